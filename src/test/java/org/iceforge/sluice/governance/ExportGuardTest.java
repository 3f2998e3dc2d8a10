package org.iceforge.sluice.governance;

import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportGuardTest {

    @TempDir
    Path dir;

    private DatabaseProperties.DatabaseConfig database(Path file, boolean immutable) {
        DatabaseProperties.DatabaseConfig cfg = new DatabaseProperties.DatabaseConfig();
        cfg.setFile(file == null ? null : file.toString());
        cfg.setImmutable(immutable);
        return cfg;
    }

    @Test
    void downloadsImmutableFileBackedDatabases() throws Exception {
        Path file = Files.writeString(dir.resolve("data.mv.db"), "bytes");

        assertThat(ExportGuard.checkDownload(GovernanceConfig.defaults(), "data", database(file, true))).isEqualTo(file);
    }

    @Test
    void refusesDownloadsThatAreOffMutableOrMissing() throws Exception {
        Path file = Files.writeString(dir.resolve("data.mv.db"), "bytes");
        GovernanceProperties off = new GovernanceProperties();
        off.setAllowDownload(false);

        assertThatThrownBy(() -> ExportGuard.checkDownload(off.toConfig(), "data", database(file, true)))
                .isInstanceOf(ExportDisabledException.class);
        assertThatThrownBy(() -> ExportGuard.checkDownload(GovernanceConfig.defaults(), "data", database(file, false)))
                .isInstanceOf(ExportDisabledException.class);
        assertThatThrownBy(() -> ExportGuard.checkDownload(GovernanceConfig.defaults(), "data", database(null, true)))
                .isInstanceOf(ExportDisabledException.class);
        assertThatThrownBy(() -> ExportGuard.checkDownload(GovernanceConfig.defaults(), "data",
                database(dir.resolve("gone.mv.db"), true)))
                .isInstanceOf(ExportDisabledException.class);
    }

    @Test
    void csvStreamCanBeTurnedOff() {
        GovernanceProperties off = new GovernanceProperties();
        off.setAllowCsvStream(false);

        ExportGuard.checkCsvStream(GovernanceConfig.defaults());
        assertThatThrownBy(() -> ExportGuard.checkCsvStream(off.toConfig()))
                .isInstanceOf(ExportDisabledException.class);
    }

    @Test
    void limitedStreamFailsPastTheCap() throws Exception {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        SizeLimitedOutputStream out = new SizeLimitedOutputStream(sink, 4);

        out.write(new byte[]{1, 2, 3});
        out.write(4);
        assertThat(out.written()).isEqualTo(4);
        assertThatThrownBy(() -> out.write(5)).isInstanceOf(ExportLimitExceededException.class);
        assertThat(sink.size()).isEqualTo(4);
    }

    @Test
    void zeroMegabytesMeansUnlimited() throws Exception {
        GovernanceProperties p = new GovernanceProperties();
        p.setMaxCsvMb(0);
        SizeLimitedOutputStream out = ExportGuard.limit(p.toConfig(), new ByteArrayOutputStream());

        out.write(new byte[2 * 1024 * 1024]);
        assertThat(out.written()).isEqualTo(2L * 1024 * 1024);
    }
}
