package org.iceforge.sluice.governance;

import org.iceforge.sluice.jdbc.DatabaseProperties;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Policy checks for bulk exports: raw database download and CSV streaming.
 */
public final class ExportGuard {
    private ExportGuard() {}

    /**
     * Only immutable, file-backed databases may be downloaded; a mutable file could be
     * read mid-write.
     *
     * @return the file to serve
     */
    public static Path checkDownload(GovernanceConfig config, String database, DatabaseProperties.DatabaseConfig db) {
        if (!config.allowDownload()) {
            throw new ExportDisabledException("Database download is disabled");
        }
        if (db == null || !db.isImmutable() || db.getFile() == null || db.getFile().isBlank()) {
            throw new ExportDisabledException("Database " + database + " cannot be downloaded");
        }
        Path file = Path.of(db.getFile());
        if (!Files.isRegularFile(file)) {
            throw new ExportDisabledException("Database file for " + database + " is missing");
        }
        return file;
    }

    public static void checkCsvStream(GovernanceConfig config) {
        if (!config.allowCsvStream()) {
            throw new ExportDisabledException("CSV streaming is disabled");
        }
    }

    /** Wrap a CSV sink so it stops at {@code max_csv_mb}. */
    public static SizeLimitedOutputStream limit(GovernanceConfig config, OutputStream out) {
        return new SizeLimitedOutputStream(out, config.maxCsvMb() * 1024L * 1024L);
    }
}
