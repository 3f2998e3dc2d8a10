package org.iceforge.sluice.cache;

import org.iceforge.sluice.jdbc.DatabaseProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;

/**
 * SHA-256 of the database file, streamed. Only immutable, file-backed databases are hashed:
 * a mutable database's hash would be stale the moment it was computed.
 */
public class FileContentHasher implements ContentHasher {
    private static final Logger log = LoggerFactory.getLogger(FileContentHasher.class);

    private static final int BUFFER_SIZE = 64 * 1024;

    @Override
    public Optional<String> hash(String database, DatabaseProperties.DatabaseConfig cfg) throws IOException {
        if (cfg == null || !cfg.isImmutable() || cfg.getFile() == null || cfg.getFile().isBlank()) {
            return Optional.empty();
        }
        Path file = Path.of(cfg.getFile());
        long t0 = System.nanoTime();
        MessageDigest md = sha256();
        byte[] buf = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buf)) != -1) {
                md.update(buf, 0, n);
            }
        }
        String hex = toHex(md.digest());
        log.info("Hashed database={} file={} in {}ms", database, file, (System.nanoTime() - t0) / 1_000_000L);
        return Optional.of(hex);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static String toHex(byte[] dig) {
        StringBuilder sb = new StringBuilder(dig.length * 2);
        for (byte b : dig) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}
