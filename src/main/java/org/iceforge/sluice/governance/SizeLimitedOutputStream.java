package org.iceforge.sluice.governance;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Counts bytes on their way out and fails once the limit is crossed.
 * A limit of 0 disables the check.
 */
public class SizeLimitedOutputStream extends FilterOutputStream {
    private final long limitBytes;
    private long written;

    public SizeLimitedOutputStream(OutputStream out, long limitBytes) {
        super(out);
        if (limitBytes < 0) throw new IllegalArgumentException("limitBytes must be >= 0");
        this.limitBytes = limitBytes;
    }

    @Override
    public void write(int b) throws IOException {
        account(1);
        out.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        account(len);
        out.write(b, off, len);
    }

    public long written() {
        return written;
    }

    private void account(int len) {
        written += len;
        if (limitBytes > 0 && written > limitBytes) {
            throw new ExportLimitExceededException(limitBytes);
        }
    }
}
