package com.questrail.meshinfo.olsr;

import java.io.Closeable;
import java.io.IOException;

/**
 * OlsrLineSource
 * -----------------------------------------------------------------------------
 * Minimal port for the line-oriented text export of an OLSR daemon.
 *
 * <p>Implementations may be backed by Netty, a plain socket, or a test script.
 * They only deliver lines; classification and deduplication happen in
 * {@link OlsrData}.</p>
 *
 * <p>Callers serialize access; implementations need not be thread-safe for
 * concurrent {@link #readLine()} calls.</p>
 */
public interface OlsrLineSource extends Closeable
{
    /**
     * Read the next line without its terminator.
     *
     * @return the next line, or {@code null} once the daemon closed the stream
     * @throws IOException on a read fault or when the daemon stalls past the read timeout
     */
    String readLine() throws IOException;

    /**
     * Release the underlying connection. Idempotent.
     */
    @Override
    void close();
}
