package com.questrail.meshinfo.olsr;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.HashSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OlsrData
 * =============================================================================
 * One OLSR stream session exposed as two independent lazy sequences: node
 * addresses ({@link #nodes()}) and links ({@link #links()}).
 *
 * <h2>Coordination</h2>
 * Both views share a single {@link OlsrLineSource}. Each view owns a local
 * buffer. A view whose buffer is empty enters the session's critical section
 * and pulls one line at a time, routing whatever the line yields into the
 * matching buffers, until its own buffer has an element or the stream ends.
 * Only one view advances the source at a time; the other view waits on the
 * lock instead of reading the connection itself.
 *
 * <h2>Classification</h2>
 * Every line is tested against two independent patterns:
 * <pre>
 *   "10.32.66.190" -&gt; "10.80.213.95"[label="1.000"];
 * </pre>
 * The node pattern only needs the {@code "<ip>" -> "<digit>} prefix; the link
 * pattern needs two mesh ({@code 10.x}) addresses and a label. Routing summary
 * (HNA) records carry a CIDR destination and never match the link pattern.
 *
 * <h2>Termination</h2>
 * A {@code null} line marks the end of the stream: the session is finished,
 * the source is closed and both views end after draining their buffers. A
 * read fault also finishes the session, but views then fail with
 * {@link OlsrStreamException} once their buffers are drained.
 *
 * <p>Each view expects a single consumer thread.</p>
 */
public final class OlsrData
{
    private static final Logger log = LoggerFactory.getLogger(OlsrData.class);

    static final Pattern NODE_PATTERN =
            Pattern.compile("^\"(\\d{2}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})\" -> \"\\d+");
    static final Pattern LINK_PATTERN = Pattern.compile(
            "^\"(10\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})\" -> "
                    + "\"(10\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})\"\\[label=\"(.+?)\"\\];");

    private final OlsrLineSource source;
    private final ReentrantLock lock = new ReentrantLock();

    private final View<String> nodes = new View<>();
    private final View<OlsrLink> links = new View<>();

    // guarded by lock
    private final Set<String> nodesSeen = new HashSet<>();
    private final Set<LinkKey> linksSeen = new HashSet<>();
    private int linesProcessed;
    private int nodesReturned;
    private int duplicateNodes;
    private int linksReturned;
    private int duplicateLinks;
    private int invalidLinks;

    private volatile boolean finished;
    private volatile IOException failure;

    public OlsrData(OlsrLineSource source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Connect to an OLSR daemon and wrap the connection in a new session.
     *
     * @throws OlsrConnectException if the connection cannot be established
     */
    public static OlsrData connect(OlsrConnector connector, String host, int port, Duration timeout)
            throws OlsrConnectException
    {
        log.trace("Connecting to OLSR daemon {}:{}", host, port);
        return new OlsrData(connector.connect(host, port, timeout));
    }

    /** Unique node addresses in stream order. */
    public Iterator<String> nodes() {
        return nodes;
    }

    /** Unique links, by (source, destination), in stream order. */
    public Iterator<OlsrLink> links() {
        return links;
    }

    public boolean isFinished() {
        return finished;
    }

    public OlsrStatistics statistics() {
        lock.lock();
        try {
            return new OlsrStatistics(linesProcessed, nodesReturned, duplicateNodes,
                    linksReturned, duplicateLinks, invalidLinks);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finish the session early and release the connection. Idempotent.
     */
    public void close() {
        lock.lock();
        try {
            if (!finished) {
                finished = true;
                source.close();
            }
        } finally {
            lock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Shared read loop
    // -------------------------------------------------------------------------

    /**
     * Read and route one line. Caller must hold {@link #lock}.
     */
    private void populateQueues() {
        if (finished) {
            return;
        }

        final String line;
        try {
            line = source.readLine();
        } catch (IOException e) {
            log.error("OLSR stream failed after {} lines: {}", linesProcessed, e.toString());
            failure = e;
            finished = true;
            source.close();
            return;
        }

        if (line == null) {
            finished = true;
            source.close();
            logSummary();
            return;
        }

        linesProcessed++;
        String text = line.stripTrailing();
        log.trace("OLSR data: {}", text);

        String address = nodeAddress(text);
        if (address != null) {
            nodes.buffer.add(address);
        }
        OlsrLink link = link(text);
        if (link != null) {
            links.buffer.add(link);
        }
    }

    private String nodeAddress(String line) {
        Matcher m = NODE_PATTERN.matcher(line);
        if (!m.lookingAt()) {
            return null;
        }
        String address = m.group(1);
        if (!nodesSeen.add(address)) {
            duplicateNodes++;
            return null;
        }
        nodesReturned++;
        return address;
    }

    private OlsrLink link(String line) {
        Matcher m = LINK_PATTERN.matcher(line);
        if (!m.lookingAt()) {
            return null;
        }
        LinkKey key = new LinkKey(m.group(1), m.group(2));
        if (linksSeen.contains(key)) {
            duplicateLinks++;
            return null;
        }

        final OlsrLink link;
        try {
            link = OlsrLink.fromStrings(key.source(), key.destination(), m.group(3));
        } catch (NumberFormatException e) {
            log.warn("Ignoring OLSR link with unparseable cost: {}", line);
            invalidLinks++;
            return null;
        }
        linksSeen.add(key);
        linksReturned++;
        return link;
    }

    private void logSummary() {
        log.info("OLSR Data Statistics: {}", statistics().asMap());
        if (nodesReturned == 0) {
            log.warn("Failed to find any nodes in {} lines of OLSR data.", linesProcessed);
        }
        if (linksReturned == 0) {
            log.warn("Failed to find any links in {} lines of OLSR data.", linesProcessed);
        }
    }

    private record LinkKey(String source, String destination) {}

    /**
     * One consumer view over the shared stream.
     */
    private final class View<E> implements Iterator<E>
    {
        private final Queue<E> buffer = new ConcurrentLinkedQueue<>();
        private E pending;

        @Override
        public boolean hasNext() {
            if (pending == null) {
                pending = advance();
            }
            return pending != null;
        }

        @Override
        public E next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            E next = pending;
            pending = null;
            return next;
        }

        private E advance() {
            E next = buffer.poll();
            if (next != null) {
                return next;
            }

            lock.lock();
            try {
                while ((next = buffer.poll()) == null && !finished) {
                    populateQueues();
                }
            } finally {
                lock.unlock();
            }

            if (next == null && failure != null) {
                throw new OlsrStreamException("OLSR stream ended abnormally", failure);
            }
            return next;
        }
    }
}
