package com.questrail.meshinfo.collector;

import com.questrail.meshinfo.config.CollectorConfig;
import com.questrail.meshinfo.config.OlsrConfig;
import com.questrail.meshinfo.internal.time.MonotonicClock;
import com.questrail.meshinfo.internal.time.Sleeper;
import com.questrail.meshinfo.internal.time.WallClock;
import com.questrail.meshinfo.observability.CollectorErrorEvent;
import com.questrail.meshinfo.observability.CollectorObservabilitySink;
import com.questrail.meshinfo.observability.CollectorStateTransitionEvent;
import com.questrail.meshinfo.observability.CycleCompletedEvent;
import com.questrail.meshinfo.observability.NullObservabilitySink;
import com.questrail.meshinfo.olsr.OlsrConnectException;
import com.questrail.meshinfo.olsr.OlsrConnector;
import com.questrail.meshinfo.olsr.OlsrData;
import com.questrail.meshinfo.olsr.OlsrStreamException;
import com.questrail.meshinfo.persistence.CycleStatistics;
import com.questrail.meshinfo.persistence.MeshRepository;
import com.questrail.meshinfo.topology.NetworkInfo;
import com.questrail.meshinfo.topology.TopologyAssembler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * CollectorService
 * =============================================================================
 * The perpetual collection loop: connect to the OLSR daemon, assemble the
 * topology, reconcile it into the repository, sleep, repeat.
 *
 * <h2>States</h2>
 * <pre>
 *   IDLE → CONNECTING → POLLING → RECONCILING → SLEEPING → CONNECTING ...
 *              │                                   │
 *              ├── connect failed ──→ SLEEPING     └── run once ──→ STOPPED
 *              └── retries exhausted ──→ ABORTED
 * </pre>
 *
 * <h2>Failure handling</h2>
 * <ul>
 *   <li>A failed connection is retried after one full period. After
 *       {@code maxRetries} consecutive failures, or the first failure of a
 *       single-cycle run, the loop ends with {@link CollectorAbortedException}.</li>
 *   <li>An OLSR stream that breaks after connecting ends the cycle; the loop
 *       carries on with the next one. It does not count as a connection failure.</li>
 *   <li>A failed unit of work is rolled back and its exception propagates
 *       out of {@link #run()}.</li>
 * </ul>
 *
 * <h2>Cadence</h2>
 * After a cycle the loop sleeps {@code period - (elapsed % period)}, where
 * {@code elapsed} is measured on the {@link MonotonicClock} from the start of
 * the cycle, so cycles stay aligned to the period even when one overruns it.
 *
 * <h2>Threading</h2>
 * {@link #run()} blocks the calling thread. {@link #state()} may be read from
 * any thread.
 */
public final class CollectorService {

    private static final Logger log = LoggerFactory.getLogger(CollectorService.class);

    private final CollectorConfig config;
    private final OlsrConnector connector;
    private final TopologyAssembler assembler;
    private final TopologyReconciler reconciler;
    private final MeshRepository repository;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Sleeper sleeper;
    private final CollectorObservabilitySink observabilitySink;

    private final ConnectAttemptTracker connectAttempts = new ConnectAttemptTracker();

    private volatile CollectorState state = CollectorState.IDLE;

    public CollectorService(CollectorConfig config,
                            OlsrConnector connector,
                            TopologyAssembler assembler,
                            TopologyReconciler reconciler,
                            MeshRepository repository,
                            MonotonicClock clock,
                            WallClock wallClock,
                            Sleeper sleeper,
                            CollectorObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
        this.repository = Objects.requireNonNull(repository, "repository");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public CollectorState state() {
        return state;
    }

    /**
     * Run cycles until a single-cycle run completes or connecting keeps failing.
     *
     * @throws CollectorAbortedException    if connecting failed too many times in a row
     * @throws InterruptedException         if the thread is interrupted while waiting
     * @throws com.questrail.meshinfo.persistence.RepositoryException if a unit of work fails
     */
    public void run() throws InterruptedException {
        if (state != CollectorState.IDLE) {
            throw new IllegalStateException("Collector already ran, state " + state);
        }
        Duration period = config.period();

        while (true) {
            long cycleStart = clock.nowNanos();
            Instant startedAt = wallClock.now();

            transition(CollectorState.CONNECTING);
            OlsrData olsr = connect();
            if (olsr == null) {
                transition(CollectorState.SLEEPING);
                log.debug("Sleeping {} before reconnecting", period);
                sleeper.sleep(period);
                continue;
            }

            try {
                runCycle(olsr, cycleStart, startedAt);
            } catch (OlsrStreamException e) {
                log.error("OLSR stream failed, abandoning cycle: {}", e.toString());
                observabilitySink.onError(new CollectorErrorEvent(wallClock.now(),
                        "OLSR stream failed, abandoning cycle", e));
            }

            if (config.runOnce()) {
                transition(CollectorState.STOPPED);
                return;
            }

            long elapsed = clock.nowNanos() - cycleStart;
            long periodNanos = period.toNanos();
            Duration remaining = Duration.ofNanos(periodNanos - (elapsed % periodNanos));
            transition(CollectorState.SLEEPING);
            log.debug("Sleeping {} until querying network again", remaining);
            sleeper.sleep(remaining);
        }
    }

    /**
     * One connection attempt.
     *
     * @return the session, or {@code null} when the attempt failed and should be retried
     * @throws CollectorAbortedException when no more attempts are allowed
     */
    private OlsrData connect() {
        OlsrConfig olsr = config.olsr();
        try {
            OlsrData data = OlsrData.connect(connector, olsr.host(), olsr.port(), olsr.connectTimeout());
            connectAttempts.reset();
            return data;
        } catch (OlsrConnectException e) {
            int failures = connectAttempts.recordFailure();
            log.error("Failed to connect to OLSR daemon {}:{} (attempt {} of {}): {}",
                    olsr.host(), olsr.port(), failures, config.maxRetries(), e.getMessage());
            observabilitySink.onError(new CollectorErrorEvent(wallClock.now(),
                    "Failed to connect to OLSR daemon", e));

            if (failures >= config.maxRetries() || config.runOnce()) {
                CollectorAbortedException aborted =
                        new CollectorAbortedException(olsr.host(), olsr.port(), failures, e);
                log.error(aborted.getMessage());
                transition(CollectorState.ABORTED);
                throw aborted;
            }
            return null;
        }
    }

    private void runCycle(OlsrData olsr, long cycleStart, Instant startedAt) throws InterruptedException {
        transition(CollectorState.POLLING);
        final NetworkInfo network;
        try {
            network = assembler.assemble(olsr);
        } finally {
            olsr.close();
        }

        long polled = clock.nowNanos();
        Duration pollDuration = Duration.ofNanos(polled - cycleStart);
        log.info("Network polling took {}", format(pollDuration));

        transition(CollectorState.RECONCILING);
        Instant now = wallClock.now();
        CycleStatistics statistics = repository.inTransaction(session -> {
            Map<String, Integer> counters = new LinkedHashMap<>(network.counters());
            counters.putAll(reconciler.reconcile(session, network, now));

            CycleStatistics stats = new CycleStatistics(
                    startedAt,
                    network.nodes().size(),
                    network.links().size(),
                    network.errors().size(),
                    pollDuration,
                    Duration.ofNanos(clock.nowNanos() - cycleStart),
                    counters);
            session.appendStatistics(stats);
            return stats;
        });

        log.info("Database updates took {}", format(Duration.ofNanos(clock.nowNanos() - polled)));
        log.info("Total time: {}", format(statistics.totalDuration()));
        observabilitySink.onCycleCompleted(new CycleCompletedEvent(wallClock.now(), statistics));
    }

    private void transition(CollectorState next) {
        CollectorState previous = state;
        state = next;
        observabilitySink.onStateTransition(
                new CollectorStateTransitionEvent(wallClock.now(), previous, next));
    }

    private static String format(Duration duration) {
        double seconds = duration.toNanos() / 1e9;
        return String.format("%.2fs (%.2fm)", seconds, seconds / 60);
    }
}
