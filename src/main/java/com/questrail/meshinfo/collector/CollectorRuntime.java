package com.questrail.meshinfo.collector;

import com.questrail.meshinfo.config.CollectorConfig;
import com.questrail.meshinfo.internal.time.MonotonicClock;
import com.questrail.meshinfo.internal.time.Sleeper;
import com.questrail.meshinfo.internal.time.SystemMonotonicClock;
import com.questrail.meshinfo.internal.time.SystemWallClock;
import com.questrail.meshinfo.internal.time.ThreadSleeper;
import com.questrail.meshinfo.internal.time.WallClock;
import com.questrail.meshinfo.observability.CollectorObservabilitySink;
import com.questrail.meshinfo.observability.Slf4jCollectorObservabilitySink;
import com.questrail.meshinfo.olsr.OlsrConnector;
import com.questrail.meshinfo.olsr.netty.NettyOlsrConnector;
import com.questrail.meshinfo.persistence.InMemoryMeshRepository;
import com.questrail.meshinfo.persistence.MeshRepository;
import com.questrail.meshinfo.poller.NameResolver;
import com.questrail.meshinfo.poller.NodePoller;
import com.questrail.meshinfo.poller.ReverseDnsNameResolver;
import com.questrail.meshinfo.poller.StatusClientFactory;
import com.questrail.meshinfo.poller.netty.NettyStatusClientFactory;
import com.questrail.meshinfo.poller.sysinfo.SystemInfoParser;
import com.questrail.meshinfo.topology.TopologyAssembler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CollectorRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the collector.
 *
 * <p>Production wiring uses Netty for both the OLSR connection and the node
 * status requests, reverse DNS for naming unreachable nodes and SLF4J for
 * observability. Every collaborator can be replaced through the builder.</p>
 *
 * <pre>
 *   runtime.run()    → runs the loop on the calling thread
 *   runtime.start()  → runs the loop on a dedicated thread
 *   runtime.stop()   → interrupts that thread and waits for it
 * </pre>
 */
public final class CollectorRuntime {
    private static final Logger log = LoggerFactory.getLogger(CollectorRuntime.class);

    private final CollectorService service;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile Thread loopThread;
    private volatile Throwable failure;

    private CollectorRuntime(CollectorService service) {
        this.service = service;
    }

    /**
     * Run the loop on the calling thread.
     *
     * @throws CollectorAbortedException if connecting to the OLSR daemon kept failing
     * @throws InterruptedException      if the calling thread is interrupted
     */
    public void run() throws InterruptedException {
        service.run();
    }

    /**
     * Run the loop on a dedicated thread. Idempotent.
     */
    public void start() {
        if (started.compareAndSet(false, true)) {
            loopThread = new Thread(this::runLoop, "meshinfo-collector");
            loopThread.start();
        }
    }

    /**
     * Interrupt the loop thread and wait up to five seconds for it to end.
     */
    public void stop() {
        Thread thread = loopThread;
        if (thread == null) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public CollectorState state() {
        return service.state();
    }

    /** What ended the loop thread abnormally, or {@code null}. */
    public Throwable failure() {
        return failure;
    }

    private void runLoop() {
        try {
            service.run();
        } catch (InterruptedException e) {
            log.info("Collector interrupted in state {}", service.state());
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            failure = e;
            log.error("Collector stopped: {}", e.getMessage(), e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CollectorConfig config = CollectorConfig.defaults();
        private MeshRepository repository;
        private CollectorObservabilitySink observabilitySink = new Slf4jCollectorObservabilitySink();
        private NameResolver nameResolver = new ReverseDnsNameResolver();
        private OlsrConnector olsrConnector;
        private StatusClientFactory statusClientFactory;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private Sleeper sleeper = ThreadSleeper.INSTANCE;

        public Builder withConfig(CollectorConfig config) {
            this.config = config;
            return this;
        }

        public Builder withRepository(MeshRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder withObservabilitySink(CollectorObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withNameResolver(NameResolver resolver) {
            this.nameResolver = resolver;
            return this;
        }

        public Builder withOlsrConnector(OlsrConnector connector) {
            this.olsrConnector = connector;
            return this;
        }

        public Builder withStatusClientFactory(StatusClientFactory factory) {
            this.statusClientFactory = factory;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withSleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public CollectorRuntime build() {
            Objects.requireNonNull(config, "config");

            // 1. Transports
            OlsrConnector connector = olsrConnector != null
                    ? olsrConnector
                    : new NettyOlsrConnector(config.olsr().readTimeout());
            StatusClientFactory clients = statusClientFactory != null
                    ? statusClientFactory
                    : new NettyStatusClientFactory(config.poller().connectTimeout(), config.poller().readTimeout());

            // 2. Polling and merging
            NodePoller poller = new NodePoller(clients, nameResolver, new SystemInfoParser(),
                    config.poller().maxConnections());
            TopologyAssembler assembler = new TopologyAssembler(poller);

            // 3. Persistence
            TopologyReconciler reconciler = new TopologyReconciler(config.nodeInactive(), config.linkInactive());
            MeshRepository store = repository != null ? repository : new InMemoryMeshRepository();

            // 4. Loop
            CollectorService service = new CollectorService(
                config,
                connector,
                assembler,
                reconciler,
                store,
                clock,
                wallClock,
                sleeper,
                observabilitySink
            );
            return new CollectorRuntime(service);
        }
    }
}
