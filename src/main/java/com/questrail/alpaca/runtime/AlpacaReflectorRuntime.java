package com.questrail.alpaca.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.alpaca.api.AlpacaJson;
import com.questrail.alpaca.backend.BackendDispatcher;
import com.questrail.alpaca.backend.bus.MessageBus;
import com.questrail.alpaca.config.ReflectorConfig;
import com.questrail.alpaca.config.ServerSettings;
import com.questrail.alpaca.discovery.AlpacaDiscoveryResponder;
import com.questrail.alpaca.discovery.AlpacaDiscoveryScanner;
import com.questrail.alpaca.engine.DevicePoolEngine;
import com.questrail.alpaca.engine.client.AlpacaRestClient;
import com.questrail.alpaca.engine.observability.DevicePoolObservabilitySink;
import com.questrail.alpaca.engine.observability.Slf4jDevicePoolObservabilitySink;
import com.questrail.alpaca.registry.VirtualDeviceRegistry;
import com.questrail.alpaca.server.AlpacaResponses;
import com.questrail.alpaca.server.DeviceApi;
import com.questrail.alpaca.server.ManagementApi;
import com.questrail.alpaca.server.RequestHandler;
import com.questrail.alpaca.server.Router;
import com.questrail.alpaca.server.ServerTransactionCounter;
import com.questrail.alpaca.server.middleware.MiddlewareChain;
import com.questrail.alpaca.server.netty.NettyAlpacaHttpServer;
import com.questrail.alpaca.time.MonotonicClock;
import com.questrail.alpaca.time.MonotonicScheduler;
import com.questrail.alpaca.time.ScheduledExecutorScheduler;
import com.questrail.alpaca.time.SystemMonotonicClock;
import com.questrail.alpaca.time.SystemWallClock;
import com.questrail.alpaca.time.WallClock;
import com.questrail.alpaca.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * AlpacaReflectorRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a running reflector.
 *
 * <h2>What it wires</h2>
 * <ul>
 *   <li>virtual device registry and backend dispatcher from the configuration</li>
 *   <li>router with the management and device APIs behind the standard
 *       middleware chain, served by Netty over HTTP or HTTPS</li>
 *   <li>UDP discovery responder advertising the API port</li>
 *   <li>a {@link DevicePoolEngine} for client-side management of remote
 *       Alpaca devices, with its health ticker on the scheduler thread</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} brings up HTTP first so discovery never advertises a port
 * that is not listening. {@link #stop()} tears down in reverse order.
 */
public final class AlpacaReflectorRuntime {

    private static final Logger log = LoggerFactory.getLogger(AlpacaReflectorRuntime.class);

    static final Duration DISCOVERY_BIND_TIMEOUT = Duration.ofSeconds(2);

    private final ReflectorConfig config;
    private final VirtualDeviceRegistry registry;
    private final BackendDispatcher dispatcher;
    private final NettyAlpacaHttpServer httpServer;
    private final NettyUdpDatagramEndpoint discoveryEndpoint;
    private final ObjectMapper mapper;
    private final DevicePoolEngine devicePool;
    private final ScheduledExecutorService schedulerExecutor;
    private final MessageBus messageBus;

    private volatile AlpacaDiscoveryResponder discoveryResponder;

    private AlpacaReflectorRuntime(ReflectorConfig config,
                                   VirtualDeviceRegistry registry,
                                   BackendDispatcher dispatcher,
                                   NettyAlpacaHttpServer httpServer,
                                   NettyUdpDatagramEndpoint discoveryEndpoint,
                                   ObjectMapper mapper,
                                   DevicePoolEngine devicePool,
                                   ScheduledExecutorService schedulerExecutor,
                                   MessageBus messageBus) {
        this.config = config;
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.httpServer = httpServer;
        this.discoveryEndpoint = discoveryEndpoint;
        this.mapper = mapper;
        this.devicePool = devicePool;
        this.schedulerExecutor = schedulerExecutor;
        this.messageBus = messageBus;
    }

    /**
     * @throws IOException if the HTTP listener or the discovery socket cannot
     *                     be bound; whatever was already started is stopped
     */
    public void start() throws IOException {
        if (messageBus != null) {
            messageBus.connect();
        }
        httpServer.start();
        // Advertise the bound port; the configured one may be 0.
        AlpacaDiscoveryResponder responder =
                new AlpacaDiscoveryResponder(discoveryEndpoint, httpServer.localAddress().getPort(), mapper);
        responder.start();
        try {
            responder.awaitBound(DISCOVERY_BIND_TIMEOUT);
        } catch (IOException e) {
            abortStart(responder);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abortStart(responder);
            throw new InterruptedIOException("interrupted while binding discovery on UDP "
                    + config.server().discoveryPort());
        }
        discoveryResponder = responder;
        devicePool.start();
        log.info("Alpaca reflector '{}' started: {} devices, API on {}, discovery on UDP {}",
                config.server().serverName(), registry.size(), httpServer.localAddress(),
                config.server().discoveryPort());
    }

    private void abortStart(AlpacaDiscoveryResponder responder) {
        log.error("Discovery on UDP {} did not start; stopping the HTTP server", config.server().discoveryPort());
        responder.stop();
        httpServer.stop();
        if (messageBus != null) {
            messageBus.disconnect();
        }
    }

    public void stop() {
        devicePool.stop();
        AlpacaDiscoveryResponder responder = discoveryResponder;
        if (responder != null) {
            responder.stop();
        }
        httpServer.stop();
        dispatcher.disconnectAll();
        if (messageBus != null) {
            messageBus.disconnect();
        }

        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Alpaca reflector stopped");
    }

    public ReflectorConfig config() {
        return config;
    }

    public VirtualDeviceRegistry registry() {
        return registry;
    }

    public BackendDispatcher dispatcher() {
        return dispatcher;
    }

    public DevicePoolEngine devicePool() {
        return devicePool;
    }

    /** Bound HTTP address, or {@code null} before {@link #start()}. */
    public InetSocketAddress httpAddress() {
        return httpServer.localAddress();
    }

    /** Responder started by {@link #start()}, or {@code null} before. */
    public AlpacaDiscoveryResponder discoveryResponder() {
        return discoveryResponder;
    }

    /** Bound discovery address, or {@code null} when not bound. */
    public InetSocketAddress discoveryAddress() {
        return discoveryEndpoint.localAddress().orElse(null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ReflectorConfig config;
        private MessageBus messageBus;
        private HttpClient httpClient;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private DevicePoolObservabilitySink devicePoolSink = new Slf4jDevicePoolObservabilitySink();
        private Duration healthCheckInterval = DevicePoolEngine.DEFAULT_HEALTH_CHECK_INTERVAL;
        private int handlerThreads = 16;

        /** Must be a validated configuration. */
        public Builder withConfig(ReflectorConfig config) {
            this.config = config;
            return this;
        }

        /** Required only when a device uses the mqtt backend. */
        public Builder withMessageBus(MessageBus messageBus) {
            this.messageBus = messageBus;
            return this;
        }

        public Builder withHttpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
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

        public Builder withDevicePoolObservabilitySink(DevicePoolObservabilitySink sink) {
            this.devicePoolSink = sink;
            return this;
        }

        public Builder withHealthCheckInterval(Duration interval) {
            this.healthCheckInterval = interval;
            return this;
        }

        public Builder withHandlerThreads(int threads) {
            this.handlerThreads = threads;
            return this;
        }

        public AlpacaReflectorRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(devicePoolSink, "devicePoolSink");

            ServerSettings server = config.server();
            ObjectMapper mapper = AlpacaJson.newMapper();
            HttpClient http = httpClient != null
                    ? httpClient
                    : HttpClient.newBuilder()
                            .connectTimeout(config.backend().network().defaultTimeout())
                            .build();

            // 1. Devices and their backends
            VirtualDeviceRegistry registry = VirtualDeviceRegistry.fromConfig(config, wallClock);
            BackendDispatcher dispatcher = BackendDispatcher.create(registry, http, messageBus, mapper, clock, wallClock);

            // 2. Routes and middleware
            AlpacaResponses responses = new AlpacaResponses(mapper);
            Router router = new Router(responses);
            new ManagementApi(server, registry, responses).registerRoutes(router);
            new DeviceApi(registry, dispatcher, responses, wallClock).registerRoutes(router);
            RequestHandler handler = MiddlewareChain.compose(
                    MiddlewareChain.standardStages(config.cors(), config.authentication(),
                            new ServerTransactionCounter(), responses, clock),
                    router);

            // 3. HTTP transport
            NettyAlpacaHttpServer httpServer = new NettyAlpacaHttpServer(
                    server.listenSocketAddress(),
                    handler,
                    new NettyAlpacaHttpServer.Options(server.readTimeout(), server.writeTimeout(),
                            server.idleTimeout(), server.shutdownTimeout(), handlerThreads),
                    config.tls());

            // 4. Discovery
            NettyUdpDatagramEndpoint discoveryEndpoint =
                    new NettyUdpDatagramEndpoint(new InetSocketAddress(server.discoveryPort()));

            // 5. Client-side device pool
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "alpaca-health-scheduler");
                t.setDaemon(true);
                return t;
            });
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            AlpacaDiscoveryScanner scanner = new AlpacaDiscoveryScanner(
                    () -> new NettyUdpDatagramEndpoint(new InetSocketAddress(0), true,
                            NettyUdpDatagramEndpoint.DEFAULT_SHUTDOWN_BOUND),
                    broadcastAddress(),
                    mapper);
            DevicePoolEngine devicePool = DevicePoolEngine.builder()
                    .withClient(new AlpacaRestClient(http, mapper))
                    .withScanner(scanner)
                    .withClock(clock)
                    .withWallClock(wallClock)
                    .withScheduler(scheduler)
                    .withObservabilitySink(devicePoolSink)
                    .withHealthCheckInterval(healthCheckInterval)
                    .build();

            return new AlpacaReflectorRuntime(config, registry, dispatcher, httpServer, discoveryEndpoint,
                    mapper, devicePool, schedulerExec, messageBus);
        }

        private static InetAddress broadcastAddress() {
            try {
                return InetAddress.getByName("255.255.255.255");
            } catch (IOException e) {
                throw new IllegalStateException("cannot resolve the limited broadcast address", e);
            }
        }
    }
}
