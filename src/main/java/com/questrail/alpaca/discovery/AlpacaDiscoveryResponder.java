package com.questrail.alpaca.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.alpaca.transport.DatagramEndpoint;
import com.questrail.alpaca.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * AlpacaDiscoveryResponder
 * =============================================================================
 * Answers Alpaca discovery probes with the REST API port.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>a datagram equal to {@link AlpacaDiscovery#TOKEN} gets exactly one
 *       unicast reply to its sender, {@code {"AlpacaPort": apiPort}}</li>
 *   <li>any other datagram is dropped, logged at debug level only</li>
 *   <li>nothing is ever broadcast</li>
 * </ul>
 *
 * <p>The reply bytes are built once at construction; the hot path is a byte
 * comparison and a send.</p>
 *
 * <p>{@link #start()} returns before the socket is bound; callers that must
 * not proceed without discovery follow it with {@link #awaitBound(Duration)}.</p>
 */
public final class AlpacaDiscoveryResponder implements DatagramEndpointListener {

    private static final Logger log = LoggerFactory.getLogger(AlpacaDiscoveryResponder.class);

    private final DatagramEndpoint endpoint;
    private final int apiPort;
    private final byte[] reply;
    private final AtomicBoolean up = new AtomicBoolean(false);
    private final CountDownLatch bindOutcome = new CountDownLatch(1);
    private final AtomicReference<Throwable> bindFailure = new AtomicReference<>();

    public AlpacaDiscoveryResponder(DatagramEndpoint endpoint, int apiPort, ObjectMapper mapper) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(mapper, "mapper");
        if (apiPort <= 0 || apiPort > 65535) {
            throw new IllegalArgumentException("apiPort out of range: " + apiPort);
        }
        this.apiPort = apiPort;
        try {
            this.reply = mapper.writeValueAsBytes(new DiscoveryResponse(apiPort));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void start() {
        endpoint.setListener(this);
        endpoint.start();
    }

    /**
     * Wait for the outcome of the bind started by {@link #start()}.
     *
     * @throws IOException          if the socket failed to bind or did not bind in time
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitBound(Duration timeout) throws IOException, InterruptedException {
        Objects.requireNonNull(timeout, "timeout");
        if (!bindOutcome.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new IOException("discovery socket did not bind within " + timeout);
        }
        Throwable cause = bindFailure.get();
        if (cause != null) {
            throw new IOException("failed to start discovery service: " + cause.getMessage(), cause);
        }
        if (!up.get()) {
            throw new IOException("discovery socket closed before it was bound");
        }
    }

    public void stop() {
        endpoint.stop();
        up.set(false);
        log.info("Discovery responder stopped");
    }

    public boolean isUp() {
        return up.get();
    }

    public int apiPort() {
        return apiPort;
    }

    @Override
    public void onTransportUp() {
        up.set(true);
        bindOutcome.countDown();
        log.info("Discovery responder listening on {}, advertising API port {}",
                endpoint.localAddress().map(Object::toString).orElse("?"), apiPort);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        boolean wasUp = up.getAndSet(false);
        if (cause != null && bindOutcome.getCount() > 0) {
            bindFailure.compareAndSet(null, cause);
        }
        bindOutcome.countDown();
        if (cause != null) {
            log.error("Discovery transport failed", cause);
        } else if (wasUp) {
            log.debug("Discovery transport closed");
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        if (!AlpacaDiscovery.isProbe(payload)) {
            log.debug("Ignoring {}-byte datagram from {}: not a discovery probe", payload.length, remote);
            return;
        }
        log.debug("Discovery probe from {}", remote);
        endpoint.send(remote, reply.clone());
    }
}
