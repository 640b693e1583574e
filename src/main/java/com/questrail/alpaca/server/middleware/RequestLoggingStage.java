package com.questrail.alpaca.server.middleware;

import com.questrail.alpaca.server.AlpacaRequest;
import com.questrail.alpaca.server.AlpacaResponse;
import com.questrail.alpaca.server.RequestHandler;
import com.questrail.alpaca.server.RequestStage;
import com.questrail.alpaca.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Logs each request on entry and its outcome on exit: {@code error} for 5xx,
 * {@code warn} for 4xx, {@code debug} otherwise.
 */
public final class RequestLoggingStage implements RequestStage {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingStage.class);

    private final MonotonicClock clock;

    public RequestLoggingStage(MonotonicClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public AlpacaResponse apply(AlpacaRequest request, RequestHandler next) {
        log.debug("Incoming request: method={} path={} query={} client={}",
                request.method(), request.path(), request.rawQuery(), request.remoteAddress());

        long start = clock.nowNanos();
        AlpacaResponse response = next.handle(request);
        Duration duration = Duration.ofNanos(clock.nowNanos() - start);

        int status = response.status();
        if (status >= 500) {
            log.error("Request failed: method={} path={} status={} duration={} body={}",
                    request.method(), request.path(), status, duration, response.bodyAsString());
        } else if (status >= 400) {
            log.warn("Request returned client error: method={} path={} status={} duration={}",
                    request.method(), request.path(), status, duration);
        } else {
            log.debug("Request completed: method={} path={} status={} duration={}",
                    request.method(), request.path(), status, duration);
        }
        return response;
    }
}
