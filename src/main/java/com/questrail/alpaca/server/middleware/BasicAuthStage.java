package com.questrail.alpaca.server.middleware;

import com.questrail.alpaca.api.AlpacaErrorCode;
import com.questrail.alpaca.config.AuthenticationSettings;
import com.questrail.alpaca.server.AlpacaRequest;
import com.questrail.alpaca.server.AlpacaResponse;
import com.questrail.alpaca.server.AlpacaResponses;
import com.questrail.alpaca.server.RequestHandler;
import com.questrail.alpaca.server.RequestStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Objects;

/**
 * HTTP Basic authentication against a single configured account.
 *
 * <p>Missing, malformed or wrong credentials yield 401 with a
 * {@code WWW-Authenticate} challenge and an unspecified-error envelope. The
 * downstream handler is not invoked in that case.</p>
 */
public final class BasicAuthStage implements RequestStage {

    private static final Logger log = LoggerFactory.getLogger(BasicAuthStage.class);

    private static final String PREFIX = "Basic ";

    private final AuthenticationSettings settings;
    private final AlpacaResponses responses;
    private final byte[] expectedUser;
    private final byte[] expectedPassword;

    public BasicAuthStage(AuthenticationSettings settings, AlpacaResponses responses) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.responses = Objects.requireNonNull(responses, "responses");
        this.expectedUser = bytes(settings.username());
        this.expectedPassword = bytes(settings.password());
    }

    @Override
    public AlpacaResponse apply(AlpacaRequest request, RequestHandler next) {
        if (authenticated(request.header("Authorization"))) {
            return next.handle(request);
        }
        log.debug("Rejected credentials from {} for {}", request.remoteAddress(), request.path());
        return responses.error(401, request, AlpacaErrorCode.UNSPECIFIED, "Authentication required")
                .withHeader("WWW-Authenticate", "Basic realm=\"" + settings.realm() + "\"");
    }

    boolean authenticated(String authorization) {
        if (authorization == null || authorization.length() < PREFIX.length()
                || !authorization.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return false;
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(authorization.substring(PREFIX.length()).trim()),
                    StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return false;
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return false;
        }
        boolean userOk = MessageDigest.isEqual(expectedUser, bytes(decoded.substring(0, colon)));
        boolean passwordOk = MessageDigest.isEqual(expectedPassword, bytes(decoded.substring(colon + 1)));
        return userOk & passwordOk;
    }

    private static byte[] bytes(String s) {
        return (s == null ? "" : s).getBytes(StandardCharsets.UTF_8);
    }
}
