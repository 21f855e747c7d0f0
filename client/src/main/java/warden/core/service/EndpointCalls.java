package warden.core.service;

import java.time.Duration;

import org.jboss.logging.Logger;

import warden.core.model.TokenEndpointRequest;
import warden.core.model.TokenEndpointResponse;
import warden.core.model.problem.CredentialException;
import warden.core.model.problem.CredentialProblem;
import warden.spi.TokenEndpointTransport;

/**
 * Blocking calls over {@link TokenEndpointTransport}.
 */
final class EndpointCalls {

    private static final Logger LOG = Logger.getLogger(EndpointCalls.class);

    private EndpointCalls() {}

    /**
     * Execute {@code request} and wait at most {@code timeout} for the response.
     *
     * @throws CredentialException with kind {@code TRANSPORT_ERROR} when no response arrives
     */
    static TokenEndpointResponse send(TokenEndpointTransport transport, TokenEndpointRequest request, Duration timeout) {
        final TokenEndpointResponse response;
        try {
            response = transport.execute(request).await().atMost(timeout);
        } catch (CredentialException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warnf("Request to %s failed: %s", request.url(), e.getMessage());
            throw CredentialProblem.transportError(describe(e), e);
        }
        if (response == null) {
            throw CredentialProblem.transportError("no response from " + request.url(), null);
        }
        return response;
    }

    private static String describe(Throwable error) {
        final var message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
