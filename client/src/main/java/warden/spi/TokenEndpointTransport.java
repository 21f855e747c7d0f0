package warden.spi;

import io.smallrye.mutiny.Uni;

import warden.core.model.TokenEndpointRequest;
import warden.core.model.TokenEndpointResponse;

/**
 * Service Provider Interface for delivering requests to OAuth endpoints.
 *
 * <p>Implementations perform the HTTP round trip only. They must emit any
 * received response, including non-2xx statuses, as a
 * {@link TokenEndpointResponse}; a failed {@link Uni} means the endpoint could
 * not be reached. Interpreting the body is the caller's job.
 *
 * <p>Implementations must be safe for concurrent use.
 */
public interface TokenEndpointTransport {

    /**
     * Send a request to an OAuth endpoint.
     *
     * @param request method, URL, form parameters and headers
     * @return Uni emitting the status and raw body
     */
    Uni<TokenEndpointResponse> execute(TokenEndpointRequest request);
}
