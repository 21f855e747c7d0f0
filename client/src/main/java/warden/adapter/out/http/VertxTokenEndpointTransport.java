package warden.adapter.out.http;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpMethod;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.model.TokenEndpointRequest;
import warden.core.model.TokenEndpointResponse;
import warden.spi.TokenEndpointTransport;

/**
 * Token endpoint transport on the Vert.x web client.
 *
 * <p>Sends the encoded body as is, or no body when it is empty, and emits
 * every received response, whatever its status. Connection failures and timeouts fail the returned {@link Uni}.
 */
public class VertxTokenEndpointTransport implements TokenEndpointTransport {

    private static final Logger LOG = Logger.getLogger(VertxTokenEndpointTransport.class);

    private final WebClient webClient;
    private final long timeoutMillis;

    public VertxTokenEndpointTransport(Vertx vertx, WardenConfig config) {
        this.webClient = WebClient.create(vertx);
        this.timeoutMillis = config.transport().timeout().toMillis();
    }

    @Override
    public Uni<TokenEndpointResponse> execute(TokenEndpointRequest request) {
        LOG.debugf("Sending %s %s", request.method(), request.url());

        var httpRequest = webClient
                .requestAbs(HttpMethod.valueOf(request.method()), request.url())
                .timeout(timeoutMillis);
        for (var header : request.headers().entrySet()) {
            httpRequest = httpRequest.putHeader(header.getKey(), header.getValue());
        }

        final var body = request.encodedBody();
        final var sent = body.isEmpty() ? httpRequest.send() : httpRequest.sendBuffer(Buffer.buffer(body));
        return sent.map(response -> new TokenEndpointResponse(response.statusCode(), response.bodyAsString()))
                .onItem()
                .invoke(response -> LOG.debugf("%s responded with HTTP %d", request.url(), response.statusCode()))
                .onFailure()
                .invoke(error -> LOG.warnf("Request to %s failed: %s", request.url(), error.getMessage()));
    }

    /**
     * Release the underlying client. The Vert.x instance is owned by the caller.
     */
    public void close() {
        webClient.close();
    }
}
