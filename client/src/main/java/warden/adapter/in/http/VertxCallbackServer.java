package warden.adapter.in.http;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.http.HttpServer;
import io.vertx.mutiny.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import warden.config.WardenConfig;
import warden.core.model.CallbackResult;
import warden.core.model.problem.CredentialProblem;

/**
 * Loopback HTTP server that receives the authorization redirect of a
 * native app (RFC 8252, section 7.3).
 *
 * <p>Binds {@code 127.0.0.1} on the configured {@code warden.callback.port}, where
 * port 0 lets the OS pick one. Only {@value #CALLBACK_PATH} is served. The first
 * request carrying a code or an error completes the callback; later requests get
 * the same page but are otherwise ignored. The browser never sees request data
 * echoed back.
 *
 * <pre>{@code
 * try (var server = VertxCallbackServer.start(vertx, config)) {
 *     var client = new OAuthFlowClient(oauth.withRedirectUri(server.callbackUrl()), storage, transport, config);
 *     var flow = client.startAuthFlow();
 *     openBrowser(flow.url());
 *     var token = client.completeAuthorization(flow.state(), server.waitForCallback(), key);
 * }
 * }</pre>
 */
public class VertxCallbackServer implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(VertxCallbackServer.class);

    public static final String CALLBACK_PATH = "/callback";
    static final String LOOPBACK_HOST = "127.0.0.1";

    private static final Duration SERVER_OP_TIMEOUT = Duration.ofSeconds(10);

    private static final String SUCCESS_PAGE = """
            <!DOCTYPE html>
            <html><head><title>Authorization complete</title></head>
            <body><h1>Authorization complete</h1><p>You can close this window and return to the application.</p></body>
            </html>
            """;

    private static final String ERROR_PAGE = """
            <!DOCTYPE html>
            <html><head><title>Authorization failed</title></head>
            <body><h1>Authorization failed</h1><p>Return to the application for details.</p></body>
            </html>
            """;

    private final HttpServer server;
    private final Duration defaultTimeout;
    private final CompletableFuture<CallbackResult> callback = new CompletableFuture<>();

    private VertxCallbackServer(Vertx vertx, Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
        this.server = vertx.createHttpServer().requestHandler(this::handle);
    }

    /**
     * Start listening on the loopback interface.
     *
     * @throws warden.core.model.problem.CredentialException {@code TRANSPORT_ERROR} if the port cannot be bound
     */
    public static VertxCallbackServer start(Vertx vertx, WardenConfig config) {
        final var callbackServer = new VertxCallbackServer(vertx, config.callback().timeout());
        final int port = config.callback().port();
        try {
            callbackServer.server.listen(port, LOOPBACK_HOST).await().atMost(SERVER_OP_TIMEOUT);
        } catch (RuntimeException e) {
            throw CredentialProblem.transportError("Cannot listen on %s:%d".formatted(LOOPBACK_HOST, port), e);
        }
        LOG.infof("Waiting for authorization callback on %s", callbackServer.callbackUrl());
        return callbackServer;
    }

    public int port() {
        return server.actualPort();
    }

    /**
     * Redirect URI to register with the authorization request.
     */
    public String callbackUrl() {
        return "http://%s:%d%s".formatted(LOOPBACK_HOST, port(), CALLBACK_PATH);
    }

    /**
     * Block until the callback arrives or the configured {@code warden.callback.timeout} elapses.
     */
    public CallbackResult waitForCallback() {
        return waitForCallback(defaultTimeout);
    }

    /**
     * Block until the callback arrives.
     *
     * @throws warden.core.model.problem.CredentialException {@code CALLBACK_TIMEOUT} when nothing arrives in time,
     *                                                       {@code INTERRUPTED} if the thread is interrupted
     */
    public CallbackResult waitForCallback(Duration timeout) {
        try {
            return callback.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw CredentialProblem.callbackTimeout(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CredentialProblem.interrupted(e);
        } catch (ExecutionException e) {
            // only ever completed normally
            throw new IllegalStateException(e.getCause());
        }
    }

    private void handle(HttpServerRequest request) {
        if (!CALLBACK_PATH.equals(request.path())) {
            request.response().setStatusCode(404).endAndForget();
            return;
        }

        final var result = CallbackResult.fromQuery(request.query());
        final boolean success = result.isSuccess();
        request.response()
                .setStatusCode(success ? 200 : 400)
                .putHeader("Content-Type", "text/html; charset=utf-8")
                .putHeader("Cache-Control", "no-store")
                .putHeader("Connection", "close")
                .endAndForget(success ? SUCCESS_PAGE : ERROR_PAGE);

        if (!success && !result.isError()) {
            LOG.debug("Ignoring callback request without code or error");
            return;
        }
        if (callback.complete(result)) {
            LOG.debugf("Received authorization callback: %s", result);
        } else {
            LOG.debug("Ignoring repeated authorization callback");
        }
    }

    @Override
    public void close() {
        final int port = port();
        server.close().await().atMost(SERVER_OP_TIMEOUT);
        LOG.debugf("Callback server on port %d closed", port);
    }
}
