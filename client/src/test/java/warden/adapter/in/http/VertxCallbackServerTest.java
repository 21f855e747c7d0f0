package warden.adapter.in.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;

import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import warden.adapter.out.storage.memory.InMemoryCredentialStorage;
import warden.config.TestWardenConfig;
import warden.core.model.OAuthConfig;
import warden.core.model.problem.CredentialException;
import warden.core.model.problem.CredentialException.Kind;
import warden.core.service.OAuthFlowClient;
import warden.core.service.StubTokenEndpoint;

@DisplayName("VertxCallbackServer")
class VertxCallbackServerTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    private Vertx vertx;
    private WebClient browser;
    private TestWardenConfig config;
    private VertxCallbackServer server;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        browser = WebClient.create(vertx);
        config = new TestWardenConfig();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
        browser.close();
        vertx.close().await().indefinitely();
    }

    private HttpResponse<Buffer> visit(String url) {
        return browser.getAbs(url).send().await().atMost(WAIT);
    }

    @Nested
    @DisplayName("start()")
    class Start {

        @Test
        @DisplayName("should bind an ephemeral loopback port when configured with port 0")
        void bindsEphemeralPort() {
            server = VertxCallbackServer.start(vertx, config);

            assertTrue(server.port() > 0);
            assertEquals("http://127.0.0.1:" + server.port() + "/callback", server.callbackUrl());
        }

        @Test
        @DisplayName("should report a transport error when the port is taken")
        void portInUse() throws Exception {
            try (var occupied = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
                config.callbackPort(occupied.getLocalPort());

                final var ex = assertThrows(CredentialException.class, () -> VertxCallbackServer.start(vertx, config));

                assertEquals(Kind.TRANSPORT_ERROR, ex.kind());
            }
        }
    }

    @Nested
    @DisplayName("Callback requests")
    class CallbackRequests {

        @BeforeEach
        void startServer() {
            server = VertxCallbackServer.start(vertx, config);
        }

        @Test
        @DisplayName("should capture the code and state of a successful redirect")
        void success() {
            final var response = visit(server.callbackUrl() + "?code=abc%2F123&state=xyz");

            assertEquals(200, response.statusCode());
            assertTrue(response.getHeader("Content-Type").startsWith("text/html"));
            final var result = server.waitForCallback(WAIT);
            assertTrue(result.isSuccess());
            assertEquals("abc/123", result.code());
            assertEquals("xyz", result.state());
        }

        @Test
        @DisplayName("should capture an error redirect without echoing it to the browser")
        void error() {
            final var response =
                    visit(server.callbackUrl() + "?error=access_denied&error_description=User%20denied&state=xyz");

            assertEquals(400, response.statusCode());
            assertFalse(response.bodyAsString().contains("access_denied"));
            final var result = server.waitForCallback(WAIT);
            assertTrue(result.isError());
            assertEquals("access_denied", result.error());
            assertEquals("User denied", result.errorDescription());
            assertNull(result.code());
        }

        @Test
        @DisplayName("should keep the first callback and ignore later ones")
        void firstCallbackWins() {
            visit(server.callbackUrl() + "?code=first&state=s");
            visit(server.callbackUrl() + "?code=second&state=s");

            assertEquals("first", server.waitForCallback(WAIT).code());
        }

        @Test
        @DisplayName("should not complete on a request with neither code nor error")
        void ignoresEmptyCallback() {
            assertEquals(400, visit(server.callbackUrl()).statusCode());

            final var ex = assertThrows(CredentialException.class, () -> server.waitForCallback(Duration.ofMillis(100)));
            assertEquals(Kind.CALLBACK_TIMEOUT, ex.kind());
        }

        @Test
        @DisplayName("should answer 404 on other paths")
        void otherPath() {
            assertEquals(404, visit("http://127.0.0.1:" + server.port() + "/favicon.ico").statusCode());

            assertThrows(CredentialException.class, () -> server.waitForCallback(Duration.ofMillis(100)));
        }
    }

    @Nested
    @DisplayName("waitForCallback()")
    class WaitForCallback {

        @Test
        @DisplayName("should time out after the configured callback timeout")
        void configuredTimeout() {
            config.callbackTimeout(Duration.ofMillis(150));
            server = VertxCallbackServer.start(vertx, config);

            final var ex = assertThrows(CredentialException.class, server::waitForCallback);

            assertEquals(Kind.CALLBACK_TIMEOUT, ex.kind());
        }
    }

    @Test
    @DisplayName("should complete an authorization-code flow end to end")
    void completesAuthorization() {
        server = VertxCallbackServer.start(vertx, config);
        final var endpoint = new StubTokenEndpoint(request -> StubTokenEndpoint.ok(
                "{\"access_token\":\"at-1\",\"refresh_token\":\"rt-1\",\"token_type\":\"Bearer\",\"expires_in\":3600}"));
        final var oauth = OAuthConfig.of(
                "my-client",
                "https://auth.example.com/authorize",
                "https://auth.example.com/token",
                server.callbackUrl(),
                null);
        final var storage = new InMemoryCredentialStorage();
        final var client = new OAuthFlowClient(oauth, storage, endpoint, config);

        final var flow = client.startAuthFlow();
        assertTrue(flow.url().contains("redirect_uri=http%3A%2F%2F127.0.0.1%3A" + server.port()));
        visit(server.callbackUrl() + "?code=the-code&state=" + flow.state());
        final var token = client.completeAuthorization(flow.state(), server.waitForCallback(), "github");

        assertEquals("at-1", token.accessToken());
        assertEquals("the-code", endpoint.lastRequest().form().get("code"));
        assertEquals(server.callbackUrl(), endpoint.lastRequest().form().get("redirect_uri"));
        assertTrue(storage.getToken("github").isPresent());
    }
}
