package com.grcplatform.security.key;

import com.grcplatform.security.testing.TestTokens;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HttpKeyDiscoveryClient")
class HttpKeyDiscoveryClientTest {

    private HttpServer server;
    private volatile String body;
    private volatile int status = 200;

    @BeforeEach
    void startServer() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/keys", exchange -> {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private HttpKeyDiscoveryClient client() throws Exception {
        URL url = new URL("http://127.0.0.1:" + server.getAddress().getPort() + "/keys");
        return new HttpKeyDiscoveryClient(url, Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("parses published RSA keys by kid")
    void parsesKeys() throws Exception {
        TestTokens keys = TestTokens.generate("kid-http");
        body = keys.jwksJson();

        assertThat(client().fetchKeys()).containsEntry("kid-http", keys.publicKey());
    }

    @Test
    @DisplayName("invalid JSON is DiscoveryUnavailableException")
    void invalidJson() {
        body = "<html>maintenance</html>";

        assertThatThrownBy(() -> client().fetchKeys()).isInstanceOf(DiscoveryUnavailableException.class);
    }

    @Test
    @DisplayName("server error is DiscoveryUnavailableException")
    void serverError() {
        body = "{}";
        status = 503;

        assertThatThrownBy(() -> client().fetchKeys()).isInstanceOf(DiscoveryUnavailableException.class);
    }
}
