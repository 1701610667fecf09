package io.memlite.server;

import io.memlite.storage.DurableMemoryStore;
import io.memlite.storage.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks for WebServer validation and error semantics.
 *
 * Focus:
 *  - Invalid JSON -> 400 "invalid JSON".
 *  - Too-large body -> 413 "request body too large".
 *  - ValidationException from the service -> 400.
 *  - Unknown id -> 404, unknown route -> 404, wrong method -> 405.
 *  - Sync endpoint without a hub -> 501.
 */
class WebServerValidationTest {

    private static final int PORT = 18080; // test-only port

    @TempDir Path dir;
    private DurableMemoryStore store;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        store = DurableMemoryStore.open(dir, 10_000);
        server = new WebServer(PORT, new MemoryService(store, "test-replica"));
        server.start();
        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) server.stop();
        if (store != null) store.close();
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        var builder = HttpRequest.newBuilder().uri(URI.create("http://localhost:" + PORT + path));
        if (body == null) builder.method(method, HttpRequest.BodyPublishers.noBody());
        else builder.method(method, HttpRequest.BodyPublishers.ofString(body)).header("Content-Type", "application/json");
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void invalid_json_returns_400_for_learn() throws Exception {
        var resp = send("POST", "/memories", "{ invalid-json");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        String big = "x".repeat(11 * 1024 * 1024);
        var resp = send("POST", "/memories", big);
        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }

    @Test
    void blank_content_returns_400() throws Exception {
        var resp = send("POST", "/memories", "{\"content\": \"  \"}");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("content must not be blank"));
    }

    @Test
    void out_of_range_importance_returns_400() throws Exception {
        var resp = send("POST", "/memories", "{\"content\": \"x\", \"importance\": 1.5}");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("importance"));
        assertEquals(0, store.count());
    }

    @Test
    void unknown_memory_type_returns_400() throws Exception {
        var resp = send("POST", "/memories", "{\"content\": \"x\", \"memoryType\": \"dream\"}");
        assertEquals(400, resp.statusCode());
    }

    @Test
    void bad_query_parameter_returns_400() throws Exception {
        assertEquals(400, send("GET", "/memories?k=abc", null).statusCode());
        assertEquals(400, send("GET", "/memories?k=0", null).statusCode());
        assertEquals(400, send("GET", "/memories?minImportance=2", null).statusCode());
    }

    @Test
    void unknown_id_returns_404() throws Exception {
        assertEquals(404, send("GET", "/memories/nope", null).statusCode());
        assertEquals(404, send("PUT", "/memories/nope", "{\"importance\": 0.3}").statusCode());
        assertEquals(404, send("POST", "/memories/nope/access", null).statusCode());
    }

    @Test
    void unknown_route_and_method() throws Exception {
        assertEquals(404, send("GET", "/unknown/x", null).statusCode());
        assertEquals(405, send("DELETE", "/memories/abc", null).statusCode());
    }

    @Test
    void sync_without_hub_returns_501() throws Exception {
        var resp = send("POST", "/admin/sync", null);
        assertEquals(501, resp.statusCode());
        assertTrue(resp.body().contains("sync not configured"));
    }

    @Test
    void storage_failures_map_to_503() {
        assertEquals(503, WebServer.statusFor(new StorageException("disk full")));
        assertEquals(500, WebServer.statusFor(new IllegalStateException("bug")));
        assertEquals(404, WebServer.statusFor(new MemoryNotFoundException("x")));
    }
}
