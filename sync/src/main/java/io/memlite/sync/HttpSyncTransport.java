package io.memlite.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.memlite.core.EmbeddingDocument;
import io.memlite.core.MemoryDocument;
import io.memlite.storage.json.DocumentJson;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * HTTP client side of the sync contract.
 *
 *   POST /sync/push            body: JSON array of documents
 *        -> 200 { "accepted": true, "merged": 3 }
 *   GET  /sync/pull?query=..&k=..
 *        -> 200 JSON array of documents
 *   POST /sync/embeddings      body: JSON array of embeddings
 *        -> 200 { "accepted": true, "merged": 2 }
 *   GET  /sync/embeddings?hash=..&hash=..
 *        -> 200 JSON array of the embeddings the hub has
 *
 * Any other status, an unreadable body or an IO failure raises {@link SyncTransportException}.
 */
public final class HttpSyncTransport implements SyncTransport {

    // Hashes per embedding fetch, which keeps request URIs short.
    static final int HASHES_PER_REQUEST = 50;

    private final URI baseUri;
    private final HttpClient client;
    private final DocumentJson json;
    private final Duration requestTimeout;

    public HttpSyncTransport(URI baseUri) {
        this(baseUri, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                new DocumentJson(), Duration.ofSeconds(30));
    }

    public HttpSyncTransport(URI baseUri, HttpClient client, DocumentJson json, Duration requestTimeout) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.client = Objects.requireNonNull(client, "client");
        this.json = Objects.requireNonNull(json, "json");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public boolean push(List<MemoryDocument> batch) {
        try {
            byte[] body = json.writeDocuments(batch);
            HttpRequest req = HttpRequest.newBuilder(baseUri.resolve("/sync/push"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                    .build();
            HttpResponse<byte[]> resp = client.send(req, HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() != 200) {
                throw new SyncTransportException("Hub " + baseUri + " returned HTTP " + resp.statusCode() + " for push");
            }
            PushAck ack = json.mapper().readValue(resp.body(), PushAck.class);
            return ack.accepted();
        } catch (IOException e) {
            throw new SyncTransportException("Push of " + batch.size() + " documents to " + baseUri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncTransportException("Push to " + baseUri + " interrupted", e);
        }
    }

    @Override
    public void pushEmbeddings(List<EmbeddingDocument> embeddings) {
        if (embeddings.isEmpty()) return;
        try {
            byte[] body = json.writeEmbeddings(embeddings);
            HttpRequest req = HttpRequest.newBuilder(baseUri.resolve("/sync/embeddings"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                    .build();
            HttpResponse<byte[]> resp = client.send(req, HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() != 200) {
                throw new SyncTransportException("Hub " + baseUri + " returned HTTP " + resp.statusCode()
                        + " for embedding push");
            }
        } catch (IOException e) {
            throw new SyncTransportException("Push of " + embeddings.size() + " embeddings to " + baseUri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncTransportException("Embedding push to " + baseUri + " interrupted", e);
        }
    }

    @Override
    public List<EmbeddingDocument> pullEmbeddings(Collection<String> contentHashes) {
        var hashes = new ArrayList<>(contentHashes);
        var out = new ArrayList<EmbeddingDocument>(hashes.size());
        for (int from = 0; from < hashes.size(); from += HASHES_PER_REQUEST) {
            var q = new StringBuilder();
            for (String hash : hashes.subList(from, Math.min(hashes.size(), from + HASHES_PER_REQUEST))) {
                if (q.length() > 0) q.append('&');
                q.append("hash=").append(encode(hash));
            }
            out.addAll(fetchEmbeddings(q.toString()));
        }
        return out;
    }

    private List<EmbeddingDocument> fetchEmbeddings(String query) {
        HttpRequest req = HttpRequest.newBuilder(baseUri.resolve("/sync/embeddings?" + query))
                .timeout(requestTimeout)
                .GET()
                .build();
        try {
            HttpResponse<byte[]> resp = client.send(req, HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() != 200) {
                throw new SyncTransportException("Hub " + baseUri + " returned HTTP " + resp.statusCode()
                        + " for embedding pull");
            }
            return json.readEmbeddings(resp.body());
        } catch (IOException | IllegalArgumentException e) {
            throw new SyncTransportException("Embedding pull from " + baseUri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncTransportException("Embedding pull from " + baseUri + " interrupted", e);
        }
    }

    @Override
    public List<MemoryDocument> pull(String query, int k) {
        String q = "query=" + encode(query == null ? "" : query) + "&k=" + k;
        HttpRequest req = HttpRequest.newBuilder(baseUri.resolve("/sync/pull?" + q))
                .timeout(requestTimeout)
                .GET()
                .build();
        try {
            HttpResponse<byte[]> resp = client.send(req, HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() != 200) {
                throw new SyncTransportException("Hub " + baseUri + " returned HTTP " + resp.statusCode() + " for pull");
            }
            return json.readDocuments(resp.body());
        } catch (IOException | IllegalArgumentException e) {
            throw new SyncTransportException("Pull from " + baseUri + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncTransportException("Pull from " + baseUri + " interrupted", e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    // ---------- JSON DTOs ----------

    /** Hub reply to a push. */
    public static final class PushAck {
        private final boolean accepted;
        private final int merged;

        @JsonCreator
        public PushAck(
                @JsonProperty("accepted") boolean accepted,
                @JsonProperty("merged") int merged
        ) {
            this.accepted = accepted;
            this.merged = merged;
        }

        @JsonProperty("accepted")
        public boolean accepted() { return accepted; }

        @JsonProperty("merged")
        public int merged() { return merged; }
    }
}
