package io.memlite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.memlite.core.MemoryDocument;
import io.memlite.core.MemoryType;
import io.memlite.core.ValidationException;
import io.memlite.server.dto.LearnRequest;
import io.memlite.server.dto.SyncReport;
import io.memlite.server.dto.UpdateRequest;
import io.memlite.storage.StorageException;
import io.memlite.storage.json.DocumentJson;
import io.memlite.storage.json.MemoryDocumentDto;
import io.memlite.sync.SyncManager;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over MemoryService and SyncManager.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST /memories                       learn
 *   - GET  /memories?type=&tag=&minImportance=&k=   filtered listing
 *   - GET  /memories?query=&k=             recall
 *   - GET  /memories/{id}                  one memory
 *   - PUT  /memories/{id}                  partial update
 *   - POST /memories/{id}/access           record an access
 *   - GET  /admin/promotion-candidates     memories above the promotion threshold
 *   - POST /admin/sync                     run one sync cycle now
 *   - GET  /admin/health                   health and counters
 *   - POST /sync/push                      hub side: merge a pushed batch
 *   - GET  /sync/pull?query=&k=            hub side: documents relevant to a query
 *   - POST /sync/embeddings                hub side: store pushed embeddings
 *   - GET  /sync/embeddings?hash=&hash=    hub side: embeddings of the given content hashes
 *
 * Error mapping: validation and malformed JSON -> 400, unknown id -> 404,
 * body over 10 MiB -> 413, storage failure -> 503, anything else -> 500.
 */
public final class WebServer {

    static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final int DEFAULT_K = 10;

    private final Undertow server;
    private final ObjectMapper json;
    private final DocumentJson documents;
    private final MemoryService service;
    private final SyncManager sync; // null when no hub is configured

    public WebServer(int port, MemoryService service) {
        this(port, service, null, new DocumentJson());
    }

    public WebServer(int port, MemoryService service, SyncManager sync, DocumentJson documents) {
        this.service = service;
        this.sync = sync;
        this.documents = documents;
        this.json = documents.mapper();

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    // Storage writes fsync; keep them off the IO threads.
                    if (exchange.isInIoThread()) {
                        exchange.dispatch(this::route);
                        return;
                    }
                    route(exchange);
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void route(HttpServerExchange ex) {
        var path = ex.getRequestPath();
        var method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if ("/memories".equals(path) || "/memories/".equals(path)) {
            switch (method) {
                case "GET" -> handleQuery(ex);
                case "POST" -> withBody(ex, this::handleLearn);
                default -> reject(ex, 405, "method not allowed");
            }
        } else if (path.startsWith("/memories/")) {
            String rest = path.substring("/memories/".length());
            if (rest.endsWith("/access")) {
                String id = rest.substring(0, rest.length() - "/access".length());
                if ("POST".equals(method)) timed(ex, () -> reply(200, dto(service.recordAccess(requireId(id)))));
                else reject(ex, 405, "method not allowed");
                return;
            }
            if (rest.isBlank() || rest.contains("/")) {
                reject(ex, 400, "id must not be empty");
                return;
            }
            switch (method) {
                case "GET" -> timed(ex, () -> reply(200, dto(service.get(rest))));
                case "PUT" -> withBody(ex, body -> handleUpdate(rest, body));
                default -> reject(ex, 405, "method not allowed");
            }
        } else if ("/admin/health".equals(path) && "GET".equals(method)) {
            timed(ex, this::health);
        } else if ("/admin/promotion-candidates".equals(path) && "GET".equals(method)) {
            timed(ex, () -> reply(200, dtos(service.promotionCandidates())));
        } else if ("/admin/sync".equals(path) && "POST".equals(method)) {
            timed(ex, this::handleSync);
        } else if ("/sync/push".equals(path) && "POST".equals(method)) {
            withBody(ex, this::handlePush);
        } else if ("/sync/pull".equals(path) && "GET".equals(method)) {
            timed(ex, () -> handlePull(ex));
        } else if ("/sync/embeddings".equals(path)) {
            switch (method) {
                case "GET" -> timed(ex, () -> handleEmbeddingPull(ex));
                case "POST" -> withBody(ex, this::handleEmbeddingPush);
                default -> reject(ex, 405, "method not allowed");
            }
        } else {
            reject(ex, 404, "not found");
        }
    }

    // ---------- handlers ----------

    /** GET /memories: recall when "query" is given, filtered listing otherwise. */
    private void handleQuery(HttpServerExchange ex) {
        timed(ex, () -> {
            var params = ex.getQueryParameters();
            int k = parseInt(firstOrNull(params.get("k")), DEFAULT_K, "k");
            String query = firstOrNull(params.get("query"));
            if (query != null && !query.isBlank()) {
                return reply(200, dtos(service.recall(query, k)));
            }
            String type = firstOrNull(params.get("type"));
            String tag = firstOrNull(params.get("tag"));
            String minImportance = firstOrNull(params.get("minImportance"));
            return reply(200, dtos(service.list(
                    type == null || type.isBlank() ? null : MemoryType.parse(type),
                    tag == null || tag.isBlank() ? null : tag,
                    minImportance == null || minImportance.isBlank() ? null : parseDouble(minImportance, "minImportance"),
                    k)));
        });
    }

    private Reply handleLearn(byte[] body) throws Exception {
        var req = json.readValue(body, LearnRequest.class);
        if (req == null) throw new ValidationException("request body is empty");
        var doc = service.learn(
                req.content,
                MemoryType.parse(req.memoryType),
                req.importance,
                req.confidence,
                MemoryUpdate.values(req.tags, "tags"),
                MemoryUpdate.values(req.related, "related"),
                MemoryUpdate.values(req.evidence, "evidence"));
        return reply(201, dto(doc));
    }

    private Reply handleUpdate(String id, byte[] body) throws Exception {
        var req = json.readValue(body, UpdateRequest.class);
        if (req == null) throw new ValidationException("request body is empty");
        var update = new MemoryUpdate(req.content, req.importance, req.confidence,
                req.addTags, req.removeTags, req.addRelated, req.addEvidence);
        return reply(200, dto(service.update(id, update)));
    }

    private Reply handleSync() {
        if (sync == null) return reply(501, Map.of("error", "sync not configured"));
        var result = sync.sync();
        var dto = new SyncReport();
        dto.success = result.success();
        dto.pushed = result.pushedCount();
        dto.synced = result.syncedCount();
        dto.failed = result.failedCount();
        dto.errors = result.errors();
        dto.durationMillis = result.durationMillis();
        dto.pending = service.pendingCount();
        return reply(result.success() ? 200 : 502, dto);
    }

    private Reply handlePush(byte[] body) throws Exception {
        List<MemoryDocument> batch = documents.readDocuments(body);
        int merged = service.acceptPush(batch);
        return reply(200, Map.of("accepted", true, "merged", merged));
    }

    private Reply handlePull(HttpServerExchange ex) throws Exception {
        var params = ex.getQueryParameters();
        int k = parseInt(firstOrNull(params.get("k")), DEFAULT_K, "k");
        var docs = service.servePull(firstOrNull(params.get("query")), k);
        return new Reply(200, documents.writeDocuments(docs));
    }

    private Reply handleEmbeddingPush(byte[] body) throws Exception {
        int merged = service.acceptEmbeddings(documents.readEmbeddings(body));
        return reply(200, Map.of("accepted", true, "merged", merged));
    }

    private Reply handleEmbeddingPull(HttpServerExchange ex) throws Exception {
        Deque<String> hashes = ex.getQueryParameters().get("hash");
        if (hashes == null || hashes.isEmpty()) throw new ValidationException("hash must be given");
        return new Reply(200, documents.writeEmbeddings(service.serveEmbeddings(hashes)));
    }

    private Reply health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("instanceId", service.instanceId());
        body.put("memories", service.count());
        body.put("pending", service.pendingCount());
        body.put("syncEnabled", sync != null);
        if (sync != null) {
            var stats = sync.stats();
            body.put("syncRunning", sync.isRunning());
            body.put("totalSynced", stats.totalSynced());
            body.put("totalFailed", stats.totalFailed());
            body.put("consecutiveFailures", stats.consecutiveFailures());
            body.put("lastSyncTime", stats.lastSyncTime());
        }
        return reply(200, body);
    }

    // ---------- plumbing ----------

    /** Result of a handler: a status and either a DTO to serialize or pre-encoded JSON bytes. */
    private record Reply(int status, Object body) {}

    @FunctionalInterface
    private interface Action {
        Reply run() throws Exception;
    }

    @FunctionalInterface
    private interface BodyAction {
        Reply run(byte[] body) throws Exception;
    }

    private static Reply reply(int status, Object body) {
        return new Reply(status, body);
    }

    /** Run {@code action}, map its failure to a status, write the response and log it. */
    private void timed(HttpServerExchange ex, Action action) {
        long start = System.nanoTime();
        int status;
        long serviceMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            Reply r = action.run();
            serviceMs = (System.nanoTime() - sStart) / 1_000_000L;
            status = r.status();
            send(ex, status, r.body());
        } catch (Exception e) {
            error = e;
            status = statusFor(e);
            send(ex, status, errorBody(e, status));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(),
                    ex.getStatusCode(), totalMs, serviceMs, error);
        }
    }

    private void withBody(HttpServerExchange ex, BodyAction action) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    if (data.length > MAX_BODY_BYTES) {
                        reject(exchange, 413, "request body too large");
                        return;
                    }
                    timed(exchange, () -> action.run(data));
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(exchange.getRequestMethod().toString(), exchange.getRequestPath(),
                            400, 0, -1, ioEx);
                }
        );
    }

    private void reject(HttpServerExchange ex, int status, String message) {
        send(ex, status, Map.of("error", message));
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), status, 0, -1, null);
    }

    static int statusFor(Throwable e) {
        if (e instanceof MemoryNotFoundException) return 404;
        if (e instanceof JsonProcessingException) return 400;
        if (e instanceof IllegalArgumentException) return 400;
        if (e instanceof StorageException) return 503;
        return 500;
    }

    private static Map<String, Object> errorBody(Exception e, int status) {
        if (e instanceof JsonProcessingException) return Map.of("error", "invalid JSON");
        String message = e.getMessage() == null ? "" : e.getMessage();
        if (status >= 500) return Map.of("error", e.getClass().getSimpleName(), "message", message);
        return Map.of("error", message);
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) throw new ValidationException("id must not be empty");
        return id;
    }

    private static MemoryDocumentDto dto(MemoryDocument doc) {
        return DocumentJson.toDto(doc);
    }

    private static List<MemoryDocumentDto> dtos(List<MemoryDocument> docs) {
        var out = new ArrayList<MemoryDocumentDto>(docs.size());
        for (var d : docs) out.add(DocumentJson.toDto(d));
        return out;
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    private static int parseInt(String raw, int fallback, String name) {
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException nfe) {
            throw new ValidationException(name + " must be an integer");
        }
    }

    private static double parseDouble(String raw, String name) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException nfe) {
            throw new ValidationException(name + " must be a number");
        }
    }

    /** Serialize 'body' as JSON (or write it as-is when already encoded) with the given status. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = body instanceof byte[] raw ? raw : json.writeValueAsBytes(body);
            ex.getResponseSender().send(ByteBuffer.wrap(bytes));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
