// file: src/main/java/io/tabver/server/WebServer.java
package io.tabver.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabver.core.CrossDocumentException;
import io.tabver.core.DuplicateVersionException;
import io.tabver.core.InvalidParentException;
import io.tabver.core.InvalidResolutionException;
import io.tabver.core.NormalizedTable;
import io.tabver.core.Version;
import io.tabver.core.VersionNotFoundException;
import io.tabver.server.diff.DiffEngine;
import io.tabver.server.diff.DiffReport;
import io.tabver.server.dto.CompareRequest;
import io.tabver.server.dto.CreateVersionRequest;
import io.tabver.server.dto.DuplicateResponse;
import io.tabver.server.dto.JsonMapping;
import io.tabver.server.dto.MergeRequestJson;
import io.tabver.server.dto.VersionResponse;
import io.tabver.server.merge.MergeEngine;
import io.tabver.server.merge.MergeRequest;
import io.tabver.server.merge.MergeResult;
import io.tabver.storage.StoredVersion;
import io.tabver.storage.VersionPage;
import io.tabver.storage.VersionStore;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.Locale;
import java.util.Map;

/**
 * Thin HTTP adapter over VersionStore, DiffEngine and MergeEngine.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging, naming the document / versions each request touched.
 *
 * Path layout:
 *   - POST /versions                               create a version (201, or 409 on duplicate content)
 *   - GET  /versions/{id}                          version metadata + table
 *   - GET  /documents/{documentId}/versions        page of versions (?after=&limit=)
 *   - POST /diff/compare                           cell diff of two versions
 *   - POST /diff/merge                             three-way merge
 *   - GET  /admin/health                           basic health check
 *
 * Every request is moved off the I/O thread before it touches the engines.
 */
public final class WebServer {
    static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final VersionStore store;
    private final DiffEngine diffs;
    private final MergeEngine merges;

    public WebServer(int port, VersionStore store, DiffEngine diffs, MergeEngine merges) {
        this.store = store;
        this.diffs = diffs;
        this.merges = merges;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::route);
            return;
        }
        exchange.startBlocking();

        var path = exchange.getRequestPath();
        var method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if ("/versions".equals(path)) {
            if ("POST".equals(method)) handleCreateVersion(exchange);
            else methodNotAllowed(exchange, method, path);
        } else if (path.startsWith("/versions/")) {
            String id = path.substring("/versions/".length());
            if (id.isBlank() || id.contains("/")) {
                notFound(exchange, method, path);
            } else if ("GET".equals(method)) {
                handleGetVersion(exchange, id);
            } else {
                methodNotAllowed(exchange, method, path);
            }
        } else if (path.startsWith("/documents/") && path.endsWith("/versions")) {
            String documentId = path.substring("/documents/".length(), path.length() - "/versions".length());
            if (documentId.isBlank() || documentId.contains("/")) {
                notFound(exchange, method, path);
            } else if ("GET".equals(method)) {
                handleListVersions(exchange, documentId);
            } else {
                methodNotAllowed(exchange, method, path);
            }
        } else if ("/diff/compare".equals(path)) {
            if ("POST".equals(method)) handleCompare(exchange);
            else methodNotAllowed(exchange, method, path);
        } else if ("/diff/merge".equals(path)) {
            if ("POST".equals(method)) handleMerge(exchange);
            else methodNotAllowed(exchange, method, path);
        } else if ("/admin/health".equals(path)) {
            send(exchange, 200, Map.of("status", "ok"));
            RequestLogger.logRequest(method, path, 200);
        } else {
            notFound(exchange, method, path);
        }
    }

    // ---------- handlers ----------

    /** POST /versions */
    private void handleCreateVersion(HttpServerExchange ex) {
        handle(ex, (body, subject) -> {
            var req = json.readValue(body, CreateVersionRequest.class);
            if (req == null) throw new IllegalArgumentException("request body is required");
            NormalizedTable table = JsonMapping.toTable(req.table);
            subject.set("doc=" + req.documentId + " actor=" + req.actor);
            Version v = store.createVersion(req.documentId, req.parentVersionId, table, req.actor, req.tag);
            var dto = new VersionResponse();
            dto.version = JsonMapping.fromVersion(v);
            return new Reply(201, dto, "version=" + v.id() + " #" + v.versionNumber() + " cells=" + v.cellCount());
        });
    }

    /** GET /versions/{id} */
    private void handleGetVersion(HttpServerExchange ex, String id) {
        handle(ex, (body, subject) -> {
            subject.set("version=" + id);
            StoredVersion sv = store.getVersion(id);
            var dto = new VersionResponse();
            dto.version = JsonMapping.fromVersion(sv.version());
            dto.table = JsonMapping.fromTable(sv.table());
            return new Reply(200, dto, "doc=" + sv.version().documentId());
        });
    }

    /** GET /documents/{documentId}/versions?after=&limit= */
    private void handleListVersions(HttpServerExchange ex, String documentId) {
        handle(ex, (body, subject) -> {
            subject.set("doc=" + documentId);
            Integer after = intParam(ex, "after");
            Integer limit = intParam(ex, "limit");
            VersionPage page = store.listVersions(documentId, after, limit);
            return new Reply(200, JsonMapping.fromPage(page), "versions=" + page.versions().size());
        });
    }

    /** POST /diff/compare */
    private void handleCompare(HttpServerExchange ex) {
        handle(ex, (body, subject) -> {
            var req = json.readValue(body, CompareRequest.class);
            if (req == null) throw new IllegalArgumentException("request body is required");
            subject.set("from=" + req.fromVersionId + " to=" + req.toVersionId);
            DiffReport report = diffs.compare(req.fromVersionId, req.toVersionId, JsonMapping.toOptions(req.options));
            return new Reply(200, JsonMapping.fromDiff(report.entries(), report.summary()),
                    "changes=" + (report.summary().total() - report.summary().unchanged()));
        });
    }

    /** POST /diff/merge */
    private void handleMerge(HttpServerExchange ex) {
        handle(ex, (body, subject) -> {
            var req = json.readValue(body, MergeRequestJson.class);
            MergeRequest request = JsonMapping.toMergeRequest(req);
            subject.set("base=" + request.baseVersionId() + " left=" + request.leftVersionId()
                    + " right=" + request.rightVersionId() + " actor=" + request.actor());
            MergeResult result = merges.merge(request);
            return new Reply(200, JsonMapping.fromMerge(result), mergeSummary(result));
        });
    }

    // ---------- helpers ----------

    /** Response plus the short outcome that goes into the request log. */
    private record Reply(int status, Object body, String result) {}

    /** Holder the action fills in as soon as it knows what the request is about. */
    private static final class Subject {
        private String value;

        void set(String value) {
            this.value = value;
        }
    }

    @FunctionalInterface
    private interface Action {
        Reply run(byte[] body, Subject subject) throws Exception;
    }

    private static String mergeSummary(MergeResult r) {
        StringBuilder sb = new StringBuilder("outcome=").append(r.outcome().name().toLowerCase(Locale.ROOT));
        if (r.mergedVersionId() != null) sb.append(" merged=").append(r.mergedVersionId());
        sb.append(" auto=").append(r.autoResolvedCount())
                .append(" manual=").append(r.manuallyResolvedCount())
                .append(" unresolved=").append(r.unresolvedCount());
        if (!r.audited()) sb.append(" audit=failed");
        return sb.toString();
    }

    /**
     * Read the body (bounded), run the action, map exceptions to status codes and
     * log the request.
     */
    private void handle(HttpServerExchange ex, Action action) {
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        long start = System.nanoTime();
        int status;
        long engineMs = -1L;
        Subject subject = new Subject();
        String result = null;
        Throwable error = null;

        try {
            byte[] body = readBody(ex);
            if (body == null) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
            } else {
                long eStart = System.nanoTime();
                Reply reply = action.run(body, subject);
                engineMs = (System.nanoTime() - eStart) / 1_000_000L;
                status = reply.status();
                result = reply.result();
                send(ex, status, reply.body());
            }
        } catch (DuplicateVersionException dup) {
            status = 409;
            var dto = new DuplicateResponse();
            dto.error = dup.getMessage();
            dto.existingVersionId = dup.existingVersionId();
            result = "duplicate of " + dup.existingVersionId();
            send(ex, status, dto);
        } catch (VersionNotFoundException nf) {
            status = 404;
            error = nf;
            send(ex, status, Map.of("error", nf.getMessage()));
        } catch (InvalidParentException | CrossDocumentException | InvalidResolutionException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", bad.getMessage()));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException | NullPointerException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.log(new RequestLogger.Entry(
                    method, path, ex.getStatusCode(), totalMs, engineMs, subject.value, result, error));
        }
    }

    /** Whole request body, or null when it exceeds {@link #MAX_BODY_BYTES}. */
    private static byte[] readBody(HttpServerExchange ex) throws IOException {
        try (InputStream in = ex.getInputStream()) {
            byte[] data = in.readNBytes(MAX_BODY_BYTES + 1);
            if (data.length <= MAX_BODY_BYTES) return data;
            in.transferTo(OutputStream.nullOutputStream()); // drain so the client sees the 413
            return null;
        }
    }

    private static Integer intParam(HttpServerExchange ex, String name) {
        Deque<String> values = ex.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.peekFirst().isBlank()) return null;
        try {
            return Integer.parseInt(values.peekFirst());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer", e);
        }
    }

    private void notFound(HttpServerExchange ex, String method, String path) {
        send(ex, 404, Map.of("error", "not found"));
        RequestLogger.logRequest(method, path, 404);
    }

    private void methodNotAllowed(HttpServerExchange ex, String method, String path) {
        send(ex, 405, Map.of("error", "method not allowed"));
        RequestLogger.logRequest(method, path, 405);
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
