// file: src/main/java/io/tabver/client/Cli.java
package io.tabver.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.PrintStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Simple CLI for interacting with a running TabVer server over HTTP.
 *
 * Usage:
 *   tabver-cli [--base-url http://host:port] upload <documentId> <actor> <table.json> [parentVersionId]
 *   tabver-cli [--base-url http://host:port] get <versionId>
 *   tabver-cli [--base-url http://host:port] versions <documentId>
 *   tabver-cli [--base-url http://host:port] diff <fromVersionId> <toVersionId> [--structural]
 *   tabver-cli [--base-url http://host:port] merge <base> <left> <right> <actor> [--allow-partial]
 *
 * Exit codes: 0 success, 1 usage or HTTP error, 2 unexpected failure.
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CRASHED = 2;

    private final HttpClient http;
    private final String baseUrl;
    private final PrintStream out;
    private final ObjectMapper json = new ObjectMapper();

    private Cli(String baseUrl, PrintStream out) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.out = out;
    }

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) System.exit(code);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (args.length == 0) {
                throw new UsageException("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                throw new UsageException("missing command");
            }

            Cli cli = new Cli(parsed.getKey(), out);
            String cmd = rest[0];
            List<String> positional = new ArrayList<>();
            List<String> flags = new ArrayList<>();
            for (int i = 1; i < rest.length; i++) {
                if (rest[i].startsWith("--")) flags.add(rest[i]);
                else positional.add(rest[i]);
            }

            switch (cmd) {
                case "upload" -> {
                    requireArgs(positional, flags, 3, 4, List.of(), "upload requires <documentId> <actor> <table.json> [parentVersionId]");
                    cli.upload(positional.get(0), positional.get(1), Path.of(positional.get(2)),
                            positional.size() == 4 ? positional.get(3) : null);
                }
                case "get" -> {
                    requireArgs(positional, flags, 1, 1, List.of(), "get requires <versionId>");
                    cli.get(positional.get(0));
                }
                case "versions" -> {
                    requireArgs(positional, flags, 1, 1, List.of(), "versions requires <documentId>");
                    cli.versions(positional.get(0));
                }
                case "diff" -> {
                    requireArgs(positional, flags, 2, 2, List.of("--structural"), "diff requires <from> <to> [--structural]");
                    cli.diff(positional.get(0), positional.get(1), flags.contains("--structural"));
                }
                case "merge" -> {
                    requireArgs(positional, flags, 4, 4, List.of("--allow-partial"),
                            "merge requires <base> <left> <right> <actor> [--allow-partial]");
                    cli.merge(positional.get(0), positional.get(1), positional.get(2), positional.get(3),
                            flags.contains("--allow-partial"));
                }
                default -> throw new UsageException("unknown command: " + cmd);
            }
            return EXIT_OK;
        } catch (UsageException e) {
            err.println("error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_FAILED;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (Exception e) {
            e.printStackTrace(err);
            return EXIT_CRASHED;
        }
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if ("--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new UsageException("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private static void requireArgs(List<String> positional, List<String> flags, int min, int max,
                                    List<String> allowedFlags, String message) {
        if (positional.size() < min || positional.size() > max) {
            throw new UsageException(message);
        }
        for (String f : flags) {
            if (!allowedFlags.contains(f)) throw new UsageException("unknown option: " + f);
        }
    }

    // ---------- commands ----------

    private void upload(String documentId, String actor, Path tableFile, String parentVersionId) throws Exception {
        if (!Files.isRegularFile(tableFile)) {
            throw new CliException("no such file: " + tableFile);
        }
        ObjectNode body = json.createObjectNode();
        body.put("documentId", documentId);
        body.put("actor", actor);
        if (parentVersionId != null) body.put("parentVersionId", parentVersionId);
        body.set("table", json.readTree(tableFile.toFile()));

        HttpResponse<String> resp = post("/versions", body);
        if (resp.statusCode() == 409) {
            String existing = json.readTree(resp.body()).path("existingVersionId").asText();
            throw new CliException("identical content already stored as version " + existing);
        }
        expect(resp, 201, "upload");
        JsonNode v = json.readTree(resp.body()).path("version");
        out.printf("created %s (version %d of %s)%n", v.path("id").asText(), v.path("versionNumber").asInt(), documentId);
    }

    private void get(String versionId) throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/versions/" + encode(versionId)))
                .GET()
                .build());
        if (resp.statusCode() == 404) {
            throw new CliException("version not found: " + versionId);
        }
        expect(resp, 200, "get");
        out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(json.readTree(resp.body())));
    }

    private void versions(String documentId) throws Exception {
        Integer after = null;
        int printed = 0;
        do {
            String query = after == null ? "" : "?after=" + after;
            HttpResponse<String> resp = send(HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/documents/" + encode(documentId) + "/versions" + query))
                    .GET()
                    .build());
            expect(resp, 200, "versions");
            JsonNode page = json.readTree(resp.body());
            for (JsonNode v : page.path("versions")) {
                out.printf("#%d  %s  %s  %s%s%n",
                        v.path("versionNumber").asInt(),
                        v.path("id").asText(),
                        v.path("createdBy").asText(),
                        v.path("createdAt").asText(),
                        v.path("tag").isTextual() ? "  [" + v.path("tag").asText() + "]" : "");
                printed++;
            }
            JsonNode next = page.path("nextCursor");
            after = next.isNumber() ? next.asInt() : null;
        } while (after != null);
        if (printed == 0) out.println("(no versions)");
    }

    private void diff(String from, String to, boolean structural) throws Exception {
        ObjectNode body = json.createObjectNode();
        body.put("fromVersionId", from);
        body.put("toVersionId", to);
        body.putObject("options").put("structuralAware", structural);

        HttpResponse<String> resp = post("/diff/compare", body);
        expectFound(resp, "diff");
        JsonNode report = json.readTree(resp.body());
        for (JsonNode d : report.path("diffs")) {
            String kind = d.path("kind").asText();
            StringBuilder line = new StringBuilder().append(kind).append(' ').append(d.path("ref").asText());
            if (!d.path("oldValue").isMissingNode() || !d.path("newValue").isMissingNode()) {
                line.append(": ").append(display(d.path("oldValue"))).append(" -> ").append(display(d.path("newValue")));
            }
            if (d.path("originRow").isNumber()) {
                line.append(" (was row ").append(d.path("originRow").asInt() + 1).append(')');
            }
            out.println(line);
        }
        JsonNode s = report.path("summary");
        out.printf("%d changes: %d added, %d removed, %d modified, %d rows inserted, %d rows deleted%n",
                s.path("total").asInt(), s.path("added").asInt(), s.path("removed").asInt(),
                s.path("modified").asInt(), s.path("rowsInserted").asInt(), s.path("rowsDeleted").asInt());
    }

    private void merge(String base, String left, String right, String actor, boolean allowPartial) throws Exception {
        ObjectNode body = json.createObjectNode();
        body.put("baseVersionId", base);
        body.put("leftVersionId", left);
        body.put("rightVersionId", right);
        body.put("actor", actor);
        body.put("allowPartial", allowPartial);

        HttpResponse<String> resp = post("/diff/merge", body);
        if (resp.statusCode() == 409) {
            String existing = json.readTree(resp.body()).path("existingVersionId").asText();
            throw new CliException("merged content already stored as version " + existing);
        }
        expectFound(resp, "merge");
        JsonNode r = json.readTree(resp.body());
        for (JsonNode c : r.path("conflicts")) {
            out.printf("%-10s %s  base=%s left=%s right=%s  %s%n",
                    c.path("resolution").asText(),
                    c.path("ref").asText(),
                    display(c.path("baseValue")),
                    display(c.path("leftValue")),
                    display(c.path("rightValue")),
                    c.path("reason").asText());
        }
        JsonNode merged = r.path("mergedVersionId");
        out.printf("%s: %s (auto %d, manual %d, unresolved %d, confidence %.2f)%n",
                r.path("outcome").asText(),
                merged.isTextual() ? merged.asText() : "no version written",
                r.path("autoResolvedCount").asInt(),
                r.path("manuallyResolvedCount").asInt(),
                r.path("unresolvedCount").asInt(),
                r.path("confidenceScore").asDouble());
    }

    // ---------- helpers ----------

    private HttpResponse<String> post(String path, JsonNode body) throws Exception {
        return send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                .build());
    }

    private HttpResponse<String> send(HttpRequest req) throws Exception {
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private void expectFound(HttpResponse<String> resp, String what) throws Exception {
        if (resp.statusCode() == 404) {
            throw new CliException(what + " failed: " + json.readTree(resp.body()).path("error").asText());
        }
        expect(resp, 200, what);
    }

    private static void expect(HttpResponse<String> resp, int status, String what) {
        if (resp.statusCode() != status) {
            throw new CliException(what + " failed (" + resp.statusCode() + "): " + resp.body());
        }
    }

    /** Short form of a JSON cell value: quoted text, "=formula", or "-" when absent. */
    static String display(JsonNode value) {
        if (value == null || value.isMissingNode() || value.isNull()) return "-";
        return switch (value.path("type").asText()) {
            case "formula" -> "=" + value.path("formula").asText();
            case "text" -> "\"" + value.path("value").asText() + "\"";
            case "empty" -> "(empty)";
            default -> value.path("value").toString();
        };
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static final String USAGE = """
            Usage:
              tabver-cli [--base-url http://host:port] upload <documentId> <actor> <table.json> [parentVersionId]
              tabver-cli [--base-url http://host:port] get <versionId>
              tabver-cli [--base-url http://host:port] versions <documentId>
              tabver-cli [--base-url http://host:port] diff <from> <to> [--structural]
              tabver-cli [--base-url http://host:port] merge <base> <left> <right> <actor> [--allow-partial]
            """;

    private static class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }

    private static final class UsageException extends CliException {
        UsageException(String msg) {
            super(msg);
        }
    }
}
