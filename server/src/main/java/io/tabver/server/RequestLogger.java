// file: src/main/java/io/tabver/server/RequestLogger.java
package io.tabver.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging.
 *
 * Responsibilities:
 *  - One line per HTTP request: method, path, status and latency.
 *  - Name what the request was about (document, versions) and how it ended
 *    (diff size, merge outcome, duplicate target), so a merge can be traced
 *    from the log alone.
 *  - 5xx at WARNING with the stack trace, everything else at INFO; rejected
 *    requests carry the error message.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * One completed request.
     *
     * @param engineMillis time spent in the store / diff / merge call, or -1 if not measured
     * @param subject      what the request addressed, e.g. "doc=budget version=v1", or null
     * @param result       short outcome, e.g. "outcome=partial conflicts=2", or null
     * @param error        exception that decided the status, or null
     */
    public record Entry(
            String method,
            String path,
            int status,
            long totalMillis,
            long engineMillis,
            String subject,
            String result,
            Throwable error
    ) {
        public String format() {
            StringBuilder sb = new StringBuilder()
                    .append("HTTP ").append(method).append(' ').append(path).append(" -> ").append(status);
            if (subject != null) sb.append(" [").append(subject).append(']');
            if (result != null) sb.append(' ').append(result);
            if (error != null && status < 500) sb.append(" error=").append(error.getMessage());
            sb.append(" (total=").append(totalMillis).append("ms");
            if (engineMillis >= 0) sb.append(", engine=").append(engineMillis).append("ms");
            return sb.append(')').toString();
        }
    }

    public static void log(Entry entry) {
        if (entry.status() >= 500) {
            if (entry.error() != null) log.log(Level.WARNING, entry.format(), entry.error());
            else log.log(Level.WARNING, entry.format());
        } else {
            log.log(Level.INFO, entry.format());
        }
    }

    /** Requests answered by the router itself (health, 404, 405). */
    public static void logRequest(String method, String path, int status) {
        log(new Entry(method, path, status, 0, -1, null, null, null));
    }
}
