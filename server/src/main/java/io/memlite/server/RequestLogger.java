package io.memlite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level logging for the HTTP layer.
 *
 * Responsibilities:
 *  - Central place to log method, path, status and latency.
 *  - 5xx go out at WARNING with the cause; health probes stay at FINE.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * Log a completed HTTP request.
     *
     * @param method        HTTP method
     * @param path          request path
     * @param status        HTTP status code
     * @param totalMillis   wall-clock latency for the whole request
     * @param serviceMillis time spent in MemoryService or SyncManager, or -1 if not measured
     * @param error         exception behind a 4xx/5xx, null if none
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            long serviceMillis,
            Throwable error
    ) {
        String msg = String.format(
                "HTTP %s %s -> %d (total=%dms%s)%s",
                method,
                path,
                status,
                totalMillis,
                serviceMillis >= 0 ? ", service=" + serviceMillis + "ms" : "",
                error != null && status < 500 ? ": " + error.getMessage() : ""
        );

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if ("/admin/health".equals(path)) {
            log.fine(msg);
        } else {
            log.info(msg);
        }
    }
}
