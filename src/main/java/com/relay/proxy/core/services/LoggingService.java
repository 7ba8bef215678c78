package com.relay.proxy.core.services;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

import com.relay.proxy.config.LoggingConfig;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one access line per dispatched request.
 * The line layout follows a configurable Apache-style format and is emitted on
 * the {@code relay.access} logger, so its destination is decided by the logging
 * backend configuration.
 */
public class LoggingService {

    /** Name of the logger access lines are written to. */
    public static final String ACCESS_LOGGER = "relay.access";

    private static final Logger accessLog = LoggerFactory.getLogger(ACCESS_LOGGER);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z");

    private final LoggingConfig config;

    /**
     * Cached formatted timestamp, refreshed at most once per second.
     */
    private volatile String cachedTimestamp = "";
    /** The epoch second at which {@link #cachedTimestamp} was last produced. */
    private volatile long cachedTimestampSec = 0;

    /**
     * Initializes the LoggingService with the provided configuration.
     *
     * @param config The access log settings.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public LoggingService(LoggingConfig config) {
        this.config = config != null ? config : new LoggingConfig();
    }

    /**
     * Values available to the format tokens.
     */
    record AccessRecord(String remoteHost, String time, String requestLine, String status, String bytes,
            String method, String query, String workerId, String correlationId) {
    }

    /**
     * Logs a dispatched request using the configured format.
     *
     * @param remoteHost    Client's IP address.
     * @param method        HTTP method.
     * @param uri           Request target including any query string.
     * @param status        HTTP status sent to the client.
     * @param bytes         Number of body bytes sent to the client.
     * @param workerId      Id of the worker that handled the request, or -1 if none.
     * @param correlationId Correlation id of the request, may be null.
     */
    public void logRequest(String remoteHost, String method, String uri, int status, long bytes, int workerId,
            String correlationId) {
        if (!config.isAccessLogEnabled() || !accessLog.isInfoEnabled()) {
            return;
        }
        accessLog.info(format(remoteHost, method, uri, status, bytes, workerId, correlationId));
    }

    /**
     * Formats an access line without logging it.
     *
     * @param remoteHost    Client's IP address.
     * @param method        HTTP method.
     * @param uri           Request target including any query string.
     * @param status        HTTP status sent to the client.
     * @param bytes         Number of body bytes sent to the client.
     * @param workerId      Id of the worker that handled the request, or -1 if none.
     * @param correlationId Correlation id of the request, may be null.
     * @return The formatted line.
     */
    String format(String remoteHost, String method, String uri, int status, long bytes, int workerId,
            String correlationId) {
        String query = "";
        int queryIndex = uri.indexOf('?');
        if (queryIndex != -1) {
            query = uri.substring(queryIndex);
        }
        AccessRecord accessRecord = new AccessRecord(
                remoteHost != null ? remoteHost : "-",
                "[" + getCachedTimestamp() + "]",
                method + " " + uri + " HTTP/1.1",
                String.valueOf(status),
                bytes > 0 ? String.valueOf(bytes) : "-",
                method,
                query,
                workerId >= 0 ? String.valueOf(workerId) : "-",
                correlationId != null ? correlationId : "-");
        return formatLogLine(config.getFormat(), accessRecord);
    }

    /**
     * Formats a log line based on the Apache-style format string.
     * Supported tokens: %h, %l, %u, %t, %r, %>s, %b, %m, %q, %w, %i.
     */
    private String formatLogLine(String format, AccessRecord accessRecord) {
        StringBuilder sb = new StringBuilder(format.length() + 100);
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c == '%' && i + 1 < format.length()) {
                i = appendToken(sb, format, i, accessRecord);
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private int appendToken(StringBuilder sb, String format, int currentIdx, AccessRecord accessRecord) {
        char next = format.charAt(currentIdx + 1);
        int skip = 1;
        switch (next) {
            case 'h' -> sb.append(accessRecord.remoteHost());
            case 'l', 'u' -> sb.append('-');
            case 't' -> sb.append(accessRecord.time());
            case 'r' -> sb.append(accessRecord.requestLine());
            case 'm' -> sb.append(accessRecord.method());
            case 'q' -> sb.append(accessRecord.query());
            case 'w' -> sb.append(accessRecord.workerId());
            case 'i' -> sb.append(accessRecord.correlationId());
            case '>' -> {
                if (currentIdx + 2 < format.length() && format.charAt(currentIdx + 2) == 's') {
                    sb.append(accessRecord.status());
                    skip = 2;
                } else {
                    sb.append('%');
                    skip = 0;
                }
            }
            case 'b' -> sb.append(accessRecord.bytes());
            default -> {
                sb.append('%');
                skip = 0;
            }
        }
        return currentIdx + skip + 1;
    }

    private String getCachedTimestamp() {
        long nowSec = Instant.now().getEpochSecond();
        if (nowSec != cachedTimestampSec) {
            cachedTimestampSec = nowSec;
            cachedTimestamp = ZonedDateTime.now().format(DATE_FORMATTER);
        }
        return cachedTimestamp;
    }
}
