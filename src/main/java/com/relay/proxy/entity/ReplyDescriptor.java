package com.relay.proxy.entity;

import com.relay.proxy.core.constants.ErrorKind;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Reply message produced by a worker for exactly one {@link RequestDescriptor}.
 * Either carries a body ({@link #isOk()}) or an {@link ErrorKind} with a short
 * detail.
 */
public final class ReplyDescriptor {
    private final String correlationId;
    private final byte[] data;
    private final String contentType;
    private final ErrorKind error;
    private final String detail;
    private final int upstreamStatus;

    private ReplyDescriptor(String correlationId, byte[] data, String contentType, ErrorKind error, String detail,
            int upstreamStatus) {
        this.correlationId = Objects.requireNonNull(correlationId, "correlationId");
        this.data = data;
        this.contentType = contentType;
        this.error = error;
        this.detail = detail;
        this.upstreamStatus = upstreamStatus;
    }

    /**
     * Creates a successful reply.
     * 
     * @param correlationId  The id of the request being answered.
     * @param data           The aggregated upstream body.
     * @param contentType    The upstream content type, may be null.
     * @param upstreamStatus The status the upstream answered with.
     * @return A new reply.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public static ReplyDescriptor ok(String correlationId, byte[] data, String contentType, int upstreamStatus) {
        return new ReplyDescriptor(correlationId, data == null ? new byte[0] : data, contentType, null, null,
                upstreamStatus);
    }

    /**
     * Creates an error reply with the kind's default message as detail.
     * 
     * @param correlationId The id of the request being answered.
     * @param kind          The failure kind.
     * @return A new reply.
     */
    public static ReplyDescriptor error(String correlationId, ErrorKind kind) {
        return error(correlationId, kind, kind.getMessage());
    }

    /**
     * Creates an error reply.
     * 
     * @param correlationId The id of the request being answered.
     * @param kind          The failure kind.
     * @param detail        Client-facing detail text.
     * @return A new reply.
     */
    public static ReplyDescriptor error(String correlationId, ErrorKind kind, String detail) {
        return new ReplyDescriptor(correlationId, null, null, Objects.requireNonNull(kind, "kind"), detail, 0);
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public boolean isOk() {
        return error == null;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public byte[] getData() {
        return data;
    }

    public String getContentType() {
        return contentType;
    }

    public ErrorKind getError() {
        return error;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * Retrieves the status the upstream answered with. The client still
     * receives 200 for any upstream response.
     *
     * @return The upstream status, or 0 when no upstream response was received.
     */
    public int getUpstreamStatus() {
        return upstreamStatus;
    }

    /**
     * Retrieves the HTTP status the dispatcher should answer with.
     * 
     * @return 200 for a successful reply, otherwise the error kind's status.
     */
    public int getStatus() {
        return error == null ? 200 : error.getStatus();
    }

    /**
     * Retrieves the error code in its wire form.
     * 
     * @return The status as a string, or null for a successful reply.
     */
    public String getErrorCode() {
        return error == null ? null : String.valueOf(error.getStatus());
    }

    /**
     * Retrieves the bytes the client receives as the response body.
     * 
     * @return The upstream body, or the UTF-8 encoded detail of an error.
     */
    public byte[] body() {
        if (error == null) {
            return data.clone();
        }
        return (detail != null ? detail : error.getMessage()).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return isOk()
                ? "ReplyDescriptor{" + correlationId + " ok " + data.length + " bytes}"
                : "ReplyDescriptor{" + correlationId + " " + error + " " + detail + "}";
    }
}
