package com.relay.proxy.core.forward;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Fully buffered upstream response.
 *
 * @param statusCode  Status returned by the upstream.
 * @param contentType Content-Type returned by the upstream, may be null.
 * @param body        The whole response body.
 */
@SuppressFBWarnings({ "EI_EXPOSE_REP", "EI_EXPOSE_REP2" })
public record ForwardResponse(int statusCode, String contentType, byte[] body) {
}
