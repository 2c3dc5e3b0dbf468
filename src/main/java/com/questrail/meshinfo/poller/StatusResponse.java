package com.questrail.meshinfo.poller;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Raw HTTP response from a node's status endpoint.
 *
 * @param status HTTP status code
 * @param body   response body bytes as received
 */
public record StatusResponse(int status, byte[] body) {

    public StatusResponse {
        Objects.requireNonNull(body, "body");
    }

    /**
     * Body decoded as UTF-8; malformed sequences become U+FFFD rather than failing.
     */
    public String text() {
        return new String(body, StandardCharsets.UTF_8);
    }
}
