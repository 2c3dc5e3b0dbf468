package com.questrail.meshinfo.poller;

import java.util.Objects;

/**
 * Typed failure of one node poll.
 *
 * @param error    failure kind
 * @param response diagnostic text: exception message, or the (possibly long) response body
 */
public record NodeError(PollingError error, String response) {

    static final int PREVIEW_LENGTH = 50;

    public NodeError {
        Objects.requireNonNull(error, "error");
        response = response == null ? "" : response;
    }

    @Override
    public String toString() {
        if (response.length() <= PREVIEW_LENGTH) {
            return error + " ('" + response + "')";
        }
        return error + " ('" + response.substring(0, PREVIEW_LENGTH) + "...')";
    }
}
