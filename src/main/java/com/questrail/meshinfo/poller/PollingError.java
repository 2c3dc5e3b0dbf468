package com.questrail.meshinfo.poller;

/**
 * Enumerates the ways polling a single node can fail.
 */
public enum PollingError {
    CONNECTION_ERROR,
    TIMEOUT_ERROR,
    HTTP_ERROR,
    INVALID_RESPONSE,
    PARSE_ERROR;

    /**
     * Title-cased name, e.g. {@code Timeout Error}; HTTP stays upper case.
     */
    @Override
    public String toString() {
        if (this == HTTP_ERROR) {
            return "HTTP Error";
        }
        StringBuilder sb = new StringBuilder();
        for (String word : name().split("_")) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(word.charAt(0)).append(word.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
