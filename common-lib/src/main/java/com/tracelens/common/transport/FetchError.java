package com.tracelens.common.transport;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Why a fetch from the upstream trace API produced no data.
 * {@code status} is the upstream HTTP status when one was received, otherwise null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FetchError(
    @JsonProperty("kind")    Kind kind,
    @JsonProperty("message") String message,
    @JsonProperty("status")  Integer status
) {
    public enum Kind {
        /** Upstream answered with a non-2xx status. */
        HTTP_STATUS,
        /** No answer within the configured timeout. */
        TIMEOUT,
        /** Connection refused, reset or DNS failure. */
        CONNECTION,
        /** Body could not be read as trace records. */
        DECODE,
        /** Body decoded but the records were rejected by validation. */
        INVALID_RECORD
    }

    public static FetchError httpStatus(int status, String message) {
        return new FetchError(Kind.HTTP_STATUS, message, status);
    }

    public static FetchError of(Kind kind, String message) {
        return new FetchError(kind, message, null);
    }
}
