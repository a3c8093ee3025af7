package com.integration.mergequeue.exception;

import lombok.Getter;

/**
 * A call to the code hosting platform failed: unexpected status code or no response at all.
 */
@Getter
public class ForgeApiException extends RuntimeException {

    private final int status;

    public ForgeApiException(int status, String message) {
        super(message);
        this.status = status;
    }

    public ForgeApiException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
