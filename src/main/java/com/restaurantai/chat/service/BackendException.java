package com.restaurantai.chat.service;

/**
 * Failure of a generative backend call: transport error, non-2xx status or an unreadable body.
 */
public class BackendException extends RuntimeException {

    public static final int NO_STATUS = 0;

    private final int statusCode;
    private final String detail;

    public BackendException(String message, int statusCode, String detail) {
        super(message);
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public BackendException(String message, int statusCode, String detail, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.detail = detail;
    }

    /**
     * @return upstream HTTP status, or {@link #NO_STATUS} when the call never got a response
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getDetail() {
        return detail;
    }
}
