package com.restaurantai.chat.service;

public class StoreUnavailableException extends RuntimeException {
    /**
     * Creates an exception describing a failed durable-store call, preserving the originating cause.
     */
    public StoreUnavailableException(String m, Throwable c) { super(m, c); }
}
