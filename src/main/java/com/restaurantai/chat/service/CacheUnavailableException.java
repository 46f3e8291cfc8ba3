package com.restaurantai.chat.service;

public class CacheUnavailableException extends RuntimeException {
    /**
     * Creates an exception describing an unreachable fast cache, preserving the originating cause.
     */
    public CacheUnavailableException(String m, Throwable c) { super(m, c); }
}
