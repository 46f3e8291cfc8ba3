package com.restaurantai.chat.service;

/**
 * Unexpected failure inside the chat pipeline. The message is safe to show to end users.
 */
public class ChatPipelineException extends RuntimeException {
    public ChatPipelineException(String m, Throwable c) { super(m, c); }
}
