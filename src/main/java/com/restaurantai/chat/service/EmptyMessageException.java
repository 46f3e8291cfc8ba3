package com.restaurantai.chat.service;

public class EmptyMessageException extends RuntimeException {
    public EmptyMessageException() { super("Empty message"); }
}
