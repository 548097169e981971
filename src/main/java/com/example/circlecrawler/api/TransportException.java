package com.example.circlecrawler.api;

public class TransportException extends CircleCiException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
