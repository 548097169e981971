package com.example.circlecrawler.api;

public class DecodeException extends CircleCiException {
    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
