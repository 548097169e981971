package com.example.circlecrawler.api;

/**
 * Base type for failures talking to the CircleCI API.
 */
public class CircleCiException extends Exception {
    public CircleCiException(String message) {
        super(message);
    }

    public CircleCiException(String message, Throwable cause) {
        super(message, cause);
    }
}
