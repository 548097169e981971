package com.example.circlecrawler.api;

/**
 * The API answered with a client error, which for this token means the credentials were rejected.
 */
public class AuthException extends CircleCiException {
    private final int statusCode;

    public AuthException(String url, int statusCode) {
        super("invalid credentials, status " + statusCode + " for " + url);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
