package com.example.circlecrawler.api;

public record HttpFetchResult(int statusCode, byte[] body) {
    public boolean isClientError() {
        return statusCode > 399 && statusCode < 500;
    }

    public byte[] bodyOrEmpty() {
        return body == null ? new byte[0] : body;
    }
}
