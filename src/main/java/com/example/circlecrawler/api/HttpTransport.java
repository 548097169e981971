package com.example.circlecrawler.api;

import java.io.IOException;
import java.net.URI;
import java.util.Map;

/**
 * Performs a GET and returns whatever status and body the server answered with.
 * Implementations may retry transient failures; callers never do.
 */
@FunctionalInterface
public interface HttpTransport {
    HttpFetchResult get(URI uri, Map<String, String> headers) throws IOException, InterruptedException;
}
