package com.example.circlecrawler.metadata;

/**
 * Where a chunk came from inside CircleCI, plus a link a human can open in the dashboard.
 */
public record CircleCiMetadata(
        String vcsType,
        String username,
        String repository,
        long buildNumber,
        String buildStep,
        String link
) {
}
