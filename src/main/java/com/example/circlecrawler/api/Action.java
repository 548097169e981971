package com.example.circlecrawler.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Leaf of the build tree. The output URL points at the raw log of a single action.
 */
public record Action(
        @JsonProperty("index") int index,
        @JsonProperty("output_url") String outputUrl
) {
}
