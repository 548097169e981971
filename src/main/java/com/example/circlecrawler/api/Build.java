package com.example.circlecrawler.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Build(
        @JsonProperty("build_num") int buildNum
) {
}
