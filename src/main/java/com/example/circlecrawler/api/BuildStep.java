package com.example.circlecrawler.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A named phase of a build with its actions in execution order.
 */
public record BuildStep(
        String name,
        List<Action> actions
) {
    @JsonCreator
    public BuildStep(@JsonProperty("name") String name,
                     @JsonProperty("actions") List<Action> actions) {
        this.name = name;
        this.actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
