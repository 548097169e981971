package com.example.circlecrawler.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A repository followed by the token's account, keyed by provider, owner and repository name.
 */
public record Project(
        @JsonProperty("vcs_type") String vcsType,
        @JsonProperty("username") String username,
        @JsonProperty("reponame") String reponame
) {
    @Override
    public String toString() {
        return vcsType + "/" + username + "/" + reponame;
    }
}
