package com.example.circlecrawler.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of the CircleCI v1.1 API: projects, their builds, the steps of a build
 * and the raw log of each step action. Each call is a single GET through the transport.
 */
public class CircleCiClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(CircleCiClient.class);

    public static final URI DEFAULT_BASE_URL = URI.create("https://circleci.com/api/v1.1/");
    static final String TOKEN_HEADER = "Circle-Token";

    private static final TypeReference<List<Project>> PROJECTS = new TypeReference<>() {
    };
    private static final TypeReference<List<Build>> BUILDS = new TypeReference<>() {
    };

    private final HttpTransport transport;
    private final URI baseUrl;
    private final String token;
    private final ObjectMapper mapper;

    public CircleCiClient(HttpTransport transport, URI baseUrl, String token) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.baseUrl = withTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.token = Objects.requireNonNull(token, "token");
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<Project> listProjects() throws CircleCiException, InterruptedException {
        List<Project> projects = getJson(baseUrl.resolve("projects"), mapper.readerFor(PROJECTS));
        return projects == null ? List.of() : projects;
    }

    public List<Build> listBuilds(Project project) throws CircleCiException, InterruptedException {
        List<Build> builds = getJson(projectUri(project, ""), mapper.readerFor(BUILDS));
        return builds == null ? List.of() : builds;
    }

    public List<BuildStep> listSteps(Project project, Build build) throws CircleCiException, InterruptedException {
        BuildDetail detail = getJson(projectUri(project, "/" + build.buildNum()), mapper.readerFor(BuildDetail.class));
        if (detail == null || detail.steps() == null) {
            return List.of();
        }
        return detail.steps();
    }

    /**
     * Downloads the raw output of an action. The output URL is used as given; it usually points
     * at a different host than the API, so the token is only sent when the hosts match.
     */
    public byte[] fetchLogBody(Action action) throws CircleCiException, InterruptedException {
        if (action.outputUrl() == null || action.outputUrl().isBlank()) {
            throw new TransportException("action " + action.index() + " has no output url");
        }
        URI uri;
        try {
            uri = URI.create(action.outputUrl());
        } catch (IllegalArgumentException ex) {
            throw new TransportException("malformed output url " + action.outputUrl(), ex);
        }
        Map<String, String> headers = Objects.equals(uri.getHost(), baseUrl.getHost())
                ? apiHeaders()
                : Map.of("Accept", "application/json");
        return fetch(uri, headers).bodyOrEmpty();
    }

    private <T> T getJson(URI uri, ObjectReader reader) throws CircleCiException, InterruptedException {
        HttpFetchResult result = fetch(uri, apiHeaders());
        try {
            T value = reader.readValue(result.bodyOrEmpty());
            if (value == null) {
                LOGGER.debug("GET {} returned an empty document", uri);
            }
            return value;
        } catch (IOException ex) {
            throw new DecodeException("malformed response from " + uri, ex);
        }
    }

    private HttpFetchResult fetch(URI uri, Map<String, String> headers) throws CircleCiException, InterruptedException {
        HttpFetchResult result;
        try {
            result = transport.get(uri, headers);
        } catch (IOException ex) {
            throw new TransportException("GET " + uri + " failed", ex);
        }
        if (result.isClientError()) {
            throw new AuthException(uri.toString(), result.statusCode());
        }
        if (result.statusCode() >= 500) {
            throw new TransportException("GET " + uri + " failed with status " + result.statusCode());
        }
        return result;
    }

    private Map<String, String> apiHeaders() {
        return Map.of(
                TOKEN_HEADER, token,
                "Accept", "application/json"
        );
    }

    private URI projectUri(Project project, String suffix) {
        return baseUrl.resolve("project/"
                + segment(project.vcsType()) + "/"
                + segment(project.username()) + "/"
                + segment(project.reponame())
                + suffix);
    }

    private static String segment(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static URI withTrailingSlash(URI uri) {
        String value = uri.toString();
        return value.endsWith("/") ? uri : URI.create(value + "/");
    }

    private record BuildDetail(@JsonProperty("steps") List<BuildStep> steps) {
    }
}
