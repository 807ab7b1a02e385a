package com.forgeloop.orchestrator.tracker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.orchestrator.config.ForgeloopProperties;
import com.forgeloop.orchestrator.model.ItemState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link WorkItemTracker} backed by GitHub Issues (REST v3).
 *
 * Uses java.net.http.HttpClient, like ClaudeClient, so every header on the
 * wire is explicit. Issue numbers are the item ids. Pull requests, which the
 * issues endpoint also returns, are skipped when listing.
 */
public class GitHubWorkItemTracker implements WorkItemTracker {

    private static final Logger log = LoggerFactory.getLogger(GitHubWorkItemTracker.class);

    private static final String API_VERSION = "2022-11-28";
    private static final int PAGE_SIZE = 100;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       repoUrl;
    private final String       token;

    public GitHubWorkItemTracker(ForgeloopProperties.Github github, ObjectMapper objectMapper) {
        if (github.getOwner() == null || github.getRepo() == null) {
            throw new IllegalStateException("forgeloop.github.owner and forgeloop.github.repo must be set");
        }
        this.repoUrl = github.getBaseUrl() + "/repos/" + github.getOwner() + "/" + github.getRepo();
        this.token   = github.getToken();
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // WorkItemTracker
    // ------------------------------------------------------------------

    @Override
    public String createItem(String title, String body, Set<String> labels) {
        String payload = toJson(Map.of("title", title, "body", body == null ? "" : body, "labels", labels));
        JsonNode created = readTree(send("POST", "/issues", payload, "createItem '" + title + "'"));
        String id = created.path("number").asText();
        log.info("Created issue #{} '{}'", id, title);
        return id;
    }

    @Override
    public void closeItem(String id, String evidence) {
        if (evidence != null && !evidence.isBlank()) {
            comment(id, evidence);
        }
        send("PATCH", "/issues/" + id, toJson(Map.of("state", "closed")), "closeItem #" + id);
        log.info("Closed issue #{}", id);
    }

    @Override
    public List<ItemSummary> listItems(ItemFilter filter) {
        String state = filter.state() == null ? "all" : filter.state() == ItemState.OPEN ? "open" : "closed";
        StringBuilder query = new StringBuilder("?state=").append(state).append("&per_page=").append(PAGE_SIZE);
        if (!filter.labels().isEmpty()) {
            query.append("&labels=").append(URLEncoder.encode(String.join(",", filter.labels()), StandardCharsets.UTF_8));
        }

        List<ItemSummary> items = new ArrayList<>();
        for (int page = 1; ; page++) {
            JsonNode batch = readTree(send("GET", "/issues" + query + "&page=" + page, null, "listItems"));
            for (JsonNode issue : batch) {
                if (issue.has("pull_request")) continue;
                items.add(toSummary(issue));
            }
            if (batch.size() < PAGE_SIZE) break;
        }
        return items;
    }

    @Override
    public void comment(String id, String body) {
        send("POST", "/issues/" + id + "/comments", toJson(Map.of("body", body)), "comment on #" + id);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private ItemSummary toSummary(JsonNode issue) {
        Set<String> labels = new LinkedHashSet<>();
        for (JsonNode label : issue.path("labels")) {
            labels.add(label.path("name").asText());
        }
        ItemState state = "closed".equals(issue.path("state").asText()) ? ItemState.CLOSED : ItemState.OPEN;
        return new ItemSummary(issue.path("number").asText(), issue.path("title").asText(), state, labels);
    }

    private String send(String method, String path, String jsonBody, String opName) {
        try {
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(repoUrl + path))
                    .timeout(Duration.ofSeconds(30))
                    .header("Accept", "application/vnd.github+json")
                    .header("X-GitHub-Api-Version", API_VERSION)
                    .method(method, jsonBody == null
                            ? HttpRequest.BodyPublishers.noBody()
                            : HttpRequest.BodyPublishers.ofString(jsonBody));
            if (jsonBody != null) {
                req.header("Content-Type", "application/json");
            }
            if (token != null && !token.isBlank()) {
                req.header("Authorization", "Bearer " + token);
            }
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() == 404) {
                throw new TrackerException(TrackerException.Kind.NOT_FOUND, opName + " failed: HTTP 404");
            }
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new TrackerException(TrackerException.Kind.REJECTED,
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (TrackerException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrackerException(TrackerException.Kind.UNREACHABLE, opName + " interrupted", e);
        } catch (Exception e) {
            throw new TrackerException(TrackerException.Kind.UNREACHABLE, opName + " failed", e);
        }
    }

    private JsonNode readTree(String body) {
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TrackerException(TrackerException.Kind.REJECTED, "Unparsable tracker response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new TrackerException(TrackerException.Kind.REJECTED, "JSON serialization failed", e);
        }
    }
}
