package com.govsentinel.service.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.govsentinel.core.model.WatchedEntity;
import com.govsentinel.core.orchestrator.FetchException;
import com.govsentinel.core.orchestrator.Fetcher;
import com.govsentinel.core.ratelimit.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link Fetcher} for Snapshot spaces, backed by the hub GraphQL API.
 *
 * <h3>Mapping</h3>
 * <ul>
 * <li>scope: Snapshot space id (e.g. {@code aave.eth})</li>
 * <li>entity id: proposal id</li>
 * <li>status: proposal {@code state} ({@code active}, {@code closed})</li>
 * <li>attributes: {@code start} and {@code end} as epoch seconds</li>
 * </ul>
 *
 * <p>
 * A space the hub does not know yields a {@code null} batch. A tracked
 * proposal the hub no longer returns is reported with status
 * {@value #DELETED_STATUS}.
 * </p>
 *
 * @since 1.0.0
 */
public class SnapshotFetcher implements Fetcher {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotFetcher.class);

    public static final URI DEFAULT_ENDPOINT = URI.create("https://hub.snapshot.org/graphql");
    public static final String DEFAULT_PROPOSAL_BASE = "https://snapshot.org/#/";
    public static final String DELETED_STATUS = "deleted";

    private static final String PROPOSAL_FIELDS =
            "id title state start end space { id name }";

    static final String BATCH_QUERY =
            "query Proposals($space: String!) { "
                    + "space(id: $space) { id name } "
                    + "proposals(first: 1000, where: { space_in: [$space], state: \"active\" }, "
                    + "orderBy: \"created\", orderDirection: desc) { " + PROPOSAL_FIELDS + " } }";

    static final String PROPOSAL_QUERY =
            "query Proposal($id: String!) { proposal(id: $id) { " + PROPOSAL_FIELDS + " } }";

    private final URI endpoint;
    private final String proposalBase;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    private SnapshotFetcher(Builder b) {
        this.mapper = Objects.requireNonNull(b.mapper, "mapper must not be null");
        this.endpoint = b.endpoint != null ? b.endpoint : DEFAULT_ENDPOINT;
        this.proposalBase = b.proposalBase != null ? b.proposalBase : DEFAULT_PROPOSAL_BASE;
        this.timeout = b.timeout != null ? b.timeout : Duration.ofSeconds(30);
        this.httpClient = b.httpClient != null
                ? b.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<WatchedEntity> fetchBatch(String scope) {
        ObjectNode variables = mapper.createObjectNode().put("space", scope);
        return parseBatch(scope, post(BATCH_QUERY, variables));
    }

    @Override
    public Optional<WatchedEntity> fetchTracked(String scope, String entityId) {
        ObjectNode variables = mapper.createObjectNode().put("id", entityId);
        return Optional.of(parseTracked(scope, entityId, post(PROPOSAL_QUERY, variables)));
    }

    // ---------------------------------------------------------------
    // Response parsing
    // ---------------------------------------------------------------

    List<WatchedEntity> parseBatch(String scope, JsonNode response) {
        checkErrors(response, "space " + scope);
        JsonNode data = response.path("data");
        if (data.path("space").isNull() || data.path("space").isMissingNode()) {
            LOG.info("Space {} not found", scope);
            return null;
        }
        List<WatchedEntity> entities = new ArrayList<>();
        for (JsonNode proposal : data.path("proposals")) {
            entities.add(toEntity(scope, proposal));
        }
        LOG.debug("Space {}: {} active proposals", scope, entities.size());
        return entities;
    }

    WatchedEntity parseTracked(String scope, String entityId, JsonNode response) {
        checkErrors(response, "proposal " + entityId);
        JsonNode proposal = response.path("data").path("proposal");
        if (proposal.isNull() || proposal.isMissingNode()) {
            LOG.info("Proposal {} in {} no longer exists; reporting it as {}", entityId, scope, DELETED_STATUS);
            return WatchedEntity.builder()
                    .id(entityId)
                    .status(DELETED_STATUS)
                    .title("Proposal " + entityId + " was deleted from " + scope)
                    .url(proposalUrl(scope, entityId))
                    .build();
        }
        return toEntity(scope, proposal);
    }

    private WatchedEntity toEntity(String scope, JsonNode proposal) {
        String id = proposal.path("id").asText();
        String space = proposal.path("space").path("id").asText(scope);
        WatchedEntity.Builder builder = WatchedEntity.builder()
                .id(id)
                .status(proposal.path("state").asText())
                .title(proposal.path("title").asText(null))
                .url(proposalUrl(space, id));
        if (proposal.path("start").isNumber()) {
            builder.attribute("start", proposal.path("start").asDouble());
        }
        if (proposal.path("end").isNumber()) {
            builder.attribute("end", proposal.path("end").asDouble());
        }
        return builder.build();
    }

    private String proposalUrl(String space, String id) {
        return proposalBase + space + "/proposal/" + id;
    }

    private static void checkErrors(JsonNode response, String subject) {
        JsonNode errors = response.path("errors");
        if (!errors.isArray() || errors.isEmpty()) {
            return;
        }
        for (JsonNode error : errors) {
            if (error.toString().contains("Too Many Requests")) {
                throw new RateLimitedException("Snapshot rate limited the request for " + subject);
            }
        }
        throw new FetchException("Snapshot returned errors for " + subject + ": " + errors);
    }

    // ---------------------------------------------------------------
    // Transport
    // ---------------------------------------------------------------

    private JsonNode post(String query, ObjectNode variables) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("query", query);
        payload.set("variables", variables);

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload)))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new FetchException("Snapshot request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Snapshot request interrupted", e);
        }
        return readResponse(response.statusCode(), response.body());
    }

    JsonNode readResponse(int statusCode, String body) {
        if (statusCode == 429) {
            throw new RateLimitedException("Snapshot returned HTTP 429");
        }
        if (statusCode != 200) {
            throw new FetchException("Snapshot returned HTTP " + statusCode + ": " + body);
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchException("Unreadable Snapshot response: " + e.getOriginalMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private URI endpoint;
        private String proposalBase;
        private Duration timeout;
        private ObjectMapper mapper;
        private HttpClient httpClient;

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder proposalBase(String proposalBase) {
            this.proposalBase = proposalBase;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public SnapshotFetcher build() {
            return new SnapshotFetcher(this);
        }
    }
}
