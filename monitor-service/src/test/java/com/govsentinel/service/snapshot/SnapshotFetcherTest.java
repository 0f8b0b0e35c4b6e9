package com.govsentinel.service.snapshot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.govsentinel.core.model.WatchedEntity;
import com.govsentinel.core.orchestrator.FetchException;
import com.govsentinel.core.ratelimit.RateLimitedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SnapshotFetcher} response parsing.
 */
class SnapshotFetcherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final SnapshotFetcher fetcher = SnapshotFetcher.builder().mapper(mapper).build();

    private JsonNode fixture(String name) throws IOException {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("fixtures/snapshot/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return mapper.readTree(in);
        }
    }

    @Test
    @DisplayName("Should map active proposals to entities with proposal URLs")
    void shouldMapActiveProposals() throws IOException {
        List<WatchedEntity> entities = fetcher.parseBatch("aave.eth", fixture("space-active.json"));

        assertThat(entities).hasSize(2);
        WatchedEntity first = entities.get(0);
        assertThat(first.getId()).isEqualTo("0xabc");
        assertThat(first.getStatus()).isEqualTo("active");
        assertThat(first.getTitle()).contains("Raise the ETH borrow cap");
        assertThat(first.getUrl()).contains("https://snapshot.org/#/aave.eth/proposal/0xabc");
        assertThat(first.getAttribute("end")).contains(1718100000.0);
    }

    @Test
    @DisplayName("Should return an empty batch for a space with nothing active")
    void shouldReturnEmptyBatch() throws IOException {
        assertThat(fetcher.parseBatch("aave.eth", fixture("space-empty.json"))).isEmpty();
    }

    @Test
    @DisplayName("Should return null for a space the hub does not know")
    void shouldReturnNullForUnknownSpace() throws IOException {
        assertThat(fetcher.parseBatch("gone.eth", fixture("space-missing.json"))).isNull();
    }

    @Test
    @DisplayName("Should signal throttling when the hub reports Too Many Requests")
    void shouldSignalRateLimit() throws IOException {
        JsonNode response = fixture("rate-limited.json");

        assertThatThrownBy(() -> fetcher.parseBatch("aave.eth", response))
                .isInstanceOf(RateLimitedException.class);
    }

    @Test
    @DisplayName("Should raise a fetch error for other GraphQL errors")
    void shouldFailOnGraphQlError() throws IOException {
        JsonNode response = mapper.readTree("{\"errors\":[{\"message\":\"Syntax Error\"}]}");

        assertThatThrownBy(() -> fetcher.parseBatch("aave.eth", response))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("Syntax Error");
    }

    @Test
    @DisplayName("Should report the current state of a tracked proposal")
    void shouldReadTrackedProposal() throws IOException {
        WatchedEntity entity = fetcher.parseTracked("aave.eth", "0xabc", fixture("proposal-closed.json"));

        assertThat(entity.getStatus()).isEqualTo("closed");
        assertThat(entity.getTitle()).contains("Raise the ETH borrow cap");
    }

    @Test
    @DisplayName("Should report a vanished proposal as deleted")
    void shouldReportVanishedProposalAsDeleted() throws IOException {
        JsonNode response = mapper.readTree("{\"data\":{\"proposal\":null}}");

        WatchedEntity entity = fetcher.parseTracked("aave.eth", "0xabc", response);

        assertThat(entity.getStatus()).isEqualTo(SnapshotFetcher.DELETED_STATUS);
        assertThat(entity.getTitle()).contains("Proposal 0xabc was deleted from aave.eth");
        assertThat(entity.getUrl()).contains("https://snapshot.org/#/aave.eth/proposal/0xabc");
    }

    @Test
    @DisplayName("Should map HTTP 429 to a rate-limit signal and other statuses to fetch errors")
    void shouldMapHttpStatus() {
        assertThatThrownBy(() -> fetcher.readResponse(429, ""))
                .isInstanceOf(RateLimitedException.class);
        assertThatThrownBy(() -> fetcher.readResponse(502, "bad gateway"))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("502");
    }
}
