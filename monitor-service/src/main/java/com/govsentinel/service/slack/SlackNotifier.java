package com.govsentinel.service.slack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.govsentinel.core.dispatch.Notifier;
import com.govsentinel.core.model.Notification;
import com.govsentinel.core.model.SendResult;
import com.govsentinel.core.ratelimit.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link Notifier} posting Block Kit messages through Slack's
 * {@code chat.postMessage}.
 *
 * <p>
 * The returned anchor is the message {@code ts}. Follow-ups carry it as
 * {@code thread_ts} and are broadcast back to the channel.
 * </p>
 *
 * <pre>
 * SlackNotifier notifier = SlackNotifier.builder()
 *     .botToken(System.getenv("SLACK_BOT_TOKEN"))
 *     .mapper(JsonMappers.create())
 *     .build();
 * </pre>
 *
 * @since 1.0.0
 */
public class SlackNotifier implements Notifier {

    private static final Logger LOG = LoggerFactory.getLogger(SlackNotifier.class);

    public static final URI DEFAULT_ENDPOINT = URI.create("https://slack.com/api/chat.postMessage");
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final String botToken;
    private final URI endpoint;
    private final Duration timeout;
    private final boolean disableLinkPreviews;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    private SlackNotifier(Builder b) {
        this.botToken = Objects.requireNonNull(b.botToken, "botToken must not be null");
        this.mapper = Objects.requireNonNull(b.mapper, "mapper must not be null");
        this.endpoint = b.endpoint != null ? b.endpoint : DEFAULT_ENDPOINT;
        this.timeout = b.timeout != null ? b.timeout : DEFAULT_TIMEOUT;
        this.disableLinkPreviews = b.disableLinkPreviews;
        this.httpClient = b.httpClient != null
                ? b.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws RateLimitedException if Slack throttles the request
     */
    @Override
    public SendResult send(Notification notification) {
        String channel = notification.getChannel().orElse(null);
        if (channel == null || channel.isBlank()) {
            LOG.error("Notification '{}' has no channel", notification.getTitle());
            return SendResult.failed();
        }

        String body;
        try {
            body = mapper.writeValueAsString(buildPayload(notification));
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize Slack payload for '{}': {}", notification.getTitle(), e.getMessage(), e);
            return SendResult.failed();
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Authorization", "Bearer " + botToken)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return parseResponse(response.statusCode(), response.body());
        } catch (IOException e) {
            LOG.error("Slack request failed: {}", e.getMessage(), e);
            return SendResult.failed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Slack request interrupted");
            return SendResult.failed();
        }
    }

    // ---------------------------------------------------------------
    // Wire format
    // ---------------------------------------------------------------

    ObjectNode buildPayload(Notification notification) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("channel", notification.getChannel().orElse(null));
        payload.put("text", notification.getTitle() + ": " + notification.getBody());
        payload.put("unfurl_links", !disableLinkPreviews);
        payload.put("unfurl_media", false);

        ArrayNode blocks = payload.putArray("blocks");
        ObjectNode header = blocks.addObject().put("type", "header");
        header.putObject("text").put("type", "plain_text").put("text", notification.getTitle()).put("emoji", true);

        ObjectNode section = blocks.addObject().put("type", "section");
        section.putObject("text").put("type", "mrkdwn").put("text", notification.getBody());

        if (notification.getActionLink().isPresent()) {
            ObjectNode actions = blocks.addObject().put("type", "actions");
            ObjectNode button = actions.putArray("elements").addObject().put("type", "button");
            button.putObject("text").put("type", "plain_text")
                    .put("text", notification.getActionText().orElse("Open"))
                    .put("emoji", true);
            button.put("url", notification.getActionLink().get());
        }
        blocks.addObject().put("type", "divider");

        notification.getAnchorHint().ifPresent(anchor -> {
            payload.put("thread_ts", anchor);
            payload.put("reply_broadcast", true);
        });
        return payload;
    }

    /**
     * @throws RateLimitedException on HTTP 429 or a {@code ratelimited} error
     */
    SendResult parseResponse(int statusCode, String body) {
        if (statusCode == 429) {
            throw new RateLimitedException("Slack returned HTTP 429");
        }
        if (statusCode != 200) {
            LOG.error("Slack returned HTTP {}: {}", statusCode, body);
            return SendResult.failed();
        }
        JsonNode json;
        try {
            json = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            LOG.error("Unreadable Slack response: {}", e.getMessage());
            return SendResult.failed();
        }
        if (json.path("ok").asBoolean(false)) {
            String ts = json.path("ts").asText(null);
            return SendResult.delivered(ts);
        }
        String error = json.path("error").asText("unknown_error");
        if ("ratelimited".equals(error)) {
            throw new RateLimitedException("Slack rejected the message: ratelimited");
        }
        LOG.error("Slack rejected the message: {}", error);
        return SendResult.failed();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String botToken;
        private URI endpoint;
        private Duration timeout;
        private boolean disableLinkPreviews = true;
        private ObjectMapper mapper;
        private HttpClient httpClient;

        public Builder botToken(String botToken) {
            this.botToken = botToken;
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder disableLinkPreviews(boolean disableLinkPreviews) {
            this.disableLinkPreviews = disableLinkPreviews;
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

        public SlackNotifier build() {
            return new SlackNotifier(this);
        }
    }
}
