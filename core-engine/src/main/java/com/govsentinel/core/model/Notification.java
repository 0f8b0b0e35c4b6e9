package com.govsentinel.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Transport-neutral notification payload produced by a
 * {@link com.govsentinel.core.dispatch.NotificationFormatter}.
 *
 * <p>
 * {@code anchorHint} is the only field the dispatcher relies on
 * structurally: when present, the notifier posts the message as a threaded
 * reply to that anchor.
 * </p>
 *
 * @since 1.0.0
 */
public final class Notification {

    private final TransitionOutcome kind;
    private final String title;
    private final String body;
    private final String actionLink;
    private final String actionText;
    private final String anchorHint;
    private final String channel;

    private Notification(Builder b) {
        this.kind = Objects.requireNonNull(b.kind, "kind must not be null");
        this.title = Objects.requireNonNull(b.title, "title must not be null");
        this.body = b.body != null ? b.body : "";
        this.actionLink = b.actionLink;
        this.actionText = b.actionText;
        this.anchorHint = b.anchorHint;
        this.channel = b.channel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this notification's fields
     */
    public Builder toBuilder() {
        return new Builder()
                .kind(kind)
                .title(title)
                .body(body)
                .actionLink(actionLink)
                .actionText(actionText)
                .anchorHint(anchorHint)
                .channel(channel);
    }

    public static class Builder {
        private TransitionOutcome kind;
        private String title;
        private String body;
        private String actionLink;
        private String actionText;
        private String anchorHint;
        private String channel;

        public Builder kind(TransitionOutcome kind) {
            this.kind = kind;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder body(String body) {
            this.body = body;
            return this;
        }

        public Builder actionLink(String actionLink) {
            this.actionLink = actionLink;
            return this;
        }

        public Builder actionText(String actionText) {
            this.actionText = actionText;
            return this;
        }

        public Builder anchorHint(String anchorHint) {
            this.anchorHint = anchorHint;
            return this;
        }

        public Builder channel(String channel) {
            this.channel = channel;
            return this;
        }

        public Notification build() {
            return new Notification(this);
        }
    }

    public TransitionOutcome getKind() {
        return kind;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }

    public Optional<String> getActionLink() {
        return Optional.ofNullable(actionLink);
    }

    public Optional<String> getActionText() {
        return Optional.ofNullable(actionText);
    }

    public Optional<String> getAnchorHint() {
        return Optional.ofNullable(anchorHint);
    }

    public Optional<String> getChannel() {
        return Optional.ofNullable(channel);
    }

    @Override
    public String toString() {
        return "Notification{" +
                "kind=" + kind +
                ", title='" + title + '\'' +
                ", anchorHint='" + anchorHint + '\'' +
                ", channel='" + channel + '\'' +
                '}';
    }
}
