package com.casesentinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A normalized, timeline-ready record derived from a {@link Match},
 * {@link Anomaly} or {@link Threat}.
 *
 * <p>
 * Immutable. {@code timestamp} is either canonical
 * {@code yyyy-MM-dd HH:mm:ss} text or absent. {@code event},
 * {@code artifact} and {@code level} are required.
 * </p>
 *
 * @since 1.0.0
 */
public final class Finding {

    private final String timestamp;
    private final String deviceName;
    private final String account;
    private final String event;
    private final String artifact;
    private final String eventId;
    private final String analyst;
    private final String comments;
    private final ThreatLevel level;

    private Finding(Builder builder) {
        this.timestamp = builder.timestamp;
        this.deviceName = builder.deviceName;
        this.account = builder.account;
        this.event = Objects.requireNonNull(builder.event, "event must not be null");
        this.artifact = Objects.requireNonNull(builder.artifact, "artifact must not be null");
        this.eventId = builder.eventId;
        this.analyst = builder.analyst != null ? builder.analyst : "";
        this.comments = builder.comments != null ? builder.comments : "";
        this.level = Objects.requireNonNull(builder.level, "level must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with this finding's fields
     */
    public Builder toBuilder() {
        return new Builder()
                .timestamp(timestamp)
                .deviceName(deviceName)
                .account(account)
                .event(event)
                .artifact(artifact)
                .eventId(eventId)
                .analyst(analyst)
                .comments(comments)
                .level(level);
    }

    /**
     * Fluent builder for {@link Finding} instances.
     */
    public static class Builder {
        private String timestamp;
        private String deviceName;
        private String account;
        private String event;
        private String artifact;
        private String eventId;
        private String analyst;
        private String comments;
        private ThreatLevel level;

        public Builder timestamp(String timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder deviceName(String deviceName) {
            this.deviceName = deviceName;
            return this;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder event(String event) {
            this.event = event;
            return this;
        }

        public Builder artifact(String artifact) {
            this.artifact = artifact;
            return this;
        }

        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public Builder analyst(String analyst) {
            this.analyst = analyst;
            return this;
        }

        public Builder comments(String comments) {
            this.comments = comments;
            return this;
        }

        public Builder level(ThreatLevel level) {
            this.level = level;
            return this;
        }

        public Finding build() {
            return new Finding(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * @return canonical timestamp text, or {@code null} when none could be
     *         resolved
     */
    @JsonProperty("timestamp")
    public String getTimestamp() {
        return timestamp;
    }

    @JsonProperty("device_name")
    public String getDeviceName() {
        return deviceName;
    }

    @JsonProperty("account")
    public String getAccount() {
        return account;
    }

    @JsonProperty("event")
    public String getEvent() {
        return event;
    }

    @JsonProperty("artifact")
    public String getArtifact() {
        return artifact;
    }

    @JsonProperty("event_id")
    public String getEventId() {
        return eventId;
    }

    @JsonProperty("analyst")
    public String getAnalyst() {
        return analyst;
    }

    @JsonProperty("comments")
    public String getComments() {
        return comments;
    }

    @JsonProperty("level")
    public ThreatLevel getLevel() {
        return level;
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Finding that))
            return false;
        return Objects.equals(timestamp, that.timestamp)
                && Objects.equals(deviceName, that.deviceName)
                && Objects.equals(account, that.account)
                && event.equals(that.event)
                && artifact.equals(that.artifact)
                && Objects.equals(eventId, that.eventId)
                && analyst.equals(that.analyst)
                && comments.equals(that.comments)
                && level == that.level;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, deviceName, account, event, artifact, eventId, analyst, comments, level);
    }

    @Override
    public String toString() {
        return "Finding{" +
                "timestamp='" + timestamp + '\'' +
                ", artifact='" + artifact + '\'' +
                ", level=" + level +
                ", event='" + event + '\'' +
                '}';
    }
}
