package com.dev.queuebot.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "title", "url", "duration", "user", "userid"})
public class SongEntry {

    public static final int DEFAULT_DURATION_SECONDS = 30;

    String id;

    String title;

    String url;

    @JsonProperty("duration")
    int durationSeconds;

    @JsonProperty("user")
    String requestedBy;

    @JsonProperty("userid")
    String requestedByUserId;

    public boolean hasSameId(SongEntry other) {
        return other != null && id != null && id.equals(other.id);
    }

    /**
     * Entries written by legacy producers carry no id and are matched on content.
     */
    public boolean isSameSong(SongEntry other) {
        if (other == null) {
            return false;
        }
        if (id != null && other.id != null) {
            return id.equals(other.id);
        }
        return durationSeconds == other.durationSeconds
                && Objects.equals(title, other.title)
                && Objects.equals(url, other.url)
                && Objects.equals(requestedBy, other.requestedBy)
                && Objects.equals(requestedByUserId, other.requestedByUserId);
    }

    public SongEntry withPlayableDuration() {
        if (durationSeconds > 0) {
            return this;
        }
        return toBuilder().durationSeconds(DEFAULT_DURATION_SECONDS).build();
    }
}
