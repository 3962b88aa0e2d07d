package com.watchroom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * On-demand playback state: which video, which episode, and where the owner is.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = "type", allowGetters = true, ignoreUnknown = true)
public record PlaybackState(
        String url,
        double currentTime,
        @JsonProperty("isPlaying") boolean isPlaying,
        String videoId,
        String videoName,
        String videoYear,
        String searchTitle,
        Integer episode,
        String source) implements MediaState {

    public static final String TYPE = "play";

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
