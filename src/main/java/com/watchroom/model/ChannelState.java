package com.watchroom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Live channel state.
 */
@JsonIgnoreProperties(value = "type", allowGetters = true, ignoreUnknown = true)
public record ChannelState(String channelId, String channelName, String channelUrl) implements MediaState {

    public static final String TYPE = "live";

    @Override
    @JsonProperty("type")
    public String type() {
        return TYPE;
    }
}
