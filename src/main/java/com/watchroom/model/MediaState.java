package com.watchroom.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Shared playback state of a room: either an on-demand video or a live channel.
 * The {@code type} property carries the tag on the wire ("play" or "live").
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type", visible = true)
@JsonSubTypes({
    @JsonSubTypes.Type(value = PlaybackState.class, name = PlaybackState.TYPE),
    @JsonSubTypes.Type(value = ChannelState.class, name = ChannelState.TYPE)
})
public interface MediaState {

    String type();
}
