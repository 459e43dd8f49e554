package com.tubedigest.feed.youtube;

import com.tubedigest.feed.model.DiscoveredVideo;

import java.time.Instant;
import java.util.List;

public interface VideoDiscoveryClient {

    /**
     * Lists videos of a channel published strictly after {@code since}.
     *
     * @throws DiscoveryException when the channel cannot be read; {@link DiscoveryException#isTransient()}
     *     tells a provider or network hiccup apart from a bad channel reference
     */
    List<DiscoveredVideo> discover(String channelRef, Instant since);
}
