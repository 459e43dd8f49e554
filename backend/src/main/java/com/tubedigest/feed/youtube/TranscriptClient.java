package com.tubedigest.feed.youtube;

import com.tubedigest.feed.model.TranscriptText;

import java.util.Optional;

public interface TranscriptClient {

    /**
     * Fetches and cleans the captions of a video. A video without captions yields an empty result.
     *
     * @throws TranscriptFetchException when the caption service could not be read
     */
    Optional<TranscriptText> fetch(String videoId);
}
