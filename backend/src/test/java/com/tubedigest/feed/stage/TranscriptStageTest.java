package com.tubedigest.feed.stage;

import com.tubedigest.feed.model.StageResult;
import com.tubedigest.feed.model.StageStatus;
import com.tubedigest.feed.model.TranscriptText;
import com.tubedigest.feed.util.ReasonCodeClassifier;
import com.tubedigest.feed.youtube.TranscriptClient;
import com.tubedigest.feed.youtube.TranscriptFetchException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TranscriptStageTest {

    @Mock
    private TranscriptClient transcriptClient;

    @InjectMocks
    private TranscriptStage stage;

    @Test
    void returnsTranscriptOnSuccess() {
        TranscriptText text = new TranscriptText("v1", "en", "hello there");
        when(transcriptClient.fetch("v1")).thenReturn(Optional.of(text));

        StageResult<TranscriptText> result = stage.fetch("v1");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).isEqualTo(text);
    }

    @Test
    void missingCaptionsAreUnavailable() {
        when(transcriptClient.fetch("v2")).thenReturn(Optional.empty());

        StageResult<TranscriptText> result = stage.fetch("v2");

        assertThat(result.status()).isEqualTo(StageStatus.UNAVAILABLE);
        assertThat(result.reasonCode()).isEqualTo(ReasonCodeClassifier.NO_TRANSCRIPT);
    }

    @Test
    void blankCaptionsAreUnavailable() {
        when(transcriptClient.fetch("v3")).thenReturn(Optional.of(new TranscriptText("v3", "en", "  ")));

        assertThat(stage.fetch("v3").status()).isEqualTo(StageStatus.UNAVAILABLE);
    }

    @Test
    void transientClientFailureIsTransient() {
        when(transcriptClient.fetch("v4"))
            .thenThrow(new TranscriptFetchException("503", ReasonCodeClassifier.HTTP_5XX, true));

        StageResult<TranscriptText> result = stage.fetch("v4");

        assertThat(result.status()).isEqualTo(StageStatus.TRANSIENT);
        assertThat(result.reasonCode()).isEqualTo(ReasonCodeClassifier.HTTP_5XX);
    }

    @Test
    void permanentClientFailureIsFatal() {
        when(transcriptClient.fetch("v5"))
            .thenThrow(new TranscriptFetchException("forbidden", ReasonCodeClassifier.HTTP_401_403, false));

        StageResult<TranscriptText> result = stage.fetch("v5");

        assertThat(result.status()).isEqualTo(StageStatus.FATAL);
        assertThat(result.reasonCode()).isEqualTo(ReasonCodeClassifier.TRANSCRIPT_FAILED);
    }

    @Test
    void unexpectedExceptionIsTransient() {
        when(transcriptClient.fetch("v6")).thenThrow(new IllegalStateException("boom"));

        assertThat(stage.fetch("v6").status()).isEqualTo(StageStatus.TRANSIENT);
    }
}
