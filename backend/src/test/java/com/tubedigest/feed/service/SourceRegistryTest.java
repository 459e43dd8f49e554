package com.tubedigest.feed.service;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.model.ResolvedChannel;
import com.tubedigest.feed.model.Source;
import com.tubedigest.feed.persistence.FeedJdbcRepository;
import com.tubedigest.feed.youtube.ChannelResolutionException;
import com.tubedigest.feed.youtube.YouTubeChannelResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceRegistryTest {
    private static final String HANDLE_URL = "https://www.youtube.com/@t3dotgg";
    private static final String CHANNEL_ID = "UCbRP3c757lWg9M-U7TyEkXA";

    @Mock
    private FeedJdbcRepository repository;

    @Mock
    private YouTubeChannelResolver channelResolver;

    private SourceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SourceRegistry(repository, new DigestProperties(), channelResolver);
    }

    @Test
    void channelUrlIsStoredUnderResolvedId() {
        when(channelResolver.pageUrl(HANDLE_URL)).thenReturn(HANDLE_URL);
        when(channelResolver.resolve(HANDLE_URL)).thenReturn(new ResolvedChannel(CHANNEL_ID, "Theo - t3.gg", HANDLE_URL));
        when(repository.insertSource(eq(CHANNEL_ID), eq("Theo - t3.gg"), eq(HANDLE_URL), any(), any())).thenReturn(5L);
        Source stored = source(5L, CHANNEL_ID, HANDLE_URL, true);
        when(repository.findSourceById(5L)).thenReturn(stored);

        assertThat(registry.register(HANDLE_URL, null, null)).isEqualTo(stored);
    }

    @Test
    void knownUrlIsNotResolvedAgain() {
        Source existing = source(3L, CHANNEL_ID, HANDLE_URL, true);
        when(channelResolver.pageUrl(HANDLE_URL)).thenReturn(HANDLE_URL);
        when(repository.findSourceByUrl(HANDLE_URL)).thenReturn(existing);

        assertThat(registry.register(HANDLE_URL, null, null)).isEqualTo(existing);
        verify(channelResolver, never()).resolve(anyString());
        verify(repository, never()).insertSource(anyString(), anyString(), anyString(), any(), any());
    }

    @Test
    void differentUrlForKnownChannelReturnsExistingSource() {
        String otherUrl = "https://www.youtube.com/c/Theo";
        Source existing = source(3L, CHANNEL_ID, HANDLE_URL, true);
        when(channelResolver.pageUrl(otherUrl)).thenReturn(otherUrl);
        when(channelResolver.resolve(otherUrl)).thenReturn(new ResolvedChannel(CHANNEL_ID, "Theo", otherUrl));
        when(repository.findSourceByChannelRef(CHANNEL_ID)).thenReturn(existing);

        assertThat(registry.register(otherUrl, null, null)).isEqualTo(existing);
        verify(repository, never()).insertSource(anyString(), anyString(), anyString(), any(), any());
    }

    @Test
    void unresolvableUrlIsNotStored() {
        when(channelResolver.pageUrl("@nobody")).thenReturn("https://www.youtube.com/@nobody");
        when(channelResolver.resolve("@nobody")).thenThrow(new ChannelResolutionException("not found", "HTTP_404"));

        assertThatThrownBy(() -> registry.register("@nobody", null, null)).isInstanceOf(ChannelResolutionException.class);
        verify(repository, never()).insertSource(anyString(), anyString(), anyString(), any(), any());
    }

    @Test
    void plainChannelIdSkipsResolution() {
        Source existing = source(4L, CHANNEL_ID, "https://www.youtube.com/channel/" + CHANNEL_ID, true);
        when(repository.findSourceByChannelRef(CHANNEL_ID)).thenReturn(existing);

        assertThat(registry.register(CHANNEL_ID, null, null)).isEqualTo(existing);
        verify(channelResolver, never()).resolve(anyString());
    }

    private Source source(long id, String ref, String url, boolean active) {
        Instant now = Instant.parse("2024-05-01T00:00:00Z");
        return new Source(id, ref, "Theo", url, active, now, now);
    }
}
