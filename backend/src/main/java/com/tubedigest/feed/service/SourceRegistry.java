package com.tubedigest.feed.service;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.model.ResolvedChannel;
import com.tubedigest.feed.model.Source;
import com.tubedigest.feed.persistence.FeedJdbcRepository;
import com.tubedigest.feed.youtube.YouTubeChannelResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Monitored channels and their per-source watermarks. A watermark is the newest
 * publish time that has been fully resolved for that source and only ever moves forward.
 */
@Service
public class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final FeedJdbcRepository repository;
    private final DigestProperties properties;
    private final YouTubeChannelResolver channelResolver;

    public SourceRegistry(
        FeedJdbcRepository repository,
        DigestProperties properties,
        YouTubeChannelResolver channelResolver
    ) {
        this.repository = repository;
        this.properties = properties;
        this.channelResolver = channelResolver;
    }

    public List<Source> listActiveSources() {
        return repository.findActiveSources();
    }

    public List<Source> listAll() {
        return repository.findAllSources();
    }

    public Source getSource(long sourceId) {
        Source source = repository.findSourceById(sourceId);
        if (source == null) {
            throw new SourceNotFoundException(sourceId);
        }
        return source;
    }

    public Instant getWatermark(long sourceId) {
        return getSource(sourceId).watermark();
    }

    /**
     * Sets {@code watermark := max(watermark, ts)}. Returns true when the stored value moved.
     */
    public boolean advanceWatermark(long sourceId, Instant ts) {
        if (ts == null) {
            return false;
        }
        int updated = repository.advanceWatermark(sourceId, ts);
        if (updated > 0) {
            log.debug("Advanced watermark for source {} to {}", sourceId, ts);
            return true;
        }
        if (repository.findSourceById(sourceId) == null) {
            throw new SourceNotFoundException(sourceId);
        }
        return false;
    }

    @Transactional
    public void advanceWatermarks(Map<Long, Instant> targets) {
        for (Map.Entry<Long, Instant> entry : targets.entrySet()) {
            advanceWatermark(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Registers a channel by id, channel URL or {@code @handle}. URLs and handles are
     * resolved to the channel id first. A channel that is already known, by page URL or
     * by id, is returned as is (and re-activated if it had been removed) rather than
     * added a second time.
     *
     * @throws com.tubedigest.feed.youtube.ChannelResolutionException when a URL or handle
     *     cannot be resolved
     */
    public Source register(String channelRef, String name, String url) {
        if (channelRef == null || channelRef.isBlank()) {
            throw new IllegalArgumentException("channelRef is required");
        }
        String ref = channelRef.trim();
        String link = (url == null || url.isBlank()) ? null : url.trim();
        String resolvedName = null;
        if (YouTubeChannelResolver.needsResolution(ref)) {
            String pageUrl = channelResolver.pageUrl(ref);
            Source byUrl = repository.findSourceByUrl(pageUrl);
            if (byUrl != null) {
                return reactivated(byUrl);
            }
            ResolvedChannel resolved = channelResolver.resolve(ref);
            ref = resolved.channelId();
            resolvedName = resolved.name();
            if (link == null) {
                link = resolved.url();
            }
        }
        Source existing = repository.findSourceByChannelRef(ref);
        if (existing != null) {
            return reactivated(existing);
        }
        Instant now = Instant.now();
        Instant watermark = now.minus(Duration.ofHours(properties.getRun().getInitialLookbackHours()));
        String displayName;
        if (name != null && !name.isBlank()) {
            displayName = name.trim();
        } else {
            displayName = resolvedName == null ? ref : resolvedName;
        }
        if (link == null) {
            link = "https://www.youtube.com/channel/" + ref;
        }
        long sourceId;
        try {
            sourceId = repository.insertSource(ref, displayName, link, watermark, now);
        } catch (DuplicateKeyException e) {
            // Lost a race with a concurrent registration of the same channel.
            return repository.findSourceByChannelRef(ref);
        }
        log.info("Registered source {} ({}) with watermark {}", sourceId, ref, watermark);
        return repository.findSourceById(sourceId);
    }

    private Source reactivated(Source existing) {
        if (existing.active()) {
            return existing;
        }
        repository.setSourceActive(existing.sourceId(), true);
        log.info("Re-activated source {} ({})", existing.sourceId(), existing.channelRef());
        return repository.findSourceById(existing.sourceId());
    }

    public void deactivate(long sourceId) {
        if (repository.setSourceActive(sourceId, false) == 0) {
            throw new SourceNotFoundException(sourceId);
        }
        log.info("Deactivated source {}", sourceId);
    }
}
