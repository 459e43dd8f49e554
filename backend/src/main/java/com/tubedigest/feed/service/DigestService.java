package com.tubedigest.feed.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.model.Digest;
import com.tubedigest.feed.model.DigestItem;
import com.tubedigest.feed.model.ProcessedRecord;
import com.tubedigest.feed.persistence.ProcessedVideoRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Projects summarized ledger rows into the daily digest and optionally writes it out
 * as pretty-printed JSON.
 */
@Service
public class DigestService {
    private static final Logger log = LoggerFactory.getLogger(DigestService.class);

    private final ProcessedVideoRepository repository;
    private final ObjectMapper objectMapper;
    private final DigestProperties properties;

    public DigestService(ProcessedVideoRepository repository, ObjectMapper objectMapper, DigestProperties properties) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public static Digest fromRecords(LocalDate date, List<ProcessedRecord> records) {
        List<DigestItem> items = records.stream()
            .filter(ProcessedRecord::isSummarized)
            .map(r -> new DigestItem(r.videoId(), r.title(), r.summary(), r.link(), r.publishedAt()))
            .toList();
        return new Digest(date, items.size(), items);
    }

    public Digest digestForRun(long runId) {
        return fromRecords(LocalDate.now(ZoneOffset.UTC), repository.findByRun(runId));
    }

    public Digest digestForDate(LocalDate date) {
        return fromRecords(
            date,
            repository.findSummarizedBetween(
                date.atStartOfDay().toInstant(ZoneOffset.UTC),
                date.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC)
            )
        );
    }

    /**
     * Builds the digest for a finished cycle and writes it when output is enabled.
     */
    public Digest publishRun(long runId) {
        Digest digest = digestForRun(runId);
        if (properties.getOutput().isEnabled() && digest.count() > 0) {
            writeToFile(digest, Path.of(properties.getOutput().getPath()));
        }
        return digest;
    }

    public void writeToFile(Digest digest, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), digest);
            log.info("Wrote digest with {} item(s) to {}", digest.count(), target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write digest to " + target, e);
        }
    }
}
