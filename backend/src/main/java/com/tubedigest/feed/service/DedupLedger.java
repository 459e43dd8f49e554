package com.tubedigest.feed.service;

import com.tubedigest.feed.model.ProcessedRecord;
import com.tubedigest.feed.persistence.ProcessedVideoRepository;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class DedupLedger {
    private final ProcessedVideoRepository repository;

    public DedupLedger(ProcessedVideoRepository repository) {
        this.repository = repository;
    }

    public boolean hasProcessed(String videoId) {
        return repository.exists(videoId);
    }

    public void markProcessed(ProcessedRecord record) {
        try {
            repository.insert(record);
        } catch (DuplicateKeyException e) {
            throw new DuplicateVideoException(record.videoId(), e);
        }
    }

    public ProcessedRecord find(String videoId) {
        return repository.findById(videoId);
    }

    public List<ProcessedRecord> findByRun(long runId) {
        return repository.findByRun(runId);
    }

    public List<ProcessedRecord> findLatest(int limit) {
        return repository.findLatest(limit);
    }
}
