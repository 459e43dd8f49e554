package com.tubedigest.feed.api;

import com.tubedigest.feed.model.Digest;
import com.tubedigest.feed.model.ProcessedRecord;
import com.tubedigest.feed.service.DedupLedger;
import com.tubedigest.feed.service.DigestService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class DigestController {
    private final DigestService digestService;
    private final DedupLedger dedupLedger;

    public DigestController(DigestService digestService, DedupLedger dedupLedger) {
        this.digestService = digestService;
        this.dedupLedger = dedupLedger;
    }

    @GetMapping("/summaries/latest")
    public List<ProcessedRecord> latest(@RequestParam(name = "limit", required = false, defaultValue = "20") int limit) {
        return dedupLedger.findLatest(limit);
    }

    @GetMapping("/digest")
    public Digest digest(
        @RequestParam(name = "date", required = false) String date,
        @RequestParam(name = "runId", required = false) Long runId
    ) {
        if (runId != null) {
            return digestService.digestForRun(runId);
        }
        return digestService.digestForDate(parseDate(date));
    }

    private LocalDate parseDate(String raw) {
        if (raw == null || raw.isBlank()) {
            return LocalDate.now(ZoneOffset.UTC);
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ResponseStatusException(BAD_REQUEST, "date must be YYYY-MM-DD");
        }
    }
}
