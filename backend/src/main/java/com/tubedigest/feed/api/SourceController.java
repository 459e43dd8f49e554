package com.tubedigest.feed.api;

import com.tubedigest.feed.model.Source;
import com.tubedigest.feed.model.SourceCreateRequest;
import com.tubedigest.feed.service.SourceRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/sources")
public class SourceController {
    private final SourceRegistry sourceRegistry;

    public SourceController(SourceRegistry sourceRegistry) {
        this.sourceRegistry = sourceRegistry;
    }

    @GetMapping
    public List<Source> list(@RequestParam(name = "activeOnly", required = false, defaultValue = "false") boolean activeOnly) {
        return activeOnly ? sourceRegistry.listActiveSources() : sourceRegistry.listAll();
    }

    @PostMapping
    public Source register(@RequestBody SourceCreateRequest request) {
        if (request == null || request.channelRef() == null || request.channelRef().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "channelRef is required");
        }
        return sourceRegistry.register(request.channelRef(), request.name(), request.url());
    }

    @GetMapping("/{id}")
    public Source get(@PathVariable("id") long sourceId) {
        return sourceRegistry.getSource(sourceId);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deactivate(@PathVariable("id") long sourceId) {
        sourceRegistry.deactivate(sourceId);
    }
}
