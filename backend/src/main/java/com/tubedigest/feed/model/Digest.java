package com.tubedigest.feed.model;

import java.time.LocalDate;
import java.util.List;

public record Digest(LocalDate date, int count, List<DigestItem> items) {}
