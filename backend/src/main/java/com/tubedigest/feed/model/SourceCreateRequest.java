package com.tubedigest.feed.model;

public record SourceCreateRequest(String channelRef, String name, String url) {}
