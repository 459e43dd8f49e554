package com.tubedigest.feed.model;

public record ResolvedChannel(String channelId, String name, String url) {}
