package com.tubedigest.feed.model;

public record Summary(String title, String text) {}
