package com.tubedigest.feed.util;

import org.jsoup.parser.Parser;

import java.util.regex.Pattern;

public final class TranscriptTextCleaner {
    private static final Pattern BRACKETED_CUE = Pattern.compile("\\[[^\\]]*\\]");
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern REPEATED_DOTS = Pattern.compile("\\.{2,}");
    private static final Pattern REPEATED_BANGS = Pattern.compile("!{2,}");
    private static final Pattern REPEATED_QUESTIONS = Pattern.compile("\\?{2,}");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s+([.,!?;:])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TranscriptTextCleaner() {}

    public static String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        // Caption payloads are entity-escaped twice.
        String text = Parser.unescapeEntities(raw, false);
        text = HTML_TAG.matcher(text).replaceAll(" ");
        text = BRACKETED_CUE.matcher(text).replaceAll(" ");
        text = REPEATED_DOTS.matcher(text).replaceAll(".");
        text = REPEATED_BANGS.matcher(text).replaceAll("!");
        text = REPEATED_QUESTIONS.matcher(text).replaceAll("?");
        text = WHITESPACE.matcher(text).replaceAll(" ");
        text = SPACE_BEFORE_PUNCTUATION.matcher(text).replaceAll("$1");
        return text.trim();
    }
}
