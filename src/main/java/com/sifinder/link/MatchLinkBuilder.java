package com.sifinder.link;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a web link for a matched file whose name carries lesson and page ids
 * ({@code l_<lesson>p<page>}), e.g. {@code scan_l_12p3.png}.
 */
public class MatchLinkBuilder {
    static final String PLACEHOLDER_HOST = "your-website.com";
    private static final Pattern LESSON_PAGE = Pattern.compile("l_(\\d+)p(\\d+)");

    private final String baseUrl;

    public MatchLinkBuilder(String baseUrl) {
        this.baseUrl = baseUrl == null ? "" : baseUrl.strip();
    }

    public boolean isConfigured() {
        return !baseUrl.isEmpty() && !baseUrl.contains(PLACEHOLDER_HOST);
    }

    public Optional<String> linkFor(String matchPath) {
        if (!isConfigured() || matchPath == null) {
            return Optional.empty();
        }
        Path fileName = Path.of(matchPath).getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher matcher = LESSON_PAGE.matcher(fileName.toString());
        if (!matcher.find()) {
            return Optional.empty();
        }
        String separator = baseUrl.contains("?") ? "&" : "?";
        return Optional.of(baseUrl + separator + "lesson_id=" + matcher.group(1) + "&page_id=" + matcher.group(2));
    }
}
