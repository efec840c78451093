package com.devloop.orchestrator.completion;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds GitHub pull request URLs in command output.
 */
public class PullRequestUrlParser {

    public record PullRequestUrl(String url, int number) {}

    private final Pattern prUrl = Pattern.compile(
            "https://github\\.com/[^/\\s]+/[^/\\s]+/pull/(?<number>\\d+)", Pattern.CASE_INSENSITIVE);

    /** First PR URL in {@code text}, if any. */
    public Optional<PullRequestUrl> find(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = prUrl.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new PullRequestUrl(m.group(), Integer.parseInt(m.group("number"))));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
