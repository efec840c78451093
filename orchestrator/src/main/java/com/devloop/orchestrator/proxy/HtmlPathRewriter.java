package com.devloop.orchestrator.proxy;

import org.springframework.stereotype.Component;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites root-relative URLs in agent HTML so they resolve under the proxy prefix.
 *
 * Handles {@code src="/…"}, {@code href="/…"}, {@code action="/…"} and
 * {@code url(/…)} with or without quotes. Protocol-relative {@code //host}
 * references and absolute URLs are left untouched.
 */
@Component
public class HtmlPathRewriter {

    private final Pattern srcHref = Pattern.compile("(src|href)=\"(/(?!/)[^\"]*)");
    private final Pattern cssUrl  = Pattern.compile("url\\((['\"]?)(/(?!/)[^)\"']*)");
    private final Pattern action  = Pattern.compile("action=\"(/(?!/)[^\"]*)");

    public String rewrite(String html, String prefix) {
        if (html == null || html.isEmpty()) {
            return html;
        }
        String out = replace(srcHref, html, m -> m.group(1) + "=\"" + prefix + m.group(2));
        out = replace(cssUrl, out, m -> "url(" + m.group(1) + prefix + m.group(2));
        out = replace(action, out, m -> "action=\"" + prefix + m.group(1));
        return out;
    }

    private static String replace(Pattern pattern, String input,
                                  Function<Matcher, String> replacement) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder(input.length() + 64);
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement.apply(m)));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
