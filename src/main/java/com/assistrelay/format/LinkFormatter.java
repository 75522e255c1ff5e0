package com.assistrelay.format;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites markdown links {@code [label](url)} into Slack's {@code <url|label>} form.
 *
 * <p>Matching is loose and has to stay compatible with replies already posted: the label runs
 * from the first {@code [} to the first {@code ]} after it, and the url from the first {@code (}
 * after the {@code [} to the first {@code )} after the {@code [}. Brackets are not checked for
 * nesting or order. Indexes that cross produce an empty piece rather than an error.
 */
public final class LinkFormatter {

    private static final Logger log = LoggerFactory.getLogger(LinkFormatter.class);
    private static final long GROWTH_FACTOR = 64;
    private static final long MIN_LIMIT = 1 << 16;

    private LinkFormatter() {}

    public static String formatLinks(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        var formatted = text;
        // some malformed inputs copy '[' back into the text and grow without end
        long limit = Math.max(text.length() * GROWTH_FACTOR, MIN_LIMIT);
        while (true) {
            int start = formatted.indexOf('[');
            if (start == -1) break;
            int end = formatted.indexOf(')', start);
            if (end == -1) break;

            var label = slice(formatted, start + 1, formatted.indexOf(']', start));
            var url = slice(formatted, formatted.indexOf('(', start) + 1, end);
            var next = formatted.substring(0, start)
                    + "<" + url + "|" + label + ">"
                    + formatted.substring(end + 1);
            if (next.length() > limit) {
                log.warn("Link rewrite of a {}-char message exceeded {} chars, stopping", text.length(), limit);
                break;
            }
            formatted = next;
        }
        return formatted;
    }

    // lenient substring: a negative end counts back from the tail, crossed bounds give ""
    private static String slice(String s, int from, int to) {
        int len = s.length();
        if (to < 0) to = Math.max(len + to, 0);
        from = Math.min(Math.max(from, 0), len);
        to = Math.min(to, len);
        return from < to ? s.substring(from, to) : "";
    }
}
