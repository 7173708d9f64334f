package com.sandkev.canvasio.shared.http;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses RFC 5988 {@code Link} headers as Canvas sends them:
 * {@code <https://x/api/v1/courses?page=2&per_page=10>; rel="next", <...>; rel="last"}.
 */
public final class LinkHeader {

    private static final Pattern ENTRY = Pattern.compile("<([^>]*)>\\s*((?:;\\s*[^,;]+)*)");
    private static final Pattern REL = Pattern.compile("rel\\s*=\\s*\"?([^\";]+)\"?");

    private LinkHeader() {}

    /** rel -> url; a rel listing several names ({@code rel="next last"}) maps each of them. */
    public static Map<String, String> parse(String header) {
        var out = new LinkedHashMap<String, String>();
        if (header == null || header.isBlank()) return out;

        Matcher m = ENTRY.matcher(header);
        while (m.find()) {
            String url = m.group(1).trim();
            Matcher rel = REL.matcher(m.group(2));
            if (!rel.find()) continue;
            for (String name : rel.group(1).trim().split("\\s+")) {
                out.putIfAbsent(name, url);
            }
        }
        return out;
    }
}
