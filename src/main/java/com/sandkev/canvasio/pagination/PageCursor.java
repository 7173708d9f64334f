package com.sandkev.canvasio.pagination;

import com.sandkev.canvasio.shared.http.LinkHeader;
import org.springframework.lang.Nullable;

/** Pointer to the next page of a list response; an empty {@code nextUrl} marks the last page. */
public record PageCursor(@Nullable String nextUrl) {

    private static final PageCursor TERMINAL = new PageCursor(null);

    public static PageCursor terminal() {
        return TERMINAL;
    }

    public static PageCursor fromLinkHeader(@Nullable String linkHeader) {
        String next = LinkHeader.parse(linkHeader).get("next");
        return next == null || next.isBlank() ? TERMINAL : new PageCursor(next);
    }

    public boolean hasNext() {
        return nextUrl != null;
    }
}
