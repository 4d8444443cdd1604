package com.openparking.common.util;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.Locale;

/**
 * Turns the API's 1-based {@code page}/{@code limit} query parameters into a {@link Pageable}.
 * Out-of-range values fall back to the defaults instead of failing the request.
 */
public final class Pagination {

    /** Escape character the repository LIKE queries declare with {@code ESCAPE}. */
    public static final char LIKE_ESCAPE = '!';

    private Pagination() {
    }

    public static Pageable of(Integer page, Integer limit, Sort sort) {
        int p = (page == null || page < 1) ? Constants.DEFAULT_PAGE : page;
        int l = (limit == null || limit < 1) ? Constants.DEFAULT_PAGE_SIZE : Math.min(limit, Constants.MAX_PAGE_SIZE);
        return PageRequest.of(p - 1, l, sort);
    }

    /**
     * Normalizes a free-text search term: null becomes empty, surrounding whitespace is dropped
     * and the term is lower-cased for the case-insensitive LIKE queries. LIKE wildcards in the
     * term are escaped with {@link #LIKE_ESCAPE} so they match literally.
     */
    public static String searchTerm(String search) {
        if (search == null) {
            return "";
        }
        String term = search.trim().toLowerCase(Locale.ROOT);
        StringBuilder escaped = new StringBuilder(term.length());
        for (char c : term.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
