package uk.gegc.trivia.shared.pagination;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Offset pagination over an already ordered, fully materialised result list.
 * Pages are 1-based.
 */
public final class Paginator {

    public static final int DEFAULT_PAGE = 1;

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private Paginator() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Parses the raw {@code page} query parameter, falling back to {@link #DEFAULT_PAGE}
     * when it is absent or not a number. Numbers outside the {@code int} range saturate,
     * so they still address a page past the end.
     */
    public static int resolvePage(String rawPage) {
        if (rawPage == null || rawPage.isBlank()) {
            return DEFAULT_PAGE;
        }
        String trimmed = rawPage.trim();
        if (!INTEGER.matcher(trimmed).matches()) {
            return DEFAULT_PAGE;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            return trimmed.startsWith("-") ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
    }

    /**
     * Returns the items of the given page, clipped to the list bounds. Pages past the end,
     * and pages below 1, yield an empty list.
     */
    public static <T> List<T> slice(List<T> items, int page, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
        if (page < 1 || items.isEmpty()) {
            return List.of();
        }
        long start = (long) (page - 1) * pageSize;
        if (start >= items.size()) {
            return List.of();
        }
        int end = (int) Math.min(items.size(), start + pageSize);
        return List.copyOf(items.subList((int) start, end));
    }
}
