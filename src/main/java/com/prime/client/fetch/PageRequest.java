package com.prime.client.fetch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One page of a bulk fetch: its position, offset and the effective query
 * parameters (the caller's parameters plus the paging keys).
 *
 * @param index    0-based page index, ascending with offset
 * @param offset   first record of the page
 * @param pageSize records requested; the last page may return fewer
 * @param params   effective query parameters, unmodifiable
 */
public record PageRequest(int index, long offset, int pageSize, Map<String, Object> params) {

    public static final String FULL = ".full";
    public static final String FIRST_RESULT = ".firstResult";
    public static final String MAX_RESULTS = ".maxResults";

    public PageRequest {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0");
        }
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * Splits {@code count} records into pages of {@code pageSize}: offsets
     * 0, pageSize, 2*pageSize, ... while the offset is below the count.
     * The base parameters are copied, never modified.
     */
    public static List<PageRequest> partition(Map<String, ?> baseParams, long count, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0");
        }
        List<PageRequest> pages = new ArrayList<>();
        int index = 0;
        for (long offset = 0; offset < count; offset += pageSize) {
            Map<String, Object> params = new LinkedHashMap<>();
            if (baseParams != null) {
                params.putAll(baseParams);
            }
            params.put(FULL, "true");
            params.put(FIRST_RESULT, offset);
            params.put(MAX_RESULTS, pageSize);
            pages.add(new PageRequest(index++, offset, pageSize, params));
        }
        return pages;
    }

    /**
     * Groups pages into consecutive chunks of at most {@code concurrency} pages.
     */
    public static List<List<PageRequest>> chunk(List<PageRequest> pages, int concurrency) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        List<List<PageRequest>> chunks = new ArrayList<>();
        for (int start = 0; start < pages.size(); start += concurrency) {
            chunks.add(List.copyOf(pages.subList(start, Math.min(start + concurrency, pages.size()))));
        }
        return chunks;
    }
}
