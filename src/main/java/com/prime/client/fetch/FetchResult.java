package com.prime.client.fetch;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Records of a completed bulk fetch, concatenated in ascending page offset.
 *
 * @param resourceName  the data resource the records came from
 * @param url           the resource URL
 * @param reportedCount record count reported by the count probe
 * @param pageCount     number of page requests issued
 * @param entities      the records, unmodifiable
 */
public record FetchResult(String resourceName, String url, long reportedCount, int pageCount,
                          List<JsonNode> entities) {

    public FetchResult {
        entities = entities != null ? List.copyOf(entities) : List.of();
    }

    /**
     * A copy whose records are deep copies, so changes to either side stay invisible to the other.
     */
    public FetchResult deepCopy() {
        return new FetchResult(resourceName, url, reportedCount, pageCount,
                entities.stream().<JsonNode>map(JsonNode::deepCopy).toList());
    }

    public static FetchResult empty(String resourceName, String url) {
        return new FetchResult(resourceName, url, 0, 0, List.of());
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    /**
     * Whether the server returned as many records as the count probe announced.
     */
    public boolean isComplete() {
        return entities.size() == reportedCount;
    }
}
