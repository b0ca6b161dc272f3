package com.prime.client.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the {@code data.json} and {@code op.json} listings into resource descriptors.
 *
 * <p>The listing is the first array of objects found in the payload, whatever
 * envelope it sits in. Attribute names are accepted with or without the
 * {@code @} prefix the API uses for JSON-mapped XML attributes. Relative URLs
 * are resolved against the API base URL.</p>
 */
class CatalogParser {
    private static final Logger log = LoggerFactory.getLogger(CatalogParser.class);

    private static final String[] NAME_KEYS = {"displayName", "@displayName", "name", "$"};
    private static final String[] DATA_URL_KEYS = {"urlTemplate", "@urlTemplate", "url", "@url", "path", "@path"};
    private static final String[] METHOD_KEYS = {"httpMethod", "@httpMethod", "method"};
    private static final String[] SERVICE_URL_KEYS = {"path", "@path", "url", "@url", "urlTemplate"};

    private final URI baseUri;

    CatalogParser(String baseUrl) {
        this.baseUri = URI.create(baseUrl);
    }

    List<ResourceDescriptor> parseDataResources(JsonNode payload) {
        List<ResourceDescriptor> resources = new ArrayList<>();
        for (JsonNode entry : listing(payload)) {
            String name = text(entry, NAME_KEYS);
            String url = text(entry, DATA_URL_KEYS);
            if (name == null || url == null) {
                log.debug("Skipping data catalog entry without name or url: {}", entry);
                continue;
            }
            resources.add(ResourceDescriptor.data(name, resolve(url)));
        }
        return resources;
    }

    List<ResourceDescriptor> parseServiceResources(JsonNode payload) {
        List<ResourceDescriptor> resources = new ArrayList<>();
        for (JsonNode entry : listing(payload)) {
            String name = text(entry, NAME_KEYS);
            String url = text(entry, SERVICE_URL_KEYS);
            if (name == null || url == null) {
                log.debug("Skipping service catalog entry without name or path: {}", entry);
                continue;
            }
            resources.add(ResourceDescriptor.service(name, text(entry, METHOD_KEYS), resolve(url)));
        }
        return resources;
    }

    String resolve(String url) {
        String relative = url.startsWith("/") && baseUri.getPath() != null && url.startsWith(baseUri.getPath())
                ? url : url.replaceFirst("^/+", "");
        return baseUri.resolve(relative).toString();
    }

    private static List<JsonNode> listing(JsonNode payload) {
        JsonNode array = findObjectArray(payload);
        List<JsonNode> entries = new ArrayList<>();
        if (array != null) {
            array.forEach(entries::add);
        }
        return entries;
    }

    private static JsonNode findObjectArray(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isArray()) {
            return node.size() > 0 && node.get(0).isObject() ? node : null;
        }
        if (node.isObject()) {
            for (JsonNode child : node) {
                JsonNode found = findObjectArray(child);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static String text(JsonNode entry, String[] keys) {
        for (String key : keys) {
            JsonNode value = entry.get(key);
            if (value != null && value.isValueNode() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
