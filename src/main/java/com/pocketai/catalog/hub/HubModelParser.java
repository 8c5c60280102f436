package com.pocketai.catalog.hub;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.json.Json;
import jakarta.json.JsonArray;
import jakarta.json.JsonObject;
import jakarta.json.JsonReader;
import jakarta.json.JsonString;
import jakarta.json.JsonStructure;
import jakarta.json.JsonValue;

/**
 * Turns the hub's loosely typed model listing into {@link HubModelDescriptor}s.
 * All defaulting of missing or oddly shaped fields happens here, once.
 */
public class HubModelParser {

    private static final Logger log = LoggerFactory.getLogger(HubModelParser.class);

    private final String hubBaseUrl;

    public HubModelParser(String hubBaseUrl) {
        String base = hubBaseUrl == null ? "" : hubBaseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        this.hubBaseUrl = base;
    }

    /**
     * Parse a listing page. Accepts a bare array or an object wrapping the
     * array under {@code models} or {@code items}.
     *
     * @throws jakarta.json.JsonException when the body is not valid JSON
     */
    public List<HubModelDescriptor> parseListing(String body) {
        List<HubModelDescriptor> descriptors = new ArrayList<>();
        if (body == null || body.isBlank()) {
            return descriptors;
        }
        JsonStructure root;
        try (JsonReader reader = Json.createReader(new StringReader(body))) {
            root = reader.read();
        }
        for (JsonObject entry : entries(root)) {
            HubModelDescriptor descriptor = parse(entry);
            if (descriptor == null) {
                log.warn("Dropping hub listing entry without an id: {}", truncate(entry.toString()));
                continue;
            }
            descriptors.add(descriptor);
        }
        return descriptors;
    }

    /**
     * Parse a single listing entry.
     *
     * @return the descriptor, or {@code null} when the entry has no usable id
     */
    public HubModelDescriptor parse(JsonObject entry) {
        String id = getString(entry, "id");
        if (id == null || id.isBlank()) {
            id = getString(entry, "modelId");
        }
        if (id == null || id.isBlank()) {
            return null;
        }
        id = id.trim();

        JsonObject cardData = getObject(entry, "cardData");
        String description = "";
        if (cardData != null) {
            description = firstNonBlank(getString(cardData, "summary"), getString(cardData, "description"));
        }

        return HubModelDescriptor.builder(id)
                .displayName(lastSegment(id))
                .description(description)
                .tags(getStringList(entry, "tags"))
                .task(getString(entry, "pipeline_tag"))
                .license(licenseOf(cardData))
                .url(hubBaseUrl + "/" + id)
                .sha(getString(entry, "sha"))
                .privateModel(getBoolean(entry, "private"))
                .build();
    }

    private List<JsonObject> entries(JsonStructure root) {
        List<JsonObject> entries = new ArrayList<>();
        JsonArray array = null;
        if (root.getValueType() == JsonValue.ValueType.ARRAY) {
            array = root.asJsonArray();
        } else if (root.getValueType() == JsonValue.ValueType.OBJECT) {
            JsonObject obj = root.asJsonObject();
            for (String candidate : List.of("models", "items")) {
                JsonValue value = obj.get(candidate);
                if (value != null && value.getValueType() == JsonValue.ValueType.ARRAY) {
                    array = value.asJsonArray();
                    break;
                }
            }
        }
        if (array != null) {
            array.forEach(value -> {
                if (value instanceof JsonObject obj) {
                    entries.add(obj);
                }
            });
        }
        return entries;
    }

    private String licenseOf(JsonObject cardData) {
        if (cardData == null) {
            return "unknown";
        }
        JsonValue value = cardData.get("license");
        if (value instanceof JsonString js && !js.getString().isBlank()) {
            return js.getString();
        }
        // some cards list several licenses; the first one wins
        if (value instanceof JsonArray arr) {
            for (JsonValue item : arr) {
                if (item instanceof JsonString js && !js.getString().isBlank()) {
                    return js.getString();
                }
            }
        }
        return "unknown";
    }

    private static String lastSegment(String id) {
        int slash = id.lastIndexOf('/');
        return slash >= 0 ? id.substring(slash + 1) : id;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a;
        }
        if (b != null && !b.isBlank()) {
            return b;
        }
        return "";
    }

    private static String getString(JsonObject source, String key) {
        if (source == null || !source.containsKey(key)) {
            return null;
        }
        JsonValue value = source.get(key);
        if (value instanceof JsonString js) {
            return js.getString();
        }
        return null;
    }

    private static JsonObject getObject(JsonObject source, String key) {
        JsonValue value = source.get(key);
        return value instanceof JsonObject obj ? obj : null;
    }

    private static List<String> getStringList(JsonObject source, String key) {
        List<String> values = new ArrayList<>();
        JsonValue value = source.get(key);
        if (value instanceof JsonArray arr) {
            for (JsonValue item : arr) {
                if (item instanceof JsonString js) {
                    values.add(js.getString());
                }
            }
        }
        return values;
    }

    private static boolean getBoolean(JsonObject source, String key) {
        JsonValue value = source.get(key);
        return value != null && value.getValueType() == JsonValue.ValueType.TRUE;
    }

    private static String truncate(String text) {
        return text.length() > 256 ? text.substring(0, 256) + "..." : text;
    }
}
