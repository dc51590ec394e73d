package org.tapline.records;

import java.util.Set;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Persisted incremental-build metadata of one compiler.
 * <p>
 * The content is an opaque JSON object owned by plugins (for example to keep assigned
 * identifiers stable between builds). Child compilers keep their records nested inside
 * their parent's records: under the shortened child name, as a list with one object per
 * spawn index. A child {@code Records} instance is a live view on that nested object, so
 * writes made by the child are part of the parent's records.
 * <p>
 * Not thread-safe; records are only touched by the build attempt that owns them.
 */
public final class Records {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private final JsonObject root;

    /**
     * Creates an empty store.
     */
    public Records() {
        this(new JsonObject());
    }

    private Records(JsonObject root) {
        this.root = root;
    }

    /**
     * Parses persisted records.
     *
     * @param json the file content.
     * @return the parsed store.
     * @throws RecordsParseException if the content is not valid JSON or its root is not an object.
     */
    public static Records parse(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new RecordsParseException(e.getMessage(), e);
        }
        if (element == null || !element.isJsonObject()) {
            throw new RecordsParseException("expected a JSON object at the root but found "
                    + (element == null || element.isJsonNull() ? "nothing" : element.toString()));
        }
        return new Records(element.getAsJsonObject());
    }

    /**
     * Returns the records of a child compiler, creating them if needed.
     * <p>
     * An existing object at {@code index} is reused so a child spawned at the same position
     * in a later build sees what it stored before. Otherwise a new empty object is stored at
     * that position; missing lower positions are filled with empty objects.
     *
     * @param name  the shortened child compiler name.
     * @param index the spawn index among siblings of the same name.
     * @return a live view on the child's records.
     */
    public Records childRecords(String name, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Child index must not be negative: " + index);
        }
        JsonElement existing = root.get(name);
        JsonArray list;
        if (existing != null && existing.isJsonArray()) {
            list = existing.getAsJsonArray();
        } else {
            list = new JsonArray();
            root.add(name, list);
        }
        while (list.size() < index) {
            list.add(new JsonObject());
        }
        if (index < list.size() && list.get(index).isJsonObject()) {
            return new Records(list.get(index).getAsJsonObject());
        }
        JsonObject created = new JsonObject();
        if (index < list.size()) {
            list.set(index, created);
        } else {
            list.add(created);
        }
        return new Records(created);
    }

    /**
     * @return the number of record entries stored for a child name.
     */
    public int childCount(String name) {
        JsonElement existing = root.get(name);
        return existing != null && existing.isJsonArray() ? existing.getAsJsonArray().size() : 0;
    }

    public JsonElement get(String key) {
        return root.get(key);
    }

    public void put(String key, JsonElement value) {
        root.add(key, value);
    }

    public boolean has(String key) {
        return root.has(key);
    }

    public JsonElement remove(String key) {
        return root.remove(key);
    }

    public Set<String> keys() {
        return root.keySet();
    }

    public boolean isEmpty() {
        return root.size() == 0;
    }

    /**
     * Serializes the store with two-space indentation.
     */
    public String toJson() {
        return GSON.toJson(root);
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
