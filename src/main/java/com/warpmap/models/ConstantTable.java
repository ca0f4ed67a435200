package com.warpmap.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Map constant name to id and dimension lookup, in declaration order.
 *
 * Ids are only unique within one const_def block. The LAST_MAP sentinel
 * carries id 255 and never has dimensions.
 */
public class ConstantTable {

    public static final String LAST_MAP = "LAST_MAP";
    public static final int LAST_MAP_ID = 0xFF;

    private final Map<String, Integer> ids = new LinkedHashMap<>();
    private final Map<String, MapDimensions> dimensions = new LinkedHashMap<>();

    public void define(String name, int id, MapDimensions dims) {
        ids.put(name, id);
        if (dims != null) {
            dimensions.put(name, dims);
        }
    }

    public void defineSentinel() {
        ids.put(LAST_MAP, LAST_MAP_ID);
        dimensions.remove(LAST_MAP);
    }

    public boolean contains(String name) {
        return name != null && ids.containsKey(name);
    }

    public Integer idOf(String name) {
        return name == null ? null : ids.get(name);
    }

    public MapDimensions dimensionsOf(String name) {
        if (name == null || LAST_MAP.equals(name)) {
            return null;
        }
        return dimensions.get(name);
    }

    /**
     * First declared name carrying the given id, ignoring the sentinel.
     */
    public String nameOfId(int id) {
        for (Map.Entry<String, Integer> entry : ids.entrySet()) {
            if (entry.getValue() == id && !LAST_MAP.equals(entry.getKey())) {
                return entry.getKey();
            }
        }
        return null;
    }

    public static boolean isSentinel(int id) {
        return id == LAST_MAP_ID;
    }

    public Map<String, Integer> getIds() {
        return Collections.unmodifiableMap(ids);
    }

    public Map<String, MapDimensions> getDimensions() {
        return Collections.unmodifiableMap(dimensions);
    }

    public int size() {
        return ids.size();
    }
}
