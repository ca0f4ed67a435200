package com.warpmap.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warpmap.models.ConstantTable;
import com.warpmap.models.MapDimensions;

import java.util.Map;
import java.util.TreeMap;

/**
 * Shape of map_info.json: constant name to id, and constant name to dimensions.
 */
public class MapInfoDocument {

    private final Map<String, Integer> mapIds;
    private final Map<String, MapDimensions> mapDimensions;

    public MapInfoDocument(Map<String, Integer> mapIds, Map<String, MapDimensions> mapDimensions) {
        this.mapIds = new TreeMap<>(mapIds);
        this.mapDimensions = new TreeMap<>(mapDimensions);
    }

    public static MapInfoDocument from(ConstantTable table) {
        return new MapInfoDocument(table.getIds(), table.getDimensions());
    }

    @JsonProperty("map_ids")
    public Map<String, Integer> getMapIds() {
        return mapIds;
    }

    @JsonProperty("map_dimensions")
    public Map<String, MapDimensions> getMapDimensions() {
        return mapDimensions;
    }
}
