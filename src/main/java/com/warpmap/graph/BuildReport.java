package com.warpmap.graph;

import com.warpmap.models.ResolvedWarp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counters and warnings collected while building a transition graph.
 */
public class BuildReport {

    public enum WarningType {
        UNKNOWN_MAP,
        SENTINEL_SOURCE,
        MISSING_WARP_DATA,
        INVALID_WARP_INDEX,
        MISSING_DIMENSIONS
    }

    public record BuildWarning(WarningType type, String message) {
    }

    private final List<BuildWarning> warnings = new ArrayList<>();
    private final List<ResolvedWarp> resolvedWarps = new ArrayList<>();
    private int overworldWrites;

    public void addWarning(WarningType type, String message) {
        warnings.add(new BuildWarning(type, message));
    }

    public void addResolvedWarp(ResolvedWarp warp) {
        resolvedWarps.add(warp);
    }

    /**
     * Counts both directed keys, once per overlapping tile, so it runs well
     * above the number of distinct overworld pairs.
     */
    public void addOverworldWrites(int writes) {
        overworldWrites += writes;
    }

    public List<BuildWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public long countWarnings(WarningType type) {
        return warnings.stream().filter(w -> w.type() == type).count();
    }

    public List<ResolvedWarp> getResolvedWarps() {
        return Collections.unmodifiableList(resolvedWarps);
    }

    public int getWarpsResolved() {
        return resolvedWarps.size();
    }

    public int getOverworldWrites() {
        return overworldWrites;
    }
}
