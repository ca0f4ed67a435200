package com.warpmap.models;

/**
 * A warp whose destination index resolved to a concrete warp tile.
 * Kept for consumers that need tile coordinates; the graph itself ignores them.
 */
public record ResolvedWarp(int sourceId, int sourceX, int sourceY, int destId, int destX, int destY) {
}
