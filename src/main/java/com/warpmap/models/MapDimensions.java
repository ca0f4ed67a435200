package com.warpmap.models;

/**
 * Width and height of a map, in blocks, as declared by its map_const line.
 */
public record MapDimensions(int width, int height) {
}
