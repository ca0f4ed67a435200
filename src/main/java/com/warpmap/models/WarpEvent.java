package com.warpmap.models;

/**
 * One warp_event line. The destination index is 1-based and points into the
 * destination map's own warp list.
 */
public class WarpEvent {
    private final int x;
    private final int y;
    private final String destMap;
    private final int destWarpIndex;

    public WarpEvent(int x, int y, String destMap, int destWarpIndex) {
        this.x = x;
        this.y = y;
        this.destMap = destMap;
        this.destWarpIndex = destWarpIndex;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public String getDestMap() {
        return destMap;
    }

    public int getDestWarpIndex() {
        return destWarpIndex;
    }

    @Override
    public String toString() {
        return "WarpEvent{" + x + ", " + y + " -> " + destMap + " #" + destWarpIndex + "}";
    }
}
