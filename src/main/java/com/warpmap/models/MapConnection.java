package com.warpmap.models;

/**
 * One connection line of a map header. Only the constant-cased destination is
 * kept; the label column is dropped at parse time.
 */
public class MapConnection {
    private final ConnectionDirection direction;
    private final String destMap;
    private final int offset;

    public MapConnection(ConnectionDirection direction, String destMap, int offset) {
        this.direction = direction;
        this.destMap = destMap;
        this.offset = offset;
    }

    public ConnectionDirection getDirection() {
        return direction;
    }

    public String getDestMap() {
        return destMap;
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public String toString() {
        return "MapConnection{" + direction.token() + " -> " + destMap + " @" + offset + "}";
    }
}
