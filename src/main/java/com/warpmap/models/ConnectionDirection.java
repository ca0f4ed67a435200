package com.warpmap.models;

import java.util.Locale;

public enum ConnectionDirection {
    NORTH,
    SOUTH,
    EAST,
    WEST;

    public static ConnectionDirection fromToken(String token) {
        if (token == null) {
            return null;
        }
        switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "north":
                return NORTH;
            case "south":
                return SOUTH;
            case "east":
                return EAST;
            case "west":
                return WEST;
            default:
                return null;
        }
    }

    /**
     * North and south connections share a horizontal edge, so the overlap runs
     * along the width. East and west run along the height.
     */
    public boolean spansWidth() {
        return this == NORTH || this == SOUTH;
    }

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }
}
