package com.warpmap.parse;

/**
 * Turns a map file name into the constant expected in map_constants.asm.
 * The result may not exist in the table; callers decide what to do then.
 */
public interface MapNameNormalizer {

    String toConstant(String fileStem);

    default String fromFileName(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return toConstant(dot > 0 ? fileName.substring(0, dot) : fileName);
    }
}
