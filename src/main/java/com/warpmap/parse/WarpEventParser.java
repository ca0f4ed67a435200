package com.warpmap.parse;

import com.warpmap.models.WarpEvent;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the warp_event lines of a map object file, in file order.
 * Only lines between def_warp_events and the next def_bg_events or
 * def_object_events count.
 */
public class WarpEventParser {

    private static final Pattern WARP_EVENT =
        Pattern.compile("\\s*warp_event\\s+(\\d+),\\s+(\\d+),\\s+(\\w+),\\s+(\\d+)");
    private static final String SECTION_START = "def_warp_events";
    private static final String BG_EVENTS = "def_bg_events";
    private static final String OBJECT_EVENTS = "def_object_events";

    public List<WarpEvent> parse(Path mapFile) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(mapFile, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public List<WarpEvent> parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);
        List<WarpEvent> warps = new ArrayList<>();
        boolean inWarpSection = false;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.contains(SECTION_START)) {
                inWarpSection = true;
                continue;
            }
            if (!inWarpSection) {
                continue;
            }
            if (line.contains(BG_EVENTS) || line.contains(OBJECT_EVENTS)) {
                break;
            }
            WarpEvent warp = parseLine(line);
            if (warp != null) {
                warps.add(warp);
            }
        }
        return warps;
    }

    static WarpEvent parseLine(String line) {
        Matcher m = WARP_EVENT.matcher(line);
        if (!m.lookingAt()) {
            return null;
        }
        Integer x = ParseNumbers.parseIntOrNull(m.group(1));
        Integer y = ParseNumbers.parseIntOrNull(m.group(2));
        Integer index = ParseNumbers.parseIntOrNull(m.group(4));
        if (x == null || y == null || index == null) {
            return null;
        }
        return new WarpEvent(x, y, m.group(3), index);
    }
}
