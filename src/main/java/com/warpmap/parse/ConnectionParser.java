package com.warpmap.parse;

import com.warpmap.models.ConnectionDirection;
import com.warpmap.models.MapConnection;

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
 * Reads connection lines from a map header file:
 *   connection north, Route1, ROUTE_1, 0
 * The whole file is scanned. The second column (label) is discarded.
 */
public class ConnectionParser {

    private static final Pattern CONNECTION =
        Pattern.compile("\\s*connection\\s+(north|south|east|west),\\s+(\\w+),\\s+(\\w+),\\s+(-?\\d+)");

    public List<MapConnection> parse(Path headerFile) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(headerFile, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public List<MapConnection> parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);
        List<MapConnection> connections = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            MapConnection connection = parseLine(line);
            if (connection != null) {
                connections.add(connection);
            }
        }
        return connections;
    }

    static MapConnection parseLine(String line) {
        Matcher m = CONNECTION.matcher(line);
        if (!m.lookingAt()) {
            return null;
        }
        Integer offset = ParseNumbers.parseIntOrNull(m.group(4));
        if (offset == null) {
            return null;
        }
        return new MapConnection(ConnectionDirection.fromToken(m.group(1)), m.group(3), offset);
    }
}
