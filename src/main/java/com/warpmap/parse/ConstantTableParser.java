package com.warpmap.parse;

import com.warpmap.models.ConstantTable;
import com.warpmap.models.MapDimensions;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link ConstantTable} from map_constants.asm.
 *
 * Grammar:
 *   const_def                  -> counter back to 0
 *   map_const NAME, W, H       -> NAME gets the counter value, counter + 1
 *
 * Anything else is skipped, including map_const lines without two integer
 * dimensions. LAST_MAP (255) is added after the scan.
 */
public class ConstantTableParser {

    private static final Pattern MAP_CONST = Pattern.compile("\\s*map_const\\s+(\\w+),\\s+(\\d+),\\s+(\\d+)");
    private static final String CONST_DEF = "const_def";

    public ConstantTable parse(Path constantsFile) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(constantsFile, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    public ConstantTable parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);
        ParseState state = new ParseState();
        String line;
        while ((line = reader.readLine()) != null) {
            state = step(state, line);
        }
        return finish(state);
    }

    public ConstantTable parseLines(List<String> lines) {
        ParseState state = new ParseState();
        for (String line : lines) {
            state = step(state, line);
        }
        return finish(state);
    }

    static ParseState step(ParseState state, String line) {
        Matcher m = MAP_CONST.matcher(line);
        if (m.lookingAt()) {
            Integer width = ParseNumbers.parseIntOrNull(m.group(2));
            Integer height = ParseNumbers.parseIntOrNull(m.group(3));
            if (width == null || height == null) {
                return state;
            }
            state.table.define(m.group(1), state.counter, new MapDimensions(width, height));
            state.counter++;
        } else if (line.contains(CONST_DEF)) {
            state.counter = 0;
        }
        return state;
    }

    private static ConstantTable finish(ParseState state) {
        state.table.defineSentinel();
        return state.table;
    }

    /**
     * Running counter plus the table being filled.
     */
    static final class ParseState {
        private int counter;
        private final ConstantTable table = new ConstantTable();

        int getCounter() {
            return counter;
        }

        ConstantTable getTable() {
            return table;
        }
    }
}
