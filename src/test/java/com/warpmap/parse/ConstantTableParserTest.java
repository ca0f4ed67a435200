package com.warpmap.parse;

import com.warpmap.models.ConstantTable;
import com.warpmap.models.MapDimensions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstantTableParserTest {

    private final ConstantTableParser parser = new ConstantTableParser();

    @Test
    void assignsSequentialIdsWithDimensions() {
        ConstantTable table = parser.parseLines(List.of(
            "; map ids",
            "\tconst_def",
            "\tmap_const PALLET_TOWN,   10,  9 ; $00",
            "\tmap_const VIRIDIAN_CITY, 20, 18 ; $01",
            "\tmap_const ROUTE_1,       10, 18 ; $02"
        ));

        assertEquals(0, table.idOf("PALLET_TOWN"));
        assertEquals(1, table.idOf("VIRIDIAN_CITY"));
        assertEquals(2, table.idOf("ROUTE_1"));
        assertEquals(new MapDimensions(20, 18), table.dimensionsOf("VIRIDIAN_CITY"));
    }

    @Test
    void constDefResetsCounter() {
        ConstantTable table = parser.parseLines(List.of(
            "\tconst_def",
            "\tmap_const A_MAP, 1, 1",
            "\tmap_const B_MAP, 1, 1",
            "\tconst_def",
            "\tmap_const C_MAP, 1, 1"
        ));

        assertEquals(0, table.idOf("A_MAP"));
        assertEquals(1, table.idOf("B_MAP"));
        assertEquals(0, table.idOf("C_MAP"));
        assertEquals("A_MAP", table.nameOfId(0));
    }

    @Test
    void lastMapSentinelIsAlwaysPresentWithoutDimensions() {
        ConstantTable table = parser.parseLines(List.of());

        assertEquals(ConstantTable.LAST_MAP_ID, table.idOf(ConstantTable.LAST_MAP));
        assertNull(table.dimensionsOf(ConstantTable.LAST_MAP));
        assertNull(table.nameOfId(ConstantTable.LAST_MAP_ID));
    }

    @Test
    void malformedMapConstLinesAreSkipped() {
        ConstantTable table = parser.parseLines(List.of(
            "\tconst_def",
            "\tmap_const BROKEN_MAP, 10",
            "\tmap_const NAMED_DIMS, WIDTH, HEIGHT",
            "\tmap_const OVERFLOW_MAP, 99999999999, 1",
            "\tmap_const GOOD_MAP, 4, 4"
        ));

        assertFalse(table.contains("BROKEN_MAP"));
        assertFalse(table.contains("NAMED_DIMS"));
        assertFalse(table.contains("OVERFLOW_MAP"));
        assertEquals(0, table.idOf("GOOD_MAP"));
    }

    @Test
    void stepCarriesCounterAndTable() {
        ConstantTableParser.ParseState state = new ConstantTableParser.ParseState();
        state = ConstantTableParser.step(state, "\tmap_const A_MAP, 1, 2");
        state = ConstantTableParser.step(state, "not a directive");
        assertEquals(1, state.getCounter());
        state = ConstantTableParser.step(state, "\tconst_def");
        assertEquals(0, state.getCounter());
        assertEquals(new MapDimensions(1, 2), state.getTable().dimensionsOf("A_MAP"));
    }

    @Test
    void parsesFromReader() throws IOException {
        ConstantTable table = parser.parse(new StringReader("\tconst_def\n\tmap_const ROUTE_2, 10, 36\n"));
        assertEquals(0, table.idOf("ROUTE_2"));
        assertEquals(2, table.size());
    }

    @Test
    void missingFileIsFatal(@TempDir Path tempDir) {
        assertThrows(NoSuchFileException.class, () -> parser.parse(tempDir.resolve("map_constants.asm")));
    }
}
