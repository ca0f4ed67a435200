package com.warpmap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warpmap.graph.BuildReport.WarningType;
import com.warpmap.models.TransitionKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MapExtractionServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private AppConfig config(Path root, Path out) throws IOException {
        return new AppConfig.Builder()
            .root(root)
            .outputDir(out)
            .consoleEnabled(false)
            .build();
    }

    @Test
    void extractsWarpAndOverworldTransitions(@TempDir Path tempDir) throws IOException {
        Path root = TestCorpus.write(tempDir.resolve("pokered"));
        MapExtractionService service = new MapExtractionService(config(root, tempDir.resolve("out")));

        ExtractionResult result = service.extract();

        assertEquals(TestCorpus.expectedTransitionKeys(), new ArrayList<>(result.getGraph().asSortedMap().keySet()));
        assertEquals(TransitionKind.WARP, result.getGraph().kindOf(0, 3));
        assertEquals(TransitionKind.WARP, result.getGraph().kindOf(4, 3));
        assertEquals(TransitionKind.OVERWORLD, result.getGraph().kindOf(2, 1));
        assertEquals(4, result.getMapsWithWarps());
        assertEquals(3, result.getMapsWithConnections());
        assertEquals(3, result.getReport().getWarpsResolved());
        assertEquals(60, result.getReport().getOverworldWrites());
    }

    @Test
    void resolutionProblemsAreCountedNotThrown(@TempDir Path tempDir) throws IOException {
        Path root = TestCorpus.write(tempDir.resolve("pokered"));
        ExtractionResult result = new MapExtractionService(config(root, tempDir.resolve("out"))).extract();

        assertEquals(1, result.getReport().countWarnings(WarningType.INVALID_WARP_INDEX));
        assertEquals(2, result.getReport().countWarnings(WarningType.UNKNOWN_MAP));
        assertEquals(1, result.getReport().countWarnings(WarningType.MISSING_WARP_DATA));
        assertEquals(1, result.getUnmatchedFiles());
        assertEquals(5, result.getWarningCount());
    }

    @Test
    void writesSortedArtifacts(@TempDir Path tempDir) throws IOException {
        Path root = TestCorpus.write(tempDir.resolve("pokered"));
        AppConfig config = config(root, tempDir.resolve("out"));
        MapExtractionService service = new MapExtractionService(config);

        service.writeArtifacts(service.extract());

        JsonNode transitions = objectMapper.readTree(config.getTransitionsPath().toFile());
        List<String> keys = new ArrayList<>();
        transitions.fieldNames().forEachRemaining(keys::add);
        assertEquals(TestCorpus.expectedTransitionKeys(), keys);
        assertEquals("overworld", transitions.get("[0]-[2]").asText());
        assertEquals("warp", transitions.get("[3]-[4]").asText());

        JsonNode mapInfo = objectMapper.readTree(config.getMapInfoPath().toFile());
        List<String> sections = new ArrayList<>();
        mapInfo.fieldNames().forEachRemaining(sections::add);
        assertEquals(List.of("map_dimensions", "map_ids"), sections);
        assertEquals(255, mapInfo.get("map_ids").get("LAST_MAP").asInt());
        assertEquals(3, mapInfo.get("map_ids").get("REDS_HOUSE_1F").asInt());
        assertFalse(mapInfo.get("map_dimensions").has("LAST_MAP"));
        JsonNode viridian = mapInfo.get("map_dimensions").get("VIRIDIAN_CITY");
        assertEquals(20, viridian.get("width").asInt());
        assertEquals(18, viridian.get("height").asInt());

        List<String> names = new ArrayList<>();
        mapInfo.get("map_ids").fieldNames().forEachRemaining(names::add);
        List<String> sorted = new ArrayList<>(names);
        sorted.sort(null);
        assertEquals(sorted, names);
    }

    @Test
    void repeatedRunsProduceIdenticalBytes(@TempDir Path tempDir) throws IOException {
        Path root = TestCorpus.write(tempDir.resolve("pokered"));
        AppConfig config = config(root, tempDir.resolve("out"));
        MapExtractionService service = new MapExtractionService(config);

        service.writeArtifacts(service.extract());
        byte[] firstTransitions = Files.readAllBytes(config.getTransitionsPath());
        byte[] firstMapInfo = Files.readAllBytes(config.getMapInfoPath());

        service.writeArtifacts(service.extract());

        assertArrayEquals(firstTransitions, Files.readAllBytes(config.getTransitionsPath()));
        assertArrayEquals(firstMapInfo, Files.readAllBytes(config.getMapInfoPath()));
        String text = new String(firstTransitions, StandardCharsets.UTF_8);
        assertTrue(text.endsWith("}\n"));
        assertFalse(text.contains("\r"));
    }

    @Test
    void checkReportsNothingWhenArtifactsAreCurrent(@TempDir Path tempDir) throws IOException {
        Path root = TestCorpus.write(tempDir.resolve("pokered"));
        MapExtractionService service = new MapExtractionService(config(root, tempDir.resolve("out")));
        ExtractionResult result = service.extract();
        service.writeArtifacts(result);

        assertTrue(service.check(result).isEmpty());
    }

    @Test
    void checkReportsChangedArtifacts(@TempDir Path tempDir) throws IOException {
        Path root = TestCorpus.write(tempDir.resolve("pokered"));
        AppConfig config = config(root, tempDir.resolve("out"));
        MapExtractionService service = new MapExtractionService(config);
        service.writeArtifacts(service.extract());

        // Route 1 gains a warp into the upstairs room
        TestCorpus.write(root.resolve("data/maps/objects/Route1.asm"),
            TestCorpus.objectFile("Route1", "\twarp_event  1,  1, REDS_HOUSE_2F, 1"));
        Map<String, String> changed = service.check(service.extract());

        assertEquals(List.of(AppConfig.TRANSITIONS_FILE), new ArrayList<>(changed.keySet()));
        assertTrue(changed.get(AppConfig.TRANSITIONS_FILE).contains("+  \"[2]-[4]\""));
    }

    @Test
    void missingConstantsFileIsFatal(@TempDir Path tempDir) throws IOException {
        Path root = TestCorpus.write(tempDir.resolve("pokered"));
        Files.delete(root.resolve("constants/map_constants.asm"));
        MapExtractionService service = new MapExtractionService(config(root, tempDir.resolve("out")));

        assertThrows(NoSuchFileException.class, service::extract);
    }

    @Test
    void missingHeadersDirectoryIsFatal(@TempDir Path tempDir) throws IOException {
        Path root = TestCorpus.write(tempDir.resolve("pokered"));
        AppConfig config = new AppConfig.Builder()
            .root(root)
            .headersDir(tempDir.resolve("nope").toString())
            .outputDir(tempDir.resolve("out"))
            .build();

        assertThrows(NoSuchFileException.class, () -> new MapExtractionService(config).extract());
    }
}
