package com.warpmap;

import com.warpmap.graph.TransitionConflictPolicy;
import com.warpmap.graph.TransitionGraphBuilder;
import com.warpmap.models.ConstantTable;
import com.warpmap.models.MapConnection;
import com.warpmap.models.WarpEvent;
import com.warpmap.parse.CamelCaseMapNameNormalizer;
import com.warpmap.parse.ConnectionParser;
import com.warpmap.parse.ConstantTableParser;
import com.warpmap.parse.MapNameNormalizer;
import com.warpmap.parse.WarpEventParser;
import com.warpmap.storage.ArtifactDiff;
import com.warpmap.storage.JsonStorage;
import com.warpmap.storage.MapInfoDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs one extraction: constants first, then every object and header file in
 * ascending file name order, then graph resolution and serialization.
 *
 * Missing inputs surface as IOException. Everything after the constants are
 * loaded is reported as warnings instead.
 */
public class MapExtractionService {

    private final AppConfig config;
    private final MapNameNormalizer normalizer;
    private final TransitionConflictPolicy policy;
    private final ConstantTableParser constantParser = new ConstantTableParser();
    private final WarpEventParser warpParser = new WarpEventParser();
    private final ConnectionParser connectionParser = new ConnectionParser();

    public MapExtractionService(AppConfig config) {
        this(config, new CamelCaseMapNameNormalizer(), TransitionConflictPolicy.LAST_WRITE_WINS);
    }

    public MapExtractionService(AppConfig config, MapNameNormalizer normalizer, TransitionConflictPolicy policy) {
        this.config = config;
        this.normalizer = normalizer;
        this.policy = policy;
    }

    public ExtractionResult extract() throws IOException {
        config.validateInputs();

        AppLogger.logInfo("Parsing map constants from " + config.getConstantsFile());
        ConstantTable constants = constantParser.parse(config.getConstantsFile());
        AppLogger.logInfo("Found " + constants.size() + " maps");

        UnmatchedCounter unmatched = new UnmatchedCounter();

        AppLogger.logInfo("Parsing map object files for warps...");
        Map<Integer, List<WarpEvent>> warpsByMap = new LinkedHashMap<>();
        for (Path file : listMapFiles(config.getObjectsDir())) {
            Integer mapId = resolveMapId(file, constants, unmatched);
            if (mapId == null) {
                continue;
            }
            List<WarpEvent> warps = warpParser.parse(file);
            if (!warps.isEmpty()) {
                warpsByMap.put(mapId, warps);
                AppLogger.logInfo(String.format("  %s (ID %02X): %d warps",
                    normalizer.fromFileName(file.getFileName().toString()), mapId, warps.size()));
            }
        }

        AppLogger.logInfo("Parsing map header files for connections...");
        Map<Integer, List<MapConnection>> connectionsByMap = new LinkedHashMap<>();
        for (Path file : listMapFiles(config.getHeadersDir())) {
            Integer mapId = resolveMapId(file, constants, unmatched);
            if (mapId == null) {
                continue;
            }
            List<MapConnection> connections = connectionParser.parse(file);
            if (!connections.isEmpty()) {
                connectionsByMap.put(mapId, connections);
                AppLogger.logInfo(String.format("  %s (ID %02X): %d connections",
                    normalizer.fromFileName(file.getFileName().toString()), mapId, connections.size()));
            }
        }

        AppLogger.logInfo("Building transition dictionary...");
        TransitionGraphBuilder.Result built = new TransitionGraphBuilder(constants, policy)
            .build(warpsByMap, connectionsByMap);

        return new ExtractionResult(constants, built.getGraph(), built.getReport(),
            warpsByMap.size(), connectionsByMap.size(), unmatched.count);
    }

    public void writeArtifacts(ExtractionResult result) throws IOException {
        JsonStorage.writeRendered(config.getTransitionsPath(), renderTransitions(result));
        AppLogger.logInfo("Transitions saved to " + config.getTransitionsPath());
        JsonStorage.writeRendered(config.getMapInfoPath(), renderMapInfo(result));
        AppLogger.logInfo("Map info saved to " + config.getMapInfoPath());
    }

    /**
     * Diffs both artifacts against the files already in the output directory.
     *
     * @return artifact file name to unified diff, only for artifacts that changed
     */
    public Map<String, String> check(ExtractionResult result) throws IOException {
        Map<String, String> changed = new LinkedHashMap<>();
        String transitionsDiff = ArtifactDiff.againstFile(config.getTransitionsPath(), renderTransitions(result));
        if (!transitionsDiff.isEmpty()) {
            changed.put(AppConfig.TRANSITIONS_FILE, transitionsDiff);
        }
        String mapInfoDiff = ArtifactDiff.againstFile(config.getMapInfoPath(), renderMapInfo(result));
        if (!mapInfoDiff.isEmpty()) {
            changed.put(AppConfig.MAP_INFO_FILE, mapInfoDiff);
        }
        return changed;
    }

    public static String renderTransitions(ExtractionResult result) throws IOException {
        return JsonStorage.render(result.getGraph().asSortedMap());
    }

    public static String renderMapInfo(ExtractionResult result) throws IOException {
        return JsonStorage.render(MapInfoDocument.from(result.getConstants()));
    }

    private Integer resolveMapId(Path file, ConstantTable constants, UnmatchedCounter unmatched) {
        String fileName = file.getFileName().toString();
        String constant = normalizer.fromFileName(fileName);
        Integer mapId = constants.idOf(constant);
        if (mapId == null) {
            AppLogger.logWarn("No map ID found for " + constant + " (" + fileName + ")");
            unmatched.count++;
            return null;
        }
        if (ConstantTable.isSentinel(mapId)) {
            AppLogger.logWarn("Skipping " + fileName + ": " + ConstantTable.LAST_MAP + " is not a real map");
            unmatched.count++;
            return null;
        }
        return mapId;
    }

    private List<Path> listMapFiles(Path dir) throws IOException {
        String extension = config.getFileExtension();
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(extension))
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .collect(Collectors.toList());
        }
    }

    private static final class UnmatchedCounter {
        private int count;
    }
}
