package com.warpmap.graph;

import com.warpmap.AppLogger;
import com.warpmap.graph.BuildReport.WarningType;
import com.warpmap.models.ConstantTable;
import com.warpmap.models.MapConnection;
import com.warpmap.models.MapDimensions;
import com.warpmap.models.ResolvedWarp;
import com.warpmap.models.TransitionKind;
import com.warpmap.models.WarpEvent;

import java.util.List;
import java.util.Map;

/**
 * Resolves parsed warps and connections into a {@link TransitionGraph}.
 *
 * Warps are resolved first, then connections. Both passes write into the same
 * graph, so the conflict policy decides what a pair holding both ends up as.
 * Every resolution failure is a warning on the report; nothing here throws for
 * a bad record.
 *
 * Iteration follows the map order of the inputs, so callers pass maps built in
 * ascending filename order (LinkedHashMap) to keep runs reproducible.
 */
public class TransitionGraphBuilder {

    private final ConstantTable constants;
    private final TransitionConflictPolicy policy;

    public TransitionGraphBuilder(ConstantTable constants) {
        this(constants, TransitionConflictPolicy.LAST_WRITE_WINS);
    }

    public TransitionGraphBuilder(ConstantTable constants, TransitionConflictPolicy policy) {
        this.constants = constants;
        this.policy = policy;
    }

    public Result build(Map<Integer, List<WarpEvent>> warpsByMap,
                        Map<Integer, List<MapConnection>> connectionsByMap) {
        TransitionGraph graph = new TransitionGraph(policy);
        BuildReport report = new BuildReport();

        AppLogger.logInfo("Processing warps...");
        resolveWarps(warpsByMap, graph, report);
        AppLogger.logInfo("  Added " + graph.count(TransitionKind.WARP) + " warp transitions");

        AppLogger.logInfo("Processing overworld connections...");
        resolveConnections(connectionsByMap, graph, report);
        AppLogger.logInfo("  Added " + report.getOverworldWrites() + " overworld connection transitions");

        return new Result(graph, report);
    }

    void resolveWarps(Map<Integer, List<WarpEvent>> warpsByMap, TransitionGraph graph, BuildReport report) {
        for (Map.Entry<Integer, List<WarpEvent>> entry : warpsByMap.entrySet()) {
            int sourceId = entry.getKey();
            if (ConstantTable.isSentinel(sourceId)) {
                warn(report, WarningType.SENTINEL_SOURCE, "Ignoring warps recorded under " + ConstantTable.LAST_MAP);
                continue;
            }
            for (WarpEvent warp : entry.getValue()) {
                String destName = warp.getDestMap();
                Integer destId = constants.idOf(destName);
                if (destId == null) {
                    warn(report, WarningType.UNKNOWN_MAP, "Unknown destination map " + destName);
                    continue;
                }
                // LAST_MAP warps return to wherever the player came from
                if (ConstantTable.isSentinel(destId)) {
                    continue;
                }
                List<WarpEvent> destWarps = warpsByMap.get(destId);
                if (destWarps == null || destWarps.isEmpty()) {
                    warn(report, WarningType.MISSING_WARP_DATA,
                        "No warp data for destination map " + destName + " (ID " + hex(destId) + ")");
                    continue;
                }
                int destIndex = warp.getDestWarpIndex() - 1;
                if (destIndex < 0 || destIndex >= destWarps.size()) {
                    warn(report, WarningType.INVALID_WARP_INDEX,
                        "Invalid warp ID " + warp.getDestWarpIndex() + " for map " + destName
                            + " (has " + destWarps.size() + " warps)");
                    continue;
                }
                WarpEvent target = destWarps.get(destIndex);
                report.addResolvedWarp(new ResolvedWarp(
                    sourceId, warp.getX(), warp.getY(), destId, target.getX(), target.getY()));
                graph.record(sourceId, destId, TransitionKind.WARP);
            }
        }
    }

    void resolveConnections(Map<Integer, List<MapConnection>> connectionsByMap, TransitionGraph graph,
                            BuildReport report) {
        for (Map.Entry<Integer, List<MapConnection>> entry : connectionsByMap.entrySet()) {
            int sourceId = entry.getKey();
            String sourceName = constants.nameOfId(sourceId);
            MapDimensions source = constants.dimensionsOf(sourceName);
            if (source == null) {
                warn(report, WarningType.MISSING_DIMENSIONS, "No dimensions found for map ID " + hex(sourceId));
                continue;
            }
            for (MapConnection connection : entry.getValue()) {
                String destName = connection.getDestMap();
                Integer destId = constants.idOf(destName);
                if (destId == null) {
                    warn(report, WarningType.UNKNOWN_MAP, "Unknown destination map " + destName);
                    continue;
                }
                MapDimensions dest = constants.dimensionsOf(destName);
                if (dest == null) {
                    warn(report, WarningType.MISSING_DIMENSIONS, "No dimensions found for " + destName);
                    continue;
                }
                int overlap = countOverlap(connection, source, dest);
                for (int i = 0; i < overlap; i++) {
                    graph.record(sourceId, destId, TransitionKind.OVERWORLD);
                }
                report.addOverworldWrites(overlap * 2);
            }
        }
    }

    /**
     * Number of edge tiles on the source side that land inside the destination
     * once shifted by the connection offset.
     */
    static int countOverlap(MapConnection connection, MapDimensions source, MapDimensions dest) {
        int span = connection.getDirection().spansWidth() ? source.width() : source.height();
        int limit = connection.getDirection().spansWidth() ? dest.width() : dest.height();
        int count = 0;
        for (int i = 0; i < span; i++) {
            int shifted = i + connection.getOffset();
            if (shifted >= 0 && shifted < limit) {
                count++;
            }
        }
        return count;
    }

    private static void warn(BuildReport report, WarningType type, String message) {
        report.addWarning(type, message);
        AppLogger.logWarn(message);
    }

    private static String hex(int id) {
        return String.format("%02X", id);
    }

    public static class Result {
        private final TransitionGraph graph;
        private final BuildReport report;

        public Result(TransitionGraph graph, BuildReport report) {
            this.graph = graph;
            this.report = report;
        }

        public TransitionGraph getGraph() {
            return graph;
        }

        public BuildReport getReport() {
            return report;
        }
    }
}
