package com.warpmap;

import com.warpmap.graph.BuildReport;
import com.warpmap.graph.TransitionGraph;
import com.warpmap.models.ConstantTable;

public class ExtractionResult {
    private final ConstantTable constants;
    private final TransitionGraph graph;
    private final BuildReport report;
    private final int mapsWithWarps;
    private final int mapsWithConnections;
    private final int unmatchedFiles;

    public ExtractionResult(ConstantTable constants, TransitionGraph graph, BuildReport report,
                            int mapsWithWarps, int mapsWithConnections, int unmatchedFiles) {
        this.constants = constants;
        this.graph = graph;
        this.report = report;
        this.mapsWithWarps = mapsWithWarps;
        this.mapsWithConnections = mapsWithConnections;
        this.unmatchedFiles = unmatchedFiles;
    }

    public ConstantTable getConstants() {
        return constants;
    }

    public TransitionGraph getGraph() {
        return graph;
    }

    public BuildReport getReport() {
        return report;
    }

    public int getMapsWithWarps() {
        return mapsWithWarps;
    }

    public int getMapsWithConnections() {
        return mapsWithConnections;
    }

    /**
     * Files whose name did not normalize to a known map constant.
     */
    public int getUnmatchedFiles() {
        return unmatchedFiles;
    }

    /**
     * Resolution warnings plus file names that matched no constant.
     */
    public int getWarningCount() {
        return report.getWarnings().size() + unmatchedFiles;
    }
}
