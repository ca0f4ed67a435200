package com.warpmap;

import com.warpmap.models.TransitionKind;

import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final int EXIT_FAILED = 1;
    private static final int EXIT_OUT_OF_DATE = 2;

    private static AppLogger logger;

    public static void main(String[] args) {
        int exitCode;
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isConsoleEnabled());
            logger = AppLogger.get();

            printBanner(config);
            exitCode = run(config);
            logger.close();
        } catch (Exception e) {
            if (logger != null) {
                logger.error("Extraction failed: " + e.getMessage(), e);
                logger.close();
            } else {
                System.err.println("Extraction failed: " + e.getMessage());
                e.printStackTrace();
            }
            exitCode = EXIT_FAILED;
        }
        System.exit(exitCode);
    }

    static int run(AppConfig config) throws Exception {
        MapExtractionService service = new MapExtractionService(config);
        ExtractionResult result = service.extract();
        printSummary(result);

        if (config.isCheckOnly()) {
            Map<String, String> changed = service.check(result);
            if (changed.isEmpty()) {
                logger.console("  Artifacts are up to date");
                return 0;
            }
            changed.forEach((file, diff) -> {
                logger.warn(file + " is out of date");
                logger.console(diff);
            });
            return EXIT_OUT_OF_DATE;
        }

        service.writeArtifacts(result);
        return 0;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Warp Map Extractor v" + VERSION);
        logger.console("========================================");
        logger.console("  Constants: " + config.getConstantsFile());
        logger.console("  Objects:   " + config.getObjectsDir());
        logger.console("  Headers:   " + config.getHeadersDir());
        logger.console("  Output:    " + config.getOutputDir());
        if (config.isCheckOnly()) {
            logger.console("  Mode: check only");
        }
    }

    private static void printSummary(ExtractionResult result) {
        logger.console("");
        logger.console("  Maps with warps:       " + result.getMapsWithWarps());
        logger.console("  Maps with connections: " + result.getMapsWithConnections());
        logger.console("  Warps resolved:        " + result.getReport().getWarpsResolved());
        logger.console("  Overworld writes:      " + result.getReport().getOverworldWrites());
        logger.console("  Warp transitions:      " + result.getGraph().count(TransitionKind.WARP));
        logger.console("  Overworld transitions: " + result.getGraph().count(TransitionKind.OVERWORLD));
        logger.console("  Total transitions:     " + result.getGraph().size());
        logger.console("  Warnings:              " + result.getWarningCount());
        logger.console("");
    }
}
