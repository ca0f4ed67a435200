package com.warpmap;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Input and output locations for one extraction run.
 *
 * Defaults follow the pokered disassembly layout:
 *   constants/map_constants.asm, data/maps/objects/*.asm, data/maps/headers/*.asm
 */
public class AppConfig {

    public static final String DEFAULT_ROOT = "pokered";
    public static final String TRANSITIONS_FILE = "transitions_weak.json";
    public static final String MAP_INFO_FILE = "map_info.json";
    private static final String LOG_FILE = "warp-map-extractor.log";

    private final Path constantsFile;
    private final Path objectsDir;
    private final Path headersDir;
    private final String fileExtension;
    private final Path outputDir;
    private final Path logPath;
    private final boolean consoleEnabled;
    private final boolean checkOnly;

    private AppConfig(Builder builder, Path root) {
        this.constantsFile = builder.constantsFile != null
            ? builder.constantsFile
            : root.resolve("constants").resolve("map_constants.asm");
        this.objectsDir = builder.objectsDir != null
            ? builder.objectsDir
            : root.resolve("data").resolve("maps").resolve("objects");
        this.headersDir = builder.headersDir != null
            ? builder.headersDir
            : root.resolve("data").resolve("maps").resolve("headers");
        this.fileExtension = builder.fileExtension;
        this.outputDir = builder.outputDir;
        this.logPath = builder.outputDir.resolve(LOG_FILE);
        this.consoleEnabled = builder.consoleEnabled;
        this.checkOnly = builder.checkOnly;
    }

    public Path getConstantsFile() {
        return constantsFile;
    }

    public Path getObjectsDir() {
        return objectsDir;
    }

    public Path getHeadersDir() {
        return headersDir;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public Path getTransitionsPath() {
        return outputDir.resolve(TRANSITIONS_FILE);
    }

    public Path getMapInfoPath() {
        return outputDir.resolve(MAP_INFO_FILE);
    }

    public Path getLogPath() {
        return logPath;
    }

    public boolean isConsoleEnabled() {
        return consoleEnabled;
    }

    public boolean isCheckOnly() {
        return checkOnly;
    }

    /**
     * Missing inputs end the run; there is nothing useful to extract without them.
     */
    public void validateInputs() throws IOException {
        if (!Files.isRegularFile(constantsFile)) {
            throw new NoSuchFileException(constantsFile.toString(), null, "map constants file not found");
        }
        if (!Files.isDirectory(objectsDir)) {
            throw new NoSuchFileException(objectsDir.toString(), null, "map objects directory not found");
        }
        if (!Files.isDirectory(headersDir)) {
            throw new NoSuchFileException(headersDir.toString(), null, "map headers directory not found");
        }
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path root = Paths.get(DEFAULT_ROOT);
        private Path constantsFile = null;
        private Path objectsDir = null;
        private Path headersDir = null;
        private String fileExtension = ".asm";
        private Path outputDir = Paths.get(".");
        private boolean consoleEnabled = true;
        private boolean checkOnly = false;

        public Builder root(String path) {
            if (path != null && !path.isEmpty()) {
                this.root = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder root(Path path) {
            if (path != null) {
                this.root = path.toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder constantsFile(String path) {
            this.constantsFile = toPath(path);
            return this;
        }

        public Builder objectsDir(String path) {
            this.objectsDir = toPath(path);
            return this;
        }

        public Builder headersDir(String path) {
            this.headersDir = toPath(path);
            return this;
        }

        public Builder fileExtension(String extension) {
            if (extension != null && !extension.isBlank()) {
                this.fileExtension = extension.startsWith(".") ? extension : "." + extension;
            }
            return this;
        }

        public Builder outputDir(String path) {
            Path parsed = toPath(path);
            if (parsed != null) {
                this.outputDir = parsed;
            }
            return this;
        }

        public Builder outputDir(Path path) {
            if (path != null) {
                this.outputDir = path.toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder consoleEnabled(boolean consoleEnabled) {
            this.consoleEnabled = consoleEnabled;
            return this;
        }

        public Builder checkOnly(boolean checkOnly) {
            this.checkOnly = checkOnly;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--root=")) {
                    root(arg.substring("--root=".length()));
                } else if ("--root".equals(arg) && i + 1 < args.length) {
                    root(args[++i]);
                }

                else if (arg.startsWith("--constants=")) {
                    constantsFile(arg.substring("--constants=".length()));
                } else if ("--constants".equals(arg) && i + 1 < args.length) {
                    constantsFile(args[++i]);
                }

                else if (arg.startsWith("--objects=")) {
                    objectsDir(arg.substring("--objects=".length()));
                } else if ("--objects".equals(arg) && i + 1 < args.length) {
                    objectsDir(args[++i]);
                }

                else if (arg.startsWith("--headers=")) {
                    headersDir(arg.substring("--headers=".length()));
                } else if ("--headers".equals(arg) && i + 1 < args.length) {
                    headersDir(args[++i]);
                }

                else if (arg.startsWith("--out=")) {
                    outputDir(arg.substring("--out=".length()));
                } else if ("--out".equals(arg) && i + 1 < args.length) {
                    outputDir(args[++i]);
                }

                else if ("--quiet".equals(arg)) {
                    this.consoleEnabled = false;
                } else if ("--check".equals(arg)) {
                    this.checkOnly = true;
                }
            }
            return this;
        }

        public AppConfig build() throws IOException {
            Path out = outputDir.toAbsolutePath().normalize();
            Files.createDirectories(out);
            this.outputDir = out;
            return new AppConfig(this, root);
        }

        private static Path toPath(String path) {
            if (path == null || path.isEmpty()) {
                return null;
            }
            return Paths.get(path).toAbsolutePath().normalize();
        }
    }
}
