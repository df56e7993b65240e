package org.example.shaker.lockfile;

import org.example.shaker.exception.MaterializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The pinned requirements file, one {@code git@host:org/name.git==<tag or sha>} per line.
 * Blank lines and lines starting with '#' are ignored on read.
 */
public class RequirementsFile {

    static final String BACKUP_SUFFIX = ".last";

    private final Path path;
    private final Logger log;

    public RequirementsFile(Path path) {
        this(path, LoggerFactory.getLogger(RequirementsFile.class));
    }

    public RequirementsFile(Path path, Logger log) {
        this.path = path;
        this.log = log;
    }

    public Path getPath() {
        return path;
    }

    public boolean exists() {
        return Files.isRegularFile(path);
    }

    /**
     * Extracts requirement lines from file content.
     */
    public static List<String> parseLines(String content) {
        return Arrays.stream(content.split("\\R"))
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .collect(Collectors.toList());
    }

    /**
     * Reads the requirement lines.
     *
     * @return the lines, or empty when the file does not exist or holds no entries
     * @throws IOException if the file exists but cannot be read
     */
    public Optional<List<String>> read() throws IOException {
        if (!exists()) {
            log.debug("Requirements file not found: {}", path);
            return Optional.empty();
        }
        List<String> lines = parseLines(Files.readString(path, StandardCharsets.UTF_8));
        if (lines.isEmpty()) {
            log.warn("Requirements file {} is empty", path);
            return Optional.empty();
        }
        return Optional.of(lines);
    }

    /**
     * Writes the given lines, newline terminated.
     *
     * @param lines     requirement lines
     * @param overwrite replace an existing file; when false an existing file is left untouched
     * @param backup    move an existing file to {@code <name>.last} before writing
     * @return true if the file was written
     * @throws MaterializationException if the backup or the write fails
     */
    public boolean write(List<String> lines, boolean overwrite, boolean backup) throws MaterializationException {
        if (exists()) {
            if (!overwrite) {
                log.warn("Requirements file {} exists, not writing", path);
                return false;
            }
            if (backup) {
                Path backupPath = path.resolveSibling(path.getFileName() + BACKUP_SUFFIX);
                try {
                    Files.move(path, backupPath, StandardCopyOption.REPLACE_EXISTING);
                    log.info("Moved {} to {}", path, backupPath);
                } catch (IOException e) {
                    throw new MaterializationException(
                            "Failed to back up " + path + " to " + backupPath + ": " + e.getMessage(), e);
                }
            }
        }

        String content = lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new MaterializationException("Failed to write " + path + ": " + e.getMessage(), e);
        }
        log.debug("Wrote {} requirements to {}", lines.size(), path);
        return true;
    }
}
