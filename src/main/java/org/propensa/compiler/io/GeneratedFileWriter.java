package org.propensa.compiler.io;

import org.propensa.compiler.backend.emit.PropensitySourceGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes generated source to disk without clobbering hand-written files.
 * <p>
 * A new file is always written. An existing file is only overwritten if its first line is the
 * {@link PropensitySourceGenerator#MARKER}; otherwise the write is skipped and a warning is issued.
 * Removing or editing the marker line therefore protects a file from regeneration.
 */
public class GeneratedFileWriter {

    private static final Logger log = LoggerFactory.getLogger(GeneratedFileWriter.class);

    /**
     * Receives a notification when an existing file is left untouched.
     */
    @FunctionalInterface
    public interface WriteListener {

        /**
         * Called when a write is refused.
         * @param target The existing file that was not overwritten.
         */
        void refused(Path target);
    }

    private final String marker;
    private final WriteListener listener;

    public GeneratedFileWriter() {
        this(target -> { });
    }

    public GeneratedFileWriter(WriteListener listener) {
        this(PropensitySourceGenerator.MARKER, listener);
    }

    GeneratedFileWriter(String marker, WriteListener listener) {
        this.marker = marker;
        this.listener = listener;
    }

    /**
     * Writes {@code content} to {@code target} if permitted.
     *
     * @param target  The destination file.
     * @param content The text to write.
     * @return {@code true} if the file was written, {@code false} if an existing foreign file was kept.
     * @throws IOException If reading the existing file or writing fails.
     */
    public boolean write(Path target, String content) throws IOException {
        if (Files.exists(target) && !isGenerated(target)) {
            log.warn("Will not overwrite existing file '{}' since it was not generated by propensa", target);
            listener.refused(target);
            return false;
        }
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
        log.debug("Wrote {} characters to '{}'", content.length(), target);
        return true;
    }

    /**
     * @return Whether the first line of the existing file is the generator marker.
     */
    boolean isGenerated(Path existing) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(existing, StandardCharsets.UTF_8)) {
            String firstLine = reader.readLine();
            return firstLine != null && firstLine.startsWith(marker);
        }
    }
}
