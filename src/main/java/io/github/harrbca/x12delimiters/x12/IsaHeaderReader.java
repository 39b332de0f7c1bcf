package io.github.harrbca.x12delimiters.x12;

import io.github.harrbca.x12delimiters.config.DelimiterProperties;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the leading bytes of an interchange and detects its delimiters.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IsaHeaderReader {

    private static final byte[] ISA_TAG = {'I', 'S', 'A'};

    private final DelimiterProperties properties;

    public Delimiters read(@NonNull String header) {
        // one byte per char so the fixed offsets line up
        return read(header.getBytes(StandardCharsets.ISO_8859_1));
    }

    public Delimiters read(@NonNull File file) {
        try (InputStream in = new FileInputStream(file)) {
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ISA header from file: " + file, e);
        }
    }

    public Delimiters read(@NonNull Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ISA header from path: " + path, e);
        }
    }

    public Delimiters read(@NonNull InputStream in) {
        byte[] header;
        try {
            header = in.readNBytes(Delimiters.ISA_MIN_LENGTH);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ISA header", e);
        }
        return read(header);
    }

    public Delimiters read(@NonNull byte[] header) {
        // length is checked first so short input always reports INVALID_ISA_LENGTH
        Delimiters delimiters = Delimiters.fromIsa(header);

        if (properties.isRequireIsaTag() && !startsWithIsaTag(header)) {
            throw new IllegalArgumentException("No ISA segment found");
        }
        if (properties.isRequireValid() && !delimiters.areValid()) {
            throw new IllegalArgumentException("ISA header reuses a delimiter: " + delimiters);
        }

        log.debug("Detected {}", delimiters);
        return delimiters;
    }

    /**
     * Like {@link #read(byte[])}, but falls back to the configured delimiters when the header is rejected.
     */
    public Delimiters readOrDefault(@NonNull byte[] header) {
        try {
            return read(header);
        } catch (DelimiterException | IllegalArgumentException e) {
            Delimiters fallback = properties.toDelimiters();
            log.warn("Could not detect delimiters ({}), using {}", e.getMessage(), fallback);
            return fallback;
        }
    }

    public Delimiters readOrDefault(@NonNull Path path) {
        try {
            return read(path);
        } catch (DelimiterException | IllegalArgumentException e) {
            Delimiters fallback = properties.toDelimiters();
            log.warn("Could not detect delimiters in {} ({}), using {}", path, e.getMessage(), fallback);
            return fallback;
        }
    }

    private static boolean startsWithIsaTag(byte[] header) {
        for (int i = 0; i < ISA_TAG.length; i++) {
            if (header[i] != ISA_TAG[i]) {
                return false;
            }
        }
        return true;
    }
}
