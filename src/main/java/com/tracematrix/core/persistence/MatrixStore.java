package com.tracematrix.core.persistence;

import com.tracematrix.core.config.TraceabilityConfig;
import com.tracematrix.core.model.Matrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Persists the last generated matrix as a single JSON file.
 * <p>
 * Writes go to a sibling temporary file first and are then moved into place, so a failed
 * write never leaves a truncated matrix behind. An unreadable file on load is reported and
 * treated as absent, which makes callers regenerate.
 */
@Service
public class MatrixStore {

    private static final Logger log = LoggerFactory.getLogger(MatrixStore.class);

    private final Path matrixFile;

    public MatrixStore(TraceabilityConfig config) {
        this.matrixFile = config.matrixFile();
    }

    public Path location() {
        return matrixFile;
    }

    public boolean exists() {
        return Files.isRegularFile(matrixFile);
    }

    /**
     * @throws MatrixStoreException if the file or its directory cannot be written
     */
    public void save(Matrix matrix) {
        try {
            Files.createDirectories(matrixFile.toAbsolutePath().getParent());
            Path tmp = matrixFile.resolveSibling(matrixFile.getFileName() + ".tmp");
            Files.writeString(tmp, MatrixJson.write(matrix), StandardCharsets.UTF_8);
            Files.move(tmp, matrixFile, StandardCopyOption.REPLACE_EXISTING);
            log.info("Saved traceability matrix to {}", matrixFile);
        } catch (IOException e) {
            throw new MatrixStoreException("Could not write traceability matrix to " + matrixFile, e);
        }
    }

    public Optional<Matrix> load() {
        if (!exists()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MatrixJson.read(Files.readString(matrixFile, StandardCharsets.UTF_8)));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Ignoring unreadable matrix file {}: {}", matrixFile, e.getMessage());
            return Optional.empty();
        }
    }
}
