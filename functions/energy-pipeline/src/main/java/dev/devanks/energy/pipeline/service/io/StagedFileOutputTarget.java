package dev.devanks.energy.pipeline.service.io;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

@RequiredArgsConstructor
@Slf4j
public class StagedFileOutputTarget implements OutputTarget {

    private final Path destination;
    private final Path stagingFile; // same directory as destination, so the move stays on one filesystem

    @Override
    public String getLocation() {
        return destination.toString();
    }

    @Override
    public OutputStream getOutputStream() throws IOException {
        return Files.newOutputStream(stagingFile);
    }

    @Override
    public void publish() throws IOException {
        try {
            Files.move(stagingFile, destination, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to a plain replace.", destination);
            Files.move(stagingFile, destination, REPLACE_EXISTING);
        }
        log.debug("Published {}", destination);
    }

    @Override
    public void discard() {
        try {
            Files.deleteIfExists(stagingFile);
        } catch (IOException e) {
            log.warn("Could not delete staging file {}: {}", stagingFile, e.getMessage(), e);
        }
    }
}
