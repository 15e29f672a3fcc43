package dev.devanks.energy.pipeline.service.io;

import org.springframework.stereotype.Component;
import org.springframework.util.ResourceUtils;

import java.io.IOException;
import java.nio.file.Files;

@Component
public class OutputTargetProvider {

    /**
     * Creates the destination directory if needed and a hidden staging file next to the destination.
     *
     * @param location plain filesystem path or {@code file:} URL
     */
    public OutputTarget createTarget(String location) throws IOException {
        var destination = ResourceUtils.getFile(location).toPath().toAbsolutePath().normalize();
        var directory = destination.getParent();
        Files.createDirectories(directory);
        var stagingFile = Files.createTempFile(directory, "." + destination.getFileName(), ".tmp");
        return new StagedFileOutputTarget(destination, stagingFile);
    }
}
