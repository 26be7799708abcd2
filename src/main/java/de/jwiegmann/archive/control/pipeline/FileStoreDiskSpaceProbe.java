package de.jwiegmann.archive.control.pipeline;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class FileStoreDiskSpaceProbe implements DiskSpaceProbe {

    @Override
    public long usableBytes(Path path) {
        try {
            Files.createDirectories(path);
            return Files.getFileStore(path).getUsableSpace();
        } catch (IOException e) {
            throw new UncheckedIOException("cannot determine free space of " + path, e);
        }
    }
}
