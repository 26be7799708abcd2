package de.jwiegmann.archive.control.pipeline;

import java.nio.file.Path;

@FunctionalInterface
public interface DiskSpaceProbe {

    long usableBytes(Path path);
}
