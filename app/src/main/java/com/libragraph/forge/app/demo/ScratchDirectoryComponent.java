package com.libragraph.forge.app.demo;

import com.libragraph.forge.core.system.AbstractComponent;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns a temporary working directory under {@code root}: created on start,
 * deleted with its contents on stop.
 */
public class ScratchDirectoryComponent extends AbstractComponent {

    private final Path root;
    private volatile Path directory;

    public ScratchDirectoryComponent(Path root) {
        this.root = Objects.requireNonNull(root, "root cannot be null");
    }

    @Override
    protected String componentId() {
        return "scratch";
    }

    @Override
    protected void doStart() throws IOException {
        Files.createDirectories(root);
        directory = Files.createTempDirectory(root, "forge-scratch-");
        log.infof("Scratch directory %s", directory);
    }

    @Override
    protected void doStop() throws IOException {
        Path dir = directory;
        if (dir == null || !Files.exists(dir)) {
            directory = null;
            return;
        }
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(d);
                return FileVisitResult.CONTINUE;
            }
        });
        directory = null;
        log.debugf("Deleted scratch directory %s", dir);
    }

    /** The working directory while running. */
    public Optional<Path> directory() {
        return Optional.ofNullable(directory);
    }
}
