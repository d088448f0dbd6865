/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler.parse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncwarden.kubernetes.reconciler.backoff.BackoffStrategy;
import io.syncwarden.kubernetes.reconciler.backoff.ExponentialBackoff;
import io.syncwarden.kubernetes.reconciler.errors.SourceFetchException;
import io.syncwarden.tag.VisibleForTesting;

/**
 * <p>Reads a source checked out by a sidecar. The sidecar checks each revision out into a directory named after
 * its commit and atomically repoints a symbolic link, {@value #REVISION_LINK}, at it. The renderer does the same
 * below the hydrated root and writes the commit it last finished to {@value #DONE_FILE} below the repository root.</p>
 *
 * <p>Resolving a revision is retried with backoff, since the sidecar may still be producing the first checkout.</p>
 */
public class FileSystemSourceReader implements SourceReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemSourceReader.class);

    static final String REVISION_LINK = "rev";
    static final String DONE_FILE = "done";
    private static final List<String> MANIFEST_EXTENSIONS = List.of(".yaml", ".yml", ".json");

    /** Roughly five minutes of attempts. */
    static final BackoffStrategy SOURCE_RETRY_BACKOFF = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0.1, 12,
            new Random());
    /** Roughly one minute of attempts. */
    static final BackoffStrategy HYDRATED_RETRY_BACKOFF = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0, 0.1, 8,
            new Random());

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Path sourceRoot;
    private final Path hydratedRoot;
    private final Path repoRoot;
    private final String syncDir;
    private final BackoffStrategy sourceBackoff;
    private final BackoffStrategy hydratedBackoff;
    private final Sleeper sleeper;

    public FileSystemSourceReader(Path sourceRoot, Path hydratedRoot, Path repoRoot, String syncDir) {
        this(sourceRoot, hydratedRoot, repoRoot, syncDir, SOURCE_RETRY_BACKOFF, HYDRATED_RETRY_BACKOFF, d -> Thread.sleep(d.toMillis()));
    }

    @VisibleForTesting
    FileSystemSourceReader(Path sourceRoot,
                           Path hydratedRoot,
                           Path repoRoot,
                           String syncDir,
                           BackoffStrategy sourceBackoff,
                           BackoffStrategy hydratedBackoff,
                           Sleeper sleeper) {
        this.sourceRoot = Objects.requireNonNull(sourceRoot);
        this.hydratedRoot = Objects.requireNonNull(hydratedRoot);
        this.repoRoot = Objects.requireNonNull(repoRoot);
        this.syncDir = Objects.requireNonNull(syncDir);
        this.sourceBackoff = Objects.requireNonNull(sourceBackoff);
        this.hydratedBackoff = Objects.requireNonNull(hydratedBackoff);
        this.sleeper = Objects.requireNonNull(sleeper);
    }

    @Override
    public SourceRevision readSource() {
        return withRetry("source", sourceBackoff, () -> resolve(sourceRoot));
    }

    @Override
    public Optional<SourceRevision> readHydrated() {
        if (!Files.exists(hydratedRoot)) {
            return Optional.empty();
        }
        return Optional.of(withRetry("hydrated", hydratedBackoff, () -> resolve(hydratedRoot)));
    }

    @Override
    public Optional<String> renderingDoneCommit() {
        Path doneFile = repoRoot.resolve(DONE_FILE);
        try {
            return Optional.of(Files.readString(doneFile, StandardCharsets.UTF_8).trim());
        }
        catch (NoSuchFileException e) {
            return Optional.empty();
        }
        catch (IOException e) {
            throw new SourceFetchException("unable to read the done file: " + doneFile, e);
        }
    }

    @Override
    public List<Path> listConfigFiles(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> !isHidden(dir.relativize(path)))
                    .filter(FileSystemSourceReader::isManifest)
                    .sorted()
                    .toList();
        }
        catch (IOException e) {
            throw new SourceFetchException("unable to list the files in " + dir, e);
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static boolean isManifest(Path path) {
        String name = String.valueOf(path.getFileName()).toLowerCase(Locale.ROOT);
        return MANIFEST_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    private SourceRevision resolve(Path root) {
        Path link = root.resolve(REVISION_LINK);
        Path target;
        try {
            target = link.toRealPath();
        }
        catch (IOException e) {
            throw new SourceFetchException("unable to resolve the revision link " + link, e);
        }
        Path commitName = target.getFileName();
        if (commitName == null) {
            throw new SourceFetchException("the revision link " + link + " does not point at a commit directory");
        }
        Path dir = target.resolve(syncDir).normalize();
        if (!dir.startsWith(target)) {
            throw new SourceFetchException("the sync directory " + syncDir + " is outside of the source");
        }
        if (!Files.isDirectory(dir)) {
            throw new SourceFetchException("the sync directory " + dir + " does not exist");
        }
        return new SourceRevision(commitName.toString(), dir);
    }

    private <T> T withRetry(String what, BackoffStrategy backoff, Supplier<T> action) {
        int failures = 0;
        while (true) {
            try {
                return action.get();
            }
            catch (SourceFetchException e) {
                failures++;
                if (failures >= backoff.stepLimit()) {
                    throw e;
                }
                Duration delay = backoff.getDelay(failures);
                LOGGER.atDebug()
                        .setMessage("Failed to read the {} revision, retrying in {}ms: {}")
                        .addArgument(what)
                        .addArgument(delay::toMillis)
                        .addArgument(e::getMessage)
                        .log();
                try {
                    sleeper.sleep(delay);
                }
                catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SourceFetchException("interrupted while reading the " + what + " revision", e);
                }
            }
        }
    }
}
