/*
 * Copyright Syncwarden Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.syncwarden.kubernetes.reconciler;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

import org.slf4j.LoggerFactory;

import io.syncwarden.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Build information, read from {@code META-INF/metadata.properties}, which Maven filters at build time.
 *
 * @param version the project version
 * @param commitId the git commit built
 */
public record VersionInfo(String version, String commitId) {

    static final String UNKNOWN = "unknown";
    static final String METADATA_RESOURCE = "META-INF/metadata.properties";

    public static final VersionInfo VERSION_INFO = load();

    public VersionInfo {
        Objects.requireNonNull(version);
        Objects.requireNonNull(commitId);
    }

    private static VersionInfo load() {
        try (var resource = VersionInfo.class.getClassLoader().getResourceAsStream(METADATA_RESOURCE)) {
            if (resource != null) {
                return read(resource);
            }
        }
        catch (IOException e) {
            LoggerFactory.getLogger(VersionInfo.class).warn("Failed to retrieve version information (ignored)", e);
        }
        return new VersionInfo(UNKNOWN, UNKNOWN);
    }

    @VisibleForTesting
    static VersionInfo read(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(in);
        return new VersionInfo(resolved(properties.getProperty("syncwarden.version")),
                resolved(properties.getProperty("git.commit.id")));
    }

    // an unfiltered resource still holds the ${...} placeholder
    private static String resolved(@Nullable String value) {
        return value == null || value.isBlank() || value.startsWith("${") ? UNKNOWN : value;
    }
}
