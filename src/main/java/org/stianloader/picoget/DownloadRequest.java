package org.stianloader.picoget;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The inputs of a single run.
 *
 * @param packageId The id of the root package
 * @param version The requested root version. Null or blank selects the latest version.
 * @param prerelease Whether prerelease versions may be selected
 * @param directory The directory archives are written to
 * @param targetFrameworks The accepted framework identifiers, an empty set accepts every framework
 */
public final record DownloadRequest(@NotNull String packageId, @Nullable String version, boolean prerelease,
        @NotNull Path directory, @NotNull Set<@NotNull String> targetFrameworks) {

    @NotNull
    public static final Path DEFAULT_DIRECTORY = Paths.get("download");

    public DownloadRequest {
        Objects.requireNonNull(packageId, "packageId may not be null");
        Objects.requireNonNull(directory, "directory may not be null");
        targetFrameworks = Collections.unmodifiableSet(new LinkedHashSet<>(targetFrameworks));
    }

    @Contract(pure = true)
    public boolean isLatestRequested() {
        String version = this.version;
        return version == null || version.trim().isEmpty();
    }
}
