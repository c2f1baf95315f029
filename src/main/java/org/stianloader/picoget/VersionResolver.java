package org.stianloader.picoget;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoget.logging.LoggingAdapter;
import org.stianloader.picoget.repo.PackageIndex;
import org.stianloader.picoget.version.NuGetVersion;
import org.stianloader.picoget.version.VersionRange;

/**
 * Selects concrete package versions from the candidates a {@link PackageIndex} reports.
 *
 * <p>All selection operations pick the highest version among the candidates that survive their filter.
 * A null return value means that no candidate survived. The candidate list of every package id is
 * queried once and then cached for the lifetime of the resolver, so a resolver should be created
 * per run in order to observe changes to the index.
 */
public class VersionResolver {

    @NotNull
    private final PackageIndex index;
    @NotNull
    private final Map<String, List<@NotNull PackageRef>> candidateCache = new HashMap<>();

    public VersionResolver(@NotNull PackageIndex index) {
        this.index = Objects.requireNonNull(index, "index may not be null");
    }

    @NotNull
    private List<@NotNull PackageRef> getCandidates(@NotNull String packageId) throws IOException {
        String key = packageId.toLowerCase(Locale.ROOT);
        List<@NotNull PackageRef> candidates = this.candidateCache.get(key);
        if (candidates == null) {
            LoggingAdapter.getDefaultLogger().debug(VersionResolver.class, "Querying index for {}", packageId);
            candidates = Collections.unmodifiableList(this.index.findPackagesById(packageId));
            this.candidateCache.put(key, candidates);
        }
        return candidates;
    }

    @Nullable
    private static PackageRef selectNewest(@NotNull List<@NotNull PackageRef> candidates, @NotNull Predicate<@NotNull PackageRef> filter) {
        PackageRef newest = null;
        for (PackageRef candidate : candidates) {
            if (filter.test(candidate) && (newest == null || candidate.version().isNewerThan(newest.version()))) {
                newest = candidate;
            }
        }
        return newest;
    }

    /**
     * Resolves the candidate whose version equals the given version string. Prerelease candidates
     * are never filtered out here, as an explicitly requested version has precedence over the prerelease switch.
     *
     * @param packageId The id of the package
     * @param version The version to look up
     * @return The matching candidate, or null if the index does not list that version
     * @throws IOException If the index could not be queried
     */
    @Nullable
    public PackageRef resolveExact(@NotNull String packageId, @NotNull NuGetVersion version) throws IOException {
        for (PackageRef candidate : this.getCandidates(packageId)) {
            if (candidate.version().equals(version)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Resolves the newest version within the given range.
     *
     * @param packageId The id of the package
     * @param range The accepted versions
     * @param prerelease Whether prerelease candidates may be selected
     * @return The newest candidate within the range, or null if there is none
     * @throws IOException If the index could not be queried
     */
    @Nullable
    public PackageRef resolveInRange(@NotNull String packageId, @NotNull VersionRange range, boolean prerelease) throws IOException {
        List<@NotNull PackageRef> eligible = new ArrayList<>();
        List<@NotNull NuGetVersion> versions = new ArrayList<>();
        for (PackageRef candidate : this.getCandidates(packageId)) {
            if (prerelease || !candidate.prerelease()) {
                eligible.add(candidate);
                versions.add(candidate.version());
            }
        }

        NuGetVersion selected = range.selectFrom(versions);
        if (selected == null) {
            return null;
        }
        return eligible.get(versions.indexOf(selected));
    }

    /**
     * Resolves the latest version of a package.
     *
     * <p>If prerelease versions are excluded, only candidates that the index flags as the latest release
     * and which are not prereleases are considered. Otherwise the newest of all candidates wins.
     *
     * @param packageId The id of the package
     * @param prerelease Whether prerelease candidates may be selected
     * @return The latest candidate, or null if there is none
     * @throws IOException If the index could not be queried
     */
    @Nullable
    public PackageRef resolveLatest(@NotNull String packageId, boolean prerelease) throws IOException {
        if (prerelease) {
            return VersionResolver.selectNewest(this.getCandidates(packageId), (candidate) -> true);
        }
        return VersionResolver.selectNewest(this.getCandidates(packageId), (candidate) -> {
            return !candidate.prerelease() && candidate.latestRelease();
        });
    }
}
