package org.stianloader.picoget;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoget.version.NuGetVersion;

/**
 * A concrete package version as advertised by a {@link org.stianloader.picoget.repo.PackageIndex}.
 *
 * <p>Instances carry everything needed for both resolution and download, so no further lookups
 * are necessary once a {@link PackageRef} was obtained. The download URL may be null if the index
 * did not advertise one; such packages can be resolved but not downloaded.
 */
public final record PackageRef(@NotNull String id, @NotNull NuGetVersion version, @NotNull String title,
        boolean prerelease, boolean latestRelease, @Nullable URI downloadUrl,
        @NotNull List<@NotNull DependencySet> dependencySets) {

    public PackageRef {
        Objects.requireNonNull(id, "id may not be null");
        Objects.requireNonNull(version, "version may not be null");
        Objects.requireNonNull(title, "title may not be null");
        dependencySets = Collections.unmodifiableList(new ArrayList<>(dependencySets));
    }

    /**
     * Collects the dependencies of all {@link DependencySet sets} that apply to the accepted frameworks,
     * in declaration order.
     *
     * @param acceptedFrameworks The accepted framework identifiers, an empty collection accepts all
     * @return The applicable dependencies
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull DependencySpec> getApplicableDependencies(@NotNull Iterable<@NotNull String> acceptedFrameworks) {
        List<@NotNull DependencySpec> applicable = new ArrayList<>();
        for (DependencySet set : this.dependencySets) {
            if (set.appliesTo(acceptedFrameworks)) {
                applicable.addAll(set.dependencies());
            }
        }
        return applicable;
    }

    @NotNull
    @Contract(pure = true)
    public String getFullName() {
        return this.id + ' ' + this.version;
    }

    @NotNull
    @Contract(pure = true)
    public PackageIdentity identity() {
        return new PackageIdentity(this.id, this.version);
    }

    @Override
    public String toString() {
        return "PackageRef[" + this.getFullName() + "]";
    }
}
