package org.stianloader.picoget;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The packages selected by a single graph build, in the order they were discovered.
 *
 * <p>Entries are unique by {@link PackageIdentity}. The set only ever grows: packages
 * cannot be removed and are never reordered. It is not meant to outlive the run that created it.
 */
public final class ResolvedSet implements Iterable<@NotNull PackageRef> {
    @NotNull
    private final Set<PackageIdentity> known = new HashSet<>();
    @NotNull
    private final List<@NotNull PackageRef> packages = new ArrayList<>();

    /**
     * Adds a package if no package with the same identity was added before.
     *
     * @param ref The package to add
     * @return True if the package was added, false if it was already known
     */
    @Contract(mutates = "this")
    public boolean add(@NotNull PackageRef ref) {
        if (!this.known.add(ref.identity())) {
            return false;
        }
        this.packages.add(ref);
        return true;
    }

    @Contract(pure = true)
    public boolean contains(@NotNull PackageIdentity identity) {
        return this.known.contains(identity);
    }

    @Contract(pure = true)
    public boolean isEmpty() {
        return this.packages.isEmpty();
    }

    @Override
    @NotNull
    public Iterator<@NotNull PackageRef> iterator() {
        return this.asList().iterator();
    }

    /**
     * Obtains an unmodifiable view of the packages in discovery order.
     *
     * @return The packages
     */
    @NotNull
    @Contract(pure = true)
    public List<@NotNull PackageRef> asList() {
        return Collections.unmodifiableList(this.packages);
    }

    @Contract(pure = true)
    public int size() {
        return this.packages.size();
    }

    @Override
    public String toString() {
        return "ResolvedSet" + this.packages;
    }
}
