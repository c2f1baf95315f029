package org.stianloader.picoget.repo;

import java.io.IOException;
import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoget.PackageRef;

/**
 * A remote (or local) catalogue of packages which reports every published version of a package id
 * together with its metadata.
 */
public interface PackageIndex {

    /**
     * Lists all versions of a package known to the index, prerelease versions included.
     *
     * <p><ul>
     * <li>The returned list MUST be empty (and not fail) if the index does not know the package id.</li>
     * <li>Package ids SHOULD be matched case-insensitively.</li>
     * <li>The order of the returned candidates is irrelevant for version selection, but the order of
     * the {@link org.stianloader.picoget.DependencySet dependency sets} and of the dependencies within them
     * MUST reflect the order the package declares them in, as it defines the traversal order.</li>
     * </ul>
     *
     * @param packageId The id of the package
     * @return The candidates, one per published version
     * @throws IOException If the index could not be queried
     */
    @NotNull
    List<@NotNull PackageRef> findPackagesById(@NotNull String packageId) throws IOException;
}
