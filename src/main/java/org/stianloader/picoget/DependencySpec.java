package org.stianloader.picoget;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoget.version.VersionRange;

/**
 * A dependency declared by a package: the id of the required package and the range of versions that satisfy it.
 */
public final record DependencySpec(@NotNull String id, @NotNull VersionRange range) {
    @Override
    public String toString() {
        return this.id + ' ' + this.range;
    }
}
