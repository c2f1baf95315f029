package org.stianloader.picoget;

import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoget.version.NuGetVersion;

/**
 * The identity of a concrete package: its id and its version. Package ids are compared
 * case-insensitively, as is the convention with NuGet feeds, while versions are compared
 * through {@link NuGetVersion#equals(Object)}, that is "1.0" and "1.0.0.0" denote the same package version.
 *
 * <p>The id is kept in the casing reported by the index, only equality and hashing ignore it.
 */
public final record PackageIdentity(@NotNull String id, @NotNull NuGetVersion version) {

    public PackageIdentity {
        Objects.requireNonNull(id, "id may not be null");
        Objects.requireNonNull(version, "version may not be null");
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PackageIdentity) {
            PackageIdentity other = (PackageIdentity) obj;
            return other.id.equalsIgnoreCase(this.id) && other.version.equals(this.version);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id.toLowerCase(Locale.ROOT), this.version);
    }

    @Override
    public String toString() {
        return this.id + ' ' + this.version;
    }
}
