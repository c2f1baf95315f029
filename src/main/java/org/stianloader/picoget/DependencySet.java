package org.stianloader.picoget;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A group of {@link DependencySpec dependencies} that apply when the package is consumed
 * by the given target framework. A null framework identifier means that the set applies to every framework.
 *
 * <p>An empty set is meaningful: it declares that the package has no dependencies on that framework.
 */
public final record DependencySet(@Nullable String targetFramework, @NotNull List<@NotNull DependencySpec> dependencies) {

    public DependencySet {
        dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
    }

    /**
     * Checks whether this set applies to a consumer that accepts the given framework identifiers.
     *
     * @param acceptedFrameworks The accepted identifiers. An empty collection accepts every framework.
     * @return True if the dependencies of this set should be followed
     */
    @Contract(pure = true)
    public boolean appliesTo(@NotNull Iterable<@NotNull String> acceptedFrameworks) {
        String framework = this.targetFramework;
        if (framework == null) {
            return true;
        }
        boolean empty = true;
        for (String accepted : acceptedFrameworks) {
            empty = false;
            if (accepted.equalsIgnoreCase(framework)) {
                return true;
            }
        }
        return empty;
    }
}
