package org.stianloader.picoget;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoget.logging.LoggingAdapter;
import org.stianloader.picoget.progress.CancellationToken;
import org.stianloader.picoget.progress.ProgressSink;

/**
 * Expands a root package into the closure of all packages it requires.
 *
 * <p>The traversal is depth-first and pre-order: the dependencies of a package are visited in
 * declaration order and a newly discovered package is fully expanded before its next sibling is looked at.
 * Packages that are already part of the {@link ResolvedSet} are not expanded again, which keeps the
 * traversal finite even if the dependency graph has cycles. The traversal uses an explicit stack, so the
 * depth of the dependency graph is not limited by the size of the call stack.
 *
 * <p>Dependency edges whose range cannot be satisfied by the index are skipped: a warning is logged and
 * reported to the progress sink, and neither the dependency nor anything below it enters the result.
 */
public class DependencyGraphBuilder {

    private static class Frame {
        @NotNull
        private final PackageRef declarer;
        @NotNull
        private final Iterator<@NotNull DependencySpec> dependencies;

        private Frame(@NotNull PackageRef declarer, @NotNull Iterator<@NotNull DependencySpec> dependencies) {
            this.declarer = declarer;
            this.dependencies = dependencies;
        }
    }

    @NotNull
    private final VersionResolver resolver;
    @NotNull
    private final Set<@NotNull String> acceptedFrameworks;
    private final boolean prerelease;

    /**
     * Constructor.
     *
     * @param resolver The resolver used to select the version of every dependency
     * @param prerelease Whether dependencies may resolve to prerelease versions
     * @param acceptedFrameworks The framework identifiers whose dependency sets should be followed.
     * Sets without framework are always followed. An empty collection accepts every framework.
     */
    public DependencyGraphBuilder(@NotNull VersionResolver resolver, boolean prerelease, @NotNull Collection<@NotNull String> acceptedFrameworks) {
        this.resolver = Objects.requireNonNull(resolver, "resolver may not be null");
        this.prerelease = prerelease;
        this.acceptedFrameworks = Collections.unmodifiableSet(new LinkedHashSet<>(acceptedFrameworks));
    }

    /**
     * Builds the closure of the root package.
     *
     * <p>The cancellation token is polled before every dependency edge. If a stop is requested the packages
     * discovered so far are returned, so the result always contains at least the root.
     *
     * @param root The already resolved root package
     * @param token The token to poll
     * @param progress The sink receiving one "&lt;parent&gt; -&gt; &lt;child&gt;" line per resolved edge
     * @return The discovered packages, root first, in discovery order
     * @throws IOException If the index could not be queried
     */
    @NotNull
    public ResolvedSet build(@NotNull PackageRef root, @NotNull CancellationToken token, @NotNull ProgressSink progress) throws IOException {
        ResolvedSet resolved = new ResolvedSet();
        resolved.add(root);

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(this.createFrame(root));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.dependencies.hasNext()) {
                stack.pop();
                continue;
            }

            DependencySpec dependency = frame.dependencies.next();
            if (token.isStopRequested()) {
                LoggingAdapter.getDefaultLogger().debug(DependencyGraphBuilder.class, "Stop requested after discovering {} packages", resolved.size());
                return resolved;
            }

            PackageRef child = this.resolver.resolveInRange(dependency.id(), dependency.range(), this.prerelease);
            if (child == null) {
                LoggingAdapter.getDefaultLogger().warn(DependencyGraphBuilder.class, "No version of {} satisfies {} as required by {}; skipping it", dependency.id(), dependency.range(), frame.declarer.getFullName());
                progress.progress("Unable to resolve " + dependency.id() + " " + dependency.range() + " required by " + frame.declarer.getFullName() + ", skipping.");
                continue;
            }

            progress.progress(frame.declarer.getFullName() + " -> " + child.getFullName());

            if (resolved.add(child)) {
                stack.push(this.createFrame(child));
            }
        }

        return resolved;
    }

    @NotNull
    private Frame createFrame(@NotNull PackageRef ref) {
        return new Frame(ref, ref.getApplicableDependencies(this.acceptedFrameworks).iterator());
    }
}
