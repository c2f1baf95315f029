package org.stianloader.picoget.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.stianloader.picoget.test.InMemoryPackageIndex.dep;
import static org.stianloader.picoget.test.InMemoryPackageIndex.pkg;
import static org.stianloader.picoget.test.InMemoryPackageIndex.set;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.stianloader.picoget.DependencyGraphBuilder;
import org.stianloader.picoget.PackageRef;
import org.stianloader.picoget.ResolvedSet;
import org.stianloader.picoget.VersionResolver;
import org.stianloader.picoget.progress.CancellationToken;
import org.stianloader.picoget.repo.FrameworkNames;

public class DependencyGraphBuilderTest {

    private static List<String> names(ResolvedSet set) {
        List<String> names = new ArrayList<>();
        for (PackageRef ref : set) {
            names.add(ref.getFullName());
        }
        return names;
    }

    private static DependencyGraphBuilder builder(InMemoryPackageIndex index, Collection<String> frameworks) {
        return new DependencyGraphBuilder(new VersionResolver(index), false, frameworks);
    }

    @Test
    public void testDepthFirstOrder() throws IOException {
        PackageRef root = pkg("A", "1.0", dep("B", "1.0"), dep("C", "1.0"));
        InMemoryPackageIndex index = new InMemoryPackageIndex()
                .add(root)
                .add(pkg("B", "1.0", dep("D", "[1.0,2.0)")))
                .add(pkg("C", "1.0"))
                .add(pkg("D", "1.0"))
                .add(pkg("D", "1.5"))
                .add(pkg("D", "2.0"));

        List<String> progress = new ArrayList<>();
        ResolvedSet resolved = builder(index, Collections.emptySet()).build(root, CancellationToken.NONE, progress::add);

        assertEquals(Arrays.asList("A 1.0", "B 1.0", "D 1.5", "C 1.0"), names(resolved));
        assertEquals(Arrays.asList("A 1.0 -> B 1.0", "B 1.0 -> D 1.5", "A 1.0 -> C 1.0"), progress);
    }

    @Test
    public void testCycleTerminates() throws IOException {
        PackageRef root = pkg("A", "1.0", dep("B", "1.0"));
        InMemoryPackageIndex index = new InMemoryPackageIndex()
                .add(root)
                .add(pkg("B", "1.0", dep("A", "1.0")));

        ResolvedSet resolved = builder(index, Collections.emptySet()).build(root, CancellationToken.NONE, (line) -> { });
        assertEquals(Arrays.asList("A 1.0", "B 1.0"), names(resolved));
    }

    @Test
    public void testSharedDependencyIsListedOnce() throws IOException {
        PackageRef root = pkg("A", "1.0", dep("B", "1.0"), dep("C", "1.0"));
        InMemoryPackageIndex index = new InMemoryPackageIndex()
                .add(root)
                .add(pkg("B", "1.0", dep("D", "1.0")))
                .add(pkg("C", "1.0", dep("d", "1.0")))
                .add(pkg("D", "1.0"));

        List<String> progress = new ArrayList<>();
        ResolvedSet resolved = builder(index, Collections.emptySet()).build(root, CancellationToken.NONE, progress::add);

        assertEquals(Arrays.asList("A 1.0", "B 1.0", "D 1.0", "C 1.0"), names(resolved));
        // The edge is reported even though D is not expanded a second time
        assertTrue(progress.contains("C 1.0 -> D 1.0"));
    }

    @Test
    public void testFrameworkFiltering() throws IOException {
        PackageRef root = pkg("A", "1.0", false, Arrays.asList(
                set(null, dep("Any", "1.0")),
                set(FrameworkNames.NET_FRAMEWORK, dep("Framework", "1.0")),
                set(FrameworkNames.NET_STANDARD, dep("Standard", "1.0"))));
        InMemoryPackageIndex index = new InMemoryPackageIndex()
                .add(root)
                .add(pkg("Any", "1.0"))
                .add(pkg("Framework", "1.0"))
                .add(pkg("Standard", "1.0"));

        ResolvedSet standard = builder(index, Collections.singleton(".netstandard")).build(root, CancellationToken.NONE, (line) -> { });
        assertEquals(Arrays.asList("A 1.0", "Any 1.0", "Standard 1.0"), names(standard));

        ResolvedSet all = builder(index, Collections.emptySet()).build(root, CancellationToken.NONE, (line) -> { });
        assertEquals(Arrays.asList("A 1.0", "Any 1.0", "Framework 1.0", "Standard 1.0"), names(all));

        ResolvedSet none = builder(index, Collections.singleton(FrameworkNames.NET_CORE_APP)).build(root, CancellationToken.NONE, (line) -> { });
        assertEquals(Arrays.asList("A 1.0", "Any 1.0"), names(none));
    }

    @Test
    public void testMissingDependencyIsSkipped() throws IOException {
        PackageRef root = pkg("A", "1.0", dep("Missing", "[1.0]"), dep("B", "1.0"));
        InMemoryPackageIndex index = new InMemoryPackageIndex()
                .add(root)
                .add(pkg("B", "1.0"));

        List<String> progress = new ArrayList<>();
        ResolvedSet resolved = builder(index, Collections.emptySet()).build(root, CancellationToken.NONE, progress::add);

        assertEquals(Arrays.asList("A 1.0", "B 1.0"), names(resolved));
        assertEquals(Arrays.asList("Unable to resolve Missing [1.0] required by A 1.0, skipping.", "A 1.0 -> B 1.0"), progress);
    }

    @Test
    public void testPrereleaseDependencies() throws IOException {
        PackageRef root = pkg("A", "1.0", dep("B", "1.0"));
        InMemoryPackageIndex index = new InMemoryPackageIndex()
                .add(root)
                .add(pkg("B", "1.0"))
                .add(pkg("B", "1.1-rc.1"));

        ResolvedSet stable = new DependencyGraphBuilder(new VersionResolver(index), false, Collections.emptySet()).build(root, CancellationToken.NONE, (line) -> { });
        assertEquals(Arrays.asList("A 1.0", "B 1.0"), names(stable));

        ResolvedSet prerelease = new DependencyGraphBuilder(new VersionResolver(index), true, Collections.emptySet()).build(root, CancellationToken.NONE, (line) -> { });
        assertEquals(Arrays.asList("A 1.0", "B 1.1-rc.1"), names(prerelease));
    }

    @Test
    public void testStopDuringBuild() throws IOException {
        PackageRef root = pkg("A", "1.0", dep("B", "1.0"), dep("C", "1.0"));
        InMemoryPackageIndex index = new InMemoryPackageIndex()
                .add(root)
                .add(pkg("B", "1.0", dep("D", "1.0")))
                .add(pkg("C", "1.0"))
                .add(pkg("D", "1.0"));

        AtomicInteger polls = new AtomicInteger();
        CancellationToken token = () -> polls.incrementAndGet() > 2;
        ResolvedSet resolved = builder(index, Collections.emptySet()).build(root, token, (line) -> { });

        assertEquals(Arrays.asList("A 1.0", "B 1.0", "D 1.0"), names(resolved));
        assertFalse(index.getQueries().contains("C"));
    }

    @Test
    public void testStopBeforeFirstEdge() throws IOException {
        PackageRef root = pkg("A", "1.0", dep("B", "1.0"));
        InMemoryPackageIndex index = new InMemoryPackageIndex().add(root).add(pkg("B", "1.0"));

        ResolvedSet resolved = builder(index, Collections.emptySet()).build(root, () -> true, (line) -> { });
        assertEquals(Collections.singletonList("A 1.0"), names(resolved));
        assertTrue(index.getQueries().isEmpty());
    }
}
