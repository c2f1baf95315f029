package org.stianloader.picoget.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.stianloader.picoget.DependencySet;
import org.stianloader.picoget.DependencySpec;
import org.stianloader.picoget.PackageRef;
import org.stianloader.picoget.repo.FrameworkNames;
import org.stianloader.picoget.repo.ODataPackageIndex;
import org.stianloader.picoget.version.NuGetVersion;
import org.stianloader.picoget.version.VersionRange;

public class ODataPackageIndexTest {

    private static final URI PAGE_LOCATION = URI.create("https://www.nuget.org/api/v2/FindPackagesById()?id=%27Example.Lib%27");

    private static URI parsePage(String resource, List<PackageRef> sink) throws IOException {
        try (InputStream is = ODataPackageIndexTest.class.getResourceAsStream(resource)) {
            assertNotNull(is, "Missing test resource " + resource);
            return ODataPackageIndex.parseFeed(is, PAGE_LOCATION, sink);
        }
    }

    @Test
    public void testQueryURI() {
        ODataPackageIndex index = new ODataPackageIndex(URI.create("https://www.nuget.org/api/v2"));
        assertEquals(URI.create("https://www.nuget.org/api/v2/"), index.getBase());
        assertEquals(PAGE_LOCATION, index.getQueryURI("Example.Lib"));
        assertEquals(URI.create("https://example.invalid/FindPackagesById()?id=%27A+B%27"), new ODataPackageIndex(URI.create("https://example.invalid")).getQueryURI("A B"));
    }

    @Test
    public void testParseFirstPage() throws IOException {
        List<PackageRef> packages = new ArrayList<>();
        URI next = parsePage("/feeds/example-lib-page1.xml", packages);

        assertEquals(URI.create("https://www.nuget.org/api/v2/FindPackagesById?id='Example.Lib'&$skiptoken=2"), next);
        // The entry without a valid version is skipped
        assertEquals(2, packages.size());

        PackageRef release = packages.get(0);
        assertEquals("Example.Lib", release.id());
        assertEquals("Example Library", release.title());
        assertEquals(NuGetVersion.parse("1.0.0"), release.version());
        assertFalse(release.prerelease());
        assertTrue(release.latestRelease());
        assertEquals(URI.create("https://www.nuget.org/api/v2/package/Example.Lib/1.0.0"), release.downloadUrl());
        assertEquals(2, release.dependencySets().size());
        assertEquals(FrameworkNames.NET_FRAMEWORK, release.dependencySets().get(0).targetFramework());
        assertEquals(FrameworkNames.NET_STANDARD, release.dependencySets().get(1).targetFramework());
        assertEquals(Arrays.asList(
                new DependencySpec("Example.Core", VersionRange.atLeast(NuGetVersion.parse("1.0.0"))),
                new DependencySpec("System.Memory", VersionRange.atLeast(NuGetVersion.parse("4.5.0")))),
                release.dependencySets().get(1).dependencies());

        PackageRef beta = packages.get(1);
        assertEquals("Example.Lib", beta.title());
        assertTrue(beta.prerelease());
        assertFalse(beta.latestRelease());
        assertEquals("2.0.0-beta.1", beta.version().getOriginText());
        assertTrue(beta.dependencySets().isEmpty());
    }

    @Test
    public void testParseLastPage() throws IOException {
        List<PackageRef> packages = new ArrayList<>();
        assertNull(parsePage("/feeds/example-lib-page2.xml", packages));
        assertEquals(1, packages.size());

        PackageRef old = packages.get(0);
        assertNull(old.downloadUrl());
        assertFalse(old.latestRelease());
        assertEquals(Collections.singletonList(new DependencySet(FrameworkNames.NET_FRAMEWORK, Collections.emptyList())), old.dependencySets());
        assertTrue(old.getApplicableDependencies(Collections.emptySet()).isEmpty());
    }

    @Test
    public void testMalformedFeed() {
        InputStream is = new ByteArrayInputStream("<feed><entry>".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> ODataPackageIndex.parseFeed(is, PAGE_LOCATION, new ArrayList<>()));
    }

    @Test
    public void testIllegalPackageIdIsSkipped() throws IOException {
        String feed = "<feed xmlns=\"http://www.w3.org/2005/Atom\""
                + " xmlns:d=\"http://schemas.microsoft.com/ado/2007/08/dataservices\""
                + " xmlns:m=\"http://schemas.microsoft.com/ado/2007/08/dataservices/metadata\">"
                + "<entry><title type=\"text\">../escaped</title>"
                + "<content type=\"application/zip\" src=\"https://example.invalid/escaped\"/>"
                + "<m:properties><d:Version>1.0</d:Version></m:properties></entry>"
                + "<entry><content type=\"application/zip\" src=\"https://example.invalid/slash\"/>"
                + "<m:properties><d:Id>evil/name</d:Id><d:Version>1.0</d:Version></m:properties></entry>"
                + "<entry><content type=\"application/zip\" src=\"https://example.invalid/good\"/>"
                + "<m:properties><d:Id>Good_Package-1.x</d:Id><d:Version>1.0</d:Version></m:properties></entry>"
                + "</feed>";

        List<PackageRef> packages = new ArrayList<>();
        ODataPackageIndex.parseFeed(new ByteArrayInputStream(feed.getBytes(StandardCharsets.UTF_8)), PAGE_LOCATION, packages);

        assertEquals(1, packages.size());
        assertEquals("Good_Package-1.x", packages.get(0).id());
    }

    @Test
    public void testParseDependencies() {
        List<DependencySet> sets = ODataPackageIndex.parseDependencies("A:[1.0, ):net45|B:1.0:net45|A:[1.0, ):netstandard2.0|::net40|C::|D:[bad:|E");
        assertEquals(4, sets.size());

        assertEquals(FrameworkNames.NET_FRAMEWORK, sets.get(0).targetFramework());
        assertEquals(Arrays.asList(
                new DependencySpec("A", VersionRange.atLeast(NuGetVersion.parse("1.0"))),
                new DependencySpec("B", VersionRange.atLeast(NuGetVersion.parse("1.0")))),
                sets.get(0).dependencies());

        assertEquals(FrameworkNames.NET_STANDARD, sets.get(1).targetFramework());
        assertEquals(1, sets.get(1).dependencies().size());

        // "net40" keeps its own, empty, group
        assertEquals(FrameworkNames.NET_FRAMEWORK, sets.get(2).targetFramework());
        assertTrue(sets.get(2).dependencies().isEmpty());

        assertNull(sets.get(3).targetFramework());
        assertEquals(Arrays.asList(new DependencySpec("C", VersionRange.ALL), new DependencySpec("E", VersionRange.ALL)), sets.get(3).dependencies());
        assertSame(VersionRange.ALL, sets.get(3).dependencies().get(0).range());
    }

    @Test
    public void testParseNoDependencies() {
        assertTrue(ODataPackageIndex.parseDependencies(null).isEmpty());
        assertTrue(ODataPackageIndex.parseDependencies("").isEmpty());
        assertTrue(ODataPackageIndex.parseDependencies("  ").isEmpty());
    }
}
