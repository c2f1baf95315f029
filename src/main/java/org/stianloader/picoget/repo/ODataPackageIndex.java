package org.stianloader.picoget.repo;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.picoget.DependencySet;
import org.stianloader.picoget.DependencySpec;
import org.stianloader.picoget.PackageRef;
import org.stianloader.picoget.internal.HttpUtil;
import org.stianloader.picoget.internal.XMLUtil;
import org.stianloader.picoget.internal.XMLUtil.ChildElementIterable;
import org.stianloader.picoget.logging.LoggingAdapter;
import org.stianloader.picoget.version.NuGetVersion;
import org.stianloader.picoget.version.VersionRange;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * A {@link PackageIndex} backed by a NuGet V2 (OData/Atom) feed, such as <code>https://www.nuget.org/api/v2/</code>.
 *
 * <p>Only the FindPackagesById function of the feed is used. Result pages are followed through their
 * "next" links until the feed reports no further page.
 */
public class ODataPackageIndex implements PackageIndex {

    @NotNull
    public static final String NUGET_ORG = "https://www.nuget.org/api/v2/";

    /**
     * The characters NuGet permits in package ids. Ids end up in file names, so anything else is rejected.
     */
    private static final Pattern PACKAGE_ID = Pattern.compile("[A-Za-z0-9_.-]+");

    /**
     * Upper bound for the amount of result pages fetched for a single package id.
     * Protects against feeds whose "next" links never end.
     */
    private static final int MAX_PAGES = 1000;

    /**
     * Parses the dependency string of a V2 feed entry. The string consists of
     * "id:range:framework" triples separated by '|'. The range and framework parts may be empty
     * or absent. A triple with an empty id declares a framework without dependencies.
     *
     * <p>Dependencies are grouped by their framework moniker in order of first appearance.
     * Entries whose range cannot be parsed are logged and dropped.
     *
     * @param dependencies The dependency string, may be null or empty
     * @return The parsed dependency sets
     */
    @NotNull
    public static List<@NotNull DependencySet> parseDependencies(@Nullable String dependencies) {
        if (dependencies == null || dependencies.trim().isEmpty()) {
            return Collections.emptyList();
        }

        // Keyed by the raw moniker; different monikers may share an identifier ("net40" and "net45")
        Map<String, List<@NotNull DependencySpec>> groups = new LinkedHashMap<>();
        Map<String, String> identifiers = new LinkedHashMap<>();

        for (String triple : dependencies.split("\\|")) {
            if (triple.trim().isEmpty()) {
                continue;
            }
            String[] parts = triple.split(":", -1);
            String id = parts[0].trim();
            String range = parts.length > 1 ? parts[1].trim() : "";
            String moniker = parts.length > 2 ? parts[2].trim() : "";
            String key = moniker.toLowerCase(Locale.ROOT);

            List<@NotNull DependencySpec> group = groups.get(key);
            if (group == null) {
                group = new ArrayList<>();
                groups.put(key, group);
                identifiers.put(key, FrameworkNames.toIdentifier(moniker));
            }

            if (id.isEmpty()) {
                continue;
            }

            try {
                group.add(new DependencySpec(id, VersionRange.parse(range)));
            } catch (IllegalArgumentException e) {
                LoggingAdapter.getDefaultLogger().warn(ODataPackageIndex.class, "Ignoring dependency {} with unparsable version range \"{}\"", id, range, e);
            }
        }

        List<@NotNull DependencySet> sets = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<@NotNull DependencySpec>> entry : groups.entrySet()) {
            sets.add(new DependencySet(identifiers.get(entry.getKey()), entry.getValue()));
        }
        return sets;
    }

    /**
     * Parses a single Atom entry of the feed.
     *
     * @param entry The entry element
     * @return The parsed package, or null if the entry lacks a valid id or a valid version
     */
    @Nullable
    public static PackageRef parseEntry(@NotNull Element entry) {
        Element properties = XMLUtil.optElement(entry, "properties");
        if (properties == null) {
            return null;
        }

        String id = ODataPackageIndex.trimToNull(XMLUtil.elementText(properties, "Id"));
        if (id == null) {
            // nuget.org only carries the id in the Atom title
            id = ODataPackageIndex.trimToNull(XMLUtil.elementText(entry, "title"));
        }
        NuGetVersion version = NuGetVersion.tryParse(XMLUtil.elementText(properties, "Version"));
        if (id == null || version == null) {
            return null;
        }
        if (!ODataPackageIndex.PACKAGE_ID.matcher(id).matches()) {
            LoggingAdapter.getDefaultLogger().warn(ODataPackageIndex.class, "Rejecting entry with illegal package id \"{}\"", id);
            return null;
        }

        String title = ODataPackageIndex.trimToNull(XMLUtil.elementText(properties, "Title"));
        if (title == null) {
            title = id;
        }

        String isPrerelease = XMLUtil.elementText(properties, "IsPrerelease");
        boolean prerelease = isPrerelease == null ? version.isPrerelease() : Boolean.parseBoolean(isPrerelease.trim());
        boolean latest = Boolean.parseBoolean(String.valueOf(XMLUtil.elementText(properties, "IsLatestVersion")).trim());

        URI downloadUrl = null;
        Element content = XMLUtil.optElement(entry, "content");
        if (content != null) {
            String src = ODataPackageIndex.trimToNull(content.getAttribute("src"));
            if (src != null) {
                try {
                    downloadUrl = URI.create(src);
                } catch (IllegalArgumentException e) {
                    LoggingAdapter.getDefaultLogger().warn(ODataPackageIndex.class, "Package {} {} advertises a malformed download URL: {}", id, version, src);
                }
            }
        }

        List<@NotNull DependencySet> sets = ODataPackageIndex.parseDependencies(XMLUtil.elementText(properties, "Dependencies"));
        return new PackageRef(id, version, title, prerelease, latest, downloadUrl, sets);
    }

    /**
     * Parses a page of a feed, appending all valid entries to the sink.
     *
     * @param is The stream to read the page from
     * @param pageLocation The location the page was fetched from, used to resolve relative links
     * @param sink The list the parsed packages are appended to
     * @return The location of the next page, or null if this was the last page
     * @throws IOException If the stream could not be read or does not contain valid XML
     */
    @Nullable
    public static URI parseFeed(@NotNull InputStream is, @NotNull URI pageLocation, @NotNull List<@NotNull PackageRef> sink) throws IOException {
        Document xmlDoc = XMLUtil.parse(is);
        Element feed = xmlDoc.getDocumentElement();
        URI next = null;

        for (Element element : new ChildElementIterable(feed)) {
            String name = XMLUtil.localName(element);
            if (name.equals("entry")) {
                PackageRef ref = ODataPackageIndex.parseEntry(element);
                if (ref == null) {
                    LoggingAdapter.getDefaultLogger().warn(ODataPackageIndex.class, "Skipping malformed feed entry in page {}", pageLocation);
                } else {
                    sink.add(ref);
                }
            } else if (name.equals("link") && "next".equals(element.getAttribute("rel"))) {
                String href = ODataPackageIndex.trimToNull(element.getAttribute("href"));
                if (href != null) {
                    next = pageLocation.resolve(href);
                }
            }
        }

        return next;
    }

    @Nullable
    @Contract(pure = true, value = "null -> null")
    private static String trimToNull(@Nullable String string) {
        if (string == null) {
            return null;
        }
        string = string.trim();
        return string.isEmpty() ? null : string;
    }

    @NotNull
    private final URI base;
    private int connectTimeout;
    private int readTimeout;

    public ODataPackageIndex(@NotNull URI base) {
        if (base.getPath() == null || base.getPath().isEmpty()) {
            base = base.resolve("/");
        } else if (!base.getPath().endsWith("/")) {
            base = base.resolve(base.getPath() + "/");
        }
        this.base = base;
    }

    @Override
    @NotNull
    public List<@NotNull PackageRef> findPackagesById(@NotNull String packageId) throws IOException {
        List<@NotNull PackageRef> candidates = new ArrayList<>();
        URI page = this.getQueryURI(packageId);
        int pages = 0;
        while (page != null) {
            if (++pages > ODataPackageIndex.MAX_PAGES) {
                throw new IOException("Feed " + this.base + " returned more than " + ODataPackageIndex.MAX_PAGES + " pages for package " + packageId);
            }
            try (InputStream is = HttpUtil.openStream(page, this.connectTimeout, this.readTimeout)) {
                page = ODataPackageIndex.parseFeed(is, page, candidates);
            }
        }
        LoggingAdapter.getDefaultLogger().debug(ODataPackageIndex.class, "Feed {} lists {} versions of {}", this.base, candidates.size(), packageId);
        return candidates;
    }

    @NotNull
    @Contract(pure = true)
    public URI getBase() {
        return this.base;
    }

    @NotNull
    @Contract(pure = true)
    public URI getQueryURI(@NotNull String packageId) {
        String quoted = URLEncoder.encode("'" + packageId + "'", StandardCharsets.UTF_8);
        return this.base.resolve("FindPackagesById()?id=" + quoted);
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ODataPackageIndex setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public ODataPackageIndex setReadTimeout(int readTimeout) {
        this.readTimeout = readTimeout;
        return this;
    }
}
