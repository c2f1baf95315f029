package org.stianloader.picoget.repo;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Maps the target framework monikers found in package metadata to framework identifiers.
 *
 * <p>Feeds use short folder names such as "net45", "netstandard2.0" or "portable-net45+win8"
 * while older metadata may carry full names such as ".NETFramework4.5" or ".NETFramework,Version=v4.5".
 * Dependency filtering only cares about the identifier part (".NETFramework", ".NETStandard", ...),
 * the framework version is dropped.
 */
public final class FrameworkNames {

    public static final String NET_CORE = ".NETCore";
    public static final String NET_CORE_APP = ".NETCoreApp";
    public static final String NET_FRAMEWORK = ".NETFramework";
    public static final String NET_PORTABLE = ".NETPortable";
    public static final String NET_STANDARD = ".NETStandard";

    private static final Map<String, String> SHORT_NAMES = new HashMap<>();

    static {
        SHORT_NAMES.put("net", NET_FRAMEWORK);
        SHORT_NAMES.put("netframework", NET_FRAMEWORK);
        SHORT_NAMES.put("netstandard", NET_STANDARD);
        SHORT_NAMES.put("netcoreapp", NET_CORE_APP);
        SHORT_NAMES.put("netcore", NET_CORE);
        SHORT_NAMES.put("win", NET_CORE);
        SHORT_NAMES.put("winrt", NET_CORE);
        SHORT_NAMES.put("portable", NET_PORTABLE);
        SHORT_NAMES.put("netmf", ".NETMicroFramework");
        SHORT_NAMES.put("sl", "Silverlight");
        SHORT_NAMES.put("wp", "WindowsPhone");
        SHORT_NAMES.put("wpa", "WindowsPhoneApp");
        SHORT_NAMES.put("uap", "UAP");
        SHORT_NAMES.put("monoandroid", "MonoAndroid");
        SHORT_NAMES.put("monotouch", "MonoTouch");
        SHORT_NAMES.put("monomac", "MonoMac");
        SHORT_NAMES.put("xamarinios", "Xamarin.iOS");
        SHORT_NAMES.put("xamarinmac", "Xamarin.Mac");
        SHORT_NAMES.put("xamarintvos", "Xamarin.TVOS");
        SHORT_NAMES.put("xamarinwatchos", "Xamarin.WatchOS");
        SHORT_NAMES.put("tizen", "Tizen");
        SHORT_NAMES.put("native", "native");
    }

    /**
     * Obtains the framework identifier of a framework moniker.
     *
     * @param framework The moniker, short or full
     * @return The identifier, or null if the moniker is null or blank (which denotes "any framework")
     */
    @Nullable
    @Contract(pure = true, value = "null -> null")
    public static String toIdentifier(@Nullable String framework) {
        if (framework == null) {
            return null;
        }
        String moniker = framework.trim();
        if (moniker.isEmpty()) {
            return null;
        }

        if (moniker.charAt(0) == '.' || moniker.indexOf(',') != -1) {
            // Full name, ".NETFramework4.5" or ".NETFramework,Version=v4.5"
            int comma = moniker.indexOf(',');
            String identifier = comma == -1 ? moniker : moniker.substring(0, comma);
            int dash = identifier.indexOf('-');
            if (dash != -1) {
                identifier = identifier.substring(0, dash);
            }
            return FrameworkNames.stripVersion(identifier.trim());
        }

        // Platform suffixes such as "net6.0-windows" and the profile of "portable-net45+win8" are irrelevant
        String lower = moniker.toLowerCase(Locale.ROOT);
        int dash = lower.indexOf('-');
        if (dash != -1) {
            lower = lower.substring(0, dash);
        }

        int versionStart = 0;
        while (versionStart < lower.length() && Character.isLetter(lower.charAt(versionStart))) {
            versionStart++;
        }
        String letters = lower.substring(0, versionStart);
        String version = lower.substring(versionStart);

        if (letters.equals("net") && FrameworkNames.isNetCoreAppVersion(version)) {
            // net5.0 and newer are the continuation of netcoreapp
            return NET_CORE_APP;
        }

        String identifier = SHORT_NAMES.get(letters);
        if (identifier != null) {
            return identifier;
        }
        return FrameworkNames.stripVersion(moniker);
    }

    private static boolean isNetCoreAppVersion(@NotNull String version) {
        int dot = version.indexOf('.');
        if (dot <= 0) {
            // "net45" or "net" - the old dotless notation is always .NET Framework
            return false;
        }
        try {
            return Integer.parseInt(version.substring(0, dot)) >= 5;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    @NotNull
    private static String stripVersion(@NotNull String name) {
        int end = name.length();
        while (end > 1 && (Character.isDigit(name.charAt(end - 1)) || name.charAt(end - 1) == '.')) {
            end--;
        }
        return name.substring(0, end);
    }

    private FrameworkNames() {
        throw new AssertionError();
    }
}
