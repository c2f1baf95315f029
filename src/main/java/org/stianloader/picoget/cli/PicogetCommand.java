package org.stianloader.picoget.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoget.DownloadRequest;
import org.stianloader.picoget.PackageDownloader;
import org.stianloader.picoget.RunStatus;
import org.stianloader.picoget.logging.LoggingAdapter;
import org.stianloader.picoget.progress.StopSignal;
import org.stianloader.picoget.repo.FrameworkNames;
import org.stianloader.picoget.repo.ODataPackageIndex;
import org.stianloader.picoget.repo.URLArchiveTransport;

import picocli.CommandLine;

/**
 * Command line front end, replacing the interactive form of earlier NuGet scrapers.
 * Progress lines are printed to standard output, diagnostics go through the {@link LoggingAdapter}.
 */
@CommandLine.Command(name = "picoget",
    mixinStandardHelpOptions = true,
    header = "Download a NuGet package together with all of its dependencies",
    description = "Resolves the transitive dependencies of the given package against a NuGet V2 feed\n"
        + "and downloads every package archive to the download directory.\n"
        + "Archives that already exist in the directory are not downloaded again,\n"
        + "so an interrupted run can be resumed by running it again.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: all packages downloaded",
        "1: package not found, invalid version or I/O failure",
        "130: stopped before completion"
    })
public class PicogetCommand implements Callable<Integer> {

    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_STOPPED = 130;

    /**
     * How long the shutdown hook waits for a stopped run to reach its final report, in milliseconds.
     */
    private static final long SHUTDOWN_GRACE_MILLIS = 5_000L;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PicogetCommand()).execute(args);
        System.exit(exitCode);
    }

    @CommandLine.Parameters(index = "0", paramLabel = "PACKAGE", description = "The id of the package to download")
    private String packageId;

    @CommandLine.Option(names = {"--package-version"}, paramLabel = "VERSION",
        description = "The version of the package. The latest version is used if absent.")
    private String packageVersion;

    @CommandLine.Option(names = {"--prerelease"}, description = "Allow prerelease versions to be selected")
    private boolean prerelease;

    @CommandLine.Option(names = {"-d", "--directory"}, paramLabel = "DIR", defaultValue = "download",
        description = "The directory to download to (default: ${DEFAULT-VALUE})")
    private Path directory;

    @CommandLine.Option(names = {"-f", "--framework"}, paramLabel = "FRAMEWORK",
        description = "A target framework whose dependencies should be followed, either as identifier "
            + "(.NETFramework, .NETStandard, .NETCore) or as moniker (net45, netstandard2.0). May be repeated. "
            + "All frameworks are accepted if absent.")
    private List<String> frameworks = new ArrayList<>();

    @CommandLine.Option(names = {"--feed"}, paramLabel = "URL", defaultValue = ODataPackageIndex.NUGET_ORG,
        description = "The NuGet V2 feed to resolve against (default: ${DEFAULT-VALUE})")
    private URI feed;

    @CommandLine.Option(names = {"--timeout"}, paramLabel = "MILLIS", defaultValue = "0",
        description = "Connect and read timeout for network requests, 0 to wait indefinitely")
    private int timeout;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @NotNull
    public DownloadRequest toRequest() {
        Set<@NotNull String> identifiers = new LinkedHashSet<>();
        for (String framework : this.frameworks) {
            String identifier = FrameworkNames.toIdentifier(framework);
            if (identifier != null) {
                identifiers.add(identifier);
            }
        }
        return new DownloadRequest(this.packageId, this.packageVersion, this.prerelease, this.directory, identifiers);
    }

    @Override
    public Integer call() {
        PrintWriter out = this.spec.commandLine().getOut();
        StopSignal signal = new StopSignal();
        CountDownLatch finished = new CountDownLatch(1);

        Thread hook = new Thread(() -> {
            if (signal.raise()) {
                try {
                    finished.await(PicogetCommand.SHUTDOWN_GRACE_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }, "picoget-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        ODataPackageIndex index = new ODataPackageIndex(this.feed)
                .setConnectTimeout(this.timeout)
                .setReadTimeout(this.timeout);
        URLArchiveTransport transport = new URLArchiveTransport()
                .setConnectTimeout(this.timeout)
                .setReadTimeout(this.timeout);

        try {
            RunStatus status = new PackageDownloader(index, transport).process(this.toRequest(), signal, (line) -> {
                out.println(line);
                out.flush();
            });
            return PicogetCommand.toExitCode(status);
        } catch (IOException e) {
            LoggingAdapter.getDefaultLogger().error(PicogetCommand.class, "Run of {} failed", this.packageId, e);
            this.spec.commandLine().getErr().println("Failed: " + e.getMessage());
            return PicogetCommand.EXIT_FAILURE;
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException shuttingDown) {
                // The hook is running already and waits for the latch released above
            }
        }
    }

    public static int toExitCode(@NotNull RunStatus status) {
        switch (status) {
        case DONE:
            return CommandLine.ExitCode.OK;
        case STOPPED:
            return PicogetCommand.EXIT_STOPPED;
        default:
            return PicogetCommand.EXIT_FAILURE;
        }
    }
}
