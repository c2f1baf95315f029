package org.stianloader.picoget;

import java.io.IOException;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoget.logging.LoggingAdapter;
import org.stianloader.picoget.progress.CancellationToken;
import org.stianloader.picoget.progress.ProgressSink;
import org.stianloader.picoget.repo.ArchiveTransport;
import org.stianloader.picoget.repo.PackageIndex;
import org.stianloader.picoget.version.NuGetVersion;

/**
 * Drives a complete run: resolving the root package, building its dependency closure and downloading
 * the archives of the closure.
 *
 * <p>A {@link PackageDownloader} holds no per-run state and may be reused for any number of runs.
 * Each run reports its progress as human-readable lines and finishes with either "Done." or "Stopped."
 * unless it aborted early because the root package could not be resolved.
 */
public class PackageDownloader {

    @NotNull
    private final PackageIndex index;
    @NotNull
    private final ArchiveTransport transport;

    public PackageDownloader(@NotNull PackageIndex index, @NotNull ArchiveTransport transport) {
        this.index = Objects.requireNonNull(index, "index may not be null");
        this.transport = Objects.requireNonNull(transport, "transport may not be null");
    }

    /**
     * Executes a run that cannot be stopped, reporting its progress to the {@link ProgressSink#logging() log}.
     *
     * @param request The inputs of the run
     * @return How the run ended
     * @throws IOException If the index could not be queried or an archive could not be transferred
     */
    @NotNull
    public RunStatus process(@NotNull DownloadRequest request) throws IOException {
        return this.process(request, CancellationToken.NONE, ProgressSink.logging());
    }

    /**
     * Executes a run.
     *
     * <p>The token is polled before the closure is built, before every dependency edge, after the closure
     * was built and before every download.
     *
     * @param request The inputs of the run
     * @param token The stop predicate of the run
     * @param progress The sink receiving the progress lines of the run
     * @return How the run ended
     * @throws IOException If the index could not be queried or an archive could not be transferred.
     * Archives downloaded before the failure are kept, so the run can be repeated to resume it.
     */
    @NotNull
    public RunStatus process(@NotNull DownloadRequest request, @NotNull CancellationToken token, @NotNull ProgressSink progress) throws IOException {
        if (token.isStopRequested()) {
            progress.progress("Stopped.");
            return RunStatus.STOPPED;
        }

        VersionResolver resolver = new VersionResolver(this.index);
        PackageRef root;
        if (request.isLatestRequested()) {
            root = resolver.resolveLatest(request.packageId(), request.prerelease());
        } else {
            String versionString = Objects.requireNonNull(request.version());
            NuGetVersion version = NuGetVersion.tryParse(versionString);
            if (version == null) {
                LoggingAdapter.getDefaultLogger().debug(PackageDownloader.class, "Rejected version \"{}\" of {}", versionString, request.packageId());
                progress.progress("Unable to parse package version.");
                return RunStatus.INVALID_VERSION;
            }
            root = resolver.resolveExact(request.packageId(), version);
        }

        if (root == null) {
            progress.progress("Package not found.");
            return RunStatus.NOT_FOUND;
        }

        progress.progress(root.getFullName());
        DependencyGraphBuilder builder = new DependencyGraphBuilder(resolver, request.prerelease(), request.targetFrameworks());
        ResolvedSet resolved = builder.build(root, token, progress);

        if (token.isStopRequested()) {
            progress.progress("Stopped.");
            return RunStatus.STOPPED;
        }

        progress.progress(resolved.size() + " packages to download.");
        DownloadSummary summary = new DownloadOrchestrator(this.transport).download(request.directory(), resolved, token, progress);
        LoggingAdapter.getDefaultLogger().debug(PackageDownloader.class, "Downloaded {} packages, {} were already present", summary.downloaded().size(), summary.present().size());

        if (summary.stopped() || token.isStopRequested()) {
            progress.progress("Stopped.");
            return RunStatus.STOPPED;
        }

        progress.progress("Done.");
        return RunStatus.DONE;
    }
}
