package org.stianloader.picoget;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoget.logging.LoggingAdapter;
import org.stianloader.picoget.progress.CancellationToken;
import org.stianloader.picoget.progress.ProgressSink;
import org.stianloader.picoget.repo.ArchiveTransport;

/**
 * Fetches the archives of resolved packages into a directory.
 *
 * <p>Every package is stored as "&lt;id&gt;.&lt;version&gt;.nupkg" within the destination directory.
 * Packages whose file already exists are not fetched again, which makes repeated passes over the same
 * directory cheap and lets an interrupted pass be resumed by simply running it again.
 */
public class DownloadOrchestrator {

    @NotNull
    public static final String ARCHIVE_EXTENSION = "nupkg";

    @NotNull
    private final ArchiveTransport transport;

    public DownloadOrchestrator(@NotNull ArchiveTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public static String getFileName(@NotNull PackageRef ref) {
        return ref.id() + '.' + ref.version().getOriginText() + '.' + DownloadOrchestrator.ARCHIVE_EXTENSION;
    }

    /**
     * Downloads all packages, in the order of the given set.
     *
     * <p>The cancellation token is polled before every package. A transfer that already started is
     * always carried out to its end.
     *
     * @param directory The destination directory, created with its parents if absent
     * @param packages The packages to download
     * @param token The token to poll
     * @param progress The sink receiving "already downloaded" and "downloading" lines
     * @return A summary of the pass
     * @throws IOException If the directory could not be created, a package would be stored outside of it
     * or a transfer failed. No further packages are downloaded in that case.
     */
    @NotNull
    public DownloadSummary download(@NotNull Path directory, @NotNull ResolvedSet packages, @NotNull CancellationToken token, @NotNull ProgressSink progress) throws IOException {
        Files.createDirectories(directory);
        Path root = directory.toAbsolutePath().normalize();

        List<@NotNull PackageRef> downloaded = new ArrayList<>();
        List<@NotNull PackageRef> present = new ArrayList<>();

        for (PackageRef ref : packages) {
            if (token.isStopRequested()) {
                return new DownloadSummary(downloaded, present, true);
            }

            Path file = directory.resolve(DownloadOrchestrator.getFileName(ref));
            if (!file.toAbsolutePath().normalize().startsWith(root)) {
                throw new IOException("Refusing to write " + ref.getFullName() + " outside of " + root + ": " + file);
            }
            if (Files.exists(file)) {
                progress.progress(file + " already downloaded.");
                present.add(ref);
                continue;
            }

            URI source = ref.downloadUrl();
            if (source == null) {
                throw new IOException("The index did not advertise a download location for " + ref.getFullName());
            }

            progress.progress("downloading " + ref.id() + " " + ref.version());
            this.transport.transfer(source, file);
            LoggingAdapter.getDefaultLogger().info(DownloadOrchestrator.class, "Downloaded {} to {}", ref.getFullName(), file);
            downloaded.add(ref);
        }

        return new DownloadSummary(downloaded, present, false);
    }
}
