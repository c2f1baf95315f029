package org.stianloader.picoget;

import java.util.Collections;
import java.util.List;

import org.jetbrains.annotations.NotNull;

/**
 * The outcome of a download pass.
 *
 * @param downloaded The packages transferred during the pass
 * @param present The packages skipped because their archive already existed
 * @param stopped Whether the pass ended early because a stop was requested
 */
public final record DownloadSummary(@NotNull List<@NotNull PackageRef> downloaded, @NotNull List<@NotNull PackageRef> present, boolean stopped) {
    public DownloadSummary {
        downloaded = Collections.unmodifiableList(downloaded);
        present = Collections.unmodifiableList(present);
    }
}
