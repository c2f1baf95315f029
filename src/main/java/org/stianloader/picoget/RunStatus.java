package org.stianloader.picoget;

/**
 * How a {@link PackageDownloader#process(DownloadRequest) run} ended, if it ended without an exception.
 */
public enum RunStatus {
    /**
     * The closure was resolved and every archive is present in the download directory.
     */
    DONE,
    /**
     * The run observed a stop request.
     */
    STOPPED,
    /**
     * The root package (or the requested version of it) does not exist in the index.
     */
    NOT_FOUND,
    /**
     * The requested root version could not be parsed.
     */
    INVALID_VERSION;
}
