package org.stianloader.picoget.repo;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;

/**
 * Copies a remote package archive to a local file.
 */
@FunctionalInterface
public interface ArchiveTransport {

    /**
     * Transfers the resource to the target file.
     *
     * <p>Implementations MUST NOT leave a file at {@code target} if the transfer fails, as the existence of
     * the target is what marks a package as downloaded.
     *
     * @param source The location of the archive
     * @param target The file to write to. Its parent directory exists.
     * @throws IOException If the transfer failed
     */
    void transfer(@NotNull URI source, @NotNull Path target) throws IOException;
}
