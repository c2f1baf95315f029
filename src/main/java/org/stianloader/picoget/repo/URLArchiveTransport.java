package org.stianloader.picoget.repo;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.picoget.internal.HttpUtil;
import org.stianloader.picoget.logging.LoggingAdapter;

/**
 * An {@link ArchiveTransport} that streams any URL supported by {@link java.net.URL} into a file.
 *
 * <p>Data is first written to a "&lt;target&gt;.part" file which is then atomically moved to the target,
 * so an interrupted transfer never masquerades as a complete archive.
 */
public class URLArchiveTransport implements ArchiveTransport {

    private int connectTimeout;
    private int readTimeout;

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public URLArchiveTransport setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    @NotNull
    @Contract(mutates = "this", pure = false, value = "_ -> this")
    public URLArchiveTransport setReadTimeout(int readTimeout) {
        this.readTimeout = readTimeout;
        return this;
    }

    private static void discard(@NotNull Path parts, @NotNull IOException cause) {
        try {
            Files.deleteIfExists(parts);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public void transfer(@NotNull URI source, @NotNull Path target) throws IOException {
        Path parts = target.resolveSibling(target.getFileName().toString() + ".part");
        long bytes;
        try (InputStream is = HttpUtil.openStream(source, this.connectTimeout, this.readTimeout)) {
            bytes = Files.copy(is, parts, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            URLArchiveTransport.discard(parts, e);
            throw e;
        }

        try {
            Files.move(parts, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            URLArchiveTransport.discard(parts, e);
            throw e;
        }
        LoggingAdapter.getDefaultLogger().debug(URLArchiveTransport.class, "Wrote {} bytes from {} to {}", bytes, source, target);
    }
}
