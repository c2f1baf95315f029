package org.stianloader.picoget.internal;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLConnection;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoget.logging.LoggingAdapter;

public class HttpUtil {

    /**
     * Opens a stream to the given resource. For HTTP(S) resources, responses outside the 2xx range
     * are reported as {@link IOException IOExceptions} instead of returning the error page.
     *
     * @param resource The resource to open
     * @param connectTimeout The connect timeout in milliseconds, 0 for none
     * @param readTimeout The read timeout in milliseconds, 0 for none
     * @return The opened stream, which the caller has to close
     * @throws IOException If the connection could not be established or the server returned an error
     */
    @NotNull
    public static InputStream openStream(@NotNull URI resource, int connectTimeout, int readTimeout) throws IOException {
        LoggingAdapter.getDefaultLogger().debug(HttpUtil.class, "Fetching {}", resource);
        URLConnection connection = resource.toURL().openConnection();
        connection.setConnectTimeout(connectTimeout);
        connection.setReadTimeout(readTimeout);
        if (connection instanceof HttpURLConnection) {
            HttpURLConnection httpUrlConn = (HttpURLConnection) connection;
            httpUrlConn.setInstanceFollowRedirects(true);
            int responseCode = httpUrlConn.getResponseCode();
            if ((responseCode / 100) != 2) {
                httpUrlConn.disconnect();
                throw new IOException("Query for " + connection.getURL() + " returned with a response code of " + responseCode + " (" + httpUrlConn.getResponseMessage() + ")");
            }
        }
        return connection.getInputStream();
    }
}
