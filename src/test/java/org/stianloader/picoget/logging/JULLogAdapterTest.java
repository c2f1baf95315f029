package org.stianloader.picoget.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;

import org.junit.jupiter.api.Test;

public class JULLogAdapterTest {

    @Test
    public void testPlaceholders() {
        assertEquals("Downloaded A 1.0 to /tmp/x", JULLogAdapter.formatMessage("Downloaded {} to {}", "A 1.0", "/tmp/x"));
        assertEquals("no placeholders", JULLogAdapter.formatMessage("no placeholders"));
        assertEquals("null value", JULLogAdapter.formatMessage("{} value", (Object) null));
    }

    @Test
    public void testMissingAndSurplusArguments() {
        assertEquals("a missing {}", JULLogAdapter.formatMessage("{} missing {}", "a"));
        assertEquals("x 1 2", JULLogAdapter.formatMessage("x {}", 1, 2));
    }

    @Test
    public void testTrailingThrowable() {
        String message = JULLogAdapter.formatMessage("Run of {} failed", "App", new IOException("boom"));
        assertTrue(message.startsWith("Run of App failed\njava.io.IOException: boom"), message);
    }
}
