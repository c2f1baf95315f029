package org.stianloader.picoget.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.stianloader.picoget.test.InMemoryPackageIndex.pkg;

import org.junit.jupiter.api.Test;
import org.stianloader.picoget.PackageIdentity;
import org.stianloader.picoget.PackageRef;
import org.stianloader.picoget.ResolvedSet;
import org.stianloader.picoget.version.NuGetVersion;

public class ResolvedSetTest {

    @Test
    public void testUniqueByIdentity() {
        ResolvedSet set = new ResolvedSet();
        assertTrue(set.isEmpty());

        PackageRef first = pkg("System.Memory", "4.5.0");
        assertTrue(set.add(first));
        assertFalse(set.add(pkg("system.memory", "4.5.0.0")));
        assertTrue(set.add(pkg("System.Memory", "4.5.1")));

        assertEquals(2, set.size());
        assertFalse(set.isEmpty());
        assertEquals(first, set.asList().get(0));
        assertTrue(set.contains(new PackageIdentity("SYSTEM.MEMORY", NuGetVersion.parse("4.5"))));
        assertFalse(set.contains(new PackageIdentity("System.Memory", NuGetVersion.parse("4.6"))));
    }

    @Test
    public void testListIsReadOnly() {
        ResolvedSet set = new ResolvedSet();
        set.add(pkg("A", "1.0"));
        assertThrows(UnsupportedOperationException.class, () -> set.asList().clear());
    }
}
