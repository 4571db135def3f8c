package org.stianloader.refresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;
import org.stianloader.refresolve.version.PackageVersion;
import org.stianloader.refresolve.version.VersionRange;

public class VersionRangeTest {

    private boolean contains(@NotNull String range, @NotNull String version) {
        return VersionRange.parse(range).containsVersion(PackageVersion.parse(version));
    }

    @Test
    public void testPlainVersionIsMinimum() {
        assertTrue(contains("1.0.0", "1.0.0"));
        assertTrue(contains("1.0.0", "5.0.0"));
        assertFalse(contains("1.0.0", "0.9.0"));
        assertEquals(PackageVersion.parse("1.0.0"), VersionRange.parse("1.0.0").getMinVersion());
        assertTrue(VersionRange.parse("1.0.0").isMinInclusive());
    }

    @Test
    public void testIntervals() {
        assertTrue(contains("[1.0.0,2.0.0)", "1.0.0"));
        assertTrue(contains("[1.0.0,2.0.0)", "1.9.9"));
        assertFalse(contains("[1.0.0,2.0.0)", "2.0.0"));
        assertFalse(contains("(1.0.0,2.0.0]", "1.0.0"));
        assertTrue(contains("(1.0.0,2.0.0]", "2.0.0"));
        assertTrue(contains("[1.0]", "1.0.0"));
        assertFalse(contains("[1.0]", "1.0.1"));
        assertTrue(contains("(,2.0)", "0.1"));
        assertFalse(contains("(,2.0)", "2.0"));
        assertTrue(contains("[2.0,)", "3.0"));
    }

    @Test
    public void testUnbounded() {
        assertSame(VersionRange.ALL, VersionRange.parse(""));
        assertSame(VersionRange.ALL, VersionRange.parse("*"));
        assertSame(VersionRange.ALL, VersionRange.parse("(,)"));
        assertNull(VersionRange.ALL.getMinVersion());
        assertNull(VersionRange.parse("(,2.0)").getMinVersion());
    }

    @Test
    public void testExclusiveLowerBound() {
        VersionRange range = VersionRange.parse("(1.0.0,)");
        assertEquals(PackageVersion.parse("1.0.0"), range.getMinVersion());
        assertFalse(range.isMinInclusive());
    }

    @Test
    public void testIntersection() {
        VersionRange range = VersionRange.parse("[1.0,3.0)").intersect(VersionRange.parse("[2.0,)"));
        assertFalse(range.containsVersion(PackageVersion.parse("1.5")));
        assertTrue(range.containsVersion(PackageVersion.parse("2.5")));
        assertFalse(range.containsVersion(PackageVersion.parse("3.0")));
        assertEquals(PackageVersion.parse("2.0"), range.getMinVersion());
    }

    @Test
    public void testSelectLowest() {
        VersionRange range = VersionRange.parse("[1.5,)");
        PackageVersion selected = range.selectLowest(Arrays.asList(PackageVersion.parse("3.0"), PackageVersion.parse("1.0"), PackageVersion.parse("1.6"), PackageVersion.parse("2.0")));
        assertEquals(PackageVersion.parse("1.6"), selected);
        assertNull(VersionRange.parse("[4.0,)").selectLowest(Arrays.asList(PackageVersion.parse("1.0"))));
    }

    @Test
    public void testInvalidRanges() {
        assertThrows(IllegalArgumentException.class, () -> VersionRange.parse("[1.0,2.0"));
        assertThrows(IllegalArgumentException.class, () -> VersionRange.parse("[2.0,1.0]"));
        assertThrows(IllegalArgumentException.class, () -> VersionRange.parse("[1.0,2.0,3.0]"));
        assertThrows(IllegalArgumentException.class, () -> VersionRange.parse("(1.0)"));
    }
}
