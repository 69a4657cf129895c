package com.work.archive.core.version;

import com.work.archive.core.exception.SchemaNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class VersionResolverTest {

    private VersionResolver resolver;

    @BeforeEach
    public void setUp() {
        resolver = new VersionResolver();
        assertTrue(resolver.insert(0, 10));
        assertTrue(resolver.insert(100, 11));
        assertTrue(resolver.insert(250, 12));
    }

    @Test
    public void resolves_greatest_breakpoint_not_above_height() {
        assertEquals(10, resolver.resolve(0));
        assertEquals(10, resolver.resolve(99));
        assertEquals(11, resolver.resolve(100));
        assertEquals(11, resolver.resolve(150));
        assertEquals(12, resolver.resolve(250));
        assertEquals(12, resolver.resolve(300));
    }

    @Test
    public void negative_height_is_not_found() {
        SchemaNotFoundException e = assertThrows(SchemaNotFoundException.class, () -> resolver.resolve(-1));
        assertEquals(-1, e.getHeight());
    }

    @Test
    public void height_before_first_breakpoint_is_not_found() {
        VersionResolver late = new VersionResolver();
        late.insert(500, 3);
        assertThrows(SchemaNotFoundException.class, () -> late.resolve(499));
        assertEquals(3, late.resolve(500));
    }

    @Test
    public void empty_resolver_is_not_found() {
        assertThrows(SchemaNotFoundException.class, () -> new VersionResolver().resolve(0));
    }

    @Test
    public void insert_is_append_only() {
        // 同高度
        assertFalse(resolver.insert(250, 13));
        // 低于尾部
        assertFalse(resolver.insert(120, 13));
        // 与尾部同版本
        assertFalse(resolver.insert(400, 12));
        assertEquals(3, resolver.snapshot().size());

        assertTrue(resolver.insert(400, 13));
        assertEquals(13, resolver.resolve(400));
        assertEquals(11, resolver.resolve(150));
        assertEquals(new VersionBreakpoint(400, 13).getHeight(), resolver.latest().get().getHeight());
    }

    @Test
    public void insert_rejects_negative_values() {
        assertThrows(IllegalArgumentException.class, () -> resolver.insert(-5, 1));
        assertThrows(IllegalArgumentException.class, () -> resolver.insert(500, -1));
    }

    @Test
    public void reload_sorts_and_keeps_first_per_height() {
        VersionResolver r = new VersionResolver();
        r.reload(Arrays.asList(
                new VersionBreakpoint(250, 2),
                new VersionBreakpoint(0, 0),
                new VersionBreakpoint(100, 1),
                new VersionBreakpoint(100, 9)));
        assertEquals(3, r.snapshot().size());
        assertEquals(1, r.resolve(150));
        assertTrue(r.knowsVersion(2));
        assertFalse(r.knowsVersion(9));
    }
}
