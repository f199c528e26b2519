package io.github.sarps.solarpatch.service;

import io.github.sarps.solarpatch.exception.IdentifierCollisionException;
import io.github.sarps.solarpatch.model.ResolvedRectangle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundingBoxRegistryTest {

    @Test
    void testRegisterKeepsInsertionOrder() {
        BoundingBoxRegistry registry = new BoundingBoxRegistry("canvas-1");
        ResolvedRectangle a = new ResolvedRectangle(0, 2, 0, 2, 377);
        ResolvedRectangle b = new ResolvedRectangle(5, 9, 1, 3, 12);

        registry.register(a);
        registry.register(b);

        assertEquals(List.of(a, b), registry.getRectangles());
        assertEquals(List.of(377, 12), List.copyOf(registry.asMap().keySet()));
        assertEquals(2, registry.size());
        assertTrue(registry.contains(12));
        assertTrue(registry.get(99).isEmpty());
    }

    @Test
    void testCollisionKeepsFirstBox() {
        BoundingBoxRegistry registry = new BoundingBoxRegistry("canvas-1");
        ResolvedRectangle first = new ResolvedRectangle(0, 2, 0, 2, 7);
        registry.register(first);

        IdentifierCollisionException e = assertThrows(IdentifierCollisionException.class,
                () -> registry.register(new ResolvedRectangle(3, 4, 3, 4, 7)));

        assertEquals(7, e.getRegionId());
        assertEquals("canvas-1", e.getCanvasId());
        assertEquals(first, registry.get(7).orElseThrow());
        assertEquals(1, registry.size());
    }

    @Test
    void testSnapshotsAreUnmodifiable() {
        BoundingBoxRegistry registry = new BoundingBoxRegistry("canvas-1");
        registry.register(new ResolvedRectangle(0, 1, 0, 1, 1));

        assertThrows(UnsupportedOperationException.class,
                () -> registry.getRectangles().add(new ResolvedRectangle(0, 1, 0, 1, 2)));
        assertThrows(UnsupportedOperationException.class, () -> registry.asMap().clear());
    }
}
