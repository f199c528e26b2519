package io.github.sarps.solarpatch.service;

import io.github.sarps.solarpatch.TestFixtures;
import io.github.sarps.solarpatch.config.SolarPatchConfigManager;
import io.github.sarps.solarpatch.exception.GeometryException;
import io.github.sarps.solarpatch.exception.IdentifierCollisionException;
import io.github.sarps.solarpatch.instrument.InstrumentProvider;
import io.github.sarps.solarpatch.model.Canvas;
import io.github.sarps.solarpatch.model.FullDiskKeys;
import io.github.sarps.solarpatch.model.Patch;
import io.github.sarps.solarpatch.model.ResolvedRectangle;
import io.github.sarps.solarpatch.utilities.DiskMaskGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CompositingSessionTest {

    // 32x32 canvas, centre (16, 16), radius 12
    private static final FullDiskKeys KEYS = new FullDiskKeys(16, 16, 24, 2);

    private static CompositingSession.Builder primarySession() {
        return new CompositingSession.Builder()
                .provider(TestFixtures.primary(32))
                .fullDiskKeys(KEYS)
                .workers(4);
    }

    @Test
    @DisplayName("Parallel session matches a sequential composite of the shuffled patches")
    void testParallelMatchesSequential() {
        Random random = new Random(1234L);
        List<Patch> patches = TestFixtures.randomPatches(random, 60, 32, 16, 16, 10, TestFixtures.PRIMARY_CODES);

        CompositeResult result;
        try (CompositingSession session = primarySession().build()) {
            result = session.composite(patches);
        }

        List<Patch> shuffled = new ArrayList<>(patches);
        Collections.shuffle(shuffled, random);
        Canvas expected = DiskMaskGenerator.generate(KEYS, 32);
        PatchCompositor compositor = new PatchCompositor(expected);
        shuffled.forEach(compositor::composite);

        assertTrue(expected.sameContent(result.canvas()));
        assertTrue(result.recodeReport().isEmpty());
    }

    @Test
    void testBoxesFollowInputOrder() {
        List<Patch> patches = List.of(
                TestFixtures.patchAt(new int[][]{{1}}, 20, 3, 32, 16, 16, 30),
                TestFixtures.patchAt(new int[][]{{2, 2}}, 1, 7, 32, 16, 16, 10),
                TestFixtures.patchAt(new int[][]{{33}, {34}}, 12, 12, 32, 16, 16, 20));

        try (CompositingSession session = primarySession().build()) {
            CompositeResult result = session.composite(patches);

            assertEquals(List.of(30, 10, 20), result.boxes().stream().map(ResolvedRectangle::getRegionId).toList());
            assertEquals(new ResolvedRectangle(1, 2, 7, 9, 10), session.getRegistry().get(10).orElseThrow());
            assertEquals(new ResolvedRectangle(12, 14, 12, 13, 20), result.boxes().get(2));
        }
    }

    @Test
    void testIncrementalBatches() {
        try (CompositingSession session = primarySession().build()) {
            session.composite(List.of(TestFixtures.patchAt(new int[][]{{2}}, 16, 16, 32, 16, 16, 1)));
            CompositeResult result = session.composite(
                    List.of(TestFixtures.patchAt(new int[][]{{34}}, 17, 16, 32, 16, 16, 2)));

            assertEquals(2, result.boxes().size());
            assertEquals(2.0, result.canvas().get(16, 16));
            assertEquals(34.0, result.canvas().get(17, 16));
        }
    }

    @Test
    @DisplayName("A repeated region identifier fails the session")
    void testIdentifierCollision() {
        List<Patch> patches = List.of(
                TestFixtures.patchAt(new int[][]{{1}}, 10, 10, 32, 16, 16, 5),
                TestFixtures.patchAt(new int[][]{{2}}, 11, 11, 32, 16, 16, 5));

        try (CompositingSession session = primarySession().build()) {
            IdentifierCollisionException e = assertThrows(IdentifierCollisionException.class,
                    () -> session.composite(patches));

            assertEquals(5, e.getRegionId());
            assertTrue(session.isFailed());
            assertThrows(IllegalStateException.class, () -> session.composite(List.of()));
        }
    }

    @Test
    void testCollisionAcrossBatches() {
        try (CompositingSession session = primarySession().build()) {
            session.composite(List.of(TestFixtures.patchAt(new int[][]{{1}}, 10, 10, 32, 16, 16, 8)));
            assertThrows(IdentifierCollisionException.class, () ->
                    session.composite(List.of(TestFixtures.patchAt(new int[][]{{1}}, 20, 20, 32, 16, 16, 8))));
            assertTrue(session.isFailed());
        }
    }

    @Test
    void testOutOfBoundsPatchFailsSession() {
        List<Patch> patches = List.of(
                TestFixtures.patchAt(new int[][]{{1}}, 10, 10, 32, 16, 16, 1),
                TestFixtures.patchAt(new int[][]{{1, 1, 1}}, 5, 30, 32, 16, 16, 2));

        try (CompositingSession session = primarySession().build()) {
            GeometryException e = assertThrows(GeometryException.class, () -> session.composite(patches));

            assertEquals(2, e.getRegionId());
            assertEquals(new ResolvedRectangle(5, 6, 30, 33, 2), e.getRectangle());
            assertTrue(session.isFailed());
        }
    }

    @Test
    @DisplayName("Secondary patches are recoded before merging")
    void testSecondaryRecode() {
        Patch patch = TestFixtures.patchAt(new int[][]{{97, 98}, {0, 66}}, 14, 14, 32, 16, 16, 3001);

        try (CompositingSession session = new CompositingSession.Builder()
                .provider(TestFixtures.secondary(32))
                .fullDiskKeys(KEYS)
                .build()) {
            CompositeResult result = session.composite(List.of(patch));
            Canvas canvas = result.canvas();

            assertEquals(33.0, canvas.get(14, 14));
            assertEquals(34.0, canvas.get(14, 15));
            assertEquals(1.0, canvas.get(15, 14));
            assertEquals(2.0, canvas.get(15, 15));
            assertTrue(result.recodeReport().isEmpty());
        }
    }

    @Test
    void testUncoveredCodesAreReported() {
        List<Patch> patches = List.of(
                TestFixtures.patchAt(new int[][]{{80, 65}}, 14, 14, 32, 16, 16, 1),
                TestFixtures.patchAt(new int[][]{{80}}, 16, 16, 32, 16, 16, 2));

        try (CompositingSession session = new CompositingSession.Builder()
                .provider(TestFixtures.secondary(32))
                .fullDiskKeys(KEYS)
                .build()) {
            CompositeResult result = session.composite(patches);

            assertEquals(Map.of(80, 2L), result.recodeReport().getUncovered());
            assertEquals(16.0, result.canvas().get(14, 14));
            assertEquals(1.0, result.canvas().get(14, 15));
        }
    }

    @Test
    void testDateSubstitutionIsFlagged() {
        FullDiskKeys keys = new FullDiskKeys(16, 16, 24, 2, "2010.07.14_11:12:00_TAI");
        LocalDateTime requested = LocalDateTime.of(2010, 7, 14, 11, 0);

        try (CompositingSession session = primarySession().fullDiskKeys(keys).requestedDate(requested).build()) {
            CompositeResult result = session.composite(List.of());

            assertTrue(result.dateSubstituted());
            assertEquals(requested, result.requestedDate());
            assertEquals(LocalDateTime.of(2010, 7, 14, 11, 12), result.observedDate());
            assertEquals("hmi@2010.07.14_11:12:00_TAI", result.canvas().getCanvasId());
        }
    }

    @Test
    void testMatchingDateIsNotFlagged() {
        FullDiskKeys keys = new FullDiskKeys(16, 16, 24, 2, "2010.07.14_11:00:00_TAI");

        try (CompositingSession session = primarySession().fullDiskKeys(keys)
                .requestedDate(LocalDateTime.of(2010, 7, 14, 11, 0)).build()) {
            assertFalse(session.composite(List.of()).dateSubstituted());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"MISSING", "2010-07-14T11:12:00Z", "not a date"})
    @DisplayName("An unreadable T_OBS leaves the observation date unknown")
    void testUnreadableObservationDateDoesNotFailSession(String tObs) {
        FullDiskKeys keys = new FullDiskKeys(16, 16, 24, 2, tObs);

        try (CompositingSession session = primarySession().fullDiskKeys(keys)
                .requestedDate(LocalDateTime.of(2010, 7, 14, 11, 0)).build()) {
            CompositeResult result = session.composite(
                    List.of(TestFixtures.patchAt(new int[][]{{2}}, 16, 16, 32, 16, 16, 1)));

            assertNull(result.observedDate());
            assertFalse(result.dateSubstituted());
            assertEquals(2.0, result.canvas().get(16, 16));
            assertFalse(session.isFailed());
        }
    }

    @Test
    void testWorkerCountFromConfiguration() {
        SolarPatchConfigManager config = SolarPatchConfigManager.fromYaml("session:\n  workers: 2\n");

        try (CompositingSession session = primarySession().workers(config.getWorkerCount()).build()) {
            assertEquals(1, session.composite(
                    List.of(TestFixtures.patchAt(new int[][]{{1}}, 3, 3, 32, 16, 16, 1))).boxes().size());
        }
    }

    @Test
    @DisplayName("An existing canvas is used as is and the provider never builds one")
    void testExistingCanvasWithMockProvider() {
        InstrumentProvider provider = mock(InstrumentProvider.class);
        when(provider.name()).thenReturn("mock");
        when(provider.profile()).thenReturn(TestFixtures.primaryProfile(32));
        when(provider.recoder()).thenReturn(Optional.empty());

        Canvas canvas = DiskMaskGenerator.generate("observed", KEYS, 32);
        try (CompositingSession session = new CompositingSession.Builder()
                .provider(provider)
                .canvas(canvas)
                .workers(2)
                .build()) {
            CompositeResult result = session.composite(
                    List.of(TestFixtures.patchAt(new int[][]{{2}}, 16, 16, 32, 16, 16, 1)));

            assertSame(canvas, result.canvas());
            assertEquals(2.0, canvas.get(16, 16));
            assertSame(provider, result.provider());
        }
        verify(provider, never()).createCanvas(any());
        verify(provider, times(1)).recoder();
    }

    @Test
    void testClosedSessionRejectsWork() {
        CompositingSession session = primarySession().build();
        session.close();

        assertThrows(IllegalStateException.class, () -> session.composite(List.of()));
        assertFalse(session.isFailed());
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalStateException.class,
                () -> new CompositingSession.Builder().fullDiskKeys(KEYS).build());
        assertThrows(IllegalStateException.class,
                () -> new CompositingSession.Builder().provider(TestFixtures.primary(32)).build());
        assertThrows(IllegalStateException.class, () -> primarySession().workers(0).build());

        Canvas shifted = DiskMaskGenerator.generate(new FullDiskKeys(15, 16, 24, 2), 32);
        assertThrows(IllegalStateException.class, () -> primarySession().canvas(shifted).build());

        // canvas side must be the instrument's image size
        Canvas small = DiskMaskGenerator.generate(KEYS, 32);
        assertThrows(IllegalStateException.class, () -> new CompositingSession.Builder()
                .provider(TestFixtures.primary(4096))
                .canvas(small)
                .build());
        assertThrows(IllegalStateException.class, () -> new CompositingSession.Builder()
                .provider(TestFixtures.secondary(64))
                .canvas(small)
                .build());
    }

    @Test
    void testNullPatchListIsRejected() {
        try (CompositingSession session = primarySession().build()) {
            assertThrows(IllegalArgumentException.class, () -> session.composite(null));
            assertFalse(session.isFailed());
        }
    }
}
