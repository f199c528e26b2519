package io.github.sarps.solarpatch.service;

import io.github.sarps.solarpatch.TestFixtures;
import io.github.sarps.solarpatch.exception.GeometryException;
import io.github.sarps.solarpatch.model.Canvas;
import io.github.sarps.solarpatch.model.FullDiskKeys;
import io.github.sarps.solarpatch.model.Patch;
import io.github.sarps.solarpatch.model.RecodeReport;
import io.github.sarps.solarpatch.model.ReferenceFrame;
import io.github.sarps.solarpatch.model.ResolvedRectangle;
import io.github.sarps.solarpatch.utilities.CoordinateTransformer;
import io.github.sarps.solarpatch.utilities.DiskMaskGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PatchCompositorTest {

    // 10x10 canvas, centre (5, 5), radius 3
    private static final FullDiskKeys SMALL = new FullDiskKeys(5, 5, 6, 2);
    // 32x32 canvas, centre (16, 16), radius 12
    private static final FullDiskKeys MEDIUM = new FullDiskKeys(16, 16, 24, 2);

    @Test
    @DisplayName("Foreground pixels raise disk cells, background leaves them alone")
    void testSinglePatchOnDisk() {
        Canvas canvas = DiskMaskGenerator.generate(SMALL, 10);
        PatchCompositor compositor = new PatchCompositor(canvas);

        int changed = compositor.composite(new Patch(new int[][]{{2, 2}, {2, 0}}, 1, 1, 11));

        assertEquals(3, changed);
        assertEquals(2.0, canvas.get(4, 4));
        assertEquals(2.0, canvas.get(4, 5));
        assertEquals(2.0, canvas.get(5, 4));
        assertEquals(1.0, canvas.get(5, 5));
    }

    @Test
    void testOverlappingPatchesInEitherOrder() {
        Patch two = new Patch(new int[][]{{2, 2}, {2, 0}}, 1, 1, 11);
        Patch three = new Patch(new int[][]{{3, 3}, {3, 0}}, 1, 1, 12);

        Canvas first = DiskMaskGenerator.generate(SMALL, 10);
        new PatchCompositor(first).composite(two);
        new PatchCompositor(first).composite(three);

        Canvas second = DiskMaskGenerator.generate(SMALL, 10);
        new PatchCompositor(second).composite(three);
        new PatchCompositor(second).composite(two);

        assertEquals(3.0, first.get(4, 4));
        assertEquals(3.0, first.get(4, 5));
        assertEquals(3.0, first.get(5, 4));
        assertEquals(1.0, first.get(5, 5));
        assertTrue(first.sameContent(second));
    }

    @Test
    void testNanLosesToAnyCode() {
        Canvas canvas = DiskMaskGenerator.generate(SMALL, 10);
        assertTrue(Double.isNaN(canvas.get(0, 0)));

        new PatchCompositor(canvas).composite(TestFixtures.patchAt(new int[][]{{1}}, 0, 0, 10, 5, 5, 1));

        assertEquals(1.0, canvas.get(0, 0));
    }

    @Test
    void testBackgroundNeverWrites() {
        Canvas canvas = DiskMaskGenerator.generate(SMALL, 10);
        PatchCompositor compositor = new PatchCompositor(canvas);

        int changed = compositor.composite(TestFixtures.patchAt(new int[][]{{0, 0}, {0, 0}}, 0, 0, 10, 5, 5, 1));

        assertEquals(0, changed);
        assertTrue(Double.isNaN(canvas.get(0, 0)));
        assertTrue(Double.isNaN(canvas.get(1, 1)));
    }

    @Test
    void testLowerCodeDoesNotOverwrite() {
        Canvas canvas = DiskMaskGenerator.generate(SMALL, 10);
        PatchCompositor compositor = new PatchCompositor(canvas);

        compositor.composite(TestFixtures.patchAt(new int[][]{{34}}, 5, 5, 10, 5, 5, 1));
        int changed = compositor.composite(TestFixtures.patchAt(new int[][]{{33}}, 5, 5, 10, 5, 5, 2));

        assertEquals(0, changed);
        assertEquals(34.0, canvas.get(5, 5));
    }

    @Test
    void testOutOfBoundsPatchIsRejected() {
        Canvas canvas = DiskMaskGenerator.generate(SMALL, 10);
        PatchCompositor compositor = new PatchCompositor(canvas);
        double[][] before = canvas.copyData();

        // y1 = 10 - 5 - (-4) = 9, two rows tall
        Patch patch = new Patch(new int[][]{{1}, {1}}, 1, -4, 77);
        GeometryException e = assertThrows(GeometryException.class, () -> compositor.composite(patch));

        assertEquals(77, e.getRegionId());
        assertEquals(new ResolvedRectangle(9, 11, 4, 5, 77), e.getRectangle());
        assertArrayEquals(before, canvas.copyData());
    }

    @Test
    void testShapeMismatchIsRejected() {
        Canvas canvas = DiskMaskGenerator.generate(SMALL, 10);
        Patch patch = new Patch(new int[][]{{1, 1}, {1, 1}}, 1, 1, 5);
        PreparedPatch prepared = new PreparedPatch(patch, new ResolvedRectangle(0, 3, 0, 3, 5),
                canvas.getFrame(), RecodeReport.empty());

        assertThrows(GeometryException.class, () -> new PatchCompositor(canvas).merge(prepared));
    }

    @Test
    void testFrameMismatchIsRejected() {
        Canvas canvas = DiskMaskGenerator.generate(SMALL, 10);
        Patch patch = new Patch(new int[][]{{1}}, 1, 1, 5);
        PreparedPatch prepared = new PreparedPatch(patch, new ResolvedRectangle(4, 5, 4, 5, 5),
                new ReferenceFrame(5.5, 5, 10), RecodeReport.empty());

        assertThrows(GeometryException.class, () -> new PatchCompositor(canvas).merge(prepared));
    }

    @Test
    @DisplayName("Every cell ends at the maximum foreground value covering it")
    void testMatchesBruteForceMaximum() {
        Random random = new Random(20240611L);
        for (int trial = 0; trial < 20; trial++) {
            Canvas canvas = DiskMaskGenerator.generate(MEDIUM, 32);
            double[][] expected = canvas.copyData();
            List<Patch> patches = TestFixtures.randomPatches(random, 15, 32, 16, 16, 10, TestFixtures.PRIMARY_CODES);

            PatchCompositor compositor = new PatchCompositor(canvas);
            for (Patch patch : patches) {
                ResolvedRectangle r = CoordinateTransformer.resolve(canvas.getFrame(), patch);
                for (int row = 0; row < patch.getHeight(); row++) {
                    for (int col = 0; col < patch.getWidth(); col++) {
                        int value = patch.get(row, col);
                        double current = expected[r.getY1() + row][r.getX1() + col];
                        if (value != 0 && (Double.isNaN(current) || value > current)) {
                            expected[r.getY1() + row][r.getX1() + col] = value;
                        }
                    }
                }
                compositor.composite(patch);
            }

            assertArrayEquals(expected, canvas.copyData(), "trial " + trial);
        }
    }

    @Test
    @DisplayName("Composite does not depend on patch order")
    void testOrderIndependence() {
        Random random = new Random(7L);
        List<Patch> patches = TestFixtures.randomPatches(random, 40, 32, 16, 16, 12, TestFixtures.PRIMARY_CODES);

        Canvas reference = DiskMaskGenerator.generate(MEDIUM, 32);
        PatchCompositor referenceCompositor = new PatchCompositor(reference);
        patches.forEach(referenceCompositor::composite);

        for (int trial = 0; trial < 10; trial++) {
            List<Patch> shuffled = new ArrayList<>(patches);
            Collections.shuffle(shuffled, random);
            Canvas canvas = DiskMaskGenerator.generate(MEDIUM, 32);
            PatchCompositor compositor = new PatchCompositor(canvas);
            shuffled.forEach(compositor::composite);

            assertTrue(reference.sameContent(canvas), "trial " + trial);
        }
    }

    @Test
    void testConcurrentMergesMatchSequentialResult() throws InterruptedException {
        Random random = new Random(99L);
        List<Patch> patches = TestFixtures.randomPatches(random, 80, 32, 16, 16, 12, TestFixtures.PRIMARY_CODES);

        Canvas sequential = DiskMaskGenerator.generate(MEDIUM, 32);
        patches.forEach(new PatchCompositor(sequential)::composite);

        Canvas shared = DiskMaskGenerator.generate(MEDIUM, 32);
        PatchCompositor compositor = new PatchCompositor(shared);
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            int offset = t;
            threads.add(new Thread(() -> {
                for (int i = offset; i < patches.size(); i += 4) {
                    compositor.composite(patches.get(i));
                }
            }));
        }
        threads.forEach(Thread::start);
        for (Thread thread : threads) {
            thread.join();
        }

        assertTrue(sequential.sameContent(shared));
    }
}
