package io.github.sarps.solarpatch.utilities;

import io.github.sarps.solarpatch.model.Patch;
import io.github.sarps.solarpatch.model.RecodeReport;
import io.github.sarps.solarpatch.model.RecodeTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * Rewrites a secondary-instrument bitmap into the primary instrument's category vocabulary
 * using a fixed {@link RecodeTable}.
 *
 * <p>The recoder is stateless and thread-safe. It never touches a canvas; it produces a
 * new patch whose codes can be composited next to primary-instrument patches. Recoding
 * an already recoded bitmap is a no-op because group targets are never source codes and
 * never fall in the secondary range.</p>
 *
 * <p>Codes no group claims are passed through (minus the offset when they sit in the
 * secondary range), logged as a warning and listed in the returned {@link RecodeReport}.</p>
 *
 * @since 0.1.0
 */
public class BitmapRecoder {
    private static final Logger logger = LoggerFactory.getLogger(BitmapRecoder.class);

    private final RecodeTable table;

    public BitmapRecoder(RecodeTable table) {
        if (table == null) {
            throw new IllegalArgumentException("Recode table must not be null");
        }
        this.table = table;
    }

    /**
     * A recoded patch and the codes that were not covered while recoding it.
     */
    public record Result(Patch patch, RecodeReport report) { }

    /**
     * Recodes the bitmap of {@code patch}.
     *
     * @param patch patch from the secondary instrument
     * @return a new patch with translated codes and the coverage report
     */
    public Result recode(Patch patch) {
        int[][] bitmap = patch.getBitmap();
        RecodeReport report = recodeInPlace(bitmap);
        if (!report.isEmpty()) {
            logger.warn("Patch {} contains category codes not covered by the recode table: {}",
                    patch.getRegionId(), report.getUncovered());
        }
        return new Result(patch.withBitmap(bitmap), report);
    }

    /**
     * Recodes a bare bitmap, returning a new array.
     */
    public int[][] recode(int[][] bitmap) {
        int[][] copy = new int[bitmap.length][];
        for (int row = 0; row < bitmap.length; row++) {
            copy[row] = bitmap[row].clone();
        }
        recodeInPlace(copy);
        return copy;
    }

    private RecodeReport recodeInPlace(int[][] bitmap) {
        Map<Integer, Long> uncovered = null;
        for (int[] row : bitmap) {
            for (int col = 0; col < row.length; col++) {
                int code = row[col];
                if (!table.covers(code)) {
                    if (uncovered == null) {
                        uncovered = new TreeMap<>();
                    }
                    uncovered.merge(code, 1L, Long::sum);
                }
                row[col] = table.translate(code);
            }
        }
        return uncovered == null ? RecodeReport.empty() : new RecodeReport(uncovered);
    }

    public RecodeTable getTable() {
        return table;
    }
}
