package io.github.sarps.solarpatch.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.github.sarps.solarpatch.instrument.InstrumentProfile;
import io.github.sarps.solarpatch.model.ResolvedRectangle;
import io.github.sarps.solarpatch.utilities.ObservationDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the bounding boxes of a compositing run as JSON for the rendering layer.
 *
 * <p>Each box carries its rectangle, its region identifier and the anchor of its text
 * label, placed {@value #LABEL_OFFSET} pixels beyond the rectangle's far edge along the
 * row axis. The document also names the instrument, canvas, observation date and the
 * legend labels of the category codes.</p>
 */
public class BoundingBoxExporter {
    private static final Logger logger = LoggerFactory.getLogger(BoundingBoxExporter.class);

    /** Distance in pixels between a rectangle and its label anchor. */
    public static final int LABEL_OFFSET = 20;

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    /**
     * @return the export document as pretty-printed JSON
     */
    public String toJson(CompositeResult result) {
        return gson.toJson(toDocument(result));
    }

    /**
     * Writes the export document to {@code outputPath}.
     *
     * @throws IOException On write error.
     */
    public void write(CompositeResult result, Path outputPath) throws IOException {
        try (Writer w = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            gson.toJson(toDocument(result), w);
        }
        logger.info("Wrote {} bounding boxes to {}", result.boxes().size(), outputPath);
    }

    Map<String, Object> toDocument(CompositeResult result) {
        InstrumentProfile profile = result.provider().profile();

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("instrument", profile.displayName());
        doc.put("regionKeyword", profile.regionKeyword());
        doc.put("canvasId", result.canvas().getCanvasId());
        doc.put("canvasSize", result.canvas().getSize());
        doc.put("observationDate", result.observedDate() != null
                ? ObservationDates.format(result.observedDate()) : null);
        doc.put("dateSubstituted", result.dateSubstituted());

        Map<String, String> categories = new LinkedHashMap<>();
        profile.categoryLabels().forEach((code, label) -> categories.put(code.toString(), label));
        doc.put("categories", categories);

        List<Map<String, Object>> boxes = new ArrayList<>();
        for (ResolvedRectangle r : result.boxes()) {
            Map<String, Object> box = new LinkedHashMap<>();
            box.put("regionId", r.getRegionId());
            box.put("y1", r.getY1());
            box.put("y2", r.getY2());
            box.put("x1", r.getX1());
            box.put("x2", r.getX2());
            box.put("labelX", r.getX1());
            box.put("labelY", r.getY2() + LABEL_OFFSET);
            boxes.add(box);
        }
        doc.put("boxes", boxes);

        if (!result.recodeReport().isEmpty()) {
            Map<String, Long> uncovered = new LinkedHashMap<>();
            result.recodeReport().getUncovered().forEach((code, count) -> uncovered.put(code.toString(), count));
            doc.put("uncoveredCodes", uncovered);
        }
        return doc;
    }
}
