package io.github.sarps.solarpatch.service;

import io.github.sarps.solarpatch.exception.IdentifierCollisionException;
import io.github.sarps.solarpatch.model.ResolvedRectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Collects the rectangle of every composited patch, keyed by region identifier, for the
 * labeling and rendering layer.
 *
 * <p>Iteration follows insertion order. Identifiers must be unique within a session;
 * registering one twice raises {@link IdentifierCollisionException} instead of merging
 * the two boxes. All methods are thread-safe.</p>
 *
 * @since 0.1.0
 */
public class BoundingBoxRegistry {
    private static final Logger logger = LoggerFactory.getLogger(BoundingBoxRegistry.class);

    private final String canvasId;
    private final Map<Integer, ResolvedRectangle> boxes = new LinkedHashMap<>();

    /**
     * @param canvasId id of the canvas the boxes belong to, used in error reports
     */
    public BoundingBoxRegistry(String canvasId) {
        this.canvasId = canvasId;
    }

    /**
     * Records the rectangle of one patch.
     *
     * @throws IdentifierCollisionException if the region identifier is already registered
     */
    public synchronized void register(ResolvedRectangle rectangle) {
        int regionId = rectangle.getRegionId();
        ResolvedRectangle existing = boxes.get(regionId);
        if (existing != null) {
            logger.error("Region {} registered twice on canvas {}: {} and {}", regionId, canvasId, existing, rectangle);
            throw new IdentifierCollisionException(canvasId, regionId);
        }
        boxes.put(regionId, rectangle);
        logger.debug("Registered box for region {}: {}", regionId, rectangle);
    }

    public synchronized boolean contains(int regionId) {
        return boxes.containsKey(regionId);
    }

    public synchronized Optional<ResolvedRectangle> get(int regionId) {
        return Optional.ofNullable(boxes.get(regionId));
    }

    /**
     * @return the registered rectangles in insertion order
     */
    public synchronized List<ResolvedRectangle> getRectangles() {
        return Collections.unmodifiableList(new ArrayList<>(boxes.values()));
    }

    /**
     * @return a copy of the registry keyed by region identifier, in insertion order
     */
    public synchronized Map<Integer, ResolvedRectangle> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(boxes));
    }

    public synchronized int size() {
        return boxes.size();
    }

    public String getCanvasId() {
        return canvasId;
    }
}
