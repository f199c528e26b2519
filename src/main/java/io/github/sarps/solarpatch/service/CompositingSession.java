package io.github.sarps.solarpatch.service;

import io.github.sarps.solarpatch.config.SolarPatchConfigManager;
import io.github.sarps.solarpatch.exception.ConfigurationException;
import io.github.sarps.solarpatch.exception.SolarPatchException;
import io.github.sarps.solarpatch.instrument.InstrumentProvider;
import io.github.sarps.solarpatch.model.Canvas;
import io.github.sarps.solarpatch.model.FullDiskKeys;
import io.github.sarps.solarpatch.model.Patch;
import io.github.sarps.solarpatch.model.RecodeReport;
import io.github.sarps.solarpatch.model.ReferenceFrame;
import io.github.sarps.solarpatch.model.ResolvedRectangle;
import io.github.sarps.solarpatch.utilities.BitmapRecoder;
import io.github.sarps.solarpatch.utilities.CoordinateTransformer;
import io.github.sarps.solarpatch.utilities.ObservationDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Composites the patches of one observation onto the canvas this session owns.
 *
 * <p>The work for each patch is split in two:</p>
 * <ol>
 *   <li><strong>Prepare</strong> (parallel, bounded worker pool): resolve the rectangle with
 *       {@link CoordinateTransformer}, check it lies on the canvas, and recode the bitmap
 *       when the provider supplies a {@link BitmapRecoder}. No shared state is touched.</li>
 *   <li><strong>Merge</strong> (calling thread, input order): register the box with the
 *       {@link BoundingBoxRegistry} and merge the pixels with {@link PatchCompositor}, which
 *       holds the canvas lock.</li>
 * </ol>
 * <p>Because the merge uses the commutative max rule, the canvas does not depend on the
 * order of the patches; only the registry order follows the input order.</p>
 *
 * <h3>Failure</h3>
 * <p>The first fatal error aborts the session: outstanding preparations are cancelled,
 * the session is marked failed and the original {@link SolarPatchException} is rethrown.
 * The canvas is then undefined and any further call raises {@link IllegalStateException}.
 * There are no retries.</p>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * SolarPatchConfigManager config = SolarPatchConfigManager.loadDefault();
 * InstrumentRegistry registry = InstrumentRegistry.fromConfig(config);
 * try (CompositingSession session = new CompositingSession.Builder()
 *         .provider(registry.forDate(date))
 *         .fullDiskKeys(keys)
 *         .requestedDate(date)
 *         .workers(config.getWorkerCount())
 *         .build()) {
 *     CompositeResult result = session.composite(patches);
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public class CompositingSession implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(CompositingSession.class);

    private enum State { OPEN, FAILED, CLOSED }

    private final InstrumentProvider provider;
    private final Canvas canvas;
    private final PatchCompositor compositor;
    private final BoundingBoxRegistry registry;
    private final ExecutorService executor;
    private final LocalDateTime requestedDate;
    private final LocalDateTime observedDate;
    private final boolean dateSubstituted;

    private volatile State state = State.OPEN;
    private RecodeReport recodeReport = RecodeReport.empty();

    private CompositingSession(Builder builder) {
        this.provider = builder.provider;
        this.canvas = builder.canvas != null ? builder.canvas : provider.createCanvas(builder.fullDiskKeys);
        this.compositor = new PatchCompositor(canvas);
        this.registry = new BoundingBoxRegistry(canvas.getCanvasId());
        this.requestedDate = builder.requestedDate;
        this.observedDate = builder.fullDiskKeys != null ? observedDate(builder.fullDiskKeys.tObs()) : null;
        this.dateSubstituted = ObservationDates.isSubstituted(requestedDate, observedDate);

        AtomicInteger threadCount = new AtomicInteger();
        String threadPrefix = "solarpatch-" + provider.name() + "-";
        this.executor = Executors.newFixedThreadPool(builder.workers, r -> {
            Thread t = new Thread(r, threadPrefix + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.info("Opened compositing session for {} on {} with {} workers",
                provider.profile().displayName(), canvas, builder.workers);
    }

    /**
     * T_OBS only feeds the date-substitution report, so an unreadable value is logged
     * and treated as unknown.
     */
    private static LocalDateTime observedDate(String tObs) {
        if (tObs == null) {
            return null;
        }
        try {
            return ObservationDates.parse(tObs);
        } catch (ConfigurationException e) {
            logger.warn("Ignoring unreadable T_OBS '{}': {}", tObs, e.getMessage());
            return null;
        }
    }

    /**
     * Composites a batch of patches. May be called repeatedly to add patches incrementally;
     * region identifiers must stay unique across calls.
     *
     * @param patches patches of this session's observation
     * @return a snapshot of the session after the batch
     * @throws io.github.sarps.solarpatch.exception.GeometryException if a patch does not fit the canvas
     * @throws io.github.sarps.solarpatch.exception.IdentifierCollisionException on a repeated region identifier
     * @throws IllegalStateException if the session has failed or been closed
     */
    public synchronized CompositeResult composite(List<Patch> patches) {
        requireOpen();
        if (patches == null) {
            throw new IllegalArgumentException("Patches must not be null");
        }
        logger.info("Compositing {} patches onto {}", patches.size(), canvas.getCanvasId());

        ReferenceFrame frame = canvas.getFrame();
        Optional<BitmapRecoder> recoder = provider.recoder();
        List<CompletableFuture<PreparedPatch>> pending = new ArrayList<>(patches.size());
        for (Patch patch : patches) {
            pending.add(CompletableFuture.supplyAsync(() -> prepare(patch, frame, recoder), executor));
        }

        int changed = 0;
        try {
            for (CompletableFuture<PreparedPatch> future : pending) {
                PreparedPatch prepared = future.join();
                registry.register(prepared.rectangle());
                changed += compositor.merge(prepared);
                recodeReport = recodeReport.merge(prepared.report());
            }
        } catch (CompletionException e) {
            fail(pending);
            throw unwrap(e);
        } catch (RuntimeException e) {
            fail(pending);
            throw e;
        }

        if (!recodeReport.isEmpty()) {
            logger.warn("Vocabulary gaps on {}: codes not covered by the recode table {}",
                    canvas.getCanvasId(), recodeReport.getUncovered());
        }
        logger.info("Composited {} patches onto {} ({} cells changed, {} boxes registered)",
                patches.size(), canvas.getCanvasId(), changed, registry.size());
        return snapshot();
    }

    /**
     * Runs on a worker thread; touches no shared state.
     */
    private PreparedPatch prepare(Patch patch, ReferenceFrame frame, Optional<BitmapRecoder> recoder) {
        ResolvedRectangle rectangle = CoordinateTransformer.resolve(frame, patch);
        CoordinateTransformer.requireWithin(canvas, rectangle);
        if (recoder.isPresent()) {
            BitmapRecoder.Result recoded = recoder.get().recode(patch);
            return new PreparedPatch(recoded.patch(), rectangle, frame, recoded.report());
        }
        return new PreparedPatch(patch, rectangle, frame, RecodeReport.empty());
    }

    private void fail(List<CompletableFuture<PreparedPatch>> pending) {
        state = State.FAILED;
        pending.forEach(f -> f.cancel(true));
        logger.error("Compositing session on {} failed; the canvas must be discarded", canvas.getCanvasId());
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new SolarPatchException("Patch preparation failed", cause != null ? cause : e);
    }

    private void requireOpen() {
        if (state == State.FAILED) {
            throw new IllegalStateException("Session on " + canvas.getCanvasId() + " has failed; its canvas must be discarded");
        }
        if (state == State.CLOSED) {
            throw new IllegalStateException("Session on " + canvas.getCanvasId() + " is closed");
        }
    }

    private CompositeResult snapshot() {
        return new CompositeResult(provider, canvas, registry.getRectangles(), recodeReport,
                requestedDate, observedDate, dateSubstituted);
    }

    public boolean isFailed() {
        return state == State.FAILED;
    }

    public Canvas getCanvas() {
        return canvas;
    }

    public BoundingBoxRegistry getRegistry() {
        return registry;
    }

    public InstrumentProvider getProvider() {
        return provider;
    }

    @Override
    public void close() {
        if (state == State.OPEN) {
            state = State.CLOSED;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Workers of session on {} did not stop within 5 s", canvas.getCanvasId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Closed compositing session on {}", canvas.getCanvasId());
    }

    /**
     * Builder for {@link CompositingSession}. Give {@link #fullDiskKeys(FullDiskKeys)} for a
     * synthetic disk, or {@link #canvas(Canvas)} to composite onto an existing canvas. When both
     * are given the canvas is used and must share the keys' reference frame.
     */
    public static class Builder {
        private InstrumentProvider provider;
        private FullDiskKeys fullDiskKeys;
        private Canvas canvas;
        private LocalDateTime requestedDate;
        private int workers = SolarPatchConfigManager.DEFAULT_WORKERS;

        public Builder provider(InstrumentProvider provider) {
            this.provider = provider;
            return this;
        }

        /**
         * Build a synthetic disk canvas from these keywords. {@code T_OBS}, when present,
         * is compared against {@link #requestedDate(LocalDateTime)}.
         */
        public Builder fullDiskKeys(FullDiskKeys keys) {
            this.fullDiskKeys = keys;
            return this;
        }

        /**
         * Composite onto an existing canvas, e.g. a real observation.
         */
        public Builder canvas(Canvas canvas) {
            this.canvas = canvas;
            return this;
        }

        public Builder requestedDate(LocalDateTime requestedDate) {
            this.requestedDate = requestedDate;
            return this;
        }

        /**
         * Size of the preparation pool, normally {@link SolarPatchConfigManager#getWorkerCount()}.
         * Defaults to {@value SolarPatchConfigManager#DEFAULT_WORKERS}.
         */
        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        /**
         * @throws IllegalStateException if the builder is incomplete or contradictory
         */
        public CompositingSession build() {
            if (provider == null) {
                String error = "Instrument provider must be set";
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }
            if (canvas == null && fullDiskKeys == null) {
                String error = "Must specify either full-disk keys or a canvas";
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }
            if (canvas != null && fullDiskKeys != null
                    && !canvas.getFrame().equals(fullDiskKeys.referenceFrame(canvas.getSize()))) {
                String error = "Canvas reference frame " + canvas.getFrame() + " does not match the full-disk keys";
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }
            if (canvas != null && canvas.getSize() != provider.profile().imageSize()) {
                String error = String.format("Canvas size %d does not match the %d px image size of %s",
                        canvas.getSize(), provider.profile().imageSize(), provider.name());
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }
            if (workers <= 0) {
                String error = "Worker count must be positive, got " + workers;
                logger.error("Build validation failed: {}", error);
                throw new IllegalStateException(error);
            }
            return new CompositingSession(this);
        }
    }
}
