package com.fluxwatch.core.preprocess;

import com.fluxwatch.core.config.PreprocessingSettings;
import com.fluxwatch.core.exception.MalformedInputException;
import com.fluxwatch.core.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Cleans one raw observation stream before calibration and detection.
 *
 * <h3>Stages</h3>
 * <ol>
 * <li><b>Validity</b>: non-finite values are rejected or skipped
 * ({@code invalidValuePolicy}).</li>
 * <li><b>Ordering</b>: a timestamp lower than its predecessor is rejected or
 * skipped ({@code orderingPolicy}).</li>
 * <li><b>Duplicates</b>: a repeated timestamp is rejected or replaces the
 * earlier record ({@code duplicatePolicy}). {@code take_last} holds back one
 * observation until the next distinct timestamp or {@link #flush()}.</li>
 * <li><b>Gap filling</b>: up to {@code maxGap} missing samples are
 * synthesised by forward fill or linear interpolation and flagged
 * {@link Observation#isImputed() imputed}.</li>
 * <li><b>Transform</b>: the configured {@link ValueTransform} is applied to
 * every emitted value, unless the preprocessor was built cleaning-only.</li>
 * </ol>
 *
 * <p>
 * Dropped records are logged at WARN and counted in
 * {@link #getDroppedCount()}; nothing is discarded silently.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateful and bound to one stream; not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class Preprocessor implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(Preprocessor.class);

    private final GapFillPolicy gapFillPolicy;
    private final InputPolicy invalidValuePolicy;
    private final InputPolicy orderingPolicy;
    private final DuplicatePolicy duplicatePolicy;
    private final int maxGap;
    private final ValueTransform transform;

    private long interval;
    private boolean hasLast;
    private long lastTimestamp;
    private double lastValue;
    private Observation pending;
    private long droppedCount;

    /**
     * @param settings preprocessing settings; validated here
     * @throws IllegalStateException if the settings are invalid
     */
    public Preprocessor(PreprocessingSettings settings) {
        this(settings, true);
    }

    /**
     * @param settings       preprocessing settings; validated here
     * @param applyTransform {@code false} to stop after gap filling and leave
     *                       the configured transform to the caller
     * @throws IllegalStateException if the settings are invalid
     */
    public Preprocessor(PreprocessingSettings settings, boolean applyTransform) {
        Objects.requireNonNull(settings, "PreprocessingSettings must not be null");
        settings.validate();
        this.gapFillPolicy = settings.resolveGapFillPolicy();
        this.invalidValuePolicy = settings.resolveInvalidValuePolicy();
        this.orderingPolicy = settings.resolveOrderingPolicy();
        this.duplicatePolicy = settings.resolveDuplicatePolicy();
        this.maxGap = settings.getMaxGap();
        this.interval = settings.getExpectedInterval();
        this.transform = applyTransform ? TransformFactory.create(settings) : new IdentityTransform();
    }

    /**
     * Lazily normalise a raw stream.
     *
     * @param source raw observations in arrival order
     * @return cleaned observations; the returned iterator throws
     *         {@link MalformedInputException} from {@code hasNext()} when a
     *         record is rejected
     */
    public Iterator<Observation> normalize(Iterator<Observation> source) {
        Objects.requireNonNull(source, "source must not be null");
        return new Iterator<>() {
            private final ArrayDeque<Observation> ready = new ArrayDeque<>();
            private boolean flushed;

            @Override
            public boolean hasNext() {
                while (ready.isEmpty() && source.hasNext()) {
                    ready.addAll(accept(source.next()));
                }
                if (ready.isEmpty() && !flushed) {
                    flushed = true;
                    ready.addAll(flush());
                }
                return !ready.isEmpty();
            }

            @Override
            public Observation next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return ready.removeFirst();
            }
        };
    }

    /**
     * Push one raw observation.
     *
     * @param raw the next observation in arrival order
     * @return zero or more cleaned observations, in order
     * @throws MalformedInputException if the record is rejected by policy
     */
    public List<Observation> accept(Observation raw) {
        Objects.requireNonNull(raw, "Observation must not be null");
        long ts = raw.getTimestamp();

        if (!Double.isFinite(raw.getValue())) {
            if (invalidValuePolicy == InputPolicy.REJECT) {
                throw new MalformedInputException(ts, "non-finite value " + raw.getValue());
            }
            drop(raw, "non-finite value");
            return Collections.emptyList();
        }

        boolean hasReference = pending != null || hasLast;
        long reference = pending != null ? pending.getTimestamp() : lastTimestamp;

        if (hasReference && ts < reference) {
            if (orderingPolicy == InputPolicy.REJECT) {
                throw new MalformedInputException(ts, "timestamp precedes " + reference);
            }
            drop(raw, "out-of-order timestamp");
            return Collections.emptyList();
        }

        if (hasReference && ts == reference) {
            if (duplicatePolicy == DuplicatePolicy.REJECT) {
                throw new MalformedInputException(ts, "duplicate timestamp");
            }
            if (pending != null) {
                drop(pending, "superseded by a later record with the same timestamp");
                pending = raw;
            } else {
                // The earlier record has already been emitted.
                drop(raw, "duplicate of an emitted timestamp");
            }
            return Collections.emptyList();
        }

        if (duplicatePolicy == DuplicatePolicy.TAKE_LAST) {
            Observation previous = pending;
            pending = raw;
            return previous == null ? Collections.emptyList() : emit(previous);
        }
        return emit(raw);
    }

    /**
     * Release the observation held back by {@code take_last}, if any. Call
     * at end of stream.
     *
     * @return the remaining cleaned observations
     */
    public List<Observation> flush() {
        if (pending == null) {
            return Collections.emptyList();
        }
        Observation previous = pending;
        pending = null;
        return emit(previous);
    }

    private List<Observation> emit(Observation obs) {
        List<Observation> out = new ArrayList<>(1);
        long ts = obs.getTimestamp();

        if (hasLast) {
            if (interval <= 0) {
                interval = ts - lastTimestamp;
                LOG.debug("Inferred sampling interval {}", interval);
            } else {
                fillGap(obs, out);
            }
        }

        out.add(transformed(obs));
        hasLast = true;
        lastTimestamp = ts;
        lastValue = obs.getValue();
        return out;
    }

    private void fillGap(Observation next, List<Observation> out) {
        long delta = next.getTimestamp() - lastTimestamp;
        long missing = delta / interval - (delta % interval == 0 ? 1 : 0);
        if (missing <= 0 || gapFillPolicy == GapFillPolicy.NONE) {
            return;
        }
        if (missing > maxGap) {
            LOG.warn("Gap of {} sample(s) between {} and {} exceeds maxGap {}, left unfilled",
                    missing, lastTimestamp, next.getTimestamp(), maxGap);
            return;
        }
        for (long k = 1; k <= missing; k++) {
            double value = switch (gapFillPolicy) {
                case FORWARD_FILL -> lastValue;
                case INTERPOLATE -> lastValue + (next.getValue() - lastValue) * k / (missing + 1);
                case NONE -> throw new IllegalStateException("unreachable");
            };
            out.add(transformed(Observation.imputed(lastTimestamp + k * interval, value)));
        }
        LOG.debug("Filled {} sample(s) after {} ({})", missing, lastTimestamp, gapFillPolicy.getConfigName());
    }

    private Observation transformed(Observation obs) {
        return obs.withValue(transform.apply(obs.getValue()));
    }

    private void drop(Observation obs, String reason) {
        droppedCount++;
        LOG.warn("Dropped observation at {} ({}): {}", obs.getTimestamp(), obs.getValue(), reason);
    }

    /**
     * @return number of records dropped so far under {@code skip} or
     *         {@code take_last} policies
     */
    public long getDroppedCount() {
        return droppedCount;
    }

    /**
     * @return the sampling interval in use, 0 until inferred
     */
    public long getInterval() {
        return interval;
    }
}
