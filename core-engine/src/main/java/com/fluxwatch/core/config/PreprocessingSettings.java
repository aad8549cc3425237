package com.fluxwatch.core.config;

import com.fluxwatch.core.preprocess.DuplicatePolicy;
import com.fluxwatch.core.preprocess.GapFillPolicy;
import com.fluxwatch.core.preprocess.InputPolicy;
import com.fluxwatch.core.preprocess.TransformType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Settings of the preprocessing stage (the {@code preprocessing} YAML section).
 *
 * <p>
 * Policy fields are stored as lowercase strings, as written in YAML, and
 * resolved to their enums through the {@code resolve*} accessors.
 * </p>
 *
 * @since 1.0.0
 */
public class PreprocessingSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private String gapFillPolicy = GapFillPolicy.NONE.getConfigName();

    /** Longest run of missing samples that gets filled. */
    private int maxGap = 0;

    /** Nominal sampling interval; 0 infers it from the first two samples. */
    private long expectedInterval = 0;

    private String invalidValuePolicy = InputPolicy.REJECT.getConfigName();
    private String orderingPolicy = InputPolicy.REJECT.getConfigName();
    private String duplicatePolicy = DuplicatePolicy.REJECT.getConfigName();
    private String transform = TransformType.NONE.getConfigName();

    /** Window of the moving-average and fluctuation transforms. */
    private int smoothingWindow = 5;

    /** EWMA smoothing factor of the fluctuation transform. */
    private double ewmaAlpha = 0.2;

    /** Samples per seasonal period of the periodic fluctuation transform. */
    private int period = 1440;

    /** Periods compared by the periodic fluctuation transform, current one included. */
    private int periodWindow = 5;

    /** Half-width of the local-maximum window of the periodic fluctuation transform. */
    private int halfDriftWindow = 2;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every policy name and numeric setting.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        checkName(errors, gapFillPolicy, GapFillPolicy::fromConfig);
        checkName(errors, invalidValuePolicy, InputPolicy::fromConfig);
        checkName(errors, orderingPolicy, InputPolicy::fromConfig);
        checkName(errors, duplicatePolicy, DuplicatePolicy::fromConfig);
        checkName(errors, transform, TransformType::fromConfig);

        if (maxGap < 0) {
            errors.add("'maxGap' must be >= 0, got: " + maxGap);
        }
        if (expectedInterval < 0) {
            errors.add("'expectedInterval' must be >= 0, got: " + expectedInterval);
        }
        if (smoothingWindow < 1) {
            errors.add("'smoothingWindow' must be >= 1, got: " + smoothingWindow);
        }
        if (("fluctuation".equals(transform) || "periodic_fluctuation".equals(transform))
                && smoothingWindow < 2) {
            errors.add("'" + transform + "' transform requires 'smoothingWindow' >= 2");
        }
        if (halfDriftWindow < 0) {
            errors.add("'halfDriftWindow' must be >= 0, got: " + halfDriftWindow);
        }
        if (period < 1 || period < halfDriftWindow) {
            errors.add("'period' must be >= 1 and >= 'halfDriftWindow', got: " + period);
        }
        if (periodWindow < 2) {
            errors.add("'periodWindow' must be >= 2, got: " + periodWindow);
        }
        if (!(ewmaAlpha > 0 && ewmaAlpha <= 1)) {
            errors.add("'ewmaAlpha' must be in (0, 1], got: " + ewmaAlpha);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid preprocessing settings: " + String.join("; ", errors));
        }
    }

    private static void checkName(List<String> errors, String name, Function<String, ?> resolver) {
        try {
            resolver.apply(name);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
    }

    public GapFillPolicy resolveGapFillPolicy() {
        return GapFillPolicy.fromConfig(gapFillPolicy);
    }

    public InputPolicy resolveInvalidValuePolicy() {
        return InputPolicy.fromConfig(invalidValuePolicy);
    }

    public InputPolicy resolveOrderingPolicy() {
        return InputPolicy.fromConfig(orderingPolicy);
    }

    public DuplicatePolicy resolveDuplicatePolicy() {
        return DuplicatePolicy.fromConfig(duplicatePolicy);
    }

    public TransformType resolveTransform() {
        return TransformType.fromConfig(transform);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getGapFillPolicy() {
        return gapFillPolicy;
    }

    public void setGapFillPolicy(String gapFillPolicy) {
        this.gapFillPolicy = lower(gapFillPolicy);
    }

    public int getMaxGap() {
        return maxGap;
    }

    public void setMaxGap(int maxGap) {
        this.maxGap = maxGap;
    }

    public long getExpectedInterval() {
        return expectedInterval;
    }

    public void setExpectedInterval(long expectedInterval) {
        this.expectedInterval = expectedInterval;
    }

    public String getInvalidValuePolicy() {
        return invalidValuePolicy;
    }

    public void setInvalidValuePolicy(String invalidValuePolicy) {
        this.invalidValuePolicy = lower(invalidValuePolicy);
    }

    public String getOrderingPolicy() {
        return orderingPolicy;
    }

    public void setOrderingPolicy(String orderingPolicy) {
        this.orderingPolicy = lower(orderingPolicy);
    }

    public String getDuplicatePolicy() {
        return duplicatePolicy;
    }

    public void setDuplicatePolicy(String duplicatePolicy) {
        this.duplicatePolicy = lower(duplicatePolicy);
    }

    public String getTransform() {
        return transform;
    }

    public void setTransform(String transform) {
        this.transform = lower(transform);
    }

    public int getSmoothingWindow() {
        return smoothingWindow;
    }

    public void setSmoothingWindow(int smoothingWindow) {
        this.smoothingWindow = smoothingWindow;
    }

    public double getEwmaAlpha() {
        return ewmaAlpha;
    }

    public void setEwmaAlpha(double ewmaAlpha) {
        this.ewmaAlpha = ewmaAlpha;
    }

    public int getPeriod() {
        return period;
    }

    public void setPeriod(int period) {
        this.period = period;
    }

    public int getPeriodWindow() {
        return periodWindow;
    }

    public void setPeriodWindow(int periodWindow) {
        this.periodWindow = periodWindow;
    }

    public int getHalfDriftWindow() {
        return halfDriftWindow;
    }

    public void setHalfDriftWindow(int halfDriftWindow) {
        this.halfDriftWindow = halfDriftWindow;
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : null;
    }

    @Override
    public String toString() {
        return "PreprocessingSettings{" +
                "gapFillPolicy='" + gapFillPolicy + '\'' +
                ", maxGap=" + maxGap +
                ", expectedInterval=" + expectedInterval +
                ", invalidValuePolicy='" + invalidValuePolicy + '\'' +
                ", orderingPolicy='" + orderingPolicy + '\'' +
                ", duplicatePolicy='" + duplicatePolicy + '\'' +
                ", transform='" + transform + '\'' +
                ", smoothingWindow=" + smoothingWindow +
                ", ewmaAlpha=" + ewmaAlpha +
                ", period=" + period +
                ", periodWindow=" + periodWindow +
                ", halfDriftWindow=" + halfDriftWindow +
                '}';
    }
}
