package com.fluxwatch.core.config;

import java.io.Serializable;

/**
 * Offline scoring and batch-run settings (the {@code evaluation} YAML section).
 *
 * @since 1.0.0
 */
public class EvaluationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Number of detections after the start of a labelled interval within which
     * a flag still credits the interval; negative means the whole interval.
     */
    private int detectionDelay = -1;

    /** Capacity of the queue between the preprocessing producer and the detector. */
    private int bufferCapacity = 256;

    /** Threads used to run independent streams of a dataset concurrently. */
    private int workerThreads = 4;

    /**
     * @throws IllegalStateException if a value is out of range
     */
    public void validate() {
        if (bufferCapacity < 1) {
            throw new IllegalStateException("Invalid evaluation settings: 'bufferCapacity' must be >= 1, got: "
                    + bufferCapacity);
        }
        if (workerThreads < 1) {
            throw new IllegalStateException("Invalid evaluation settings: 'workerThreads' must be >= 1, got: "
                    + workerThreads);
        }
    }

    public int getDetectionDelay() {
        return detectionDelay;
    }

    public void setDetectionDelay(int detectionDelay) {
        this.detectionDelay = detectionDelay;
    }

    public int getBufferCapacity() {
        return bufferCapacity;
    }

    public void setBufferCapacity(int bufferCapacity) {
        this.bufferCapacity = bufferCapacity;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    @Override
    public String toString() {
        return "EvaluationSettings{" +
                "detectionDelay=" + detectionDelay +
                ", bufferCapacity=" + bufferCapacity +
                ", workerThreads=" + workerThreads +
                '}';
    }
}
