package com.edge.astrometry.core.refine;

import java.util.Arrays;

/**
 * 最小二乘拟合结果
 * <p>
 * 未收敛或数据不足时 parameters 为初值，调用方据此沿用拟合前的变换。
 */
public final class FitResult {

    public enum Status {
        CONVERGED,
        NOT_CONVERGED,
        INSUFFICIENT_DATA
    }

    private final Status status;
    private final double[] parameters;
    private final double rms;
    private final int iterations;
    private final int sampleCount;
    private final String message;

    private FitResult(Status status, double[] parameters, double rms, int iterations, int sampleCount,
                      String message) {
        this.status = status;
        this.parameters = parameters.clone();
        this.rms = rms;
        this.iterations = iterations;
        this.sampleCount = sampleCount;
        this.message = message;
    }

    public static FitResult converged(double[] parameters, double rms, int iterations, int sampleCount) {
        return new FitResult(Status.CONVERGED, parameters, rms, iterations, sampleCount, null);
    }

    public static FitResult notConverged(double[] initial, int sampleCount, String message) {
        return new FitResult(Status.NOT_CONVERGED, initial, Double.NaN, 0, sampleCount, message);
    }

    public static FitResult insufficientData(double[] initial, int sampleCount, int required) {
        return new FitResult(Status.INSUFFICIENT_DATA, initial, Double.NaN, 0, sampleCount,
            "need at least " + required + " matches, got " + sampleCount);
    }

    public Status getStatus() { return status; }
    public double[] getParameters() { return parameters.clone(); }
    public double getRms() { return rms; }
    public int getIterations() { return iterations; }
    public int getSampleCount() { return sampleCount; }
    public String getMessage() { return message; }

    public boolean isConverged() {
        return status == Status.CONVERGED;
    }

    /**
     * 同一结果，样本数换成实际参与拟合的匹配数
     */
    public FitResult withSampleCount(int count) {
        return new FitResult(status, parameters, rms, iterations, count, message);
    }

    @Override
    public String toString() {
        return "FitResult[" + status + ", n=" + sampleCount + ", p=" + Arrays.toString(parameters)
            + (message != null ? ", " + message : "") + "]";
    }
}
