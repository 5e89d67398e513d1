package com.edge.astrometry.core.refine;

import com.edge.astrometry.core.wcs.TileWcs;

/**
 * 单个 tile 的精修结果
 */
public final class TileFitOutcome {

    public enum Status {
        FITTED,
        SKIPPED_TOO_FEW,
        NOT_CONVERGED
    }

    private final int tileId;
    private final Status status;
    private final int sampleCount;
    private final double rmsBefore;
    private final double rmsAfter;
    private final TileWcs wcs;

    private TileFitOutcome(int tileId, Status status, int sampleCount, double rmsBefore, double rmsAfter,
                           TileWcs wcs) {
        this.tileId = tileId;
        this.status = status;
        this.sampleCount = sampleCount;
        this.rmsBefore = rmsBefore;
        this.rmsAfter = rmsAfter;
        this.wcs = wcs;
    }

    public static TileFitOutcome fitted(int tileId, int sampleCount, double rmsBefore, double rmsAfter, TileWcs wcs) {
        return new TileFitOutcome(tileId, Status.FITTED, sampleCount, rmsBefore, rmsAfter, wcs);
    }

    public static TileFitOutcome skipped(int tileId, int sampleCount, TileWcs parent) {
        return new TileFitOutcome(tileId, Status.SKIPPED_TOO_FEW, sampleCount, Double.NaN, Double.NaN, parent);
    }

    public static TileFitOutcome notConverged(int tileId, int sampleCount, double rmsBefore, TileWcs parent) {
        return new TileFitOutcome(tileId, Status.NOT_CONVERGED, sampleCount, rmsBefore, rmsBefore, parent);
    }

    public int getTileId() { return tileId; }
    public Status getStatus() { return status; }
    public int getSampleCount() { return sampleCount; }

    /**
     * 拟合前残差 rms（角秒）
     */
    public double getRmsBefore() { return rmsBefore; }

    public double getRmsAfter() { return rmsAfter; }

    /**
     * 拟合后的变换；跳过或未收敛时为原变换
     */
    public TileWcs getWcs() { return wcs; }

    @Override
    public String toString() {
        return String.format("TileFitOutcome[tile=%d, %s, n=%d, rms %.3f\" -> %.3f\"]",
            tileId, status, sampleCount, rmsBefore, rmsAfter);
    }
}
