package com.edge.astrometry.core.calibration;

import com.edge.astrometry.core.transform.ShiftRotation;

/**
 * 单个阶段的诊断记录
 */
public final class StageRecord {
    private final CalibrationStage stage;
    private final double angleDeg;
    private final double dRaArcsec;
    private final double dDecArcsec;
    private final int matchCount;
    private final String description;

    public StageRecord(CalibrationStage stage, double angleDeg, double dRaArcsec, double dDecArcsec,
                       int matchCount, String description) {
        this.stage = stage;
        this.angleDeg = angleDeg;
        this.dRaArcsec = dRaArcsec;
        this.dDecArcsec = dDecArcsec;
        this.matchCount = matchCount;
        this.description = description;
    }

    public static StageRecord of(CalibrationStage stage, ShiftRotation correction, int matchCount,
                                 String description) {
        return new StageRecord(stage, correction.getAngleDeg(), correction.getDRaArcsec(),
            correction.getDDecArcsec(), matchCount, description);
    }

    public CalibrationStage getStage() { return stage; }
    public double getAngleDeg() { return angleDeg; }
    public double getDRaArcsec() { return dRaArcsec; }
    public double getDDecArcsec() { return dDecArcsec; }
    public int getMatchCount() { return matchCount; }
    public String getDescription() { return description; }

    @Override
    public String toString() {
        return String.format("%s: angle=%.4f°, dRA=%.2f\", dDec=%.2f\", n=%d (%s)",
            stage, angleDeg, dRaArcsec, dDecArcsec, matchCount, description);
    }
}
