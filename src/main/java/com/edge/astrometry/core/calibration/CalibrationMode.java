package com.edge.astrometry.core.calibration;

import java.util.Locale;

/**
 * 标定模式：决定流水线在哪个阶段结束
 */
public enum CalibrationMode {
    SHIFT("shift", CalibrationStage.SHIFT_ONLY),
    ROTATION("rotation", CalibrationStage.ROTATION_SEARCH),
    OTASHIFT("otashift", CalibrationStage.PER_TILE_SHIFT),
    OTASHEAR("otashear", CalibrationStage.PER_TILE_SHEAR),
    DISTORTION("distortion", CalibrationStage.DISTORTION_FIT);

    private final String key;
    private final CalibrationStage lastStage;

    CalibrationMode(String key, CalibrationStage lastStage) {
        this.key = key;
        this.lastStage = lastStage;
    }

    public String getKey() {
        return key;
    }

    public CalibrationStage getLastStage() {
        return lastStage;
    }

    /**
     * 该模式是否执行到给定阶段（SHIFT 模式只执行 SHIFT_ONLY）
     */
    public boolean runs(CalibrationStage stage) {
        if (this == SHIFT) {
            return stage == CalibrationStage.SHIFT_ONLY;
        }
        return stage != CalibrationStage.SHIFT_ONLY && stage.ordinal() <= lastStage.ordinal();
    }

    public static CalibrationMode fromKey(String key) {
        if (key == null || key.isBlank()) {
            return OTASHEAR;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (CalibrationMode mode : values()) {
            if (mode.key.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown calibration mode: " + key
            + " (expected shift, rotation, otashift, otashear or distortion)");
    }
}
