package com.edge.astrometry.core.calibration;

/**
 * 流水线状态，按执行顺序排列
 */
public enum CalibrationStage {
    SHIFT_ONLY,
    ROTATION_SEARCH,
    PER_TILE_SHIFT,
    PER_TILE_SHEAR,
    DISTORTION_FIT,
    DONE,
    FAILED
}
