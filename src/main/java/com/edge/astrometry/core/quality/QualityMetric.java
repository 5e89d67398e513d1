package com.edge.astrometry.core.quality;

/**
 * 标定质量指标，除 STARCOUNT 外单位均为角秒
 */
public enum QualityMetric {
    RMS_RA("RMS-RA"),
    RMS_DEC("RMS-DEC"),
    RMS("RMS"),
    MEDIAN_RA("MEDIAN-RA"),
    MEDIAN_DEC("MEDIAN-DEC"),
    MEDIAN("MEDIAN"),
    SIGMA_RA("SIGMA-RA"),
    SIGMA_DEC("SIGMA-DEC"),
    SIGMA("SIGMA"),
    STARCOUNT("STARCOUNT");

    private final String key;

    QualityMetric(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
