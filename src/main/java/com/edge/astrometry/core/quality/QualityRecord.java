package com.edge.astrometry.core.quality;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一组质量指标；没有可用匹配时所有数值为 {@link #INVALID}
 */
public final class QualityRecord {

    public static final double INVALID = -9999;

    private final EnumMap<QualityMetric, Double> values;

    QualityRecord(EnumMap<QualityMetric, Double> values) {
        this.values = new EnumMap<>(values);
    }

    public static QualityRecord invalid() {
        EnumMap<QualityMetric, Double> values = new EnumMap<>(QualityMetric.class);
        for (QualityMetric metric : QualityMetric.values()) {
            values.put(metric, INVALID);
        }
        values.put(QualityMetric.STARCOUNT, 0.0);
        return new QualityRecord(values);
    }

    public double get(QualityMetric metric) {
        return values.get(metric);
    }

    public int getStarCount() {
        return (int) get(QualityMetric.STARCOUNT);
    }

    public boolean isValid() {
        return getStarCount() > 0;
    }

    /**
     * 以指标名为键的有序映射，用于日志与 JSON 输出
     */
    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (Map.Entry<QualityMetric, Double> entry : values.entrySet()) {
            map.put(entry.getKey().getKey(), entry.getValue());
        }
        return map;
    }

    @Override
    public String toString() {
        return String.format("Quality[n=%d, rms=%.3f\" (%.3f, %.3f), median=(%.3f, %.3f), sigma=%.3f\"]",
            getStarCount(), get(QualityMetric.RMS), get(QualityMetric.RMS_RA), get(QualityMetric.RMS_DEC),
            get(QualityMetric.MEDIAN_RA), get(QualityMetric.MEDIAN_DEC), get(QualityMetric.SIGMA));
    }
}
