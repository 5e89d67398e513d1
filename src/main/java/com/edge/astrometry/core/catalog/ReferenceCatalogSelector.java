package com.edge.astrometry.core.catalog;

import com.edge.astrometry.core.match.DeclinationScale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 参考星表准备
 * <p>
 * 1. 区域筛选：只保留落在源星表覆盖范围（外扩最大指向误差）内的参考星
 * 2. 迭代孤立：从 8" 起每次加 2"，直到星数不超过上限且孤立距离不小于 10"
 */
@Component
public class ReferenceCatalogSelector {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceCatalogSelector.class);

    private final CatalogPreprocessor preprocessor;

    public ReferenceCatalogSelector(CatalogPreprocessor preprocessor) {
        this.preprocessor = preprocessor;
    }

    /**
     * 参考星落在源星表外包框（RA 方向按 cos(dec) 换算）外扩 margin 的范围内才保留
     */
    public Catalog selectOverlapping(Catalog source, Catalog reference, double margin) {
        if (source.isEmpty() || reference.isEmpty()) {
            return Catalog.empty(reference.width());
        }
        double minRa = Double.POSITIVE_INFINITY, maxRa = Double.NEGATIVE_INFINITY;
        double minDec = Double.POSITIVE_INFINITY, maxDec = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < source.size(); i++) {
            minRa = Math.min(minRa, source.x(i));
            maxRa = Math.max(maxRa, source.x(i));
            minDec = Math.min(minDec, source.y(i));
            maxDec = Math.max(maxDec, source.y(i));
        }
        double cosDec = DeclinationScale.factorFor(Math.max(Math.abs(minDec), Math.abs(maxDec)));
        double raMargin = margin / cosDec;

        double loRa = minRa - raMargin, hiRa = maxRa + raMargin;
        double loDec = minDec - margin, hiDec = maxDec + margin;
        Catalog overlapping = reference.filter(i ->
            reference.x(i) >= loRa && reference.x(i) <= hiRa
                && reference.y(i) >= loDec && reference.y(i) <= hiDec);
        logger.debug("参考星表区域筛选: {} -> {} (外扩 {}')",
            reference.size(), overlapping.size(), String.format("%.1f", margin * 60));
        return overlapping;
    }

    /**
     * 迭代孤立参考星
     *
     * @param reference       参考星表
     * @param maxSources      星数上限
     * @param initialDistance 起始孤立距离（度），第一轮前先加一个步长
     * @param minDistance     最小孤立距离（度）
     * @param step            步长（度）
     */
    public Catalog isolate(Catalog reference, int maxSources, double initialDistance,
                           double minDistance, double step) {
        if (step <= 0) {
            throw new IllegalArgumentException("Isolation step must be positive, got " + step);
        }
        Catalog current = reference;
        double distance = initialDistance;
        // 浮点累加误差容忍
        double tolerance = step * 1e-6;
        while (current.size() > maxSources || distance < minDistance - tolerance) {
            distance += step;
            Catalog isolated = preprocessor.pickIsolated(current, distance);
            if (isolated.isEmpty()) {
                logger.warn("参考星孤立筛选 ({}\") 清空了星表，保留上一轮的 {} 颗星",
                    String.format("%.1f", distance * 3600), current.size());
                break;
            }
            current = isolated;
            logger.debug("参考星表孤立筛选到 {} 颗 (min_d={}\")", current.size(),
                String.format("%.1f", distance * 3600));
        }
        logger.info("最终参考星表: {} 颗, 孤立距离 >{}\"", current.size(), String.format("%.1f", distance * 3600));
        return current;
    }
}
