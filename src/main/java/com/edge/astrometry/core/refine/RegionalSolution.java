package com.edge.astrometry.core.refine;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.match.MatchedCatalog;
import com.edge.astrometry.core.tile.TileLayout;

import java.util.Collections;
import java.util.Map;

/**
 * 逐 tile 精修后的整体状态
 */
public final class RegionalSolution {
    private final TileLayout tiles;
    private final Catalog calibrated;
    private final MatchedCatalog matched;
    private final Map<Integer, TileFitOutcome> outcomes;

    public RegionalSolution(TileLayout tiles, Catalog calibrated, MatchedCatalog matched,
                            Map<Integer, TileFitOutcome> outcomes) {
        this.tiles = tiles;
        this.calibrated = calibrated;
        this.matched = matched;
        this.outcomes = Collections.unmodifiableMap(outcomes);
    }

    public TileLayout getTiles() { return tiles; }

    /**
     * 用新变换重新投影的源星表
     */
    public Catalog getCalibrated() { return calibrated; }

    /**
     * 收紧半径后的行对齐匹配表（哨兵形式）
     */
    public MatchedCatalog getMatched() { return matched; }

    public Map<Integer, TileFitOutcome> getOutcomes() { return outcomes; }

    public int fittedTileCount() {
        int count = 0;
        for (TileFitOutcome outcome : outcomes.values()) {
            if (outcome.getStatus() == TileFitOutcome.Status.FITTED) {
                count++;
            }
        }
        return count;
    }
}
