package com.edge.astrometry.core.calibration;

import com.edge.astrometry.core.catalog.Catalog;
import com.edge.astrometry.core.match.MatchedCatalog;
import com.edge.astrometry.core.quality.QualityRecord;
import com.edge.astrometry.core.refine.TileFitOutcome;
import com.edge.astrometry.core.search.RotationGuess;
import com.edge.astrometry.core.tile.TileLayout;
import com.edge.astrometry.core.transform.ShiftRotation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 标定结果
 * <p>
 * validSolution = false 时 reason 给出原因，correction/guess 仅供诊断，不应应用。
 */
public final class CalibrationResult {
    private final boolean validSolution;
    private final String reason;
    private final CalibrationStage finalStage;
    private final CalibrationMode mode;
    private final ShiftRotation correction;
    private final RotationGuess guess;
    private final double pointingError;
    private final TileLayout tiles;
    private final Catalog calibrated;
    private final MatchedCatalog matched;
    private final QualityRecord quality;
    private final Map<Integer, QualityRecord> tileQuality;
    private final Map<Integer, TileFitOutcome> tileOutcomes;
    private final List<StageRecord> stages;
    private final int sourceCount;
    private final int referenceCount;

    private CalibrationResult(Builder b) {
        this.validSolution = b.validSolution;
        this.reason = b.reason;
        this.finalStage = b.validSolution ? CalibrationStage.DONE : CalibrationStage.FAILED;
        this.mode = b.mode;
        this.correction = b.correction;
        this.guess = b.guess;
        this.pointingError = b.pointingError;
        this.tiles = b.tiles;
        this.calibrated = b.calibrated;
        this.matched = b.matched;
        this.quality = b.quality != null ? b.quality : QualityRecord.invalid();
        this.tileQuality = Collections.unmodifiableMap(new LinkedHashMap<>(b.tileQuality));
        this.tileOutcomes = Collections.unmodifiableMap(new LinkedHashMap<>(b.tileOutcomes));
        this.stages = Collections.unmodifiableList(new ArrayList<>(b.stages));
        this.sourceCount = b.sourceCount;
        this.referenceCount = b.referenceCount;
    }

    public static Builder builder(CalibrationMode mode) {
        return new Builder(mode);
    }

    public boolean isValidSolution() { return validSolution; }
    public String getReason() { return reason; }
    public CalibrationStage getFinalStage() { return finalStage; }
    public CalibrationMode getMode() { return mode; }
    public ShiftRotation getCorrection() { return correction; }
    public RotationGuess getGuess() { return guess; }

    public double getContrast() {
        return guess != null ? guess.getContrast() : 0;
    }

    public double getBackgroundMatches() {
        return guess != null ? guess.getBackgroundMatches() : 0;
    }

    public double getPointingError() { return pointingError; }
    public TileLayout getTiles() { return tiles; }
    public Catalog getCalibrated() { return calibrated; }

    /**
     * 最终匹配表（哨兵形式，每个标定后的源一行）
     */
    public MatchedCatalog getMatched() { return matched; }

    public QualityRecord getQuality() { return quality; }
    public Map<Integer, QualityRecord> getTileQuality() { return tileQuality; }
    public Map<Integer, TileFitOutcome> getTileOutcomes() { return tileOutcomes; }
    public List<StageRecord> getStages() { return stages; }
    public int getSourceCount() { return sourceCount; }
    public int getReferenceCount() { return referenceCount; }

    @Override
    public String toString() {
        return "CalibrationResult[" + (validSolution ? "valid" : "invalid: " + reason)
            + ", mode=" + mode.getKey() + ", " + correction + ", " + quality + "]";
    }

    public static final class Builder {
        private final CalibrationMode mode;
        private boolean validSolution;
        private String reason;
        private ShiftRotation correction = ShiftRotation.IDENTITY;
        private RotationGuess guess;
        private double pointingError = Double.NaN;
        private TileLayout tiles = TileLayout.empty();
        private Catalog calibrated;
        private MatchedCatalog matched;
        private QualityRecord quality;
        private Map<Integer, QualityRecord> tileQuality = new LinkedHashMap<>();
        private Map<Integer, TileFitOutcome> tileOutcomes = new LinkedHashMap<>();
        private final List<StageRecord> stages = new ArrayList<>();
        private int sourceCount;
        private int referenceCount;

        private Builder(CalibrationMode mode) {
            this.mode = mode;
        }

        public Builder correction(ShiftRotation value) { this.correction = value; return this; }
        public Builder guess(RotationGuess value) { this.guess = value; return this; }
        public Builder pointingError(double value) { this.pointingError = value; return this; }
        public Builder tiles(TileLayout value) { this.tiles = value; return this; }
        public Builder calibrated(Catalog value) { this.calibrated = value; return this; }
        public Builder matched(MatchedCatalog value) { this.matched = value; return this; }
        public Builder quality(QualityRecord value) { this.quality = value; return this; }
        public Builder tileQuality(Map<Integer, QualityRecord> value) { this.tileQuality = value; return this; }
        public Builder tileOutcomes(Map<Integer, TileFitOutcome> value) { this.tileOutcomes.putAll(value); return this; }
        public Builder sourceCount(int value) { this.sourceCount = value; return this; }
        public Builder referenceCount(int value) { this.referenceCount = value; return this; }

        public Builder stage(StageRecord record) {
            stages.add(record);
            return this;
        }

        public CalibrationResult valid() {
            this.validSolution = true;
            this.reason = null;
            return new CalibrationResult(this);
        }

        public CalibrationResult invalid(String why) {
            this.validSolution = false;
            this.reason = why;
            return new CalibrationResult(this);
        }
    }
}
