package com.edge.astrometry.core.calibration;

import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.search.AngleRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 标定流水线参数，角度单位均为度
 */
public class CalibrationSettings {

    // 源星表预处理
    private double minFwhm = 0.3 * CatalogColumns.ARCSEC;
    private double maxMagError = 0.3;
    private double sourceIsolationRadius = 10 * CatalogColumns.ARCSEC;
    private int maxSources = 1500;

    // 参考星表
    private int referenceMaxSources = 2000;
    private double referenceIsolationStart = 8 * CatalogColumns.ARCSEC;
    private double referenceIsolationMin = 10 * CatalogColumns.ARCSEC;
    private double referenceIsolationStep = 2 * CatalogColumns.ARCSEC;
    private double referenceExtraRadius = 0.8;

    // 旋转搜索
    private List<Double> pointingErrors = new ArrayList<>(Arrays.asList(
        3 * CatalogColumns.ARCMIN, 5 * CatalogColumns.ARCMIN, 7 * CatalogColumns.ARCMIN));
    private AngleRange rotatorRange = AngleRange.explicit(-3.0, 3.5);
    private double angleStep = 20 * CatalogColumns.ARCMIN;
    private double votingRadius = 5 * CatalogColumns.ARCSEC;
    private double minContrast = 3.0;
    private boolean parallel = true;

    // 精修
    private double globalMatchRadius = 5 * CatalogColumns.ARCSEC;
    private int globalMinMatches = 4;
    private double tileShiftMatchRadius = 3 * CatalogColumns.ARCSEC;
    private int tileShiftMinSample = 4;
    private double tileShearMatchRadius = 3 * CatalogColumns.ARCSEC;
    private int tileShearMinSample = 9;
    private double distortionMatchRadius = 2 * CatalogColumns.ARCSEC;
    private int distortionMinSample = 14;
    private double finalMatchRadius = 2 * CatalogColumns.ARCSEC;

    public CalibrationSettings copy() {
        CalibrationSettings c = new CalibrationSettings();
        c.minFwhm = minFwhm;
        c.maxMagError = maxMagError;
        c.sourceIsolationRadius = sourceIsolationRadius;
        c.maxSources = maxSources;
        c.referenceMaxSources = referenceMaxSources;
        c.referenceIsolationStart = referenceIsolationStart;
        c.referenceIsolationMin = referenceIsolationMin;
        c.referenceIsolationStep = referenceIsolationStep;
        c.referenceExtraRadius = referenceExtraRadius;
        c.pointingErrors = new ArrayList<>(pointingErrors);
        c.rotatorRange = rotatorRange;
        c.angleStep = angleStep;
        c.votingRadius = votingRadius;
        c.minContrast = minContrast;
        c.parallel = parallel;
        c.globalMatchRadius = globalMatchRadius;
        c.globalMinMatches = globalMinMatches;
        c.tileShiftMatchRadius = tileShiftMatchRadius;
        c.tileShiftMinSample = tileShiftMinSample;
        c.tileShearMatchRadius = tileShearMatchRadius;
        c.tileShearMinSample = tileShearMinSample;
        c.distortionMatchRadius = distortionMatchRadius;
        c.distortionMinSample = distortionMinSample;
        c.finalMatchRadius = finalMatchRadius;
        return c;
    }

    /**
     * 指向误差半径，从小到大
     */
    public List<Double> sortedPointingErrors() {
        List<Double> sorted = new ArrayList<>(pointingErrors);
        Collections.sort(sorted);
        return sorted;
    }

    public double maxPointingError() {
        return Collections.max(pointingErrors);
    }

    public double getMinFwhm() { return minFwhm; }
    public void setMinFwhm(double minFwhm) { this.minFwhm = minFwhm; }

    public double getMaxMagError() { return maxMagError; }
    public void setMaxMagError(double maxMagError) { this.maxMagError = maxMagError; }

    public double getSourceIsolationRadius() { return sourceIsolationRadius; }
    public void setSourceIsolationRadius(double sourceIsolationRadius) { this.sourceIsolationRadius = sourceIsolationRadius; }

    public int getMaxSources() { return maxSources; }
    public void setMaxSources(int maxSources) { this.maxSources = maxSources; }

    public int getReferenceMaxSources() { return referenceMaxSources; }
    public void setReferenceMaxSources(int referenceMaxSources) { this.referenceMaxSources = referenceMaxSources; }

    public double getReferenceIsolationStart() { return referenceIsolationStart; }
    public void setReferenceIsolationStart(double referenceIsolationStart) { this.referenceIsolationStart = referenceIsolationStart; }

    public double getReferenceIsolationMin() { return referenceIsolationMin; }
    public void setReferenceIsolationMin(double referenceIsolationMin) { this.referenceIsolationMin = referenceIsolationMin; }

    public double getReferenceIsolationStep() { return referenceIsolationStep; }
    public void setReferenceIsolationStep(double referenceIsolationStep) { this.referenceIsolationStep = referenceIsolationStep; }

    public double getReferenceExtraRadius() { return referenceExtraRadius; }
    public void setReferenceExtraRadius(double referenceExtraRadius) { this.referenceExtraRadius = referenceExtraRadius; }

    public List<Double> getPointingErrors() { return pointingErrors; }

    public void setPointingErrors(List<Double> pointingErrors) {
        if (pointingErrors == null || pointingErrors.isEmpty()) {
            throw new IllegalArgumentException("At least one pointing error is required");
        }
        this.pointingErrors = new ArrayList<>(pointingErrors);
    }

    public AngleRange getRotatorRange() { return rotatorRange; }
    public void setRotatorRange(AngleRange rotatorRange) { this.rotatorRange = rotatorRange; }

    public double getAngleStep() { return angleStep; }
    public void setAngleStep(double angleStep) { this.angleStep = angleStep; }

    public double getVotingRadius() { return votingRadius; }
    public void setVotingRadius(double votingRadius) { this.votingRadius = votingRadius; }

    public double getMinContrast() { return minContrast; }
    public void setMinContrast(double minContrast) { this.minContrast = minContrast; }

    public boolean isParallel() { return parallel; }
    public void setParallel(boolean parallel) { this.parallel = parallel; }

    public double getGlobalMatchRadius() { return globalMatchRadius; }
    public void setGlobalMatchRadius(double globalMatchRadius) { this.globalMatchRadius = globalMatchRadius; }

    public int getGlobalMinMatches() { return globalMinMatches; }
    public void setGlobalMinMatches(int globalMinMatches) { this.globalMinMatches = globalMinMatches; }

    public double getTileShiftMatchRadius() { return tileShiftMatchRadius; }
    public void setTileShiftMatchRadius(double tileShiftMatchRadius) { this.tileShiftMatchRadius = tileShiftMatchRadius; }

    public int getTileShiftMinSample() { return tileShiftMinSample; }
    public void setTileShiftMinSample(int tileShiftMinSample) { this.tileShiftMinSample = tileShiftMinSample; }

    public double getTileShearMatchRadius() { return tileShearMatchRadius; }
    public void setTileShearMatchRadius(double tileShearMatchRadius) { this.tileShearMatchRadius = tileShearMatchRadius; }

    public int getTileShearMinSample() { return tileShearMinSample; }
    public void setTileShearMinSample(int tileShearMinSample) { this.tileShearMinSample = tileShearMinSample; }

    public double getDistortionMatchRadius() { return distortionMatchRadius; }
    public void setDistortionMatchRadius(double distortionMatchRadius) { this.distortionMatchRadius = distortionMatchRadius; }

    public int getDistortionMinSample() { return distortionMinSample; }
    public void setDistortionMinSample(int distortionMinSample) { this.distortionMinSample = distortionMinSample; }

    public double getFinalMatchRadius() { return finalMatchRadius; }
    public void setFinalMatchRadius(double finalMatchRadius) { this.finalMatchRadius = finalMatchRadius; }
}
