package com.edge.astrometry.core.search;

import com.edge.astrometry.core.catalog.CatalogColumns;
import com.edge.astrometry.core.transform.ShiftRotation;

import java.util.Collections;
import java.util.List;

/**
 * 旋转搜索结果：最佳角度、偏移、票数以及显著性
 */
public final class RotationGuess {
    private final boolean found;
    private final double angleDeg;
    private final double dRa;
    private final double dDec;
    private final int votes;
    private final double backgroundMatches;
    private final double contrast;
    private final double pointingError;
    private final List<AngleVote> angleVotes;

    private RotationGuess(boolean found, double angleDeg, double dRa, double dDec, int votes,
                          double backgroundMatches, double contrast, double pointingError,
                          List<AngleVote> angleVotes) {
        this.found = found;
        this.angleDeg = angleDeg;
        this.dRa = dRa;
        this.dDec = dDec;
        this.votes = votes;
        this.backgroundMatches = backgroundMatches;
        this.contrast = contrast;
        this.pointingError = pointingError;
        this.angleVotes = Collections.unmodifiableList(angleVotes);
    }

    public static RotationGuess of(AngleVote best, double backgroundMatches, double contrast,
                                   double pointingError, List<AngleVote> angleVotes) {
        return new RotationGuess(true, best.getAngleDeg(), best.getVote().getDRa(), best.getVote().getDDec(),
            best.getVotes(), backgroundMatches, contrast, pointingError, angleVotes);
    }

    /**
     * 所有角度都没有候选星对
     */
    public static RotationGuess noCandidates(double pointingError, List<AngleVote> angleVotes) {
        return new RotationGuess(false, 0, Double.NaN, Double.NaN, 0, 0, 0, pointingError, angleVotes);
    }

    public boolean isFound() { return found; }
    public double getAngleDeg() { return angleDeg; }
    public double getDRa() { return dRa; }
    public double getDDec() { return dDec; }
    public int getVotes() { return votes; }
    public double getBackgroundMatches() { return backgroundMatches; }
    public double getContrast() { return contrast; }
    public double getPointingError() { return pointingError; }
    public List<AngleVote> getAngleVotes() { return angleVotes; }

    public ShiftRotation toShiftRotation() {
        if (!found) {
            return ShiftRotation.IDENTITY;
        }
        return new ShiftRotation(angleDeg, dRa, dDec);
    }

    @Override
    public String toString() {
        if (!found) {
            return String.format("RotationGuess[no candidates, pointing error %.1f']",
                pointingError / CatalogColumns.ARCMIN);
        }
        return String.format("RotationGuess[angle=%.4f°, dRA=%.2f\", dDec=%.2f\", votes=%d, bg=%.1f, contrast=%.1f]",
            angleDeg, dRa / CatalogColumns.ARCSEC, dDec / CatalogColumns.ARCSEC, votes, backgroundMatches, contrast);
    }
}
