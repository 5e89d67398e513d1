package com.edge.astrometry.core.refine;

import com.edge.astrometry.core.transform.ShiftRotation;

/**
 * 全局旋转 + 平移精修结果；未收敛时 solution 即初值
 */
public final class ShiftRotationFit {
    private final ShiftRotation solution;
    private final FitResult fit;

    public ShiftRotationFit(ShiftRotation solution, FitResult fit) {
        this.solution = solution;
        this.fit = fit;
    }

    public ShiftRotation getSolution() { return solution; }
    public FitResult getFit() { return fit; }

    public boolean isConverged() {
        return fit.isConverged();
    }

    public int getMatchCount() {
        return fit.getSampleCount();
    }

    @Override
    public String toString() {
        return "ShiftRotationFit[" + solution + ", " + fit.getStatus() + ", n=" + fit.getSampleCount() + "]";
    }
}
