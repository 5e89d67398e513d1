package com.edge.astrometry.core.search;

/**
 * 旋转角搜索范围
 * <ul>
 *   <li>{@link Kind#NO_ROTATION}：只搜索角度 0</li>
 *   <li>{@link Kind#SYMMETRIC}：[-max, +max]</li>
 *   <li>{@link Kind#EXPLICIT}：[min, max]</li>
 * </ul>
 * 在调用边界解析一次，之后只通过 {@link #toGrid(double)} 生成角度网格。
 */
public abstract class AngleRange {

    public enum Kind {
        NO_ROTATION,
        SYMMETRIC,
        EXPLICIT
    }

    private static final AngleRange NONE = new NoRotation();

    AngleRange() {
    }

    public static AngleRange none() {
        return NONE;
    }

    public static AngleRange symmetric(double maxDeg) {
        return new SymmetricRange(maxDeg);
    }

    public static AngleRange explicit(double minDeg, double maxDeg) {
        return new ExplicitRange(minDeg, maxDeg);
    }

    public abstract Kind getKind();

    public abstract double getMinDeg();

    public abstract double getMaxDeg();

    /**
     * 等间距角度网格，包含两端点，个数 = ceil(范围 / 步长) + 1
     */
    public double[] toGrid(double stepDeg) {
        double min = getMinDeg();
        double max = getMaxDeg();
        double range = max - min;
        if (range <= 0) {
            return new double[]{min};
        }
        if (!(stepDeg > 0)) {
            throw new IllegalArgumentException("Angle step must be positive, got " + stepDeg);
        }
        int count = (int) Math.ceil(range / stepDeg - 1e-9) + 1;
        double[] grid = new double[count];
        for (int i = 0; i < count; i++) {
            grid[i] = min + range * i / (count - 1);
        }
        grid[count - 1] = max;
        return grid;
    }

    public static final class NoRotation extends AngleRange {
        private NoRotation() {
        }

        @Override
        public Kind getKind() { return Kind.NO_ROTATION; }

        @Override
        public double getMinDeg() { return 0; }

        @Override
        public double getMaxDeg() { return 0; }

        @Override
        public String toString() {
            return "NoRotation";
        }
    }

    public static final class SymmetricRange extends AngleRange {
        private final double maxDeg;

        private SymmetricRange(double maxDeg) {
            if (maxDeg < 0 || Double.isNaN(maxDeg)) {
                throw new IllegalArgumentException("Symmetric range must be >= 0, got " + maxDeg);
            }
            this.maxDeg = maxDeg;
        }

        @Override
        public Kind getKind() { return Kind.SYMMETRIC; }

        @Override
        public double getMinDeg() { return -maxDeg; }

        @Override
        public double getMaxDeg() { return maxDeg; }

        @Override
        public String toString() {
            return "SymmetricRange(" + maxDeg + ")";
        }
    }

    public static final class ExplicitRange extends AngleRange {
        private final double minDeg;
        private final double maxDeg;

        private ExplicitRange(double minDeg, double maxDeg) {
            if (!(minDeg <= maxDeg)) {
                throw new IllegalArgumentException("Angle range min " + minDeg + " > max " + maxDeg);
            }
            this.minDeg = minDeg;
            this.maxDeg = maxDeg;
        }

        @Override
        public Kind getKind() { return Kind.EXPLICIT; }

        @Override
        public double getMinDeg() { return minDeg; }

        @Override
        public double getMaxDeg() { return maxDeg; }

        @Override
        public String toString() {
            return "ExplicitRange(" + minDeg + ", " + maxDeg + ")";
        }
    }
}
