package com.edge.astrometry.core.refine;

/**
 * 非线性最小二乘求解器
 */
public interface LeastSquaresSolver {

    /**
     * 向量残差目标函数
     */
    @FunctionalInterface
    interface ResidualFunction {
        double[] residuals(double[] parameters);
    }

    /**
     * 最小化 Σ r_i(p)²
     *
     * @param objective     残差函数
     * @param initial       初值
     * @param residualCount 残差向量长度
     */
    FitResult solve(ResidualFunction objective, double[] initial, int residualCount);
}
