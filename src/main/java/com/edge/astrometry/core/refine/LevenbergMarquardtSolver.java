package com.edge.astrometry.core.refine;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commons Math Levenberg-Marquardt，雅可比矩阵用中心差分
 */
public class LevenbergMarquardtSolver implements LeastSquaresSolver {
    private static final Logger logger = LoggerFactory.getLogger(LevenbergMarquardtSolver.class);

    private static final double RELATIVE_STEP = 1e-7;

    private final int maxEvaluations;
    private final int maxIterations;

    public LevenbergMarquardtSolver() {
        this(2000, 500);
    }

    public LevenbergMarquardtSolver(int maxEvaluations, int maxIterations) {
        this.maxEvaluations = maxEvaluations;
        this.maxIterations = maxIterations;
    }

    @Override
    public FitResult solve(ResidualFunction objective, double[] initial, int residualCount) {
        if (residualCount < initial.length) {
            return FitResult.insufficientData(initial, residualCount, initial.length);
        }

        MultivariateJacobianFunction model = point -> evaluate(objective, point.toArray(), residualCount);
        LeastSquaresProblem problem = new LeastSquaresBuilder()
            .start(initial)
            .model(model)
            .target(new double[residualCount])
            .maxEvaluations(maxEvaluations)
            .maxIterations(maxIterations)
            .build();

        try {
            LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);
            double[] fitted = optimum.getPoint().toArray();
            for (double value : fitted) {
                if (!Double.isFinite(value)) {
                    return FitResult.notConverged(initial, residualCount, "non-finite parameters");
                }
            }
            logger.trace("LM 收敛: {} 次迭代, rms={}", optimum.getIterations(), optimum.getRMS());
            return FitResult.converged(fitted, optimum.getRMS(), optimum.getIterations(), residualCount);
        } catch (MathIllegalStateException e) {
            // 迭代/求值次数超限或奇异
            logger.warn("最小二乘未收敛: {}", e.getMessage());
            return FitResult.notConverged(initial, residualCount, e.getMessage());
        }
    }

    private Pair<RealVector, RealMatrix> evaluate(ResidualFunction objective, double[] p, int residualCount) {
        double[] value = checkLength(objective.residuals(p), residualCount);
        double[][] jacobian = new double[residualCount][p.length];
        for (int j = 0; j < p.length; j++) {
            double h = RELATIVE_STEP * Math.max(1.0, Math.abs(p[j]));
            double[] plus = p.clone();
            double[] minus = p.clone();
            plus[j] += h;
            minus[j] -= h;
            double[] rPlus = checkLength(objective.residuals(plus), residualCount);
            double[] rMinus = checkLength(objective.residuals(minus), residualCount);
            for (int i = 0; i < residualCount; i++) {
                jacobian[i][j] = (rPlus[i] - rMinus[i]) / (2 * h);
            }
        }
        return new Pair<>(new ArrayRealVector(value, false), new Array2DRowRealMatrix(jacobian, false));
    }

    private static double[] checkLength(double[] residuals, int expected) {
        if (residuals.length != expected) {
            throw new IllegalStateException("Objective returned " + residuals.length
                + " residuals, expected " + expected);
        }
        return residuals;
    }
}
