package com.edge.astrometry.core.refine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LevenbergMarquardtSolverTest {

    private final LevenbergMarquardtSolver solver = new LevenbergMarquardtSolver();

    @Test
    void fitsLine() {
        double[] x = {0, 1, 2, 3, 4, 5};
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = 2.5 * x[i] - 1.0;
        }

        FitResult result = solver.solve(p -> {
            double[] r = new double[x.length];
            for (int i = 0; i < x.length; i++) {
                r[i] = p[0] * x[i] + p[1] - y[i];
            }
            return r;
        }, new double[]{0, 0}, x.length);

        assertThat(result.isConverged()).isTrue();
        assertThat(result.getParameters()[0]).isCloseTo(2.5, within(1e-8));
        assertThat(result.getParameters()[1]).isCloseTo(-1.0, within(1e-8));
        assertThat(result.getRms()).isCloseTo(0, within(1e-8));
    }

    @Test
    void reportsInsufficientData() {
        FitResult result = solver.solve(p -> new double[]{p[0] - 1}, new double[]{0, 0, 0}, 1);

        assertThat(result.getStatus()).isEqualTo(FitResult.Status.INSUFFICIENT_DATA);
        assertThat(result.getParameters()).containsExactly(0, 0, 0);
    }

    @Test
    void reportsIterationLimitAsNotConverged() {
        LevenbergMarquardtSolver limited = new LevenbergMarquardtSolver(3, 1);

        FitResult result = limited.solve(p -> new double[]{Math.exp(p[0]) - 10, p[0] * p[0] - 5},
            new double[]{-20}, 2);

        assertThat(result.getStatus()).isEqualTo(FitResult.Status.NOT_CONVERGED);
        assertThat(result.getParameters()).containsExactly(-20);
    }
}
