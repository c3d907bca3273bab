package mlr.ml;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LeastSquaresSolverTest {

    private final LeastSquaresSolver solver = new LeastSquaresSolver();

    @Test
    void recoversExactPlane() {
        // y = 1 + 2·x₁ + 3·x₂
        double[][] design = {
            {1, 0, 1}, {1, 1, 0}, {1, 2, 3}, {1, 3, 1}, {1, 4, 5}
        };
        double[] y = new double[design.length];
        for (int i = 0; i < y.length; i++) y[i] = 1 + 2 * design[i][1] + 3 * design[i][2];

        FittedModel m = solver.solve(design, y);

        assertArrayEquals(new double[] {1, 2, 3}, m.getWeights(), 1e-9);
        assertEquals(0.0, m.getRss(), 1e-12);
        assertEquals(1.0, m.getRSquared(), 1e-12);
    }

    @Test
    void noisyLineMatchesClosedForm() {
        double[][] design = {{1, 1}, {1, 2}, {1, 3}, {1, 4}};
        double[] y = {2.1, 3.9, 6.1, 7.9};

        FittedModel m = solver.solve(design, y);

        // slope = Sxy / Sxx = 9.8 / 5, intercept = 5.0 - 1.96 * 2.5
        assertEquals(0.1, m.getIntercept(), 1e-9);
        assertEquals(1.96, m.getWeights()[1], 1e-9);
        assertEquals(0.032, m.getRss(), 1e-9);
        assertEquals(1 - 0.032 / 19.24, m.getRSquared(), 1e-9);
        assertEquals(1 - (0.032 / 19.24) * 3 / 2, m.getAdjustedRSquared(), 1e-9);
    }

    @Test
    void largeScaleFeatureIsFullRank() {
        double[][] design = {{1, 1e12}, {1, 2e12}, {1, 3e12}, {1, 4e12}};
        double[] y = {2.1, 3.9, 6.1, 7.9};

        FittedModel m = solver.solve(design, y);

        assertEquals(0.1, m.getIntercept(), 1e-6);
        assertEquals(1.96, m.getWeights()[1] * 1e12, 1e-6);
        assertEquals(0.032, m.getRss(), 1e-6);
    }

    @Test
    void smallScaleFeatureIsFullRank() {
        double[][] design = {{1, 1e-13}, {1, 2e-13}, {1, 3e-13}, {1, 4e-13}};
        double[] y = {2.1, 3.9, 6.1, 7.9};

        FittedModel m = solver.solve(design, y);

        assertEquals(0.1, m.getIntercept(), 1e-6);
        assertEquals(1.96, m.getWeights()[1] * 1e-13, 1e-6);
        assertEquals(0.032, m.getRss(), 1e-6);
    }

    @Test
    void mixedScaleFeaturesAreFullRank() {
        // y = 1 + 2e-9·x₁ + 3e9·x₂
        double[][] design = {
            {1, 0, 1e-9}, {1, 1e9, 0}, {1, 2e9, 3e-9}, {1, 3e9, 1e-9}, {1, 4e9, 5e-9}
        };
        double[] y = new double[design.length];
        for (int i = 0; i < y.length; i++) y[i] = 1 + 2e-9 * design[i][1] + 3e9 * design[i][2];

        FittedModel m = solver.solve(design, y);

        assertEquals(1.0, m.getIntercept(), 1e-6);
        assertEquals(2.0, m.getWeights()[1] * 1e9, 1e-6);
        assertEquals(3.0, m.getWeights()[2] * 1e-9, 1e-6);
    }

    @Test
    void zeroColumnIsSingular() {
        double[][] design = {{1, 0}, {1, 0}, {1, 0}};
        SingularDesignMatrixException e = assertThrows(SingularDesignMatrixException.class,
            () -> solver.solve(design, new double[] {1, 2, 3}));
        assertTrue(e.getMessage().contains("column 1"));
    }

    @Test
    void collinearColumnsAreSingular() {
        double[][] design = {{1, 1, 1}, {1, 2, 2}, {1, 3, 3}, {1, 4, 4}};
        double[] y = {1, 2, 3, 4};

        SingularDesignMatrixException e = assertThrows(SingularDesignMatrixException.class,
            () -> solver.solve(design, y));
        assertEquals(FitFailure.Reason.SINGULAR_MATRIX, e.reason());
        assertTrue(e.getMessage().contains("column 2 is linearly dependent on columns 0..1"));
    }

    @Test
    void constantFeatureIsCollinearWithIntercept() {
        double[][] design = {{1, 5}, {1, 5}, {1, 5}};
        assertThrows(SingularDesignMatrixException.class, () -> solver.solve(design, new double[] {1, 2, 3}));
    }

    @Test
    void fewerRowsThanColumnsIsSingular() {
        double[][] design = {{1, 1, 2}, {1, 3, 4}};
        assertThrows(SingularDesignMatrixException.class, () -> solver.solve(design, new double[] {1, 2}));
    }

    @Test
    void nonFiniteInputIsNumericalInstability() {
        double[][] design = {{1, 1}, {1, Double.NaN}, {1, 3}};
        NumericalInstabilityException e = assertThrows(NumericalInstabilityException.class,
            () -> solver.solve(design, new double[] {1, 2, 3}));
        assertEquals(FitFailure.Reason.NUMERICAL_INSTABILITY, e.reason());

        double[][] ok = {{1, 1}, {1, 2}, {1, 3}};
        assertThrows(NumericalInstabilityException.class,
            () -> solver.solve(ok, new double[] {1, Double.POSITIVE_INFINITY, 3}));
    }

    @Test
    void overflowingResidualsAreNumericalInstability() {
        double[][] design = {{1, 0}, {1, 1}, {1, 2}};
        double[] y = {1e200, -1e200, 1e200};
        assertThrows(NumericalInstabilityException.class, () -> solver.solve(design, y));
    }

    @Test
    void rejectsInvalidTolerance() {
        assertThrows(IllegalArgumentException.class, () -> new LeastSquaresSolver(-1));
        assertThrows(IllegalArgumentException.class, () -> new LeastSquaresSolver(Double.NaN));
    }

    @Test
    void weightsAreCopied() {
        FittedModel m = solver.solve(new double[][] {{1, 1}, {1, 2}, {1, 3}}, new double[] {2, 4, 6});
        double[] w = m.getWeights();
        w[0] = 42;
        assertNotEquals(42, m.getWeights()[0]);
    }
}
