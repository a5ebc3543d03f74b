package com.chicu.cellfeatures.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatsTest {

    private static final double EPS = 1e-9;

    @Test
    void moments_shouldMatchPopulationConventions() {
        double[] x = {1, 2, 3, 4};
        assertEquals(2.5, Stats.mean(x), EPS);
        assertEquals(1.25, Stats.variance(x), EPS);
        assertEquals(0.0, Stats.skew(x), EPS);
        // m4 / m2^2 - 3 = 2.5625 / 1.5625 - 3
        assertEquals(-1.36, Stats.kurtosis(x), EPS);
    }

    @Test
    void pearsonKurtosisUnbiased_shouldMatchHandComputedValue() {
        // несмещённый эксцесс по Пирсону для [1,2,3,4,10], посчитан вручную
        double[] x = {1, 2, 3, 4, 10};
        // ((n²-1)·2.788 - 3(n-1)²) / ((n-2)(n-3)) + 3
        assertEquals(6.152, Stats.pearsonKurtosisUnbiased(x), 1e-9);
    }

    @Test
    void emptyInput_shouldGiveNaN_exceptSums() {
        double[] empty = new double[0];
        assertTrue(Double.isNaN(Stats.mean(empty)));
        assertTrue(Double.isNaN(Stats.min(empty)));
        assertTrue(Double.isNaN(Stats.variance(empty)));
        assertEquals(0.0, Stats.sumAbs(empty));
        assertEquals(0.0, Stats.sumSquares(empty));
    }

    @Test
    void nanAware_shouldSkipNaN() {
        double[] x = {Double.NaN, 2, 4};
        assertEquals(3.0, Stats.nanMean(x), EPS);
        assertEquals(6.0, Stats.nanSum(x), EPS);
        assertEquals(2.0, Stats.nanMin(x), EPS);
        assertEquals(4.0, Stats.nanMax(x), EPS);
        assertArrayEquals(new double[]{2, 4}, Stats.finite(new double[]{Double.NaN, 2, Double.POSITIVE_INFINITY, 4}));
    }

    @Test
    void signedLog_shouldUseAbsoluteValue() {
        assertEquals(-2.0, Stats.signedLog(-0.01), EPS);
        assertEquals(1.0, Stats.signedLog(10), EPS);
        assertEquals(Double.NEGATIVE_INFINITY, Stats.signedLog(0));
    }

    @Test
    void median_shouldAverageMiddlePair_whenEvenLength() {
        assertEquals(2.5, Stats.median(new double[]{4, 1, 3, 2}), EPS);
        assertEquals(3.0, Stats.median(new double[]{5, 3, 1}), EPS);
    }

    @Test
    void linearFit_shouldRecoverLine_andGiveNaN_whenDegenerate() {
        LinearFit fit = LinearFit.of(new double[]{0, 1, 2, 3}, new double[]{1, 3, 5, 7});
        assertEquals(2.0, fit.slope(), EPS);
        assertEquals(1.0, fit.intercept(), EPS);

        assertTrue(Double.isNaN(LinearFit.of(new double[]{1, 1}, new double[]{2, 3}).slope()));
        assertTrue(Double.isNaN(LinearFit.of(new double[]{1}, new double[]{2}).slope()));
    }
}
