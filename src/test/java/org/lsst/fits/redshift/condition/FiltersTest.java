package org.lsst.fits.redshift.condition;

import java.util.Arrays;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import org.junit.Test;

public class FiltersTest {

    @Test
    public void testMedianRemovesSpike() {
        double[] data = {1, 1, 1, 9, 1, 1, 1};
        assertArrayEquals(new double[]{1, 1, 1, 1, 1, 1, 1}, Filters.medianFilter(data, 3), 0);
        assertEquals(9, data[3], 0);
    }

    @Test
    public void testMedianFollowsStep() {
        double[] data = {0, 0, 0, 0, 5, 5, 5, 5};
        double[] result = Filters.medianFilter(data, 3);
        assertEquals(0, result[2], 0);
        assertEquals(5, result[5], 0);
    }

    @Test
    public void testBoxCarConstant() {
        double[] data = new double[40];
        Arrays.fill(data, 3);
        for (double v : Filters.boxCarSmooth(data, 7)) {
            assertEquals(3, v, 1e-12);
        }
    }

    @Test
    public void testBoxCarAverage() {
        double[] data = {0, 0, 0, 0, 3, 0, 0, 0, 0};
        double[] result = Filters.boxCarSmooth(data, 3);
        assertEquals(1, result[3], 1e-12);
        assertEquals(1, result[4], 1e-12);
        assertEquals(1, result[5], 1e-12);
        assertEquals(0, result[7], 1e-12);
    }

    @Test
    public void testFastSmooth() {
        double[] data = new double[20];
        Arrays.fill(data, 1);
        double[] result = Filters.fastSmooth(data, 1);
        assertEquals(1, result[10], 1e-12);
        assertEquals(3.0 / 5, result[0], 1e-12);
        assertArrayEquals(data, Filters.fastSmooth(data, 0), 0);
    }

    @Test
    public void testFastSmoothWindowCentred() {
        double[] data = new double[20];
        data[10] = 5;
        double[] result = Filters.fastSmooth(data, 1);
        for (int i = 0; i < data.length; i++) {
            assertEquals("index " + i, Math.abs(i - 10) <= 2 ? 1 : 0, result[i], 1e-12);
        }
        assertEquals(5, data[10], 0);
    }

    @Test
    public void testRollingPointMean() {
        double[] data = new double[20];
        Arrays.fill(data, 4);
        Filters.rollingPointMean(data, 2, 0.5);
        assertEquals(4, data[10], 1e-12);
        // Only three of the five weights (0.25, 0.5, 1, 0.5, 0.25) are in range at the start
        assertEquals(4 * 1.75 / 2.5, data[0], 1e-12);
    }

    @Test
    public void testRemoveNaNs() {
        double[] data = {Double.NaN, 1, Double.NaN, Double.NaN, 4};
        Filters.removeNaNs(data);
        assertArrayEquals(new double[]{0, 1, 1, 1, 4}, data, 0);
    }

    @Test
    public void testStatistics() {
        double[] data = {1, -3, 2, -2};
        assertEquals(8, Filters.area(data, 0, 3), 0);
        assertEquals(7, Filters.area(data, 1, 10), 0);
        assertEquals(-0.5, Filters.mean(data), 1e-12);
        assertEquals(2, Filters.absMean(data), 1e-12);
        assertEquals(3, Filters.absMax(data), 0);
        assertEquals(Math.sqrt((2.25 + 6.25 + 6.25 + 2.25) / 4), Filters.standardDeviation(data), 1e-12);
    }

    @Test
    public void testSmoothContinuumRemovesBaseline() {
        double[] data = new double[200];
        Arrays.fill(data, 8);
        data[100] = 20;
        double[] continuum = new SmoothContinuumSubtraction(51, 7).smoothAndSubtract(data);
        assertEquals(8, continuum[100], 1e-12);
        assertEquals(12, data[100], 1e-12);
        assertEquals(0, data[150], 1e-12);
    }
}
