package org.lsst.fits.redshift.condition;

import java.util.Random;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class ErrorAdjustmentTest {

    @Test
    public void testBroaden() {
        double[] variance = {1, 1, 5, 1, 1};
        new ErrorAdjustment(3, 101, 0.6, 1e10).broadenError(variance);
        assertArrayEquals(new double[]{1, 5, 5, 5, 1}, variance, 0);
    }

    @Test
    public void testSentinelSkipped() {
        double[] variance = {1, 1e10, 1};
        new ErrorAdjustment(3, 101, 0.6, 1e10).broadenError(variance);
        assertArrayEquals(new double[]{1, 1e10, 1}, variance, 0);
    }

    @Test
    public void testNeverLowers() {
        Random random = new Random(3);
        double[] variance = new double[500];
        for (int i = 0; i < variance.length; i++) {
            variance[i] = random.nextDouble() * (random.nextDouble() < 0.05 ? 100 : 1);
        }
        variance[17] = 1e10;
        double[] original = variance.clone();
        new ErrorAdjustment(3, 101, 0.6, 1e10).adjustError(variance);
        for (int i = 0; i < variance.length; i++) {
            assertTrue(variance[i] >= original[i]);
        }
    }

    @Test
    public void testMedianFloor() {
        double[] variance = {1, 1, 1, 0.01, 1, 1, 1};
        new ErrorAdjustment(3, 5, 0.6, 1e10).maxMedianAdjust(variance);
        assertArrayEquals(new double[]{1, 1, 1, 0.6, 1, 1, 1}, variance, 1e-12);
    }
}
