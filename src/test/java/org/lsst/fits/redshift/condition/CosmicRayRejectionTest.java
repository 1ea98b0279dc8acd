package org.lsst.fits.redshift.condition;

import java.util.Arrays;
import static org.junit.Assert.assertEquals;
import org.junit.Test;

public class CosmicRayRejectionTest {

    @Test
    public void testSpikeReplaced() {
        double[] intensity = new double[100];
        Arrays.fill(intensity, 1);
        intensity[50] = 1000;
        double[] variance = new double[100];
        Arrays.fill(variance, 1);
        CosmicRayRejection rejection = new CosmicRayRejection(2, 5, 2, 1e10);
        assertEquals(1, rejection.removeCosmicRays(intensity, variance));
        for (double v : intensity) {
            assertEquals(1, v, 1e-12);
        }
        assertEquals(1e10, variance[50], 0);
        assertEquals(1, variance[49], 0);
    }

    @Test
    public void testFlatSpectrumUntouched() {
        double[] intensity = new double[10];
        Arrays.fill(intensity, 2);
        double[] variance = new double[10];
        assertEquals(0, new CosmicRayRejection(2, 5, 2, 1e10).removeCosmicRays(intensity, variance));
        assertEquals(2, intensity[5], 0);
    }

    @Test
    public void testBroadFeatureKept() {
        // A wide bump has small neighbour differences and is not a cosmic ray
        double[] intensity = new double[100];
        for (int i = 0; i < intensity.length; i++) {
            intensity[i] = 100 * Math.exp(-(i - 50) * (i - 50) / 200.0);
        }
        double[] copy = intensity.clone();
        new CosmicRayRejection(2, 1, 2, 1e10).removeCosmicRays(intensity, new double[100]);
        assertEquals(copy[50], intensity[50], 0);
    }
}
