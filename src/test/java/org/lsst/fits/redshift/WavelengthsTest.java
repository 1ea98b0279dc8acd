package org.lsst.fits.redshift;

import static org.junit.Assert.assertEquals;
import org.junit.Test;

public class WavelengthsTest {

    @Test
    public void testAirToVacuum() {
        // Ha is 6562.80 in air and 6564.61 in vacuum
        assertEquals(6564.61, Wavelengths.convertSingleVacuumFromAir(6562.80), 0.01);
        double[] lambda = {5000, 6562.80};
        Wavelengths.convertVacuumFromAir(lambda);
        assertEquals(6564.61, lambda[1], 0.01);
        assertEquals(Wavelengths.convertSingleVacuumFromAir(5000), lambda[0], 1e-9);
    }

    @Test
    public void testLogAirToVacuum() {
        double[] log = {Math.log10(6562.80)};
        Wavelengths.convertVacuumFromAirWithLogLambda(log);
        assertEquals(Math.log10(Wavelengths.convertSingleVacuumFromAir(6562.80)), log[0], 1e-12);
    }

    @Test
    public void testShift() {
        assertEquals(7500, Wavelengths.shiftWavelength(5000, 0.5), 1e-9);
    }
}
