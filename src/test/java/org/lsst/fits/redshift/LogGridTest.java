package org.lsst.fits.redshift;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import org.junit.Test;

public class LogGridTest {

    @Test
    public void testGrid() {
        LogGrid grid = new LogGrid(3.0, 4.0, 11);
        assertEquals(0.1, grid.getGap(), 1e-12);
        double[] log = grid.getLogWavelengths();
        assertEquals(11, log.length);
        assertEquals(3.0, log[0], 1e-12);
        assertEquals(4.0, log[10], 1e-12);
        assertEquals(1000, grid.getWavelengths()[0], 1e-9);
        assertEquals(10000, grid.getWavelengths()[10], 1e-8);
    }

    @Test
    public void testLinearScale() {
        assertArrayEquals(new double[]{0, 0.25, 0.5, 0.75, 1}, LogGrid.linearScale(0, 1, 5), 1e-12);
    }

    @Test(expected = InvalidInputException.class)
    public void testTooFewPoints() {
        new LogGrid(3.0, 4.0, 1);
    }
}
