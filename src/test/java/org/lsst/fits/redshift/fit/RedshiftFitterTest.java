package org.lsst.fits.redshift.fit;

import org.lsst.fits.redshift.LogGrid;
import org.lsst.fits.redshift.NoMatchException;
import org.lsst.fits.redshift.template.Template;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;
import org.junit.Test;

public class RedshiftFitterTest {

    private static final double GAP = 0.001;

    @Test
    public void testBinarySearch() {
        double[] zs = {1, 3, 5, 7, 9};
        assertArrayEquals(new int[]{2, 3}, RedshiftFitter.binarySearch(zs, 6));
        assertArrayEquals(new int[]{2, 2}, RedshiftFitter.binarySearch(zs, 5));
        assertArrayEquals(new int[]{0, 0}, RedshiftFitter.binarySearch(zs, 0));
        assertArrayEquals(new int[]{4, 4}, RedshiftFitter.binarySearch(zs, 10));
        assertArrayEquals(new int[]{0, 0}, RedshiftFitter.binarySearch(zs, 1));
        assertArrayEquals(new int[]{4, 4}, RedshiftFitter.binarySearch(zs, 9));
        assertArrayEquals(new int[]{0, 1}, RedshiftFitter.binarySearch(zs, 2));
    }

    @Test
    public void testFitAroundIndex() {
        double[] data = {0, 1, 3, 2, 0};
        assertEquals(1.0 / 6, RedshiftFitter.fitAroundIndex(data, 2), 1e-12);
        assertEquals(0, RedshiftFitter.fitAroundIndex(data, 0), 0);
        assertEquals(0, RedshiftFitter.fitAroundIndex(data, 4), 0);
        assertEquals(0, RedshiftFitter.fitAroundIndex(new double[]{1, 1, 1}, 1), 0);
        assertEquals(0, RedshiftFitter.fitAroundIndex(new double[]{1, 2, 1}, 1), 1e-12);
    }

    @Test
    public void testFitRedshift() throws NoMatchException {
        Template template = template(8, 4, 8, 0.5);
        double[] xcor = {0, 1, 3, 2};
        RedshiftFitter fitter = new RedshiftFitter(7);
        double z = fitter.fitRedshift(template, xcor, template.getZs()[2]);
        assertEquals(Math.pow(10, (2 + 1.0 / 6) * GAP) * 1.5 - 1, z, 1e-12);
        // The window finds the maximum even from a neighbouring candidate
        assertEquals(z, fitter.fitRedshift(template, xcor, template.getZs()[0]), 1e-12);
    }

    @Test
    public void testRedshiftForIndex() {
        Template template = template(8, 2, 6, 0.1);
        // Index 2 of the pruned curve is the zero lag index N/2
        assertEquals(0.1, RedshiftFitter.redshiftForIndex(template, 2), 1e-12);
        assertEquals(template.getZs()[3], RedshiftFitter.redshiftForIndex(template, 3), 1e-12);
    }

    @Test
    public void testNoSamplesInWindow() {
        Template template = template(32, 0, 20, 0);
        double[] xcor = {1, 2};
        try {
            new RedshiftFitter(3).fitRedshift(template, xcor, template.getZs()[15]);
            fail("Window beyond the curve should not match");
        } catch (NoMatchException x) {
            assertEquals("t", x.getTemplateId());
        }
    }

    private static Template template(int n, int start, int end, double redshift) {
        double[] logLambda = LogGrid.linearScale(3.0, 3.0 + (n - 1) * GAP, n);
        double[] zs = new double[end - start];
        for (int j = 0; j < zs.length; j++) {
            zs[j] = Math.pow(10, (j + start - n / 2) * GAP) * (1 + redshift) - 1;
        }
        return new Template("t", "test", redshift, logLambda, new double[n], null, zs, start, end);
    }
}
