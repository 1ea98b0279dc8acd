package org.lsst.fits.redshift.correlate;

import org.lsst.fits.redshift.InvalidInputException;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import org.junit.Test;

public class CommonsMathFourierTransformTest {

    private final FourierTransform fourier = new CommonsMathFourierTransform();

    @Test
    public void testImpulse() {
        double[] impulse = new double[8];
        impulse[0] = 1;
        TransformedSpectrum transform = fourier.forward(impulse);
        for (int i = 0; i < transform.length(); i++) {
            assertEquals(1, transform.get(i).getReal(), 1e-12);
            assertEquals(0, transform.get(i).getImaginary(), 1e-12);
        }
        assertArrayEquals(impulse, fourier.inverse(transform), 1e-12);
    }

    @Test
    public void testConjugateProductIsAutocorrelation() {
        double[] data = {1, 2, 0, 0, 0, 0, 0, 0};
        TransformedSpectrum t = fourier.forward(data);
        double[] auto = fourier.inverse(t.multiply(t.conjugate()));
        assertEquals(5, auto[0], 1e-12);
        assertEquals(2, auto[1], 1e-12);
        assertEquals(2, auto[7], 1e-12);
        assertEquals(0, auto[4], 1e-12);
    }

    @Test(expected = InvalidInputException.class)
    public void testNotPowerOfTwo() {
        fourier.forward(new double[12]);
    }
}
