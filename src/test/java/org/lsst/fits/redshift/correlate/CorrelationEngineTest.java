package org.lsst.fits.redshift.correlate;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.lsst.fits.redshift.InvalidInputException;
import org.lsst.fits.redshift.LogGrid;
import org.lsst.fits.redshift.Peak;
import org.lsst.fits.redshift.template.Template;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class CorrelationEngineTest {

    private final FourierTransform fourier = new CommonsMathFourierTransform();

    @Test
    public void testCircShift() {
        double[] data = {1, 2, 3, 4};
        CorrelationEngine.circShift(data, 2);
        assertArrayEquals(new double[]{3, 4, 1, 2}, data, 0);
        CorrelationEngine.circShift(data, -1);
        assertArrayEquals(new double[]{2, 3, 4, 1}, data, 0);
    }

    @Test
    public void testPrune() {
        double[] data = {0, 1, 2, 3, 4, 5};
        assertArrayEquals(new double[]{2, 3, 4}, CorrelationEngine.prune(data, 2, 5), 0);
        assertArrayEquals(new double[]{4, 5}, CorrelationEngine.prune(data, 4, 10), 0);
        assertEquals(0, CorrelationEngine.prune(data, 5, 3).length);
    }

    @Test
    public void testGetPeaks() {
        double[] data = {0, 0, 1, 3, 1, 0, 3, 1, 0, 0};
        assertEquals(Arrays.asList(new Peak(3, 3), new Peak(6, 3)), CorrelationEngine.getPeaks(data, false));
        assertEquals(Arrays.asList(new Peak(3, 3), new Peak(5, 0), new Peak(6, 3)), CorrelationEngine.getPeaks(data, true));
    }

    @Test
    public void testPlateauGivesOnePeak() {
        double[] data = {0, 0, 2, 2, 2, 0, 0};
        List<Peak> peaks = CorrelationEngine.getPeaks(data, false);
        assertEquals(1, peaks.size());
        assertEquals(2, peaks.get(0).getIndex());
    }

    @Test
    public void testSubtractMeanReject() {
        double[] data = {1, 2, 3, 4, 5, 6, 7, 8, 9, 100};
        CorrelationEngine.subtractMeanReject(data, 0.2);
        assertEquals(1 - 5.5, data[0], 1e-12);
        assertEquals(100 - 5.5, data[9], 1e-12);
    }

    @Test
    public void testRmsNormalise() {
        double[] data = {0, 0, 2, 0, 0, -2, 0, 0};
        CorrelationEngine.rmsNormalisePeaks(data);
        assertArrayEquals(new double[]{0, 0, 1, 0, 0, -1, 0, 0}, data, 1e-12);
        double[] flat = new double[8];
        CorrelationEngine.rmsNormalisePeaks(flat);
        assertArrayEquals(new double[8], flat, 0);
    }

    @Test
    public void testMatchFindsShift() {
        int n = 256;
        double[] signal = new double[n];
        Random random = new Random(11);
        for (int i = 40; i < 200; i++) {
            signal[i] = random.nextGaussian();
        }
        double[] shifted = new double[n];
        System.arraycopy(signal, 0, shifted, 5, n - 5);
        Template template = template("t", signal, 0, n);
        CorrelationResult result = new CorrelationEngine(fourier, 0.1).matchTemplate(template, fourier.forward(shifted));
        Peak best = result.getPeaks().stream().max((a, b) -> Double.compare(a.getValue(), b.getValue())).get();
        assertEquals(n / 2 + 5, best.getIndex());
        assertEquals(n, result.getXcor().length);
    }

    @Test(expected = InvalidInputException.class)
    public void testLengthMismatch() {
        Template template = template("t", new double[16], 0, 16);
        new CorrelationEngine(fourier, 0.1).matchTemplate(template, fourier.forward(new double[32]));
    }

    @Test
    public void testMatchAllSkipsFailures() {
        Random random = new Random(5);
        double[] signal = new double[64];
        for (int i = 0; i < signal.length; i++) {
            signal[i] = random.nextGaussian();
        }
        Template good = template("good", signal, 16, 48);
        Template bad = template("bad", new double[32], 0, 32);
        Map<String, CorrelationResult> results = new CorrelationEngine(fourier, 0.1)
                .matchAll(Arrays.asList(good, bad), fourier.forward(signal), Runnable::run);
        assertEquals(1, results.size());
        assertTrue(results.containsKey("good"));
        assertEquals(32, results.get("good").getXcor().length);
    }

    private Template template(String id, double[] intensity, int start, int end) {
        int n = intensity.length;
        double[] logLambda = LogGrid.linearScale(3.0, 3.0 + (n - 1) * 1e-4, n);
        double[] zs = new double[end - start];
        for (int j = 0; j < zs.length; j++) {
            zs[j] = Math.pow(10, (j + start - n / 2) * 1e-4) - 1;
        }
        return new Template(id, id, 0, logLambda, intensity, fourier.forward(intensity).conjugate(), zs, start, end);
    }
}
