package org.lsst.fits.redshift.template;

import java.util.Comparator;
import org.lsst.fits.redshift.NoMatchException;
import org.lsst.fits.redshift.Peak;
import org.lsst.fits.redshift.ProcessingConfig;
import org.lsst.fits.redshift.SyntheticSpectra;
import org.lsst.fits.redshift.correlate.CommonsMathFourierTransform;
import org.lsst.fits.redshift.correlate.CorrelationEngine;
import org.lsst.fits.redshift.correlate.CorrelationResult;
import org.lsst.fits.redshift.correlate.FourierTransform;
import org.lsst.fits.redshift.fit.RedshiftFitter;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

public class TemplateBuilderTest {

    private final ProcessingConfig config = ProcessingConfig.defaults();
    private final FourierTransform fourier = new CommonsMathFourierTransform();

    @Test
    public void testRedshiftRange() {
        Template template = new TemplateBuilder(config, fourier).build(SyntheticSpectra.reference("ref", 0.1, 0, 1.0));
        int n = config.getArraySize();
        double gap = config.getLogGrid().getGap();
        assertEquals(n, template.getLength());
        assertEquals(n, template.getTransform().length());
        assertEquals(n / 2 + (int) Math.ceil(Math.log10(1 / 1.1) / gap), template.getStartZIndex());
        assertEquals(n / 2 + (int) Math.floor(Math.log10(2 / 1.1) / gap) + 1, template.getEndZIndex());
        double[] zs = template.getZs();
        assertEquals(template.getEndZIndex() - template.getStartZIndex(), zs.length);
        assertEquals(0, zs[0], 2 * gap * Math.log(10) * 1.1);
        assertEquals(1.0, zs[zs.length - 1], 2 * gap * Math.log(10) * 2);
        assertEquals(0.1, zs[n / 2 - template.getStartZIndex()], 1e-12);
        for (int j = 1; j < zs.length; j++) {
            assertEquals(zs[j], RedshiftFitter.redshiftForIndex(template, j), 1e-12);
        }
    }

    @Test
    public void testSelfMatch() throws NoMatchException {
        Template template = new TemplateBuilder(config, fourier).build(SyntheticSpectra.reference("ref", 0.1, 0, 1.0));
        CorrelationResult result = new CorrelationEngine(fourier, config)
                .matchTemplate(template, fourier.forward(template.getIntensity()));
        Peak best = result.getPeaks().stream().max(Comparator.comparingDouble(Peak::getValue)).get();
        assertEquals(config.getArraySize() / 2 - template.getStartZIndex(), best.getIndex());
        double z = new RedshiftFitter(config).fitRedshift(template, result.getXcor(), result.getZs()[best.getIndex()]);
        assertEquals(0.1, z, 1e-4);
    }

    @Test
    public void testRangeClamped() {
        Template template = new TemplateBuilder(config, fourier).build(SyntheticSpectra.reference("wide", 0, 0, 1000));
        assertEquals(config.getArraySize(), template.getEndZIndex());
        assertEquals(template.getEndZIndex() - template.getStartZIndex(), template.getZs().length);
    }

    @Test
    public void testArraysNotShared() {
        Template template = new TemplateBuilder(config, fourier).build(SyntheticSpectra.reference("ref", 0.1, 0, 1.0));
        double z5 = template.getZs()[5];
        double intensity0 = template.getIntensity()[0];
        CorrelationResult result = new CorrelationEngine(fourier, config)
                .matchTemplate(template, fourier.forward(template.getIntensity()));
        result.getZs()[5] = 42;
        template.getZs()[5] = 43;
        template.getIntensity()[0] = 44;
        template.getLogLambda()[0] = 45;
        assertEquals(z5, template.getZs()[5], 0);
        assertEquals(intensity0, template.getIntensity()[0], 0);
        assertEquals(config.getStartPower(), template.getLogLambda()[0], 1e-12);
        assertEquals(42, result.getZs()[5], 0);
    }

    @Test
    public void testQuasarGrid() throws NoMatchException {
        ProcessingConfig wide = config.toBuilder().quasarLogGrid(3.25, 4.05).build();
        TemplateBuilder builder = new TemplateBuilder(wide, fourier);
        Template standard = builder.build(SyntheticSpectra.reference("ref", 0.1, 0, 1.0));
        Template quasar = builder.build(SyntheticSpectra.reference("qso", 0.1, 0, 1.0, true));
        assertFalse(standard.isQuasar());
        assertTrue(quasar.isQuasar());
        assertEquals(wide.getStartPower(), standard.getLogLambda()[0], 1e-12);
        assertEquals(3.25, quasar.getLogLambda()[0], 1e-12);
        assertEquals(builder.getGrid(true).getGap(), quasar.getGap(), 1e-12);
        assertEquals(wide.getArraySize() / 2 + (int) Math.floor(Math.log10(2 / 1.1) / builder.getGrid(true).getGap()) + 1, quasar.getEndZIndex());

        CorrelationResult result = new CorrelationEngine(fourier, wide)
                .matchTemplate(quasar, fourier.forward(quasar.getIntensity()));
        Peak best = result.getPeaks().stream().max(Comparator.comparingDouble(Peak::getValue)).get();
        double z = new RedshiftFitter(wide).fitRedshift(quasar, result.getXcor(), result.getZs()[best.getIndex()]);
        assertEquals(0.1, z, 1e-4);
    }
}
