package org.lsst.fits.redshift.io;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.lsst.fits.redshift.Spectrum;

/**
 * Reads a one dimensional spectrum from a FITS file.
 * <p>
 * The intensity is the first HDU holding data. The variance comes from the HDU
 * with <code>EXTNAME = VARIANCE</code>, otherwise from the next HDU holding
 * data, otherwise it is set to one everywhere. Wavelengths are computed from
 * the linear WCS keywords of the intensity HDU,
 * <code>CRVAL1 + (i + 1 - CRPIX1) * CDELT1</code>, with <code>CD1_1</code>
 * standing in for a missing <code>CDELT1</code>. When <code>DC-FLAG</code> is
 * 1 the axis is log10 wavelength and is converted back to linear.
 */
public class SpectrumFitsReader {

    private static final Logger LOG = Logger.getLogger(SpectrumFitsReader.class.getName());
    private static final String VARIANCE_EXTNAME = "VARIANCE";

    public Spectrum read(File file) throws IOException, FitsException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null) {
                throw new FitsException("No HDUs in " + file);
            }
            int intensityIndex = -1;
            int varianceIndex = -1;
            for (int i = 0; i < hdus.length; i++) {
                if (!hasData(hdus[i])) {
                    continue;
                }
                String extname = hdus[i].getHeader().getStringValue("EXTNAME");
                if (extname != null && VARIANCE_EXTNAME.equalsIgnoreCase(extname.trim())) {
                    varianceIndex = i;
                } else if (intensityIndex < 0) {
                    intensityIndex = i;
                } else if (varianceIndex < 0) {
                    varianceIndex = i;
                }
            }
            if (intensityIndex < 0) {
                throw new FitsException("No spectrum data in " + file);
            }
            BasicHDU<?> intensityHDU = hdus[intensityIndex];
            double[] intensity = readData(intensityHDU);
            double[] variance;
            if (varianceIndex >= 0) {
                variance = readData(hdus[varianceIndex]);
                if (variance.length != intensity.length) {
                    throw new FitsException(String.format("Variance has %d values but intensity has %d in %s", variance.length, intensity.length, file));
                }
            } else {
                LOG.log(Level.FINE, "No variance in {0}, using unit variance", file);
                variance = new double[intensity.length];
                Arrays.fill(variance, 1.0);
            }
            double[] wavelength = wavelengths(intensityHDU.getHeader(), intensity.length);
            return new Spectrum(wavelength, intensity, variance, false);
        }
    }

    static double[] wavelengths(Header header, int n) throws FitsException {
        if (!header.containsKey("CRVAL1")) {
            throw new FitsException("Missing CRVAL1 keyword");
        }
        double crval = header.getDoubleValue("CRVAL1");
        double crpix = header.getDoubleValue("CRPIX1", 1.0);
        double cdelt;
        if (header.containsKey("CDELT1")) {
            cdelt = header.getDoubleValue("CDELT1");
        } else if (header.containsKey("CD1_1")) {
            cdelt = header.getDoubleValue("CD1_1");
        } else {
            throw new FitsException("Missing CDELT1 or CD1_1 keyword");
        }
        boolean log = header.getIntValue("DC-FLAG", 0) == 1;
        double[] wavelength = new double[n];
        for (int i = 0; i < n; i++) {
            double w = crval + (i + 1 - crpix) * cdelt;
            wavelength[i] = log ? Math.pow(10, w) : w;
        }
        return wavelength;
    }

    private static boolean hasData(BasicHDU<?> hdu) {
        return hdu.getHeader().getIntValue("NAXIS", 0) > 0 && hdu.getKernel() != null;
    }

    private static double[] readData(BasicHDU<?> hdu) throws FitsException {
        Header header = hdu.getHeader();
        double bscale = header.getDoubleValue("BSCALE", 1.0);
        double bzero = header.getDoubleValue("BZERO", 0.0);
        double[] data = toDoubles(hdu.getKernel());
        if (bscale != 1.0 || bzero != 0.0) {
            for (int i = 0; i < data.length; i++) {
                data[i] = data[i] * bscale + bzero;
            }
        }
        return data;
    }

    /**
     * Convert a primitive array kernel to doubles. For a multi-dimensional
     * image the first row is used.
     */
    static double[] toDoubles(Object kernel) throws FitsException {
        if (kernel instanceof double[]) {
            return ((double[]) kernel).clone();
        } else if (kernel instanceof float[]) {
            float[] in = (float[]) kernel;
            double[] out = new double[in.length];
            for (int i = 0; i < in.length; i++) {
                out[i] = in[i];
            }
            return out;
        } else if (kernel instanceof int[]) {
            return Arrays.stream((int[]) kernel).asDoubleStream().toArray();
        } else if (kernel instanceof long[]) {
            return Arrays.stream((long[]) kernel).asDoubleStream().toArray();
        } else if (kernel instanceof short[]) {
            short[] in = (short[]) kernel;
            double[] out = new double[in.length];
            for (int i = 0; i < in.length; i++) {
                out[i] = in[i];
            }
            return out;
        } else if (kernel instanceof byte[]) {
            byte[] in = (byte[]) kernel;
            double[] out = new double[in.length];
            for (int i = 0; i < in.length; i++) {
                out[i] = in[i] & 0xff;
            }
            return out;
        } else if (kernel instanceof Object[] && ((Object[]) kernel).length > 0) {
            return toDoubles(((Object[]) kernel)[0]);
        }
        throw new FitsException("Unsupported FITS data type: " + (kernel == null ? null : kernel.getClass().getSimpleName()));
    }
}
