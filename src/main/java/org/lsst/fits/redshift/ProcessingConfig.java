package org.lsst.fits.redshift;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable set of tuning parameters for the redshift pipeline. Every
 * threshold, window width and grid bound used by the conditioning, correlation
 * and fitting code comes from here.
 * <p>
 * Instances are created with {@link #defaults()}, {@link #builder()} or from a
 * properties file whose keys are the option names prefixed with
 * <code>redshift.</code>, for example <code>redshift.polyDegree=6</code>.
 */
public class ProcessingConfig {

    private static final Logger LOG = Logger.getLogger(ProcessingConfig.class.getName());
    static final String PREFIX = "redshift.";

    private static final ProcessingConfig DEFAULTS = new Builder().build();

    private final int arraySize;
    private final double startPower;
    private final double endPower;
    private final double quasarStartPower;
    private final double quasarEndPower;
    private final double minValue;
    private final double maxValue;
    private final int badPixelRadius;
    private final int cosmicIterations;
    private final double deviationFactor;
    private final int cosmicPointCheck;
    private final double maxError;
    private final int polyDegree;
    private final int polyFitIterations;
    private final double polyFitRejectDeviation;
    private final int medianWidth;
    private final int smoothWidth;
    private final int broadenWindow;
    private final int errorMedianWindow;
    private final double errorMedianWeight;
    private final double baseWeight;
    private final double gaussianWidth;
    private final int zeroPixelWidth;
    private final int taperWidth;
    private final double clipValue;
    private final int maxClipIterations;
    private final double normalisedArea;
    private final double trimAmount;
    private final int fitWindow;
    private final int peaksPerTemplate;
    private final boolean airWavelengths;

    private ProcessingConfig(Builder b) {
        this.arraySize = b.arraySize;
        this.startPower = b.startPower;
        this.endPower = b.endPower;
        this.quasarStartPower = b.quasarStartPower;
        this.quasarEndPower = b.quasarEndPower;
        this.minValue = b.minValue;
        this.maxValue = b.maxValue;
        this.badPixelRadius = b.badPixelRadius;
        this.cosmicIterations = b.cosmicIterations;
        this.deviationFactor = b.deviationFactor;
        this.cosmicPointCheck = b.cosmicPointCheck;
        this.maxError = b.maxError;
        this.polyDegree = b.polyDegree;
        this.polyFitIterations = b.polyFitIterations;
        this.polyFitRejectDeviation = b.polyFitRejectDeviation;
        this.medianWidth = b.medianWidth;
        this.smoothWidth = b.smoothWidth;
        this.broadenWindow = b.broadenWindow;
        this.errorMedianWindow = b.errorMedianWindow;
        this.errorMedianWeight = b.errorMedianWeight;
        this.baseWeight = b.baseWeight;
        this.gaussianWidth = b.gaussianWidth;
        this.zeroPixelWidth = b.zeroPixelWidth;
        this.taperWidth = b.taperWidth;
        this.clipValue = b.clipValue;
        this.maxClipIterations = b.maxClipIterations;
        this.normalisedArea = b.normalisedArea;
        this.trimAmount = b.trimAmount;
        this.fitWindow = b.fitWindow;
        this.peaksPerTemplate = b.peaksPerTemplate;
        this.airWavelengths = b.airWavelengths;
    }

    public static ProcessingConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder pre-populated with the values of this configuration.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Read a configuration from a properties stream. The stream is closed.
     *
     * @param input The properties source
     * @return The configuration, with defaults for any missing keys
     * @throws IOException If the stream cannot be read
     */
    public static ProcessingConfig load(InputStream input) throws IOException {
        Properties props = new Properties();
        try (InputStream in = input) {
            props.load(in);
        }
        return fromProperties(props);
    }

    /**
     * Build a configuration from properties, keys prefixed with
     * <code>redshift.</code>. Keys that are not recognised are ignored.
     *
     * @throws InvalidInputException if a value cannot be parsed
     */
    public static ProcessingConfig fromProperties(Properties props) {
        Builder b = new Builder();
        b.arraySize = intValue(props, "arraySize", b.arraySize);
        b.startPower = doubleValue(props, "startPower", b.startPower);
        b.endPower = doubleValue(props, "endPower", b.endPower);
        b.quasarStartPower = doubleValue(props, "quasarStartPower", b.quasarStartPower);
        b.quasarEndPower = doubleValue(props, "quasarEndPower", b.quasarEndPower);
        b.minValue = doubleValue(props, "minValue", b.minValue);
        b.maxValue = doubleValue(props, "maxValue", b.maxValue);
        b.badPixelRadius = intValue(props, "badPixelRadius", b.badPixelRadius);
        b.cosmicIterations = intValue(props, "cosmicIterations", b.cosmicIterations);
        b.deviationFactor = doubleValue(props, "deviationFactor", b.deviationFactor);
        b.cosmicPointCheck = intValue(props, "cosmicPointCheck", b.cosmicPointCheck);
        b.maxError = doubleValue(props, "maxError", b.maxError);
        b.polyDegree = intValue(props, "polyDegree", b.polyDegree);
        b.polyFitIterations = intValue(props, "polyFitIterations", b.polyFitIterations);
        b.polyFitRejectDeviation = doubleValue(props, "polyFitRejectDeviation", b.polyFitRejectDeviation);
        b.medianWidth = intValue(props, "medianWidth", b.medianWidth);
        b.smoothWidth = intValue(props, "smoothWidth", b.smoothWidth);
        b.broadenWindow = intValue(props, "broadenWindow", b.broadenWindow);
        b.errorMedianWindow = intValue(props, "errorMedianWindow", b.errorMedianWindow);
        b.errorMedianWeight = doubleValue(props, "errorMedianWeight", b.errorMedianWeight);
        b.baseWeight = doubleValue(props, "baseWeight", b.baseWeight);
        b.gaussianWidth = doubleValue(props, "gaussianWidth", b.gaussianWidth);
        b.zeroPixelWidth = intValue(props, "zeroPixelWidth", b.zeroPixelWidth);
        b.taperWidth = intValue(props, "taperWidth", b.taperWidth);
        b.clipValue = doubleValue(props, "clipValue", b.clipValue);
        b.maxClipIterations = intValue(props, "maxClipIterations", b.maxClipIterations);
        b.normalisedArea = doubleValue(props, "normalisedArea", b.normalisedArea);
        b.trimAmount = doubleValue(props, "trimAmount", b.trimAmount);
        b.fitWindow = intValue(props, "fitWindow", b.fitWindow);
        b.peaksPerTemplate = intValue(props, "peaksPerTemplate", b.peaksPerTemplate);
        b.airWavelengths = Boolean.parseBoolean(props.getProperty(PREFIX + "airWavelengths", String.valueOf(b.airWavelengths)).trim());
        return b.build();
    }

    private static int intValue(Properties props, String name, int defaultValue) {
        String value = props.getProperty(PREFIX + name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException x) {
            throw new InvalidInputException("Invalid integer for " + PREFIX + name + ": " + value, x);
        }
    }

    private static double doubleValue(Properties props, String name, double defaultValue) {
        String value = props.getProperty(PREFIX + name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException x) {
            throw new InvalidInputException("Invalid number for " + PREFIX + name + ": " + value, x);
        }
    }

    /**
     * The log grid spectra and templates are resampled onto.
     */
    public LogGrid getLogGrid() {
        return new LogGrid(startPower, endPower, arraySize);
    }

    /**
     * The wider log grid used when matching against quasar templates.
     */
    public LogGrid getQuasarLogGrid() {
        return new LogGrid(quasarStartPower, quasarEndPower, arraySize);
    }

    public int getArraySize() {
        return arraySize;
    }

    public double getStartPower() {
        return startPower;
    }

    public double getEndPower() {
        return endPower;
    }

    public double getQuasarStartPower() {
        return quasarStartPower;
    }

    public double getQuasarEndPower() {
        return quasarEndPower;
    }

    public double getMinValue() {
        return minValue;
    }

    public double getMaxValue() {
        return maxValue;
    }

    public int getBadPixelRadius() {
        return badPixelRadius;
    }

    public int getCosmicIterations() {
        return cosmicIterations;
    }

    public double getDeviationFactor() {
        return deviationFactor;
    }

    public int getCosmicPointCheck() {
        return cosmicPointCheck;
    }

    public double getMaxError() {
        return maxError;
    }

    public int getPolyDegree() {
        return polyDegree;
    }

    public int getPolyFitIterations() {
        return polyFitIterations;
    }

    public double getPolyFitRejectDeviation() {
        return polyFitRejectDeviation;
    }

    public int getMedianWidth() {
        return medianWidth;
    }

    public int getSmoothWidth() {
        return smoothWidth;
    }

    public int getBroadenWindow() {
        return broadenWindow;
    }

    public int getErrorMedianWindow() {
        return errorMedianWindow;
    }

    public double getErrorMedianWeight() {
        return errorMedianWeight;
    }

    public double getBaseWeight() {
        return baseWeight;
    }

    public double getGaussianWidth() {
        return gaussianWidth;
    }

    public int getZeroPixelWidth() {
        return zeroPixelWidth;
    }

    public int getTaperWidth() {
        return taperWidth;
    }

    public double getClipValue() {
        return clipValue;
    }

    public int getMaxClipIterations() {
        return maxClipIterations;
    }

    public double getNormalisedArea() {
        return normalisedArea;
    }

    public double getTrimAmount() {
        return trimAmount;
    }

    public int getFitWindow() {
        return fitWindow;
    }

    public int getPeaksPerTemplate() {
        return peaksPerTemplate;
    }

    public boolean isAirWavelengths() {
        return airWavelengths;
    }

    @Override
    public String toString() {
        return "ProcessingConfig{" + "arraySize=" + arraySize + ", startPower=" + startPower + ", endPower=" + endPower
                + ", polyDegree=" + polyDegree + ", cosmicIterations=" + cosmicIterations + ", deviationFactor=" + deviationFactor
                + ", medianWidth=" + medianWidth + ", smoothWidth=" + smoothWidth + ", clipValue=" + clipValue
                + ", trimAmount=" + trimAmount + ", fitWindow=" + fitWindow + '}';
    }

    public static class Builder {

        private int arraySize = 4096;
        private double startPower = 3.3;
        private double endPower = 4.0;
        private double quasarStartPower = 3.0;
        private double quasarEndPower = 4.0;
        private double minValue = -1e4;
        private double maxValue = 1e6;
        private int badPixelRadius = 3;
        private int cosmicIterations = 2;
        private double deviationFactor = 30;
        private int cosmicPointCheck = 2;
        private double maxError = 1e10;
        private int polyDegree = 6;
        private int polyFitIterations = 15;
        private double polyFitRejectDeviation = 3.5;
        private int medianWidth = 51;
        private int smoothWidth = 7;
        private int broadenWindow = 3;
        private int errorMedianWindow = 101;
        private double errorMedianWeight = 0.6;
        private double baseWeight = 0.7;
        private double gaussianWidth = 2e-5;
        private int zeroPixelWidth = 3;
        private int taperWidth = 40;
        private double clipValue = 30;
        private int maxClipIterations = 1000;
        private double normalisedArea = 100000;
        private double trimAmount = 0.1;
        private int fitWindow = 7;
        private int peaksPerTemplate = 5;
        private boolean airWavelengths = false;

        Builder() {
        }

        Builder(ProcessingConfig c) {
            arraySize = c.arraySize;
            startPower = c.startPower;
            endPower = c.endPower;
            quasarStartPower = c.quasarStartPower;
            quasarEndPower = c.quasarEndPower;
            minValue = c.minValue;
            maxValue = c.maxValue;
            badPixelRadius = c.badPixelRadius;
            cosmicIterations = c.cosmicIterations;
            deviationFactor = c.deviationFactor;
            cosmicPointCheck = c.cosmicPointCheck;
            maxError = c.maxError;
            polyDegree = c.polyDegree;
            polyFitIterations = c.polyFitIterations;
            polyFitRejectDeviation = c.polyFitRejectDeviation;
            medianWidth = c.medianWidth;
            smoothWidth = c.smoothWidth;
            broadenWindow = c.broadenWindow;
            errorMedianWindow = c.errorMedianWindow;
            errorMedianWeight = c.errorMedianWeight;
            baseWeight = c.baseWeight;
            gaussianWidth = c.gaussianWidth;
            zeroPixelWidth = c.zeroPixelWidth;
            taperWidth = c.taperWidth;
            clipValue = c.clipValue;
            maxClipIterations = c.maxClipIterations;
            normalisedArea = c.normalisedArea;
            trimAmount = c.trimAmount;
            fitWindow = c.fitWindow;
            peaksPerTemplate = c.peaksPerTemplate;
            airWavelengths = c.airWavelengths;
        }

        public Builder arraySize(int arraySize) {
            this.arraySize = arraySize;
            return this;
        }

        public Builder logGrid(double startPower, double endPower) {
            this.startPower = startPower;
            this.endPower = endPower;
            return this;
        }

        public Builder quasarLogGrid(double startPower, double endPower) {
            this.quasarStartPower = startPower;
            this.quasarEndPower = endPower;
            return this;
        }

        public Builder validRange(double minValue, double maxValue) {
            this.minValue = minValue;
            this.maxValue = maxValue;
            return this;
        }

        public Builder badPixelRadius(int badPixelRadius) {
            this.badPixelRadius = badPixelRadius;
            return this;
        }

        public Builder cosmicIterations(int cosmicIterations) {
            this.cosmicIterations = cosmicIterations;
            return this;
        }

        public Builder deviationFactor(double deviationFactor) {
            this.deviationFactor = deviationFactor;
            return this;
        }

        public Builder cosmicPointCheck(int cosmicPointCheck) {
            this.cosmicPointCheck = cosmicPointCheck;
            return this;
        }

        public Builder maxError(double maxError) {
            this.maxError = maxError;
            return this;
        }

        public Builder polyDegree(int polyDegree) {
            this.polyDegree = polyDegree;
            return this;
        }

        public Builder polyFitIterations(int polyFitIterations) {
            this.polyFitIterations = polyFitIterations;
            return this;
        }

        public Builder polyFitRejectDeviation(double polyFitRejectDeviation) {
            this.polyFitRejectDeviation = polyFitRejectDeviation;
            return this;
        }

        public Builder medianWidth(int medianWidth) {
            this.medianWidth = medianWidth;
            return this;
        }

        public Builder smoothWidth(int smoothWidth) {
            this.smoothWidth = smoothWidth;
            return this;
        }

        public Builder broadenWindow(int broadenWindow) {
            this.broadenWindow = broadenWindow;
            return this;
        }

        public Builder errorMedian(int errorMedianWindow, double errorMedianWeight) {
            this.errorMedianWindow = errorMedianWindow;
            this.errorMedianWeight = errorMedianWeight;
            return this;
        }

        public Builder lineWeighting(double baseWeight, double gaussianWidth) {
            this.baseWeight = baseWeight;
            this.gaussianWidth = gaussianWidth;
            return this;
        }

        public Builder taper(int zeroPixelWidth, int taperWidth) {
            this.zeroPixelWidth = zeroPixelWidth;
            this.taperWidth = taperWidth;
            return this;
        }

        public Builder clipValue(double clipValue) {
            this.clipValue = clipValue;
            return this;
        }

        public Builder maxClipIterations(int maxClipIterations) {
            this.maxClipIterations = maxClipIterations;
            return this;
        }

        public Builder normalisedArea(double normalisedArea) {
            this.normalisedArea = normalisedArea;
            return this;
        }

        public Builder trimAmount(double trimAmount) {
            this.trimAmount = trimAmount;
            return this;
        }

        public Builder fitWindow(int fitWindow) {
            this.fitWindow = fitWindow;
            return this;
        }

        public Builder peaksPerTemplate(int peaksPerTemplate) {
            this.peaksPerTemplate = peaksPerTemplate;
            return this;
        }

        public Builder airWavelengths(boolean airWavelengths) {
            this.airWavelengths = airWavelengths;
            return this;
        }

        /**
         * @throws InvalidInputException if a window or count is not usable
         */
        public ProcessingConfig build() {
            if (arraySize < 2) {
                throw new InvalidInputException("arraySize must be at least 2: " + arraySize);
            }
            if (fitWindow < 1) {
                throw new InvalidInputException("fitWindow must be positive: " + fitWindow);
            }
            if (medianWidth < 1 || smoothWidth < 1 || broadenWindow < 1 || errorMedianWindow < 1) {
                throw new InvalidInputException("Smoothing windows must be positive");
            }
            if (trimAmount < 0 || trimAmount >= 1) {
                throw new InvalidInputException("trimAmount must be in [0,1): " + trimAmount);
            }
            if (polyDegree < 0) {
                throw new InvalidInputException("polyDegree must not be negative: " + polyDegree);
            }
            if (medianWidth % 2 == 0 || smoothWidth % 2 == 0) {
                LOG.log(Level.FINE, "Even smoothing window {0}/{1} will be treated as {2}/{3}",
                        new Object[]{medianWidth, smoothWidth, medianWidth - 1, smoothWidth - 1});
            }
            return new ProcessingConfig(this);
        }
    }
}
