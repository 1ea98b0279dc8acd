package org.lsst.fits.redshift.lines;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read only list of spectral lines. The standard catalog is read from the
 * <code>spectral-lines.txt</code> resource next to this class, one line per
 * row:
 * <pre>
 * id  label  wavelength  EMISSION|ABSORPTION
 * </pre>
 * Blank rows and rows starting with # are ignored. Labels must not contain
 * whitespace.
 */
public class SpectralLineCatalog {

    public static final String STANDARD_CATALOG = "spectral-lines.txt";
    private static final Pattern ROW_PATTERN = Pattern.compile("(\\S+)\\s+(\\S+)\\s+([0-9.]+)\\s+(EMISSION|ABSORPTION)");

    private final List<SpectralLine> lines;

    public SpectralLineCatalog(List<SpectralLine> lines) {
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public static SpectralLineCatalog standard() {
        return load(STANDARD_CATALOG);
    }

    /**
     * Load a catalog from a classpath resource relative to this class.
     *
     * @throws RuntimeException if the resource is missing or malformed
     */
    public static SpectralLineCatalog load(String resource) {
        try (InputStream input = SpectralLineCatalog.class.getResourceAsStream(resource)) {
            if (input == null) {
                throw new RuntimeException("Missing spectral line file: " + resource);
            }
            return read(input, resource);
        } catch (IOException x) {
            throw new RuntimeException("Invalid spectral line file " + resource, x);
        }
    }

    static SpectralLineCatalog read(InputStream input, String name) throws IOException {
        List<SpectralLine> result = new ArrayList<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        int lineNumber = 0;
        for (;;) {
            String line = reader.readLine();
            if (line == null) {
                break;
            }
            lineNumber++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            Matcher matcher = ROW_PATTERN.matcher(line);
            if (!matcher.matches()) {
                throw new IOException("Bad row " + lineNumber + " in " + name + ": " + line);
            }
            result.add(new SpectralLine(matcher.group(1), matcher.group(2),
                    Double.parseDouble(matcher.group(3)), SpectralLine.Type.valueOf(matcher.group(4))));
        }
        return new SpectralLineCatalog(result);
    }

    public List<SpectralLine> getAll() {
        return lines;
    }

    public double[] getLogWavelengths() {
        double[] result = new double[lines.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = lines.get(i).getLogWavelength();
        }
        return result;
    }

    public int size() {
        return lines.size();
    }
}
