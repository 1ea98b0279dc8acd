package org.lsst.fits.redshift.lines;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

public class SpectralLineCatalogTest {

    @Test
    public void testStandard() {
        SpectralLineCatalog catalog = SpectralLineCatalog.standard();
        assertTrue(catalog.size() > 20);
        assertEquals(catalog.size(), catalog.getLogWavelengths().length);
        SpectralLine ha = catalog.getAll().stream().filter(l -> "ha".equals(l.getId())).findFirst().get();
        assertEquals(6564.61, ha.getWavelength(), 1e-9);
        assertEquals(Math.log10(6564.61), ha.getLogWavelength(), 1e-12);
        assertEquals(SpectralLine.Type.EMISSION, ha.getType());
    }

    @Test
    public void testRead() throws IOException {
        String text = "# id label wavelength type\n\nCaK CaK 3934.78 ABSORPTION\n  Hb Hb 4862.69 EMISSION\n";
        SpectralLineCatalog catalog = SpectralLineCatalog.read(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), "inline");
        assertEquals(2, catalog.size());
        assertEquals(SpectralLine.Type.ABSORPTION, catalog.getAll().get(0).getType());
        assertEquals("Hb", catalog.getAll().get(1).getId());
    }

    @Test(expected = IOException.class)
    public void testBadRow() throws IOException {
        String text = "Hb Hb not-a-number EMISSION\n";
        SpectralLineCatalog.read(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)), "inline");
    }

    @Test
    public void testMissing() {
        try {
            SpectralLineCatalog.load("no-such-lines.txt");
            fail("Missing resource should fail");
        } catch (RuntimeException x) {
            assertEquals("Missing spectral line file: no-such-lines.txt", x.getMessage());
        }
    }
}
