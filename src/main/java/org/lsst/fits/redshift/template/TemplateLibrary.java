package org.lsst.fits.redshift.template;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.redshift.InvalidInputException;
import org.lsst.fits.redshift.Timed;

/**
 * The registered reference spectra and the templates built from them. Templates
 * are built on first use and cached; registering a reference again replaces
 * its cached template.
 */
public class TemplateLibrary {

    private static final Logger LOG = Logger.getLogger(TemplateLibrary.class.getName());

    private final Map<String, ReferenceSpectrum> references = new LinkedHashMap<>();
    private final LoadingCache<String, Template> templateCache;

    public TemplateLibrary(TemplateBuilder builder) {
        templateCache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger("org.lsst.fits.redshift.templateCacheSize", 1_000))
                .recordStats()
                .build((String id) -> {
                    ReferenceSpectrum reference = getReference(id);
                    return Timed.execute(() -> builder.build(reference), "Building template %s took %dms", id);
                });
    }

    public void register(ReferenceSpectrum reference) {
        synchronized (references) {
            references.put(reference.getId(), reference);
        }
        templateCache.invalidate(reference.getId());
        LOG.log(Level.FINE, "Registered {0}", reference);
    }

    /**
     * @throws InvalidInputException if no reference has this id
     */
    public Template get(String id) {
        getReference(id);
        return templateCache.get(id);
    }

    /**
     * Every template, in registration order.
     */
    public List<Template> getTemplates() {
        List<String> ids;
        synchronized (references) {
            ids = new ArrayList<>(references.keySet());
        }
        List<Template> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            result.add(templateCache.get(id));
        }
        return result;
    }

    public int size() {
        synchronized (references) {
            return references.size();
        }
    }

    private ReferenceSpectrum getReference(String id) {
        ReferenceSpectrum reference;
        synchronized (references) {
            reference = references.get(id);
        }
        if (reference == null) {
            throw new InvalidInputException("Unknown template: " + id);
        }
        return reference;
    }

    public void report() {
        LOG.log(Level.INFO, "template Cache size {0} stats {1}", new Object[]{templateCache.estimatedSize(), templateCache.stats()});
    }

    long estimatedSize() {
        return templateCache.estimatedSize();
    }
}
