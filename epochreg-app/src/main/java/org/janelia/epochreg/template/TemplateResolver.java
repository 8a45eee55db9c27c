package org.janelia.epochreg.template;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.epochreg.error.MissingInputException;
import org.janelia.epochreg.external.TemplateScaler;
import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.Camera;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates (or synthesizes) the template image subtracted from each epoch.
 *
 * Without template filters, the template is the registered combination of the template epoch.
 * With template filters, a scaled template is built once from the template epoch combinations
 * of those filters and reused for as long as it exists.
 *
 * @author Eric Trautman
 */
public class TemplateResolver {

    private final ArtifactNamer namer;
    private final TemplateScaler templateScaler;
    private final int templateEpoch;
    private final List<String> templateFilters;
    private final boolean clobber;

    public TemplateResolver(final ArtifactNamer namer,
                            final TemplateScaler templateScaler,
                            final int templateEpoch,
                            final List<String> templateFilters,
                            final boolean clobber) {
        this.namer = namer;
        this.templateScaler = templateScaler;
        this.templateEpoch = templateEpoch;
        this.templateFilters = templateFilters == null ? Collections.emptyList() : new ArrayList<>(templateFilters);
        this.clobber = clobber;
    }

    public int getTemplateEpoch() {
        return templateEpoch;
    }

    public boolean isScaled() {
        return ! templateFilters.isEmpty();
    }

    /**
     * @param  filter     filter of the images to be differenced.
     * @param  drzSuffix  product suffix of the images to be differenced.
     * @param  camera     camera of the images to be differenced (used to scale synthetic templates).
     *
     * @return the template science image.
     *
     * @throws MissingInputException
     *   if the template (or the images needed to synthesize it) do not exist.
     */
    public File resolve(final String filter,
                        final String drzSuffix,
                        final Camera camera)
            throws MissingInputException {

        final File templateScience;

        if (isScaled()) {

            templateScience = namer.getScaledTemplateProduct(filter, templateEpoch, drzSuffix, ArtifactKind.SCIENCE);

            if (! templateScience.exists()) {
                final List<File> sourceList = new ArrayList<>();
                final List<File> missingList = new ArrayList<>();
                for (final String templateFilter : templateFilters) {
                    final File source = namer.getRegisteredProduct(templateFilter, templateEpoch, drzSuffix,
                                                                   ArtifactKind.SCIENCE);
                    sourceList.add(source);
                    if (! source.exists()) {
                        missingList.add(source);
                    }
                }

                if (! missingList.isEmpty()) {
                    throw new MissingInputException("cannot build scaled template " + templateScience.getName(),
                                                    missingList);
                }

                final String bandpass = (camera == null ? "" : camera.getLabel() + ",") + filter;
                LOG.info("resolve: building scaled {} template {} from {}", bandpass, templateScience, sourceList);

                templateScaler.makeScaledTemplate(bandpass,
                                                  sourceList.get(0),
                                                  sourceList.size() > 1 ? sourceList.get(1) : null,
                                                  templateScience,
                                                  clobber);
            }

        } else {
            templateScience = namer.getRegisteredProduct(filter, templateEpoch, drzSuffix, ArtifactKind.SCIENCE);
        }

        if (! templateScience.exists()) {
            throw new MissingInputException("missing template " + templateScience.getName(),
                                            Collections.singletonList(templateScience));
        }

        return templateScience;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TemplateResolver.class);
}
