package org.janelia.epochreg.external;

/**
 * The external operations a pipeline run depends upon.
 *
 * @author Eric Trautman
 */
public class Collaborators {

    private final Combiner combiner;
    private final HotPixelCleaner hotPixelCleaner;
    private final Registrar registrar;
    private final BackPropagator backPropagator;
    private final PixelArithmetic pixelArithmetic;
    private final TemplateScaler templateScaler;

    public Collaborators(final Combiner combiner,
                         final HotPixelCleaner hotPixelCleaner,
                         final Registrar registrar,
                         final BackPropagator backPropagator,
                         final PixelArithmetic pixelArithmetic,
                         final TemplateScaler templateScaler) {
        this.combiner = combiner;
        this.hotPixelCleaner = hotPixelCleaner;
        this.registrar = registrar;
        this.backPropagator = backPropagator;
        this.pixelArithmetic = pixelArithmetic;
        this.templateScaler = templateScaler;
    }

    public Combiner getCombiner() {
        return combiner;
    }

    public HotPixelCleaner getHotPixelCleaner() {
        return hotPixelCleaner;
    }

    public Registrar getRegistrar() {
        return registrar;
    }

    public BackPropagator getBackPropagator() {
        return backPropagator;
    }

    public PixelArithmetic getPixelArithmetic() {
        return pixelArithmetic;
    }

    public TemplateScaler getTemplateScaler() {
        return templateScaler;
    }
}
