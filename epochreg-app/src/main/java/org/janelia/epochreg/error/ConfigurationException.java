package org.janelia.epochreg.error;

/**
 * This exception is thrown when run parameters are missing or incompatible with each other.
 * It is always raised before any stage runs.
 *
 * @author Eric Trautman
 */
public class ConfigurationException
        extends PipelineException {

    public ConfigurationException(final String message) {
        super(message);
    }
}
