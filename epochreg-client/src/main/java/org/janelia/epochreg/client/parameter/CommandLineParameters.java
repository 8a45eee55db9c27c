package org.janelia.epochreg.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.epochreg.error.ConfigurationException;
import org.janelia.epochreg.json.JsonUtils;

/**
 * Base parameters for epochreg command line clients.
 *
 * Parsing failures and incompatible option combinations are reported as {@link ConfigurationException}s
 * so that clients stop before any exposure is touched.
 *
 * @author Eric Trautman
 */
public abstract class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    /**
     * Parses the specified arguments into this instance and validates the result.
     * Usage information is printed when help is requested.
     *
     * @return true if the client should run, false if only help was requested.
     *
     * @throws ConfigurationException
     *   if the arguments cannot be parsed or are invalid.
     */
    public boolean parse(final String[] args)
            throws ConfigurationException {

        final JCommander jCommander = buildCommander();

        try {
            jCommander.parse(args);
        } catch (final ParameterException pe) {
            throw new ConfigurationException("failed to parse command line arguments, " + pe.getMessage() +
                                             "\n\n" + getUsage(jCommander));
        }

        if (help) {
            jCommander.getConsole().println(getUsage(jCommander));
            return false;
        }

        validate();

        return true;
    }

    /**
     * Checks option combinations that cannot be expressed with annotations.
     *
     * @throws ConfigurationException
     *   if the parsed options are incompatible.
     */
    protected void validate()
            throws ConfigurationException {
    }

    /**
     * @return JSON representation of these parameters.
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private JCommander buildCommander() {
        final Class enclosingClass = getClass().getEnclosingClass();
        final String programName = (enclosingClass == null ? getClass() : enclosingClass).getName();
        final JCommander jCommander = JCommander.newBuilder().addObject(this).build();
        jCommander.setProgramName("java -cp epochreg-client-standalone.jar " + programName);
        return jCommander;
    }

    private static String getUsage(final JCommander jCommander) {
        final StringBuilder usage = new StringBuilder();
        jCommander.getUsageFormatter().usage(usage);
        return usage.toString();
    }

    /**
     * Prints usage for the specified parameters, used to verify that their annotations are consistent.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" });
    }

}
