package org.janelia.epochreg.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.epochreg.RegistrationPipeline;
import org.janelia.epochreg.catalog.FitsHeaderReader;
import org.janelia.epochreg.catalog.HeaderReader;
import org.janelia.epochreg.client.parameter.CommandLineParameters;
import org.janelia.epochreg.client.tool.ExternalToolCollaborators;
import org.janelia.epochreg.client.tool.ExternalToolConfiguration;
import org.janelia.epochreg.error.ConfigurationException;
import org.janelia.epochreg.external.Collaborators;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.stage.RunReport;
import org.janelia.epochreg.util.LogbackTools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for registering, combining and differencing the exposures of one or more roots.
 *
 * <pre>
 *     # Example: run stages 1 through 6 for the root 'snfoo' in the current directory
 *     java -cp epochreg-client-standalone.jar org.janelia.epochreg.client.EpochRegistrationClient \
 *       --toolsJson tools.json --doAll --filters f160w,f814w snfoo
 * </pre>
 *
 * @author Eric Trautman
 */
public class EpochRegistrationClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                description = "Root name(s) to process, each root's exposures are in [topDirectory]/[root].flt")
        public List<String> rootNames = new ArrayList<>();

        @Parameter(
                names = "--allRoots",
                description = "Process every root with an exposure directory in the top directory",
                arity = 0)
        public boolean allRoots = false;

        @Parameter(
                names = "--topDirectory",
                description = "Directory that contains the root exposure directories")
        public String topDirectory = ".";

        @Parameter(
                names = "--toolsJson",
                description = "JSON file that maps external operations to the commands that perform them",
                required = true)
        public String toolsJson;

        @Parameter(
                names = "--pipelineJson",
                description = "JSON file with pipeline parameters (replaces all pipeline options on the command line)")
        public String pipelineJson;

        @Parameter(
                names = "--verbose",
                description = "Log debug details",
                arity = 0)
        public boolean verbose = false;

        @Parameter(
                names = "--quiet",
                description = "Only log warnings and errors",
                arity = 0)
        public boolean quiet = false;

        @Parameter(
                names = "--logDirectory",
                description = "Also write the run log to a timestamped file in this directory")
        public String logDirectory;

        @ParametersDelegate
        public PipelineParameters pipeline = new PipelineParameters();

        public int getVerbosity() {
            return quiet ? 0 : (verbose ? 2 : 1);
        }

        @Override
        protected void validate()
                throws ConfigurationException {
            if (verbose && quiet) {
                throw new ConfigurationException("--verbose and --quiet cannot both be specified");
            }
            if (rootNames.isEmpty() && (! allRoots)) {
                throw new ConfigurationException("specify at least one root name or use --allRoots");
            }
        }

        /**
         * @return root names to process.
         *
         * @throws ConfigurationException
         *   if no roots were specified or found.
         */
        public List<String> getRootNames()
                throws ConfigurationException {

            final List<String> names = new ArrayList<>(rootNames);

            if (allRoots) {
                final File[] directories = new File(topDirectory).listFiles(
                        (dir, name) -> name.endsWith(EXPOSURE_DIRECTORY_SUFFIX) && new File(dir, name).isDirectory());
                if (directories != null) {
                    Arrays.sort(directories);
                    for (final File directory : directories) {
                        final String name = directory.getName();
                        final String rootName = name.substring(0, name.length() - EXPOSURE_DIRECTORY_SUFFIX.length());
                        if (! names.contains(rootName)) {
                            names.add(rootName);
                        }
                    }
                }
            }

            if (names.isEmpty()) {
                throw new ConfigurationException("specify at least one root name or use --allRoots");
            }

            return names;
        }

        public PipelineParameters getPipelineParameters()
                throws IOException {
            return pipelineJson == null ? pipeline : PipelineParameters.fromJsonFile(pipelineJson);
        }
    }

    private static final String EXPOSURE_DIRECTORY_SUFFIX = ".flt";

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                if (parameters.parse(args)) {

                    LOG.info("runClient: entry, parameters={}", parameters);

                    final EpochRegistrationClient client = new EpochRegistrationClient(parameters);
                    client.run();
                }
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public EpochRegistrationClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public List<RunReport> run()
            throws IOException {

        LogbackTools.setVerbosity(parameters.getVerbosity());
        if (parameters.logDirectory != null) {
            final File logFile = LogbackTools.setRootFileAppenderWithTimestamp(new File(parameters.logDirectory),
                                                                               "epochreg");
            LOG.info("run: logging to {}", logFile);
        }

        final ExternalToolConfiguration toolConfiguration =
                ExternalToolConfiguration.fromJsonFile(new File(parameters.toolsJson));
        final Collaborators collaborators = new ExternalToolCollaborators(toolConfiguration).toCollaborators();
        final HeaderReader headerReader = new FitsHeaderReader();

        final File topDirectory = new File(parameters.topDirectory).getAbsoluteFile();
        final List<RunReport> reports = new ArrayList<>();

        for (final String rootName : parameters.getRootNames()) {
            // validation normalizes values in place, so each root gets a fresh copy
            final PipelineParameters pipelineParameters = parameters.getPipelineParameters();
            final PipelineParameters rootParameters =
                    PipelineParameters.fromJson(new StringReader(pipelineParameters.toJson()));
            final RegistrationPipeline pipeline = new RegistrationPipeline(headerReader, collaborators);
            reports.add(pipeline.run(topDirectory, rootName, rootParameters));
        }

        return reports;
    }

    private static final Logger LOG = LoggerFactory.getLogger(EpochRegistrationClient.class);
}
