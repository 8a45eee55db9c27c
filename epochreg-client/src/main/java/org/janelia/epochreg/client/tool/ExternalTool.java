package org.janelia.epochreg.client.tool;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.time.StopWatch;
import org.janelia.epochreg.error.CollaboratorFailureException;
import org.janelia.epochreg.json.JsonUtils;
import org.janelia.epochreg.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.ProcessBuilder.Redirect.INHERIT;

/**
 * Java wrapper for running one external image processing program.
 *
 * <pre>
 *     # Example command line invocation (run inside the unit's working directory):
 *     /opt/hst/bin/run_combine.sh combine.request.json combine.response.json
 * </pre>
 *
 * The request file holds the operation's arguments as JSON.
 * The program may write a JSON {@link ExternalToolResponse} to the response file.
 *
 * @author Eric Trautman
 */
public class ExternalTool {

    private final String operationName;
    private final List<String> command;
    private final Long timeoutSeconds;

    public ExternalTool(final String operationName,
                        final List<String> command,
                        final Long timeoutSeconds) {
        this.operationName = operationName;
        this.command = new ArrayList<>(command);
        this.timeoutSeconds = timeoutSeconds;
    }

    public String getOperationName() {
        return operationName;
    }

    public List<String> getCommand() {
        return command;
    }

    /**
     * Runs the program inside the specified working directory and waits for it to finish.
     *
     * @param  workingDirectory  directory the program runs in.
     * @param  request           operation arguments.
     *
     * @return the program's response (an OK response with no values if it wrote none).
     *
     * @throws CollaboratorFailureException
     *   if the program cannot be started, times out, returns a non-zero code, or reports a failure.
     */
    public ExternalToolResponse run(final File workingDirectory,
                                    final Map<String, Object> request)
            throws CollaboratorFailureException {

        final StopWatch stopWatch = StopWatch.createStarted();

        final File requestFile = new File(workingDirectory, operationName + ".request.json");
        final File responseFile = new File(workingDirectory, operationName + ".response.json");

        final List<String> fullCommand = new ArrayList<>(command);
        fullCommand.add(requestFile.getName());
        fullCommand.add(responseFile.getName());

        final ProcessBuilder processBuilder =
                new ProcessBuilder(fullCommand).
                        directory(workingDirectory).
                        redirectOutput(INHERIT).
                        redirectError(INHERIT);

        final ExternalToolResponse response;
        try {
            FileUtil.deleteIfExists(responseFile);
            JsonUtils.MAPPER.writeValue(requestFile, request);

            LOG.info("run: running {} in {}", processBuilder.command(), workingDirectory);

            final Process process = processBuilder.start();

            final int returnCode;
            if (timeoutSeconds == null) {
                returnCode = process.waitFor();
            } else if (process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                returnCode = process.exitValue();
            } else {
                process.destroyForcibly();
                throw new CollaboratorFailureException(
                        operationName + " did not finish within " + timeoutSeconds + " seconds");
            }

            if (returnCode != 0) {
                throw new CollaboratorFailureException(
                        "code " + returnCode + " returned from " + processBuilder.command());
            }

            response = responseFile.exists() ? ExternalToolResponse.fromJsonFile(responseFile) :
                       new ExternalToolResponse();

            FileUtil.deleteIfExists(requestFile);
            FileUtil.deleteIfExists(responseFile);

        } catch (final IOException e) {
            throw new CollaboratorFailureException("failed to run " + processBuilder.command(), e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorFailureException(operationName + " was interrupted", e);
        }

        if (! ExternalToolResponse.OK.equals(response.getStatus())) {
            throw new CollaboratorFailureException(operationName + " failed with status " +
                                                   response.getStatus() + ": " + response.getMessage());
        }

        LOG.info("run: exit, {} completed in {}", operationName, stopWatch);

        return response;
    }

    @Override
    public String toString() {
        return operationName + " " + command;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ExternalTool.class);
}
