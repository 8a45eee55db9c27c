package org.janelia.epochreg.client;

import org.apache.commons.lang3.time.StopWatch;
import org.janelia.epochreg.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a command line client so that every invocation ends with one of two log lines
 * (completed or failed) and a process exit status of 0 or 1.
 *
 * Invalid configurations are reported with their message only,
 * any other failure is logged with its stack trace.
 *
 * @author Eric Trautman
 */
public abstract class ClientRunner {

    public static final int SUCCESS_STATUS = 0;
    public static final int FAILURE_STATUS = 1;

    private final String[] args;

    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Runs the client and exits the JVM with its status.
     */
    public void run() {
        System.exit(runWithStatus());
    }

    /**
     * @return {@link #SUCCESS_STATUS} if the client completed, otherwise {@link #FAILURE_STATUS}.
     */
    int runWithStatus() {

        LOG.info("runWithStatus: entry, {} arguments", args == null ? 0 : args.length);

        final StopWatch stopWatch = StopWatch.createStarted();
        int status = FAILURE_STATUS;

        try {
            runClient(args);
            status = SUCCESS_STATUS;
            LOG.info("runWithStatus: exit, processing completed in {}", stopWatch);
        } catch (final ConfigurationException e) {
            LOG.error("runWithStatus: invalid configuration, {}", e.getMessage());
            LOG.info("runWithStatus: exit, nothing was processed");
        } catch (final Throwable t) {
            LOG.error("runWithStatus: caught exception", t);
            LOG.info("runWithStatus: exit, processing failed after {}", stopWatch);
        }

        return status;
    }

    /**
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
