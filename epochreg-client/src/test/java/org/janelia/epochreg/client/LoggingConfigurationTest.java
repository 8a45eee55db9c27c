package org.janelia.epochreg.client;

import java.net.URL;

import org.janelia.epochreg.RegistrationPipeline;
import org.janelia.epochreg.util.LogbackTools;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;

/**
 * Verifies that the client's logging configuration honors the verbosity options.
 *
 * @author Eric Trautman
 */
public class LoggingConfigurationTest {

    @After
    public void tearDown() throws Exception {
        configure("logback-test.xml");
    }

    @Test
    public void testClientConfigurationHonorsVerbosity() throws Exception {

        configure("logback.xml");

        final Logger pipelineLogger = LoggerFactory.getLogger(RegistrationPipeline.class);

        Assert.assertTrue("client configuration should log info by default", pipelineLogger.isInfoEnabled());

        LogbackTools.setVerbosity(0);
        Assert.assertFalse("--quiet should disable info", pipelineLogger.isInfoEnabled());

        LogbackTools.setVerbosity(2);
        Assert.assertTrue("--verbose should enable debug", pipelineLogger.isDebugEnabled());
    }

    private static void configure(final String resourceName) throws Exception {
        final URL url = LoggingConfigurationTest.class.getClassLoader().getResource(resourceName);
        Assert.assertNotNull(resourceName + " should be on the class path", url);
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        loggerContext.reset();
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(loggerContext);
        configurator.doConfigure(url);
    }
}
