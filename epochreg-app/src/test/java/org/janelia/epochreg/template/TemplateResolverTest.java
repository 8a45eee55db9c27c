package org.janelia.epochreg.template;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;

import org.apache.commons.io.FileUtils;
import org.janelia.epochreg.FakeCollaborators;
import org.janelia.epochreg.KeywordFileHeaderReader;
import org.janelia.epochreg.error.MissingInputException;
import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.Camera;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link TemplateResolver} class.
 *
 * @author Eric Trautman
 */
public class TemplateResolverTest {

    private File topDirectory;
    private ArtifactNamer namer;
    private FakeCollaborators fakeCollaborators;

    @Before
    public void setup() throws Exception {
        topDirectory = new File("test-template-resolver").getAbsoluteFile();
        FileUtils.deleteDirectory(topDirectory);
        namer = new ArtifactNamer(topDirectory, "sn1");
        fakeCollaborators = new FakeCollaborators();
    }

    @After
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(topDirectory);
    }

    @Test
    public void testRegisteredTemplate() throws Exception {

        final TemplateResolver resolver = new TemplateResolver(namer, fakeCollaborators, 0, null, false);
        final File expected = namer.getRegisteredProduct("f814w", 0, "drz", ArtifactKind.SCIENCE);

        try {
            resolver.resolve("f814w", "drz", Camera.WFC3_UVIS);
            Assert.fail("missing template should have been reported");
        } catch (final MissingInputException e) {
            Assert.assertEquals("invalid missing files", Collections.singletonList(expected), e.getMissingFiles());
        }

        FileUtils.touch(expected);

        Assert.assertEquals("invalid template", expected, resolver.resolve("f814w", "drz", Camera.WFC3_UVIS));
        Assert.assertEquals("nothing should be synthesized", 0, fakeCollaborators.getCallCount("makeScaledTemplate"));
    }

    @Test
    public void testScaledTemplateBuiltOnce() throws Exception {

        final TemplateResolver resolver =
                new TemplateResolver(namer, fakeCollaborators, 0, Arrays.asList("f125w", "f160w"), false);
        Assert.assertTrue("resolver should be scaled", resolver.isScaled());

        final File f125w = namer.getRegisteredProduct("f125w", 0, "drz", ArtifactKind.SCIENCE);
        FileUtils.touch(f125w);

        try {
            resolver.resolve("f140w", "drz", Camera.WFC3_IR);
            Assert.fail("missing f160w template source should have been reported");
        } catch (final MissingInputException e) {
            Assert.assertEquals("invalid number of missing files", 1, e.getMissingFiles().size());
        }

        FileUtils.touch(namer.getRegisteredProduct("f160w", 0, "drz", ArtifactKind.SCIENCE));

        final File template = resolver.resolve("f140w", "drz", Camera.WFC3_IR);
        resolver.resolve("f140w", "drz", Camera.WFC3_IR);

        Assert.assertEquals("invalid scaled template",
                            namer.getScaledTemplateProduct("f140w", 0, "drz", ArtifactKind.SCIENCE), template);
        Assert.assertEquals("scaled template should only be built once",
                            1, fakeCollaborators.getCallCount("makeScaledTemplate"));
        Assert.assertEquals("invalid bandpass",
                            "WFC3-IR,f140w",
                            new KeywordFileHeaderReader().readPrimaryHeader(template).get("BANDPASS"));
    }
}
