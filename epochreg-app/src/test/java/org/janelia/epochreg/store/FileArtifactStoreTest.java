package org.janelia.epochreg.store;

import java.io.File;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.janelia.epochreg.spec.ArtifactKind;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link FileArtifactStore} class.
 *
 * @author Eric Trautman
 */
public class FileArtifactStoreTest {

    private File testDirectory;
    private File science;
    private File otherScience;
    private FileArtifactStore store;

    @Before
    public void setup() throws Exception {
        testDirectory = new File("test-artifact-store").getAbsoluteFile();
        FileUtils.deleteDirectory(testDirectory);
        science = new File(testDirectory, "sn1_f814w_e01_reg_drz_sci.fits");
        otherScience = new File(testDirectory, "sn1_f606w_e01_reg_drz_sci.fits");
        store = new FileArtifactStore();
    }

    @After
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(testDirectory);
    }

    @Test
    public void testNeedsRun() throws Exception {

        Assert.assertTrue("missing artifact should need a run", store.needsRun(science, false));

        FileUtils.touch(science);
        FileUtils.touch(store.pathFor(science, ArtifactKind.WEIGHT));

        Assert.assertTrue("artifact should exist", store.exists(science));
        Assert.assertFalse("existing artifact should not need a run", store.needsRun(science, false));
        Assert.assertTrue("existing artifact should not be removed without clobber", science.exists());

        Assert.assertTrue("clobbered artifact should need a run", store.needsRun(science, true));
        Assert.assertFalse("clobbered science should be removed", science.exists());
        Assert.assertFalse("clobbered weight should be removed", store.pathFor(science, ArtifactKind.WEIGHT).exists());
    }

    @Test
    public void testInvalidateOnlyTouchesOneFamily() throws Exception {

        for (final ArtifactKind kind : ArtifactKind.values()) {
            FileUtils.touch(store.pathFor(science, kind));
            FileUtils.touch(store.pathFor(otherScience, kind));
        }

        final List<File> removed = store.invalidate(science);

        Assert.assertEquals("all kinds should be removed", ArtifactKind.values().length, removed.size());
        for (final ArtifactKind kind : ArtifactKind.values()) {
            Assert.assertTrue("other family " + kind + " should be kept", store.pathFor(otherScience, kind).exists());
        }
    }
}
