package org.janelia.epochreg.naming;

import java.io.File;

import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.Camera;
import org.janelia.epochreg.spec.Exposure;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link DifferenceArtifactName} class.
 *
 * @author Eric Trautman
 */
public class DifferenceArtifactNameTest {

    @Test
    public void testParseNamerOutput() {

        final ArtifactNamer namer = new ArtifactNamer(new File("/data"), "sn_2012_a");

        final DifferenceArtifactName name =
                DifferenceArtifactName.parse(namer.getDifferenceProduct("f160w", 12, 3, ArtifactKind.SCIENCE, true));

        Assert.assertEquals("invalid root", "sn_2012_a", name.getRootName());
        Assert.assertEquals("invalid group", "f160w_e12", name.getFeGroup());
        Assert.assertEquals("invalid template epoch", 3, name.getTemplateEpoch());
        Assert.assertTrue("should be masked", name.isMasked());
        Assert.assertFalse("should not be a single exposure difference", name.isSingleExposure());
        Assert.assertEquals("invalid kind", ArtifactKind.SCIENCE, name.getKind());
    }

    @Test
    public void testParseSingleExposureName() {

        final ArtifactNamer namer = new ArtifactNamer(new File("/data"), "sn1");
        final Exposure exposure = new Exposure("/data/sn1.flt/iab2b1q_flt.fits", "f105w", "f105w", Camera.WFC3_IR,
                                               55010.0, "12099_B1", true, 2);

        final DifferenceArtifactName name =
                DifferenceArtifactName.parse(namer.getSingleDifferenceProduct(exposure, 0, ArtifactKind.WEIGHT, false));

        Assert.assertEquals("invalid group", "f105w_e02", name.getFeGroup());
        Assert.assertEquals("invalid template epoch", 0, name.getTemplateEpoch());
        Assert.assertEquals("invalid exposure", "iab2b1q", name.getExposureRootname());
        Assert.assertFalse("should not be masked", name.isMasked());
        Assert.assertEquals("invalid kind", ArtifactKind.WEIGHT, name.getKind());
    }

    @Test
    public void testIsDifferenceName() {
        Assert.assertTrue("stack-free difference not recognized",
                          DifferenceArtifactName.isDifferenceName("sn1_f814w_e01-e00_sub_masked_sci.fits"));
        Assert.assertFalse("registered product should not be recognized",
                           DifferenceArtifactName.isDifferenceName("sn1_f814w_e01_reg_drz_sci.fits"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testParseInvalidName() {
        DifferenceArtifactName.parse("sn1_f814w_e01_reg_drz_sci.fits");
    }
}
