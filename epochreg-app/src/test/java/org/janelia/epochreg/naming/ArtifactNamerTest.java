package org.janelia.epochreg.naming;

import java.io.File;
import java.util.Arrays;

import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.spec.Camera;
import org.janelia.epochreg.spec.Exposure;
import org.janelia.epochreg.spec.ExposureGroup;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ArtifactNamer} class.
 *
 * @author Eric Trautman
 */
public class ArtifactNamerTest {

    private final File topDirectory = new File("/data/sne").getAbsoluteFile();
    private final ArtifactNamer namer = new ArtifactNamer(topDirectory, "sn1");

    @Test
    public void testDirectories() {
        Assert.assertEquals("invalid exposure directory",
                            new File(topDirectory, "sn1.flt"), namer.getExposureDirectory());
        Assert.assertEquals("invalid epoch directory",
                            new File(topDirectory, "sn1.e03"), namer.getEpochDirectory(3));
        Assert.assertEquals("invalid epoch list",
                            new File(topDirectory, "sn1_epochs.txt"), namer.getDefaultEpochListFile());
        Assert.assertEquals("invalid default reference",
                            new File(topDirectory, "sn1.refim/sn1_wcsref_drz_sci.fits"),
                            namer.getDefaultReferenceImage());
    }

    @Test
    public void testGroupProducts() {

        final Exposure a = buildExposure("icb2b1q_flc.fits", "12099_B1");
        final Exposure b = buildExposure("icb2b2q_flc.fits", "12099_B1");
        final ExposureGroup fevGroup = ExposureGroup.byFevGroup(Arrays.asList(a, b)).get(0);
        final ExposureGroup feGroup = ExposureGroup.byFeGroup(Arrays.asList(a, b)).get(0);

        Assert.assertEquals("invalid working copy",
                            new File(topDirectory, "sn1.e01/icb2b1q_flc.fits"), namer.getWorkingCopy(a));
        Assert.assertEquals("invalid native product",
                            new File(topDirectory, "sn1.e01/sn1_f814w_e01_12099_B1_nat_drc_sci.fits"),
                            namer.getNativeProduct(fevGroup, ArtifactKind.SCIENCE));
        Assert.assertEquals("invalid registered weight",
                            new File(topDirectory, "sn1.e01/sn1_f814w_e01_reg_drc_wht.fits"),
                            namer.getRegisteredProduct(feGroup, ArtifactKind.WEIGHT));
        Assert.assertEquals("invalid single exposure product",
                            new File(topDirectory, "sn1.e01/sn1_f814w_e01_reg_icb2b1q_single_sci.fits"),
                            namer.getSingleExposureProduct(a, ArtifactKind.SCIENCE));
        Assert.assertEquals("invalid scaled template",
                            new File(topDirectory, "sn1.e00/sn1_~f814w_e00_reg_drc_sci.fits"),
                            namer.getScaledTemplateProduct("f814w", 0, "drc", ArtifactKind.SCIENCE));
    }

    @Test
    public void testDifferenceProducts() {

        final Exposure a = buildExposure("icb2b1q_flc.fits", "12099_B1");

        Assert.assertEquals("invalid masked difference",
                            new File(topDirectory, "sn1.e01/sn1_f814w_e01-e00_sub_masked_sci.fits"),
                            namer.getDifferenceProduct("f814w", 1, 0, ArtifactKind.SCIENCE, true));
        Assert.assertEquals("invalid difference weight",
                            new File(topDirectory, "sn1.e01/sn1_f814w_e01-e00_sub_wht.fits"),
                            namer.getDifferenceProduct("f814w", 1, 0, ArtifactKind.WEIGHT, false));
        Assert.assertEquals("invalid single difference",
                            new File(topDirectory, "sn1.e01/sn1_f814w_e01-e00_icb2b1q_single_sub_masked_sci.fits"),
                            namer.getSingleDifferenceProduct(a, 0, ArtifactKind.SCIENCE, true));
        Assert.assertEquals("invalid stack difference",
                            new File(topDirectory, "sn1.stack/sn1_f814w_stack-e00_sub_sci.fits"),
                            namer.getStackDifferenceProduct("f814w", 0));
    }

    @Test
    public void testGetSibling() {
        final File science = new File(topDirectory, "sn1.e01/sn1_f814w_e01_reg_drz_sci.fits");
        Assert.assertEquals("invalid mask sibling",
                            new File(topDirectory, "sn1.e01/sn1_f814w_e01_reg_drz_bpx.fits"),
                            ArtifactNamer.getSibling(science, ArtifactKind.BAD_PIXEL_MASK));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGetSiblingOfNonScienceFile() {
        ArtifactNamer.getSibling(new File("sn1_f814w_e01_reg_drz_wht.fits"), ArtifactKind.WEIGHT);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingRootName() {
        new ArtifactNamer(topDirectory, "");
    }

    private Exposure buildExposure(final String filename,
                                   final String visit) {
        return new Exposure(new File(topDirectory, "sn1.flt/" + filename).getPath(), "f814w", "f814w",
                            Camera.WFC3_UVIS, 55010.0, visit, true, 1);
    }
}
