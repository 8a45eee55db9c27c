package org.janelia.epochreg;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.parameters.CosmicRayMode;
import org.janelia.epochreg.parameters.PipelineParameters;
import org.janelia.epochreg.stage.PipelineStage;
import org.janelia.epochreg.stage.RunReport;
import org.janelia.epochreg.stage.UnitOutcome;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Runs the {@link RegistrationPipeline} end to end with fake collaborators.
 *
 * @author Eric Trautman
 */
public class RegistrationPipelineTest {

    private static final String ROOT_NAME = "sn1";

    private File topDirectory;
    private ArtifactNamer namer;
    private FakeCollaborators fakeCollaborators;
    private RegistrationPipeline pipeline;

    @Before
    public void setup() throws Exception {
        topDirectory = new File("test-pipeline").getAbsoluteFile();
        FileUtils.deleteDirectory(topDirectory);
        namer = new ArtifactNamer(topDirectory, ROOT_NAME);
        fakeCollaborators = new FakeCollaborators();
        pipeline = new RegistrationPipeline(new KeywordFileHeaderReader(), fakeCollaborators.toCollaborators());
    }

    @After
    public void tearDown() throws Exception {
        FileUtils.deleteDirectory(topDirectory);
    }

    @Test
    public void testRunAllStages() throws Exception {

        writeTwoEpochExposures();

        final RunReport report = pipeline.run(topDirectory, ROOT_NAME, buildParameters(false));

        Assert.assertEquals("no units should be missing inputs",
                            0, report.getCount(UnitOutcome.Status.SKIPPED_MISSING_INPUT));

        Assert.assertTrue("epoch list not persisted", namer.getDefaultEpochListFile().exists());
        Assert.assertTrue("working copy missing",
                          new File(namer.getEpochDirectory(1), "iab2c1q_flt.fits").exists());
        Assert.assertTrue("reference image missing", namer.getDefaultReferenceImage().exists());

        for (final String visit : Arrays.asList("12099_B1", "12099_B2")) {
            final File nativeProduct = new File(namer.getEpochDirectory(1),
                                                "sn1_f814w_e01_" + visit + "_nat_drz_sci.fits");
            Assert.assertTrue(nativeProduct + " missing", nativeProduct.exists());
        }

        final FakeCollaborators.CombineCall registeredCall = fakeCollaborators.getLastCombineCall("sn1_f814w_e01_reg");
        Assert.assertNotNull("epoch 1 was not combined", registeredCall);
        Assert.assertEquals("epoch 1 combination should include exposures from both visits",
                            Arrays.asList("iab2b1q_flt.fits", "iab2b2q_flt.fits", "iab2c1q_flt.fits"),
                            registeredCall.getImageNames());
        Assert.assertTrue("epoch 1 combination should use the registered grid",
                          registeredCall.getOptions().isRegisteredGrid());
        Assert.assertNotNull("registered grid center should come from the reference image",
                             registeredCall.getOptions().getOutputCenter());

        final File maskedDifference = new File(namer.getEpochDirectory(1), "sn1_f814w_e01-e00_sub_masked_sci.fits");
        final File unmaskedDifference = new File(namer.getEpochDirectory(1), "sn1_f814w_e01-e00_sub_sci.fits");
        final File differenceWeight = new File(namer.getEpochDirectory(1), "sn1_f814w_e01-e00_sub_wht.fits");
        Assert.assertTrue("masked difference missing", maskedDifference.exists());
        Assert.assertFalse("unmasked difference should have been removed", unmaskedDifference.exists());
        Assert.assertTrue("difference weight missing", differenceWeight.exists());

        Assert.assertEquals("template epoch should not be differenced",
                            1, report.getOutcomes(PipelineStage.DIFFERENCE).size());
        Assert.assertTrue("stack stage should not be part of --doAll",
                          report.getOutcomes(PipelineStage.STACK).isEmpty());
    }

    @Test
    public void testSecondRunChangesNothing() throws Exception {

        writeTwoEpochExposures();

        final RunReport firstReport = pipeline.run(topDirectory, ROOT_NAME, buildParameters(false));
        Assert.assertFalse("first run should build products", firstReport.isUnchanged());

        final int callCountAfterFirstRun = fakeCollaborators.getTotalCallCount();
        final String epochList = FileUtils.readFileToString(namer.getDefaultEpochListFile(), StandardCharsets.UTF_8);

        final RunReport secondReport = pipeline.run(topDirectory, ROOT_NAME, buildParameters(false));

        Assert.assertTrue("second run should not build anything, outcomes are " + secondReport.getOutcomes(),
                          secondReport.isUnchanged());
        Assert.assertEquals("second run should not invoke any collaborators",
                            callCountAfterFirstRun, fakeCollaborators.getTotalCallCount());
        Assert.assertEquals("epoch list should not change",
                            epochList,
                            FileUtils.readFileToString(namer.getDefaultEpochListFile(), StandardCharsets.UTF_8));
    }

    @Test
    public void testClobberRegeneratesOnlyRequestedStage() throws Exception {

        writeTwoEpochExposures();

        pipeline.run(topDirectory, ROOT_NAME, buildParameters(false));

        final File registeredProduct = new File(namer.getEpochDirectory(1), "sn1_f814w_e01_reg_drz_sci.fits");
        final File maskedDifference = new File(namer.getEpochDirectory(1), "sn1_f814w_e01-e00_sub_masked_sci.fits");
        final File referenceImage = namer.getDefaultReferenceImage();

        final String registeredContent = read(registeredProduct);
        final String differenceContent = read(maskedDifference);
        final String referenceContent = read(referenceImage);
        final int combineCount = fakeCollaborators.getCallCount("combine");

        final PipelineParameters parameters = new PipelineParameters();
        parameters.stages.doRefIm = true;
        parameters.stages.doDiff = true;
        parameters.clobber = true;

        final RunReport report = pipeline.run(topDirectory, ROOT_NAME, parameters);

        Assert.assertEquals("difference should have been rebuilt",
                            1, report.getOutcomes(UnitOutcome.Status.COMPLETED).size());
        Assert.assertNotEquals("difference content should change", differenceContent, read(maskedDifference));
        Assert.assertEquals("registered product should not change", registeredContent, read(registeredProduct));
        Assert.assertEquals("reference should not be rebuilt without a selection override",
                            referenceContent, read(referenceImage));
        Assert.assertEquals("nothing should be combined", combineCount, fakeCollaborators.getCallCount("combine"));
    }

    @Test
    public void testReferenceRebuiltForClobberedOverride() throws Exception {

        writeTwoEpochExposures();

        final PipelineParameters firstParameters = new PipelineParameters();
        firstParameters.stages.doRefIm = true;
        pipeline.run(topDirectory, ROOT_NAME, firstParameters);

        final FakeCollaborators.CombineCall firstCall = fakeCollaborators.getLastCombineCall("sn1_wcsref");
        Assert.assertEquals("default reference should use the first epoch",
                            Arrays.asList("iab1a1q_flt.fits", "iab1a2q_flt.fits"), firstCall.getImageNames());

        final PipelineParameters parameters = new PipelineParameters();
        parameters.stages.doRefIm = true;
        parameters.clobber = true;
        parameters.reference.refEpoch = 1;
        parameters.reference.refVisit = "12099_b1";

        final RunReport report = pipeline.run(topDirectory, ROOT_NAME, parameters);

        Assert.assertEquals("reference should have been rebuilt",
                            1, report.getOutcomes(UnitOutcome.Status.COMPLETED).size());
        final FakeCollaborators.CombineCall secondCall = fakeCollaborators.getLastCombineCall("sn1_wcsref");
        Assert.assertEquals("override visit should be used",
                            Arrays.asList("iab2b1q_flt.fits", "iab2b2q_flt.fits"), secondCall.getImageNames());
    }

    @Test
    public void testMissingTemplateIsReported() throws Exception {

        final File exposureDirectory = namer.getExposureDirectory();
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a1q", "UVIS", "F814W", 55000.0, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b1q", "UVIS", "F814W", 55010.0, "B1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b2q", "UVIS", "F606W", 55010.1, "B1");

        final RunReport report = pipeline.run(topDirectory, ROOT_NAME, buildParameters(false));

        final List<UnitOutcome> missingList = report.getOutcomes(UnitOutcome.Status.SKIPPED_MISSING_INPUT);
        Assert.assertEquals("only the f606w difference should be skipped, outcomes are " + missingList,
                            1, missingList.size());

        final UnitOutcome missing = missingList.get(0);
        Assert.assertEquals("invalid stage for skipped unit", PipelineStage.DIFFERENCE, missing.getStage());
        Assert.assertEquals("invalid missing files",
                            new File(namer.getEpochDirectory(0), "sn1_f606w_e00_reg_drz_sci.fits"),
                            missing.getMissingFiles().get(0));

        Assert.assertTrue("f814w difference should still be built",
                          new File(namer.getEpochDirectory(1), "sn1_f814w_e01-e00_sub_masked_sci.fits").exists());
    }

    @Test
    public void testNewExposuresMergedWithClobber() throws Exception {

        writeTwoEpochExposures();

        final PipelineParameters setupParameters = new PipelineParameters();
        setupParameters.stages.doSetup = true;
        pipeline.run(topDirectory, ROOT_NAME, setupParameters);

        KeywordFileHeaderReader.writeExposure(namer.getExposureDirectory(), "iab3d1q", "UVIS", "F814W", 55030.0, "D1");

        final PipelineParameters hintParameters = new PipelineParameters();
        hintParameters.stages.doSetup = true;
        pipeline.run(topDirectory, ROOT_NAME, hintParameters);

        Assert.assertFalse("new exposure should not be catalogued without clobber",
                           read(namer.getDefaultEpochListFile()).contains("iab3d1q"));

        final PipelineParameters clobberParameters = new PipelineParameters();
        clobberParameters.stages.doSetup = true;
        clobberParameters.clobber = true;
        pipeline.run(topDirectory, ROOT_NAME, clobberParameters);

        Assert.assertTrue("new exposure should be catalogued with clobber",
                          read(namer.getDefaultEpochListFile()).contains("iab3d1q"));
        Assert.assertTrue("new exposure should be copied into a new epoch",
                          new File(namer.getEpochDirectory(2), "iab3d1q_flt.fits").exists());
    }

    @Test
    public void testAverageFilterCombination() throws Exception {

        final File exposureDirectory = namer.getExposureDirectory();
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a1q", "IR", "F125W", 55000.0, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a2q", "IR", "F125W", 55000.1, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a3q", "IR", "F160W", 55000.2, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a4q", "IR", "F160W", 55000.3, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b1q", "IR", "F125W", 55010.0, "B1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b2q", "IR", "F125W", 55010.1, "B1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b3q", "IR", "F160W", 55010.2, "B1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b4q", "IR", "F160W", 55010.3, "B1");

        final PipelineParameters parameters = buildParameters(false);
        parameters.filterCombination.combineFilterList = Arrays.asList("F125W", "F160W");
        parameters.filterCombination.combineFilterName = "JH";
        parameters.filterCombination.combineFilterMethod = "avg";

        final RunReport report = pipeline.run(topDirectory, ROOT_NAME, parameters);

        Assert.assertEquals("each filter and the average should be differenced, outcomes are " +
                            report.getOutcomes(PipelineStage.DIFFERENCE),
                            3, report.getOutcomes(PipelineStage.DIFFERENCE).size());
        Assert.assertEquals("average should be computed once", 1, fakeCollaborators.getCallCount("weightedAverage"));
        Assert.assertTrue("composite difference missing",
                          new File(namer.getEpochDirectory(1), "sn1_jh_e01-e00_sub_masked_sci.fits").exists());
        Assert.assertTrue("composite weight missing",
                          new File(namer.getEpochDirectory(1), "sn1_jh_e01-e00_sub_wht.fits").exists());

        pipeline.run(topDirectory, ROOT_NAME, parameters);
        Assert.assertEquals("existing average should not be recomputed",
                            1, fakeCollaborators.getCallCount("weightedAverage"));
    }

    @Test
    public void testStackExcludesTemplateEpoch() throws Exception {

        writeTwoEpochExposures();

        pipeline.run(topDirectory, ROOT_NAME, buildParameters(false));

        final PipelineParameters parameters = new PipelineParameters();
        parameters.stages.doStack = true;

        final RunReport report = pipeline.run(topDirectory, ROOT_NAME, parameters);

        Assert.assertEquals("one stack should be built",
                            1, report.getOutcomes(UnitOutcome.Status.COMPLETED).size());

        final FakeCollaborators.CombineCall stackCall = fakeCollaborators.getLastCombineCall("sn1_f814w_stack");
        Assert.assertNotNull("stack was not combined", stackCall);
        Assert.assertEquals("stack should only include non-template exposures",
                            Arrays.asList("iab2b1q_flt.fits", "iab2b2q_flt.fits", "iab2c1q_flt.fits"),
                            stackCall.getImageNames());
        Assert.assertTrue("stack difference missing",
                          new File(namer.getStackDirectory(), "sn1_f814w_stack-e00_sub_sci.fits").exists());

        parameters.stack.stackTemplate = true;
        parameters.clobber = true;
        pipeline.run(topDirectory, ROOT_NAME, parameters);

        Assert.assertEquals("template exposures should be stacked when requested",
                            5, fakeCollaborators.getLastCombineCall("sn1_f814w_stack").getImageNames().size());
    }

    @Test
    public void testIntravisitRegistration() throws Exception {

        writeTwoEpochExposures();

        final PipelineParameters parameters = new PipelineParameters();
        parameters.stages.doSetup = true;
        parameters.stages.doDriz1 = true;
        parameters.registration.intravisitReg = true;

        pipeline.run(topDirectory, ROOT_NAME, parameters);

        Assert.assertEquals("each visit should be aligned internally",
                            3, fakeCollaborators.getRegistrationRequests().size());
        Assert.assertEquals("invalid intravisit WCS name",
                            "INTRAVIS", fakeCollaborators.getRegistrationRequests().get(0).getWcsName());

        final FakeCollaborators.CombineCall call =
                fakeCollaborators.getLastCombineCall("sn1_f814w_e01_12099_B1_nat");
        Assert.assertNotNull("visit B1 was not combined", call);
        Assert.assertEquals("combination should use the intravisit WCS", "INTRAVIS", call.getOptions().getWcsKey());
    }

    @Test
    public void testInfraredPairHotPixelCleanup() throws Exception {

        final File exposureDirectory = namer.getExposureDirectory();
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a1q", "IR", "F160W", 55000.0, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a2q", "IR", "F160W", 55000.1, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b1q", "IR", "F160W", 55010.0, "B1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b2q", "IR", "F160W", 55010.1, "B1");

        final PipelineParameters parameters = buildParameters(false);
        parameters.combine.drizCr = 2;

        pipeline.run(topDirectory, ROOT_NAME, parameters);

        Assert.assertEquals("each visit and each epoch pair should be cleaned",
                            4, fakeCollaborators.getCallCount("cleanHotPixels"));

        int registeredCombineCount = 0;
        for (final FakeCollaborators.CombineCall call : fakeCollaborators.getCombineCalls()) {
            if ("sn1_f160w_e01_reg".equals(call.getOutputRoot())) {
                registeredCombineCount++;
            }
        }
        Assert.assertEquals("epoch pair should be combined again after cleanup", 2, registeredCombineCount);

        final FakeCollaborators.CombineCall lastCall = fakeCollaborators.getLastCombineCall("sn1_f160w_e01_reg");
        Assert.assertEquals("second combination should keep existing cosmic ray flags",
                            CosmicRayMode.KEEP_FLAGS, lastCall.getOptions().getCosmicRayMode());
        Assert.assertTrue("second combination should overwrite the first", lastCall.getOptions().isClobber());
    }

    @Test
    public void testSingleExposureDifferences() throws Exception {

        writeTwoEpochExposures();

        final PipelineParameters parameters = buildParameters(false);
        parameters.difference.singleSubs = true;

        final RunReport report = pipeline.run(topDirectory, ROOT_NAME, parameters);

        Assert.assertTrue("registered combination should write single exposure products",
                          fakeCollaborators.getLastCombineCall("sn1_f814w_e01_reg").getOptions()
                                  .isSingleExposureProducts());
        Assert.assertEquals("epoch and each of its exposures should be differenced, outcomes are " +
                            report.getOutcomes(PipelineStage.DIFFERENCE),
                            4, report.getOutcomes(PipelineStage.DIFFERENCE).size());

        for (final String rootname : Arrays.asList("iab2b1q", "iab2b2q", "iab2c1q")) {
            final File singleDifference = new File(namer.getEpochDirectory(1),
                                                   "sn1_f814w_e01-e00_" + rootname + "_single_sub_masked_sci.fits");
            Assert.assertTrue(singleDifference + " missing", singleDifference.exists());
        }
        Assert.assertTrue("epoch difference missing",
                          new File(namer.getEpochDirectory(1), "sn1_f814w_e01-e00_sub_masked_sci.fits").exists());
    }

    @Test
    public void testDrizzleFilterCombination() throws Exception {

        final File exposureDirectory = namer.getExposureDirectory();
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a1q", "IR", "F125W", 55000.0, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a2q", "IR", "F160W", 55000.1, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a3q", "IR", "F160W", 55000.2, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b1q", "IR", "F125W", 55010.0, "B1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b2q", "IR", "F160W", 55010.1, "B1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b3q", "IR", "F160W", 55010.2, "B1");

        final PipelineParameters parameters = buildParameters(false);
        parameters.filterCombination.combineFilterList = Arrays.asList("F125W", "F160W");
        parameters.filterCombination.combineFilterName = "JH";
        parameters.filterCombination.combineFilterMethod = "driz";

        final RunReport report = pipeline.run(topDirectory, ROOT_NAME, parameters);

        final FakeCollaborators.CombineCall call = fakeCollaborators.getLastCombineCall("sn1_jh_e01_reg");
        Assert.assertNotNull("member filters were not combined together", call);
        Assert.assertEquals("combination should include both filters",
                            Arrays.asList("iab2b1q_flt.fits", "iab2b2q_flt.fits", "iab2b3q_flt.fits"),
                            call.getImageNames());

        Assert.assertEquals("only the pseudo-filter should be differenced, outcomes are " +
                            report.getOutcomes(PipelineStage.DIFFERENCE),
                            1, report.getOutcomes(PipelineStage.DIFFERENCE).size());
        Assert.assertTrue("pseudo-filter difference missing",
                          new File(namer.getEpochDirectory(1), "sn1_jh_e01-e00_sub_masked_sci.fits").exists());
        Assert.assertFalse("member filter difference should not exist",
                           new File(namer.getEpochDirectory(1), "sn1_f160w_e01-e00_sub_masked_sci.fits").exists());
        Assert.assertEquals("drizzled combination should not be averaged",
                            0, fakeCollaborators.getCallCount("weightedAverage"));
    }

    @Test
    public void testExistingCombinationsSkippedWithoutWorkingCopies() throws Exception {

        writeTwoEpochExposures();

        pipeline.run(topDirectory, ROOT_NAME, buildParameters(false));

        for (final String rootname : Arrays.asList("iab2b1q", "iab2b2q", "iab2c1q")) {
            FileUtils.forceDelete(new File(namer.getEpochDirectory(1), rootname + "_flt.fits"));
        }

        final PipelineParameters parameters = new PipelineParameters();
        parameters.stages.doDriz1 = true;
        parameters.stages.doReg = true;
        parameters.stages.doDriz2 = true;

        final RunReport report = pipeline.run(topDirectory, ROOT_NAME, parameters);

        Assert.assertEquals("existing combinations should not need working copies, outcomes are " +
                            report.getOutcomes(),
                            0, report.getCount(UnitOutcome.Status.SKIPPED_MISSING_INPUT));
        Assert.assertTrue("nothing should be rebuilt", report.isUnchanged());
    }

    private void writeTwoEpochExposures()
            throws IOException {
        final File exposureDirectory = namer.getExposureDirectory();
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a1q", "UVIS", "F814W", 55000.0, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab1a2q", "UVIS", "F814W", 55000.1, "A1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b1q", "UVIS", "F814W", 55010.0, "B1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2b2q", "UVIS", "F814W", 55010.1, "B1");
        KeywordFileHeaderReader.writeExposure(exposureDirectory, "iab2c1q", "UVIS", "F814W", 55011.0, "B2");
    }

    private static PipelineParameters buildParameters(final boolean clobber) {
        final PipelineParameters parameters = new PipelineParameters();
        parameters.stages.doAll = true;
        parameters.clobber = clobber;
        return parameters;
    }

    private static String read(final File file)
            throws IOException {
        return FileUtils.readFileToString(file, StandardCharsets.UTF_8);
    }
}
