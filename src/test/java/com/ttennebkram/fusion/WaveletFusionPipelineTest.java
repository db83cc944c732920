package com.ttennebkram.fusion;

import com.google.gson.JsonObject;
import com.ttennebkram.fusion.error.DecodeException;
import com.ttennebkram.fusion.error.DimensionException;
import com.ttennebkram.fusion.error.InsufficientInputException;
import com.ttennebkram.fusion.source.ImageSource;
import com.ttennebkram.fusion.util.RecordingDiagnostics;
import com.ttennebkram.fusion.wavelet.Wavelet;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class WaveletFusionPipelineTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final RecordingDiagnostics diagnostics = new RecordingDiagnostics();
    private final WaveletFusionPipeline pipeline = new WaveletFusionPipeline(diagnostics);

    @BeforeClass
    public static void loadOpenCV() {
        ImageFixtures.loadOpenCV();
    }

    @Test
    public void testEmptyBatchFails() {
        FusionResult result = pipeline.fuse(Collections.<ImageSource>emptyList());

        assertFalse(result.isSuccess());
        assertNull(result.getImage());
        assertTrue(result.getError() instanceof InsufficientInputException);
        assertTrue(diagnostics.hasErrors());
    }

    @Test
    public void testSingleImageFails() {
        FusionResult result = pipeline.fuse(Collections.singletonList(
                ImageSource.decoded("only", ImageFixtures.randomImage(32, 32, 1L))));

        assertFalse(result.isSuccess());
        assertNull(result.getImage());
        assertTrue(result.getError() instanceof InsufficientInputException);
        // rejected before any image was normalized
        assertEquals(1, diagnostics.getMessages(RecordingDiagnostics.Level.INFO).size());
    }

    @Test
    public void testUndecodableImageFails() {
        FusionResult result = pipeline.fuse(Arrays.asList(
                ImageSource.decoded("good", ImageFixtures.randomImage(32, 32, 1L)),
                ImageSource.encoded("broken.jpg", new byte[] {0, 1, 2, 3})));

        assertFalse(result.isSuccess());
        assertNull(result.getImage());
        assertTrue(result.getError() instanceof DecodeException);
        assertTrue(diagnostics.getMessages(RecordingDiagnostics.Level.ERROR).get(0).contains("broken.jpg"));
    }

    @Test
    public void testTooSmallImagesFail() {
        FusionResult result = pipeline.fuse(Arrays.asList(
                ImageSource.decoded("a", ImageFixtures.randomImage(8, 8, 1L)),
                ImageSource.decoded("b", ImageFixtures.randomImage(8, 8, 2L))));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().getCause() instanceof DimensionException);
    }

    @Test
    public void testFusesBatchToThreeChannelImage() {
        FusionResult result = pipeline.fuse(Arrays.asList(
                ImageSource.decoded("a", ImageFixtures.randomImage(64, 80, 1L)),
                ImageSource.decoded("b", ImageFixtures.colorImage(70, 90, 10, 120, 200)),
                ImageSource.decoded("c", ImageFixtures.horizontalRamp(65, 81))));

        assertTrue(result.isSuccess());
        assertNull(result.getError());
        Mat image = result.getImage();
        assertEquals(CvType.CV_8UC3, image.type());
        assertEquals(64, image.rows());
        assertEquals(80, image.cols());

        // gray value duplicated into every channel
        List<Mat> channels = new ArrayList<>();
        Core.split(image, channels);
        assertEquals(0.0, ImageFixtures.maxAbsDiff(channels.get(0), channels.get(1)), 0.0);
        assertEquals(0.0, ImageFixtures.maxAbsDiff(channels.get(0), channels.get(2)), 0.0);

        assertTrue(diagnostics.getMessages(RecordingDiagnostics.Level.INFO).contains("Images resized to: 64x80"));
        assertFalse(diagnostics.hasErrors());
        assertEquals(3, diagnostics.getEntries().size());
        diagnostics.clear();
        assertTrue(diagnostics.getEntries().isEmpty());
        result.release();
    }

    @Test
    public void testIdenticalImagesOnlyGetContrastRemap() {
        Mat image = ImageFixtures.randomImage(32, 32, 4L);
        FusionResult result = pipeline.fuse(Arrays.asList(
                ImageSource.decoded("a", image), ImageSource.decoded("b", image)));

        assertTrue(result.isSuccess());
        Mat expected = new Mat();
        image.convertTo(expected, CvType.CV_8U, 1.2, 10);
        List<Mat> channels = new ArrayList<>();
        Core.split(result.getImage(), channels);
        assertTrue(ImageFixtures.maxAbsDiff(expected, channels.get(0)) <= 2.0);
    }

    @Test
    public void testStaticFuseWithExplicitParameters() {
        FusionResult result = WaveletFusionPipeline.fuse(Arrays.asList(
                ImageSource.decoded("a", ImageFixtures.constant(16, 16, 100)),
                ImageSource.decoded("b", ImageFixtures.constant(16, 16, 100))), "haar", 1.0, 0.0);

        assertTrue(result.isSuccess());
        assertEquals(100.0, ImageFixtures.valueAt(result.getImage(), 8, 8), 1.0);
    }

    @Test
    public void testFuseToFileWritesPng() throws Exception {
        File first = folder.newFile("first.png");
        File second = folder.newFile("second.png");
        Imgcodecs.imwrite(first.getAbsolutePath(), ImageFixtures.randomImage(48, 40, 1L));
        Imgcodecs.imwrite(second.getAbsolutePath(), ImageFixtures.colorImage(50, 44, 30, 60, 90));
        File output = new File(folder.getRoot(), "fused.png");

        boolean ok = pipeline.fuseToFile(
                Arrays.asList(first.getAbsolutePath(), second.getAbsolutePath()), output.getAbsolutePath());

        assertTrue(ok);
        Mat written = Imgcodecs.imread(output.getAbsolutePath());
        assertEquals(48, written.rows());
        assertEquals(40, written.cols());
        assertEquals(3, written.channels());
    }

    @Test
    public void testFuseToFileWithMissingInputWritesNothing() throws Exception {
        File first = folder.newFile("first.png");
        Imgcodecs.imwrite(first.getAbsolutePath(), ImageFixtures.randomImage(48, 40, 1L));
        File output = new File(folder.getRoot(), "fused.png");

        boolean ok = pipeline.fuseToFile(Arrays.asList(first.getAbsolutePath(),
                new File(folder.getRoot(), "missing.png").getAbsolutePath()), output.getAbsolutePath());

        assertFalse(ok);
        assertFalse(output.exists());
    }

    @Test
    public void testConfigRoundTrip() throws Exception {
        JsonObject defaults = pipeline.serializeConfig();
        assertEquals("db4", defaults.getAsJsonObject("WaveletFusion").get("wavelet").getAsString());
        assertEquals("symmetric", defaults.getAsJsonObject("WaveletFusion").get("extension").getAsString());
        assertEquals(1.2, defaults.getAsJsonObject("ContrastEnhance").get("alpha").getAsDouble(), 0.0);
        assertEquals("linear", defaults.getAsJsonObject("Normalize").get("interpolation").getAsString());

        File config = folder.newFile("fusion.json");
        Files.write(config.toPath(), ("{\"WaveletFusion\": {\"wavelet\": \"db2\"},"
                + " \"ContrastEnhance\": {\"beta\": 0}}").getBytes(StandardCharsets.UTF_8));
        pipeline.loadConfig(config.toPath());

        assertEquals(Wavelet.DB2, pipeline.getWavelet());
        assertEquals(1.2, pipeline.getContrastProcessor().getAlpha(), 0.0);
        assertEquals(0.0, pipeline.getContrastProcessor().getBeta(), 0.0);

        File saved = new File(folder.getRoot(), "saved.json");
        pipeline.saveConfig(saved.toPath());
        WaveletFusionPipeline reloaded = new WaveletFusionPipeline(new RecordingDiagnostics());
        reloaded.loadConfig(saved.toPath());
        assertEquals(pipeline.serializeConfig(), reloaded.serializeConfig());
    }

    @Test(expected = java.io.IOException.class)
    public void testMalformedConfigRejected() throws Exception {
        File config = folder.newFile("bad.json");
        Files.write(config.toPath(), "[1, 2".getBytes(StandardCharsets.UTF_8));
        pipeline.loadConfig(config.toPath());
    }

    @Test
    public void testDefaultsResource() throws Exception {
        WaveletFusionPipeline fromResource = WaveletFusionPipeline.withDefaults(new RecordingDiagnostics());
        assertEquals(pipeline.serializeConfig(), fromResource.serializeConfig());
    }

    @Test
    public void testFusionInfo() {
        JsonObject info = pipeline.getFusionInfo();

        assertEquals("Discrete Wavelet Transform (DWT) Fusion", info.get("algorithm").getAsString());
        assertEquals("Daubechies 4 (db4)", info.get("wavelet").getAsString());
        assertEquals("Average", info.getAsJsonObject("fusion_rules").get("approximation_coefficients").getAsString());
        assertEquals("Maximum absolute value", info.getAsJsonObject("fusion_rules").get("detail_coefficients").getAsString());
        assertEquals("Contrast enhancement with alpha=1.2, beta=10", info.get("enhancement").getAsString());
        assertEquals(3, info.getAsJsonArray("supported_formats").size());
        JsonObject fusionStage = info.getAsJsonArray("stages").get(1).getAsJsonObject();
        assertEquals("Wavelet Fusion", fusionStage.get("displayName").getAsString());
        assertEquals("db4", fusionStage.getAsJsonObject("properties").get("wavelet").getAsString());
        assertTrue(fusionStage.get("dualInput").getAsBoolean());
        assertTrue(fusionStage.get("description").getAsString().startsWith("Wavelet Fusion (db4, symmetric)"));
        assertEquals("DWT fusion: mean approximation, max-abs details", fusionStage.get("summary").getAsString());
        assertFalse(info.getAsJsonArray("stages").get(2).getAsJsonObject().get("dualInput").getAsBoolean());
        assertFalse(info.getAsJsonArray("stages").get(0).getAsJsonObject().has("properties"));
    }
}
