package com.ttennebkram.fusion;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.fusion.error.FusionException;
import com.ttennebkram.fusion.error.InsufficientInputException;
import com.ttennebkram.fusion.error.TransformException;
import com.ttennebkram.fusion.processing.ImageNormalizer;
import com.ttennebkram.fusion.processing.MultiImageReducer;
import com.ttennebkram.fusion.processing.NormalizedBatch;
import com.ttennebkram.fusion.processors.ColorProcessor;
import com.ttennebkram.fusion.processors.ContrastEnhanceProcessor;
import com.ttennebkram.fusion.processors.FusionProcessorBase;
import com.ttennebkram.fusion.processors.FusionProcessorInfo;
import com.ttennebkram.fusion.processors.GrayscaleProcessor;
import com.ttennebkram.fusion.processors.WaveletFusionProcessor;
import com.ttennebkram.fusion.source.ImageSource;
import com.ttennebkram.fusion.util.FusionDiagnostics;
import com.ttennebkram.fusion.wavelet.SignalExtension;
import com.ttennebkram.fusion.wavelet.Wavelet;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Multi-image wavelet fusion pipeline.
 *
 * Stages, in order: decode and normalize to a common even size, fold the
 * batch left to right with pairwise DWT fusion, contrast remap, and expand
 * the gray result to three channels. Any failing stage stops the run; the
 * caller gets a failed {@link FusionResult} and one error diagnostic, never
 * a partial image.
 *
 * The OpenCV native library must be loaded before use
 * ({@code nu.pattern.OpenCV.loadLocally()}).
 */
public class WaveletFusionPipeline {

    public static final String COMPONENT = "WaveletFusion";
    public static final String DEFAULTS_RESOURCE = "/fusion-defaults.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
    private static final String[] SUPPORTED_FORMATS = {"JPEG", "PNG", "TIFF"};

    private final FusionDiagnostics diagnostics;

    private final ImageNormalizer normalizer = new ImageNormalizer();
    private final WaveletFusionProcessor fusionProcessor = new WaveletFusionProcessor();
    private final ContrastEnhanceProcessor contrastProcessor = new ContrastEnhanceProcessor();
    private final ColorProcessor colorProcessor = new ColorProcessor();

    public WaveletFusionPipeline() {
        this(FusionDiagnostics.console(COMPONENT));
    }

    public WaveletFusionPipeline(FusionDiagnostics diagnostics) {
        if (diagnostics == null) {
            throw new IllegalArgumentException("Diagnostics channel is required");
        }
        this.diagnostics = diagnostics;
    }

    /**
     * Pipeline configured from the bundled defaults resource.
     */
    public static WaveletFusionPipeline withDefaults(FusionDiagnostics diagnostics) throws IOException {
        WaveletFusionPipeline pipeline = new WaveletFusionPipeline(diagnostics);
        InputStream in = WaveletFusionPipeline.class.getResourceAsStream(DEFAULTS_RESOURCE);
        if (in == null) {
            throw new IOException("Missing resource " + DEFAULTS_RESOURCE);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            pipeline.deserializeConfig(parseObject(reader, DEFAULTS_RESOURCE));
        }
        return pipeline;
    }

    /**
     * One-shot fusion with an explicit wavelet and contrast parameters.
     *
     * @throws IllegalArgumentException for an unknown wavelet or non-finite contrast values
     */
    public static FusionResult fuse(List<? extends ImageSource> images, String wavelet,
                                    double contrastAlpha, double contrastBeta) {
        WaveletFusionPipeline pipeline = new WaveletFusionPipeline();
        pipeline.setWavelet(Wavelet.fromId(wavelet));
        pipeline.setContrast(contrastAlpha, contrastBeta);
        return pipeline.fuse(images);
    }

    /**
     * Fuse an ordered batch of images.
     *
     * @param images at least two sources; order matters
     * @return success with an 8-bit 3-channel image, or failure with its cause
     */
    public FusionResult fuse(List<? extends ImageSource> images) {
        int count = images == null ? 0 : images.size();
        diagnostics.info("Starting fusion process with " + count + " images");

        NormalizedBatch batch = null;
        Mat fused = null;
        Mat enhanced = null;
        try {
            if (count < MultiImageReducer.MINIMUM_IMAGES) {
                throw new InsufficientInputException(MultiImageReducer.MINIMUM_IMAGES, count);
            }

            batch = normalizer.normalize(images);
            diagnostics.info("Images resized to: " + batch.rows() + "x" + batch.cols());

            MultiImageReducer reducer = new MultiImageReducer(fusionProcessor.createDualImageProcessor());
            fused = reducer.reduce(batch.getGrayImages());

            enhanced = contrastProcessor.createImageProcessor().process(fused);
            Mat output = colorProcessor.process(enhanced);

            diagnostics.info("Fusion completed successfully");
            return FusionResult.success(output);
        } catch (FusionException e) {
            diagnostics.error(e.getMessage(), e);
            return FusionResult.failure(e);
        } catch (CvException e) {
            TransformException error = new TransformException("OpenCV error during fusion: " + e.getMessage(), e);
            diagnostics.error(error.getMessage(), e);
            return FusionResult.failure(error);
        } finally {
            if (batch != null) {
                batch.release();
            }
            if (enhanced != null && enhanced != fused) {
                enhanced.release();
            }
            if (fused != null) {
                fused.release();
            }
        }
    }

    /**
     * Fuse image files and write the result as PNG.
     *
     * @return true if the fused image was written
     */
    public boolean fuseToFile(List<String> inputPaths, String outputPath) {
        List<ImageSource> sources = new ArrayList<>();
        if (inputPaths != null) {
            for (String path : inputPaths) {
                sources.add(ImageSource.file(path));
            }
        }

        FusionResult result = fuse(sources);
        if (!result.isSuccess()) {
            return false;
        }
        try {
            if (!Imgcodecs.imwrite(outputPath, result.getImage())) {
                diagnostics.error("Failed to write result to: " + outputPath, null);
                return false;
            }
        } catch (CvException e) {
            diagnostics.error("Failed to write result to: " + outputPath, e);
            return false;
        } finally {
            result.release();
        }

        diagnostics.info("Result saved to: " + outputPath);
        return true;
    }

    // ===== Configuration =====

    /**
     * Current configuration, one object per stage keyed by node type.
     */
    public JsonObject serializeConfig() {
        JsonObject root = new JsonObject();

        JsonObject normalize = new JsonObject();
        normalizer.serializeProperties(normalize);
        root.add(ImageNormalizer.NODE_TYPE, normalize);

        JsonObject fusion = new JsonObject();
        fusionProcessor.serializeProperties(fusion);
        root.add(fusionProcessor.getNodeType(), fusion);

        JsonObject contrast = new JsonObject();
        contrastProcessor.serializeProperties(contrast);
        root.add(contrastProcessor.getNodeType(), contrast);

        return root;
    }

    /**
     * Apply a configuration document. Stages without a section keep their settings.
     *
     * @throws IllegalArgumentException if a section holds an invalid value
     */
    public void deserializeConfig(JsonObject root) {
        JsonObject normalize = section(root, ImageNormalizer.NODE_TYPE);
        if (normalize != null) {
            normalizer.deserializeProperties(normalize);
        }
        JsonObject fusion = section(root, fusionProcessor.getNodeType());
        if (fusion != null) {
            fusionProcessor.deserializeProperties(fusion);
        }
        JsonObject contrast = section(root, contrastProcessor.getNodeType());
        if (contrast != null) {
            contrastProcessor.deserializeProperties(contrast);
        }
    }

    public void loadConfig(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            deserializeConfig(parseObject(reader, path.toString()));
        }
    }

    public void saveConfig(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(serializeConfig(), writer);
        }
    }

    /**
     * Description of the algorithm and its current parameters.
     */
    public JsonObject getFusionInfo() {
        JsonObject info = new JsonObject();
        info.addProperty("algorithm", "Discrete Wavelet Transform (DWT) Fusion");
        info.addProperty("wavelet", fusionProcessor.getWavelet().getDisplayName());
        info.addProperty("extension", fusionProcessor.getExtension().getId());

        JsonObject rules = new JsonObject();
        rules.addProperty("approximation_coefficients", "Average");
        rules.addProperty("detail_coefficients", "Maximum absolute value");
        info.add("fusion_rules", rules);

        info.addProperty("enhancement", "Contrast enhancement with alpha="
                + formatNumber(contrastProcessor.getAlpha()) + ", beta="
                + formatNumber(contrastProcessor.getBeta()));

        JsonArray stages = new JsonArray();
        stages.add(describeStage(new GrayscaleProcessor()));
        stages.add(describeStage(fusionProcessor));
        stages.add(describeStage(contrastProcessor));
        stages.add(describeStage(colorProcessor));
        info.add("stages", stages);

        JsonArray formats = new JsonArray();
        for (String format : SUPPORTED_FORMATS) {
            formats.add(format);
        }
        info.add("supported_formats", formats);
        return info;
    }

    public static String toPrettyJson(JsonElement json) {
        return GSON.toJson(json);
    }

    // ===== Getters/setters =====

    public void setWavelet(Wavelet wavelet) {
        fusionProcessor.setWavelet(wavelet);
    }

    public Wavelet getWavelet() {
        return fusionProcessor.getWavelet();
    }

    public void setExtension(SignalExtension extension) {
        fusionProcessor.setExtension(extension);
    }

    public void setContrast(double alpha, double beta) {
        contrastProcessor.setAlpha(alpha);
        contrastProcessor.setBeta(beta);
    }

    public void setInterpolation(String interpolation) {
        normalizer.setInterpolation(interpolation);
    }

    public ImageNormalizer getNormalizer() {
        return normalizer;
    }

    public WaveletFusionProcessor getFusionProcessor() {
        return fusionProcessor;
    }

    public ContrastEnhanceProcessor getContrastProcessor() {
        return contrastProcessor;
    }

    private static JsonObject describeStage(FusionProcessorBase processor) {
        JsonObject stage = new JsonObject();
        stage.addProperty("nodeType", processor.getNodeType());
        stage.addProperty("displayName", processor.getDisplayName());
        stage.addProperty("category", processor.getCategory());
        stage.addProperty("description", processor.getDescription());
        FusionProcessorInfo annotation = processor.getClass().getAnnotation(FusionProcessorInfo.class);
        if (annotation != null) {
            if (!annotation.description().isEmpty()) {
                stage.addProperty("summary", annotation.description());
            }
            stage.addProperty("dualInput", annotation.dualInput());
        }
        if (processor.hasProperties()) {
            JsonObject properties = new JsonObject();
            processor.serializeProperties(properties);
            stage.add("properties", properties);
        }
        return stage;
    }

    private static JsonObject section(JsonObject root, String key) {
        if (root != null && root.has(key) && root.get(key).isJsonObject()) {
            return root.getAsJsonObject(key);
        }
        return null;
    }

    private static JsonObject parseObject(Reader reader, String name) throws IOException {
        JsonElement element;
        try {
            element = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IOException("Invalid JSON in " + name + ": " + e.getMessage(), e);
        }
        if (!element.isJsonObject()) {
            throw new IOException("Expected a JSON object in " + name);
        }
        return element.getAsJsonObject();
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
