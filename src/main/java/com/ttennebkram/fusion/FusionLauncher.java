package com.ttennebkram.fusion;

import com.ttennebkram.fusion.util.FusionDiagnostics;
import com.ttennebkram.fusion.wavelet.Wavelet;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 *
 * <pre>
 *   fusion [-c config.json] [-w db4] [-a 1.2] [-b 10] -o fused.png in1.png in2.png ...
 *   fusion --info
 * </pre>
 */
public class FusionLauncher {

    private static final String USAGE =
            "Usage: fusion [-c config.json] [-w wavelet] [-a alpha] [-b beta] -o output.png input1 input2 ...\n"
            + "       fusion --info";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        String configPath = null;
        String wavelet = null;
        Double alpha = null;
        Double beta = null;
        String outputPath = null;
        boolean info = false;
        List<String> inputs = new ArrayList<>();

        try {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-c":
                    case "--config":
                        configPath = requireValue(args, ++i, arg);
                        break;
                    case "-w":
                    case "--wavelet":
                        wavelet = requireValue(args, ++i, arg);
                        break;
                    case "-a":
                    case "--alpha":
                        alpha = Double.parseDouble(requireValue(args, ++i, arg));
                        break;
                    case "-b":
                    case "--beta":
                        beta = Double.parseDouble(requireValue(args, ++i, arg));
                        break;
                    case "-o":
                    case "--output":
                        outputPath = requireValue(args, ++i, arg);
                        break;
                    case "--info":
                        info = true;
                        break;
                    case "-h":
                    case "--help":
                        System.out.println(USAGE);
                        return 0;
                    default:
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        inputs.add(arg);
                        break;
                }
            }

            WaveletFusionPipeline pipeline = new WaveletFusionPipeline(
                    FusionDiagnostics.console(WaveletFusionPipeline.COMPONENT));
            if (configPath != null) {
                pipeline.loadConfig(Paths.get(configPath));
            }
            if (wavelet != null) {
                pipeline.setWavelet(Wavelet.fromId(wavelet));
            }
            if (alpha != null || beta != null) {
                pipeline.setContrast(
                        alpha != null ? alpha : pipeline.getContrastProcessor().getAlpha(),
                        beta != null ? beta : pipeline.getContrastProcessor().getBeta());
            }

            if (info) {
                System.out.println(WaveletFusionPipeline.toPrettyJson(pipeline.getFusionInfo()));
                return 0;
            }
            if (outputPath == null) {
                throw new IllegalArgumentException("Missing output path (-o)");
            }

            // Load OpenCV native library
            nu.pattern.OpenCV.loadLocally();

            return pipeline.fuseToFile(inputs, outputPath) ? 0 : 1;
        } catch (IllegalArgumentException e) {
            System.err.println("[FusionLauncher] " + e.getMessage());
            System.err.println(USAGE);
            return 2;
        } catch (IOException e) {
            System.err.println("[FusionLauncher] Failed to read configuration: " + e.getMessage());
            return 2;
        }
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }
}
