package com.ttennebkram.fusion.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.fusion.ImageFixtures;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import static org.junit.Assert.assertEquals;

public class ContrastEnhanceProcessorTest {

    @BeforeClass
    public static void loadOpenCV() {
        ImageFixtures.loadOpenCV();
    }

    private static double enhance(ContrastEnhanceProcessor processor, int value) {
        Mat output = processor.process(ImageFixtures.constant(2, 2, value));
        assertEquals(CvType.CV_8UC1, output.type());
        return ImageFixtures.valueAt(output, 1, 1);
    }

    @Test
    public void testDefaultRemap() {
        ContrastEnhanceProcessor processor = new ContrastEnhanceProcessor();

        assertEquals(10.0, enhance(processor, 0), 0.0);
        assertEquals(130.0, enhance(processor, 100), 0.0);
        // 1.2 * 101 + 10 = 131.2
        assertEquals(131.0, enhance(processor, 101), 0.0);
        // 1.2 * 250 + 10 = 310 saturates
        assertEquals(255.0, enhance(processor, 250), 0.0);
    }

    @Test
    public void testNegativeResultsClampToZero() {
        ContrastEnhanceProcessor processor = new ContrastEnhanceProcessor();
        processor.setAlpha(0.5);
        processor.setBeta(-20);

        assertEquals(30.0, enhance(processor, 100), 0.0);
        assertEquals(0.0, enhance(processor, 10), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonFiniteAlphaRejected() {
        new ContrastEnhanceProcessor().setAlpha(Double.NaN);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonFiniteBetaRejected() {
        new ContrastEnhanceProcessor().setBeta(Double.POSITIVE_INFINITY);
    }

    @Test
    public void testPropertiesRoundTripThroughJson() {
        ContrastEnhanceProcessor processor = new ContrastEnhanceProcessor();
        processor.setAlpha(1.5);
        processor.setBeta(-4);

        JsonObject json = new JsonObject();
        processor.serializeProperties(json);
        assertEquals(1.5, json.get("alpha").getAsDouble(), 0.0);

        ContrastEnhanceProcessor restored = new ContrastEnhanceProcessor();
        restored.deserializeProperties(json);
        assertEquals(1.5, restored.getAlpha(), 0.0);
        assertEquals(-4.0, restored.getBeta(), 0.0);

        ContrastEnhanceProcessor defaults = new ContrastEnhanceProcessor();
        defaults.deserializeProperties(new JsonObject());
        assertEquals(ContrastEnhanceProcessor.DEFAULT_ALPHA, defaults.getAlpha(), 0.0);
        assertEquals(ContrastEnhanceProcessor.DEFAULT_BETA, defaults.getBeta(), 0.0);
    }
}
