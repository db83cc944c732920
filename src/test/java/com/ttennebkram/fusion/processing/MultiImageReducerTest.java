package com.ttennebkram.fusion.processing;

import com.ttennebkram.fusion.ImageFixtures;
import com.ttennebkram.fusion.error.DimensionException;
import com.ttennebkram.fusion.error.InsufficientInputException;
import com.ttennebkram.fusion.error.TransformException;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MultiImageReducerTest {

    @BeforeClass
    public static void loadOpenCV() {
        ImageFixtures.loadOpenCV();
    }

    private static Mat average(Mat a, Mat b) {
        Mat out = new Mat();
        Core.addWeighted(a, 0.5, b, 0.5, 0.0, out);
        return out;
    }

    @Test
    public void testFewerThanTwoImagesNeverCallsProcessor() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        MultiImageReducer reducer = new MultiImageReducer((a, b) -> {
            calls.incrementAndGet();
            return average(a, b);
        });

        for (List<Mat> batch : Arrays.<List<Mat>>asList(
                Collections.<Mat>emptyList(),
                Collections.singletonList(ImageFixtures.constant(4, 4, 1)))) {
            try {
                reducer.reduce(batch);
                fail("Expected InsufficientInputException");
            } catch (InsufficientInputException e) {
                assertEquals(2, e.getRequired());
                assertEquals(batch.size(), e.getSupplied());
            }
        }
        assertEquals(0, calls.get());
    }

    @Test
    public void testStrictLeftFold() throws Exception {
        List<String> order = new ArrayList<>();
        MultiImageReducer reducer = new MultiImageReducer((a, b) -> {
            order.add((int) ImageFixtures.valueAt(a, 0, 0) + "+" + (int) ImageFixtures.valueAt(b, 0, 0));
            return average(a, b);
        });

        Mat a = ImageFixtures.constant(4, 4, 0);
        Mat b = ImageFixtures.constant(4, 4, 100);
        Mat c = ImageFixtures.constant(4, 4, 200);

        Mat forward = reducer.reduce(Arrays.asList(a, b, c));
        assertEquals(Arrays.asList("0+100", "50+200"), order);
        assertEquals(125.0, ImageFixtures.valueAt(forward, 0, 0), 0.0);

        // the fold is order sensitive
        Mat backward = reducer.reduce(Arrays.asList(c, b, a));
        assertEquals(75.0, ImageFixtures.valueAt(backward, 0, 0), 0.0);
    }

    @Test
    public void testInputsAreNotReleased() throws Exception {
        MultiImageReducer reducer = new MultiImageReducer(MultiImageReducerTest::average);
        Mat a = ImageFixtures.constant(4, 4, 10);
        Mat b = ImageFixtures.constant(4, 4, 30);

        Mat result = reducer.reduce(Arrays.asList(a, b));

        assertFalse(a.empty());
        assertFalse(b.empty());
        assertEquals(10.0, ImageFixtures.valueAt(a, 0, 0), 0.0);
        assertEquals(20.0, ImageFixtures.valueAt(result, 0, 0), 0.0);
    }

    @Test
    public void testFailingStepAbortsReduction() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        MultiImageReducer reducer = new MultiImageReducer((a, b) -> {
            if (calls.incrementAndGet() == 2) {
                throw new DimensionException("boom");
            }
            return average(a, b);
        });

        List<Mat> batch = Arrays.asList(
                ImageFixtures.constant(4, 4, 1),
                ImageFixtures.constant(4, 4, 2),
                ImageFixtures.constant(4, 4, 3),
                ImageFixtures.constant(4, 4, 4));
        try {
            reducer.reduce(batch);
            fail("Expected TransformException");
        } catch (TransformException e) {
            assertTrue(e.getMessage().contains("image 2"));
            assertTrue(e.getCause() instanceof DimensionException);
        }
        assertEquals(2, calls.get());
    }
}
