package com.bridgeai.server.ai.inference;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Random;

public class MathUtilTest {

    @Test
    public void testSoftmaxSumsToOne() {
        Random rnd = new Random(11);
        for (int trial = 0; trial < 200; trial++) {
            float[] scores = new float[16];
            for (int i = 0; i < scores.length; i++) {
                scores[i] = (rnd.nextFloat() - 0.5f) * 200.0f;
            }
            float[] probs = MathUtil.softmax(scores);

            float sum = 0.0f;
            for (float p : probs) {
                Assertions.assertTrue(p >= 0.0f && p <= 1.0f, "probability out of range: " + p);
                sum += p;
            }
            Assertions.assertEquals(1.0f, sum, 1e-5f);
        }
    }

    @Test
    public void testSoftmaxLargeScoresStayFinite() {
        float[] probs = MathUtil.softmax(new float[] { 1000.0f, 999.0f, -1000.0f });
        for (float p : probs) {
            Assertions.assertFalse(Float.isNaN(p));
        }
        Assertions.assertTrue(probs[0] > probs[1]);
        Assertions.assertEquals(0.0f, probs[2], 1e-6f);
    }

    @Test
    public void testSoftmaxUniformForEqualScores() {
        float[] probs = MathUtil.softmax(new float[16]);
        for (float p : probs) {
            Assertions.assertEquals(0.0625f, p, 1e-7f);
        }
    }

    @Test
    public void testArgmaxTiesKeepLowestIndex() {
        float[] x = { 0.1f, 0.4f, 0.4f, 0.9f, 0.9f };
        Assertions.assertEquals(1, MathUtil.argmax(x, 0, 3));
        Assertions.assertEquals(3, MathUtil.argmax(x));
        Assertions.assertThrows(IllegalArgumentException.class, () -> MathUtil.argmax(x, 2, 2));
    }

    @Test
    public void testRelu() {
        Assertions.assertEquals(0.0f, MathUtil.relu(-3.0f));
        Assertions.assertEquals(2.5f, MathUtil.relu(2.5f));
    }
}
