package org.starcull.imageio.scale;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class AsinhStretchTest {

    @Test
    public void testZeroFactorIsIdentity() {
        for (double v : new double[]{0, 1e-9, 0.25, 0.5, 1}) {
            assertEquals(v, AsinhStretch.apply(v, 0), 0);
            assertEquals(v, AsinhStretch.apply(v, -3), 0);
        }
    }

    @Test
    public void testEndPointsFixed() {
        for (double k : new double[]{0.1, 1, 50, 10000, 1e6}) {
            assertEquals(0, AsinhStretch.apply(0, k), 0);
            assertEquals(1, AsinhStretch.apply(1, k), 1e-12);
        }
    }

    @Test
    public void testMonotonic() {
        for (double k : new double[]{0, 1, 50, 10000}) {
            double previous = AsinhStretch.apply(0, k);
            for (int i = 1; i <= 1000; i++) {
                double current = AsinhStretch.apply(i / 1000.0, k);
                assertTrue(current >= previous);
                previous = current;
            }
        }
    }

    @Test
    public void testLiftsFaintValues() {
        assertTrue(AsinhStretch.apply(0.01, 50) > 0.1);
    }

    @Test
    public void testAsinh() {
        assertEquals(0.881373587019543, AsinhStretch.asinh(1), 1e-12);
        assertEquals(-0.881373587019543, AsinhStretch.asinh(-1), 1e-12);
    }
}
