package surface;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearFitTest {

    @Test
    void testExactLine() {
        LinearFit fit = new LinearFit();
        for (int x = 0; x < 10; x++) {
            fit.addPoint(x, 3.0 - 0.5 * x);
        }

        assertEquals(10, fit.getCount());
        assertEquals(-0.5, fit.getSlope(), 1e-12);
        assertEquals(3.0, fit.getOffset(), 1e-12);
        assertEquals(-2.0, fit.getFitValue(10), 1e-12);
    }

    @Test
    void testLeastSquares() {
        LinearFit fit = new LinearFit();
        fit.addPoint(0, 0);
        fit.addPoint(1, 1);
        fit.addPoint(2, 0);

        assertEquals(0, fit.getSlope(), 1e-12);
        assertEquals(1.0 / 3.0, fit.getOffset(), 1e-12);
    }

    @Test
    void testDegenerateAndClear() {
        LinearFit fit = new LinearFit();
        fit.addPoint(1, 1);
        assertTrue(Double.isNaN(fit.getSlope()));

        fit.addPoint(1, 2);
        assertTrue(Double.isNaN(fit.getSlope()), "all points at the same x");

        fit.addPoint(Double.NaN, 5);
        assertEquals(2, fit.getCount());

        fit.clear();
        assertEquals(0, fit.getCount());
        fit.addPoint(0, 1);
        fit.addPoint(2, 5);
        assertEquals(2, fit.getSlope(), 1e-12);
    }
}
