package emgnet.filter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Random;

import org.junit.jupiter.api.Test;

public class BandpassFilterTest {

	private BandpassFilter filter = new BandpassFilter(1000, 20, 450, 4);

	private static double[] sine(double freq, double fs, int n, double offset) {
		double[] d = new double[n];
		for (int t = 0; t < n; t++)
			d[t] = offset + Math.sin(2 * Math.PI * freq * t / fs);
		return d;
	}

	@Test
	public void coefficientsHaveTwiceTheOrderPlusOne() {
		assertEquals(9, filter.getB().length);
		assertEquals(9, filter.getA().length);
		assertEquals(1.0, filter.getA()[0], 1e-12);
		assertEquals(27, filter.getPadLength());
	}

	@Test
	public void keepsLength() {
		Random r = new Random(1);
		for (int n : new int[] { 28, 100, 999, 3000 }) {
			double[] x = new double[n];
			for (int i = 0; i < n; i++)
				x[i] = r.nextGaussian();
			assertEquals(n, filter.filter(x).length);
		}
	}

	@Test
	public void passesBandWithoutPhaseShift() {
		double[] x = sine(100, 1000, 1000, 0);
		double[] y = filter.filter(x);
		for (int t = 100; t < 900; t++)
			assertEquals(x[t], y[t], 0.01, "t=" + t);
	}

	@Test
	public void removesOffsetAndSlowDrift() {
		double[] y = filter.filter(sine(100, 1000, 1000, 5.0));
		double mean = 0;
		for (double d : y)
			mean += d;
		assertEquals(0, mean / y.length, 0.02);

		y = filter.filter(sine(2, 1000, 3000, 0));
		for (int t = 300; t < 2700; t++)
			assertEquals(0, y[t], 1e-4);
	}

	@Test
	public void constantSignalBecomesZero() {
		double[] x = new double[500];
		Arrays.fill(x, 3.0);
		for (double d : filter.filter(x))
			assertEquals(0, d, 1e-9);
	}

	@Test
	public void filtersEveryChannel() {
		double[][] w = new double[][] { sine(100, 1000, 300, 0), sine(100, 1000, 300, 1), sine(3, 1000, 300, 0), new double[300] };
		double[][] y = filter.filter(w);
		assertEquals(4, y.length);
		for (double[] ch : y)
			assertEquals(300, ch.length);
		// original arrays untouched
		assertEquals(1.0, w[1][0], 0);
	}

	@Test
	public void rejectsShortSignals() {
		SignalTooShortException e = assertThrows(SignalTooShortException.class, () -> filter.filter(new double[27]));
		assertEquals(27, e.getLength());
		assertEquals(27, e.getMinLength());
		assertEquals(28, filter.filter(new double[28]).length);
	}

	@Test
	public void rejectsInvalidCutoffs() {
		assertThrows(IllegalArgumentException.class, () -> new BandpassFilter(1000, 0, 450, 4));
		assertThrows(IllegalArgumentException.class, () -> new BandpassFilter(1000, 450, 20, 4));
		assertThrows(IllegalArgumentException.class, () -> new BandpassFilter(1000, 20, 500, 4));
		assertThrows(IllegalArgumentException.class, () -> new BandpassFilter(1000, 20, 450, 0));
	}

	@Test
	public void higherOrderNeedsLongerSignals() {
		BandpassFilter f = new BandpassFilter(1000, 20, 450, 8);
		assertEquals(51, f.getPadLength());
		assertThrows(SignalTooShortException.class, () -> f.filter(new double[40]));
		assertTrue(f.filter(new double[52]).length == 52);
	}
}
