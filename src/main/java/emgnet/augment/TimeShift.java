package emgnet.augment;

import org.apache.commons.math3.random.RandomGenerator;

// zero fill, no wrap around
public class TimeShift implements Transform {

	private int maxShift;

	public TimeShift(int maxShift) {
		if (maxShift < 0)
			throw new IllegalArgumentException("Maximum shift must not be negative: " + maxShift);
		this.maxShift = maxShift;
	}

	@Override
	public double[][] apply(double[][] window, RandomGenerator r) {
		int shift = r.nextInt(2 * maxShift + 1) - maxShift;
		return shift(window, shift);
	}

	// positive shift moves samples to later times
	public static double[][] shift(double[][] window, int shift) {
		double[][] r = new double[window.length][];
		for (int c = 0; c < window.length; c++) {
			int len = window[c].length;
			r[c] = new double[len];
			if (Math.abs(shift) >= len)
				continue;
			if (shift >= 0)
				System.arraycopy(window[c], 0, r[c], shift, len - shift);
			else
				System.arraycopy(window[c], -shift, r[c], 0, len + shift);
		}
		return r;
	}
}
