package emgnet.augment;

import org.apache.commons.math3.random.RandomGenerator;

public class ScaleOffset implements Transform {

	private double scaleMin, scaleMax, offsetMin, offsetMax;

	public ScaleOffset(double scaleMin, double scaleMax, double offsetMin, double offsetMax) {
		if (scaleMin > scaleMax || offsetMin > offsetMax)
			throw new IllegalArgumentException("Empty range: scale [" + scaleMin + "," + scaleMax + "], offset [" + offsetMin + "," + offsetMax + "]");
		this.scaleMin = scaleMin;
		this.scaleMax = scaleMax;
		this.offsetMin = offsetMin;
		this.offsetMax = offsetMax;
	}

	@Override
	public double[][] apply(double[][] window, RandomGenerator r) {
		double scale = scaleMin + r.nextDouble() * (scaleMax - scaleMin);
		double offset = offsetMin + r.nextDouble() * (offsetMax - offsetMin);
		return apply(window, scale, offset);
	}

	public static double[][] apply(double[][] window, double scale, double offset) {
		double[][] y = new double[window.length][];
		for (int c = 0; c < window.length; c++) {
			y[c] = new double[window[c].length];
			for (int t = 0; t < y[c].length; t++)
				y[c][t] = window[c][t] * scale + offset;
		}
		return y;
	}
}
