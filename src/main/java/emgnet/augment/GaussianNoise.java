package emgnet.augment;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

public class GaussianNoise implements Transform {

	public static final double MIN_STD = 1e-6;

	private double noiseLevel;

	public GaussianNoise(double noiseLevel) {
		if (noiseLevel < 0)
			throw new IllegalArgumentException("Noise level must not be negative: " + noiseLevel);
		this.noiseLevel = noiseLevel;
	}

	@Override
	public double[][] apply(double[][] window, RandomGenerator r) {
		double sigma = std(window) * noiseLevel;

		double[][] y = new double[window.length][];
		for (int c = 0; c < window.length; c++) {
			y[c] = new double[window[c].length];
			for (int t = 0; t < y[c].length; t++)
				y[c][t] = window[c][t] + r.nextGaussian() * sigma;
		}
		return y;
	}

	// population standard deviation over all channels, guarded against zero
	public static double std(double[][] window) {
		StandardDeviation sd = new StandardDeviation(false);
		for (double[] ch : window)
			for (double d : ch)
				sd.increment(d);
		double s = sd.getResult();
		return Double.isNaN(s) || s < MIN_STD ? 1.0 : s;
	}
}
