package emgnet.augment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.random.JDKRandomGenerator;
import org.apache.commons.math3.random.RandomGenerator;

import emgnet.Config;

public class Augmenter {

	private List<Transform> transforms;
	private double p;
	private RandomGenerator r;

	public Augmenter(List<Transform> transforms, double p, RandomGenerator r) {
		if (p < 0 || p > 1)
			throw new IllegalArgumentException("Probability must be in [0,1]: " + p);
		this.transforms = Collections.unmodifiableList(new ArrayList<Transform>(transforms));
		this.p = p;
		this.r = r;
	}

	/**
	 * shift, then noise, then scale/offset
	 */
	public static Augmenter fromConfig(Config c, long seed) {
		List<Transform> l = new ArrayList<Transform>();
		l.add(new TimeShift(c.maxShift));
		l.add(new GaussianNoise(c.noiseLevel));
		l.add(new ScaleOffset(c.scaleMin, c.scaleMax, c.offsetMin, c.offsetMax));

		JDKRandomGenerator r = new JDKRandomGenerator();
		r.setSeed(seed);
		return new Augmenter(l, c.augmentProbability, r);
	}

	public double[][] apply(double[][] window) {
		double[][] y = copy(window);
		for (Transform t : transforms)
			if (r.nextDouble() < p)
				y = t.apply(y, r);
		return y;
	}

	public static double[][] copy(double[][] window) {
		double[][] r = new double[window.length][];
		for (int c = 0; c < window.length; c++)
			r[c] = window[c].clone();
		return r;
	}
}
