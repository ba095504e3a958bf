package emgnet.augment;

import org.apache.commons.math3.random.RandomGenerator;

public interface Transform {

	public double[][] apply(double[][] window, RandomGenerator r);
}
