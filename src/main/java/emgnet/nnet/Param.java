package emgnet.nnet;

import java.util.Arrays;

public class Param {

	public final double[] w;
	public final double[] g;

	public Param(int size) {
		this.w = new double[size];
		this.g = new double[size];
	}

	public int size() {
		return w.length;
	}

	public void zeroGrad() {
		Arrays.fill(g, 0);
	}
}
