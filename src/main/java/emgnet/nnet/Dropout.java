package emgnet.nnet;

import java.util.Random;

// inverted dropout
public class Dropout extends Layer {

	private double p;
	private Random r;

	private double[][][] mask;

	public Dropout(double p, Random r) {
		if (p < 0 || p >= 1)
			throw new IllegalArgumentException("Dropout probability must be in [0,1): " + p);
		this.p = p;
		this.r = r;
	}

	@Override
	public double[][][] forward(double[][][] x) {
		if (mode == Mode.EVAL || p == 0) {
			mask = null;
			return x;
		}

		double scale = 1.0 / (1.0 - p);
		mask = zerosLike(x);
		double[][][] y = zerosLike(x);
		for (int b = 0; b < x.length; b++)
			for (int c = 0; c < x[b].length; c++)
				for (int t = 0; t < x[b][c].length; t++) {
					mask[b][c][t] = r.nextDouble() < p ? 0 : scale;
					y[b][c][t] = x[b][c][t] * mask[b][c][t];
				}
		return y;
	}

	@Override
	public double[][][] backward(double[][][] grad) {
		if (mask == null)
			return grad;

		double[][][] dx = zerosLike(grad);
		for (int b = 0; b < grad.length; b++)
			for (int c = 0; c < grad[b].length; c++)
				for (int t = 0; t < grad[b][c].length; t++)
					dx[b][c][t] = grad[b][c][t] * mask[b][c][t];
		return dx;
	}
}
