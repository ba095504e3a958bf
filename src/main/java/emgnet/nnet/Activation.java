package emgnet.nnet;

import emgnet.nnet.activation.Function;

public class Activation extends Layer {

	private Function f;
	private double[][][] out;

	public Activation(Function f) {
		this.f = f;
	}

	@Override
	public double[][][] forward(double[][][] x) {
		out = zerosLike(x);
		for (int b = 0; b < x.length; b++)
			for (int c = 0; c < x[b].length; c++)
				for (int t = 0; t < x[b][c].length; t++)
					out[b][c][t] = f.f(x[b][c][t]);
		return out;
	}

	@Override
	public double[][][] backward(double[][][] grad) {
		double[][][] dx = zerosLike(grad);
		for (int b = 0; b < grad.length; b++)
			for (int c = 0; c < grad[b].length; c++)
				for (int t = 0; t < grad[b][c].length; t++)
					dx[b][c][t] = grad[b][c][t] * f.fDevFOut(out[b][c][t]);
		return dx;
	}
}
