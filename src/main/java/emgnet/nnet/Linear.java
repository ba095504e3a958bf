package emgnet.nnet;

import java.util.Map;
import java.util.Random;

// on [batch][in][1], weights [out][in]
public class Linear extends Layer {

	private int in, out;
	private Param weight, bias;

	private double[][][] x;

	public Linear(int in, int out, boolean withBias, Random r) {
		this.in = in;
		this.out = out;

		double bound = 1.0 / Math.sqrt(in);
		this.weight = new Param(out * in);
		for (int i = 0; i < weight.w.length; i++)
			weight.w[i] = (r.nextDouble() * 2 - 1) * bound;
		if (withBias) {
			this.bias = new Param(out);
			for (int i = 0; i < out; i++)
				bias.w[i] = (r.nextDouble() * 2 - 1) * bound;
		}
	}

	@Override
	public double[][][] forward(double[][][] x) {
		if (x[0].length != in || x[0][0].length != 1)
			throw new IllegalArgumentException("Expected [" + in + "][1] input, got [" + x[0].length + "][" + x[0][0].length + "]");
		this.x = x;

		double[][][] y = new double[x.length][out][1];
		for (int b = 0; b < x.length; b++)
			for (int o = 0; o < out; o++) {
				double s = bias == null ? 0 : bias.w[o];
				for (int i = 0; i < in; i++)
					s += weight.w[o * in + i] * x[b][i][0];
				y[b][o][0] = s;
			}
		return y;
	}

	@Override
	public double[][][] backward(double[][][] grad) {
		double[][][] dx = new double[grad.length][in][1];
		for (int b = 0; b < grad.length; b++)
			for (int o = 0; o < out; o++) {
				double g = grad[b][o][0];
				if (bias != null)
					bias.g[o] += g;
				for (int i = 0; i < in; i++) {
					weight.g[o * in + i] += g * x[b][i][0];
					dx[b][i][0] += g * weight.w[o * in + i];
				}
			}
		return dx;
	}

	@Override
	public void collectParams(String prefix, Map<String, Param> params) {
		params.put(prefix + "weight", weight);
		if (bias != null)
			params.put(prefix + "bias", bias);
	}
}
