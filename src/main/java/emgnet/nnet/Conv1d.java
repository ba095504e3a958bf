package emgnet.nnet;

import java.util.Arrays;
import java.util.Map;
import java.util.Random;

// weights [out][in][kernel]
public class Conv1d extends Layer {

	private int in, out, kernel, stride, pad;
	private Param weight, bias;

	private double[][][] x;

	public Conv1d(int in, int out, int kernel, int stride, int pad, boolean withBias, Random r) {
		if (in < 1 || out < 1 || kernel < 1 || stride < 1 || pad < 0)
			throw new IllegalArgumentException("Invalid convolution " + in + "->" + out + ", k=" + kernel + ", s=" + stride + ", p=" + pad);
		this.in = in;
		this.out = out;
		this.kernel = kernel;
		this.stride = stride;
		this.pad = pad;

		double bound = 1.0 / Math.sqrt(in * kernel);
		this.weight = new Param(out * in * kernel);
		for (int i = 0; i < weight.w.length; i++)
			weight.w[i] = (r.nextDouble() * 2 - 1) * bound;

		if (withBias) {
			this.bias = new Param(out);
			for (int i = 0; i < bias.w.length; i++)
				bias.w[i] = (r.nextDouble() * 2 - 1) * bound;
		}
	}

	public int outLength(int length) {
		return (length + 2 * pad - kernel) / stride + 1;
	}

	@Override
	public double[][][] forward(double[][][] x) {
		if (x[0].length != in)
			throw new IllegalArgumentException("Expected " + in + " channels, got " + x[0].length);
		this.x = x;

		int len = x[0][0].length;
		int outLen = outLength(len);
		if (outLen < 1)
			throw new IllegalArgumentException("Input of length " + len + " too short for kernel " + kernel);

		double[][][] y = new double[x.length][out][outLen];
		for (int b = 0; b < x.length; b++) {
			for (int o = 0; o < out; o++) {
				double[] yo = y[b][o];
				if (bias != null)
					Arrays.fill(yo, bias.w[o]);

				for (int i = 0; i < in; i++) {
					double[] xi = x[b][i];
					int wOff = (o * in + i) * kernel;
					for (int j = 0; j < kernel; j++) {
						double w = weight.w[wOff + j];
						int tMin = firstValid(j), tMax = lastValid(j, len, outLen);
						for (int t = tMin; t <= tMax; t++)
							yo[t] += w * xi[t * stride - pad + j];
					}
				}
			}
		}
		return y;
	}

	@Override
	public double[][][] backward(double[][][] grad) {
		int len = x[0][0].length;
		int outLen = grad[0][0].length;

		double[][][] dx = zerosLike(x);
		for (int b = 0; b < x.length; b++) {
			for (int o = 0; o < out; o++) {
				double[] go = grad[b][o];
				if (bias != null)
					for (int t = 0; t < outLen; t++)
						bias.g[o] += go[t];

				for (int i = 0; i < in; i++) {
					double[] xi = x[b][i];
					double[] dxi = dx[b][i];
					int wOff = (o * in + i) * kernel;
					for (int j = 0; j < kernel; j++) {
						double w = weight.w[wOff + j];
						double dw = 0;
						int tMin = firstValid(j), tMax = lastValid(j, len, outLen);
						for (int t = tMin; t <= tMax; t++) {
							int idx = t * stride - pad + j;
							dw += go[t] * xi[idx];
							dxi[idx] += w * go[t];
						}
						weight.g[wOff + j] += dw;
					}
				}
			}
		}
		return dx;
	}

	// first output position whose receptive field at tap j lies inside the input
	private int firstValid(int j) {
		int d = pad - j;
		return d <= 0 ? 0 : (d + stride - 1) / stride;
	}

	private int lastValid(int j, int len, int outLen) {
		int d = len - 1 + pad - j;
		if (d < 0)
			return -1;
		return Math.min(outLen - 1, d / stride);
	}

	@Override
	public void collectParams(String prefix, Map<String, Param> params) {
		params.put(prefix + "weight", weight);
		if (bias != null)
			params.put(prefix + "bias", bias);
	}
}
