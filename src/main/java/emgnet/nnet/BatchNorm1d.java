package emgnet.nnet;

import java.util.Arrays;
import java.util.Map;

public class BatchNorm1d extends Layer {

	public static final double EPS = 1e-5;
	public static final double MOMENTUM = 0.1;

	private int channels;
	private Param gamma, beta;
	private double[] runningMean, runningVar;

	private double[][][] xHat;
	private double[] invStd;

	public BatchNorm1d(int channels) {
		this.channels = channels;
		this.gamma = new Param(channels);
		Arrays.fill(gamma.w, 1.0);
		this.beta = new Param(channels);
		this.runningMean = new double[channels];
		this.runningVar = new double[channels];
		Arrays.fill(runningVar, 1.0);
	}

	@Override
	public double[][][] forward(double[][][] x) {
		if (x[0].length != channels)
			throw new IllegalArgumentException("Expected " + channels + " channels, got " + x[0].length);

		int len = x[0][0].length;
		double[] mean, var;
		if (mode == Mode.TRAIN) {
			int n = x.length * len;
			if (n < 2)
				throw new IllegalStateException("Batch normalization needs more than one value per channel in training mode");

			mean = new double[channels];
			var = new double[channels];
			for (int c = 0; c < channels; c++) {
				double s = 0;
				for (int b = 0; b < x.length; b++)
					for (double d : x[b][c])
						s += d;
				mean[c] = s / n;

				double ss = 0;
				for (int b = 0; b < x.length; b++)
					for (double d : x[b][c])
						ss += (d - mean[c]) * (d - mean[c]);
				var[c] = ss / n;

				runningMean[c] = (1 - MOMENTUM) * runningMean[c] + MOMENTUM * mean[c];
				runningVar[c] = (1 - MOMENTUM) * runningVar[c] + MOMENTUM * ss / (n - 1); // unbiased
			}
		} else {
			mean = runningMean;
			var = runningVar;
		}

		invStd = new double[channels];
		for (int c = 0; c < channels; c++)
			invStd[c] = 1.0 / Math.sqrt(var[c] + EPS);

		xHat = new double[x.length][channels][len];
		double[][][] y = new double[x.length][channels][len];
		for (int b = 0; b < x.length; b++)
			for (int c = 0; c < channels; c++)
				for (int t = 0; t < len; t++) {
					xHat[b][c][t] = (x[b][c][t] - mean[c]) * invStd[c];
					y[b][c][t] = gamma.w[c] * xHat[b][c][t] + beta.w[c];
				}
		return y;
	}

	@Override
	public double[][][] backward(double[][][] grad) {
		int len = grad[0][0].length;
		int n = grad.length * len;

		double[][][] dx = new double[grad.length][channels][len];
		for (int c = 0; c < channels; c++) {
			double sumG = 0, sumGX = 0;
			for (int b = 0; b < grad.length; b++)
				for (int t = 0; t < len; t++) {
					sumG += grad[b][c][t];
					sumGX += grad[b][c][t] * xHat[b][c][t];
				}
			gamma.g[c] += sumGX;
			beta.g[c] += sumG;

			double k = gamma.w[c] * invStd[c];
			for (int b = 0; b < grad.length; b++)
				for (int t = 0; t < len; t++)
					if (mode == Mode.TRAIN)
						dx[b][c][t] = k * (grad[b][c][t] - sumG / n - xHat[b][c][t] * sumGX / n);
					else
						dx[b][c][t] = k * grad[b][c][t];
		}
		return dx;
	}

	@Override
	public void collectParams(String prefix, Map<String, Param> params) {
		params.put(prefix + "weight", gamma);
		params.put(prefix + "bias", beta);
	}

	@Override
	public void collectBuffers(String prefix, Map<String, double[]> buffers) {
		buffers.put(prefix + "running_mean", runningMean);
		buffers.put(prefix + "running_var", runningVar);
	}
}
