package emgnet.nnet;

public class MaxPool1d extends Layer {

	private int kernel, stride, pad;

	private int[][][] argMax;
	private int inLength;

	public MaxPool1d(int kernel, int stride, int pad) {
		if (pad > kernel / 2)
			throw new IllegalArgumentException("Padding must not exceed half the kernel size");
		this.kernel = kernel;
		this.stride = stride;
		this.pad = pad;
	}

	@Override
	public double[][][] forward(double[][][] x) {
		inLength = x[0][0].length;
		int outLen = (inLength + 2 * pad - kernel) / stride + 1;

		double[][][] y = new double[x.length][x[0].length][outLen];
		argMax = new int[x.length][x[0].length][outLen];
		for (int b = 0; b < x.length; b++)
			for (int c = 0; c < x[b].length; c++)
				for (int t = 0; t < outLen; t++) {
					double max = Double.NEGATIVE_INFINITY;
					int idx = -1;
					for (int j = 0; j < kernel; j++) {
						int i = t * stride - pad + j;
						if (i < 0 || i >= inLength) // padded positions never win
							continue;
						if (idx < 0 || x[b][c][i] > max) {
							max = x[b][c][i];
							idx = i;
						}
					}
					y[b][c][t] = max;
					argMax[b][c][t] = idx;
				}
		return y;
	}

	@Override
	public double[][][] backward(double[][][] grad) {
		double[][][] dx = new double[grad.length][grad[0].length][inLength];
		for (int b = 0; b < grad.length; b++)
			for (int c = 0; c < grad[b].length; c++)
				for (int t = 0; t < grad[b][c].length; t++)
					dx[b][c][argMax[b][c][t]] += grad[b][c][t];
		return dx;
	}
}
