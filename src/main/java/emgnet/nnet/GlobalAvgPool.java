package emgnet.nnet;

import java.util.Arrays;

public class GlobalAvgPool extends Layer {

	private int inLength;

	@Override
	public double[][][] forward(double[][][] x) {
		inLength = x[0][0].length;
		double[][][] y = new double[x.length][x[0].length][1];
		for (int b = 0; b < x.length; b++)
			for (int c = 0; c < x[b].length; c++) {
				double s = 0;
				for (double d : x[b][c])
					s += d;
				y[b][c][0] = s / inLength;
			}
		return y;
	}

	@Override
	public double[][][] backward(double[][][] grad) {
		double[][][] dx = new double[grad.length][grad[0].length][inLength];
		for (int b = 0; b < grad.length; b++)
			for (int c = 0; c < grad[b].length; c++)
				Arrays.fill(dx[b][c], grad[b][c][0] / inLength);
		return dx;
	}
}
