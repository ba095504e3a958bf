package emgnet.nnet;

import java.util.Map;
import java.util.Random;

import emgnet.nnet.activation.ReLu;
import emgnet.nnet.activation.Sigmoid;

public class SEGate extends Layer {

	private Sequential excite;

	private double[][][] x, gate;

	public SEGate(int channels, int reduction, Random r) {
		int hidden = Math.max(1, channels / reduction);
		excite = new Sequential()
				.add("pool", new GlobalAvgPool())
				.add("fc1", new Linear(channels, hidden, false, r))
				.add("relu", new Activation(new ReLu()))
				.add("fc2", new Linear(hidden, channels, false, r))
				.add("sigmoid", new Activation(new Sigmoid()));
	}

	@Override
	public double[][][] forward(double[][][] x) {
		this.x = x;
		gate = excite.forward(x);

		double[][][] y = zerosLike(x);
		for (int b = 0; b < x.length; b++)
			for (int c = 0; c < x[b].length; c++) {
				double e = gate[b][c][0];
				for (int t = 0; t < x[b][c].length; t++)
					y[b][c][t] = x[b][c][t] * e;
			}
		return y;
	}

	@Override
	public double[][][] backward(double[][][] grad) {
		double[][][] dGate = new double[grad.length][grad[0].length][1];
		double[][][] dx = zerosLike(grad);
		for (int b = 0; b < grad.length; b++)
			for (int c = 0; c < grad[b].length; c++) {
				double e = gate[b][c][0], s = 0;
				for (int t = 0; t < grad[b][c].length; t++) {
					dx[b][c][t] = grad[b][c][t] * e;
					s += grad[b][c][t] * x[b][c][t];
				}
				dGate[b][c][0] = s;
			}

		double[][][] dxGate = excite.backward(dGate);
		for (int b = 0; b < dx.length; b++)
			for (int c = 0; c < dx[b].length; c++)
				for (int t = 0; t < dx[b][c].length; t++)
					dx[b][c][t] += dxGate[b][c][t];
		return dx;
	}

	@Override
	public void setMode(Mode mode) {
		super.setMode(mode);
		excite.setMode(mode);
	}

	@Override
	public void collectParams(String prefix, Map<String, Param> params) {
		excite.collectParams(prefix, params);
	}
}
