package emgnet.nnet;

import java.util.Map;

// [batch][channel][time], vector layers use a time axis of length 1. backward refers to the last forward.
public abstract class Layer {

	protected Mode mode = Mode.TRAIN;

	public abstract double[][][] forward(double[][][] x);

	public abstract double[][][] backward(double[][][] grad);

	public void setMode(Mode mode) {
		this.mode = mode;
	}

	public Mode getMode() {
		return mode;
	}

	// learnable parameters, keyed by qualified name
	public void collectParams(String prefix, Map<String, Param> params) {
	}

	// non-learnable state that is part of a checkpoint
	public void collectBuffers(String prefix, Map<String, double[]> buffers) {
	}

	protected static double[][][] zerosLike(double[][][] x) {
		double[][][] r = new double[x.length][][];
		for (int b = 0; b < x.length; b++) {
			r[b] = new double[x[b].length][];
			for (int c = 0; c < x[b].length; c++)
				r[b][c] = new double[x[b][c].length];
		}
		return r;
	}
}
