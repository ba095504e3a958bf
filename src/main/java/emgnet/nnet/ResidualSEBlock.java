package emgnet.nnet;

import java.util.Map;
import java.util.Random;

import emgnet.nnet.activation.ReLu;

public class ResidualSEBlock extends Layer {

	private Sequential body, shortcut;
	private Activation relu = new Activation(new ReLu());
	private Dropout dropout;

	public ResidualSEBlock(BlockSpec spec, double dropout, int seReduction, Random r) {
		body = new Sequential()
				.add("conv1", new Conv1d(spec.in, spec.out, 3, spec.stride, 1, false, r))
				.add("bn1", new BatchNorm1d(spec.out))
				.add("relu", new Activation(new ReLu()))
				.add("conv2", new Conv1d(spec.out, spec.out, 3, 1, 1, false, r))
				.add("bn2", new BatchNorm1d(spec.out))
				.add("se", new SEGate(spec.out, seReduction, r));

		if (spec.needsProjection())
			shortcut = new Sequential()
					.add("conv", new Conv1d(spec.in, spec.out, 1, spec.stride, 0, false, r))
					.add("bn", new BatchNorm1d(spec.out));

		this.dropout = new Dropout(dropout, r);
	}

	@Override
	public double[][][] forward(double[][][] x) {
		double[][][] h = body.forward(x);
		double[][][] s = shortcut == null ? x : shortcut.forward(x);
		if (h[0][0].length != s[0][0].length)
			throw new IllegalStateException("Residual length mismatch: " + h[0][0].length + " != " + s[0][0].length);

		double[][][] sum = zerosLike(h);
		for (int b = 0; b < h.length; b++)
			for (int c = 0; c < h[b].length; c++)
				for (int t = 0; t < h[b][c].length; t++)
					sum[b][c][t] = h[b][c][t] + s[b][c][t];
		return dropout.forward(relu.forward(sum));
	}

	@Override
	public double[][][] backward(double[][][] grad) {
		double[][][] g = relu.backward(dropout.backward(grad));
		double[][][] dx = body.backward(g);
		double[][][] ds = shortcut == null ? g : shortcut.backward(g);
		for (int b = 0; b < dx.length; b++)
			for (int c = 0; c < dx[b].length; c++)
				for (int t = 0; t < dx[b][c].length; t++)
					dx[b][c][t] += ds[b][c][t];
		return dx;
	}

	@Override
	public void setMode(Mode mode) {
		super.setMode(mode);
		body.setMode(mode);
		if (shortcut != null)
			shortcut.setMode(mode);
		relu.setMode(mode);
		dropout.setMode(mode);
	}

	@Override
	public void collectParams(String prefix, Map<String, Param> params) {
		body.collectParams(prefix, params);
		if (shortcut != null)
			shortcut.collectParams(prefix + "shortcut.", params);
	}

	@Override
	public void collectBuffers(String prefix, Map<String, double[]> buffers) {
		body.collectBuffers(prefix, buffers);
		if (shortcut != null)
			shortcut.collectBuffers(prefix + "shortcut.", buffers);
	}
}
