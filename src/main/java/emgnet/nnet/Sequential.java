package emgnet.nnet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class Sequential extends Layer {

	private List<String> names = new ArrayList<String>();
	private List<Layer> layers = new ArrayList<Layer>();

	public Sequential add(String name, Layer l) {
		if (names.contains(name))
			throw new IllegalArgumentException("Duplicate layer name " + name);
		names.add(name);
		layers.add(l);
		l.setMode(mode);
		return this;
	}

	@Override
	public double[][][] forward(double[][][] x) {
		for (Layer l : layers)
			x = l.forward(x);
		return x;
	}

	@Override
	public double[][][] backward(double[][][] grad) {
		for (int i = layers.size() - 1; i >= 0; i--)
			grad = layers.get(i).backward(grad);
		return grad;
	}

	@Override
	public void setMode(Mode mode) {
		super.setMode(mode);
		for (Layer l : layers)
			l.setMode(mode);
	}

	@Override
	public void collectParams(String prefix, Map<String, Param> params) {
		for (int i = 0; i < layers.size(); i++)
			layers.get(i).collectParams(prefix + names.get(i) + ".", params);
	}

	@Override
	public void collectBuffers(String prefix, Map<String, double[]> buffers) {
		for (int i = 0; i < layers.size(); i++)
			layers.get(i).collectBuffers(prefix + names.get(i) + ".", buffers);
	}
}
