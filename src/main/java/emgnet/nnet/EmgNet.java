package emgnet.nnet;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.apache.log4j.Logger;

import emgnet.nnet.activation.ReLu;

public class EmgNet {

	private static Logger log = Logger.getLogger(EmgNet.class);

	public static final int STEM_WIDTH = 16;
	public static final int[][] STAGES = new int[][] { // in, out, blocks, stride
		{ 16, 16, 2, 1 },
		{ 16, 32, 2, 2 },
		{ 32, 64, 2, 2 }
	};

	private int numChannels, numClasses, seReduction;
	private double dropout;

	private Sequential net;
	private Mode mode;

	public EmgNet(int numChannels, int numClasses, double dropout, int seReduction, long seed) {
		if (numChannels < 1 || numClasses < 2)
			throw new IllegalArgumentException("Need at least one channel and two classes");
		this.numChannels = numChannels;
		this.numClasses = numClasses;
		this.dropout = dropout;
		this.seReduction = seReduction;

		Random r = new Random(seed);

		Sequential stem = new Sequential()
				.add("conv", new Conv1d(numChannels, STEM_WIDTH, 7, 2, 3, false, r))
				.add("bn", new BatchNorm1d(STEM_WIDTH))
				.add("relu", new Activation(new ReLu()))
				.add("pool", new MaxPool1d(3, 2, 1));

		net = new Sequential().add("stem", stem);
		int width = STEM_WIDTH;
		for (int i = 0; i < STAGES.length; i++) {
			List<BlockSpec> specs = StageBuilder.stage(STAGES[i][0], STAGES[i][1], STAGES[i][2], STAGES[i][3]);
			Sequential stage = new Sequential();
			for (int j = 0; j < specs.size(); j++)
				stage.add("" + j, new ResidualSEBlock(specs.get(j), dropout, seReduction, r));
			net.add("stage" + (i + 1), stage);
			width = STAGES[i][1];
		}

		Sequential head = new Sequential()
				.add("pool", new GlobalAvgPool())
				.add("dropout", new Dropout(dropout, r))
				.add("fc", new Linear(width, numClasses, true, r));
		net.add("head", head);

		setMode(Mode.TRAIN);
		log.debug("EmgNet with " + getNumParams() + " parameters");
	}

	public double[][] forward(double[][][] x) {
		if (x.length == 0)
			throw new IllegalArgumentException("Empty batch");
		if (x[0].length != numChannels)
			throw new IllegalArgumentException("Expected " + numChannels + " channels, got " + x[0].length);

		double[][][] y = net.forward(x);
		double[][] logits = new double[y.length][numClasses];
		for (int b = 0; b < y.length; b++)
			for (int c = 0; c < numClasses; c++)
				logits[b][c] = y[b][c][0];
		return logits;
	}

	// gradient of the loss w.r.t. the logits of the last forward call
	public void backward(double[][] gradLogits) {
		double[][][] g = new double[gradLogits.length][numClasses][1];
		for (int b = 0; b < gradLogits.length; b++)
			for (int c = 0; c < numClasses; c++)
				g[b][c][0] = gradLogits[b][c];
		net.backward(g);
	}

	public int predict(double[][] window) {
		Mode old = mode;
		setMode(Mode.EVAL);
		try {
			double[] logits = forward(new double[][][] { window })[0];
			int best = 0;
			for (int c = 1; c < logits.length; c++)
				if (logits[c] > logits[best])
					best = c;
			return best;
		} finally {
			setMode(old);
		}
	}

	public void setMode(Mode mode) {
		this.mode = mode;
		net.setMode(mode);
	}

	public Mode getMode() {
		return mode;
	}

	public Map<String, Param> getParams() {
		Map<String, Param> params = new LinkedHashMap<String, Param>();
		net.collectParams("", params);
		return params;
	}

	public Map<String, double[]> getBuffers() {
		Map<String, double[]> buffers = new LinkedHashMap<String, double[]>();
		net.collectBuffers("", buffers);
		return buffers;
	}

	/**
	 * Copies of all parameters and buffers, keyed by name.
	 */
	public Map<String, double[]> getState() {
		Map<String, double[]> state = new LinkedHashMap<String, double[]>();
		for (Map.Entry<String, Param> e : getParams().entrySet())
			state.put(e.getKey(), e.getValue().w.clone());
		for (Map.Entry<String, double[]> e : getBuffers().entrySet())
			state.put(e.getKey(), e.getValue().clone());
		return state;
	}

	public void setState(Map<String, double[]> state) {
		Map<String, double[]> target = new LinkedHashMap<String, double[]>();
		for (Map.Entry<String, Param> e : getParams().entrySet())
			target.put(e.getKey(), e.getValue().w);
		target.putAll(getBuffers());

		if (!target.keySet().equals(state.keySet()))
			throw new IllegalArgumentException("State does not match architecture, expected " + target.keySet() + " but got " + state.keySet());
		for (Map.Entry<String, double[]> e : target.entrySet()) {
			double[] src = state.get(e.getKey());
			if (src.length != e.getValue().length)
				throw new IllegalArgumentException("Size mismatch for " + e.getKey() + ": " + src.length + " != " + e.getValue().length);
			System.arraycopy(src, 0, e.getValue(), 0, src.length);
		}
	}

	public int getNumParams() {
		int n = 0;
		for (Param p : getParams().values())
			n += p.size();
		return n;
	}

	public int getNumChannels() {
		return numChannels;
	}

	public int getNumClasses() {
		return numClasses;
	}

	public double getDropout() {
		return dropout;
	}

	public int getSeReduction() {
		return seReduction;
	}
}
