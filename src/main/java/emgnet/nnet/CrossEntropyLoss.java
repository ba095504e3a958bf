package emgnet.nnet;

import emgnet.nnet.activation.SoftMax;

public class CrossEntropyLoss {

	private SoftMax softMax = new SoftMax();
	private double[][] probs;
	private int[] targets;

	public double forward(double[][] logits, int[] targets) {
		if (logits.length != targets.length)
			throw new IllegalArgumentException("Got " + logits.length + " score vectors but " + targets.length + " targets");
		if (logits.length == 0)
			throw new IllegalStateException("Cross-entropy of an empty batch");

		this.targets = targets;
		probs = new double[logits.length][];
		double loss = 0;
		for (int b = 0; b < logits.length; b++) {
			if (targets[b] < 0 || targets[b] >= logits[b].length)
				throw new IllegalArgumentException("Target " + targets[b] + " out of range [0," + logits[b].length + ")");
			probs[b] = softMax.f(logits[b]);
			loss -= softMax.logF(logits[b], targets[b]);
		}
		return loss / logits.length;
	}

	// gradient of the mean loss w.r.t. the scores of the last forward call
	public double[][] backward() {
		double[][] g = new double[probs.length][];
		for (int b = 0; b < probs.length; b++) {
			g[b] = softMax.fDevFOut(probs[b], targets[b]);
			for (int c = 0; c < g[b].length; c++)
				g[b][c] /= probs.length;
		}
		return g;
	}
}
