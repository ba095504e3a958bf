package emgnet.train;

public class EpochStats {

	public final double loss, accuracy;
	public final int samples;

	public EpochStats(double loss, double accuracy, int samples) {
		this.loss = loss;
		this.accuracy = accuracy;
		this.samples = samples;
	}

	/**
	 * @param lossSum sum of batch losses, each weighted by its batch size
	 */
	public static EpochStats of(double lossSum, int correct, int samples) {
		if (samples == 0)
			throw new IllegalStateException("No samples seen, cannot compute loss and accuracy");
		return new EpochStats(lossSum / samples, (double) correct / samples, samples);
	}

	@Override
	public String toString() {
		return String.format("loss %.4f, acc %.4f", loss, accuracy);
	}
}
