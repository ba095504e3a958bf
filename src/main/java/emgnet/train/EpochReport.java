package emgnet.train;

public class EpochReport {

	public final int epoch; // 1-based
	public final EpochStats train, val;
	public final double bestAccuracy; // best validation accuracy up to and including this epoch
	public final boolean improved;

	public EpochReport(int epoch, EpochStats train, EpochStats val, double bestAccuracy, boolean improved) {
		this.epoch = epoch;
		this.train = train;
		this.val = val;
		this.bestAccuracy = bestAccuracy;
		this.improved = improved;
	}

	@Override
	public String toString() {
		return String.format("Epoch %d: Train Loss=%.4f, Train Acc=%.4f, Val Loss=%.4f, Val Acc=%.4f", epoch, train.loss, train.accuracy, val.loss, val.accuracy);
	}
}
