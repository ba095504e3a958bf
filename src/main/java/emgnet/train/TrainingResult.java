package emgnet.train;

import java.util.Collections;
import java.util.List;

public class TrainingResult {

	public final List<EpochReport> history;
	public final double bestAccuracy;
	public final int bestEpoch, checkpoints;

	public TrainingResult(List<EpochReport> history, double bestAccuracy, int bestEpoch, int checkpoints) {
		this.history = Collections.unmodifiableList(history);
		this.bestAccuracy = bestAccuracy;
		this.bestEpoch = bestEpoch;
		this.checkpoints = checkpoints;
	}
}
