package emgnet.train;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.log4j.Logger;

import emgnet.data.Batch;
import emgnet.data.BatchIterator;
import emgnet.data.SampleStore;
import emgnet.nnet.Adam;
import emgnet.nnet.CrossEntropyLoss;
import emgnet.nnet.EmgNet;
import emgnet.nnet.Mode;
import emgnet.utils.SupervisedUtils;

/**
 * Fits an {@link EmgNet} for a fixed number of epochs and keeps the parameters with the best validation
 * accuracy.
 * <p>
 * Each epoch trains on shuffled full batches (an incomplete last batch is dropped) and then evaluates
 * the validation store once in stored order, including its last incomplete batch. Whenever validation
 * accuracy is strictly better than everything before, the network is handed to the
 * {@link CheckpointSink}. There is no early stopping and no learning rate schedule.
 */
public class Trainer {

	private static Logger log = Logger.getLogger(Trainer.class);

	private EmgNet net;
	private Adam optimizer;
	private CrossEntropyLoss loss = new CrossEntropyLoss();
	private int batchSize;
	private Random shuffle;
	private CheckpointSink sink;

	private double bestAccuracy;
	private int bestEpoch;

	public Trainer(EmgNet net, Adam optimizer, int batchSize, long seed, CheckpointSink sink) {
		if (batchSize < 1)
			throw new IllegalArgumentException("Batch size must be at least 1: " + batchSize);
		this.net = net;
		this.optimizer = optimizer;
		this.batchSize = batchSize;
		this.shuffle = new Random(seed);
		this.sink = sink;
	}

	public EpochStats trainEpoch(SampleStore train) {
		net.setMode(Mode.TRAIN);

		double lossSum = 0;
		int correct = 0, total = 0;
		BatchIterator it = BatchIterator.training(train, batchSize, shuffle);
		while (it.hasNext()) {
			Batch b = it.next();

			optimizer.zeroGrad();
			double[][] logits = net.forward(b.x);
			double l = loss.forward(logits, b.y);
			net.backward(loss.backward());
			optimizer.step();

			lossSum += l * b.size();
			correct += countCorrect(logits, b.y);
			total += b.size();
		}
		return EpochStats.of(lossSum, correct, total);
	}

	/**
	 * Loss and accuracy in evaluation mode, parameters are not touched.
	 */
	public EpochStats evaluate(SampleStore store) {
		net.setMode(Mode.EVAL);

		double lossSum = 0;
		int correct = 0, total = 0;
		BatchIterator it = BatchIterator.evaluation(store, batchSize);
		while (it.hasNext()) {
			Batch b = it.next();
			double[][] logits = net.forward(b.x);
			lossSum += loss.forward(logits, b.y) * b.size();
			correct += countCorrect(logits, b.y);
			total += b.size();
		}
		return EpochStats.of(lossSum, correct, total);
	}

	public TrainingResult fit(SampleStore train, SampleStore val, int epochs) throws IOException {
		if (epochs < 1)
			throw new IllegalArgumentException("Need at least one epoch: " + epochs);
		if (!train.isAugmenting())
			log.debug("Training store does not augment");
		if (val.isAugmenting())
			throw new IllegalArgumentException("Validation store must not augment");

		bestAccuracy = Double.NEGATIVE_INFINITY;
		bestEpoch = -1;
		int checkpoints = 0;

		log.info("Training " + net.getNumParams() + " parameters on " + train.size() + " samples, validating on " + val.size());
		List<EpochReport> history = new ArrayList<EpochReport>();
		for (int epoch = 1; epoch <= epochs; epoch++) {
			EpochStats tr = trainEpoch(train);
			EpochStats va = evaluate(val);

			boolean improved = va.accuracy > bestAccuracy;
			if (improved) {
				bestAccuracy = va.accuracy;
				bestEpoch = epoch;
			}
			EpochReport report = new EpochReport(epoch, tr, va, bestAccuracy, improved);
			history.add(report);
			log.info(report);

			if (improved && sink != null) {
				sink.save(net, epoch, va.accuracy);
				checkpoints++;
				log.info(String.format("New best model saved to %s (Val Acc=%.4f)", sink.describe(), va.accuracy));
			}
		}
		log.info(String.format("Best validation accuracy: %.4f (epoch %d)", bestAccuracy, bestEpoch));
		return new TrainingResult(history, bestAccuracy, bestEpoch, checkpoints);
	}

	private static int countCorrect(double[][] logits, int[] y) {
		int c = 0;
		for (int i = 0; i < y.length; i++)
			if (SupervisedUtils.argMax(logits[i]) == y[i])
				c++;
		return c;
	}
}
