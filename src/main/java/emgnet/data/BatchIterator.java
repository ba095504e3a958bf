package emgnet.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;

public class BatchIterator implements Iterator<Batch> {

	private SampleStore store;
	private List<Integer> order;
	private int batchSize, numBatches, next = 0;

	public BatchIterator(SampleStore store, int batchSize, boolean dropLast, Random shuffle) {
		if (batchSize < 1)
			throw new IllegalArgumentException("Batch size must be at least 1: " + batchSize);
		this.store = store;
		this.batchSize = batchSize;

		order = new ArrayList<Integer>();
		for (int i = 0; i < store.size(); i++)
			order.add(i);
		if (shuffle != null)
			Collections.shuffle(order, shuffle);

		numBatches = dropLast ? store.size() / batchSize : (store.size() + batchSize - 1) / batchSize;
		if (numBatches == 0)
			throw new IllegalStateException("No batch of size " + batchSize + " from " + store.size() + " samples" + (dropLast ? " (incomplete batches dropped)" : ""));
	}

	public static BatchIterator training(SampleStore store, int batchSize, Random r) {
		return new BatchIterator(store, batchSize, true, r);
	}

	public static BatchIterator evaluation(SampleStore store, int batchSize) {
		return new BatchIterator(store, batchSize, false, null);
	}

	public int getNumBatches() {
		return numBatches;
	}

	@Override
	public boolean hasNext() {
		return next < numBatches;
	}

	@Override
	public Batch next() {
		if (!hasNext())
			throw new NoSuchElementException();

		int from = next * batchSize;
		int to = Math.min(from + batchSize, order.size());
		next++;

		double[][][] x = new double[to - from][][];
		int[] y = new int[to - from];
		for (int i = from; i < to; i++) {
			Sample s = store.get(order.get(i));
			x[i - from] = s.window;
			y[i - from] = s.classIndex;
		}
		return new Batch(x, y);
	}
}
