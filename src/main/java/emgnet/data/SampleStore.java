package emgnet.data;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import emgnet.augment.Augmenter;
import emgnet.filter.BandpassFilter;

/**
 * Conditioned windows with their zero-based class indices.
 * <p>
 * Windows are filtered once at construction and never changed afterwards. A store built with an
 * {@link Augmenter} hands out a freshly augmented copy on every {@link #get(int)}, one built without
 * hands out plain copies. This is fixed for the life of the store, training and evaluation use separate
 * stores.
 */
public class SampleStore {

	private static Logger log = Logger.getLogger(SampleStore.class);

	private List<double[][]> windows;
	private int[] classIdx;
	private int numClasses;
	private Augmenter augmenter;

	/**
	 * @param labels 1-based labels in [1, numClasses]
	 * @param filter applied to every channel, may be null for already conditioned signals
	 * @param augmenter null for a store without augmentation
	 */
	public SampleStore(List<double[][]> signals, int[] labels, int numClasses, BandpassFilter filter, Augmenter augmenter) {
		if (signals.size() != labels.length)
			throw new DataIntegrityException("Got " + signals.size() + " signals but " + labels.length + " labels");

		this.numClasses = numClasses;
		this.augmenter = augmenter;
		this.windows = new ArrayList<double[][]>(signals.size());
		this.classIdx = new int[labels.length];

		int channels = -1, length = -1;
		for (int i = 0; i < labels.length; i++) {
			if (labels[i] < 1 || labels[i] > numClasses)
				throw new DataIntegrityException("Label " + labels[i] + " of sample " + i + " outside [1," + numClasses + "]");
			classIdx[i] = labels[i] - 1;

			double[][] w = signals.get(i);
			checkShape(w, i);
			if (i == 0) {
				channels = w.length;
				length = w[0].length;
			} else if (w.length != channels || w[0].length != length)
				throw new DataIntegrityException("Sample " + i + " is " + w.length + "x" + w[0].length + ", expected " + channels + "x" + length);

			windows.add(filter == null ? Augmenter.copy(w) : filter.filter(w));
		}
		log.debug("Store with " + windows.size() + " samples, augmenting: " + isAugmenting());
	}

	private SampleStore(List<double[][]> windows, int[] classIdx, int numClasses, Augmenter augmenter) {
		this.windows = windows;
		this.classIdx = classIdx;
		this.numClasses = numClasses;
		this.augmenter = augmenter;
	}

	private static void checkShape(double[][] w, int i) {
		if (w.length == 0)
			throw new DataIntegrityException("Sample " + i + " has no channels");
		for (int c = 1; c < w.length; c++)
			if (w[c].length != w[0].length)
				throw new DataIntegrityException("Sample " + i + ": channel " + c + " has length " + w[c].length + ", channel 0 has " + w[0].length);
	}

	/**
	 * Store over the given entries, sharing the conditioned windows without filtering them again.
	 */
	public SampleStore subset(int[] indices, Augmenter augmenter) {
		List<double[][]> w = new ArrayList<double[][]>(indices.length);
		int[] c = new int[indices.length];
		for (int i = 0; i < indices.length; i++) {
			w.add(windows.get(indices[i]));
			c[i] = classIdx[indices[i]];
		}
		return new SampleStore(w, c, numClasses, augmenter);
	}

	public int size() {
		return windows.size();
	}

	public Sample get(int i) {
		double[][] w = windows.get(i);
		return new Sample(augmenter == null ? Augmenter.copy(w) : augmenter.apply(w), classIdx[i]);
	}

	public int getClassIndex(int i) {
		return classIdx[i];
	}

	public int getNumClasses() {
		return numClasses;
	}

	public boolean isAugmenting() {
		return augmenter != null;
	}
}
