package emgnet.data;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import emgnet.Config;
import emgnet.augment.Augmenter;
import emgnet.filter.BandpassFilter;

public class SampleStoreTest {

	private static List<double[][]> windows(int n, int channels, int len, long seed) {
		Random r = new Random(seed);
		List<double[][]> l = new ArrayList<double[][]>();
		for (int i = 0; i < n; i++) {
			double[][] w = new double[channels][len];
			for (int c = 0; c < channels; c++)
				for (int t = 0; t < len; t++)
					w[c][t] = r.nextGaussian();
			l.add(w);
		}
		return l;
	}

	@Test
	public void classIndexIsLabelMinusOne() {
		for (int k = 2; k <= 10; k++)
			for (int repeat = 0; repeat < 3; repeat++) {
				int[] labels = new int[k];
				for (int i = 0; i < k; i++)
					labels[i] = k - i;
				SampleStore s = new SampleStore(windows(k, 4, 40, repeat), labels, k, null, null);
				assertEquals(k, s.size());
				for (int i = 0; i < k; i++) {
					assertEquals(labels[i] - 1, s.getClassIndex(i));
					assertEquals(labels[i] - 1, s.get(i).classIndex);
				}
			}
	}

	@Test
	public void rejectsMismatchedCounts() {
		assertThrows(DataIntegrityException.class, () -> new SampleStore(windows(3, 4, 40, 0), new int[] { 1, 2 }, 10, null, null));
	}

	@Test
	public void rejectsLabelsOutsideRange() {
		assertThrows(DataIntegrityException.class, () -> new SampleStore(windows(2, 4, 40, 0), new int[] { 0, 1 }, 10, null, null));
		assertThrows(DataIntegrityException.class, () -> new SampleStore(windows(2, 4, 40, 0), new int[] { 1, 11 }, 10, null, null));
	}

	@Test
	public void rejectsRaggedWindows() {
		List<double[][]> l = windows(2, 4, 40, 0);
		l.get(1)[2] = new double[39];
		assertThrows(DataIntegrityException.class, () -> new SampleStore(l, new int[] { 1, 2 }, 10, null, null));

		List<double[][]> l2 = windows(1, 4, 40, 0);
		l2.addAll(windows(1, 4, 41, 0));
		assertThrows(DataIntegrityException.class, () -> new SampleStore(l2, new int[] { 1, 2 }, 10, null, null));
	}

	@Test
	public void filtersOnceAtConstruction() {
		List<double[][]> raw = windows(2, 4, 200, 3);
		BandpassFilter f = new BandpassFilter(1000, 20, 450, 4);
		SampleStore s = new SampleStore(raw, new int[] { 1, 2 }, 2, f, null);
		double[][] expected = f.filter(raw.get(1));
		for (int c = 0; c < 4; c++)
			assertArrayEquals(expected[c], s.get(1).window[c], 0);
	}

	@Test
	public void plainStoreReturnsCopies() {
		SampleStore s = new SampleStore(windows(1, 4, 40, 1), new int[] { 3 }, 10, null, null);
		assertFalse(s.isAugmenting());
		double[][] a = s.get(0).window;
		a[0][0] = 1e9;
		assertTrue(s.get(0).window[0][0] != 1e9);
	}

	@Test
	public void augmentingStoreLeavesOriginalIntact() {
		List<double[][]> raw = windows(1, 4, 300, 2);
		Config c = new Config();
		c.augmentProbability = 1.0;
		SampleStore aug = new SampleStore(raw, new int[] { 1 }, 10, null, Augmenter.fromConfig(c, 9));
		SampleStore plain = new SampleStore(raw, new int[] { 1 }, 10, null, null);
		assertTrue(aug.isAugmenting());

		double[][] first = aug.get(0).window;
		double[][] second = aug.get(0).window;
		assertFalse(Arrays.equals(first[0], second[0]));
		for (int ch = 0; ch < 4; ch++)
			assertArrayEquals(raw.get(0)[ch], plain.get(0).window[ch], 0);
	}

	@Test
	public void subsetKeepsLabelsAndSetsMode() {
		SampleStore s = new SampleStore(windows(5, 4, 40, 4), new int[] { 1, 2, 3, 4, 5 }, 5, null, null);
		SampleStore sub = s.subset(new int[] { 4, 0 }, Augmenter.fromConfig(new Config(), 1));
		assertEquals(2, sub.size());
		assertEquals(4, sub.getClassIndex(0));
		assertEquals(0, sub.getClassIndex(1));
		assertTrue(sub.isAugmenting());
		assertFalse(s.isAugmenting());
	}
}
