package emgnet.data;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class BatchIteratorTest {

	// sample i carries the value i in every position
	private static SampleStore store(int n) {
		List<double[][]> l = new ArrayList<double[][]>();
		int[] labels = new int[n];
		for (int i = 0; i < n; i++) {
			double[][] w = new double[2][5];
			for (double[] ch : w)
				Arrays.fill(ch, i);
			l.add(w);
			labels[i] = i % 3 + 1;
		}
		return new SampleStore(l, labels, 3, null, null);
	}

	@Test
	public void trainingDropsIncompleteBatch() {
		BatchIterator it = BatchIterator.training(store(20), 16, new Random(1));
		assertEquals(1, it.getNumBatches());
		Batch b = it.next();
		assertEquals(16, b.size());
		assertEquals(16, b.x.length);
		assertFalse(it.hasNext());
	}

	@Test
	public void trainingShufflesWithoutRepetition() {
		BatchIterator it = BatchIterator.training(store(32), 8, new Random(2));
		Set<Integer> seen = new HashSet<Integer>();
		List<Integer> order = new ArrayList<Integer>();
		while (it.hasNext()) {
			Batch b = it.next();
			for (int i = 0; i < b.size(); i++) {
				int idx = (int) b.x[i][0][0];
				assertEquals(idx % 3, b.y[i]);
				seen.add(idx);
				order.add(idx);
			}
		}
		assertEquals(32, seen.size());
		boolean sorted = true;
		for (int i = 1; i < order.size(); i++)
			sorted &= order.get(i) > order.get(i - 1);
		assertFalse(sorted);
	}

	@Test
	public void evaluationKeepsOrderAndRemainder() {
		BatchIterator it = BatchIterator.evaluation(store(20), 16);
		assertEquals(2, it.getNumBatches());
		Batch first = it.next(), second = it.next();
		assertEquals(16, first.size());
		assertEquals(4, second.size());
		for (int i = 0; i < 16; i++)
			assertEquals(i, first.x[i][1][4], 0);
		for (int i = 0; i < 4; i++)
			assertEquals(16 + i, second.x[i][0][0], 0);
	}

	@Test
	public void emptyLoaderIsAnError() {
		assertThrows(IllegalStateException.class, () -> BatchIterator.training(store(10), 16, new Random(0)));
		assertThrows(IllegalStateException.class, () -> BatchIterator.evaluation(store(0), 16));
		assertThrows(IllegalArgumentException.class, () -> BatchIterator.evaluation(store(3), 0));
	}
}
