package emgnet.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashSet;
import java.util.List;
import java.util.Map.Entry;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class SupervisedUtilsTest {

	@Test
	public void splitIsDisjointAndComplete() {
		Entry<List<Integer>, List<Integer>> e = SupervisedUtils.getTrainTestSplit(100, 0.2, 42);
		assertEquals(80, e.getKey().size());
		assertEquals(20, e.getValue().size());

		Set<Integer> all = new HashSet<Integer>(e.getKey());
		all.addAll(e.getValue());
		assertEquals(100, all.size());
	}

	@Test
	public void splitIsReproducible() {
		assertEquals(SupervisedUtils.getTrainTestSplit(50, 0.3, 7).getValue(), SupervisedUtils.getTrainTestSplit(50, 0.3, 7).getValue());
		assertEquals(4, SupervisedUtils.getTrainTestSplit(11, 0.3, 7).getValue().size()); // rounded up
	}

	@Test
	public void splitNeedsBothParts() {
		assertThrows(IllegalArgumentException.class, () -> SupervisedUtils.getTrainTestSplit(1, 0.2, 0));
		assertThrows(IllegalArgumentException.class, () -> SupervisedUtils.getTrainTestSplit(10, 0, 0));
	}

	@Test
	public void confusionMatrixAndAccuracy() {
		int[][] m = SupervisedUtils.getConfusionMatrix(new int[] { 0, 0, 1, 2 }, new int[] { 0, 1, 1, 2 }, 3);
		assertEquals(1, m[0][0]);
		assertEquals(1, m[0][1]);
		assertEquals(1, m[1][1]);
		assertEquals(1, m[2][2]);
		assertEquals(0.75, SupervisedUtils.getAccuracy(m), 1e-12);
		assertThrows(IllegalStateException.class, () -> SupervisedUtils.getAccuracy(new int[2][2]));
	}

	@Test
	public void argMaxTakesFirstOfTies() {
		assertEquals(1, SupervisedUtils.argMax(new double[] { 0, 3, 3, -1 }));
	}
}
