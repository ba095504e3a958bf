package emgnet.utils;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map.Entry;
import java.util.Random;

public class SupervisedUtils {

	/**
	 * Shuffled split into train (key) and test (value) indices. The test part gets ceil(n*testFraction)
	 * indices, both parts are non-empty.
	 */
	public static Entry<List<Integer>, List<Integer>> getTrainTestSplit(int numSamples, double testFraction, long seed) {
		if (testFraction <= 0 || testFraction >= 1)
			throw new IllegalArgumentException("testFraction must be in (0,1): " + testFraction);

		int numTest = (int) Math.ceil(numSamples * testFraction);
		if (numSamples < 2 || numTest >= numSamples)
			throw new IllegalArgumentException("Cannot split " + numSamples + " samples with test fraction " + testFraction);

		Random r = new Random(seed);
		List<Integer> l = new ArrayList<Integer>();
		for (int i = 0; i < numSamples; i++)
			l.add(i);
		Collections.shuffle(l, r);

		List<Integer> test = new ArrayList<Integer>(l.subList(0, numTest));
		List<Integer> train = new ArrayList<Integer>(l.subList(numTest, numSamples));
		return new AbstractMap.SimpleEntry<List<Integer>, List<Integer>>(train, test);
	}

	public static int argMax(double[] a) {
		int j = 0;
		for (int i = 1; i < a.length; i++)
			if (a[i] > a[j])
				j = i;
		return j;
	}

	// rows are true classes, columns predicted ones
	public static int[][] getConfusionMatrix(int[] desired, int[] predicted, int numClasses) {
		if (desired.length != predicted.length)
			throw new IllegalArgumentException("desired.length != predicted.length (" + desired.length + "!=" + predicted.length + ")");
		int[][] m = new int[numClasses][numClasses];
		for (int i = 0; i < desired.length; i++)
			m[desired[i]][predicted[i]]++;
		return m;
	}

	public static double getAccuracy(int[][] confusion) {
		int correct = 0, total = 0;
		for (int i = 0; i < confusion.length; i++)
			for (int j = 0; j < confusion[i].length; j++) {
				total += confusion[i][j];
				if (i == j)
					correct += confusion[i][j];
			}
		if (total == 0)
			throw new IllegalStateException("Accuracy of an empty confusion matrix");
		return (double) correct / total;
	}

	public static String toString(int[][] confusion) {
		StringBuilder sb = new StringBuilder();
		for (int[] row : confusion) {
			for (int j = 0; j < row.length; j++)
				sb.append(String.format("%5d", row[j]));
			sb.append("\n");
		}
		return sb.toString();
	}
}
