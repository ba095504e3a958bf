package emgnet.nnet;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.Test;

import emgnet.nnet.activation.Sigmoid;

/**
 * Compares backward passes against central differences of f(x) = sum(forward(x) * r) for a fixed random r.
 */
public class GradientCheckTest {

	private static final double H = 1e-6, TOL = 1e-5;

	private static double[][][] random(Random r, int b, int c, int t) {
		double[][][] x = new double[b][c][t];
		for (double[][] xb : x)
			for (double[] xc : xb)
				for (int i = 0; i < xc.length; i++)
					xc[i] = r.nextGaussian();
		return x;
	}

	private static double objective(Layer l, double[][][] x, double[][][] w) {
		double[][][] y = l.forward(x);
		double s = 0;
		for (int b = 0; b < y.length; b++)
			for (int c = 0; c < y[b].length; c++)
				for (int t = 0; t < y[b][c].length; t++)
					s += y[b][c][t] * w[b][c][t];
		return s;
	}

	private static void check(Layer l, double[][][] x) {
		Random r = new Random(17);
		double[][][] y = l.forward(x);
		double[][][] w = random(r, y.length, y[0].length, y[0][0].length);

		Map<String, Param> params = new LinkedHashMap<String, Param>();
		l.collectParams("", params);
		for (Param p : params.values())
			p.zeroGrad();

		l.forward(x);
		double[][][] dx = l.backward(w);

		for (int b = 0; b < x.length; b++)
			for (int c = 0; c < x[b].length; c++)
				for (int t = 0; t < x[b][c].length; t++) {
					double old = x[b][c][t];
					x[b][c][t] = old + H;
					double plus = objective(l, x, w);
					x[b][c][t] = old - H;
					double minus = objective(l, x, w);
					x[b][c][t] = old;
					double num = (plus - minus) / (2 * H);
					assertEquals(num, dx[b][c][t], TOL * Math.max(1, Math.abs(num)), "input [" + b + "][" + c + "][" + t + "]");
				}

		for (Map.Entry<String, Param> e : params.entrySet()) {
			Param p = e.getValue();
			for (int i = 0; i < p.size(); i++) {
				double old = p.w[i];
				p.w[i] = old + H;
				double plus = objective(l, x, w);
				p.w[i] = old - H;
				double minus = objective(l, x, w);
				p.w[i] = old;
				double num = (plus - minus) / (2 * H);
				assertEquals(num, p.g[i], TOL * Math.max(1, Math.abs(num)), e.getKey() + "[" + i + "]");
			}
		}
	}

	@Test
	public void stridedPaddedConvolution() {
		Random r = new Random(1);
		check(new Conv1d(3, 4, 7, 2, 3, true, r), random(r, 2, 3, 13));
	}

	@Test
	public void pointwiseConvolution() {
		Random r = new Random(2);
		check(new Conv1d(3, 5, 1, 2, 0, false, r), random(r, 2, 3, 9));
	}

	@Test
	public void batchNormTraining() {
		Random r = new Random(3);
		BatchNorm1d bn = new BatchNorm1d(3);
		check(bn, random(r, 3, 3, 6));
	}

	@Test
	public void batchNormEvaluation() {
		Random r = new Random(4);
		BatchNorm1d bn = new BatchNorm1d(3);
		bn.forward(random(r, 4, 3, 6)); // move running statistics away from 0/1
		bn.setMode(Mode.EVAL);
		check(bn, random(r, 2, 3, 5));
	}

	@Test
	public void maxPool() {
		Random r = new Random(5);
		check(new MaxPool1d(3, 2, 1), random(r, 2, 2, 11));
	}

	@Test
	public void linearAndSigmoid() {
		Random r = new Random(6);
		check(new Sequential().add("fc", new Linear(5, 3, true, r)).add("act", new Activation(new Sigmoid())), random(r, 3, 5, 1));
	}

	@Test
	public void squeezeExcitation() {
		Random r = new Random(7);
		check(new SEGate(8, 4, r), random(r, 2, 8, 7));
	}

	@Test
	public void residualBlockWithProjection() {
		Random r = new Random(8);
		check(new ResidualSEBlock(new BlockSpec(3, 6, 2), 0, 2, r), random(r, 2, 3, 10));
	}

	@Test
	public void residualBlockWithIdentity() {
		Random r = new Random(9);
		check(new ResidualSEBlock(new BlockSpec(4, 4, 1), 0, 2, r), random(r, 2, 4, 8));
	}
}
