package emgnet.nnet;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class Adam {

	private double lr, beta1 = 0.9, beta2 = 0.999, eps = 1e-8, weightDecay;
	private List<Param> params;
	private List<double[]> m, v;
	private int t = 0;

	public Adam(Collection<Param> params, double lr, double weightDecay) {
		if (lr <= 0)
			throw new IllegalArgumentException("Learning rate must be positive: " + lr);
		if (weightDecay < 0)
			throw new IllegalArgumentException("Weight decay must not be negative: " + weightDecay);
		this.lr = lr;
		this.weightDecay = weightDecay;
		this.params = new ArrayList<Param>(params);
		this.m = new ArrayList<double[]>();
		this.v = new ArrayList<double[]>();
		for (Param p : this.params) {
			m.add(new double[p.size()]);
			v.add(new double[p.size()]);
		}
	}

	public void step() {
		t++;
		double bc1 = 1.0 - Math.pow(beta1, t);
		double bc2 = 1.0 - Math.pow(beta2, t);
		for (int i = 0; i < params.size(); i++) {
			Param p = params.get(i);
			double[] mi = m.get(i), vi = v.get(i);
			for (int j = 0; j < p.size(); j++) {
				double g = p.g[j] + weightDecay * p.w[j];
				mi[j] = beta1 * mi[j] + (1 - beta1) * g;
				vi[j] = beta2 * vi[j] + (1 - beta2) * g * g;
				p.w[j] -= lr * (mi[j] / bc1) / (Math.sqrt(vi[j] / bc2) + eps);
			}
		}
	}

	public int getStep() {
		return t;
	}

	public void zeroGrad() {
		for (Param p : params)
			p.zeroGrad();
	}
}
