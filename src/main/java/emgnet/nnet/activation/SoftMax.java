package emgnet.nnet.activation;

public class SoftMax {

	public double[] f(double[] x) {
		double max = Double.NEGATIVE_INFINITY;
		for( double d : x )
			max = Math.max(max, d);

		double[] r = new double[x.length];
		double sum = 0;
		for( int i = 0; i < x.length; i++ ) {
			r[i] = Math.exp(x[i] - max); // shifted, exp can't overflow
			sum += r[i];
		}
		for( int i = 0; i < r.length; i++ )
			r[i] /= sum;
		return r;
	}

	public double logF(double[] x, int i) {
		double max = Double.NEGATIVE_INFINITY;
		for( double d : x )
			max = Math.max(max, d);
		double sum = 0;
		for( double d : x )
			sum += Math.exp(d - max);
		return x[i] - max - Math.log(sum);
	}

	// cross-entropy cost model, derivative w.r.t. the input scores
	public double[] fDevFOut(double[] out, int target ) {
		double[] r = new double[out.length];
		for( int i = 0; i < out.length; i++ )
			r[i] = out[i] - (i == target ? 1.0 : 0.0);
		return r;
	}
}
