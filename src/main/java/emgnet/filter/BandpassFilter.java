package emgnet.filter;

import java.util.Arrays;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.log4j.Logger;

/**
 * Butterworth band-pass filter applied forward and backward, so the output has no phase shift against
 * the input.
 * <p>
 * The transfer function is designed from the analog low-pass prototype, transformed to a band-pass around
 * the pre-warped cut-offs and discretized by the bilinear transform. A filter of order n has 2n+1
 * coefficients in numerator and denominator. Before filtering the signal is extended at both ends by an
 * odd reflection of 3(2n+1) samples and the filter state is started from its step-response steady state,
 * which keeps the edges free of transients.
 */
public class BandpassFilter {

	private static Logger log = Logger.getLogger(BandpassFilter.class);

	private double fs, lowCut, highCut;
	private int order;

	private double[] b, a, zi;

	public BandpassFilter(double fs, double lowCut, double highCut, int order) {
		if (!(fs > 0))
			throw new IllegalArgumentException("Sampling rate must be positive: " + fs);
		if (order < 1)
			throw new IllegalArgumentException("Filter order must be at least 1: " + order);
		if (!(lowCut > 0 && lowCut < highCut && highCut < fs / 2))
			throw new IllegalArgumentException("Need 0 < lowCut < highCut < fs/2, got lowCut=" + lowCut + ", highCut=" + highCut + ", fs=" + fs);
		this.fs = fs;
		this.lowCut = lowCut;
		this.highCut = highCut;
		this.order = order;

		design();
		zi = steadyState(b, a);
		log.debug("b: " + Arrays.toString(b));
		log.debug("a: " + Arrays.toString(a));
	}

	private void design() {
		double nyq = fs / 2;
		// pre-warp, normalized frequencies with sampling rate 2
		double w1 = 4 * Math.tan(Math.PI * (lowCut / nyq) / 2);
		double w2 = 4 * Math.tan(Math.PI * (highCut / nyq) / 2);
		double bw = w2 - w1;
		double wo = Math.sqrt(w1 * w2);

		// analog low-pass prototype
		Complex[] proto = new Complex[order];
		for (int i = 0; i < order; i++) {
			int m = -order + 1 + 2 * i;
			proto[i] = new Complex(0, Math.PI * m / (2.0 * order)).exp().negate();
		}

		// low-pass to band-pass, n zeros at the origin and 2n poles
		Complex[] poles = new Complex[2 * order];
		Complex wo2 = new Complex(wo * wo);
		for (int i = 0; i < order; i++) {
			Complex p = proto[i].multiply(bw / 2);
			Complex s = p.multiply(p).subtract(wo2).sqrt();
			poles[i] = p.add(s);
			poles[order + i] = p.subtract(s);
		}
		double k = Math.pow(bw, order);

		// bilinear transform
		double fs2 = 4;
		Complex[] zPoles = new Complex[2 * order];
		Complex den = Complex.ONE;
		for (int i = 0; i < poles.length; i++) {
			zPoles[i] = new Complex(fs2).add(poles[i]).divide(new Complex(fs2).subtract(poles[i]));
			den = den.multiply(new Complex(fs2).subtract(poles[i]));
		}
		Complex[] zZeros = new Complex[2 * order];
		for (int i = 0; i < order; i++) {
			zZeros[i] = Complex.ONE; // origin maps to z=1
			zZeros[order + i] = Complex.ONE.negate(); // infinity maps to z=-1
		}
		k *= new Complex(Math.pow(fs2, order)).divide(den).getReal();

		b = poly(zZeros);
		for (int i = 0; i < b.length; i++)
			b[i] *= k;
		a = poly(zPoles);
	}

	// real coefficients of prod(x - r), highest power first
	private static double[] poly(Complex[] roots) {
		Complex[] c = new Complex[roots.length + 1];
		c[0] = Complex.ONE;
		for (int i = 1; i < c.length; i++)
			c[i] = Complex.ZERO;
		for (int i = 0; i < roots.length; i++)
			for (int j = i + 1; j >= 1; j--)
				c[j] = c[j].subtract(roots[i].multiply(c[j - 1]));

		double[] r = new double[c.length];
		for (int i = 0; i < c.length; i++)
			r[i] = c[i].getReal();
		return r;
	}

	// initial state for which a unit step input produces a constant output
	private static double[] steadyState(double[] b, double[] a) {
		int n = a.length - 1;
		RealMatrix m = new Array2DRowRealMatrix(n, n);
		for (int i = 0; i < n; i++) {
			m.setEntry(i, i, 1);
			m.addToEntry(i, 0, a[i + 1]);
			if (i + 1 < n)
				m.addToEntry(i, i + 1, -1);
		}
		double[] rhs = new double[n];
		for (int i = 0; i < n; i++)
			rhs[i] = b[i + 1] - a[i + 1] * b[0];
		return new LUDecomposition(m).getSolver().solve(new ArrayRealVector(rhs)).toArray();
	}

	/**
	 * Direct form II transposed, a[0] is assumed to be 1.
	 */
	private double[] lfilter(double[] x, double scale) {
		int n = a.length;
		double[] z = new double[n - 1];
		for (int i = 0; i < z.length; i++)
			z[i] = zi[i] * scale;

		double[] y = new double[x.length];
		for (int t = 0; t < x.length; t++) {
			y[t] = b[0] * x[t] + z[0];
			for (int i = 0; i < n - 2; i++)
				z[i] = z[i + 1] + b[i + 1] * x[t] - a[i + 1] * y[t];
			z[n - 2] = b[n - 1] * x[t] - a[n - 1] * y[t];
		}
		return y;
	}

	public int getPadLength() {
		return 3 * Math.max(a.length, b.length);
	}

	public double[] filter(double[] x) {
		int edge = getPadLength();
		if (x.length <= edge)
			throw new SignalTooShortException(x.length, edge);

		int len = x.length;
		double[] ext = new double[len + 2 * edge];
		for (int i = 0; i < edge; i++) {
			ext[i] = 2 * x[0] - x[edge - i];
			ext[edge + len + i] = 2 * x[len - 1] - x[len - 2 - i];
		}
		System.arraycopy(x, 0, ext, edge, len);

		double[] y = lfilter(ext, ext[0]);
		reverse(y);
		y = lfilter(y, y[0]);
		reverse(y);

		double[] r = Arrays.copyOfRange(y, edge, edge + len);
		for (double d : r)
			if (Double.isNaN(d) || Double.isInfinite(d))
				throw new IllegalStateException("Filter became unstable (order " + order + ", " + lowCut + "-" + highCut + "Hz)");
		return r;
	}

	/**
	 * Filters each channel of a [channel][time] window.
	 */
	public double[][] filter(double[][] window) {
		double[][] r = new double[window.length][];
		for (int c = 0; c < window.length; c++)
			r[c] = filter(window[c]);
		return r;
	}

	private static void reverse(double[] d) {
		for (int i = 0, j = d.length - 1; i < j; i++, j--) {
			double tmp = d[i];
			d[i] = d[j];
			d[j] = tmp;
		}
	}

	public double[] getB() {
		return b.clone();
	}

	public double[] getA() {
		return a.clone();
	}
}
