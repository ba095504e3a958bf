package emgnet.data;

public class Batch {

	public final double[][][] x; // [batch][channel][time]
	public final int[] y;

	public Batch(double[][][] x, int[] y) {
		this.x = x;
		this.y = y;
	}

	public int size() {
		return y.length;
	}
}
