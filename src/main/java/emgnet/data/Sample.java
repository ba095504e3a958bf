package emgnet.data;

public class Sample {

	public final double[][] window;
	public final int classIndex; // zero-based

	public Sample(double[][] window, int classIndex) {
		this.window = window;
		this.classIndex = classIndex;
	}
}
