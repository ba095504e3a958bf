package emgnet.data;

public class Recording {

	public final String id;
	public final int label;
	public final double[][] window;

	public Recording(String id, int label, double[][] window) {
		this.id = id;
		this.label = label;
		this.window = window;
	}

	public int length() {
		return window.length == 0 ? 0 : window[0].length;
	}

	@Override
	public String toString() {
		return id + " (label " + label + ", " + window.length + "x" + length() + ")";
	}
}
