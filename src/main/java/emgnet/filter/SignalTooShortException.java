package emgnet.filter;

public class SignalTooShortException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final int length, minLength;

	public SignalTooShortException(int length, int minLength) {
		super("Signal of length " + length + " is too short, zero-phase filtering needs more than " + minLength + " samples");
		this.length = length;
		this.minLength = minLength;
	}

	public int getLength() {
		return length;
	}

	public int getMinLength() {
		return minLength;
	}
}
