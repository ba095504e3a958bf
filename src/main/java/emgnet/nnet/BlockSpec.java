package emgnet.nnet;

public final class BlockSpec {

	public final int in, out, stride;

	public BlockSpec(int in, int out, int stride) {
		this.in = in;
		this.out = out;
		this.stride = stride;
	}

	public boolean needsProjection() {
		return in != out || stride != 1;
	}

	@Override
	public String toString() {
		return in + "->" + out + (stride != 1 ? "/" + stride : "");
	}
}
