package emgnet.nnet.activation;

public interface Function {

	public double f(double x);

	// derivative, expressed through the output of f
	public double fDevFOut(double fOut);
}
