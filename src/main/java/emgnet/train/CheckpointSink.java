package emgnet.train;

import java.io.IOException;

import emgnet.nnet.EmgNet;

public interface CheckpointSink {

	public void save(EmgNet net, int epoch, double valAccuracy) throws IOException;

	public String describe();
}
