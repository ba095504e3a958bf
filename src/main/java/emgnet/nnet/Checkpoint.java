package emgnet.nnet;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

public class Checkpoint {

	public int numChannels;
	public int numClasses;
	public double dropout;
	public int seReduction;

	public int epoch;
	public double valAccuracy;

	public Map<String, double[]> state = new LinkedHashMap<String, double[]>();

	public static Checkpoint of(EmgNet net, int epoch, double valAccuracy) {
		Checkpoint cp = new Checkpoint();
		cp.numChannels = net.getNumChannels();
		cp.numClasses = net.getNumClasses();
		cp.dropout = net.getDropout();
		cp.seReduction = net.getSeReduction();
		cp.epoch = epoch;
		cp.valAccuracy = valAccuracy;
		cp.state = net.getState();
		return cp;
	}

	public void write(File file) throws IOException {
		File parent = file.getAbsoluteFile().getParentFile();
		if (parent != null && !parent.exists() && !parent.mkdirs())
			throw new IOException("Cannot create " + parent);
		new ObjectMapper().writeValue(file, this);
	}

	public static Checkpoint read(File file) throws IOException {
		return new ObjectMapper().readValue(file, Checkpoint.class);
	}

	// fresh network of the stored architecture with the stored state
	public EmgNet toNet() {
		EmgNet net = new EmgNet(numChannels, numClasses, dropout, seReduction, 0);
		net.setState(state);
		net.setMode(Mode.EVAL);
		return net;
	}
}
