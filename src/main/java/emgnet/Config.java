package emgnet;

import java.io.File;
import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;

// unknown json keys are rejected, missing ones keep their defaults
public class Config {

	// data
	public String dataDir = "data";
	public String checkpointFile = "best_model.json";
	public int numChannels = 4;
	public int numClasses = 10;
	public int windowLength = 3000; // 0 keeps the recorded length

	// bandpass
	public double samplingRate = 1000;
	public double lowCut = 20;
	public double highCut = 450;
	public int filterOrder = 4;

	// augmentation
	public int maxShift = 100;
	public double noiseLevel = 0.02;
	public double scaleMin = 0.9;
	public double scaleMax = 1.1;
	public double offsetMin = -0.1;
	public double offsetMax = 0.1;
	public double augmentProbability = 0.5;

	// network and training
	public double dropout = 0.3;
	public int seReduction = 8;
	public int batchSize = 16;
	public double learningRate = 1e-3;
	public double weightDecay = 1e-4;
	public int epochs = 50;

	// split
	public double testFraction = 0.2;
	public long seed = 42;

	public static Config read(File file) throws IOException {
		Config c = new ObjectMapper().readValue(file, Config.class);
		c.validate();
		return c;
	}

	public void write(File file) throws IOException {
		new ObjectMapper().writerWithDefaultPrettyPrinter().writeValue(file, this);
	}

	public void validate() {
		check(numChannels >= 1, "numChannels must be at least 1");
		check(numClasses >= 2, "numClasses must be at least 2");
		check(windowLength >= 0, "windowLength must not be negative");
		check(samplingRate > 0, "samplingRate must be positive");
		check(lowCut > 0 && lowCut < highCut && highCut < samplingRate / 2, "need 0 < lowCut < highCut < samplingRate/2");
		check(filterOrder >= 1, "filterOrder must be at least 1");
		check(maxShift >= 0, "maxShift must not be negative");
		check(noiseLevel >= 0, "noiseLevel must not be negative");
		check(scaleMin <= scaleMax, "scaleMin must not exceed scaleMax");
		check(offsetMin <= offsetMax, "offsetMin must not exceed offsetMax");
		check(augmentProbability >= 0 && augmentProbability <= 1, "augmentProbability must be in [0,1]");
		check(dropout >= 0 && dropout < 1, "dropout must be in [0,1)");
		check(seReduction >= 1, "seReduction must be at least 1");
		check(batchSize >= 1, "batchSize must be at least 1");
		check(learningRate > 0, "learningRate must be positive");
		check(weightDecay >= 0, "weightDecay must not be negative");
		check(epochs >= 1, "epochs must be at least 1");
		check(testFraction > 0 && testFraction < 1, "testFraction must be in (0,1)");
		check(dataDir != null && checkpointFile != null, "dataDir and checkpointFile must be set");
	}

	private static void check(boolean ok, String msg) {
		if (!ok)
			throw new IllegalArgumentException("Invalid configuration: " + msg);
	}
}
