package emgnet;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Map.Entry;

import org.apache.log4j.Logger;

import emgnet.augment.Augmenter;
import emgnet.data.DataIntegrityException;
import emgnet.data.Recording;
import emgnet.data.SampleStore;
import emgnet.filter.BandpassFilter;
import emgnet.nnet.Adam;
import emgnet.nnet.EmgNet;
import emgnet.train.FileCheckpointSink;
import emgnet.train.Trainer;
import emgnet.train.TrainingResult;
import emgnet.utils.DataUtils;
import emgnet.utils.SupervisedUtils;

// Usage: EmgTrain [config.json]
public class EmgTrain {

	private static Logger log = Logger.getLogger(EmgTrain.class);

	public static void main(String[] args) throws IOException {
		Config c = args.length > 0 ? Config.read(new File(args[0])) : new Config();
		c.validate();
		run(c);
	}

	public static TrainingResult run(Config c) throws IOException {
		List<Recording> recordings = readRecordings(c);
		SampleStore[] stores = buildStores(c, recordings);

		EmgNet net = new EmgNet(c.numChannels, c.numClasses, c.dropout, c.seReduction, c.seed);
		Adam adam = new Adam(net.getParams().values(), c.learningRate, c.weightDecay);
		Trainer trainer = new Trainer(net, adam, c.batchSize, c.seed, new FileCheckpointSink(new File(c.checkpointFile)));
		return trainer.fit(stores[0], stores[1], c.epochs);
	}

	public static List<Recording> readRecordings(Config c) throws IOException {
		File dir = new File(c.dataDir);
		List<File> files = DataUtils.listRecordings(dir);
		List<Recording> recordings = DataUtils.readRecordings(files, c.numChannels);
		if (recordings.isEmpty())
			throw new DataIntegrityException("No recordings found below " + dir);
		log.info("Loaded " + recordings.size() + " recordings from " + files.size() + " files");
		return recordings;
	}

	/**
	 * Filtered training (augmenting) and validation store, split by the configured fraction and seed.
	 */
	public static SampleStore[] buildStores(Config c, List<Recording> recordings) {
		BandpassFilter filter = new BandpassFilter(c.samplingRate, c.lowCut, c.highCut, c.filterOrder);
		SampleStore all = new SampleStore(DataUtils.getWindows(recordings, c.windowLength), DataUtils.getLabels(recordings), c.numClasses, filter, null);

		Entry<List<Integer>, List<Integer>> split = SupervisedUtils.getTrainTestSplit(all.size(), c.testFraction, c.seed);
		SampleStore train = all.subset(DataUtils.toArray(split.getKey()), Augmenter.fromConfig(c, c.seed));
		SampleStore val = all.subset(DataUtils.toArray(split.getValue()), null);
		log.info("Train: " + train.size() + ", validation: " + val.size());
		return new SampleStore[] { train, val };
	}
}
