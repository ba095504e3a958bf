package emgnet;

import java.io.File;
import java.io.IOException;

import org.apache.log4j.Logger;

import emgnet.data.Sample;
import emgnet.data.SampleStore;
import emgnet.nnet.Checkpoint;
import emgnet.nnet.EmgNet;
import emgnet.utils.SupervisedUtils;

// Usage: EmgEvaluate [config.json]
public class EmgEvaluate {

	private static Logger log = Logger.getLogger(EmgEvaluate.class);

	public static void main(String[] args) throws IOException {
		Config c = args.length > 0 ? Config.read(new File(args[0])) : new Config();
		c.validate();

		Checkpoint cp = Checkpoint.read(new File(c.checkpointFile));
		log.info(String.format("Checkpoint from epoch %d, Val Acc=%.4f", cp.epoch, cp.valAccuracy));

		SampleStore val = EmgTrain.buildStores(c, EmgTrain.readRecordings(c))[1];
		int[][] confusion = evaluate(cp.toNet(), val);
		log.info(String.format("Accuracy: %.4f", SupervisedUtils.getAccuracy(confusion)));
		log.info("Confusion matrix (rows true, columns predicted):\n" + SupervisedUtils.toString(confusion));
	}

	public static int[][] evaluate(EmgNet net, SampleStore store) {
		int[] desired = new int[store.size()];
		int[] predicted = new int[store.size()];
		for (int i = 0; i < store.size(); i++) {
			Sample s = store.get(i);
			desired[i] = s.classIndex;
			predicted[i] = net.predict(s.window);
		}
		return SupervisedUtils.getConfusionMatrix(desired, predicted, net.getNumClasses());
	}
}
