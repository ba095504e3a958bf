package emgnet.train;

import java.io.File;
import java.io.IOException;

import emgnet.nnet.Checkpoint;
import emgnet.nnet.EmgNet;

public class FileCheckpointSink implements CheckpointSink {

	private File file;

	public FileCheckpointSink(File file) {
		this.file = file;
	}

	@Override
	public void save(EmgNet net, int epoch, double valAccuracy) throws IOException {
		Checkpoint.of(net, epoch, valAccuracy).write(file);
	}

	@Override
	public String describe() {
		return file.getPath();
	}
}
