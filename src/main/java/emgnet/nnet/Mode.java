package emgnet.nnet;

public enum Mode {
	TRAIN, EVAL
}
