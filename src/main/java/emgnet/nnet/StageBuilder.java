package emgnet.nnet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class StageBuilder {

	/**
	 * The first block changes width and resolution, the remaining ones keep both.
	 */
	public static List<BlockSpec> stage(int in, int out, int blocks, int stride) {
		if (blocks < 1)
			throw new IllegalArgumentException("A stage needs at least one block");

		List<BlockSpec> l = new ArrayList<BlockSpec>();
		l.add(new BlockSpec(in, out, stride));
		for (int i = 1; i < blocks; i++)
			l.add(new BlockSpec(out, out, 1));
		return Collections.unmodifiableList(l);
	}
}
