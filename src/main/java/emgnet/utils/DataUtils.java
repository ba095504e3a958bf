package emgnet.utils;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import emgnet.data.DataIntegrityException;
import emgnet.data.Recording;

public class DataUtils {

	private static Logger log = Logger.getLogger(DataUtils.class);

	public static final String SAMPLE_ID = "sample_id", TIME_INDEX = "time_index", LABEL = "label";

	/**
	 * All csv files below dir, sorted by path.
	 */
	public static List<File> listRecordings(File dir) throws IOException {
		if (!dir.isDirectory())
			throw new IOException("Not a directory: " + dir);
		List<File> r = new ArrayList<File>();
		collectCSV(dir, r);
		Collections.sort(r);
		return r;
	}

	private static void collectCSV(File dir, List<File> r) throws IOException {
		File[] files = dir.listFiles();
		if (files == null)
			throw new IOException("Cannot list " + dir);
		for (File f : files)
			if (f.isDirectory())
				collectCSV(f, r);
			else if (f.isFile() && f.getName().toLowerCase().endsWith(".csv"))
				r.add(f);
	}

	public static List<Recording> readRecordings(List<File> files, int numChannels) throws IOException {
		List<Recording> r = new ArrayList<Recording>();
		for (File f : files)
			r.addAll(readRecordings(f, numChannels));
		log.debug("Read " + r.size() + " recordings from " + files.size() + " files");
		return r;
	}

	/**
	 * Reads rows of sample_id, time_index, ch1..chN, label and groups them by sample_id, in order of first
	 * appearance. Rows of one sample are ordered by time_index. Lines starting with # are skipped.
	 *
	 * @throws DataIntegrityException if the rows of one sample carry different labels or repeat a
	 *             time_index, if a label is no integer or a row is malformed
	 */
	public static List<Recording> readRecordings(File file, int numChannels) throws IOException {
		Map<String, List<double[]>> rows = new LinkedHashMap<String, List<double[]>>();
		Map<String, Integer> labels = new LinkedHashMap<String, Integer>();
		Map<String, Set<Double>> times = new HashMap<String, Set<Double>>();

		BufferedReader reader = null;
		try {
			reader = new BufferedReader(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8));
			// header handling
			String header = null;
			while ((header = reader.readLine()) != null)
				// skip comments
				if (!header.startsWith("#") && !header.trim().isEmpty())
					break;
			if (header == null)
				throw new DataIntegrityException("No header in " + file);

			List<String> names = new ArrayList<String>();
			for (String h : header.split(","))
				names.add(h.trim());
			int idIdx = column(names, SAMPLE_ID, file);
			int timeIdx = column(names, TIME_INDEX, file);
			int labelIdx = column(names, LABEL, file);
			int[] chIdx = new int[numChannels];
			for (int c = 0; c < numChannels; c++)
				chIdx[c] = column(names, "ch" + (c + 1), file);

			String line = null;
			int lineNr = 1;
			while ((line = reader.readLine()) != null) {
				lineNr++;
				if (line.startsWith("#") || line.trim().isEmpty())
					continue;

				String[] data = line.split(",");
				if (data.length != names.size())
					throw new DataIntegrityException(file + ":" + lineNr + ": expected " + names.size() + " columns, got " + data.length);

				String id = data[idIdx].trim();
				double[] d = new double[numChannels + 1];
				int label;
				try {
					d[0] = Double.parseDouble(data[timeIdx]);
					for (int c = 0; c < numChannels; c++)
						d[c + 1] = Double.parseDouble(data[chIdx[c]]);
					label = Integer.parseInt(data[labelIdx].trim());
				} catch (NumberFormatException e) {
					throw new DataIntegrityException(file + ":" + lineNr + ": " + e.getMessage(), e);
				}

				Integer known = labels.get(id);
				if (known == null)
					labels.put(id, label);
				else if (known != label)
					throw new DataIntegrityException("Sample " + id + " in " + file + " has conflicting labels " + known + " and " + label + " (line " + lineNr + ")");

				if (!rows.containsKey(id)) {
					rows.put(id, new ArrayList<double[]>());
					times.put(id, new HashSet<Double>());
				}
				if (!times.get(id).add(d[0]))
					throw new DataIntegrityException("Sample " + id + " in " + file + " repeats time_index " + data[timeIdx].trim() + " (line " + lineNr + ")");
				rows.get(id).add(d);
			}
		} finally {
			if (reader != null)
				reader.close();
		}

		List<Recording> r = new ArrayList<Recording>();
		for (Map.Entry<String, List<double[]>> e : rows.entrySet()) {
			List<double[]> l = e.getValue();
			Collections.sort(l, new Comparator<double[]>() {
				@Override
				public int compare(double[] a, double[] b) {
					return Double.compare(a[0], b[0]);
				}
			});

			double[][] w = new double[numChannels][l.size()];
			for (int t = 0; t < l.size(); t++)
				for (int c = 0; c < numChannels; c++)
					w[c][t] = l.get(t)[c + 1];
			r.add(new Recording(e.getKey(), labels.get(e.getKey()), w));
		}
		return r;
	}

	private static int column(List<String> names, String name, File file) {
		int i = names.indexOf(name);
		if (i < 0)
			throw new DataIntegrityException("Column " + name + " missing in " + file + ", header is " + names);
		return i;
	}

	/**
	 * Crops or zero-pads every channel to length.
	 */
	public static double[][] fitLength(double[][] window, int length) {
		double[][] r = new double[window.length][];
		for (int c = 0; c < window.length; c++)
			r[c] = Arrays.copyOf(window[c], length);
		return r;
	}

	public static List<double[][]> getWindows(List<Recording> recordings, int length) {
		List<double[][]> r = new ArrayList<double[][]>();
		for (Recording rec : recordings)
			r.add(length > 0 ? fitLength(rec.window, length) : rec.window);
		return r;
	}

	public static int[] getLabels(List<Recording> recordings) {
		int[] r = new int[recordings.size()];
		for (int i = 0; i < r.length; i++)
			r[i] = recordings.get(i).label;
		return r;
	}

	public static int[] toArray(List<Integer> l) {
		int[] r = new int[l.size()];
		for (int i = 0; i < r.length; i++)
			r[i] = l.get(i);
		return r;
	}
}
