package my.blacklitterman.app.domain;

import my.blacklitterman.app.service.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dense vector whose entries are addressed by unique labels (asset ids or view ids).
 * Instances are immutable.
 */
public final class LabeledVector {
	private final String name;
	private final List<String> labels;
	private final double[] values;
	private final Map<String, Integer> positions;

	public LabeledVector(String name, List<String> labels, double[] values) {
		Objects.requireNonNull(labels, "labels");
		Objects.requireNonNull(values, "values");
		if (labels.size() != values.length) {
			throw new DimensionMismatchException("Vector labels and values differ in length",
					labels, List.of(String.valueOf(values.length)));
		}
		this.name = name;
		this.labels = List.copyOf(labels);
		this.values = values.clone();
		this.positions = indexLabels(this.labels);
	}

	public LabeledVector(List<String> labels, double[] values) {
		this(null, labels, values);
	}

	public static LabeledVector fromMap(String name, Map<String, Double> entries) {
		List<String> labels = new ArrayList<>(entries.size());
		double[] values = new double[entries.size()];
		int i = 0;
		for (Map.Entry<String, Double> entry : entries.entrySet()) {
			labels.add(entry.getKey());
			values[i++] = entry.getValue() == null ? Double.NaN : entry.getValue();
		}
		return new LabeledVector(name, labels, values);
	}

	public static LabeledVector fromMap(Map<String, Double> entries) {
		return fromMap(null, entries);
	}

	public static LabeledVector of(List<String> labels, RealVector vector) {
		return new LabeledVector(labels, vector.toArray());
	}

	public String name() {
		return name;
	}

	public LabeledVector withName(String newName) {
		return new LabeledVector(newName, labels, values);
	}

	public List<String> labels() {
		return labels;
	}

	public int size() {
		return values.length;
	}

	public boolean isEmpty() {
		return values.length == 0;
	}

	public boolean contains(String label) {
		return positions.containsKey(label);
	}

	public double get(String label) {
		Integer position = positions.get(label);
		if (position == null) {
			throw new DimensionMismatchException("Unknown label " + label, labels, List.of(label));
		}
		return values[position];
	}

	public double get(int position) {
		return values[position];
	}

	public double[] toArray() {
		return values.clone();
	}

	public RealVector toRealVector() {
		return new ArrayRealVector(values);
	}

	public Map<String, Double> toMap() {
		Map<String, Double> map = new LinkedHashMap<>();
		for (int i = 0; i < values.length; i++) {
			map.put(labels.get(i), values[i]);
		}
		return map;
	}

	/**
	 * Reorders the entries to follow {@code targetLabels}. The label sets must be equal;
	 * entries are never dropped or filled in.
	 */
	public LabeledVector alignTo(List<String> targetLabels) {
		if (labels.equals(targetLabels)) {
			return this;
		}
		requireSameLabels(name == null ? "Vector" : "Vector " + name, targetLabels, labels);
		double[] aligned = new double[targetLabels.size()];
		for (int i = 0; i < targetLabels.size(); i++) {
			aligned[i] = values[positions.get(targetLabels.get(i))];
		}
		return new LabeledVector(name, targetLabels, aligned);
	}

	public LabeledVector subtract(LabeledVector other) {
		LabeledVector aligned = other.alignTo(labels);
		double[] result = new double[values.length];
		for (int i = 0; i < values.length; i++) {
			result[i] = values[i] - aligned.values[i];
		}
		return new LabeledVector(name, labels, result);
	}

	public LabeledVector add(LabeledVector other) {
		LabeledVector aligned = other.alignTo(labels);
		double[] result = new double[values.length];
		for (int i = 0; i < values.length; i++) {
			result[i] = values[i] + aligned.values[i];
		}
		return new LabeledVector(name, labels, result);
	}

	public LabeledVector scale(double factor) {
		double[] result = new double[values.length];
		for (int i = 0; i < values.length; i++) {
			result[i] = values[i] * factor;
		}
		return new LabeledVector(name, labels, result);
	}

	public double sum() {
		double total = 0.0d;
		for (double value : values) {
			total += value;
		}
		return total;
	}

	public double sumOfSquares() {
		double total = 0.0d;
		for (double value : values) {
			total += value * value;
		}
		return total;
	}

	static Map<String, Integer> indexLabels(List<String> labels) {
		Map<String, Integer> index = new HashMap<>();
		for (int i = 0; i < labels.size(); i++) {
			String label = labels.get(i);
			if (label == null) {
				throw new IllegalArgumentException("Labels must not be null");
			}
			if (index.put(label, i) != null) {
				throw new IllegalArgumentException("Duplicate label " + label);
			}
		}
		return Map.copyOf(index);
	}

	static void requireSameLabels(String what, Collection<String> expected, Collection<String> actual) {
		if (expected.size() != actual.size() || !new HashSet<>(expected).equals(new HashSet<>(actual))) {
			throw new DimensionMismatchException(what + " is not aligned",
					List.copyOf(expected), List.copyOf(actual));
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof LabeledVector other)) {
			return false;
		}
		return Objects.equals(name, other.name) && labels.equals(other.labels) && Arrays.equals(values, other.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, labels, Arrays.hashCode(values));
	}

	@Override
	public String toString() {
		return "LabeledVector{name=" + name + ", values=" + toMap() + "}";
	}
}
