package my.blacklitterman.app.domain;

import my.blacklitterman.app.service.exception.DimensionMismatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An investor view: a linear combination of assets (the allocation) that is asserted to
 * return {@code outPerformance}, held with {@code confidence} between 0 (no conviction)
 * and 1 (full conviction).
 */
public record View(
		String id,
		String name,
		double confidence,
		double outPerformance,
		Map<String, Double> allocation
) {
	public View {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("View id is required");
		}
		if (Double.isNaN(confidence) || confidence < 0.0d || confidence > 1.0d) {
			throw new IllegalArgumentException("View " + id + " confidence must be between 0 and 1");
		}
		if (!Double.isFinite(outPerformance)) {
			throw new IllegalArgumentException("View " + id + " out-performance must be finite");
		}
		if (allocation == null || allocation.isEmpty()) {
			throw new IllegalArgumentException("View " + id + " allocation must not be empty");
		}
		Map<String, Double> copy = new LinkedHashMap<>();
		for (Map.Entry<String, Double> entry : allocation.entrySet()) {
			if (entry.getKey() == null || entry.getKey().isBlank()) {
				throw new IllegalArgumentException("View " + id + " allocation contains a blank asset id");
			}
			if (entry.getValue() == null || !Double.isFinite(entry.getValue())) {
				throw new IllegalArgumentException("View " + id + " allocation weight for " + entry.getKey() + " must be finite");
			}
			copy.put(entry.getKey(), entry.getValue());
		}
		allocation = Collections.unmodifiableMap(copy);
		if (name == null || name.isBlank()) {
			name = id;
		}
	}

	/**
	 * One-row view matrix for this view, columns in {@code assetUniverse} order. Assets the
	 * view does not mention get a zero weight.
	 */
	public LabeledMatrix getViewDataFrame(List<String> assetUniverse) {
		return new LabeledMatrix(List.of(id), assetUniverse, new double[][]{getViewRow(assetUniverse)});
	}

	double[] getViewRow(List<String> assetUniverse) {
		List<String> unknown = new ArrayList<>();
		for (String asset : allocation.keySet()) {
			if (!assetUniverse.contains(asset)) {
				unknown.add(asset);
			}
		}
		if (!unknown.isEmpty()) {
			throw new DimensionMismatchException("View " + id + " references assets outside the universe",
					assetUniverse, unknown);
		}
		double[] row = new double[assetUniverse.size()];
		for (int i = 0; i < assetUniverse.size(); i++) {
			row[i] = allocation.getOrDefault(assetUniverse.get(i), 0.0d);
		}
		return row;
	}
}
