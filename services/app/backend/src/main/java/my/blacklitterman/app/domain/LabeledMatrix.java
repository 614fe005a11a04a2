package my.blacklitterman.app.domain;

import my.blacklitterman.app.service.exception.DimensionMismatchException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dense matrix with labeled rows and columns. A matrix may have zero rows, which is how
 * an empty view collection is represented.
 */
public final class LabeledMatrix {
	private final List<String> rowLabels;
	private final List<String> columnLabels;
	private final double[][] values;
	private final Map<String, Integer> rowPositions;
	private final Map<String, Integer> columnPositions;

	public LabeledMatrix(List<String> rowLabels, List<String> columnLabels, double[][] values) {
		Objects.requireNonNull(rowLabels, "rowLabels");
		Objects.requireNonNull(columnLabels, "columnLabels");
		Objects.requireNonNull(values, "values");
		if (values.length != rowLabels.size()) {
			throw new DimensionMismatchException("Matrix row labels and rows differ in length",
					rowLabels, List.of(String.valueOf(values.length)));
		}
		this.rowLabels = List.copyOf(rowLabels);
		this.columnLabels = List.copyOf(columnLabels);
		this.values = new double[values.length][];
		for (int i = 0; i < values.length; i++) {
			if (values[i] == null || values[i].length != columnLabels.size()) {
				throw new DimensionMismatchException("Matrix row " + rowLabels.get(i) + " has the wrong number of columns",
						columnLabels, List.of(String.valueOf(values[i] == null ? 0 : values[i].length)));
			}
			this.values[i] = values[i].clone();
		}
		this.rowPositions = LabeledVector.indexLabels(this.rowLabels);
		this.columnPositions = LabeledVector.indexLabels(this.columnLabels);
	}

	public static LabeledMatrix square(List<String> labels, double[][] values) {
		return new LabeledMatrix(labels, labels, values);
	}

	public static LabeledMatrix diagonal(List<String> labels, double[] diagonal) {
		if (labels.size() != diagonal.length) {
			throw new DimensionMismatchException("Diagonal labels and values differ in length",
					labels, List.of(String.valueOf(diagonal.length)));
		}
		double[][] values = new double[diagonal.length][diagonal.length];
		for (int i = 0; i < diagonal.length; i++) {
			values[i][i] = diagonal[i];
		}
		return new LabeledMatrix(labels, labels, values);
	}

	public static LabeledMatrix of(List<String> rowLabels, List<String> columnLabels, RealMatrix matrix) {
		return new LabeledMatrix(rowLabels, columnLabels, matrix.getData());
	}

	public List<String> rowLabels() {
		return rowLabels;
	}

	public List<String> columnLabels() {
		return columnLabels;
	}

	public int rowCount() {
		return values.length;
	}

	public int columnCount() {
		return columnLabels.size();
	}

	public boolean isEmpty() {
		return values.length == 0 || columnLabels.isEmpty();
	}

	public double get(String rowLabel, String columnLabel) {
		Integer row = rowPositions.get(rowLabel);
		Integer column = columnPositions.get(columnLabel);
		if (row == null || column == null) {
			throw new DimensionMismatchException("Unknown matrix entry (" + rowLabel + ", " + columnLabel + ")",
					rowLabels, List.of(String.valueOf(rowLabel), String.valueOf(columnLabel)));
		}
		return values[row][column];
	}

	public double get(int row, int column) {
		return values[row][column];
	}

	public LabeledVector row(String rowLabel) {
		Integer row = rowPositions.get(rowLabel);
		if (row == null) {
			throw new DimensionMismatchException("Unknown matrix row " + rowLabel, rowLabels, List.of(rowLabel));
		}
		return new LabeledVector(rowLabel, columnLabels, values[row]);
	}

	public double[][] toArray() {
		double[][] copy = new double[values.length][];
		for (int i = 0; i < values.length; i++) {
			copy[i] = values[i].clone();
		}
		return copy;
	}

	public RealMatrix toRealMatrix() {
		if (isEmpty()) {
			throw new IllegalStateException("Cannot build a linear-algebra matrix without rows or columns");
		}
		return new Array2DRowRealMatrix(values, true);
	}

	/**
	 * Permutes rows and columns into the requested order. Both label sets must match the
	 * existing ones exactly.
	 */
	public LabeledMatrix alignTo(List<String> targetRows, List<String> targetColumns) {
		if (rowLabels.equals(targetRows) && columnLabels.equals(targetColumns)) {
			return this;
		}
		LabeledVector.requireSameLabels("Matrix rows", targetRows, rowLabels);
		LabeledVector.requireSameLabels("Matrix columns", targetColumns, columnLabels);
		double[][] aligned = new double[targetRows.size()][targetColumns.size()];
		for (int i = 0; i < targetRows.size(); i++) {
			int sourceRow = rowPositions.get(targetRows.get(i));
			for (int j = 0; j < targetColumns.size(); j++) {
				aligned[i][j] = values[sourceRow][columnPositions.get(targetColumns.get(j))];
			}
		}
		return new LabeledMatrix(targetRows, targetColumns, aligned);
	}

	public LabeledMatrix select(List<String> keptRows, List<String> keptColumns) {
		double[][] selected = new double[keptRows.size()][keptColumns.size()];
		for (int i = 0; i < keptRows.size(); i++) {
			Integer sourceRow = rowPositions.get(keptRows.get(i));
			if (sourceRow == null) {
				throw new DimensionMismatchException("Unknown matrix row " + keptRows.get(i), rowLabels, keptRows);
			}
			for (int j = 0; j < keptColumns.size(); j++) {
				Integer sourceColumn = columnPositions.get(keptColumns.get(j));
				if (sourceColumn == null) {
					throw new DimensionMismatchException("Unknown matrix column " + keptColumns.get(j), columnLabels, keptColumns);
				}
				selected[i][j] = values[sourceRow][sourceColumn];
			}
		}
		return new LabeledMatrix(keptRows, keptColumns, selected);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof LabeledMatrix other)) {
			return false;
		}
		return rowLabels.equals(other.rowLabels)
				&& columnLabels.equals(other.columnLabels)
				&& java.util.Arrays.deepEquals(values, other.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(rowLabels, columnLabels, java.util.Arrays.deepHashCode(values));
	}

	@Override
	public String toString() {
		return "LabeledMatrix{rows=" + rowLabels + ", columns=" + columnLabels + "}";
	}
}
