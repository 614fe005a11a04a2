package my.blacklitterman.app.domain;

import my.blacklitterman.app.service.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LabeledMatrixTest {
	@Test
	void permutesRowsAndColumnsTogether() {
		LabeledMatrix matrix = LabeledMatrix.square(List.of("A", "B"), new double[][]{
				{0.04, 0.01},
				{0.01, 0.09}
		});

		LabeledMatrix aligned = matrix.alignTo(List.of("B", "A"), List.of("B", "A"));

		assertThat(aligned.get(0, 0)).isEqualTo(0.09);
		assertThat(aligned.get("A", "A")).isEqualTo(0.04);
		assertThat(aligned.get("A", "B")).isEqualTo(0.01);
	}

	@Test
	void rejectsMissingColumn() {
		LabeledMatrix matrix = LabeledMatrix.square(List.of("A", "B"), new double[][]{
				{0.04, 0.01},
				{0.01, 0.09}
		});

		assertThatThrownBy(() -> matrix.alignTo(List.of("A", "B"), List.of("A", "B", "C")))
				.isInstanceOf(DimensionMismatchException.class)
				.hasMessageContaining("columns");
	}

	@Test
	void buildsDiagonal() {
		LabeledMatrix diagonal = LabeledMatrix.diagonal(List.of("v1", "v2"), new double[]{0.2, 0.3});

		assertThat(diagonal.get("v1", "v1")).isEqualTo(0.2);
		assertThat(diagonal.get("v2", "v2")).isEqualTo(0.3);
		assertThat(diagonal.get("v1", "v2")).isZero();
	}

	@Test
	void allowsZeroRowsButNotLinearAlgebraOnThem() {
		LabeledMatrix empty = new LabeledMatrix(List.of(), List.of("A", "B"), new double[0][]);

		assertThat(empty.rowCount()).isZero();
		assertThat(empty.columnCount()).isEqualTo(2);
		assertThat(empty.isEmpty()).isTrue();
		assertThatThrownBy(empty::toRealMatrix).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void rejectsRaggedRows() {
		assertThatThrownBy(() -> new LabeledMatrix(List.of("v1"), List.of("A", "B"), new double[][]{{1.0}}))
				.isInstanceOf(DimensionMismatchException.class);
	}

	@Test
	void selectsSubmatrix() {
		LabeledMatrix matrix = LabeledMatrix.square(List.of("A", "B", "C"), new double[][]{
				{1, 2, 3},
				{4, 5, 6},
				{7, 8, 9}
		});

		LabeledMatrix selected = matrix.select(List.of("C", "A"), List.of("B"));

		assertThat(selected.toArray()).isDeepEqualTo(new double[][]{{8}, {2}});
	}
}
