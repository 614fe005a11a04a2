package my.blacklitterman.app.service;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScalarMinimizerTest {
	@Test
	void gradientSearchFindsQuadraticMinimum() {
		ScalarMinimizer minimizer = new GradientScalarMinimizer(100, 10_000);

		double argument = minimizer.minimize(x -> (x - 3.0) * (x - 3.0) + 1.0, 0.1);

		assertThat(argument).isCloseTo(3.0, within(1e-6));
	}

	@Test
	void gradientSearchHandlesFlatObjective() {
		ScalarMinimizer minimizer = new GradientScalarMinimizer(100, 10_000);

		double argument = minimizer.minimize(x -> 0.0, 0.1);

		assertThat(argument).isCloseTo(0.1, within(1e-6));
	}

	@Test
	void gradientSearchReportsExhaustedIterationBudget() {
		ScalarMinimizer minimizer = new GradientScalarMinimizer(1, 10_000);

		assertThatThrownBy(() -> minimizer.minimize(x -> (x - 3.0) * (x - 3.0), 0.1))
				.isInstanceOf(MathIllegalStateException.class);
	}

	@Test
	void brentSearchFindsQuadraticMinimum() {
		ScalarMinimizer minimizer = new BrentScalarMinimizer(10_000);

		double argument = minimizer.minimize(x -> (x + 2.0) * (x + 2.0), 0.1);

		assertThat(argument).isCloseTo(-2.0, within(1e-6));
	}

	@Test
	void brentSearchReportsExhaustedEvaluationBudget() {
		ScalarMinimizer minimizer = new BrentScalarMinimizer(3);

		assertThatThrownBy(() -> minimizer.minimize(x -> -x, 0.1))
				.isInstanceOf(MathIllegalStateException.class);
	}

	@Test
	void rejectsNonPositiveBudgets() {
		assertThatThrownBy(() -> new GradientScalarMinimizer(0, 10))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new BrentScalarMinimizer(0))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
