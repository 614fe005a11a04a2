package my.blacklitterman.app.service.exception;

import java.util.List;

public class DimensionMismatchException extends RuntimeException {
	private final List<String> expected;
	private final List<String> actual;

	public DimensionMismatchException(String message, List<String> expected, List<String> actual) {
		super(message + " (expected=" + expected + ", actual=" + actual + ")");
		this.expected = expected == null ? List.of() : List.copyOf(expected);
		this.actual = actual == null ? List.of() : List.copyOf(actual);
	}

	public List<String> getExpected() {
		return expected;
	}

	public List<String> getActual() {
		return actual;
	}
}
