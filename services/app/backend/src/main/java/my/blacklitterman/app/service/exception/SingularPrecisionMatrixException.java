package my.blacklitterman.app.service.exception;

import java.util.List;

public class SingularPrecisionMatrixException extends RuntimeException {
	private final List<String> viewIds;

	public SingularPrecisionMatrixException(List<String> viewIds, Throwable cause) {
		super("Black-Litterman precision matrix is singular for views " + viewIds, cause);
		this.viewIds = viewIds == null ? List.of() : List.copyOf(viewIds);
	}

	public List<String> getViewIds() {
		return viewIds;
	}
}
