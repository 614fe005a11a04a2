package my.blacklitterman.app.service.exception;

public class CalibrationNonConvergenceException extends RuntimeException {
	private final String viewId;
	private final Double variance;

	public CalibrationNonConvergenceException(String viewId, String message, Double variance, Throwable cause) {
		super("Variance calibration failed for view " + viewId + ": " + message, cause);
		this.viewId = viewId;
		this.variance = variance;
	}

	public String getViewId() {
		return viewId;
	}

	public Double getVariance() {
		return variance;
	}
}
