package my.blacklitterman.app.settings;

import java.util.List;

public class ConfigurationException extends RuntimeException {
	private final List<String> errors;

	public ConfigurationException(List<String> errors) {
		this(errors, null);
	}

	public ConfigurationException(List<String> errors, Throwable cause) {
		super("Invalid calculation settings: " + String.join("; ", errors), cause);
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}
}
