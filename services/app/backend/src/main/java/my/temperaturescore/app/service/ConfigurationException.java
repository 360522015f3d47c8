package my.temperaturescore.app.service;

/**
 * Invalid or unsupported configuration value. Raised before any computation starts.
 */
public class ConfigurationException extends IllegalArgumentException {
	private final String field;
	private final String value;

	public ConfigurationException(String field, String value, String reason) {
		super("Invalid " + field + " '" + value + "': " + reason);
		this.field = field;
		this.value = value;
	}

	public String getField() {
		return field;
	}

	public String getValue() {
		return value;
	}
}
