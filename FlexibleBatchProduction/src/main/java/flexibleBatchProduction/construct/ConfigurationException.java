package flexibleBatchProduction.construct;

/**
 * A required parameter is absent or has an invalid value for the active switches.
 */
public class ConfigurationException extends ModelConstructionException {

	private static final long serialVersionUID = 1L;

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
