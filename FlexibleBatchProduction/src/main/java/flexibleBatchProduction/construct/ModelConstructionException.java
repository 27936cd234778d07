package flexibleBatchProduction.construct;

/**
 * Raised when a batch production model cannot be built. Construction is all-or-nothing:
 * no partially built model is handed out after this exception.
 */
public class ModelConstructionException extends Exception {

	private static final long serialVersionUID = 1L;

	public ModelConstructionException(String message) {
		super(message);
	}

	public ModelConstructionException(String message, Throwable cause) {
		super(message, cause);
	}
}
