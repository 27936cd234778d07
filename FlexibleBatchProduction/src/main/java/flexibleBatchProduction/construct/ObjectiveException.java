package flexibleBatchProduction.construct;

/**
 * Unknown objective token.
 */
public class ObjectiveException extends ModelConstructionException {

	private static final long serialVersionUID = 1L;

	public ObjectiveException(String message) {
		super(message);
	}
}
