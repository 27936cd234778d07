package flexibleBatchProduction.construct;

/**
 * Index data (equipment, virtual equipment, batch profiles, series lengths) is
 * inconsistent.
 */
public class DomainException extends ModelConstructionException {

	private static final long serialVersionUID = 1L;

	public DomainException(String message) {
		super(message);
	}
}
