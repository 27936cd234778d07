package flexibleBatchProduction.construct;

/**
 * Objectives the batch production model can be optimized for, selected by token.
 */
public enum ObjectiveType {

	/** Maximize market revenue minus grid purchase cost and demand rate. */
	MAX_PROFIT("max_profit", true),

	/** Minimize the mean absolute deviation of the power exchange from its mean or goal load. */
	STABILITY("stability", false),

	/** Minimize the summed absolute load jumps between consecutive steps. */
	MIN_LOAD_JUMPS("min_load_jumps", false);

	private final String token;
	private final boolean maximize;

	ObjectiveType(String token, boolean maximize) {
		this.token = token;
		this.maximize = maximize;
	}

	public String getToken() {
		return token;
	}

	public boolean isMaximize() {
		return maximize;
	}

	public static ObjectiveType fromToken(String token) throws ObjectiveException {
		for (ObjectiveType type : values()) {
			if (type.token.equals(token)) {
				return type;
			}
		}
		throw new ObjectiveException("Unknown objective '" + token + "', expected one of max_profit, stability, "
				+ "min_load_jumps");
	}
}
