package flexibleBatchProduction.solve;

/**
 * Outcome of a solve. A status is reported, never thrown.
 */
public enum SolverStatus {
	OPTIMAL,
	SUBOPTIMAL,
	INFEASIBLE,
	UNBOUNDED,
	INFEASIBLE_OR_UNBOUNDED,
	TIME_LIMIT,
	OTHER;

	public boolean isOptimal() {
		return this == OPTIMAL;
	}
}
