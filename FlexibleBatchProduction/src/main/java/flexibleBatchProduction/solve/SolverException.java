package flexibleBatchProduction.solve;

/**
 * Failure of the solver itself (license, environment, API error), as opposed to an
 * infeasible or unbounded model, which is reported as a {@link SolverStatus}.
 */
public class SolverException extends Exception {

	private static final long serialVersionUID = 1L;

	public SolverException(String message) {
		super(message);
	}

	public SolverException(String message, Throwable cause) {
		super(message, cause);
	}
}
