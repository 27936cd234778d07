package flexibleBatchProduction.solve;

import java.util.Map;
import java.util.Optional;

/**
 * Solver control: optional time limit [s], optional relative MIP gap and solver log output.
 */
public class SolverSettings {

	public static final String TIME_LIMIT_VARIABLE = "OPTIMIZATION_TIME_LIMIT";
	public static final String MIP_GAP_VARIABLE = "OPTIMIZATION_MIP_GAP";
	public static final String VERBOSE_VARIABLE = "OPTIMIZATION_VERBOSE";

	private Double timeLimit;
	private Double mipGap;
	private boolean verbose;

	public SolverSettings() {
	}

	public SolverSettings(Double timeLimit, Double mipGap, boolean verbose) {
		setTimeLimit(timeLimit);
		setMipGap(mipGap);
		this.verbose = verbose;
	}

	/**
	 * Reads the settings from environment variables, e.g. {@code System.getenv()}. Variables
	 * that are absent or blank leave the default in place.
	 *
	 * @throws IllegalArgumentException if a variable is set to a malformed number
	 */
	public static SolverSettings fromEnvironment(Map<String, String> environment) {
		SolverSettings settings = new SolverSettings();
		settings.setTimeLimit(parseDouble(environment, TIME_LIMIT_VARIABLE));
		settings.setMipGap(parseDouble(environment, MIP_GAP_VARIABLE));
		String verbose = environment.get(VERBOSE_VARIABLE);
		if (verbose != null && !verbose.trim().isEmpty()) {
			settings.setVerbose(Boolean.parseBoolean(verbose.trim()));
		}
		return settings;
	}

	private static Double parseDouble(Map<String, String> environment, String name) {
		String value = environment.get(name);
		if (value == null || value.trim().isEmpty()) {
			return null;
		}
		try {
			return Double.valueOf(value.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(name + " is not a number: " + value, e);
		}
	}

	public Optional<Double> getTimeLimit() {
		return Optional.ofNullable(timeLimit);
	}

	public void setTimeLimit(Double timeLimit) {
		if (timeLimit != null && !(timeLimit > 0)) {
			throw new IllegalArgumentException("Time limit must be positive, got " + timeLimit);
		}
		this.timeLimit = timeLimit;
	}

	public Optional<Double> getMipGap() {
		return Optional.ofNullable(mipGap);
	}

	public void setMipGap(Double mipGap) {
		if (mipGap != null && !(mipGap >= 0)) {
			throw new IllegalArgumentException("MIP gap must not be negative, got " + mipGap);
		}
		this.mipGap = mipGap;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

	@Override
	public String toString() {
		return "SolverSettings[timeLimit=" + timeLimit + ", mipGap=" + mipGap + ", verbose=" + verbose + "]";
	}
}
