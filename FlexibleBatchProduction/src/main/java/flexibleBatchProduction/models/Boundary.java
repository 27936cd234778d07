package flexibleBatchProduction.models;

import java.util.Objects;

/**
 * Load jump boundary: overshooting {@code limit} would be penalised with {@code penalty}
 * per MW. Boundaries are carried through the model and exported but no constraint uses
 * them yet.
 */
public class Boundary {
	private final String id;
	private final double limit;
	private final double penalty;

	public Boundary(String id, double limit, double penalty) {
		this.id = Objects.requireNonNull(id);
		this.limit = limit;
		this.penalty = penalty;
	}

	public String getId() {
		return id;
	}

	public double getLimit() {
		return limit;
	}

	public double getPenalty() {
		return penalty;
	}
}
