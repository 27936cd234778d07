package flexibleBatchProduction.construct;

import com.google.ortools.modelbuilder.LinearArgument;
import com.google.ortools.modelbuilder.LinearExpr;
import com.google.ortools.modelbuilder.Variable;

import flexibleBatchProduction.construct.IndexedConstraint.Sense;

/**
 * Linearization of {@code |x|}: a signed quantity x is written as
 * {@code positive - negative} with both parts non-negative. Minimizing
 * {@code positive + negative} keeps at most one of them above zero, so the sum equals
 * {@code |x|} at the optimum.
 */
public final class AbsoluteValueSplit {

	private AbsoluteValueSplit() {
	}

	public static IndexedConstraint split(IndexedModel model, LinearArgument signed, Variable positive,
			Variable negative, String family, Object... index) {
		if (positive.getLowerBound() < 0 || negative.getLowerBound() < 0) {
			throw new IllegalArgumentException("Split parts of " + family + " must be non-negative variables");
		}
		LinearExpr parts = LinearExpr.newBuilder().add(positive).addTerm(negative, -1.0).build();
		return model.addConstr(parts, Sense.EQUAL, signed, family, index);
	}

	/** Expression {@code positive + negative}, i.e. |x| at the optimum. */
	public static LinearExpr magnitude(Variable positive, Variable negative) {
		return LinearExpr.newBuilder().add(positive).add(negative).build();
	}
}
