package flexibleBatchProduction.construct;

import com.google.ortools.modelbuilder.LinearExpr;
import com.google.ortools.modelbuilder.Variable;

import java.util.List;

/**
 * Row of an {@link IndexedModel}, kept as {@code expression sense rhs} with every variable
 * on the left-hand side. The expression is the immutable OR-tools expression the row was
 * added with.
 */
public class IndexedConstraint {

	public enum Sense {
		LESS_EQUAL, GREATER_EQUAL, EQUAL
	}

	private final String family;
	private final List<Object> index;
	private final String name;
	private final LinearExpr expression;
	private final Sense sense;
	private final double rhs;
	private final int constraintIndex;

	IndexedConstraint(String family, List<Object> index, String name, LinearExpr expression, Sense sense, double rhs,
			int constraintIndex) {
		this.family = family;
		this.index = index;
		this.name = name;
		this.expression = expression;
		this.sense = sense;
		this.rhs = rhs;
		this.constraintIndex = constraintIndex;
	}

	public String getFamily() {
		return family;
	}

	public List<Object> getIndex() {
		return index;
	}

	public String getName() {
		return name;
	}

	public LinearExpr getExpression() {
		return expression;
	}

	/** Coefficient of {@code var} in the row, 0 when it does not appear. */
	public double getCoefficient(Variable var) {
		return IndexedModel.coefficient(expression, var);
	}

	/** Number of variables in the row. */
	public int size() {
		return expression.numElements();
	}

	public Sense getSense() {
		return sense;
	}

	public double getRhs() {
		return rhs;
	}

	/** Position of the row in the OR-tools model. */
	public int getConstraintIndex() {
		return constraintIndex;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(name).append(':');
		for (int i = 0; i < expression.numElements(); i++) {
			sb.append(' ').append(expression.getCoefficient(i)).append(" x").append(expression.getVariableIndex(i));
		}
		String op = sense == Sense.LESS_EQUAL ? "<=" : sense == Sense.GREATER_EQUAL ? ">=" : "=";
		return sb.append(' ').append(op).append(' ').append(rhs).toString();
	}
}
