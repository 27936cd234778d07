package flexibleBatchProduction.construct;

import com.google.ortools.Loader;
import com.google.ortools.modelbuilder.LinearArgument;
import com.google.ortools.modelbuilder.LinearConstraint;
import com.google.ortools.modelbuilder.LinearExpr;
import com.google.ortools.modelbuilder.LinearExprBuilder;
import com.google.ortools.modelbuilder.ModelBuilder;
import com.google.ortools.modelbuilder.Variable;

import flexibleBatchProduction.construct.IndexedConstraint.Sense;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OR-tools {@link ModelBuilder} whose variables and constraints are grouped in named
 * families and indexed by tuples, the way the batch production model declares them.
 * Names read {@code family(i,j,k)}, or just {@code family} for scalars.
 * <p>
 * Freezing takes a snapshot of the model. Solvers receive copies of that snapshot through
 * {@link #copyModelBuilder()}, so nothing done to a copy, or to a variable handle, reaches
 * the model that later solves start from.
 */
public class IndexedModel {

	static {
		Loader.loadNativeLibraries();
	}

	public static final double INFINITY = Double.POSITIVE_INFINITY;

	private final ModelBuilder builder = new ModelBuilder();
	private final List<Variable> variables = new ArrayList<>();
	private final List<IndexedConstraint> constraints = new ArrayList<>();
	private final Map<String, List<Variable>> variableFamilies = new LinkedHashMap<>();
	private final Map<String, List<IndexedConstraint>> constraintFamilies = new LinkedHashMap<>();
	private final Map<String, Variable> variablesByName = new HashMap<>();
	private final Map<String, IndexedConstraint> constraintsByName = new HashMap<>();
	private final Map<Integer, String> familyByVariable = new HashMap<>();
	private final Map<Integer, List<Object>> indexByVariable = new HashMap<>();
	private int numBinVars;
	private LinearExpr objective;
	private boolean maximize;
	private ModelBuilder snapshot;

	static String qualifiedName(String family, List<Object> index) {
		if (index.isEmpty()) {
			return family;
		}
		StringBuilder sb = new StringBuilder(family).append('(');
		for (int i = 0; i < index.size(); i++) {
			if (i > 0) {
				sb.append(',');
			}
			sb.append(index.get(i));
		}
		return sb.append(')').toString();
	}

	/** Sum of the coefficients of {@code var} in {@code expr}. */
	public static double coefficient(LinearExpr expr, Variable var) {
		double coeff = 0.0;
		for (int i = 0; i < expr.numElements(); i++) {
			if (expr.getVariableIndex(i) == var.getIndex()) {
				coeff += expr.getCoefficient(i);
			}
		}
		return coeff;
	}

	public Variable addVar(String family, double lowerBound, double upperBound, boolean integral, Object... index) {
		checkNotFrozen();
		if (lowerBound > upperBound) {
			throw new IllegalArgumentException("Lower bound above upper bound for variable " + family);
		}
		List<Object> key = Collections.unmodifiableList(Arrays.asList(index.clone()));
		String name = qualifiedName(family, key);
		if (variablesByName.containsKey(name)) {
			throw new IllegalArgumentException("Duplicate variable " + name);
		}
		Variable var = builder.newVar(lowerBound, upperBound, integral, name);
		variablesByName.put(name, var);
		variables.add(var);
		variableFamilies.computeIfAbsent(family, f -> new ArrayList<>()).add(var);
		familyByVariable.put(var.getIndex(), family);
		indexByVariable.put(var.getIndex(), key);
		if (integral && lowerBound >= 0 && upperBound <= 1) {
			numBinVars++;
		}
		return var;
	}

	public Variable addBinary(String family, Object... index) {
		return addVar(family, 0, 1, true, index);
	}

	public Variable addNonNegative(String family, Object... index) {
		return addVar(family, 0, INFINITY, false, index);
	}

	public Variable addFree(String family, Object... index) {
		return addVar(family, -INFINITY, INFINITY, false, index);
	}

	/**
	 * Adds {@code lhs sense rhs}. Both sides may hold variables and constants; variables are
	 * moved to the left and constants to the right before the row reaches the model.
	 */
	public IndexedConstraint addConstr(LinearArgument lhs, Sense sense, LinearArgument rhs, String family,
			Object... index) {
		checkNotFrozen();
		List<Object> key = Collections.unmodifiableList(Arrays.asList(index.clone()));
		String name = qualifiedName(family, key);
		if (constraintsByName.containsKey(name)) {
			throw new IllegalArgumentException("Duplicate constraint " + name);
		}

		LinearExpr difference = LinearExpr.newBuilder().addTerm(lhs, 1.0).addTerm(rhs, -1.0).build();
		LinearExprBuilder row = LinearExpr.newBuilder();
		for (int i = 0; i < difference.numElements(); i++) {
			if (difference.getCoefficient(i) != 0.0) {
				row.addTerm(builder.varFromIndex(difference.getVariableIndex(i)), difference.getCoefficient(i));
			}
		}
		LinearExpr expression = row.build();
		double rowRhs = -difference.getOffset();

		LinearConstraint added;
		switch (sense) {
		case LESS_EQUAL:
			added = builder.addLessOrEqual(expression, rowRhs);
			break;
		case GREATER_EQUAL:
			added = builder.addGreaterOrEqual(expression, rowRhs);
			break;
		case EQUAL:
			added = builder.addEquality(expression, rowRhs);
			break;
		default:
			throw new IllegalArgumentException("Unknown sense " + sense);
		}
		added.setName(name);

		IndexedConstraint constraint = new IndexedConstraint(family, key, name, expression, sense, rowRhs,
				added.getIndex());
		constraintsByName.put(name, constraint);
		constraints.add(constraint);
		constraintFamilies.computeIfAbsent(family, f -> new ArrayList<>()).add(constraint);
		return constraint;
	}

	public IndexedConstraint addConstr(LinearArgument lhs, Sense sense, double rhs, String family, Object... index) {
		return addConstr(lhs, sense, LinearExpr.newBuilder().add(rhs), family, index);
	}

	public void setObjective(LinearArgument expression, boolean maximize) {
		checkNotFrozen();
		this.objective = expression.build();
		this.maximize = maximize;
		builder.optimize(objective, maximize);
	}

	public boolean hasObjective() {
		return objective != null;
	}

	public Optional<LinearExpr> getObjective() {
		return Optional.ofNullable(objective);
	}

	public boolean isMaximize() {
		return maximize;
	}

	public void freeze() {
		checkNotFrozen();
		snapshot = builder.getClone();
	}

	public boolean isFrozen() {
		return snapshot != null;
	}

	/**
	 * Fresh copy of the frozen model. Variables keep their index, so
	 * {@code copy.varFromIndex(var.getIndex())} addresses the same variable in the copy.
	 */
	public ModelBuilder copyModelBuilder() {
		if (snapshot == null) {
			throw new IllegalStateException("Model is not frozen yet");
		}
		return snapshot.getClone();
	}

	public List<Variable> getVariables() {
		return Collections.unmodifiableList(variables);
	}

	public List<IndexedConstraint> getConstraints() {
		return Collections.unmodifiableList(constraints);
	}

	public List<Variable> getVariableFamily(String family) {
		return Collections.unmodifiableList(variableFamilies.getOrDefault(family, Collections.emptyList()));
	}

	public List<IndexedConstraint> getConstraintFamily(String family) {
		return Collections.unmodifiableList(constraintFamilies.getOrDefault(family, Collections.emptyList()));
	}

	public boolean hasVariableFamily(String family) {
		return variableFamilies.containsKey(family);
	}

	public boolean hasConstraintFamily(String family) {
		return constraintFamilies.containsKey(family);
	}

	public List<String> getConstraintFamilyNames() {
		return new ArrayList<>(constraintFamilies.keySet());
	}

	public Optional<Variable> getVariable(String family, Object... index) {
		return Optional.ofNullable(variablesByName.get(qualifiedName(family, Arrays.asList(index))));
	}

	public Optional<IndexedConstraint> getConstraint(String family, Object... index) {
		return Optional.ofNullable(constraintsByName.get(qualifiedName(family, Arrays.asList(index))));
	}

	/** Family a variable of this model was declared in. */
	public String familyOf(Variable var) {
		String family = familyByVariable.get(var.getIndex());
		if (family == null) {
			throw new IllegalArgumentException("Unknown variable " + var.getName());
		}
		return family;
	}

	/** Index tuple a variable of this model was declared with. */
	public List<Object> indexOf(Variable var) {
		List<Object> index = indexByVariable.get(var.getIndex());
		if (index == null) {
			throw new IllegalArgumentException("Unknown variable " + var.getName());
		}
		return index;
	}

	public int getNumVars() {
		return variables.size();
	}

	public int getNumBinVars() {
		return numBinVars;
	}

	public int getNumConstrs() {
		return constraints.size();
	}

	private void checkNotFrozen() {
		if (snapshot != null) {
			throw new IllegalStateException("Model is frozen");
		}
	}
}
