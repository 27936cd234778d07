package flexibleBatchProduction.solve;

import com.google.ortools.modelbuilder.Variable;

import flexibleBatchProduction.construct.BatchProductionModel;
import flexibleBatchProduction.construct.ExportEntry;
import flexibleBatchProduction.construct.IndexedModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a solve: status, objective value and one value per declared variable, keyed by
 * the variable index. Values are only present when the solver found at least one feasible
 * solution.
 */
public class SolvedModel {
	private final BatchProductionModel model;
	private final SolverStatus status;
	private final Double objectiveValue;
	private final Map<Integer, Double> values;

	public SolvedModel(BatchProductionModel model, SolverStatus status, Double objectiveValue,
			Map<Integer, Double> values) {
		this.model = model;
		this.status = status;
		this.objectiveValue = objectiveValue;
		this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}

	public BatchProductionModel getModel() {
		return model;
	}

	public SolverStatus getStatus() {
		return status;
	}

	public boolean hasSolution() {
		return !values.isEmpty();
	}

	public Optional<Double> getObjectiveValue() {
		return Optional.ofNullable(objectiveValue);
	}

	public Map<Integer, Double> getValues() {
		return values;
	}

	public Optional<Double> getValue(Variable var) {
		return Optional.ofNullable(values.get(var.getIndex()));
	}

	/** Value of the variable {@code family} at {@code index}, if declared and solved. */
	public Optional<Double> getValue(String family, Object... index) {
		return model.getIndexedModel().getVariable(family, index).flatMap(this::getValue);
	}

	/**
	 * Sets, parameters and, when a solution exists, every variable value as flat entries.
	 */
	public List<ExportEntry> entries() {
		List<ExportEntry> entries = new ArrayList<>(model.exportParameters());
		IndexedModel indexedModel = model.getIndexedModel();
		for (Variable var : indexedModel.getVariables()) {
			Double value = values.get(var.getIndex());
			if (value != null) {
				entries.add(new ExportEntry(indexedModel.familyOf(var), indexedModel.indexOf(var), value));
			}
		}
		return entries;
	}
}
