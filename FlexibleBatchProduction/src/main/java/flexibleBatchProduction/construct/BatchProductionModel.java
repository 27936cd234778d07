package flexibleBatchProduction.construct;

import com.google.ortools.modelbuilder.ModelBuilder;

import java.util.List;

/**
 * A fully built batch production model: the frozen indexed model together with the index
 * domains, parameters and variables it was declared over.
 */
public class BatchProductionModel {
	private final IndexedModel indexedModel;
	private final IndexDomains domains;
	private final ModelParameters parameters;
	private final ModelVariables variables;
	private final ObjectiveType objectiveType;

	BatchProductionModel(IndexedModel indexedModel, IndexDomains domains, ModelParameters parameters,
			ModelVariables variables, ObjectiveType objectiveType) {
		this.indexedModel = indexedModel;
		this.domains = domains;
		this.parameters = parameters;
		this.variables = variables;
		this.objectiveType = objectiveType;
	}

	public IndexedModel getIndexedModel() {
		return indexedModel;
	}

	/** Solver-side copy of the model; see {@link IndexedModel#copyModelBuilder()}. */
	public ModelBuilder copyModelBuilder() {
		return indexedModel.copyModelBuilder();
	}

	public IndexDomains getDomains() {
		return domains;
	}

	public ModelParameters getParameters() {
		return parameters;
	}

	public ModelVariables getVariables() {
		return variables;
	}

	public ObjectiveType getObjectiveType() {
		return objectiveType;
	}

	public List<ExportEntry> exportParameters() {
		return parameters.export(domains);
	}
}
