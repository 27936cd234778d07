package flexibleBatchProduction.construct;

import flexibleBatchProduction.models.PlantInput;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link BatchProductionModel} from a plant input and an objective token. The
 * objective token, the index domains and all parameters are validated before the first
 * variable is declared; a failure leaves no model behind.
 */
public final class BatchProductionModelBuilder {

	private static final Logger LOGGER = LoggerFactory.getLogger(BatchProductionModelBuilder.class);

	private BatchProductionModelBuilder() {
	}

	public static BatchProductionModel build(PlantInput input, String objectiveToken)
			throws ModelConstructionException {
		return build(input, ObjectiveType.fromToken(objectiveToken));
	}

	public static BatchProductionModel build(PlantInput input, ObjectiveType objectiveType)
			throws ModelConstructionException {
		double[] generation = input.getGeneration();
		double[] price = input.getPrice();

		IndexDomains domains = IndexDomains.build(input.getConfiguration(), generation, price);
		ModelParameters params = ParameterLoader.load(input.getConfiguration(), generation, price);

		IndexedModel model = new IndexedModel();
		ModelVariables vars = ModelVariables.allocate(model, domains, params);
		new ConstraintAssembler(model, domains, params, vars).assemble();
		ObjectiveSelector.install(model, domains, vars, objectiveType);
		model.freeze();

		LOGGER.info("Built {} model over {} steps: {} variables ({} binary), {} constraints",
				objectiveType.getToken(), domains.getHorizon(), model.getNumVars(), model.getNumBinVars(),
				model.getNumConstrs());
		return new BatchProductionModel(model, domains, params, vars, objectiveType);
	}
}
