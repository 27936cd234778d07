package flexibleBatchProduction.models;

import java.util.Objects;

/**
 * Everything a model is built from: the plant configuration plus renewable generation
 * [MW] and electricity price [€/MWh], one value per time step.
 */
public class PlantInput {
	private final PlantConfiguration configuration;
	private final double[] generation;
	private final double[] price;

	public PlantInput(PlantConfiguration configuration, double[] generation, double[] price) {
		this.configuration = Objects.requireNonNull(configuration);
		this.generation = Objects.requireNonNull(generation).clone();
		this.price = Objects.requireNonNull(price).clone();
	}

	public PlantConfiguration getConfiguration() {
		return configuration;
	}

	public double[] getGeneration() {
		return generation.clone();
	}

	public double[] getPrice() {
		return price.clone();
	}
}
