package flexibleBatchProduction.construct;

import flexibleBatchProduction.models.Boundary;
import flexibleBatchProduction.models.Equipment;
import flexibleBatchProduction.models.PlantConfiguration;
import flexibleBatchProduction.models.VirtualEquipment;

/**
 * Binds the configuration to {@link ModelParameters}. Every required value, including the
 * ones gated by {@code useStorageGoals}, {@code drawPowerFromGrid} and
 * {@code givenGoalLoad}, is checked here, before any variable or constraint exists.
 */
public final class ParameterLoader {

	private ParameterLoader() {
	}

	public static ModelParameters load(PlantConfiguration config, double[] generation, double[] price)
			throws ConfigurationException {
		ModelParameters params = new ModelParameters();

		params.minutesPerStep = require(config.getMinutesPerStep(), "minutes_per_step");
		if (params.minutesPerStep <= 0) {
			throw new ConfigurationException("minutes_per_step must be positive, got " + params.minutesPerStep);
		}
		params.steelDemand = require(config.getSteelDemand(), "steel_demand");

		params.maxCapacityElectrolyser = require(config.getMaxCapacityElectrolyser(), "max_capacity_electrolyser");
		params.minConsumptionElectrolyser = require(config.getMinConsumptionElectrolyser(),
				"min_consumption_electrolyser");
		if (params.minConsumptionElectrolyser > params.maxCapacityElectrolyser) {
			throw new ConfigurationException("min_consumption_electrolyser (" + params.minConsumptionElectrolyser
					+ ") exceeds max_capacity_electrolyser (" + params.maxCapacityElectrolyser + ")");
		}
		params.efficiencyElectrolyser = requirePositive(config.getEfficiencyElectrolyser(), "efficiency_electrolyser");
		params.capacityH2Tank = require(config.getCapacityH2Tank(), "capacity_h2_tank");
		params.initialH2TankFilling = require(config.getInitialH2TankFilling(), "initial_h2_tank_filling");
		if (params.initialH2TankFilling < 0 || params.initialH2TankFilling > 1) {
			throw new ConfigurationException(
					"initial_h2_tank_filling is a share of the tank capacity, got " + params.initialH2TankFilling);
		}
		params.initialDriContent = require(config.getInitialDriContent(), "DRI_init_content");
		params.h2MWhPerDri = requirePositive(config.getH2MWhPerDri(), "h2_MWh_per_DRI");

		params.fuelCellCapacity = require(config.getFuelCellCapacity(), "fuel_cell_capacity");
		params.fuelCellEfficiency = requirePositive(config.getFuelCellEfficiency(), "fuel_cell_efficiency");

		params.renewableGeneration = generation.clone();
		params.electricityPrice = price.clone();

		for (Equipment e : config.getEquipments()) {
			String id = e.getId();
			int pause = require(e.getPauseDuration(), "T_down[" + id + "]");
			if (pause < 0) {
				throw new ConfigurationException("T_down[" + id + "] must not be negative, got " + pause);
			}
			int rolling = require(e.getRollingDuration(), "rolling_duration[" + id + "]");
			if (rolling <= 0) {
				throw new ConfigurationException("rolling_duration[" + id + "] must be positive, got " + rolling);
			}
			params.pauseDuration.put(id, pause);
			params.rollingDuration.put(id, rolling);
			params.rollingCapacity.put(id, require(e.getRollingCapacity(), "rolling_cap[" + id + "]"));
			params.rollingMassEfficiency.put(id,
					require(e.getRollingMassEfficiency(), "rolling_mass_efficiency[" + id + "]"));

			for (VirtualEquipment v : e.getVirtualEquipments()) {
				String key = "[" + id + "][" + v.getModeId() + "]";
				params.batchLoadProfile.put(v, v.getBatchLoadProfile().clone());
				params.virtualEquipmentDuration.put(v,
						require(v.getDuration(), "virtual_equipment_duration" + key));
				params.driDemand.put(v, require(v.getDriDemand(), "DRI_demand" + key));
				params.outputSteelProducts.put(v, require(v.getOutputSteelProducts(), "output_steel_products" + key));
			}
		}

		for (Boundary b : config.getBoundaries()) {
			params.boundaryLimit.put(b.getId(), b.getLimit());
			params.boundaryPenalty.put(b.getId(), b.getPenalty());
		}

		if (config.isUseStorageGoals()) {
			params.storageGoals = new ModelParameters.StorageGoals(
					require(config.getGoalH2Content(), "goal_h2_content"),
					require(config.getGoalDriContent(), "goal_DRI_content"));
		}
		if (config.isDrawPowerFromGrid()) {
			params.gridTariff = new ModelParameters.GridTariff(
					require(config.getGridChargePowerPrice(), "grid_charge_power_price"),
					require(config.getGridChargeEnergyPrice(), "grid_charge_energy_price"));
		}
		if (config.isGivenGoalLoad()) {
			params.goalLoad = require(config.getGoalLoad(), "goal_load");
		}
		return params;
	}

	private static double require(Double value, String key) throws ConfigurationException {
		if (value == null) {
			throw new ConfigurationException("Required parameter " + key + " is missing");
		}
		if (value.isNaN() || value.isInfinite()) {
			throw new ConfigurationException("Parameter " + key + " is not a finite number: " + value);
		}
		return value;
	}

	private static int require(Integer value, String key) throws ConfigurationException {
		if (value == null) {
			throw new ConfigurationException("Required parameter " + key + " is missing");
		}
		return value;
	}

	private static double requirePositive(Double value, String key) throws ConfigurationException {
		double v = require(value, key);
		if (v <= 0) {
			throw new ConfigurationException("Parameter " + key + " must be positive, got " + v);
		}
		return v;
	}
}
