package flexibleBatchProduction.construct;

import com.google.ortools.modelbuilder.LinearExpr;
import com.google.ortools.modelbuilder.LinearExprBuilder;
import com.google.ortools.modelbuilder.Variable;

import flexibleBatchProduction.construct.IndexedConstraint.Sense;
import flexibleBatchProduction.models.Period;
import flexibleBatchProduction.models.VirtualEquipment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Adds the constraint families of the batch production model: reduction unit and storages,
 * fuel cell, steel making batches, rolling, energy management, load jumps and economics.
 */
public class ConstraintAssembler {

	private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintAssembler.class);

	public static final String ELECTROLYSER_MAX_CONSUMPTION = "electrolyserMaxConsumption";
	public static final String ELECTROLYSER_MIN_CONSUMPTION = "electrolyserMinConsumption";
	public static final String H2_FLOW = "h2Flow";
	public static final String REDUCTION_UNIT_MAX_H2 = "reductionUnitMaxH2";
	public static final String DRI_STORAGE_CONTENT = "driStorageContent";
	public static final String H2_STORAGE_CONTENT = "h2StorageContent";
	public static final String H2_STORAGE_CAPACITY = "h2StorageCapacity";
	public static final String GOAL_H2_CONTENT = "goalH2Content";
	public static final String GOAL_DRI_CONTENT = "goalDriContent";
	public static final String FUEL_CELL_MAX_GENERATION = "fuelCellMaxGeneration";
	public static final String VIRTUAL_EQUIPMENT_RUNNING = "virtualEquipmentRunning";
	public static final String EQUIPMENT_RUNNING = "equipmentRunning";
	public static final String ONE_VIRTUAL_EQUIPMENT_RUNNING = "oneVirtualEquipmentRunning";
	public static final String STARTING_TIME = "startingTime";
	public static final String MINIMUM_DOWNTIME = "minimumDowntime";
	public static final String EQUIPMENT_LOAD = "equipmentLoad";
	public static final String INTERMEDIATE_STORAGE = "intermediateStorage";
	public static final String ROLLING_RUNNING = "rollingRunning";
	public static final String ROLLING_LOAD = "rollingLoad";
	public static final String STEEL_PRODUCED = "steelProduced";
	public static final String MEET_STEEL_DEMAND = "meetSteelDemand";
	public static final String ENERGY_BALANCE = "energyBalance";
	public static final String POWER_EXCHANGE = "powerExchange";
	public static final String MEAN_POWER_EXCHANGE = "meanPowerExchange";
	public static final String MAX_POWER_FROM_GRID = "maxPowerFromGrid";
	public static final String POWER_EXCHANGE_SPLIT = "powerExchangeSplit";
	public static final String LOAD_JUMP = "loadJump";
	public static final String LOAD_JUMP_SPLIT = "loadJumpSplit";
	public static final String ELECTRICITY_MARKET_PROFIT = "electricityMarketProfit";
	public static final String ELECTRICITY_MARKET_COST = "electricityMarketCost";
	public static final String GRID_CHARGES_POWER = "gridChargesPower";

	private final IndexedModel model;
	private final IndexDomains domains;
	private final ModelParameters params;
	private final ModelVariables vars;
	private final List<Period> periods;

	public ConstraintAssembler(IndexedModel model, IndexDomains domains, ModelParameters params,
			ModelVariables vars) {
		this.model = model;
		this.domains = domains;
		this.params = params;
		this.vars = vars;
		this.periods = domains.getPeriods();
	}

	public void assemble() {
		defineReductionUnitConstraints();
		defineFuelCellConstraints();
		defineSteelMakingConstraints();
		defineRollingConstraints();
		defineEnergyManagementConstraints();
		defineLoadJumpConstraints();
		defineEconomicsConstraints();
		if (LOGGER.isDebugEnabled()) {
			for (String family : model.getConstraintFamilyNames()) {
				LOGGER.debug("Constraint family {}: {} rows", family, model.getConstraintFamily(family).size());
			}
		}
	}

	/**
	 * Electrolysers, hydrogen tank and DRI stock.
	 */
	private void defineReductionUnitConstraints() {
		double dt = params.getDeltaT();
		double h2PerStepAtMax = params.getMaxCapacityElectrolyser() * dt * params.getEfficiencyElectrolyser();

		for (Period t : periods) {
			// Semi-continuous consumption: 0 or within [min, max]
			LinearExprBuilder maxExpr = LinearExpr.newBuilder().add(vars.getElectrolyserConsumption(t));
			maxExpr.addTerm(vars.getElectrolyserTurnOn(t), -params.getMaxCapacityElectrolyser());
			model.addConstr(maxExpr, Sense.LESS_EQUAL, 0.0, ELECTROLYSER_MAX_CONSUMPTION, t.getT());

			LinearExprBuilder minExpr = LinearExpr.newBuilder().add(vars.getElectrolyserConsumption(t));
			minExpr.addTerm(vars.getElectrolyserTurnOn(t), -params.getMinConsumptionElectrolyser());
			model.addConstr(minExpr, Sense.GREATER_EQUAL, 0.0, ELECTROLYSER_MIN_CONSUMPTION, t.getT());

			// Produced hydrogen goes to the shaft furnace or into (negative: out of) the tank
			LinearExprBuilder produced = LinearExpr.newBuilder();
			produced.addTerm(vars.getElectrolyserConsumption(t), params.getEfficiencyElectrolyser() * dt);
			LinearExprBuilder used = LinearExpr.newBuilder();
			used.add(vars.getH2ForDri(t));
			used.add(vars.getH2StorageFlow(t));
			model.addConstr(produced, Sense.EQUAL, used, H2_FLOW, t.getT());

			model.addConstr(vars.getH2ForDri(t), Sense.LESS_EQUAL, h2PerStepAtMax, REDUCTION_UNIT_MAX_H2, t.getT());
		}

		for (Period t : periods) {
			LinearExprBuilder content = LinearExpr.newBuilder();
			if (t.getT() == 0) {
				content.add(params.getInitialDriContent());
			} else {
				content.add(vars.getDriStorageContent(previous(t)));
			}
			content.addTerm(vars.getH2ForDri(t), 1.0 / params.getH2MWhPerDri());
			for (VirtualEquipment v : domains.getVirtualEquipments()) {
				content.addTerm(vars.getEquipmentTurnOn(v, t), -params.getDriDemand(v));
			}
			model.addConstr(vars.getDriStorageContent(t), Sense.EQUAL, content, DRI_STORAGE_CONTENT, t.getT());
		}

		for (Period t : periods) {
			LinearExprBuilder content = LinearExpr.newBuilder();
			if (t.getT() == 0) {
				content.add(params.getInitialH2TankFilling() * params.getCapacityH2Tank());
			} else {
				content.add(vars.getH2StorageContent(previous(t)));
			}
			content.add(vars.getH2StorageFlow(t));
			content.addTerm(vars.getFuelCellGeneration(t), -dt / params.getFuelCellEfficiency());
			model.addConstr(vars.getH2StorageContent(t), Sense.EQUAL, content, H2_STORAGE_CONTENT, t.getT());

			// lower bound 0 comes from the variable domain
			model.addConstr(vars.getH2StorageContent(t), Sense.LESS_EQUAL, params.getCapacityH2Tank(),
					H2_STORAGE_CAPACITY, t.getT());
		}

		params.getStorageGoals().ifPresent(goals -> {
			Period last = domains.getLastPeriod();
			model.addConstr(vars.getH2StorageContent(last), Sense.GREATER_EQUAL, goals.getGoalH2Content(),
					GOAL_H2_CONTENT);
			model.addConstr(vars.getDriStorageContent(last), Sense.GREATER_EQUAL, goals.getGoalDriContent(),
					GOAL_DRI_CONTENT);
		});
	}

	private void defineFuelCellConstraints() {
		for (Period t : periods) {
			model.addConstr(vars.getFuelCellGeneration(t), Sense.LESS_EQUAL, params.getFuelCellCapacity(),
					FUEL_CELL_MAX_GENERATION, t.getT());
		}
	}

	/**
	 * Batch occupancy, mutual exclusion of operating modes, start window, minimum downtime,
	 * load superposition and the intermediate product storage.
	 */
	private void defineSteelMakingConstraints() {
		int horizon = domains.getHorizon();

		// A batch started at t-z is still running at t for every z < duration
		for (VirtualEquipment v : domains.getVirtualEquipments()) {
			int duration = params.getVirtualEquipmentDuration(v);
			for (Period t : periods) {
				LinearExprBuilder window = LinearExpr.newBuilder();
				for (int z = 0; z < duration && z <= t.getT(); z++) {
					window.add(vars.getEquipmentTurnOn(v, periods.get(t.getT() - z)));
				}
				model.addConstr(vars.getVirtualEquipmentRunning(v, t), Sense.EQUAL, window, VIRTUAL_EQUIPMENT_RUNNING,
						v.getEquipmentId(), v.getModeId(), t.getT());
			}
		}

		for (String e : domains.getEquipmentIds()) {
			for (Period t : periods) {
				LinearExprBuilder modes = LinearExpr.newBuilder();
				for (VirtualEquipment v : domains.getVirtualEquipments(e)) {
					modes.add(vars.getVirtualEquipmentRunning(v, t));
				}
				model.addConstr(vars.getEquipmentRunning(e, t), Sense.EQUAL, modes, EQUIPMENT_RUNNING, e, t.getT());
				model.addConstr(vars.getEquipmentRunning(e, t), Sense.LESS_EQUAL, 1.0, ONE_VIRTUAL_EQUIPMENT_RUNNING, e,
						t.getT());
			}
		}

		// Batch and rolling have to be finished within the horizon
		for (VirtualEquipment v : domains.getVirtualEquipments()) {
			int latestStart = horizon - params.getVirtualEquipmentDuration(v)
					- params.getRollingDuration(v.getEquipmentId());
			for (Period t : periods) {
				LinearExpr start = LinearExpr.newBuilder().addTerm(vars.getEquipmentTurnOn(v, t), t.getT()).build();
				model.addConstr(start, Sense.LESS_EQUAL, latestStart, STARTING_TIME, v.getEquipmentId(), v.getModeId(),
						t.getT());
			}
		}

		// No start while the equipment ran during the preceding pause steps
		for (VirtualEquipment v : domains.getVirtualEquipments()) {
			String e = v.getEquipmentId();
			int pause = params.getPauseDuration(e);
			for (Period t : periods) {
				LinearExprBuilder wait = LinearExpr.newBuilder();
				wait.addTerm(vars.getEquipmentTurnOn(v, t), pause);
				for (int k = 0; k < pause && k < t.getT(); k++) {
					wait.add(vars.getEquipmentRunning(e, periods.get(t.getT() - k - 1)));
				}
				model.addConstr(wait, Sense.LESS_EQUAL, pause, MINIMUM_DOWNTIME, e, v.getModeId(), t.getT());
			}
		}

		// Load of all overlapping batches
		for (String e : domains.getEquipmentIds()) {
			for (Period t : periods) {
				LinearExprBuilder load = LinearExpr.newBuilder();
				for (VirtualEquipment v : domains.getVirtualEquipments(e)) {
					for (int z = 0; z < domains.getBatchStepCount(v) && z <= t.getT(); z++) {
						load.addTerm(vars.getEquipmentTurnOn(v, periods.get(t.getT() - z)), params.getBatchLoad(v, z));
					}
				}
				model.addConstr(vars.getEquipmentLoad(e, t), Sense.EQUAL, load, EQUIPMENT_LOAD, e, t.getT());
			}
		}

		defineIntermediateStorageConstraints();
	}

	/**
	 * Slabs and billets of a virtual equipment enter the storage when the batch finishes and
	 * leave it once rolling of that batch is done, rolling_duration steps later. Storage and
	 * rolling stay tied to the virtual equipment that produced the batch.
	 */
	private void defineIntermediateStorageConstraints() {
		for (VirtualEquipment v : domains.getVirtualEquipments()) {
			int duration = params.getVirtualEquipmentDuration(v);
			int rolling = params.getRollingDuration(v.getEquipmentId());
			double output = params.getOutputSteelProducts(v);
			for (Period t : periods) {
				int step = t.getT();
				Variable storage = vars.getIntermediateStorage(v, t);
				LinearExprBuilder content = LinearExpr.newBuilder();
				if (step >= duration) {
					content.add(vars.getIntermediateStorage(v, previous(t)));
					content.addTerm(vars.getEquipmentTurnOn(v, periods.get(step - duration)), output);
					if (step >= duration + rolling) {
						content.addTerm(vars.getEquipmentTurnOn(v, periods.get(step - duration - rolling)), -output);
					}
				}
				model.addConstr(storage, Sense.EQUAL, content, INTERMEDIATE_STORAGE, v.getEquipmentId(), v.getModeId(),
						step);
			}
		}
	}

	/**
	 * Rolling follows steel making directly: it runs for rolling_duration steps after a batch
	 * is finished.
	 */
	private void defineRollingConstraints() {
		for (String e : domains.getEquipmentIds()) {
			int rolling = params.getRollingDuration(e);
			for (Period t : periods) {
				LinearExprBuilder running = LinearExpr.newBuilder();
				for (VirtualEquipment v : domains.getVirtualEquipments(e)) {
					int duration = params.getVirtualEquipmentDuration(v);
					for (int k = duration; k < duration + rolling && k < t.getT(); k++) {
						running.add(vars.getEquipmentTurnOn(v, periods.get(t.getT() - k - 1)));
					}
				}
				model.addConstr(vars.getRollingRunning(e, t), Sense.EQUAL, running, ROLLING_RUNNING, e, t.getT());

				LinearExpr load = LinearExpr.newBuilder()
						.addTerm(vars.getRollingRunning(e, t), params.getRollingCapacity(e)).build();
				model.addConstr(vars.getRollingLoad(e, t), Sense.EQUAL, load, ROLLING_LOAD, e, t.getT());
			}
		}

		for (String e : domains.getEquipmentIds()) {
			double perStep = params.getRollingMassEfficiency(e) / params.getRollingDuration(e);
			for (Period t : periods) {
				LinearExprBuilder produced = LinearExpr.newBuilder();
				if (t.getT() > 0) {
					produced.add(vars.getSteelProduced(e, previous(t)));
					for (VirtualEquipment v : domains.getVirtualEquipments(e)) {
						produced.addTerm(vars.getIntermediateStorage(v, t), perStep);
					}
				}
				model.addConstr(vars.getSteelProduced(e, t), Sense.EQUAL, produced, STEEL_PRODUCED, e, t.getT());
			}
		}

		LinearExprBuilder finalSteel = LinearExpr.newBuilder();
		for (String e : domains.getEquipmentIds()) {
			finalSteel.add(vars.getSteelProduced(e, domains.getLastPeriod()));
		}
		model.addConstr(finalSteel, Sense.GREATER_EQUAL, params.getSteelDemand(), MEET_STEEL_DEMAND);
	}

	/**
	 * Energy balance, power exchange with the grid, its mean and the split around the mean.
	 */
	private void defineEnergyManagementConstraints() {
		for (Period t : periods) {
			// generation + fuel cell (+ grid) - loads - feed in = 0
			LinearExprBuilder balance = LinearExpr.newBuilder();
			balance.add(params.getRenewableGeneration(t));
			balance.add(vars.getFuelCellGeneration(t));
			vars.getPowerFromGrid(t).ifPresent(fromGrid -> balance.add(fromGrid));
			for (String e : domains.getEquipmentIds()) {
				balance.addTerm(vars.getEquipmentLoad(e, t), -1.0);
				balance.addTerm(vars.getRollingLoad(e, t), -1.0);
			}
			balance.addTerm(vars.getElectrolyserConsumption(t), -1.0);
			balance.addTerm(vars.getPowerToGrid(t), -1.0);
			model.addConstr(balance, Sense.EQUAL, 0.0, ENERGY_BALANCE, t.getT());
		}

		for (Period t : periods) {
			LinearExprBuilder exchange = LinearExpr.newBuilder().add(vars.getPowerToGrid(t));
			vars.getPowerFromGrid(t).ifPresent(fromGrid -> exchange.addTerm(fromGrid, -1.0));
			model.addConstr(vars.getPowerExchange(t), Sense.EQUAL, exchange, POWER_EXCHANGE, t.getT());
		}

		vars.getMeanPowerExchange().ifPresent(mean -> {
			LinearExprBuilder average = LinearExpr.newBuilder();
			for (Period t : periods) {
				average.addTerm(vars.getPowerExchange(t), 1.0 / domains.getHorizon());
			}
			model.addConstr(mean, Sense.EQUAL, average, MEAN_POWER_EXCHANGE);
		});

		vars.getMaxPowerFromGrid().ifPresent(max -> {
			for (Period t : periods) {
				model.addConstr(max, Sense.GREATER_EQUAL, vars.getPowerFromGrid(t).get(), MAX_POWER_FROM_GRID,
						t.getT());
			}
		});

		for (Period t : periods) {
			LinearExprBuilder deviation = LinearExpr.newBuilder().add(vars.getPowerExchange(t));
			if (params.isGivenGoalLoad()) {
				deviation.add(-params.getGoalLoad().get());
			} else {
				deviation.addTerm(vars.getMeanPowerExchange().get(), -1.0);
			}
			AbsoluteValueSplit.split(model, deviation, vars.getDistanceAboveMean(t), vars.getDistanceBelowMean(t),
					POWER_EXCHANGE_SPLIT, t.getT());
		}
	}

	private void defineLoadJumpConstraints() {
		for (Period t : periods) {
			LinearExprBuilder jump = LinearExpr.newBuilder();
			if (t.getT() > 0) {
				jump.add(vars.getPowerExchange(previous(t)));
				jump.addTerm(vars.getPowerExchange(t), -1.0);
			}
			model.addConstr(vars.getLoadJump(t), Sense.EQUAL, jump, LOAD_JUMP, t.getT());
			AbsoluteValueSplit.split(model, vars.getLoadJump(t), vars.getLoadJumpUp(t), vars.getLoadJumpDown(t),
					LOAD_JUMP_SPLIT, t.getT());
		}
	}

	/**
	 * Market profit and cost per step and the demand rate on the peak grid draw.
	 */
	private void defineEconomicsConstraints() {
		double dt = params.getDeltaT();
		for (Period t : periods) {
			LinearExpr profit = LinearExpr.newBuilder()
					.addTerm(vars.getPowerToGrid(t), dt * params.getElectricityPrice(t)).build();
			model.addConstr(vars.getElectricityMarketProfit(t), Sense.EQUAL, profit, ELECTRICITY_MARKET_PROFIT,
					t.getT());
		}

		params.getGridTariff().ifPresent(tariff -> {
			for (Period t : periods) {
				LinearExprBuilder cost = LinearExpr.newBuilder();
				cost.addTerm(vars.getPowerFromGrid(t).get(), dt * params.getElectricityPrice(t));
				cost.add(tariff.getEnergyPrice());
				model.addConstr(vars.getElectricityMarketCost(t).get(), Sense.EQUAL, cost, ELECTRICITY_MARKET_COST,
						t.getT());
			}
			LinearExpr demandRate = LinearExpr.newBuilder()
					.addTerm(vars.getMaxPowerFromGrid().get(), tariff.getPowerPrice()).build();
			model.addConstr(vars.getGridChargesPower().get(), Sense.EQUAL, demandRate, GRID_CHARGES_POWER);
		});
	}

	private Period previous(Period t) {
		return periods.get(t.getT() - 1);
	}
}
