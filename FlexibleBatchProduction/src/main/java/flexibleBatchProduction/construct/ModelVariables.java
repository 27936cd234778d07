package flexibleBatchProduction.construct;

import com.google.ortools.modelbuilder.Variable;

import flexibleBatchProduction.models.Period;
import flexibleBatchProduction.models.VirtualEquipment;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decision and derived variables of the batch production model, declared over the index
 * domains. Grid variables exist only when power may be drawn from the grid, the mean power
 * exchange only when no goal load is given.
 */
public class ModelVariables {

	// Decision variables
	public static final String EQUIPMENT_TURN_ON = "equipmentTurnOn";
	public static final String ELECTROLYSER_TURN_ON = "electrolyserTurnOn";
	public static final String ELECTROLYSER_CONSUMPTION = "electrolyserConsumption";
	public static final String FUEL_CELL_GENERATION = "fuelCellGeneration";
	public static final String H2_FOR_DRI = "h2ForDri";
	public static final String H2_STORAGE_FLOW = "h2StorageFlow";
	public static final String POWER_FROM_GRID = "powerFromGrid";

	// Reduction unit
	public static final String H2_STORAGE_CONTENT = "h2StorageContent";
	public static final String DRI_STORAGE_CONTENT = "driStorageContent";

	// Steel making
	public static final String EQUIPMENT_LOAD = "equipmentLoad";
	public static final String VIRTUAL_EQUIPMENT_RUNNING = "virtualEquipmentRunning";
	public static final String EQUIPMENT_RUNNING = "equipmentRunning";
	public static final String INTERMEDIATE_STORAGE = "intermediateStorage";

	// Rolling
	public static final String ROLLING_RUNNING = "rollingRunning";
	public static final String ROLLING_LOAD = "rollingLoad";
	public static final String STEEL_PRODUCED = "steelProduced";

	// Power
	public static final String POWER_EXCHANGE = "powerExchange";
	public static final String POWER_TO_GRID = "powerToGrid";
	public static final String MEAN_POWER_EXCHANGE = "meanPowerExchange";
	public static final String DISTANCE_ABOVE_MEAN = "distanceAboveMean";
	public static final String DISTANCE_BELOW_MEAN = "distanceBelowMean";
	public static final String LOAD_JUMP = "loadJump";
	public static final String LOAD_JUMP_UP = "loadJumpUp";
	public static final String LOAD_JUMP_DOWN = "loadJumpDown";

	// Electricity market
	public static final String ELECTRICITY_MARKET_PROFIT = "electricityMarketProfit";
	public static final String ELECTRICITY_MARKET_COST = "electricityMarketCost";
	public static final String GRID_CHARGES_POWER = "gridChargesPower";
	public static final String MAX_POWER_FROM_GRID = "maxPowerFromGrid";

	final Map<VirtualEquipment, Map<Period, Variable>> equipmentTurnOn = new LinkedHashMap<>();
	final Map<Period, Variable> electrolyserTurnOn = new LinkedHashMap<>();
	final Map<Period, Variable> electrolyserConsumption = new LinkedHashMap<>();
	final Map<Period, Variable> fuelCellGeneration = new LinkedHashMap<>();
	final Map<Period, Variable> h2ForDri = new LinkedHashMap<>();
	final Map<Period, Variable> h2StorageFlow = new LinkedHashMap<>();
	final Map<Period, Variable> powerFromGrid = new LinkedHashMap<>();

	final Map<Period, Variable> h2StorageContent = new LinkedHashMap<>();
	final Map<Period, Variable> driStorageContent = new LinkedHashMap<>();

	final Map<String, Map<Period, Variable>> equipmentLoad = new LinkedHashMap<>();
	final Map<VirtualEquipment, Map<Period, Variable>> virtualEquipmentRunning = new LinkedHashMap<>();
	final Map<String, Map<Period, Variable>> equipmentRunning = new LinkedHashMap<>();
	final Map<VirtualEquipment, Map<Period, Variable>> intermediateStorage = new LinkedHashMap<>();

	final Map<String, Map<Period, Variable>> rollingRunning = new LinkedHashMap<>();
	final Map<String, Map<Period, Variable>> rollingLoad = new LinkedHashMap<>();
	final Map<String, Map<Period, Variable>> steelProduced = new LinkedHashMap<>();

	final Map<Period, Variable> powerExchange = new LinkedHashMap<>();
	final Map<Period, Variable> powerToGrid = new LinkedHashMap<>();
	final Map<Period, Variable> distanceAboveMean = new LinkedHashMap<>();
	final Map<Period, Variable> distanceBelowMean = new LinkedHashMap<>();
	final Map<Period, Variable> loadJump = new LinkedHashMap<>();
	final Map<Period, Variable> loadJumpUp = new LinkedHashMap<>();
	final Map<Period, Variable> loadJumpDown = new LinkedHashMap<>();
	Variable meanPowerExchange;

	final Map<Period, Variable> electricityMarketProfit = new LinkedHashMap<>();
	final Map<Period, Variable> electricityMarketCost = new LinkedHashMap<>();
	Variable gridChargesPower;
	Variable maxPowerFromGrid;

	private ModelVariables() {
	}

	/**
	 * Declares every variable of the model in {@code model}.
	 */
	public static ModelVariables allocate(IndexedModel model, IndexDomains domains, ModelParameters params) {
		ModelVariables vars = new ModelVariables();
		boolean grid = params.isDrawPowerFromGrid();

		for (VirtualEquipment v : domains.getVirtualEquipments()) {
			vars.equipmentTurnOn.put(v, new LinkedHashMap<>());
			for (Period t : domains.getPeriods()) {
				vars.equipmentTurnOn.get(v).put(t,
						model.addBinary(EQUIPMENT_TURN_ON, v.getEquipmentId(), v.getModeId(), t.getT()));
			}
		}
		for (Period t : domains.getPeriods()) {
			vars.electrolyserTurnOn.put(t, model.addBinary(ELECTROLYSER_TURN_ON, t.getT()));
			vars.electrolyserConsumption.put(t, model.addNonNegative(ELECTROLYSER_CONSUMPTION, t.getT()));
			vars.fuelCellGeneration.put(t, model.addNonNegative(FUEL_CELL_GENERATION, t.getT()));
			vars.h2ForDri.put(t, model.addNonNegative(H2_FOR_DRI, t.getT()));
			vars.h2StorageFlow.put(t, model.addFree(H2_STORAGE_FLOW, t.getT()));
			if (grid) {
				vars.powerFromGrid.put(t, model.addNonNegative(POWER_FROM_GRID, t.getT()));
			}
		}

		for (Period t : domains.getPeriods()) {
			vars.h2StorageContent.put(t, model.addNonNegative(H2_STORAGE_CONTENT, t.getT()));
			vars.driStorageContent.put(t, model.addNonNegative(DRI_STORAGE_CONTENT, t.getT()));
		}

		for (String e : domains.getEquipmentIds()) {
			vars.equipmentLoad.put(e, new LinkedHashMap<>());
			vars.equipmentRunning.put(e, new LinkedHashMap<>());
			vars.rollingRunning.put(e, new LinkedHashMap<>());
			vars.rollingLoad.put(e, new LinkedHashMap<>());
			vars.steelProduced.put(e, new LinkedHashMap<>());
			for (Period t : domains.getPeriods()) {
				vars.equipmentLoad.get(e).put(t, model.addNonNegative(EQUIPMENT_LOAD, e, t.getT()));
				vars.equipmentRunning.get(e).put(t, model.addBinary(EQUIPMENT_RUNNING, e, t.getT()));
			}
		}
		for (VirtualEquipment v : domains.getVirtualEquipments()) {
			vars.virtualEquipmentRunning.put(v, new LinkedHashMap<>());
			vars.intermediateStorage.put(v, new LinkedHashMap<>());
			for (Period t : domains.getPeriods()) {
				vars.virtualEquipmentRunning.get(v).put(t,
						model.addBinary(VIRTUAL_EQUIPMENT_RUNNING, v.getEquipmentId(), v.getModeId(), t.getT()));
				vars.intermediateStorage.get(v).put(t,
						model.addNonNegative(INTERMEDIATE_STORAGE, v.getEquipmentId(), v.getModeId(), t.getT()));
			}
		}
		for (String e : domains.getEquipmentIds()) {
			for (Period t : domains.getPeriods()) {
				vars.rollingRunning.get(e).put(t, model.addBinary(ROLLING_RUNNING, e, t.getT()));
				vars.rollingLoad.get(e).put(t, model.addNonNegative(ROLLING_LOAD, e, t.getT()));
				vars.steelProduced.get(e).put(t, model.addNonNegative(STEEL_PRODUCED, e, t.getT()));
			}
		}

		for (Period t : domains.getPeriods()) {
			vars.powerExchange.put(t, model.addFree(POWER_EXCHANGE, t.getT()));
			vars.powerToGrid.put(t, model.addNonNegative(POWER_TO_GRID, t.getT()));
		}
		if (!params.isGivenGoalLoad()) {
			vars.meanPowerExchange = model.addFree(MEAN_POWER_EXCHANGE);
		}
		for (Period t : domains.getPeriods()) {
			vars.distanceAboveMean.put(t, model.addNonNegative(DISTANCE_ABOVE_MEAN, t.getT()));
			vars.distanceBelowMean.put(t, model.addNonNegative(DISTANCE_BELOW_MEAN, t.getT()));
			vars.loadJump.put(t, model.addFree(LOAD_JUMP, t.getT()));
			vars.loadJumpUp.put(t, model.addNonNegative(LOAD_JUMP_UP, t.getT()));
			vars.loadJumpDown.put(t, model.addNonNegative(LOAD_JUMP_DOWN, t.getT()));
		}

		for (Period t : domains.getPeriods()) {
			vars.electricityMarketProfit.put(t, model.addFree(ELECTRICITY_MARKET_PROFIT, t.getT()));
			if (grid) {
				vars.electricityMarketCost.put(t, model.addFree(ELECTRICITY_MARKET_COST, t.getT()));
			}
		}
		if (grid) {
			vars.gridChargesPower = model.addNonNegative(GRID_CHARGES_POWER);
			vars.maxPowerFromGrid = model.addNonNegative(MAX_POWER_FROM_GRID);
		}
		return vars;
	}

	public Variable getEquipmentTurnOn(VirtualEquipment v, Period t) {
		return equipmentTurnOn.get(v).get(t);
	}

	public Variable getElectrolyserTurnOn(Period t) {
		return electrolyserTurnOn.get(t);
	}

	public Variable getElectrolyserConsumption(Period t) {
		return electrolyserConsumption.get(t);
	}

	public Variable getFuelCellGeneration(Period t) {
		return fuelCellGeneration.get(t);
	}

	public Variable getH2ForDri(Period t) {
		return h2ForDri.get(t);
	}

	public Variable getH2StorageFlow(Period t) {
		return h2StorageFlow.get(t);
	}

	public Optional<Variable> getPowerFromGrid(Period t) {
		return Optional.ofNullable(powerFromGrid.get(t));
	}

	public Variable getH2StorageContent(Period t) {
		return h2StorageContent.get(t);
	}

	public Variable getDriStorageContent(Period t) {
		return driStorageContent.get(t);
	}

	public Variable getEquipmentLoad(String e, Period t) {
		return equipmentLoad.get(e).get(t);
	}

	public Variable getVirtualEquipmentRunning(VirtualEquipment v, Period t) {
		return virtualEquipmentRunning.get(v).get(t);
	}

	public Variable getEquipmentRunning(String e, Period t) {
		return equipmentRunning.get(e).get(t);
	}

	public Variable getIntermediateStorage(VirtualEquipment v, Period t) {
		return intermediateStorage.get(v).get(t);
	}

	public Variable getRollingRunning(String e, Period t) {
		return rollingRunning.get(e).get(t);
	}

	public Variable getRollingLoad(String e, Period t) {
		return rollingLoad.get(e).get(t);
	}

	public Variable getSteelProduced(String e, Period t) {
		return steelProduced.get(e).get(t);
	}

	public Variable getPowerExchange(Period t) {
		return powerExchange.get(t);
	}

	public Variable getPowerToGrid(Period t) {
		return powerToGrid.get(t);
	}

	public Optional<Variable> getMeanPowerExchange() {
		return Optional.ofNullable(meanPowerExchange);
	}

	public Variable getDistanceAboveMean(Period t) {
		return distanceAboveMean.get(t);
	}

	public Variable getDistanceBelowMean(Period t) {
		return distanceBelowMean.get(t);
	}

	public Variable getLoadJump(Period t) {
		return loadJump.get(t);
	}

	public Variable getLoadJumpUp(Period t) {
		return loadJumpUp.get(t);
	}

	public Variable getLoadJumpDown(Period t) {
		return loadJumpDown.get(t);
	}

	public Variable getElectricityMarketProfit(Period t) {
		return electricityMarketProfit.get(t);
	}

	public Optional<Variable> getElectricityMarketCost(Period t) {
		return Optional.ofNullable(electricityMarketCost.get(t));
	}

	public Optional<Variable> getGridChargesPower() {
		return Optional.ofNullable(gridChargesPower);
	}

	public Optional<Variable> getMaxPowerFromGrid() {
		return Optional.ofNullable(maxPowerFromGrid);
	}
}
