package flexibleBatchProduction.construct;

import flexibleBatchProduction.models.Period;
import flexibleBatchProduction.models.VirtualEquipment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated technical and economic constants of one model instance. Filled by
 * {@link ParameterLoader}; read-only afterwards.
 */
public class ModelParameters {

	/** End-of-horizon storage targets, present when storage goals are used. */
	public static class StorageGoals {
		private final double goalH2Content;
		private final double goalDriContent;

		public StorageGoals(double goalH2Content, double goalDriContent) {
			this.goalH2Content = goalH2Content;
			this.goalDriContent = goalDriContent;
		}

		public double getGoalH2Content() {
			return goalH2Content;
		}

		public double getGoalDriContent() {
			return goalDriContent;
		}
	}

	/** Grid charges, present when power may be drawn from the grid. */
	public static class GridTariff {
		private final double powerPrice;
		private final double energyPrice;

		public GridTariff(double powerPrice, double energyPrice) {
			this.powerPrice = powerPrice;
			this.energyPrice = energyPrice;
		}

		/** Demand rate for the maximum power drawn [€/MW]. */
		public double getPowerPrice() {
			return powerPrice;
		}

		/** Energy grid charge added to the purchase cost of each step [€]. */
		public double getEnergyPrice() {
			return energyPrice;
		}
	}

	double minutesPerStep;
	double steelDemand;

	double maxCapacityElectrolyser;
	double minConsumptionElectrolyser;
	double efficiencyElectrolyser;
	double capacityH2Tank;
	double initialH2TankFilling;
	double initialDriContent;
	double h2MWhPerDri;

	double fuelCellCapacity;
	double fuelCellEfficiency;

	double[] renewableGeneration;
	double[] electricityPrice;

	final Map<VirtualEquipment, double[]> batchLoadProfile = new HashMap<>();
	final Map<VirtualEquipment, Double> driDemand = new HashMap<>();
	final Map<VirtualEquipment, Double> outputSteelProducts = new HashMap<>();
	final Map<VirtualEquipment, Integer> virtualEquipmentDuration = new HashMap<>();

	final Map<String, Integer> pauseDuration = new HashMap<>();
	final Map<String, Integer> rollingDuration = new HashMap<>();
	final Map<String, Double> rollingCapacity = new HashMap<>();
	final Map<String, Double> rollingMassEfficiency = new HashMap<>();

	final Map<String, Double> boundaryLimit = new HashMap<>();
	final Map<String, Double> boundaryPenalty = new HashMap<>();

	StorageGoals storageGoals;
	GridTariff gridTariff;
	Double goalLoad;

	ModelParameters() {
	}

	public double getMinutesPerStep() {
		return minutesPerStep;
	}

	/** Length of one time step in hours. */
	public double getDeltaT() {
		return minutesPerStep / 60.0;
	}

	public double getSteelDemand() {
		return steelDemand;
	}

	public double getMaxCapacityElectrolyser() {
		return maxCapacityElectrolyser;
	}

	public double getMinConsumptionElectrolyser() {
		return minConsumptionElectrolyser;
	}

	public double getEfficiencyElectrolyser() {
		return efficiencyElectrolyser;
	}

	public double getCapacityH2Tank() {
		return capacityH2Tank;
	}

	public double getInitialH2TankFilling() {
		return initialH2TankFilling;
	}

	public double getInitialDriContent() {
		return initialDriContent;
	}

	public double getH2MWhPerDri() {
		return h2MWhPerDri;
	}

	public double getFuelCellCapacity() {
		return fuelCellCapacity;
	}

	public double getFuelCellEfficiency() {
		return fuelCellEfficiency;
	}

	public double getRenewableGeneration(Period t) {
		return renewableGeneration[t.getT()];
	}

	public double getElectricityPrice(Period t) {
		return electricityPrice[t.getT()];
	}

	/** Load of batch step {@code z} of a virtual equipment [MW]. */
	public double getBatchLoad(VirtualEquipment v, int z) {
		return batchLoadProfile.get(v)[z];
	}

	public double getDriDemand(VirtualEquipment v) {
		return driDemand.get(v);
	}

	public double getOutputSteelProducts(VirtualEquipment v) {
		return outputSteelProducts.get(v);
	}

	public int getVirtualEquipmentDuration(VirtualEquipment v) {
		return virtualEquipmentDuration.get(v);
	}

	public int getPauseDuration(String equipmentId) {
		return pauseDuration.get(equipmentId);
	}

	public int getRollingDuration(String equipmentId) {
		return rollingDuration.get(equipmentId);
	}

	public double getRollingCapacity(String equipmentId) {
		return rollingCapacity.get(equipmentId);
	}

	public double getRollingMassEfficiency(String equipmentId) {
		return rollingMassEfficiency.get(equipmentId);
	}

	public Optional<StorageGoals> getStorageGoals() {
		return Optional.ofNullable(storageGoals);
	}

	public Optional<GridTariff> getGridTariff() {
		return Optional.ofNullable(gridTariff);
	}

	public Optional<Double> getGoalLoad() {
		return Optional.ofNullable(goalLoad);
	}

	public boolean isDrawPowerFromGrid() {
		return gridTariff != null;
	}

	public boolean isGivenGoalLoad() {
		return goalLoad != null;
	}

	public boolean isUseStorageGoals() {
		return storageGoals != null;
	}

	/**
	 * Sets and parameters as flat entries, so that a persisted result describes the
	 * instance it was solved for.
	 */
	public List<ExportEntry> export(IndexDomains domains) {
		List<ExportEntry> entries = new ArrayList<>();
		for (Period t : domains.getPeriods()) {
			entries.add(ExportEntry.indexed("T", t.getT(), t.getT()));
		}
		for (String e : domains.getEquipmentIds()) {
			entries.add(ExportEntry.indexed("E", e, e));
		}
		for (VirtualEquipment v : domains.getVirtualEquipments()) {
			entries.add(ExportEntry.indexed("V", v.getModeId(), v.getEquipmentId(), v.getModeId()));
		}
		for (String b : domains.getBoundaryIds()) {
			entries.add(ExportEntry.indexed("B", b, b));
		}

		entries.add(ExportEntry.scalar("minutesPerStep", minutesPerStep));
		entries.add(ExportEntry.scalar("steelDemand", steelDemand));
		for (Period t : domains.getPeriods()) {
			entries.add(ExportEntry.indexed("renewableGeneration", getRenewableGeneration(t), t.getT()));
		}
		for (Period t : domains.getPeriods()) {
			entries.add(ExportEntry.indexed("electricityPrice", getElectricityPrice(t), t.getT()));
		}
		entries.add(ExportEntry.scalar("maxCapacityElectrolyser", maxCapacityElectrolyser));
		entries.add(ExportEntry.scalar("minConsumptionElectrolyser", minConsumptionElectrolyser));
		entries.add(ExportEntry.scalar("efficiencyElectrolyser", efficiencyElectrolyser));
		entries.add(ExportEntry.scalar("capacityH2Tank", capacityH2Tank));
		entries.add(ExportEntry.scalar("initialH2TankFilling", initialH2TankFilling));
		entries.add(ExportEntry.scalar("initialDriContent", initialDriContent));
		entries.add(ExportEntry.scalar("h2MWhPerDri", h2MWhPerDri));
		entries.add(ExportEntry.scalar("fuelCellCapacity", fuelCellCapacity));
		entries.add(ExportEntry.scalar("fuelCellEfficiency", fuelCellEfficiency));

		for (VirtualEquipment v : domains.getVirtualEquipments()) {
			for (int z = 0; z < domains.getBatchStepCount(v); z++) {
				entries.add(ExportEntry.indexed("batchLoadProfile", getBatchLoad(v, z), v.getEquipmentId(),
						v.getModeId(), z));
			}
			entries.add(ExportEntry.indexed("driDemand", getDriDemand(v), v.getEquipmentId(), v.getModeId()));
			entries.add(ExportEntry.indexed("outputSteelProducts", getOutputSteelProducts(v), v.getEquipmentId(),
					v.getModeId()));
			entries.add(ExportEntry.indexed("virtualEquipmentDuration", getVirtualEquipmentDuration(v),
					v.getEquipmentId(), v.getModeId()));
		}
		for (String e : domains.getEquipmentIds()) {
			entries.add(ExportEntry.indexed("pauseDuration", getPauseDuration(e), e));
			entries.add(ExportEntry.indexed("rollingDuration", getRollingDuration(e), e));
			entries.add(ExportEntry.indexed("rollingCapacity", getRollingCapacity(e), e));
			entries.add(ExportEntry.indexed("rollingMassEfficiency", getRollingMassEfficiency(e), e));
		}
		for (String b : domains.getBoundaryIds()) {
			entries.add(ExportEntry.indexed("boundaryLimit", boundaryLimit.get(b), b));
			entries.add(ExportEntry.indexed("boundaryPenalty", boundaryPenalty.get(b), b));
		}

		entries.add(ExportEntry.scalar("useStorageGoals", isUseStorageGoals()));
		if (storageGoals != null) {
			entries.add(ExportEntry.scalar("goalH2Content", storageGoals.getGoalH2Content()));
			entries.add(ExportEntry.scalar("goalDriContent", storageGoals.getGoalDriContent()));
		}
		entries.add(ExportEntry.scalar("drawPowerFromGrid", isDrawPowerFromGrid()));
		if (gridTariff != null) {
			entries.add(ExportEntry.scalar("gridChargePowerPrice", gridTariff.getPowerPrice()));
			entries.add(ExportEntry.scalar("gridChargeEnergyPrice", gridTariff.getEnergyPrice()));
		}
		entries.add(ExportEntry.scalar("givenGoalLoad", isGivenGoalLoad()));
		if (goalLoad != null) {
			entries.add(ExportEntry.scalar("goalLoad", goalLoad));
		}
		return Collections.unmodifiableList(entries);
	}
}
