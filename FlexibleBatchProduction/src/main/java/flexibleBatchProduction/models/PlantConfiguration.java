package flexibleBatchProduction.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw input record of the plant: equipment, reduction unit, fuel cell, grid tariff and the
 * switches that enable optional parameter groups. Values are boxed so that an absent
 * parameter can be told apart from zero; validation happens when the model is built.
 */
public class PlantConfiguration {

	private Double minutesPerStep;
	private Double steelDemand; // tons

	// Reduction unit
	private Double maxCapacityElectrolyser; // MW
	private Double minConsumptionElectrolyser; // MW
	private Double efficiencyElectrolyser;
	private Double capacityH2Tank; // MWh
	private Double initialH2TankFilling; // share of capacity
	private Double initialDriContent; // tons
	private Double h2MWhPerDri; // MWh per ton DRI

	// Fuel cell
	private Double fuelCellCapacity; // MW
	private Double fuelCellEfficiency;

	private boolean useStorageGoals;
	private Double goalH2Content; // MWh
	private Double goalDriContent; // tons

	private boolean drawPowerFromGrid;
	private Double gridChargePowerPrice; // €/MW
	private Double gridChargeEnergyPrice; // €

	private boolean givenGoalLoad;
	private Double goalLoad; // MW

	private final List<Equipment> equipments = new ArrayList<>();
	private final List<Boundary> boundaries = new ArrayList<>();

	public Double getMinutesPerStep() {
		return minutesPerStep;
	}

	public void setMinutesPerStep(Double minutesPerStep) {
		this.minutesPerStep = minutesPerStep;
	}

	public Double getSteelDemand() {
		return steelDemand;
	}

	public void setSteelDemand(Double steelDemand) {
		this.steelDemand = steelDemand;
	}

	public Double getMaxCapacityElectrolyser() {
		return maxCapacityElectrolyser;
	}

	public void setMaxCapacityElectrolyser(Double maxCapacityElectrolyser) {
		this.maxCapacityElectrolyser = maxCapacityElectrolyser;
	}

	public Double getMinConsumptionElectrolyser() {
		return minConsumptionElectrolyser;
	}

	public void setMinConsumptionElectrolyser(Double minConsumptionElectrolyser) {
		this.minConsumptionElectrolyser = minConsumptionElectrolyser;
	}

	public Double getEfficiencyElectrolyser() {
		return efficiencyElectrolyser;
	}

	public void setEfficiencyElectrolyser(Double efficiencyElectrolyser) {
		this.efficiencyElectrolyser = efficiencyElectrolyser;
	}

	public Double getCapacityH2Tank() {
		return capacityH2Tank;
	}

	public void setCapacityH2Tank(Double capacityH2Tank) {
		this.capacityH2Tank = capacityH2Tank;
	}

	public Double getInitialH2TankFilling() {
		return initialH2TankFilling;
	}

	public void setInitialH2TankFilling(Double initialH2TankFilling) {
		this.initialH2TankFilling = initialH2TankFilling;
	}

	public Double getInitialDriContent() {
		return initialDriContent;
	}

	public void setInitialDriContent(Double initialDriContent) {
		this.initialDriContent = initialDriContent;
	}

	public Double getH2MWhPerDri() {
		return h2MWhPerDri;
	}

	public void setH2MWhPerDri(Double h2MWhPerDri) {
		this.h2MWhPerDri = h2MWhPerDri;
	}

	public Double getFuelCellCapacity() {
		return fuelCellCapacity;
	}

	public void setFuelCellCapacity(Double fuelCellCapacity) {
		this.fuelCellCapacity = fuelCellCapacity;
	}

	public Double getFuelCellEfficiency() {
		return fuelCellEfficiency;
	}

	public void setFuelCellEfficiency(Double fuelCellEfficiency) {
		this.fuelCellEfficiency = fuelCellEfficiency;
	}

	public boolean isUseStorageGoals() {
		return useStorageGoals;
	}

	public void setUseStorageGoals(boolean useStorageGoals) {
		this.useStorageGoals = useStorageGoals;
	}

	public Double getGoalH2Content() {
		return goalH2Content;
	}

	public void setGoalH2Content(Double goalH2Content) {
		this.goalH2Content = goalH2Content;
	}

	public Double getGoalDriContent() {
		return goalDriContent;
	}

	public void setGoalDriContent(Double goalDriContent) {
		this.goalDriContent = goalDriContent;
	}

	public boolean isDrawPowerFromGrid() {
		return drawPowerFromGrid;
	}

	public void setDrawPowerFromGrid(boolean drawPowerFromGrid) {
		this.drawPowerFromGrid = drawPowerFromGrid;
	}

	public Double getGridChargePowerPrice() {
		return gridChargePowerPrice;
	}

	public void setGridChargePowerPrice(Double gridChargePowerPrice) {
		this.gridChargePowerPrice = gridChargePowerPrice;
	}

	public Double getGridChargeEnergyPrice() {
		return gridChargeEnergyPrice;
	}

	public void setGridChargeEnergyPrice(Double gridChargeEnergyPrice) {
		this.gridChargeEnergyPrice = gridChargeEnergyPrice;
	}

	public boolean isGivenGoalLoad() {
		return givenGoalLoad;
	}

	public void setGivenGoalLoad(boolean givenGoalLoad) {
		this.givenGoalLoad = givenGoalLoad;
	}

	public Double getGoalLoad() {
		return goalLoad;
	}

	public void setGoalLoad(Double goalLoad) {
		this.goalLoad = goalLoad;
	}

	public List<Equipment> getEquipments() {
		return Collections.unmodifiableList(equipments);
	}

	public PlantConfiguration addEquipment(Equipment equipment) {
		equipments.add(equipment);
		return this;
	}

	public List<Boundary> getBoundaries() {
		return Collections.unmodifiableList(boundaries);
	}

	public PlantConfiguration addBoundary(Boundary boundary) {
		boundaries.add(boundary);
		return this;
	}
}
