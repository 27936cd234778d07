package flexibleBatchProduction.construct;

import com.google.ortools.modelbuilder.ModelBuilder;
import com.google.ortools.modelbuilder.ModelSolver;
import com.google.ortools.modelbuilder.SolveStatus;
import com.google.ortools.modelbuilder.Variable;

import flexibleBatchProduction.PlantFixtures;
import flexibleBatchProduction.construct.IndexedConstraint.Sense;
import flexibleBatchProduction.models.PlantConfiguration;
import flexibleBatchProduction.models.Period;
import flexibleBatchProduction.models.VirtualEquipment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ConstraintAssemblerTest {

	private static final double TOLERANCE = 1e-6;

	private BatchProductionModel model;
	private IndexedModel indexedModel;
	private ModelVariables vars;
	private VirtualEquipment v;

	@BeforeEach
	void setUp() throws ModelConstructionException {
		model = BatchProductionModelBuilder.build(PlantFixtures.input(), ObjectiveType.MAX_PROFIT);
		indexedModel = model.getIndexedModel();
		vars = model.getVariables();
		v = PlantFixtures.mode();
	}

	private static Period p(int t) {
		return new Period(t);
	}

	private IndexedConstraint constraint(String family, Object... index) {
		return indexedModel.getConstraint(family, index).get();
	}

	/**
	 * Solves a copy of {@code solved} with the given variables fixed and returns the solver
	 * together with the copy, so values can be read back.
	 */
	private static final class FixedSolve {
		private final ModelBuilder copy;
		private final ModelSolver solver;
		private final SolveStatus status;

		private FixedSolve(BatchProductionModel solved, Map<Variable, Double> fixed) {
			copy = solved.copyModelBuilder();
			for (Map.Entry<Variable, Double> entry : fixed.entrySet()) {
				Variable var = copy.varFromIndex(entry.getKey().getIndex());
				var.setLowerBound(entry.getValue());
				var.setUpperBound(entry.getValue());
			}
			solver = new ModelSolver("scip");
			assumeTrue(solver.solverIsSupported(), "SCIP not available");
			status = solver.solve(copy);
		}

		private double value(Variable var) {
			return solver.getValue(copy.varFromIndex(var.getIndex()));
		}
	}

	/** All starts of the single mode fixed: one batch at {@code start}, none elsewhere. */
	private Map<Variable, Double> singleBatchAt(int start) {
		Map<Variable, Double> fixed = new LinkedHashMap<>();
		for (int t = 0; t < PlantFixtures.HORIZON; t++) {
			fixed.put(vars.getEquipmentTurnOn(v, p(t)), t == start ? 1.0 : 0.0);
		}
		return fixed;
	}

	@Test
	void testSingleBatchScheduleIsFeasible() {
		FixedSolve solve = new FixedSolve(model, singleBatchAt(0));
		assertEquals(SolveStatus.OPTIMAL, solve.status);
		assertEquals(1.0, solve.value(vars.getEquipmentRunning(PlantFixtures.EAF, p(1))), TOLERANCE);
		assertEquals(0.0, solve.value(vars.getEquipmentRunning(PlantFixtures.EAF, p(2))), TOLERANCE);
		assertEquals(4.0, solve.value(vars.getEquipmentLoad(PlantFixtures.EAF, p(0))), TOLERANCE);
		assertEquals(6.0, solve.value(vars.getEquipmentLoad(PlantFixtures.EAF, p(1))), TOLERANCE);
	}

	@Test
	void testIntermediateStoragePipeline() {
		// duration 2, rolling 1, output 10, started at step 0
		FixedSolve solve = new FixedSolve(model, singleBatchAt(0));
		assertEquals(SolveStatus.OPTIMAL, solve.status);
		assertEquals(PlantFixtures.OUTPUT, solve.value(vars.getIntermediateStorage(v, p(2))), TOLERANCE);
		assertEquals(0.0, solve.value(vars.getIntermediateStorage(v, p(3))), TOLERANCE);
		assertEquals(1.0, solve.value(vars.getRollingRunning(PlantFixtures.EAF, p(3))), TOLERANCE);
		assertEquals(9.0, solve.value(vars.getSteelProduced(PlantFixtures.EAF, p(3))), TOLERANCE);

		// slabs may not stay in storage past the rolling window
		Map<Variable, Double> fixed = singleBatchAt(0);
		fixed.put(vars.getIntermediateStorage(v, p(3)), PlantFixtures.OUTPUT);
		assertEquals(SolveStatus.INFEASIBLE, new FixedSolve(model, fixed).status);
	}

	@Test
	void testIntermediateStorageRows() {
		IndexedConstraint beforeFinish = constraint(ConstraintAssembler.INTERMEDIATE_STORAGE, PlantFixtures.EAF,
				PlantFixtures.MODE, 1);
		assertEquals(1, beforeFinish.size());
		assertEquals(0.0, beforeFinish.getRhs());

		IndexedConstraint inflow = constraint(ConstraintAssembler.INTERMEDIATE_STORAGE, PlantFixtures.EAF,
				PlantFixtures.MODE, 2);
		assertEquals(1.0, inflow.getCoefficient(vars.getIntermediateStorage(v, p(2))));
		assertEquals(-1.0, inflow.getCoefficient(vars.getIntermediateStorage(v, p(1))));
		assertEquals(-PlantFixtures.OUTPUT, inflow.getCoefficient(vars.getEquipmentTurnOn(v, p(0))));

		IndexedConstraint outflow = constraint(ConstraintAssembler.INTERMEDIATE_STORAGE, PlantFixtures.EAF,
				PlantFixtures.MODE, 5);
		assertEquals(-PlantFixtures.OUTPUT, outflow.getCoefficient(vars.getEquipmentTurnOn(v, p(3))));
		assertEquals(PlantFixtures.OUTPUT, outflow.getCoefficient(vars.getEquipmentTurnOn(v, p(2))));
	}

	@Test
	void testEnergyBalanceRow() {
		IndexedConstraint balance = constraint(ConstraintAssembler.ENERGY_BALANCE, 4);
		assertEquals(Sense.EQUAL, balance.getSense());
		assertEquals(-PlantFixtures.GENERATION, balance.getRhs());
		assertEquals(1.0, balance.getCoefficient(vars.getFuelCellGeneration(p(4))));
		assertEquals(-1.0, balance.getCoefficient(vars.getEquipmentLoad(PlantFixtures.EAF, p(4))));
		assertEquals(-1.0, balance.getCoefficient(vars.getRollingLoad(PlantFixtures.EAF, p(4))));
		assertEquals(-1.0, balance.getCoefficient(vars.getElectrolyserConsumption(p(4))));
		assertEquals(-1.0, balance.getCoefficient(vars.getPowerToGrid(p(4))));
		assertEquals(5, balance.size());
	}

	@Test
	void testFeedInLimitedByGenerationAndFuelCell() {
		Map<Variable, Double> fixed = singleBatchAt(0);
		fixed.put(vars.getPowerToGrid(p(5)), PlantFixtures.GENERATION + 5.0);
		assertEquals(SolveStatus.OPTIMAL, new FixedSolve(model, fixed).status);

		fixed.put(vars.getPowerToGrid(p(5)), PlantFixtures.GENERATION + 5.0 + 1.0);
		assertEquals(SolveStatus.INFEASIBLE, new FixedSolve(model, fixed).status);
	}

	@Test
	void testStartWindow() {
		// N - duration - rolling = 10 - 2 - 1
		IndexedConstraint start = constraint(ConstraintAssembler.STARTING_TIME, PlantFixtures.EAF,
				PlantFixtures.MODE, 8);
		assertEquals(7.0, start.getRhs());
		assertEquals(8.0, start.getCoefficient(vars.getEquipmentTurnOn(v, p(8))));

		assertEquals(SolveStatus.OPTIMAL, new FixedSolve(model, singleBatchAt(7)).status);
		assertEquals(SolveStatus.INFEASIBLE, new FixedSolve(model, singleBatchAt(8)).status);
	}

	@Test
	void testOverlappingBatchesFillTheWindow() {
		IndexedConstraint running = constraint(ConstraintAssembler.VIRTUAL_EQUIPMENT_RUNNING, PlantFixtures.EAF,
				PlantFixtures.MODE, 4);
		assertEquals(-1.0, running.getCoefficient(vars.getEquipmentTurnOn(v, p(4))));
		assertEquals(-1.0, running.getCoefficient(vars.getEquipmentTurnOn(v, p(3))));
		assertEquals(0.0, running.getCoefficient(vars.getEquipmentTurnOn(v, p(2))));
	}

	@Test
	void testMinimumDowntime() {
		IndexedConstraint first = constraint(ConstraintAssembler.MINIMUM_DOWNTIME, PlantFixtures.EAF,
				PlantFixtures.MODE, 0);
		assertEquals(1, first.size());
		assertEquals(1.0, first.getRhs());

		IndexedConstraint later = constraint(ConstraintAssembler.MINIMUM_DOWNTIME, PlantFixtures.EAF,
				PlantFixtures.MODE, 3);
		assertEquals(1.0, later.getCoefficient(vars.getEquipmentTurnOn(v, p(3))));
		assertEquals(1.0, later.getCoefficient(vars.getEquipmentRunning(PlantFixtures.EAF, p(2))));
		assertEquals(1.0, later.getRhs());

		// restart directly after the batch ends
		Map<Variable, Double> fixed = singleBatchAt(0);
		fixed.put(vars.getEquipmentTurnOn(v, p(2)), 1.0);
		assertEquals(SolveStatus.INFEASIBLE, new FixedSolve(model, fixed).status);
	}

	@Test
	void testStorageBalancesStartFromInitialContent() {
		IndexedConstraint dri = constraint(ConstraintAssembler.DRI_STORAGE_CONTENT, 0);
		assertEquals(2.0, dri.getRhs());
		assertEquals(2.0, dri.getCoefficient(vars.getEquipmentTurnOn(v, p(0))));
		assertEquals(-1.0 / 3.0, dri.getCoefficient(vars.getH2ForDri(p(0))), TOLERANCE);

		IndexedConstraint h2 = constraint(ConstraintAssembler.H2_STORAGE_CONTENT, 0);
		assertEquals(10.0, h2.getRhs());
		// fuel cell draws generation * dt / efficiency
		assertEquals(2.0, h2.getCoefficient(vars.getFuelCellGeneration(p(0))));

		IndexedConstraint h2Later = constraint(ConstraintAssembler.H2_STORAGE_CONTENT, 6);
		assertEquals(-1.0, h2Later.getCoefficient(vars.getH2StorageContent(p(5))));
		assertEquals(0.0, h2Later.getRhs());
	}

	@Test
	void testHydrogenTankCapacity() {
		IndexedConstraint capacity = constraint(ConstraintAssembler.H2_STORAGE_CAPACITY, 2);
		assertEquals(Sense.LESS_EQUAL, capacity.getSense());
		assertEquals(20.0, capacity.getRhs());
		assertEquals(1.0, capacity.getCoefficient(vars.getH2StorageContent(p(2))));

		Map<Variable, Double> fixed = singleBatchAt(5);
		fixed.put(vars.getH2StorageContent(p(2)), 20.0);
		assertEquals(SolveStatus.OPTIMAL, new FixedSolve(model, fixed).status);

		fixed.put(vars.getH2StorageContent(p(2)), 21.0);
		assertEquals(SolveStatus.INFEASIBLE, new FixedSolve(model, fixed).status);
	}

	@Test
	void testSemiContinuousElectrolyser() {
		Map<Variable, Double> fixed = singleBatchAt(0);
		fixed.put(vars.getElectrolyserConsumption(p(4)), 1.0);
		assertEquals(SolveStatus.INFEASIBLE, new FixedSolve(model, fixed).status);

		fixed.put(vars.getElectrolyserConsumption(p(4)), 2.0);
		FixedSolve atMinimum = new FixedSolve(model, fixed);
		assertEquals(SolveStatus.OPTIMAL, atMinimum.status);
		assertEquals(1.0, atMinimum.value(vars.getElectrolyserTurnOn(p(4))), TOLERANCE);

		fixed.put(vars.getElectrolyserConsumption(p(4)), 0.0);
		fixed.put(vars.getElectrolyserTurnOn(p(4)), 1.0);
		assertEquals(SolveStatus.INFEASIBLE, new FixedSolve(model, fixed).status);
	}

	@Test
	void testSteelDemand() {
		Map<Variable, Double> fixed = singleBatchAt(0);
		fixed.put(vars.getSteelProduced(PlantFixtures.EAF, p(9)), 8.0);
		assertEquals(SolveStatus.INFEASIBLE, new FixedSolve(model, fixed).status);
		assertEquals(9.0, constraint(ConstraintAssembler.MEET_STEEL_DEMAND).getRhs());
	}

	@Test
	void testStorageGoalsOnLastPeriod() throws ModelConstructionException {
		PlantConfiguration config = PlantFixtures.configuration();
		config.setUseStorageGoals(true);
		config.setGoalH2Content(8.0);
		config.setGoalDriContent(1.0);
		BatchProductionModel withGoals = BatchProductionModelBuilder.build(PlantFixtures.input(config),
				ObjectiveType.STABILITY);

		IndexedConstraint goal = withGoals.getIndexedModel().getConstraint(ConstraintAssembler.GOAL_H2_CONTENT).get();
		Variable lastContent = withGoals.getVariables().getH2StorageContent(p(PlantFixtures.HORIZON - 1));
		assertEquals(1.0, goal.getCoefficient(lastContent));
		assertEquals(Sense.GREATER_EQUAL, goal.getSense());
		assertEquals(8.0, goal.getRhs());
		assertTrue(withGoals.getIndexedModel().hasConstraintFamily(ConstraintAssembler.GOAL_DRI_CONTENT));
		assertFalse(indexedModel.hasConstraintFamily(ConstraintAssembler.GOAL_H2_CONTENT));
	}

	@Test
	void testLoadJumpSplit() {
		IndexedConstraint first = constraint(ConstraintAssembler.LOAD_JUMP, 0);
		assertEquals(1, first.size());
		assertEquals(0.0, first.getRhs());

		IndexedConstraint split = constraint(ConstraintAssembler.LOAD_JUMP_SPLIT, 3);
		assertEquals(1.0, split.getCoefficient(vars.getLoadJumpUp(p(3))));
		assertEquals(-1.0, split.getCoefficient(vars.getLoadJumpDown(p(3))));
		assertEquals(-1.0, split.getCoefficient(vars.getLoadJump(p(3))));
	}

	@Test
	void testEquipmentRunningSumsAllModes() throws ModelConstructionException {
		BatchProductionModel twoModes = BatchProductionModelBuilder.build(
				PlantFixtures.input(PlantFixtures.configurationWithTwoModes()), ObjectiveType.MAX_PROFIT);
		ModelVariables twoModeVars = twoModes.getVariables();
		VirtualEquipment v2 = PlantFixtures.secondMode();

		IndexedConstraint running = twoModes.getIndexedModel()
				.getConstraint(ConstraintAssembler.EQUIPMENT_RUNNING, PlantFixtures.EAF, 4).get();
		assertEquals(1.0, running.getCoefficient(twoModeVars.getEquipmentRunning(PlantFixtures.EAF, p(4))));
		assertEquals(-1.0, running.getCoefficient(twoModeVars.getVirtualEquipmentRunning(v, p(4))));
		assertEquals(-1.0, running.getCoefficient(twoModeVars.getVirtualEquipmentRunning(v2, p(4))));
		assertEquals(3, running.size());

		// second mode started while the first still runs
		Map<Variable, Double> fixed = new LinkedHashMap<>();
		fixed.put(twoModeVars.getEquipmentTurnOn(v, p(0)), 1.0);
		fixed.put(twoModeVars.getEquipmentTurnOn(v2, p(1)), 1.0);
		assertEquals(SolveStatus.INFEASIBLE, new FixedSolve(twoModes, fixed).status);
	}

	@Test
	void testEquipmentLoadSuperposesAllModes() throws ModelConstructionException {
		BatchProductionModel twoModes = BatchProductionModelBuilder.build(
				PlantFixtures.input(PlantFixtures.configurationWithTwoModes()), ObjectiveType.MAX_PROFIT);
		ModelVariables twoModeVars = twoModes.getVariables();
		VirtualEquipment v2 = PlantFixtures.secondMode();

		IndexedConstraint load = twoModes.getIndexedModel()
				.getConstraint(ConstraintAssembler.EQUIPMENT_LOAD, PlantFixtures.EAF, 2).get();
		assertEquals(1.0, load.getCoefficient(twoModeVars.getEquipmentLoad(PlantFixtures.EAF, p(2))));
		// v1 profile {4, 6}
		assertEquals(-4.0, load.getCoefficient(twoModeVars.getEquipmentTurnOn(v, p(2))));
		assertEquals(-6.0, load.getCoefficient(twoModeVars.getEquipmentTurnOn(v, p(1))));
		assertEquals(0.0, load.getCoefficient(twoModeVars.getEquipmentTurnOn(v, p(0))));
		// v2 profile {5, 5, 5}
		for (int t = 0; t <= 2; t++) {
			assertEquals(-PlantFixtures.SECOND_MODE_LOAD, load.getCoefficient(twoModeVars.getEquipmentTurnOn(v2, p(t))));
		}
		assertEquals(6, load.size());
	}

	@Test
	void testRollingFollowsEachModeByItsOwnDuration() throws ModelConstructionException {
		BatchProductionModel twoModes = BatchProductionModelBuilder.build(
				PlantFixtures.input(PlantFixtures.configurationWithTwoModes()), ObjectiveType.MAX_PROFIT);
		ModelVariables twoModeVars = twoModes.getVariables();
		VirtualEquipment v2 = PlantFixtures.secondMode();

		IndexedConstraint rolling = twoModes.getIndexedModel()
				.getConstraint(ConstraintAssembler.ROLLING_RUNNING, PlantFixtures.EAF, 5).get();
		assertEquals(1.0, rolling.getCoefficient(twoModeVars.getRollingRunning(PlantFixtures.EAF, p(5))));
		assertEquals(-1.0, rolling.getCoefficient(twoModeVars.getEquipmentTurnOn(v, p(2))));
		assertEquals(-1.0, rolling.getCoefficient(twoModeVars.getEquipmentTurnOn(v2, p(1))));
		assertEquals(3, rolling.size());

		IndexedConstraint storage = twoModes.getIndexedModel()
				.getConstraint(ConstraintAssembler.INTERMEDIATE_STORAGE, PlantFixtures.EAF, PlantFixtures.SECOND_MODE, 3)
				.get();
		assertEquals(-PlantFixtures.SECOND_MODE_OUTPUT, storage.getCoefficient(twoModeVars.getEquipmentTurnOn(v2, p(0))));
	}
}
