package flexibleBatchProduction.solve;

import com.google.ortools.Loader;
import com.google.ortools.modelbuilder.ModelBuilder;
import com.google.ortools.modelbuilder.ModelSolver;
import com.google.ortools.modelbuilder.SolveStatus;
import com.google.ortools.modelbuilder.Variable;

import flexibleBatchProduction.construct.BatchProductionModel;
import flexibleBatchProduction.construct.IndexedModel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Solves the batch production model with a solver bundled in OR-tools, SCIP unless told
 * otherwise. Needs no license.
 */
public class OrToolsMilpSolver implements MilpSolver {

	private static final Logger LOGGER = LoggerFactory.getLogger(OrToolsMilpSolver.class);

	static {
		Loader.loadNativeLibraries();
	}

	public static final String DEFAULT_SOLVER = "scip";

	private final String solverName;

	public OrToolsMilpSolver() {
		this(DEFAULT_SOLVER);
	}

	public OrToolsMilpSolver(String solverName) {
		this.solverName = solverName;
	}

	public boolean isAvailable() {
		return new ModelSolver(solverName).solverIsSupported();
	}

	@Override
	public SolvedModel solve(BatchProductionModel model, SolverSettings settings) throws SolverException {
		IndexedModel indexedModel = model.getIndexedModel();
		if (!indexedModel.hasObjective()) {
			throw new SolverException("Model has no objective");
		}

		ModelSolver solver = new ModelSolver(solverName);
		if (!solver.solverIsSupported()) {
			throw new SolverException("Solver " + solverName + " is not available in this OR-tools build");
		}
		solver.enableOutput(settings.isVerbose());
		if (settings.getTimeLimit().isPresent()) {
			solver.setTimeLimit(Duration.ofNanos(Math.round(settings.getTimeLimit().get() * 1e9)));
		}
		if (settings.getMipGap().isPresent()) {
			if (DEFAULT_SOLVER.equals(solverName)) {
				solver.setSolverSpecificParameters("limits/gap = " + settings.getMipGap().get());
			} else {
				LOGGER.warn("MIP gap {} ignored by solver {}", settings.getMipGap().get(), solverName);
			}
		}

		ModelBuilder copy = model.copyModelBuilder();
		LOGGER.info("Solving {} model with {} and {}", model.getObjectiveType().getToken(), solverName, settings);
		SolverStatus status = mapStatus(solver.solve(copy));

		Map<Integer, Double> values = new LinkedHashMap<>();
		Double objectiveValue = null;
		if (status == SolverStatus.OPTIMAL || status == SolverStatus.SUBOPTIMAL) {
			for (Variable var : indexedModel.getVariables()) {
				values.put(var.getIndex(), solver.getValue(copy.varFromIndex(var.getIndex())));
			}
			objectiveValue = solver.getObjectiveValue();
		}

		if (status == SolverStatus.OPTIMAL) {
			LOGGER.info("Solver finished after {} s: {}, objective value {}", solver.getWallTime(), status,
					objectiveValue);
		} else {
			LOGGER.warn("Solver finished after {} s: {}, objective value {}", solver.getWallTime(), status,
					objectiveValue);
		}
		return new SolvedModel(model, status, objectiveValue, values);
	}

	static SolverStatus mapStatus(SolveStatus status) {
		switch (status) {
		case OPTIMAL:
			return SolverStatus.OPTIMAL;
		case FEASIBLE:
			return SolverStatus.SUBOPTIMAL;
		case INFEASIBLE:
			return SolverStatus.INFEASIBLE;
		case UNBOUNDED:
			return SolverStatus.UNBOUNDED;
		default:
			return SolverStatus.OTHER;
		}
	}
}
