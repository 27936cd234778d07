package flexibleBatchProduction.solve;

import com.google.ortools.modelbuilder.Variable;
import com.gurobi.gurobi.GRB;
import com.gurobi.gurobi.GRBConstr;
import com.gurobi.gurobi.GRBEnv;
import com.gurobi.gurobi.GRBException;
import com.gurobi.gurobi.GRBModel;
import com.gurobi.gurobi.GRBVar;

import flexibleBatchProduction.construct.BatchProductionModel;
import flexibleBatchProduction.construct.IndexedModel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Solves the batch production model with Gurobi. The frozen model is handed over as an MPS
 * file, read back by name. Environment, model and file are created per solve and released
 * afterwards.
 */
public class GurobiMilpSolver implements MilpSolver {

	private static final Logger LOGGER = LoggerFactory.getLogger(GurobiMilpSolver.class);

	@Override
	public SolvedModel solve(BatchProductionModel model, SolverSettings settings) throws SolverException {
		IndexedModel indexedModel = model.getIndexedModel();
		if (!indexedModel.hasObjective()) {
			throw new SolverException("Model has no objective");
		}

		Path mpsFile = writeMps(model);
		GRBEnv env = null;
		GRBModel grbModel = null;
		try {
			env = new GRBEnv(true);
			env.set(GRB.IntParam.OutputFlag, settings.isVerbose() ? 1 : 0);
			env.start();
			grbModel = new GRBModel(env, mpsFile.toString());
			grbModel.set(GRB.IntAttr.ModelSense, indexedModel.isMaximize() ? GRB.MAXIMIZE : GRB.MINIMIZE);
			configureGurobi(grbModel, settings);

			List<Variable> variables = indexedModel.getVariables();
			GRBVar[] grbVars = new GRBVar[variables.size()];
			for (int i = 0; i < grbVars.length; i++) {
				grbVars[i] = grbModel.getVarByName(variables.get(i).getName());
			}

			LOGGER.info("Solving {} model with {}", model.getObjectiveType().getToken(), settings);
			grbModel.optimize();

			SolverStatus status = mapStatus(grbModel.get(GRB.IntAttr.Status));
			Map<Integer, Double> values = new LinkedHashMap<>();
			Double objectiveValue = null;
			if (grbModel.get(GRB.IntAttr.SolCount) > 0) {
				for (int i = 0; i < grbVars.length; i++) {
					Variable var = variables.get(i);
					double value = grbVars[i] != null ? grbVars[i].get(GRB.DoubleAttr.X) : unreferencedValue(var);
					values.put(var.getIndex(), value);
				}
				objectiveValue = grbModel.get(GRB.DoubleAttr.ObjVal);
			}

			if (status == SolverStatus.OPTIMAL) {
				LOGGER.info("Solver finished: {}, objective value {}", status, objectiveValue);
			} else {
				LOGGER.warn("Solver finished: {}, objective value {}", status, objectiveValue);
			}
			if (status == SolverStatus.INFEASIBLE) {
				logIrreducibleInconsistentSubsystem(grbModel);
			}
			return new SolvedModel(model, status, objectiveValue, values);
		} catch (GRBException e) {
			throw new SolverException("Gurobi error " + e.getErrorCode() + ": " + e.getMessage(), e);
		} finally {
			dispose(grbModel, env);
			deleteMps(mpsFile);
		}
	}

	private Path writeMps(BatchProductionModel model) throws SolverException {
		try {
			Path mpsFile = Files.createTempFile("batch-production-", ".mps");
			if (!model.copyModelBuilder().writeToMpsFile(mpsFile.toString(), false)) {
				deleteMps(mpsFile);
				throw new SolverException("Could not export model to " + mpsFile);
			}
			LOGGER.debug("Exported model to {}", mpsFile);
			return mpsFile;
		} catch (IOException e) {
			throw new SolverException("Could not create model file: " + e.getMessage(), e);
		}
	}

	private void configureGurobi(GRBModel grbModel, SolverSettings settings) throws GRBException {
		if (settings.getTimeLimit().isPresent()) {
			grbModel.set(GRB.DoubleParam.TimeLimit, settings.getTimeLimit().get());
		}
		if (settings.getMipGap().isPresent()) {
			grbModel.set(GRB.DoubleParam.MIPGap, settings.getMipGap().get());
		}
	}

	/**
	 * A variable that appears in no row and not in the objective may be dropped from the MPS
	 * columns. Any value within its bounds is optimal; take the one closest to zero.
	 */
	static double unreferencedValue(Variable var) {
		return Math.min(Math.max(0.0, var.getLowerBound()), var.getUpperBound());
	}

	static SolverStatus mapStatus(int gurobiStatus) {
		switch (gurobiStatus) {
		case GRB.Status.OPTIMAL:
			return SolverStatus.OPTIMAL;
		case GRB.Status.SUBOPTIMAL:
			return SolverStatus.SUBOPTIMAL;
		case GRB.Status.INFEASIBLE:
			return SolverStatus.INFEASIBLE;
		case GRB.Status.UNBOUNDED:
			return SolverStatus.UNBOUNDED;
		case GRB.Status.INF_OR_UNBD:
			return SolverStatus.INFEASIBLE_OR_UNBOUNDED;
		case GRB.Status.TIME_LIMIT:
			return SolverStatus.TIME_LIMIT;
		default:
			return SolverStatus.OTHER;
		}
	}

	/**
	 * Logs the irreducible inconsistent subsystem. A failure here only costs the diagnosis;
	 * the caller still reports the infeasible status.
	 */
	private void logIrreducibleInconsistentSubsystem(GRBModel grbModel) {
		try {
			grbModel.computeIIS();
			for (GRBConstr constr : grbModel.getConstrs()) {
				if (constr.get(GRB.IntAttr.IISConstr) == 1) {
					LOGGER.warn("IIS constraint: {}", constr.get(GRB.StringAttr.ConstrName));
				}
			}
			for (GRBVar var : grbModel.getVars()) {
				if (var.get(GRB.IntAttr.IISLB) == 1 || var.get(GRB.IntAttr.IISUB) == 1) {
					LOGGER.warn("IIS bound: {}", var.get(GRB.StringAttr.VarName));
				}
			}
		} catch (GRBException e) {
			LOGGER.warn("Could not compute IIS: Gurobi error {}: {}", e.getErrorCode(), e.getMessage());
		}
	}

	private void dispose(GRBModel grbModel, GRBEnv env) {
		try {
			if (grbModel != null) {
				grbModel.dispose();
			}
			if (env != null) {
				env.dispose();
			}
		} catch (GRBException e) {
			LOGGER.warn("Could not release Gurobi resources: {}", e.getMessage());
		}
	}

	private void deleteMps(Path mpsFile) {
		try {
			Files.deleteIfExists(mpsFile);
		} catch (IOException e) {
			LOGGER.warn("Could not delete model file {}: {}", mpsFile, e.getMessage());
		}
	}
}
