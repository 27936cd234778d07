package flexibleBatchProduction.solve;

import flexibleBatchProduction.construct.BatchProductionModel;

/**
 * Solves a built batch production model. Implementations never mutate the model.
 */
public interface MilpSolver {

	SolvedModel solve(BatchProductionModel model, SolverSettings settings) throws SolverException;
}
