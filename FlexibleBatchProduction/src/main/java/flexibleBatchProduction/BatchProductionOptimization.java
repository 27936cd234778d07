package flexibleBatchProduction;

import flexibleBatchProduction.construct.BatchProductionModel;
import flexibleBatchProduction.construct.BatchProductionModelBuilder;
import flexibleBatchProduction.construct.ModelConstructionException;
import flexibleBatchProduction.construct.ObjectiveType;
import flexibleBatchProduction.models.PlantInput;
import flexibleBatchProduction.solve.GurobiMilpSolver;
import flexibleBatchProduction.solve.MilpSolver;
import flexibleBatchProduction.solve.SolvedModel;
import flexibleBatchProduction.solve.SolverException;
import flexibleBatchProduction.solve.SolverSettings;
import flexibleBatchProduction.workbook.PlantWorkbookReader;
import flexibleBatchProduction.workbook.ResultWorkbookWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Builds, solves and persists the flexible batch production model of a green steel plant.
 */
public class BatchProductionOptimization {

	private static final Logger LOGGER = LoggerFactory.getLogger(BatchProductionOptimization.class);

	private final MilpSolver solver;
	private final PlantWorkbookReader reader = new PlantWorkbookReader();
	private final ResultWorkbookWriter writer = new ResultWorkbookWriter();

	public BatchProductionOptimization() {
		this(new GurobiMilpSolver());
	}

	public BatchProductionOptimization(MilpSolver solver) {
		this.solver = solver;
	}

	public SolvedModel optimize(PlantInput input, ObjectiveType objective, SolverSettings settings)
			throws ModelConstructionException, SolverException {
		BatchProductionModel model = BatchProductionModelBuilder.build(input, objective);
		return solver.solve(model, settings);
	}

	public SolvedModel optimize(Path input, String objectiveToken, SolverSettings settings, Path output)
			throws IOException, ModelConstructionException, SolverException {
		ObjectiveType objective = ObjectiveType.fromToken(objectiveToken);
		SolvedModel solved = optimize(reader.read(input), objective, settings);
		LOGGER.info("Optimization of {} finished with status {}", input, solved.getStatus());
		writer.write(solved, output);
		return solved;
	}
}
