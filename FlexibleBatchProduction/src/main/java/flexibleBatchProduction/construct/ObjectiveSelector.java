package flexibleBatchProduction.construct;

import com.google.ortools.modelbuilder.LinearExpr;
import com.google.ortools.modelbuilder.LinearExprBuilder;

import flexibleBatchProduction.models.Period;

/**
 * Builds the objective expression for an {@link ObjectiveType} and installs it on the model.
 */
public final class ObjectiveSelector {

	private ObjectiveSelector() {
	}

	public static LinearExpr install(IndexedModel model, IndexDomains domains, ModelVariables vars,
			ObjectiveType type) {
		LinearExpr objective;
		switch (type) {
		case MAX_PROFIT:
			objective = profit(domains, vars);
			break;
		case STABILITY:
			objective = stability(domains, vars);
			break;
		case MIN_LOAD_JUMPS:
			objective = loadJumps(domains, vars);
			break;
		default:
			throw new IllegalArgumentException("Unhandled objective " + type);
		}
		model.setObjective(objective, type.isMaximize());
		return objective;
	}

	private static LinearExpr profit(IndexDomains domains, ModelVariables vars) {
		LinearExprBuilder expr = LinearExpr.newBuilder();
		for (Period t : domains.getPeriods()) {
			expr.add(vars.getElectricityMarketProfit(t));
			vars.getElectricityMarketCost(t).ifPresent(cost -> expr.addTerm(cost, -1.0));
		}
		vars.getGridChargesPower().ifPresent(charges -> expr.addTerm(charges, -1.0));
		return expr.build();
	}

	private static LinearExpr stability(IndexDomains domains, ModelVariables vars) {
		LinearExprBuilder expr = LinearExpr.newBuilder();
		for (Period t : domains.getPeriods()) {
			expr.addTerm(AbsoluteValueSplit.magnitude(vars.getDistanceAboveMean(t), vars.getDistanceBelowMean(t)),
					1.0 / domains.getHorizon());
		}
		return expr.build();
	}

	private static LinearExpr loadJumps(IndexDomains domains, ModelVariables vars) {
		LinearExprBuilder expr = LinearExpr.newBuilder();
		for (Period t : domains.getPeriods()) {
			expr.add(AbsoluteValueSplit.magnitude(vars.getLoadJumpUp(t), vars.getLoadJumpDown(t)));
		}
		return expr.build();
	}
}
