package my.temperaturescore.app.service;

import my.temperaturescore.app.model.AggregationMethod;
import my.temperaturescore.app.model.AggregationReport;
import my.temperaturescore.app.model.AggregationResult;
import my.temperaturescore.app.model.Contribution;
import my.temperaturescore.app.model.Scenario;
import my.temperaturescore.app.model.ScopeCategory;
import my.temperaturescore.app.model.ScoreBasis;
import my.temperaturescore.app.model.ScoreRecord;
import my.temperaturescore.app.model.ScoredTable;
import my.temperaturescore.app.model.TimeFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Applies the score cap of an engagement scenario to the companies the scenario engages.
 */
public class ScenarioCapper {
	private static final Logger logger = LoggerFactory.getLogger(ScenarioCapper.class);

	private final AggregationEngine aggregationEngine;
	private final int topContributors;

	public ScenarioCapper(AggregationEngine aggregationEngine, int topContributors) {
		if (topContributors < 0) {
			throw new IllegalArgumentException("topContributors must not be negative");
		}
		this.aggregationEngine = aggregationEngine;
		this.topContributors = topContributors;
	}

	public ScoredTable apply(ScoredTable table, Scenario scenario, AggregationMethod method) {
		if (scenario == null || scenario.scoreCap() == null) {
			return table;
		}
		double cap = scenario.scoreCap();
		Predicate<ScoreRecord> engaged = switch (scenario.type()) {
			case TARGETS -> record -> false;
			case APPROVED_TARGETS -> record -> record.basis() == ScoreBasis.TARGET;
			case HIGHEST_CONTRIBUTORS -> highestContributors(table, method);
			case HIGHEST_CONTRIBUTORS_APPROVED -> record -> record.company().engagementTarget();
		};
		int[] capped = {0};
		ScoredTable result = table.map(record -> {
			if (!engaged.test(record) || record.temperatureScore() <= cap) {
				return record;
			}
			capped[0]++;
			return record.withTemperatureScore(cap);
		}, List.of());
		logger.info("Scenario {} / {} capped {} scores at {}", scenario.type(), scenario.engagementType(), capped[0], cap);
		return result;
	}

	private Predicate<ScoreRecord> highestContributors(ScoredTable table, AggregationMethod method) {
		AggregationReport report = aggregationEngine.aggregate(table, method, List.of());
		Set<ContributorKey> contributors = new HashSet<>();
		for (AggregationResult result : report.results()) {
			if (!result.isPortfolio() || !result.isDefined()) {
				continue;
			}
			result.contributions().stream()
					.limit(topContributors)
					.map(Contribution::companyId)
					.forEach(id -> contributors.add(new ContributorKey(result.timeFrame(), result.scope(), id)));
		}
		return record -> contributors.contains(new ContributorKey(record.timeFrame(), record.scope(), record.companyId()));
	}

	private record ContributorKey(TimeFrame timeFrame, ScopeCategory scope, String companyId) {
	}
}
