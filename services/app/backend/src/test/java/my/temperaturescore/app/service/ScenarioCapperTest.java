package my.temperaturescore.app.service;

import my.temperaturescore.app.model.AggregationMethod;
import my.temperaturescore.app.model.Company;
import my.temperaturescore.app.model.EngagementType;
import my.temperaturescore.app.model.Scenario;
import my.temperaturescore.app.model.ScenarioType;
import my.temperaturescore.app.model.ScoreBasis;
import my.temperaturescore.app.model.ScoreRecord;
import my.temperaturescore.app.model.ScoredTable;
import org.junit.jupiter.api.Test;

import java.util.List;

import static my.temperaturescore.app.support.ScoringFixtures.company;
import static my.temperaturescore.app.support.ScoringFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;

class ScenarioCapperTest {
	private final ScenarioCapper capper = new ScenarioCapper(new AggregationEngine(), 1);

	private final ScoredTable table = new ScoredTable(List.of(
			record(company("A", "Energy", "EU", 100.0), 3.0, ScoreBasis.TARGET),
			record(engaged("B", 300.0), 4.0, ScoreBasis.FALLBACK),
			record(company("C", "Energy", "EU", 50.0), 1.5, ScoreBasis.TARGET)
	), List.of());

	@Test
	void withoutScenarioReturnsTableUnchanged() {
		assertThat(capper.apply(table, null, AggregationMethod.WATS)).isSameAs(table);
	}

	@Test
	void approvedTargetsCapsTargetBasedScores() {
		Scenario scenario = new Scenario(ScenarioType.APPROVED_TARGETS, EngagementType.SET_SBTI_TARGETS);

		ScoredTable capped = capper.apply(table, scenario, AggregationMethod.WATS);

		assertThat(scores(capped)).containsExactly(1.75, 4.0, 1.5);
	}

	@Test
	void highestContributorsCapsTopPortfolioContributors() {
		Scenario scenario = new Scenario(ScenarioType.HIGHEST_CONTRIBUTORS, EngagementType.SET_TARGETS);

		ScoredTable capped = capper.apply(table, scenario, AggregationMethod.WATS);

		assertThat(scores(capped)).containsExactly(3.0, 2.0, 1.5);
	}

	@Test
	void highestContributorsApprovedCapsEngagedCompanies() {
		Scenario scenario = new Scenario(ScenarioType.HIGHEST_CONTRIBUTORS_APPROVED, EngagementType.SET_SBTI_TARGETS);

		ScoredTable capped = capper.apply(table, scenario, AggregationMethod.AOTS);

		assertThat(scores(capped)).containsExactly(3.0, 1.75, 1.5);
	}

	@Test
	void targetsScenarioCapsNothing() {
		ScoredTable capped = capper.apply(table, new Scenario(ScenarioType.TARGETS, null), AggregationMethod.WATS);

		assertThat(capped.records()).isEqualTo(table.records());
	}

	@Test
	void capsDependOnEngagementType() {
		assertThat(new Scenario(ScenarioType.HIGHEST_CONTRIBUTORS, EngagementType.SET_TARGETS).scoreCap()).isEqualTo(2.0);
		assertThat(new Scenario(ScenarioType.HIGHEST_CONTRIBUTORS, EngagementType.SET_SBTI_TARGETS).scoreCap()).isEqualTo(1.75);
		assertThat(new Scenario(ScenarioType.TARGETS, null).fallbackScore(3.2)).isEqualTo(2.0);
		assertThat(new Scenario(ScenarioType.APPROVED_TARGETS, null).fallbackScore(3.2)).isEqualTo(3.2);
	}

	private Company engaged(String id, double marketCap) {
		return new Company(id, "Company " + id, "Energy", "EU", marketCap, null, null, null, null, null, null, true);
	}

	private List<Double> scores(ScoredTable capped) {
		return capped.records().stream().map(ScoreRecord::temperatureScore).toList();
	}
}
