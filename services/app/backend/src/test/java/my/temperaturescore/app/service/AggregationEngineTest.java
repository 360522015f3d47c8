package my.temperaturescore.app.service;

import my.temperaturescore.app.model.AggregationMethod;
import my.temperaturescore.app.model.AggregationReport;
import my.temperaturescore.app.model.AggregationResult;
import my.temperaturescore.app.model.Company;
import my.temperaturescore.app.model.Contribution;
import my.temperaturescore.app.model.GroupingKey;
import my.temperaturescore.app.model.PartitionStatus;
import my.temperaturescore.app.model.ScopeCategory;
import my.temperaturescore.app.model.ScoreBasis;
import my.temperaturescore.app.model.ScoreRecord;
import my.temperaturescore.app.model.ScoredTable;
import my.temperaturescore.app.model.TimeFrame;
import my.temperaturescore.app.model.WarningType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;

import static my.temperaturescore.app.support.ScoringFixtures.company;
import static my.temperaturescore.app.support.ScoringFixtures.fullCompany;
import static my.temperaturescore.app.support.ScoringFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AggregationEngineTest {
	private final AggregationEngine engine = new AggregationEngine();

	@Test
	void weightsByMarketCap() {
		ScoredTable table = table(
				record(company("A", "Energy", "EU", 100.0), 2.0, ScoreBasis.TARGET),
				record(company("B", "Energy", "EU", 300.0), 4.0, ScoreBasis.TARGET));

		AggregationResult portfolio = portfolio(engine.aggregate(table, AggregationMethod.WATS, List.of()));

		assertThat(portfolio.status()).isEqualTo(PartitionStatus.OK);
		assertThat(portfolio.score()).isEqualTo(3.5);
		assertThat(portfolio.companyCount()).isEqualTo(2);
		assertThat(portfolio.totalWeight()).isEqualTo(400.0);
	}

	@Test
	void normalizedWeightsSumToOneForEveryMethod() {
		List<ScoreRecord> records = new ArrayList<>();
		for (int i = 1; i <= 7; i++) {
			records.add(record(fullCompany("C" + i, i * 13.7), 50.0 * i, 1.5 + i * 0.37, ScoreBasis.TARGET, null));
		}
		for (AggregationMethod method : AggregationMethod.values()) {
			AggregationEngine.Partition partition = engine.weigh(records, method, ScopeCategory.S1S2);

			assertThat(partition.weights()).as(method.name()).hasSize(7);
			assertThat(partition.weightSum()).as(method.name()).isCloseTo(1.0, within(AggregationEngine.WEIGHT_TOLERANCE));
			assertThat(portfolio(engine.aggregate(table(records), method, List.of())).status()).isEqualTo(PartitionStatus.OK);
		}
	}

	@Test
	void resultIsIndependentOfPortfolioOrder() {
		List<ScoreRecord> records = new ArrayList<>();
		for (int i = 0; i < 25; i++) {
			records.add(record(fullCompany(String.format("C%02d", i), 1.0 + i * 0.731), 10.0 + i, 1.1 + (i % 7) * 0.45,
					ScoreBasis.TARGET, null));
		}
		List<ScoreRecord> shuffled = new ArrayList<>(records);
		Collections.shuffle(shuffled, new Random(42));

		for (AggregationMethod method : AggregationMethod.values()) {
			Double original = portfolio(engine.aggregate(table(records), method, List.of())).score();
			Double reordered = portfolio(engine.aggregate(table(shuffled), method, List.of())).score();

			assertThat(reordered).as(method.name()).isEqualTo(original);
		}
	}

	@Test
	void allFallbackPartitionEqualsFallbackExactly() {
		ScoredTable table = table(
				record(company("A", null, null, 1.0), 3.2, ScoreBasis.FALLBACK),
				record(company("B", null, null, 3.0), 3.2, ScoreBasis.FALLBACK),
				record(company("C", null, null, 7.0), 3.2, ScoreBasis.FALLBACK));

		AggregationResult portfolio = portfolio(engine.aggregate(table, AggregationMethod.WATS, List.of()));

		assertThat(portfolio.score()).isEqualTo(3.2);
		assertThat(portfolio.influencePercentage()).isCloseTo(100.0, within(1e-9));
	}

	@Test
	void singleCompanyEqualsItsScoreForEveryMethod() {
		ScoredTable table = table(record(fullCompany("A", 42.0), 100.0, 2.73, ScoreBasis.TARGET, null));

		for (AggregationMethod method : AggregationMethod.values()) {
			assertThat(portfolio(engine.aggregate(table, method, List.of())).score()).as(method.name()).isEqualTo(2.73);
		}
	}

	@Test
	void partitionWithoutUsableWeightsIsUndefined() {
		ScoredTable table = table(
				record(company("A", "Energy", "EU", null), 2.0, ScoreBasis.TARGET),
				record(company("B", "Energy", "EU", 0.0), 3.0, ScoreBasis.TARGET));

		AggregationReport report = engine.aggregate(table, AggregationMethod.WATS, List.of());
		AggregationResult portfolio = portfolio(report);

		assertThat(portfolio.status()).isEqualTo(PartitionStatus.UNDEFINED);
		assertThat(portfolio.score()).isNull();
		assertThat(portfolio.excludedCompanyIds()).containsExactly("A", "B");
		assertThat(report.warnings()).extracting(w -> w.type())
				.containsExactly(WarningType.MISSING_WEIGHT, WarningType.MISSING_WEIGHT, WarningType.EMPTY_PARTITION);
	}

	@Test
	void excludesCompaniesWithoutWeightFromTheAverage() {
		ScoredTable table = table(
				record(company("A", "Energy", "EU", 100.0), 2.0, ScoreBasis.TARGET),
				record(company("B", "Energy", "EU", null), 4.0, ScoreBasis.TARGET));

		AggregationReport report = engine.aggregate(table, AggregationMethod.WATS, List.of());

		assertThat(portfolio(report).score()).isEqualTo(2.0);
		assertThat(portfolio(report).excludedCompanyIds()).containsExactly("B");
		assertThat(report.warnings()).singleElement().satisfies(w -> {
			assertThat(w.type()).isEqualTo(WarningType.MISSING_WEIGHT);
			assertThat(w.companyId()).isEqualTo("B");
			assertThat(w.message()).contains("market_cap");
		});
	}

	@Test
	void requestedSliceWithoutRowsIsUndefined() {
		ScoredTable table = table(record(company("A", "Energy", "EU", 100.0), 2.0, ScoreBasis.TARGET));

		AggregationReport report = engine.aggregate(table, AggregationMethod.WATS, List.of(),
				EnumSet.of(TimeFrame.MID, TimeFrame.LONG), EnumSet.of(ScopeCategory.S1S2));

		assertThat(report.portfolio(TimeFrame.MID, ScopeCategory.S1S2).orElseThrow().isDefined()).isTrue();
		assertThat(report.portfolio(TimeFrame.LONG, ScopeCategory.S1S2).orElseThrow().status()).isEqualTo(PartitionStatus.UNDEFINED);
		assertThat(report.nested()).containsOnlyKeys(TimeFrame.MID, TimeFrame.LONG);
	}

	@Test
	void groupsBySectorInSortedOrder() {
		ScoredTable table = table(
				record(company("A", "Energy", "EU", 100.0), 2.0, ScoreBasis.TARGET),
				record(company("B", "Banks", "US", 100.0), 3.0, ScoreBasis.TARGET),
				record(company("C", null, "EU", 100.0), 4.0, ScoreBasis.FALLBACK),
				record(company("D", "Energy", "US", 300.0), 4.0, ScoreBasis.TARGET));

		AggregationReport report = engine.aggregate(table, AggregationMethod.WATS, List.of(GroupingKey.SECTOR));

		assertThat(report.results()).extracting(AggregationResult::group)
				.containsExactly("portfolio", "Banks", "Energy", "unknown");
		assertThat(report.find(TimeFrame.MID, ScopeCategory.S1S2, "Energy").orElseThrow().score()).isEqualTo(3.5);
		assertThat(report.find(TimeFrame.MID, ScopeCategory.S1S2, "unknown").orElseThrow().score()).isEqualTo(4.0);
	}

	@Test
	void groupsByJointKeys() {
		ScoredTable table = table(
				record(company("A", "Energy", "EU", 100.0), 2.0, ScoreBasis.TARGET),
				record(company("B", "Energy", "US", 100.0), 3.0, ScoreBasis.TARGET),
				record(company("C", "Energy", "EU", 100.0), 4.0, ScoreBasis.TARGET));

		AggregationReport report = engine.aggregate(table, AggregationMethod.AOTS, List.of(GroupingKey.SECTOR, GroupingKey.REGION));

		assertThat(report.nested().get(TimeFrame.MID).get(ScopeCategory.S1S2))
				.containsOnlyKeys("portfolio", "Energy-EU", "Energy-US");
		assertThat(report.find(TimeFrame.MID, ScopeCategory.S1S2, "Energy-EU").orElseThrow().score()).isEqualTo(3.0);
	}

	@Test
	void reportsContributionsAndFallbackInfluence() {
		ScoredTable table = table(
				record(company("A", "Energy", "EU", 100.0), 2.0, ScoreBasis.TARGET),
				record(company("B", "Energy", "EU", 300.0), 4.0, ScoreBasis.FALLBACK));

		AggregationResult portfolio = portfolio(engine.aggregate(table, AggregationMethod.WATS, List.of()));

		assertThat(portfolio.influencePercentage()).isEqualTo(75.0);
		assertThat(portfolio.contributions()).extracting(Contribution::companyId).containsExactly("B", "A");
		Contribution top = portfolio.contributions().get(0);
		assertThat(top.contribution()).isEqualTo(3.0);
		assertThat(top.relativeContribution()).isCloseTo(3.0 / 3.5 * 100.0, within(1e-9));
	}

	@Test
	void derivesOwnershipFromInvestmentWhenMissing() {
		Company company = new Company("A", "A", null, null, 1000.0, null, null, null, null, null, null, false);
		ScoreRecord record = record(company, 100.0, 2.0, ScoreBasis.TARGET, null);

		AggregationEngine.Partition partition = engine.weigh(List.of(record), AggregationMethod.MOTS, ScopeCategory.S1S2);

		assertThat(partition.weights().get(0).basis()).isCloseTo(100.0, within(1e-9));
	}

	@Test
	void emissionWeightsFollowTheScope() {
		Company company = new Company("A", "A", null, null, null, null, null, null, null, 20.0, 30.0, false);
		ScoreRecord record = record(company, 100.0, 2.0, ScoreBasis.TARGET, null);

		assertThat(engine.weigh(List.of(record), AggregationMethod.TETS, ScopeCategory.S1S2).totalBasis()).isEqualTo(20.0);
		assertThat(engine.weigh(List.of(record), AggregationMethod.TETS, ScopeCategory.S3).totalBasis()).isEqualTo(30.0);
		assertThat(engine.weigh(List.of(record), AggregationMethod.TETS, ScopeCategory.S1S2S3).totalBasis()).isEqualTo(50.0);
	}

	@Test
	void rejectsMissingMethod() {
		ScoredTable table = table(record(company("A", "Energy", "EU", 100.0), 2.0, ScoreBasis.TARGET));

		assertThatThrownBy(() -> engine.aggregate(table, null, List.of()))
				.isInstanceOf(ConfigurationException.class);
	}

	private ScoredTable table(ScoreRecord... records) {
		return new ScoredTable(List.of(records), List.of());
	}

	private ScoredTable table(List<ScoreRecord> records) {
		return new ScoredTable(records, List.of());
	}

	private AggregationResult portfolio(AggregationReport report) {
		return report.portfolio(TimeFrame.MID, ScopeCategory.S1S2).orElseThrow();
	}
}
