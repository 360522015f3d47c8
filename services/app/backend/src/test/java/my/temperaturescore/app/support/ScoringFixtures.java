package my.temperaturescore.app.support;

import my.temperaturescore.app.benchmark.BenchmarkModel;
import my.temperaturescore.app.benchmark.BenchmarkTrajectory;
import my.temperaturescore.app.benchmark.PathwayResolver;
import my.temperaturescore.app.benchmark.RegressionPoint;
import my.temperaturescore.app.model.Company;
import my.temperaturescore.app.model.PortfolioCompany;
import my.temperaturescore.app.model.Scope;
import my.temperaturescore.app.model.ScopeCategory;
import my.temperaturescore.app.model.ScoreBasis;
import my.temperaturescore.app.model.ScoreRecord;
import my.temperaturescore.app.model.ScoringConfig;
import my.temperaturescore.app.model.Target;
import my.temperaturescore.app.model.TargetType;
import my.temperaturescore.app.model.TimeFrame;
import my.temperaturescore.app.model.ValidationStatus;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public final class ScoringFixtures {
	public static final int MODEL = 4;

	private ScoringFixtures() {
	}

	/**
	 * Flat curve for absolute targets: temperature = 3.0 - 0.1 * ARR at every horizon.
	 */
	public static BenchmarkModel flatBenchmark() {
		return new BenchmarkModel(List.of(
				trajectory(PathwayResolver.ABSOLUTE_PATHWAY, null, -0.1, 3.0),
				trajectory(PathwayResolver.GDP_INTENSITY_PATHWAY, null, -0.2, 3.2),
				trajectory(PathwayResolver.ABSOLUTE_PATHWAY, "Utilities", -0.1, 5.0)
		));
	}

	public static BenchmarkTrajectory trajectory(String variable, String sector, double param, double intercept) {
		return new BenchmarkTrajectory(MODEL, variable, sector, null, List.of(
				new RegressionPoint(5, param, intercept),
				new RegressionPoint(15, param, intercept),
				new RegressionPoint(30, param, intercept)
		));
	}

	public static ScoringConfig config(Set<TimeFrame> timeFrames, Set<ScopeCategory> scopes) {
		return new ScoringConfig(timeFrames, scopes, 3.2, MODEL, null);
	}

	public static ScoringConfig defaultConfig() {
		return config(EnumSet.allOf(TimeFrame.class), EnumSet.of(ScopeCategory.S1S2, ScopeCategory.S3, ScopeCategory.S1S2S3));
	}

	public static Company company(String id, String sector, String region, Double marketCap) {
		return new Company(id, "Company " + id, sector, region, marketCap, null, null, null, null, null, null, false);
	}

	public static Company fullCompany(String id, double size) {
		return new Company(id, "Company " + id, "Energy", "EU", size * 10, size * 12, 5.0, size * 3, size, size * 2,
				size * 4, false);
	}

	public static Target absoluteTarget(String companyId, Set<Scope> scopes, int baseYear, int targetYear,
										double reductionPct, ValidationStatus status) {
		return new Target(null, companyId, scopes, baseYear, null, targetYear, reductionPct, status, null,
				TargetType.ABSOLUTE, null);
	}

	public static Set<Scope> s1s2() {
		return EnumSet.of(Scope.S1, Scope.S2);
	}

	public static Set<Scope> allScopes() {
		return EnumSet.allOf(Scope.class);
	}

	public static PortfolioCompany holding(Company company, Double investmentValue, List<Target> targets) {
		return new PortfolioCompany(company, investmentValue, targets, true);
	}

	public static ScoreRecord record(Company company, double score, ScoreBasis basis) {
		return record(company, 100.0, score, basis, null);
	}

	public static ScoreRecord record(Company company, Double investmentValue, double score, ScoreBasis basis, Target target) {
		return new ScoreRecord(holding(company, investmentValue, target == null ? List.of() : List.of(target)),
				ScopeCategory.S1S2, TimeFrame.MID, score, basis, target);
	}
}
