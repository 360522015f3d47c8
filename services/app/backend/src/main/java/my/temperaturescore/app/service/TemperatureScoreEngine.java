package my.temperaturescore.app.service;

import my.temperaturescore.app.benchmark.BenchmarkModel;
import my.temperaturescore.app.benchmark.BenchmarkTrajectory;
import my.temperaturescore.app.benchmark.PathwayResolver;
import my.temperaturescore.app.model.DataQualityWarning;
import my.temperaturescore.app.model.Holding;
import my.temperaturescore.app.model.PortfolioCompany;
import my.temperaturescore.app.model.ProviderData;
import my.temperaturescore.app.model.ScopeCategory;
import my.temperaturescore.app.model.ScoreBasis;
import my.temperaturescore.app.model.ScoreRecord;
import my.temperaturescore.app.model.ScoredTable;
import my.temperaturescore.app.model.ScoringConfig;
import my.temperaturescore.app.model.Target;
import my.temperaturescore.app.model.TimeFrame;
import my.temperaturescore.app.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Scores every (company, scope, time frame) combination of a portfolio. Each slot reads only
 * immutable input, so slots can be computed in parallel; the output keeps portfolio order.
 */
public class TemperatureScoreEngine {
	private static final Logger logger = LoggerFactory.getLogger(TemperatureScoreEngine.class);
	static final double S3_MATERIALITY = 0.4;

	private final BenchmarkModel benchmarkModel;
	private final TargetSelector targetSelector;
	private final double minScore;
	private final double maxScore;
	private final boolean parallel;

	public TemperatureScoreEngine(BenchmarkModel benchmarkModel, double minScore, double maxScore, boolean parallel) {
		if (benchmarkModel == null) {
			throw new IllegalArgumentException("benchmark model is required");
		}
		if (minScore < 0.0 || maxScore <= minScore) {
			throw new IllegalArgumentException("score bounds must satisfy 0 <= min < max, got [" + minScore + ", " + maxScore + "]");
		}
		this.benchmarkModel = benchmarkModel;
		this.targetSelector = new TargetSelector();
		this.minScore = minScore;
		this.maxScore = maxScore;
		this.parallel = parallel;
	}

	public ScoredTable calculate(ProviderData providerData, List<Holding> portfolio, ScoringConfig config) {
		validate(config);
		ProviderDataJoiner.JoinResult joined = new ProviderDataJoiner().join(portfolio, providerData);
		ScoredTable scored = calculate(joined.companies(), config);
		List<DataQualityWarning> warnings = new ArrayList<>(joined.warnings());
		warnings.addAll(scored.warnings());
		return new ScoredTable(scored.records(), warnings);
	}

	public ScoredTable calculate(List<PortfolioCompany> companies, ScoringConfig config) {
		validate(config);
		List<Slot> slots = new ArrayList<>();
		for (PortfolioCompany company : companies == null ? List.<PortfolioCompany>of() : companies) {
			for (ScopeCategory scope : config.scopes()) {
				for (TimeFrame timeFrame : config.timeFrames()) {
					slots.add(new Slot(company, scope, timeFrame));
				}
			}
		}
		IntStream indexes = IntStream.range(0, slots.size());
		if (parallel) {
			indexes = indexes.parallel();
		}
		List<SlotResult> results = indexes
				.mapToObj(i -> score(slots.get(i), config))
				.toList();

		List<ScoreRecord> records = new ArrayList<>(results.size());
		List<DataQualityWarning> warnings = new ArrayList<>();
		int targetBased = 0;
		for (SlotResult result : results) {
			records.add(result.record());
			result.warning().ifPresent(warnings::add);
			if (result.record().basis() == ScoreBasis.TARGET) {
				targetBased++;
			}
		}
		logger.info("Scored {} slots with model {}: {} target-based, {} fallback, {} warnings",
				records.size(), config.model(), targetBased, records.size() - targetBased, warnings.size());
		return new ScoredTable(records, warnings);
	}

	private void validate(ScoringConfig config) {
		if (config == null) {
			throw new ConfigurationException("config", "null", "scoring configuration is required");
		}
		if (!benchmarkModel.models().contains(config.model())) {
			throw new ConfigurationException("model", String.valueOf(config.model()),
					"no benchmark data for this model, available " + benchmarkModel.models());
		}
	}

	private SlotResult score(Slot slot, ScoringConfig config) {
		PortfolioCompany holding = slot.company();
		double fallback = config.effectiveFallbackScore();
		if (!holding.inProviderData()) {
			return fallback(slot, fallback, null);
		}
		Optional<Target> selected = targetSelector.select(holding.targets(), slot.scope(), slot.timeFrame());
		if (selected.isPresent()) {
			return scoreTarget(slot, selected.get(), config);
		}
		if (slot.scope() == ScopeCategory.S1S2S3) {
			Optional<SlotResult> composed = compose(slot, config);
			if (composed.isPresent()) {
				return composed.get();
			}
		}
		DataQualityWarning warning = null;
		if (targetSelector.onlyUnusableCandidates(holding.targets(), slot.scope(), slot.timeFrame())) {
			warning = DataQualityWarning.of(WarningType.INVALID_TARGET, holding.companyId(),
					"No target for " + slot.scope() + "/" + slot.timeFrame() + " has a reduction to score");
		}
		return fallback(slot, fallback, warning);
	}

	private SlotResult scoreTarget(Slot slot, Target target, ScoringConfig config) {
		PortfolioCompany holding = slot.company();
		double fallback = config.effectiveFallbackScore();
		String companyId = holding.companyId();
		int horizon = target.horizon();
		Optional<String> pathway = PathwayResolver.resolve(target);
		Optional<BenchmarkTrajectory> trajectory = pathway.flatMap(variable ->
				benchmarkModel.trajectory(config.model(), variable, holding.company().sector(), slot.scope()));
		if (trajectory.isEmpty()) {
			return fallback(slot, fallback, DataQualityWarning.of(WarningType.MISSING_BENCHMARK, companyId,
					"No benchmark for pathway " + pathway.orElse("unknown (intensity metric " + target.intensityMetric() + ")")
							+ ", sector " + holding.company().sector() + ", scope " + slot.scope() + ", model " + config.model()));
		}

		double annualReductionPct = target.reductionPct() / horizon;
		double raw = trajectory.get().impliedTemperature(annualReductionPct, horizon);
		if (Double.isNaN(raw) || Double.isInfinite(raw)) {
			return fallback(slot, fallback, DataQualityWarning.of(WarningType.INVALID_TARGET, companyId,
					"Target " + describe(target) + " produced a non-finite score"));
		}
		double score = Math.max(minScore, Math.min(maxScore, raw));
		DataQualityWarning warning = null;
		if (score != raw) {
			logger.warn("Clipped score {} of company {} ({} {}) to {}", raw, companyId, slot.scope(), slot.timeFrame(), score);
			warning = DataQualityWarning.of(WarningType.SCORE_CLIPPED, companyId,
					"Score " + raw + " for " + slot.scope() + "/" + slot.timeFrame() + " clipped to " + score);
		}
		ScoreRecord record = new ScoreRecord(holding, slot.scope(), slot.timeFrame(), score, ScoreBasis.TARGET, target);
		return new SlotResult(record, Optional.ofNullable(warning));
	}

	/**
	 * Combines separate S1S2 and S3 targets into an S1S2S3 score. Scope 3 is ignored when it is less than
	 * {@link #S3_MATERIALITY} of total emissions; otherwise both scores are weighted by their emissions.
	 * Empty when either part is not target-based, which leaves the composite to the fallback.
	 */
	private Optional<SlotResult> compose(Slot slot, ScoringConfig config) {
		PortfolioCompany holding = slot.company();
		Optional<Target> s1s2Target = targetSelector.select(holding.targets(), ScopeCategory.S1S2, slot.timeFrame());
		Optional<Target> s3Target = targetSelector.select(holding.targets(), ScopeCategory.S3, slot.timeFrame());
		if (s1s2Target.isEmpty() || s3Target.isEmpty()) {
			return Optional.empty();
		}
		ScoreRecord s1s2 = scoreTarget(new Slot(holding, ScopeCategory.S1S2, slot.timeFrame()), s1s2Target.get(), config).record();
		ScoreRecord s3 = scoreTarget(new Slot(holding, ScopeCategory.S3, slot.timeFrame()), s3Target.get(), config).record();
		if (s1s2.isFallback() || s3.isFallback()) {
			return Optional.empty();
		}
		Double ghgS1S2 = holding.company().ghgS1S2();
		Double ghgS3 = holding.company().ghgS3();
		if (ghgS1S2 == null || ghgS3 == null || ghgS1S2 < 0.0 || ghgS3 < 0.0 || ghgS1S2 + ghgS3 <= 0.0) {
			return Optional.of(fallback(slot, config.effectiveFallbackScore(), DataQualityWarning.of(WarningType.MISSING_EMISSIONS,
					holding.companyId(), "S1S2 and S3 targets need S1S2 and S3 emissions to be combined, got "
							+ ghgS1S2 + " and " + ghgS3)));
		}
		double total = ghgS1S2 + ghgS3;
		double score;
		Target basis;
		if (ghgS3 / total < S3_MATERIALITY) {
			score = s1s2.temperatureScore();
			basis = s1s2.target();
		} else {
			score = (s1s2.temperatureScore() * ghgS1S2 + s3.temperatureScore() * ghgS3) / total;
			// the record carries the target of the larger emission share
			basis = ghgS3 > ghgS1S2 ? s3.target() : s1s2.target();
		}
		ScoreRecord record = new ScoreRecord(holding, slot.scope(), slot.timeFrame(), score, ScoreBasis.TARGET, basis);
		return Optional.of(new SlotResult(record, Optional.empty()));
	}

	private SlotResult fallback(Slot slot, double fallbackScore, DataQualityWarning warning) {
		if (warning != null) {
			logger.warn("Falling back for company {} ({} {}): {}", warning.companyId(), slot.scope(), slot.timeFrame(), warning.message());
		}
		ScoreRecord record = new ScoreRecord(slot.company(), slot.scope(), slot.timeFrame(), fallbackScore, ScoreBasis.FALLBACK, null);
		return new SlotResult(record, Optional.ofNullable(warning));
	}

	private String describe(Target target) {
		return target.id() == null ? "of " + target.companyId() : target.id();
	}

	private record Slot(PortfolioCompany company, ScopeCategory scope, TimeFrame timeFrame) {
	}

	private record SlotResult(ScoreRecord record, Optional<DataQualityWarning> warning) {
	}
}
