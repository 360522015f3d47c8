package my.temperaturescore.app.service;

import my.temperaturescore.app.benchmark.BenchmarkModel;
import my.temperaturescore.app.config.AppProperties;
import my.temperaturescore.app.dto.AggregateResponseDto;
import my.temperaturescore.app.dto.AggregationResultDto;
import my.temperaturescore.app.dto.CompanyDto;
import my.temperaturescore.app.dto.ContributionDto;
import my.temperaturescore.app.dto.CoverageDto;
import my.temperaturescore.app.dto.HoldingDto;
import my.temperaturescore.app.dto.ScoreRecordDto;
import my.temperaturescore.app.dto.ScoreResponseDto;
import my.temperaturescore.app.dto.ScoringOptions;
import my.temperaturescore.app.dto.ScoringOptionsInfoDto;
import my.temperaturescore.app.dto.TargetDto;
import my.temperaturescore.app.dto.TemperatureScoreRequestDto;
import my.temperaturescore.app.dto.WarningDto;
import my.temperaturescore.app.model.AggregationMethod;
import my.temperaturescore.app.model.AggregationReport;
import my.temperaturescore.app.model.AggregationResult;
import my.temperaturescore.app.model.Company;
import my.temperaturescore.app.model.Contribution;
import my.temperaturescore.app.model.CoverageResult;
import my.temperaturescore.app.model.DataQualityWarning;
import my.temperaturescore.app.model.EngagementType;
import my.temperaturescore.app.model.GroupingKey;
import my.temperaturescore.app.model.Holding;
import my.temperaturescore.app.model.ProviderData;
import my.temperaturescore.app.model.ScenarioType;
import my.temperaturescore.app.model.ScopeCategory;
import my.temperaturescore.app.model.ScoreRecord;
import my.temperaturescore.app.model.ScoredTable;
import my.temperaturescore.app.model.ScoringConfig;
import my.temperaturescore.app.model.Target;
import my.temperaturescore.app.model.TargetType;
import my.temperaturescore.app.model.TimeFrame;
import my.temperaturescore.app.model.ValidationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class TemperatureScoreService {
	private static final Logger logger = LoggerFactory.getLogger(TemperatureScoreService.class);

	private final ScoringOptionsParser optionsParser;
	private final ProviderDataJoiner joiner;
	private final TemperatureScoreEngine scoreEngine;
	private final ScenarioCapper scenarioCapper;
	private final AggregationEngine aggregationEngine;
	private final CoverageCalculator coverageCalculator;
	private final CompanyDistributionCalculator distributionCalculator;
	private final BenchmarkModel benchmarkModel;
	private final AppProperties properties;

	public TemperatureScoreService(ScoringOptionsParser optionsParser,
								   ProviderDataJoiner joiner,
								   TemperatureScoreEngine scoreEngine,
								   ScenarioCapper scenarioCapper,
								   AggregationEngine aggregationEngine,
								   CoverageCalculator coverageCalculator,
								   CompanyDistributionCalculator distributionCalculator,
								   BenchmarkModel benchmarkModel,
								   AppProperties properties) {
		this.optionsParser = optionsParser;
		this.joiner = joiner;
		this.scoreEngine = scoreEngine;
		this.scenarioCapper = scenarioCapper;
		this.aggregationEngine = aggregationEngine;
		this.coverageCalculator = coverageCalculator;
		this.distributionCalculator = distributionCalculator;
		this.benchmarkModel = benchmarkModel;
		this.properties = properties;
	}

	public ScoreResponseDto score(TemperatureScoreRequestDto request) {
		TemperatureScoreRequestDto body = requireBody(request);
		ScoredTable scores = score(toHoldings(body.portfolio()), toProviderData(body), body.options());
		return new ScoreResponseDto(toScoreDtos(scores.records()), toWarningDtos(scores.warnings()));
	}

	public AggregateResponseDto aggregate(TemperatureScoreRequestDto request) {
		TemperatureScoreRequestDto body = requireBody(request);
		RunResult result = run(toHoldings(body.portfolio()), toProviderData(body), body.options());
		AggregationReport report = result.aggregations();
		Map<String, Map<String, Map<String, AggregationResultDto>>> aggregations = new LinkedHashMap<>();
		report.nested().forEach((timeFrame, byScope) -> {
			Map<String, Map<String, AggregationResultDto>> scopes = new LinkedHashMap<>();
			byScope.forEach((scope, byGroup) -> {
				Map<String, AggregationResultDto> groups = new LinkedHashMap<>();
				byGroup.forEach((group, aggregation) -> groups.put(group, toAggregationDto(aggregation)));
				scopes.put(scope.name(), groups);
			});
			aggregations.put(timeFrame.name(), scopes);
		});
		CoverageResult coverage = result.coverage();
		return new AggregateResponseDto(
				report.method().name(),
				report.grouping().stream().map(GroupingKey::name).toList(),
				toScoreDtos(result.scores().records()),
				aggregations,
				new CoverageDto(coverage.method().name(), coverage.percentage(), coverage.coveredCompanies(), coverage.totalCompanies()),
				result.distribution(),
				toWarningDtos(result.warnings())
		);
	}

	public ScoringOptionsInfoDto options() {
		AppProperties.Scoring scoring = properties.scoring();
		AppProperties.Aggregation aggregation = properties.aggregation();
		Map<Integer, String> scenarios = new LinkedHashMap<>();
		for (ScenarioType type : ScenarioType.values()) {
			scenarios.put(type.number(), type.name());
		}
		ScoringOptions defaults = new ScoringOptions(scoring.timeFrames(), scoring.scopes(), scoring.fallbackScore(),
				scoring.model(), aggregation.method(), aggregation.grouping(), null);
		return new ScoringOptionsInfoDto(
				names(TimeFrame.values()),
				names(ScopeCategory.values()),
				ScoringConfig.FALLBACK_SCORES,
				List.copyOf(benchmarkModel.models()),
				names(AggregationMethod.values()),
				names(GroupingKey.values()),
				scenarios,
				names(EngagementType.values()),
				defaults
		);
	}

	/**
	 * Reads a JSON or YAML options document and returns it with every default filled in and every
	 * value normalized, in the same shape the scoring requests accept.
	 */
	public ScoringOptions resolveOptions(String document) {
		ScoringOptions options = optionsParser.read(document);
		ScoringConfig config = optionsParser.toScoringConfig(options);
		AggregationMethod method = optionsParser.parseMethod(options.aggregationMethod());
		List<GroupingKey> grouping = optionsParser.parseGrouping(options.grouping());
		ScoringOptions.ScenarioOptions scenario = config.scenario() == null
				? null
				: new ScoringOptions.ScenarioOptions(config.scenario().type().number(), config.scenario().engagementType().name());
		return new ScoringOptions(
				config.timeFrames().stream().map(Enum::name).toList(),
				config.scopes().stream().map(Enum::name).toList(),
				config.fallbackScore(),
				config.model(),
				method.name(),
				grouping.stream().map(Enum::name).toList(),
				scenario
		);
	}

	/**
	 * Scores the portfolio, applying the scenario cap when a scenario is configured.
	 */
	public ScoredTable score(List<Holding> portfolio, ProviderData providerData, ScoringOptions options) {
		ScoringConfig config = optionsParser.toScoringConfig(options);
		AggregationMethod method = optionsParser.parseMethod(options == null ? null : options.aggregationMethod());
		return scoreInternal(portfolio, providerData, config, method);
	}

	public RunResult run(List<Holding> portfolio, ProviderData providerData, ScoringOptions options) {
		ScoringConfig config = optionsParser.toScoringConfig(options);
		AggregationMethod method = optionsParser.parseMethod(options == null ? null : options.aggregationMethod());
		List<GroupingKey> grouping = optionsParser.parseGrouping(options == null ? null : options.grouping());

		ScoredTable scores = scoreInternal(portfolio, providerData, config, method);
		AggregationReport aggregations = aggregationEngine.aggregate(scores, method, grouping, config.timeFrames(), config.scopes());
		CoverageResult coverage = coverageCalculator.coverage(scores, method);
		Map<String, BigDecimal> distribution = grouping.isEmpty() || scores.records().isEmpty()
				? Map.of()
				: distributionCalculator.distribution(scores, grouping);

		List<DataQualityWarning> warnings = new ArrayList<>(scores.warnings());
		warnings.addAll(aggregations.warnings());
		warnings.addAll(coverage.warnings());
		logger.info("Temperature score run finished: method={}, grouping={}, partitions={}, coverage={}%, warnings={}",
				method, grouping, aggregations.results().size(), coverage.percentage(), warnings.size());
		return new RunResult(config, scores, aggregations, coverage, distribution, List.copyOf(warnings));
	}

	private ScoredTable scoreInternal(List<Holding> portfolio, ProviderData providerData, ScoringConfig config,
									  AggregationMethod method) {
		ProviderDataJoiner.JoinResult joined = joiner.join(portfolio, providerData);
		ScoredTable scored = scoreEngine.calculate(joined.companies(), config);
		List<DataQualityWarning> warnings = new ArrayList<>(joined.warnings());
		warnings.addAll(scored.warnings());
		ScoredTable table = new ScoredTable(scored.records(), warnings);
		return scenarioCapper.apply(table, config.scenario(), method);
	}

	private TemperatureScoreRequestDto requireBody(TemperatureScoreRequestDto request) {
		if (request == null || request.portfolio() == null) {
			throw new IllegalArgumentException("portfolio is required");
		}
		return request;
	}

	private List<Holding> toHoldings(List<HoldingDto> portfolio) {
		return portfolio.stream()
				.map(holding -> new Holding(holding.companyId(), holding.investmentValue()))
				.toList();
	}

	private ProviderData toProviderData(TemperatureScoreRequestDto request) {
		List<Company> companies = new ArrayList<>();
		for (CompanyDto dto : request.companies() == null ? List.<CompanyDto>of() : request.companies()) {
			companies.add(new Company(dto.id(), dto.name(), dto.sector(), dto.region(), dto.marketCap(),
					dto.enterpriseValue(), dto.ownershipPct(), dto.revenue(), dto.cash(), dto.ghgS1S2(), dto.ghgS3(),
					Boolean.TRUE.equals(dto.engagementTarget())));
		}
		List<Target> targets = new ArrayList<>();
		List<TargetDto> targetDtos = request.targets() == null ? List.of() : request.targets();
		for (int i = 0; i < targetDtos.size(); i++) {
			targets.add(toTarget("targets[" + i + "]", targetDtos.get(i)));
		}
		return new ProviderData(companies, targets);
	}

	private Target toTarget(String field, TargetDto dto) {
		ValidationStatus status = dto.status() == null || dto.status().isBlank()
				? null
				: optionsParser.parseEnum(ValidationStatus.class, field + ".status", dto.status());
		TargetType type = dto.type() == null || dto.type().isBlank()
				? null
				: optionsParser.parseEnum(TargetType.class, field + ".type", dto.type());
		return new Target(dto.id(), dto.companyId(), optionsParser.parseTargetScopes(field + ".scopes", dto.scopes()),
				dto.baseYear(), dto.startYear(), dto.targetYear(), dto.reductionPct(), status, dto.ambition(), type,
				dto.intensityMetric());
	}

	private List<ScoreRecordDto> toScoreDtos(List<ScoreRecord> records) {
		return records.stream()
				.map(record -> new ScoreRecordDto(record.companyId(), record.companyName(), record.scope().name(),
						record.timeFrame().name(), record.temperatureScore(), record.basis().name(),
						record.target() == null ? null : record.target().id()))
				.toList();
	}

	private AggregationResultDto toAggregationDto(AggregationResult result) {
		List<ContributionDto> contributions = result.contributions().stream()
				.map(this::toContributionDto)
				.toList();
		return new AggregationResultDto(result.timeFrame().name(), result.scope().name(), result.group(),
				result.status().name(), result.score(), result.companyCount(), result.influencePercentage(),
				contributions, result.excludedCompanyIds(), result.diagnostic());
	}

	private ContributionDto toContributionDto(Contribution contribution) {
		return new ContributionDto(contribution.companyId(), contribution.companyName(), contribution.temperatureScore(),
				contribution.weight(), contribution.contribution(), contribution.relativeContribution());
	}

	private List<WarningDto> toWarningDtos(List<DataQualityWarning> warnings) {
		return warnings.stream()
				.map(warning -> new WarningDto(warning.type().name(), warning.companyId(), warning.message()))
				.toList();
	}

	private List<String> names(Enum<?>[] values) {
		return Arrays.stream(values).map(Enum::name).toList();
	}

	public record RunResult(
			ScoringConfig config,
			ScoredTable scores,
			AggregationReport aggregations,
			CoverageResult coverage,
			Map<String, BigDecimal> distribution,
			List<DataQualityWarning> warnings
	) {
	}
}
