package my.temperaturescore.app.service;

import my.temperaturescore.app.model.AggregationMethod;
import my.temperaturescore.app.model.AggregationReport;
import my.temperaturescore.app.model.AggregationResult;
import my.temperaturescore.app.model.Contribution;
import my.temperaturescore.app.model.DataQualityWarning;
import my.temperaturescore.app.model.GroupingKey;
import my.temperaturescore.app.model.PartitionStatus;
import my.temperaturescore.app.model.ScopeCategory;
import my.temperaturescore.app.model.ScoreRecord;
import my.temperaturescore.app.model.ScoredTable;
import my.temperaturescore.app.model.TimeFrame;
import my.temperaturescore.app.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Reduces scored rows to portfolio and group scores. Within a partition rows are always summed in
 * ascending company id order so repeated runs are bit-for-bit identical.
 */
@Service
public class AggregationEngine {
	private static final Logger logger = LoggerFactory.getLogger(AggregationEngine.class);
	static final double WEIGHT_TOLERANCE = 1e-9;
	private static final String GROUP_SEPARATOR = "-";

	public AggregationReport aggregate(ScoredTable table, AggregationMethod method, List<GroupingKey> grouping) {
		return aggregate(table, method, grouping, table.timeFrames(), table.scopes());
	}

	/**
	 * Aggregates the requested (time frame, scope) combinations. Combinations without rows are still
	 * reported, as {@link PartitionStatus#UNDEFINED}.
	 */
	public AggregationReport aggregate(ScoredTable table, AggregationMethod method, List<GroupingKey> grouping,
									   Set<TimeFrame> timeFrames, Set<ScopeCategory> scopes) {
		CompanyWeighting weighting = WeightingStrategies.forMethod(method);
		List<GroupingKey> keys = grouping == null ? List.of() : List.copyOf(grouping);
		List<AggregationResult> results = new ArrayList<>();
		List<DataQualityWarning> warnings = new ArrayList<>();

		for (TimeFrame timeFrame : timeFrames) {
			for (ScopeCategory scope : scopes) {
				List<ScoreRecord> slice = table.slice(timeFrame, scope);
				Partition portfolio = weigh(slice, method, weighting, scope);
				for (String excluded : portfolio.excludedCompanyIds()) {
					warnings.add(DataQualityWarning.of(WarningType.MISSING_WEIGHT, excluded,
							"Missing " + WeightingStrategies.requiredField(method, scope) + " for " + method
									+ "; excluded from " + timeFrame + "/" + scope));
				}
				results.add(reduce(portfolio, timeFrame, scope, AggregationResult.PORTFOLIO, warnings));
				if (keys.isEmpty()) {
					continue;
				}
				Map<String, List<ScoreRecord>> groups = slice.stream()
						.collect(Collectors.groupingBy(r -> groupName(r, keys), TreeMap::new, Collectors.toList()));
				for (Map.Entry<String, List<ScoreRecord>> group : groups.entrySet()) {
					Partition partition = weigh(group.getValue(), method, weighting, scope);
					results.add(reduce(partition, timeFrame, scope, group.getKey(), warnings));
				}
			}
		}
		logger.debug("Aggregated {} partitions with {}", results.size(), method);
		return new AggregationReport(method, keys, results, warnings);
	}

	/**
	 * Normalized weights of the rows of one partition, in ascending company id order.
	 */
	public Partition weigh(List<ScoreRecord> records, AggregationMethod method, ScopeCategory scope) {
		return weigh(records, method, WeightingStrategies.forMethod(method), scope);
	}

	private Partition weigh(List<ScoreRecord> records, AggregationMethod method, CompanyWeighting weighting, ScopeCategory scope) {
		List<ScoreRecord> sorted = new ArrayList<>(records);
		sorted.sort(Comparator.comparing(ScoreRecord::companyId));
		List<ScoreRecord> eligible = new ArrayList<>();
		List<Double> bases = new ArrayList<>();
		List<String> excluded = new ArrayList<>();
		for (ScoreRecord record : sorted) {
			Double basis = weighting.basis(record.holding(), scope);
			if (!isUsable(basis)) {
				excluded.add(record.companyId());
				continue;
			}
			eligible.add(record);
			bases.add(basis);
		}
		double total = 0.0;
		for (double basis : bases) {
			total += basis;
		}
		List<WeightedScore> weighted = new ArrayList<>(eligible.size());
		for (int i = 0; i < eligible.size(); i++) {
			weighted.add(new WeightedScore(eligible.get(i), bases.get(i), bases.get(i) / total));
		}
		return new Partition(method, List.copyOf(weighted), total, List.copyOf(excluded));
	}

	private AggregationResult reduce(Partition partition, TimeFrame timeFrame, ScopeCategory scope, String group,
									 List<DataQualityWarning> warnings) {
		if (partition.weights().isEmpty()) {
			warnings.add(DataQualityWarning.of(WarningType.EMPTY_PARTITION, null,
					"No eligible companies for " + timeFrame + "/" + scope + "/" + group));
			return AggregationResult.undefined(timeFrame, scope, group, partition.excludedCompanyIds());
		}
		try {
			double weightSum = partition.weightSum();
			if (Math.abs(weightSum - 1.0) > WEIGHT_TOLERANCE) {
				throw new ComputationException(group, "Weights sum to " + weightSum + " instead of 1");
			}
			double score = weightedScore(partition.weights());
			if (Double.isNaN(score) || score < 0.0) {
				throw new ComputationException(group, "Aggregated score " + score + " is not a valid temperature");
			}
			double influence = 0.0;
			List<Contribution> contributions = new ArrayList<>();
			for (WeightedScore weightedScore : partition.weights()) {
				ScoreRecord record = weightedScore.record();
				double contribution = weightedScore.weight() * record.temperatureScore();
				if (record.isFallback()) {
					influence += weightedScore.weight();
				}
				contributions.add(new Contribution(record.companyId(), record.companyName(), record.temperatureScore(),
						weightedScore.weight(), contribution, score == 0.0 ? 0.0 : contribution / score * 100.0));
			}
			contributions.sort(Comparator.comparingDouble(Contribution::contribution).reversed()
					.thenComparing(Contribution::companyId));
			return new AggregationResult(timeFrame, scope, group, PartitionStatus.OK, score,
					partition.weights().size(), partition.totalBasis(), influence * 100.0, contributions,
					partition.excludedCompanyIds(), null);
		} catch (ComputationException ex) {
			logger.error("Aggregation of {}/{}/{} failed: {}", timeFrame, scope, group, ex.getMessage());
			warnings.add(DataQualityWarning.of(WarningType.PARTITION_FAILED, null,
					timeFrame + "/" + scope + "/" + group + ": " + ex.getMessage()));
			return AggregationResult.failed(timeFrame, scope, group, partition.excludedCompanyIds(), ex.getMessage());
		}
	}

	private double weightedScore(List<WeightedScore> weights) {
		double first = weights.get(0).record().temperatureScore();
		boolean uniform = weights.stream().allMatch(w -> w.record().temperatureScore() == first);
		if (uniform) {
			return first;
		}
		double score = 0.0;
		for (WeightedScore weightedScore : weights) {
			score += weightedScore.weight() * weightedScore.record().temperatureScore();
		}
		return score;
	}

	private boolean isUsable(Double basis) {
		return basis != null && !basis.isNaN() && !basis.isInfinite() && basis > 0.0;
	}

	private String groupName(ScoreRecord record, List<GroupingKey> keys) {
		return keys.stream()
				.map(key -> key.valueOf(record.company()))
				.collect(Collectors.joining(GROUP_SEPARATOR));
	}

	public record WeightedScore(ScoreRecord record, double basis, double weight) {
	}

	public record Partition(AggregationMethod method, List<WeightedScore> weights, double totalBasis,
							List<String> excludedCompanyIds) {
		public double weightSum() {
			double sum = 0.0;
			for (WeightedScore weightedScore : weights) {
				sum += weightedScore.weight();
			}
			return sum;
		}
	}
}
