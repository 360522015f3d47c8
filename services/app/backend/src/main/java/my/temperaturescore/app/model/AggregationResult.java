package my.temperaturescore.app.model;

import java.util.List;

/**
 * Aggregated score of one (time frame, scope, group) partition. {@code score} is {@code null}
 * unless the status is {@link PartitionStatus#OK}.
 *
 * @param influencePercentage weight share of fallback-based scores, in percent
 */
public record AggregationResult(
		TimeFrame timeFrame,
		ScopeCategory scope,
		String group,
		PartitionStatus status,
		Double score,
		int companyCount,
		double totalWeight,
		double influencePercentage,
		List<Contribution> contributions,
		List<String> excludedCompanyIds,
		String diagnostic
) {
	public static final String PORTFOLIO = "portfolio";

	public AggregationResult {
		contributions = contributions == null ? List.of() : List.copyOf(contributions);
		excludedCompanyIds = excludedCompanyIds == null ? List.of() : List.copyOf(excludedCompanyIds);
	}

	public static AggregationResult undefined(TimeFrame timeFrame, ScopeCategory scope, String group,
											  List<String> excludedCompanyIds) {
		return new AggregationResult(timeFrame, scope, group, PartitionStatus.UNDEFINED, null, 0, 0.0, 0.0,
				List.of(), excludedCompanyIds, "No eligible companies in partition");
	}

	public static AggregationResult failed(TimeFrame timeFrame, ScopeCategory scope, String group,
										   List<String> excludedCompanyIds, String diagnostic) {
		return new AggregationResult(timeFrame, scope, group, PartitionStatus.FAILED, null, 0, 0.0, 0.0,
				List.of(), excludedCompanyIds, diagnostic);
	}

	public boolean isPortfolio() {
		return PORTFOLIO.equals(group);
	}

	public boolean isDefined() {
		return status == PartitionStatus.OK;
	}
}
