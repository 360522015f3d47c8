package my.temperaturescore.app.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record AggregationReport(
		AggregationMethod method,
		List<GroupingKey> grouping,
		List<AggregationResult> results,
		List<DataQualityWarning> warnings
) {
	public AggregationReport {
		grouping = grouping == null ? List.of() : List.copyOf(grouping);
		results = results == null ? List.of() : List.copyOf(results);
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}

	public Optional<AggregationResult> find(TimeFrame timeFrame, ScopeCategory scope, String group) {
		return results.stream()
				.filter(r -> r.timeFrame() == timeFrame && r.scope() == scope && r.group().equals(group))
				.findFirst();
	}

	public Optional<AggregationResult> portfolio(TimeFrame timeFrame, ScopeCategory scope) {
		return find(timeFrame, scope, AggregationResult.PORTFOLIO);
	}

	/**
	 * Results as time frame → scope → group → result, in computation order.
	 */
	public Map<TimeFrame, Map<ScopeCategory, Map<String, AggregationResult>>> nested() {
		Map<TimeFrame, Map<ScopeCategory, Map<String, AggregationResult>>> nested = new LinkedHashMap<>();
		for (AggregationResult result : results) {
			nested.computeIfAbsent(result.timeFrame(), k -> new LinkedHashMap<>())
					.computeIfAbsent(result.scope(), k -> new LinkedHashMap<>())
					.put(result.group(), result);
		}
		return nested;
	}
}
