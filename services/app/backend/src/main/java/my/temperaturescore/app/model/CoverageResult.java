package my.temperaturescore.app.model;

import java.util.List;

/**
 * @param percentage covered weight over total weight, in percent (0-100)
 */
public record CoverageResult(
		AggregationMethod method,
		double percentage,
		double coveredWeight,
		double totalWeight,
		int coveredCompanies,
		int totalCompanies,
		List<DataQualityWarning> warnings
) {
	public CoverageResult {
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}
}
