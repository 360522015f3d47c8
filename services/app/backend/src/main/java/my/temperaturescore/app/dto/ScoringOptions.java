package my.temperaturescore.app.dto;

import java.util.List;

/**
 * Unvalidated run options as supplied by a caller. Absent values fall back to the configured defaults.
 */
public record ScoringOptions(
		List<String> timeFrames,
		List<String> scopes,
		Double fallbackScore,
		Integer model,
		String aggregationMethod,
		List<String> grouping,
		ScenarioOptions scenario
) {
	public static ScoringOptions defaults() {
		return new ScoringOptions(null, null, null, null, null, null, null);
	}

	public record ScenarioOptions(Integer number, String engagementType) {
	}
}
