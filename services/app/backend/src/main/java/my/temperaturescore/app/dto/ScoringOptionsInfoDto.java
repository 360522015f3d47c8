package my.temperaturescore.app.dto;

import java.util.List;
import java.util.Map;

public record ScoringOptionsInfoDto(List<String> timeFrames,
									List<String> scopes,
									List<Double> fallbackScores,
									List<Integer> models,
									List<String> aggregationMethods,
									List<String> groupingKeys,
									Map<Integer, String> scenarios,
									List<String> engagementTypes,
									ScoringOptions defaults) {
}
