package my.temperaturescore.app.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Full run result. {@code aggregations} is keyed time frame, scope, then group
 * ({@code portfolio} or the joined grouping values).
 */
public record AggregateResponseDto(String aggregationMethod,
								   List<String> grouping,
								   List<ScoreRecordDto> scores,
								   Map<String, Map<String, Map<String, AggregationResultDto>>> aggregations,
								   CoverageDto coverage,
								   Map<String, BigDecimal> distribution,
								   List<WarningDto> warnings) {
}
