package my.temperaturescore.app.dto;

import java.util.List;

public record TargetDto(String id,
						String companyId,
						List<String> scopes,
						Integer baseYear,
						Integer startYear,
						Integer targetYear,
						Double reductionPct,
						String status,
						String ambition,
						String type,
						String intensityMetric) {
}
