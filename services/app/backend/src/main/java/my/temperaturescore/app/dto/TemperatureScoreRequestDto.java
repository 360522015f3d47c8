package my.temperaturescore.app.dto;

import java.util.List;

public record TemperatureScoreRequestDto(List<HoldingDto> portfolio,
										 List<CompanyDto> companies,
										 List<TargetDto> targets,
										 ScoringOptions options) {
}
