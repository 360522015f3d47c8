package my.temperaturescore.app.dto;

import java.util.List;

public record ScoreResponseDto(List<ScoreRecordDto> scores, List<WarningDto> warnings) {
}
