package my.temperaturescore.app.dto;

public record ScoreRecordDto(String companyId,
							 String companyName,
							 String scope,
							 String timeFrame,
							 double temperatureScore,
							 String scoreBasis,
							 String targetId) {
}
