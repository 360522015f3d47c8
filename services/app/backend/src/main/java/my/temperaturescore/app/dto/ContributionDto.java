package my.temperaturescore.app.dto;

public record ContributionDto(String companyId,
							  String companyName,
							  double temperatureScore,
							  double weight,
							  double contribution,
							  double relativeContribution) {
}
