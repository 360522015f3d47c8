package my.temperaturescore.app.dto;

public record CoverageDto(String aggregationMethod,
						  double percentage,
						  int coveredCompanies,
						  int totalCompanies) {
}
