package my.temperaturescore.app.dto;

import java.util.List;

public record AggregationResultDto(String timeFrame,
								   String scope,
								   String group,
								   String status,
								   Double score,
								   int companyCount,
								   double influencePercentage,
								   List<ContributionDto> contributions,
								   List<String> excludedCompanyIds,
								   String diagnostic) {
}
