package my.temperaturescore.app.dto;

public record CompanyDto(String id,
						 String name,
						 String sector,
						 String region,
						 Double marketCap,
						 Double enterpriseValue,
						 Double ownershipPct,
						 Double revenue,
						 Double cash,
						 Double ghgS1S2,
						 Double ghgS3,
						 Boolean engagementTarget) {
}
