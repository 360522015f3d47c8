package my.temperaturescore.app.model;

/**
 * Fundamental data of one company as delivered by a data provider.
 * Monetary and emission fields are nullable; {@code null} means the provider has no value.
 *
 * @param ownershipPct share of the company held by the portfolio, in percent (0-100)
 * @param ghgS1S2 absolute scope 1 + 2 emissions
 * @param ghgS3 absolute scope 3 emissions
 * @param engagementTarget whether the portfolio holder engages this company on target setting
 */
public record Company(
		String id,
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
		boolean engagementTarget
) {
	public Company {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("company id is required");
		}
	}

	public static Company unknown(String id) {
		return new Company(id, id, null, null, null, null, null, null, null, null, null, false);
	}
}
