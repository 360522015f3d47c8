package my.temperaturescore.app.model;

import java.util.List;

/**
 * One row of the joined scoring input: a portfolio holding with its fundamentals and targets.
 *
 * @param inProviderData false when the provider had no fundamentals for the holding
 */
public record PortfolioCompany(
		Company company,
		Double investmentValue,
		List<Target> targets,
		boolean inProviderData
) {
	public PortfolioCompany {
		targets = targets == null ? List.of() : List.copyOf(targets);
	}

	public String companyId() {
		return company.id();
	}
}
