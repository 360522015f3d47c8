package my.temperaturescore.app.service;

import my.temperaturescore.app.model.PortfolioCompany;
import my.temperaturescore.app.model.ScopeCategory;

/**
 * Un-normalized weight basis of one company. Returns {@code null} when a required fundamental is missing.
 */
@FunctionalInterface
public interface CompanyWeighting {
	Double basis(PortfolioCompany company, ScopeCategory scope);
}
