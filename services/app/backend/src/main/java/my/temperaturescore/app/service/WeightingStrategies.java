package my.temperaturescore.app.service;

import my.temperaturescore.app.model.AggregationMethod;
import my.temperaturescore.app.model.Company;
import my.temperaturescore.app.model.PortfolioCompany;
import my.temperaturescore.app.model.ScopeCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Weight formula per aggregation method. Adding a method means adding one entry here.
 */
public final class WeightingStrategies {
	private static final Map<AggregationMethod, CompanyWeighting> STRATEGIES;

	static {
		Map<AggregationMethod, CompanyWeighting> strategies = new EnumMap<>(AggregationMethod.class);
		strategies.put(AggregationMethod.WATS, (holding, scope) -> holding.company().marketCap());
		strategies.put(AggregationMethod.TETS, (holding, scope) -> emissions(holding.company(), scope));
		strategies.put(AggregationMethod.MOTS, (holding, scope) -> owned(holding, holding.company().marketCap()));
		strategies.put(AggregationMethod.EOTS, (holding, scope) -> owned(holding, holding.company().enterpriseValue()));
		strategies.put(AggregationMethod.ECOTS, (holding, scope) -> owned(holding, enterpriseValuePlusCash(holding.company())));
		strategies.put(AggregationMethod.AOTS, (holding, scope) -> 1.0);
		strategies.put(AggregationMethod.ROTS, (holding, scope) -> holding.company().revenue());
		STRATEGIES = Collections.unmodifiableMap(strategies);
	}

	private WeightingStrategies() {
	}

	public static CompanyWeighting forMethod(AggregationMethod method) {
		CompanyWeighting weighting = method == null ? null : STRATEGIES.get(method);
		if (weighting == null) {
			throw new ConfigurationException("aggregation_method", String.valueOf(method), "unsupported aggregation method");
		}
		return weighting;
	}

	/**
	 * Name of the fundamental a method needs, for diagnostics.
	 */
	public static String requiredField(AggregationMethod method, ScopeCategory scope) {
		return switch (method) {
			case WATS -> "market_cap";
			case TETS -> switch (scope) {
				case S1, S1S2 -> "ghg_s1s2";
				case S3 -> "ghg_s3";
				case S1S2S3 -> "ghg_s1s2 and ghg_s3";
			};
			case MOTS -> "market_cap and ownership";
			case EOTS -> "enterprise_value and ownership";
			case ECOTS -> "enterprise_value, cash and ownership";
			case AOTS -> "none";
			case ROTS -> "revenue";
		};
	}

	static Double emissions(Company company, ScopeCategory scope) {
		return switch (scope) {
			case S1, S1S2 -> company.ghgS1S2();
			case S3 -> company.ghgS3();
			case S1S2S3 -> company.ghgS1S2() == null || company.ghgS3() == null
					? null
					: company.ghgS1S2() + company.ghgS3();
		};
	}

	static Double enterpriseValuePlusCash(Company company) {
		if (company.enterpriseValue() == null || company.cash() == null) {
			return null;
		}
		return company.enterpriseValue() + company.cash();
	}

	/**
	 * Valuation times the owned share. Without a reported ownership the share is derived from the
	 * holding's investment value.
	 */
	static Double owned(PortfolioCompany holding, Double valuation) {
		if (valuation == null) {
			return null;
		}
		Double ownershipPct = holding.company().ownershipPct();
		if (ownershipPct == null) {
			if (holding.investmentValue() == null || valuation <= 0.0) {
				return null;
			}
			ownershipPct = holding.investmentValue() / valuation * 100.0;
		}
		return valuation * ownershipPct / 100.0;
	}
}
