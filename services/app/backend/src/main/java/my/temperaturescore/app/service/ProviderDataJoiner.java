package my.temperaturescore.app.service;

import my.temperaturescore.app.model.Company;
import my.temperaturescore.app.model.DataQualityWarning;
import my.temperaturescore.app.model.Holding;
import my.temperaturescore.app.model.PortfolioCompany;
import my.temperaturescore.app.model.ProviderData;
import my.temperaturescore.app.model.Target;
import my.temperaturescore.app.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins portfolio holdings with provider fundamentals and targets into one immutable table, so the
 * scoring core never performs lookups of its own.
 */
@Service
public class ProviderDataJoiner {
	private static final Logger logger = LoggerFactory.getLogger(ProviderDataJoiner.class);

	public JoinResult join(List<Holding> portfolio, ProviderData providerData) {
		ProviderData data = providerData == null ? new ProviderData(List.of(), List.of()) : providerData;
		List<DataQualityWarning> warnings = new ArrayList<>();
		Map<String, Company> companies = new LinkedHashMap<>();
		for (Company company : data.companies()) {
			if (companies.putIfAbsent(company.id(), company) != null) {
				warnings.add(DataQualityWarning.of(WarningType.DUPLICATE_PROVIDER_DATA, company.id(),
						"Company appears more than once in the provider data; the first entry was used"));
			}
		}
		Map<String, List<Target>> targetsByCompany = new LinkedHashMap<>();
		for (Target target : data.targets()) {
			if (target == null || target.companyId() == null) {
				continue;
			}
			targetsByCompany.computeIfAbsent(target.companyId(), k -> new ArrayList<>()).add(target);
		}

		Map<String, Double> holdings = new LinkedHashMap<>();
		for (Holding holding : portfolio == null ? List.<Holding>of() : portfolio) {
			if (holding == null || holding.companyId() == null || holding.companyId().isBlank()) {
				continue;
			}
			String companyId = holding.companyId().trim();
			if (holdings.containsKey(companyId)) {
				warnings.add(DataQualityWarning.of(WarningType.DUPLICATE_HOLDING, companyId,
						"Company appears more than once in the portfolio; holdings were summed"));
				holdings.put(companyId, sum(holdings.get(companyId), holding.investmentValue()));
			} else {
				holdings.put(companyId, holding.investmentValue());
			}
		}

		List<PortfolioCompany> rows = new ArrayList<>();
		for (Map.Entry<String, Double> entry : holdings.entrySet()) {
			String companyId = entry.getKey();
			Company company = companies.get(companyId);
			boolean found = company != null;
			if (!found) {
				warnings.add(DataQualityWarning.of(WarningType.MISSING_PROVIDER_DATA, companyId,
						"Company not found in provider data; fallback score applies"));
				company = Company.unknown(companyId);
			}
			rows.add(new PortfolioCompany(company, entry.getValue(),
					found ? targetsByCompany.getOrDefault(companyId, List.of()) : List.of(), found));
		}
		if (!warnings.isEmpty()) {
			logger.warn("Joined {} holdings with {} data quality warnings", rows.size(), warnings.size());
		}
		return new JoinResult(List.copyOf(rows), List.copyOf(warnings));
	}

	private Double sum(Double left, Double right) {
		if (left == null) {
			return right;
		}
		if (right == null) {
			return left;
		}
		return left + right;
	}

	public record JoinResult(List<PortfolioCompany> companies, List<DataQualityWarning> warnings) {
	}
}
