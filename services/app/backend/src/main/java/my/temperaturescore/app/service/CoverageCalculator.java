package my.temperaturescore.app.service;

import my.temperaturescore.app.model.AggregationMethod;
import my.temperaturescore.app.model.CoverageResult;
import my.temperaturescore.app.model.DataQualityWarning;
import my.temperaturescore.app.model.PortfolioCompany;
import my.temperaturescore.app.model.ScopeCategory;
import my.temperaturescore.app.model.ScoreRecord;
import my.temperaturescore.app.model.ScoredTable;
import my.temperaturescore.app.model.TimeFrame;
import my.temperaturescore.app.model.WarningType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Share of portfolio weight held in companies with a validated target, using the aggregation
 * weight formulas.
 */
@Service
public class CoverageCalculator {

	/**
	 * Company-level coverage over the whole portfolio. A company counts as covered when any of its
	 * scores is derived from a validated target. Emission weights use scope 1+2+3.
	 */
	public CoverageResult coverage(ScoredTable table, AggregationMethod method) {
		return compute(table.records(), method, ScopeCategory.S1S2S3);
	}

	/**
	 * Coverage restricted to the scores of one time frame and scope.
	 */
	public CoverageResult coverage(ScoredTable table, AggregationMethod method, TimeFrame timeFrame, ScopeCategory scope) {
		return compute(table.slice(timeFrame, scope), method, scope);
	}

	private CoverageResult compute(List<ScoreRecord> records, AggregationMethod method, ScopeCategory weightScope) {
		CompanyWeighting weighting = WeightingStrategies.forMethod(method);
		Map<String, CompanyCoverage> companies = new TreeMap<>();
		for (ScoreRecord record : records) {
			CompanyCoverage current = companies.get(record.companyId());
			boolean covered = record.hasValidatedTarget() || (current != null && current.covered());
			companies.put(record.companyId(), new CompanyCoverage(record.holding(), covered));
		}

		List<DataQualityWarning> warnings = new ArrayList<>();
		double coveredWeight = 0.0;
		double totalWeight = 0.0;
		int coveredCompanies = 0;
		int totalCompanies = 0;
		for (CompanyCoverage company : companies.values()) {
			Double basis = weighting.basis(company.holding(), weightScope);
			if (basis == null || basis.isNaN() || basis.isInfinite() || basis <= 0.0) {
				warnings.add(DataQualityWarning.of(WarningType.MISSING_WEIGHT, company.holding().companyId(),
						"Missing " + WeightingStrategies.requiredField(method, weightScope) + " for " + method + "; excluded from coverage"));
				continue;
			}
			totalWeight += basis;
			totalCompanies++;
			if (company.covered()) {
				coveredWeight += basis;
				coveredCompanies++;
			}
		}
		if (totalWeight <= 0.0) {
			warnings.add(DataQualityWarning.of(WarningType.EMPTY_COVERAGE, null,
					"No company with a usable " + method + " weight; coverage is 0"));
			return new CoverageResult(method, 0.0, 0.0, 0.0, 0, 0, warnings);
		}
		double percentage = Math.max(0.0, Math.min(100.0, coveredWeight * 100.0 / totalWeight));
		return new CoverageResult(method, percentage, coveredWeight, totalWeight, coveredCompanies, totalCompanies, warnings);
	}

	private record CompanyCoverage(PortfolioCompany holding, boolean covered) {
	}
}
