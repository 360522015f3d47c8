package my.temperaturescore.app.service;

import my.temperaturescore.app.model.GroupingKey;
import my.temperaturescore.app.model.PortfolioCompany;
import my.temperaturescore.app.model.ScoreRecord;
import my.temperaturescore.app.model.ScoredTable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Share of portfolio companies per sector/region combination.
 */
@Service
public class CompanyDistributionCalculator {

	public Map<String, BigDecimal> distribution(ScoredTable table, List<GroupingKey> keys) {
		if (keys == null || keys.isEmpty()) {
			throw new ConfigurationException("grouping", String.valueOf(keys), "at least one grouping key is required");
		}
		Map<String, PortfolioCompany> companies = new LinkedHashMap<>();
		for (ScoreRecord record : table.records()) {
			companies.putIfAbsent(record.companyId(), record.holding());
		}
		if (companies.isEmpty()) {
			return Map.of();
		}
		Map<String, Long> counts = companies.values().stream()
				.collect(Collectors.groupingBy(
						holding -> keys.stream().map(key -> key.valueOf(holding.company())).collect(Collectors.joining("-")),
						TreeMap::new,
						Collectors.counting()));
		BigDecimal total = BigDecimal.valueOf(companies.size());
		Map<String, BigDecimal> distribution = new LinkedHashMap<>();
		for (Map.Entry<String, Long> entry : counts.entrySet()) {
			distribution.put(entry.getKey(), BigDecimal.valueOf(entry.getValue())
					.multiply(BigDecimal.valueOf(100))
					.divide(total, 2, RoundingMode.HALF_UP));
		}
		return distribution;
	}
}
