package my.temperaturescore.app.benchmark;

import my.temperaturescore.app.model.ScopeCategory;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads benchmark regression tables. Expected columns:
 * {@code model, variable, sector, scope, horizon, param, intercept}; a blank or {@code *} sector or
 * scope makes the row apply to any sector or scope.
 */
public class BenchmarkModelLoader {
	private static final String ANY = "*";
	private static final List<String> COLUMNS = List.of("model", "variable", "sector", "scope", "horizon", "param", "intercept");

	public BenchmarkModel load(Reader reader) {
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreSurroundingSpaces(true)
				.setIgnoreEmptyLines(true)
				.setCommentMarker('#')
				.build();
		Map<GroupKey, List<RegressionPoint>> grouped = new LinkedHashMap<>();
		try (CSVParser parser = CSVParser.parse(reader, format)) {
			for (String column : COLUMNS) {
				if (!parser.getHeaderMap().containsKey(column)) {
					throw new IllegalArgumentException("Benchmark table is missing column '" + column + "'");
				}
			}
			for (CSVRecord record : parser) {
				GroupKey key = new GroupKey(
						parseInt(record, "model"),
						required(record, "variable"),
						optional(record, "sector"),
						parseScope(record)
				);
				grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(new RegressionPoint(
						parseInt(record, "horizon"),
						parseDouble(record, "param"),
						parseDouble(record, "intercept")
				));
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read benchmark table: " + exc.getMessage(), exc);
		}

		List<BenchmarkTrajectory> trajectories = new ArrayList<>();
		for (Map.Entry<GroupKey, List<RegressionPoint>> entry : grouped.entrySet()) {
			GroupKey key = entry.getKey();
			trajectories.add(new BenchmarkTrajectory(key.model(), key.variable(), key.sector(), key.scope(), entry.getValue()));
		}
		return new BenchmarkModel(trajectories);
	}

	private ScopeCategory parseScope(CSVRecord record) {
		String value = optional(record, "scope");
		if (value == null) {
			return null;
		}
		try {
			return ScopeCategory.valueOf(value.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException exc) {
			throw new IllegalArgumentException("Unknown scope '" + value + "' in benchmark table line " + record.getRecordNumber(), exc);
		}
	}

	private String required(CSVRecord record, String column) {
		String value = optional(record, column);
		if (value == null) {
			throw new IllegalArgumentException("Missing " + column + " in benchmark table line " + record.getRecordNumber());
		}
		return value;
	}

	private String optional(CSVRecord record, String column) {
		String value = record.get(column);
		if (value == null || value.isBlank() || ANY.equals(value.trim())) {
			return null;
		}
		return value.trim();
	}

	private int parseInt(CSVRecord record, String column) {
		String value = required(record, column);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException exc) {
			throw new IllegalArgumentException("Invalid " + column + " '" + value + "' in benchmark table line " + record.getRecordNumber(), exc);
		}
	}

	private double parseDouble(CSVRecord record, String column) {
		String value = required(record, column);
		try {
			return Double.parseDouble(value);
		} catch (NumberFormatException exc) {
			throw new IllegalArgumentException("Invalid " + column + " '" + value + "' in benchmark table line " + record.getRecordNumber(), exc);
		}
	}

	private record GroupKey(int model, String variable, String sector, ScopeCategory scope) {
	}
}
