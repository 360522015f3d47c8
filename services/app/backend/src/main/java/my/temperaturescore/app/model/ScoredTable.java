package my.temperaturescore.app.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

public record ScoredTable(List<ScoreRecord> records, List<DataQualityWarning> warnings) {
	public ScoredTable {
		records = records == null ? List.of() : List.copyOf(records);
		warnings = warnings == null ? List.of() : List.copyOf(warnings);
	}

	public List<ScoreRecord> slice(TimeFrame timeFrame, ScopeCategory scope) {
		return records.stream()
				.filter(r -> r.timeFrame() == timeFrame && r.scope() == scope)
				.toList();
	}

	public Set<TimeFrame> timeFrames() {
		Set<TimeFrame> timeFrames = new LinkedHashSet<>();
		records.forEach(r -> timeFrames.add(r.timeFrame()));
		return timeFrames;
	}

	public Set<ScopeCategory> scopes() {
		Set<ScopeCategory> scopes = new LinkedHashSet<>();
		records.forEach(r -> scopes.add(r.scope()));
		return scopes;
	}

	public ScoredTable map(UnaryOperator<ScoreRecord> mapper, List<DataQualityWarning> additionalWarnings) {
		List<ScoreRecord> mapped = records.stream().map(mapper).toList();
		List<DataQualityWarning> allWarnings = new ArrayList<>(warnings);
		if (additionalWarnings != null) {
			allWarnings.addAll(additionalWarnings);
		}
		return new ScoredTable(mapped, allWarnings);
	}
}
