package my.temperaturescore.app.service;

import my.temperaturescore.app.config.AppProperties;
import my.temperaturescore.app.dto.ScoringOptions;
import my.temperaturescore.app.model.AggregationMethod;
import my.temperaturescore.app.model.EngagementType;
import my.temperaturescore.app.model.GroupingKey;
import my.temperaturescore.app.model.Scenario;
import my.temperaturescore.app.model.ScenarioType;
import my.temperaturescore.app.model.Scope;
import my.temperaturescore.app.model.ScopeCategory;
import my.temperaturescore.app.model.ScoringConfig;
import my.temperaturescore.app.model.TimeFrame;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns caller supplied option names into typed configuration. Every unknown value is rejected
 * with a {@link ConfigurationException} naming the field, before any computation runs.
 */
public class ScoringOptionsParser {
	private final AppProperties.Scoring scoringDefaults;
	private final AppProperties.Aggregation aggregationDefaults;
	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public ScoringOptionsParser(AppProperties properties) {
		this.scoringDefaults = properties.scoring();
		this.aggregationDefaults = properties.aggregation();
		this.jsonMapper = JsonMapper.builder()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
		this.yamlMapper = YAMLMapper.builder()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	/**
	 * Reads options from a JSON or YAML document. Keys are the request field names
	 * ({@code timeFrames}, {@code fallbackScore}, {@code aggregationMethod}, ...).
	 */
	public ScoringOptions read(String content) {
		if (content == null || content.isBlank()) {
			return ScoringOptions.defaults();
		}
		try {
			return jsonMapper.readValue(content, ScoringOptions.class);
		} catch (JacksonException jsonEx) {
			try {
				return yamlMapper.readValue(content, ScoringOptions.class);
			} catch (JacksonException yamlEx) {
				throw new ConfigurationException("options", abbreviate(content), "neither valid JSON nor YAML: " + yamlEx.getOriginalMessage());
			}
		}
	}

	public ScoringConfig toScoringConfig(ScoringOptions options) {
		ScoringOptions resolved = options == null ? ScoringOptions.defaults() : options;
		Set<TimeFrame> timeFrames = parseTimeFrames(orDefault(resolved.timeFrames(), scoringDefaults.timeFrames()));
		Set<ScopeCategory> scopes = parseScopes(orDefault(resolved.scopes(), scoringDefaults.scopes()));
		double fallbackScore = resolved.fallbackScore() == null ? scoringDefaults.fallbackScore() : resolved.fallbackScore();
		int model = resolved.model() == null ? scoringDefaults.model() : resolved.model();
		return new ScoringConfig(timeFrames, scopes, fallbackScore, model, parseScenario(resolved.scenario()));
	}

	public AggregationMethod parseMethod(String value) {
		String raw = value == null || value.isBlank() ? aggregationDefaults.method() : value;
		return parseEnum(AggregationMethod.class, "aggregation_method", raw);
	}

	public List<GroupingKey> parseGrouping(List<String> values) {
		List<String> raw = values == null ? aggregationDefaults.grouping() : values;
		List<GroupingKey> grouping = new ArrayList<>();
		for (String value : raw) {
			GroupingKey key = parseEnum(GroupingKey.class, "grouping", value);
			if (!grouping.contains(key)) {
				grouping.add(key);
			}
		}
		return List.copyOf(grouping);
	}

	public Set<TimeFrame> parseTimeFrames(List<String> values) {
		Set<TimeFrame> timeFrames = EnumSet.noneOf(TimeFrame.class);
		for (String value : values) {
			timeFrames.add(parseEnum(TimeFrame.class, "time_frames", value));
		}
		return timeFrames;
	}

	public Set<ScopeCategory> parseScopes(List<String> values) {
		Set<ScopeCategory> scopes = EnumSet.noneOf(ScopeCategory.class);
		for (String value : values) {
			scopes.add(parseEnum(ScopeCategory.class, "scopes", value));
		}
		return scopes;
	}

	/**
	 * Parses the scope coverage of a target. Entries may name single scopes ({@code S1}) or
	 * combinations ({@code S1S2}, {@code S1+S2}), which expand to their component scopes.
	 */
	public Set<Scope> parseTargetScopes(String field, List<String> values) {
		Set<Scope> scopes = EnumSet.noneOf(Scope.class);
		if (values == null) {
			return scopes;
		}
		for (String value : values) {
			String normalized = value == null ? null : value.replace("+", "").replace(" ", "").toUpperCase(Locale.ROOT);
			if ("S2".equals(normalized)) {
				scopes.add(Scope.S2);
			} else {
				scopes.addAll(parseEnum(ScopeCategory.class, field, normalized).components());
			}
		}
		return scopes;
	}

	public Scenario parseScenario(ScoringOptions.ScenarioOptions options) {
		if (options == null || options.number() == null) {
			return null;
		}
		ScenarioType type = ScenarioType.fromNumber(options.number())
				.orElseThrow(() -> new ConfigurationException("scenario.number", String.valueOf(options.number()), "must be between 1 and 4"));
		EngagementType engagementType = options.engagementType() == null || options.engagementType().isBlank()
				? EngagementType.SET_TARGETS
				: parseEnum(EngagementType.class, "scenario.engagement_type", options.engagementType());
		return new Scenario(type, engagementType);
	}

	public <E extends Enum<E>> E parseEnum(Class<E> type, String field, String value) {
		if (value == null || value.isBlank()) {
			throw new ConfigurationException(field, String.valueOf(value), "value is required");
		}
		try {
			return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new ConfigurationException(field, value, "must be one of " + EnumSet.allOf(type));
		}
	}

	private List<String> orDefault(List<String> values, List<String> defaults) {
		return values == null || values.isEmpty() ? defaults : values;
	}

	private String abbreviate(String content) {
		String trimmed = content.strip();
		return trimmed.length() <= 40 ? trimmed : trimmed.substring(0, 40) + "...";
	}
}
