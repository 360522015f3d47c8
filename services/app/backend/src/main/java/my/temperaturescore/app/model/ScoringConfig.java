package my.temperaturescore.app.model;

import my.temperaturescore.app.service.ConfigurationException;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Validated configuration of one scoring run. The model variant travels with the config into
 * every scoring call so concurrent runs can use different variants.
 */
public record ScoringConfig(
		Set<TimeFrame> timeFrames,
		Set<ScopeCategory> scopes,
		double fallbackScore,
		int model,
		Scenario scenario
) {
	public static final List<Double> FALLBACK_SCORES = List.of(3.2, 3.9, 4.5);
	public static final int MIN_MODEL = 1;
	public static final int MAX_MODEL = 4;

	public ScoringConfig {
		if (timeFrames == null || timeFrames.isEmpty()) {
			throw new ConfigurationException("time_frames", String.valueOf(timeFrames), "at least one time frame is required");
		}
		if (scopes == null || scopes.isEmpty()) {
			throw new ConfigurationException("scopes", String.valueOf(scopes), "at least one scope is required");
		}
		if (!FALLBACK_SCORES.contains(fallbackScore)) {
			throw new ConfigurationException("fallback_score", String.valueOf(fallbackScore), "must be one of " + FALLBACK_SCORES);
		}
		if (model < MIN_MODEL || model > MAX_MODEL) {
			throw new ConfigurationException("model", String.valueOf(model), "must be between " + MIN_MODEL + " and " + MAX_MODEL);
		}
		timeFrames = Collections.unmodifiableSet(EnumSet.copyOf(timeFrames));
		scopes = Collections.unmodifiableSet(EnumSet.copyOf(scopes));
	}

	public double effectiveFallbackScore() {
		return scenario == null ? fallbackScore : scenario.fallbackScore(fallbackScore);
	}
}
