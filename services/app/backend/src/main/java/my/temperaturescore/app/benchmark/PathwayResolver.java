package my.temperaturescore.app.benchmark;

import my.temperaturescore.app.model.Target;
import my.temperaturescore.app.model.TargetType;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a target onto the benchmark pathway variable it is scored against.
 */
public final class PathwayResolver {
	public static final String ABSOLUTE_PATHWAY = "Emissions|Kyoto Gases";
	public static final String GDP_INTENSITY_PATHWAY = "INT.emKyoto_gdp";
	public static final String PRIMARY_ENERGY_INTENSITY_PATHWAY = "INT.emCO2EI_PE";
	public static final String POWER_INTENSITY_PATHWAY = "INT.emCO2EI_elecGen";

	private static final Map<String, String> INTENSITY_PATHWAYS = Map.of(
			"revenue", GDP_INTENSITY_PATHWAY,
			"product", GDP_INTENSITY_PATHWAY,
			"cement", GDP_INTENSITY_PATHWAY,
			"oil", PRIMARY_ENERGY_INTENSITY_PATHWAY,
			"steel", GDP_INTENSITY_PATHWAY,
			"aluminum", GDP_INTENSITY_PATHWAY,
			"power", POWER_INTENSITY_PATHWAY
	);

	private PathwayResolver() {
	}

	public static Optional<String> resolve(Target target) {
		if (target == null) {
			return Optional.empty();
		}
		if (target.type() == TargetType.ABSOLUTE) {
			return Optional.of(ABSOLUTE_PATHWAY);
		}
		String metric = target.intensityMetric();
		if (metric == null || metric.isBlank()) {
			return Optional.empty();
		}
		return Optional.ofNullable(INTENSITY_PATHWAYS.get(metric.trim().toLowerCase(Locale.ROOT)));
	}
}
