package my.temperaturescore.app.model;

/**
 * What-if assumption about the portfolio holder's engagement, used to cap scores.
 */
public record Scenario(ScenarioType type, EngagementType engagementType) {
	public static final double SET_TARGETS_CAP = 2.0;
	public static final double SBTI_TARGETS_CAP = 1.75;
	public static final double TARGETS_FALLBACK_SCORE = 2.0;

	public Scenario {
		if (type == null) {
			throw new IllegalArgumentException("scenario type is required");
		}
		engagementType = engagementType == null ? EngagementType.SET_TARGETS : engagementType;
	}

	/**
	 * Upper bound applied to engaged companies, or {@code null} when the scenario does not cap.
	 */
	public Double scoreCap() {
		if (engagementType == EngagementType.SET_TARGETS) {
			return SET_TARGETS_CAP;
		}
		if (type == ScenarioType.APPROVED_TARGETS || engagementType == EngagementType.SET_SBTI_TARGETS) {
			return SBTI_TARGETS_CAP;
		}
		return null;
	}

	public double fallbackScore(double configured) {
		return type == ScenarioType.TARGETS ? TARGETS_FALLBACK_SCORE : configured;
	}
}
