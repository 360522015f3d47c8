package my.temperaturescore.app.model;

/**
 * Temperature score of one company for one scope category and time frame.
 *
 * @param target the target the score is derived from, {@code null} for fallback scores
 */
public record ScoreRecord(
		PortfolioCompany holding,
		ScopeCategory scope,
		TimeFrame timeFrame,
		double temperatureScore,
		ScoreBasis basis,
		Target target
) {
	public String companyId() {
		return holding.companyId();
	}

	public String companyName() {
		return holding.company().name();
	}

	public Company company() {
		return holding.company();
	}

	public boolean isFallback() {
		return basis == ScoreBasis.FALLBACK;
	}

	public boolean hasValidatedTarget() {
		return basis == ScoreBasis.TARGET && target != null && target.isValidated();
	}

	public ScoreRecord withTemperatureScore(double score) {
		return new ScoreRecord(holding, scope, timeFrame, score, basis, target);
	}
}
