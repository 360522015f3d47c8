package my.temperaturescore.app.benchmark;

/**
 * Regression coefficients of a benchmark pathway at one horizon: temperature = param * ARR + intercept,
 * with ARR the annual reduction rate in percent per year.
 */
public record RegressionPoint(double horizonYears, double param, double intercept) {
	public double temperature(double annualReductionPct) {
		return param * annualReductionPct + intercept;
	}
}
