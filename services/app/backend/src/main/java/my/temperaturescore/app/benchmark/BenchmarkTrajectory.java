package my.temperaturescore.app.benchmark;

import my.temperaturescore.app.model.ScopeCategory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Horizon-indexed regression curve for one model variant and pathway variable.
 * {@code sector} and {@code scope} are {@code null} when the curve applies to any sector or scope.
 */
public record BenchmarkTrajectory(
		int model,
		String variable,
		String sector,
		ScopeCategory scope,
		List<RegressionPoint> points
) {
	public BenchmarkTrajectory {
		if (variable == null || variable.isBlank()) {
			throw new IllegalArgumentException("benchmark variable is required");
		}
		if (points == null || points.isEmpty()) {
			throw new IllegalArgumentException("benchmark trajectory " + variable + " has no points");
		}
		List<RegressionPoint> sorted = new ArrayList<>(points);
		sorted.sort(Comparator.comparingDouble(RegressionPoint::horizonYears));
		for (int i = 1; i < sorted.size(); i++) {
			if (sorted.get(i).horizonYears() == sorted.get(i - 1).horizonYears()) {
				throw new IllegalArgumentException("benchmark trajectory " + variable + " (model " + model
						+ ") has duplicate horizon " + sorted.get(i).horizonYears());
			}
		}
		points = List.copyOf(sorted);
	}

	/**
	 * Coefficients at the given horizon, linearly interpolated between the neighbouring points and
	 * held constant beyond the first and last point.
	 */
	public RegressionPoint at(double horizonYears) {
		RegressionPoint first = points.get(0);
		RegressionPoint last = points.get(points.size() - 1);
		if (horizonYears <= first.horizonYears()) {
			return first;
		}
		if (horizonYears >= last.horizonYears()) {
			return last;
		}
		for (int i = 1; i < points.size(); i++) {
			RegressionPoint upper = points.get(i);
			if (horizonYears <= upper.horizonYears()) {
				RegressionPoint lower = points.get(i - 1);
				double t = (horizonYears - lower.horizonYears()) / (upper.horizonYears() - lower.horizonYears());
				return new RegressionPoint(
						horizonYears,
						lower.param() + t * (upper.param() - lower.param()),
						lower.intercept() + t * (upper.intercept() - lower.intercept())
				);
			}
		}
		return last;
	}

	public double impliedTemperature(double annualReductionPct, double horizonYears) {
		return at(horizonYears).temperature(annualReductionPct);
	}
}
