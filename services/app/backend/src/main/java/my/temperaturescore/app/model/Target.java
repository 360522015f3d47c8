package my.temperaturescore.app.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Emission reduction target of a company.
 *
 * @param reductionPct targeted reduction from the base year, in percent
 * @param startYear year the reduction starts counting from; the base year when absent
 * @param intensityMetric denominator of an intensity target (Revenue, Product, Cement, Oil, Steel, Aluminum, Power)
 */
public record Target(
		String id,
		String companyId,
		Set<Scope> scopes,
		Integer baseYear,
		Integer startYear,
		Integer targetYear,
		Double reductionPct,
		ValidationStatus status,
		String ambition,
		TargetType type,
		String intensityMetric
) {
	public Target {
		scopes = scopes == null || scopes.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(scopes));
		status = status == null ? ValidationStatus.NOT_VALIDATED : status;
		type = type == null ? TargetType.ABSOLUTE : type;
	}

	public Integer referenceYear() {
		return startYear != null ? startYear : baseYear;
	}

	/**
	 * Years between the reference year and the target year, or {@code null} when either is unknown.
	 */
	public Integer horizon() {
		Integer reference = referenceYear();
		if (reference == null || targetYear == null) {
			return null;
		}
		return targetYear - reference;
	}

	public boolean isValidated() {
		return status == ValidationStatus.VALIDATED;
	}
}
