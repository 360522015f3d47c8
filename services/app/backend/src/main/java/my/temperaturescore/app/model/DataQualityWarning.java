package my.temperaturescore.app.model;

/**
 * Non-fatal problem found while scoring or aggregating. Returned next to the results.
 *
 * @param companyId affected company, {@code null} for partition-level warnings
 */
public record DataQualityWarning(WarningType type, String companyId, String message) {
	public static DataQualityWarning of(WarningType type, String companyId, String message) {
		return new DataQualityWarning(type, companyId, message);
	}
}
