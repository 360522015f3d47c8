package my.temperaturescore.app.model;

/**
 * Weighting schemes for rolling company scores up into group and portfolio scores.
 */
public enum AggregationMethod {
	/** Market capitalization. */
	WATS,
	/** Total absolute emissions in the partition scope. */
	TETS,
	/** Market capitalization times ownership. */
	MOTS,
	/** Enterprise value times ownership. */
	EOTS,
	/** Enterprise value plus cash, times ownership. */
	ECOTS,
	/** Uniform. */
	AOTS,
	/** Revenue. */
	ROTS
}
