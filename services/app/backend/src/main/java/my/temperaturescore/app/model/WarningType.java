package my.temperaturescore.app.model;

public enum WarningType {
	MISSING_PROVIDER_DATA,
	DUPLICATE_HOLDING,
	DUPLICATE_PROVIDER_DATA,
	MISSING_BENCHMARK,
	INVALID_TARGET,
	MISSING_EMISSIONS,
	SCORE_CLIPPED,
	MISSING_WEIGHT,
	EMPTY_PARTITION,
	PARTITION_FAILED,
	EMPTY_COVERAGE
}
