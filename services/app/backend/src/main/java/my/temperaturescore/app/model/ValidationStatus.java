package my.temperaturescore.app.model;

public enum ValidationStatus {
	VALIDATED,
	NOT_VALIDATED,
	PENDING
}
