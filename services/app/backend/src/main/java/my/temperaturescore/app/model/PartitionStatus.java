package my.temperaturescore.app.model;

public enum PartitionStatus {
	OK,
	UNDEFINED,
	FAILED
}
