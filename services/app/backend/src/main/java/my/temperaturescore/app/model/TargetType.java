package my.temperaturescore.app.model;

public enum TargetType {
	ABSOLUTE,
	INTENSITY
}
