package my.temperaturescore.app.model;

public enum Scope {
	S1,
	S2,
	S3
}
