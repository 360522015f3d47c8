package my.temperaturescore.app.model;

public enum ScoreBasis {
	TARGET,
	FALLBACK
}
