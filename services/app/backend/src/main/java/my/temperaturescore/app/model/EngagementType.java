package my.temperaturescore.app.model;

public enum EngagementType {
	SET_TARGETS,
	SET_SBTI_TARGETS
}
