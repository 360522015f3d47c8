package my.temperaturescore.app.model;

import java.util.Optional;

public enum ScenarioType {
	TARGETS(1),
	APPROVED_TARGETS(2),
	HIGHEST_CONTRIBUTORS(3),
	HIGHEST_CONTRIBUTORS_APPROVED(4);

	private final int number;

	ScenarioType(int number) {
		this.number = number;
	}

	public int number() {
		return number;
	}

	public static Optional<ScenarioType> fromNumber(Integer number) {
		if (number == null) {
			return Optional.empty();
		}
		for (ScenarioType type : values()) {
			if (type.number == number) {
				return Optional.of(type);
			}
		}
		return Optional.empty();
	}
}
