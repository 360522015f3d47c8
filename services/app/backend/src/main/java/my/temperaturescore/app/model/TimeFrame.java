package my.temperaturescore.app.model;

/**
 * Horizon bucket of a target, measured in years from the target's start year.
 */
public enum TimeFrame {
	SHORT(0, 5),
	MID(5, 15),
	LONG(15, 30);

	private final int lowerExclusive;
	private final int upperInclusive;

	TimeFrame(int lowerExclusive, int upperInclusive) {
		this.lowerExclusive = lowerExclusive;
		this.upperInclusive = upperInclusive;
	}

	public boolean contains(int horizonYears) {
		return horizonYears > lowerExclusive && horizonYears <= upperInclusive;
	}

	public int lowerExclusive() {
		return lowerExclusive;
	}

	public int upperInclusive() {
		return upperInclusive;
	}
}
