package my.temperaturescore.app.service;

import my.temperaturescore.app.model.ScopeCategory;
import my.temperaturescore.app.model.Target;
import my.temperaturescore.app.model.TimeFrame;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the target a (scope, time frame) score is derived from.
 */
public class TargetSelector {
	// validated first, then the larger reduction, then the later target year
	private static final Comparator<Target> PREFERENCE = Comparator
			.comparing((Target t) -> t.isValidated() ? 0 : 1)
			.thenComparing(t -> t.reductionPct() == null ? Double.NEGATIVE_INFINITY : t.reductionPct(), Comparator.reverseOrder())
			.thenComparing(t -> t.targetYear() == null ? Integer.MIN_VALUE : t.targetYear(), Comparator.reverseOrder());

	public Optional<Target> select(List<Target> targets, ScopeCategory scope, TimeFrame timeFrame) {
		if (targets == null || targets.isEmpty()) {
			return Optional.empty();
		}
		// stable sort keeps input order as the last tie-break
		return targets.stream()
				.filter(t -> qualifies(t, scope, timeFrame))
				.sorted(PREFERENCE)
				.findFirst();
	}

	/**
	 * True when the target covers the scope, falls in the time frame and carries a reduction to score.
	 */
	public boolean qualifies(Target target, ScopeCategory scope, TimeFrame timeFrame) {
		return matchesSlot(target, scope, timeFrame) && target.reductionPct() != null;
	}

	/**
	 * True when some target matches the slot by scope and horizon but none of them can be scored.
	 */
	public boolean onlyUnusableCandidates(List<Target> targets, ScopeCategory scope, TimeFrame timeFrame) {
		if (targets == null || targets.isEmpty()) {
			return false;
		}
		return targets.stream().anyMatch(t -> matchesSlot(t, scope, timeFrame))
				&& targets.stream().noneMatch(t -> qualifies(t, scope, timeFrame));
	}

	private boolean matchesSlot(Target target, ScopeCategory scope, TimeFrame timeFrame) {
		if (target == null || !scope.isCoveredBy(target.scopes())) {
			return false;
		}
		// the time frame windows start above zero, so non-positive horizons never match
		Integer horizon = target.horizon();
		return horizon != null && timeFrame.contains(horizon);
	}
}
