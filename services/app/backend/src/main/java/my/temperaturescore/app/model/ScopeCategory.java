package my.temperaturescore.app.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Scope combination a score is requested for. A target only qualifies for a category when it
 * covers every component scope; partial coverage of a composite category does not count.
 */
public enum ScopeCategory {
	S1(EnumSet.of(Scope.S1)),
	S1S2(EnumSet.of(Scope.S1, Scope.S2)),
	S3(EnumSet.of(Scope.S3)),
	S1S2S3(EnumSet.of(Scope.S1, Scope.S2, Scope.S3));

	private final Set<Scope> components;

	ScopeCategory(Set<Scope> components) {
		this.components = components;
	}

	public Set<Scope> components() {
		return EnumSet.copyOf(components);
	}

	public boolean isCoveredBy(Collection<Scope> coverage) {
		return coverage != null && coverage.containsAll(components);
	}
}
