package my.temperaturescore.app.benchmark;

import my.temperaturescore.app.model.ScopeCategory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only set of benchmark trajectories. Lookups prefer the most specific curve:
 * sector and scope, then sector only, then scope only, then the generic curve of the variable.
 */
public class BenchmarkModel {
	private final Map<TrajectoryKey, BenchmarkTrajectory> trajectories;
	private final Set<Integer> models;

	public BenchmarkModel(Collection<BenchmarkTrajectory> trajectories) {
		Map<TrajectoryKey, BenchmarkTrajectory> indexed = new HashMap<>();
		Set<Integer> modelIds = new TreeSet<>();
		for (BenchmarkTrajectory trajectory : trajectories) {
			TrajectoryKey key = new TrajectoryKey(trajectory.model(), trajectory.variable(),
					normalizeSector(trajectory.sector()), trajectory.scope());
			if (indexed.putIfAbsent(key, trajectory) != null) {
				throw new IllegalArgumentException("Duplicate benchmark trajectory " + key);
			}
			modelIds.add(trajectory.model());
		}
		this.trajectories = Map.copyOf(indexed);
		this.models = Collections.unmodifiableSet(modelIds);
	}

	public Optional<BenchmarkTrajectory> trajectory(int model, String variable, String sector, ScopeCategory scope) {
		if (variable == null) {
			return Optional.empty();
		}
		String sectorKey = normalizeSector(sector);
		List<TrajectoryKey> candidates = List.of(
				new TrajectoryKey(model, variable, sectorKey, scope),
				new TrajectoryKey(model, variable, sectorKey, null),
				new TrajectoryKey(model, variable, null, scope),
				new TrajectoryKey(model, variable, null, null)
		);
		for (TrajectoryKey key : candidates) {
			BenchmarkTrajectory trajectory = trajectories.get(key);
			if (trajectory != null) {
				return Optional.of(trajectory);
			}
		}
		return Optional.empty();
	}

	public Set<Integer> models() {
		return models;
	}

	public int size() {
		return trajectories.size();
	}

	private static String normalizeSector(String sector) {
		if (sector == null || sector.isBlank()) {
			return null;
		}
		return sector.trim().toLowerCase(Locale.ROOT);
	}

	private record TrajectoryKey(int model, String variable, String sector, ScopeCategory scope) {
	}
}
