package my.temperaturescore.app.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		Scoring scoring,
		Aggregation aggregation,
		Benchmark benchmark
) {
	public AppProperties {
		scoring = scoring == null ? new Scoring(null, null, null, null, null, null, false) : scoring;
		aggregation = aggregation == null ? new Aggregation(null, null, null) : aggregation;
		benchmark = benchmark == null ? new Benchmark(null) : benchmark;
	}

	public record Scoring(
			Double fallbackScore,
			Integer model,
			List<String> timeFrames,
			List<String> scopes,
			Double minScore,
			Double maxScore,
			boolean parallel
	) {
		public Scoring {
			fallbackScore = fallbackScore == null ? 3.2 : fallbackScore;
			model = model == null ? 4 : model;
			timeFrames = timeFrames == null || timeFrames.isEmpty() ? List.of("SHORT", "MID", "LONG") : List.copyOf(timeFrames);
			scopes = scopes == null || scopes.isEmpty() ? List.of("S1S2", "S3", "S1S2S3") : List.copyOf(scopes);
			minScore = minScore == null ? 1.0 : minScore;
			maxScore = maxScore == null ? 4.5 : maxScore;
		}
	}

	public record Aggregation(
			@NotBlank String method,
			List<String> grouping,
			@Positive Integer topContributors
	) {
		public Aggregation {
			method = method == null ? "WATS" : method;
			grouping = grouping == null ? List.of() : List.copyOf(grouping);
			topContributors = topContributors == null ? 10 : topContributors;
		}
	}

	public record Benchmark(
			@NotNull String regressionResource
	) {
		public Benchmark {
			regressionResource = regressionResource == null ? "classpath:benchmark/regression_model.csv" : regressionResource;
		}
	}
}
