package my.temperaturescore.app.config;

import my.temperaturescore.app.benchmark.BenchmarkModel;
import my.temperaturescore.app.benchmark.BenchmarkModelLoader;
import my.temperaturescore.app.service.AggregationEngine;
import my.temperaturescore.app.service.ScenarioCapper;
import my.temperaturescore.app.service.ScoringOptionsParser;
import my.temperaturescore.app.service.TemperatureScoreEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

@Configuration
public class ScoringConfiguration {
	private static final Logger logger = LoggerFactory.getLogger(ScoringConfiguration.class);

	@Bean
	public BenchmarkModel benchmarkModel(AppProperties properties, ResourceLoader resourceLoader) {
		String location = properties.benchmark().regressionResource();
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			throw new IllegalStateException("Benchmark resource not found: " + location);
		}
		try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
			BenchmarkModel model = new BenchmarkModelLoader().load(reader);
			logger.info("Loaded {} benchmark trajectories for models {} from {}.", model.size(), model.models(), location);
			return model;
		} catch (IOException ex) {
			throw new UncheckedIOException("Failed to read benchmark resource " + location, ex);
		}
	}

	@Bean
	public TemperatureScoreEngine temperatureScoreEngine(BenchmarkModel benchmarkModel, AppProperties properties) {
		AppProperties.Scoring scoring = properties.scoring();
		return new TemperatureScoreEngine(benchmarkModel, scoring.minScore(), scoring.maxScore(), scoring.parallel());
	}

	@Bean
	public ScenarioCapper scenarioCapper(AggregationEngine aggregationEngine, AppProperties properties) {
		return new ScenarioCapper(aggregationEngine, properties.aggregation().topContributors());
	}

	@Bean
	public ScoringOptionsParser scoringOptionsParser(AppProperties properties) {
		return new ScoringOptionsParser(properties);
	}
}
