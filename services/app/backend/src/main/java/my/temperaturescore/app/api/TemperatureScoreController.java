package my.temperaturescore.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.temperaturescore.app.dto.AggregateResponseDto;
import my.temperaturescore.app.dto.ScoreResponseDto;
import my.temperaturescore.app.dto.ScoringOptions;
import my.temperaturescore.app.dto.ScoringOptionsInfoDto;
import my.temperaturescore.app.dto.TemperatureScoreRequestDto;
import my.temperaturescore.app.service.TemperatureScoreService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/temperature-scores")
@Tag(name = "Temperature Scores")
public class TemperatureScoreController {
	private final TemperatureScoreService temperatureScoreService;

	public TemperatureScoreController(TemperatureScoreService temperatureScoreService) {
		this.temperatureScoreService = temperatureScoreService;
	}

	@PostMapping("/score")
	@Operation(summary = "Score every portfolio company per scope and time frame")
	public ScoreResponseDto score(@RequestBody TemperatureScoreRequestDto request) {
		return temperatureScoreService.score(request);
	}

	@PostMapping("/aggregate")
	@Operation(summary = "Score and aggregate a portfolio, including coverage")
	public AggregateResponseDto aggregate(@RequestBody TemperatureScoreRequestDto request) {
		return temperatureScoreService.aggregate(request);
	}

	@PostMapping(value = "/options/resolve", consumes = {"application/yaml", "application/x-yaml", MediaType.TEXT_PLAIN_VALUE})
	@Operation(summary = "Resolve a JSON or YAML options document against the configured defaults")
	public ScoringOptions resolveOptions(@RequestBody(required = false) String document) {
		return temperatureScoreService.resolveOptions(document);
	}

	@GetMapping("/options")
	@Operation(summary = "List supported option values and the configured defaults")
	public ScoringOptionsInfoDto options() {
		return temperatureScoreService.options();
	}
}
