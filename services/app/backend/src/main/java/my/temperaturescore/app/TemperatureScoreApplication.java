package my.temperaturescore.app;

import my.temperaturescore.app.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class TemperatureScoreApplication {

	public static void main(String[] args) {
		SpringApplication.run(TemperatureScoreApplication.class, args);
	}
}
