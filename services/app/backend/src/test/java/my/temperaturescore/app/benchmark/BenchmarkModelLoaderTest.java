package my.temperaturescore.app.benchmark;

import my.temperaturescore.app.model.ScopeCategory;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BenchmarkModelLoaderTest {
	private final BenchmarkModelLoader loader = new BenchmarkModelLoader();

	@Test
	void groupsRowsIntoTrajectories() {
		String csv = """
				# comment
				model,variable,sector,scope,horizon,param,intercept
				1,Emissions|Kyoto Gases,*,*,5,-0.1,3.0
				1,Emissions|Kyoto Gases,*,*,15,-0.2,3.1

				1,Emissions|Kyoto Gases,Steel,S3,5,-0.3,3.2
				""";

		BenchmarkModel model = loader.load(new StringReader(csv));

		assertThat(model.size()).isEqualTo(2);
		BenchmarkTrajectory generic = model.trajectory(1, "Emissions|Kyoto Gases", "Energy", ScopeCategory.S1S2).orElseThrow();
		assertThat(generic.sector()).isNull();
		assertThat(generic.points()).hasSize(2);
		BenchmarkTrajectory steel = model.trajectory(1, "Emissions|Kyoto Gases", "Steel", ScopeCategory.S3).orElseThrow();
		assertThat(steel.scope()).isEqualTo(ScopeCategory.S3);
		assertThat(steel.points().get(0).param()).isEqualTo(-0.3);
	}

	@Test
	void rejectsMissingColumns() {
		String csv = "model,variable,horizon,param,intercept\n1,x,5,-0.1,3.0\n";

		assertThatThrownBy(() -> loader.load(new StringReader(csv)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("sector");
	}

	@Test
	void rejectsInvalidNumbers() {
		String csv = "model,variable,sector,scope,horizon,param,intercept\n1,x,*,*,5,abc,3.0\n";

		assertThatThrownBy(() -> loader.load(new StringReader(csv)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid param 'abc'");
	}

	@Test
	void rejectsUnknownScope() {
		String csv = "model,variable,sector,scope,horizon,param,intercept\n1,x,*,S9,5,-0.1,3.0\n";

		assertThatThrownBy(() -> loader.load(new StringReader(csv)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Unknown scope 'S9'");
	}

	@Test
	void loadsShippedRegressionTable() throws Exception {
		try (InputStream in = getClass().getResourceAsStream("/benchmark/regression_model.csv")) {
			assertThat(in).isNotNull();
			BenchmarkModel model = loader.load(new InputStreamReader(in, StandardCharsets.UTF_8));

			assertThat(model.models()).containsExactlyInAnyOrder(1, 2, 3, 4);
			assertThat(model.size()).isEqualTo(16);
			BenchmarkTrajectory kyoto = model.trajectory(4, PathwayResolver.ABSOLUTE_PATHWAY, "Energy", ScopeCategory.S1S2S3)
					.orElseThrow();
			assertThat(kyoto.at(15).param()).isEqualTo(-0.3510);
			assertThat(kyoto.at(15).intercept()).isEqualTo(3.2480);
		}
	}
}
