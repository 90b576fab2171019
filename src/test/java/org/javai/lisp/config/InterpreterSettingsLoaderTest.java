package org.javai.lisp.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class InterpreterSettingsLoaderTest {

	private final InterpreterSettingsLoader loader = new InterpreterSettingsLoader();

	@Test
	void readsBothSettings() {
		InterpreterSettings settings = loader.loadString("""
				interpreter:
				  trace-evaluation: true
				  quote-shorthand: false
				""");

		assertThat(settings.traceEvaluation()).isTrue();
		assertThat(settings.quoteShorthand()).isFalse();
	}

	@Test
	void missingKeysTakeDefaults() {
		InterpreterSettings settings = loader.loadString("""
				interpreter:
				  trace-evaluation: true
				""");

		assertThat(settings).isEqualTo(InterpreterSettings.defaults().withTraceEvaluation(true));
	}

	@Test
	void emptyDocumentOrMissingSectionGivesDefaults() {
		assertThat(loader.loadString("")).isEqualTo(InterpreterSettings.defaults());
		assertThat(loader.loadString("other: 1")).isEqualTo(InterpreterSettings.defaults());
	}

	@Test
	void readsFromStream() {
		InputStream stream = new ByteArrayInputStream(
				"interpreter:\n  quote-shorthand: false\n".getBytes(StandardCharsets.UTF_8));

		assertThat(loader.load(stream).quoteShorthand()).isFalse();
	}

	@Test
	void readsFromPath(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("settings.yml");
		Files.writeString(file, "interpreter:\n  trace-evaluation: true\n");

		assertThat(loader.load(file).traceEvaluation()).isTrue();
	}

	@Test
	void missingFileIsReported(@TempDir Path dir) {
		Path missing = dir.resolve("absent.yml");

		assertThatThrownBy(() -> loader.load(missing))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("absent.yml");
	}

	@Test
	void bundledResourceMatchesDefaults() {
		assertThat(loader.loadDefault()).isEqualTo(InterpreterSettings.defaults());
	}

	@Test
	void rejectsNonBooleanValues() {
		assertThatThrownBy(() -> loader.loadString("interpreter:\n  trace-evaluation: sometimes\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("trace-evaluation");
	}

	@Test
	void rejectsWrongShapes() {
		assertThatThrownBy(() -> loader.loadString("- a\n- b\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("mapping");
		assertThatThrownBy(() -> loader.loadString("interpreter: 3\n"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("'interpreter' section");
	}

	@Test
	void malformedYamlIsReported() {
		assertThatThrownBy(() -> loader.loadString("interpreter: [unclosed"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Failed to parse settings");
	}
}
