package org.javai.lisp.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads {@link InterpreterSettings} from YAML.
 *
 * <pre>
 * interpreter:
 *   trace-evaluation: false
 *   quote-shorthand: true
 * </pre>
 *
 * Missing keys, or a missing {@code interpreter} section, take their defaults.
 */
public class InterpreterSettingsLoader {

	public static final String DEFAULT_RESOURCE = "META-INF/javai-lisp.yml";

	private static final Logger logger = LoggerFactory.getLogger(InterpreterSettingsLoader.class);

	private final Yaml yaml = new Yaml();

	/**
	 * Loads the settings bundled on the classpath at {@link #DEFAULT_RESOURCE}, or the defaults
	 * when no such resource exists.
	 */
	public InterpreterSettings loadDefault() {
		ClassLoader classLoader = InterpreterSettingsLoader.class.getClassLoader();
		try (InputStream stream = classLoader.getResourceAsStream(DEFAULT_RESOURCE)) {
			if (stream == null) {
				logger.debug("No {} on classpath, using default settings", DEFAULT_RESOURCE);
				return InterpreterSettings.defaults();
			}
			return load(stream);
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read settings resource: " + DEFAULT_RESOURCE, e);
		}
	}

	public InterpreterSettings load(Path path) {
		try (Reader reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read settings from path: " + path, e);
		}
	}

	public InterpreterSettings load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (YAMLException e) {
			throw new IllegalArgumentException("Failed to parse settings from input stream", e);
		}
	}

	public InterpreterSettings load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (YAMLException e) {
			throw new IllegalArgumentException("Failed to parse settings from reader", e);
		}
	}

	public InterpreterSettings loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (YAMLException e) {
			throw new IllegalArgumentException("Failed to parse settings from string", e);
		}
	}

	private InterpreterSettings build(Object document) {
		if (document == null) {
			return InterpreterSettings.defaults();
		}
		if (!(document instanceof Map<?, ?> root)) {
			throw new IllegalArgumentException("Settings document must be a mapping, got: " + document);
		}
		Object section = root.get("interpreter");
		if (section == null) {
			return InterpreterSettings.defaults();
		}
		if (!(section instanceof Map<?, ?> interpreter)) {
			throw new IllegalArgumentException("'interpreter' section must be a mapping, got: " + section);
		}

		InterpreterSettings settings = new InterpreterSettings(
				toBoolean(interpreter, "trace-evaluation", InterpreterSettings.DEFAULT_TRACE_EVALUATION),
				toBoolean(interpreter, "quote-shorthand", InterpreterSettings.DEFAULT_QUOTE_SHORTHAND)
		);
		logger.debug("Loaded interpreter settings: {}", settings);
		return settings;
	}

	private boolean toBoolean(Map<?, ?> section, String key, boolean defaultValue) {
		Object value = section.get(key);
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Boolean bool) {
			return bool;
		}
		throw new IllegalArgumentException("'" + key + "' must be true or false, got: " + value);
	}
}
