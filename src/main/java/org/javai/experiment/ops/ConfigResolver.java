package org.javai.experiment.ops;

import java.util.function.Function;

/**
 * Resolves configuration from a system property first, then an environment variable,
 * then a default.
 */
public final class ConfigResolver {

	private ConfigResolver() {
		// Utility class
	}

	/**
	 * Returns the raw value, or null if neither source sets it.
	 */
	public static String resolve(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		return value == null || value.isBlank() ? null : value.trim();
	}

	/**
	 * Resolves and parses a value, falling back to {@code defaultValue} when unset.
	 *
	 * @throws IllegalStateException if the value is set but cannot be parsed
	 */
	public static <T> T resolve(String sysProp, String envVar, T defaultValue, Function<String, T> parser) {
		String raw = resolve(sysProp, envVar);
		if (raw == null) {
			return defaultValue;
		}
		try {
			return parser.apply(raw);
		} catch (RuntimeException e) {
			throw new IllegalStateException(
				"Malformed configuration '" + raw + "' for system property '" + sysProp +
				"' or environment variable '" + envVar + "'", e
			);
		}
	}

}
