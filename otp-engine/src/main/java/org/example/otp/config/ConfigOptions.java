package org.example.otp.config;

/**
 * Retrieval options for one {@link EnvConfig} accessor call.
 *
 * @param required     fail when the key is missing or empty
 * @param defaultValue returned for a missing key when not required
 * @param trim         strip surrounding whitespace before parsing
 */
public record ConfigOptions<T>(boolean required, T defaultValue, boolean trim) {

	public static <T> ConfigOptions<T> mandatory() {
		return new ConfigOptions<>(true, null, true);
	}

	public static <T> ConfigOptions<T> optional(T defaultValue) {
		return new ConfigOptions<>(false, defaultValue, true);
	}

	public ConfigOptions<T> untrimmed() {
		return new ConfigOptions<>(required, defaultValue, false);
	}
}
