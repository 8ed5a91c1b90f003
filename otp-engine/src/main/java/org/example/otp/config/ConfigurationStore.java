package org.example.otp.config;

import java.util.Optional;

/**
 * Synchronous key to string lookup, e.g. the process environment.
 */
public interface ConfigurationStore {

	Optional<String> lookup(String key);

	/** Present and non-empty. */
	default boolean has(String key) {
		return lookup(key).filter(v -> !v.isEmpty()).isPresent();
	}
}
