package org.example.otp.config;

import java.util.Map;
import java.util.Optional;

/**
 * Process environment, copied once at construction so lookups stay consistent for the
 * lifetime of the store.
 */
public final class EnvironmentConfigurationStore implements ConfigurationStore {
	private final Map<String, String> snapshot;

	public EnvironmentConfigurationStore() {
		this(System.getenv());
	}

	EnvironmentConfigurationStore(Map<String, String> env) {
		this.snapshot = Map.copyOf(env);
	}

	@Override
	public Optional<String> lookup(String key) {
		return Optional.ofNullable(snapshot.get(key));
	}
}
