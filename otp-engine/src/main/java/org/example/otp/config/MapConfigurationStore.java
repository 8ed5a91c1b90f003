package org.example.otp.config;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store whose values may change at runtime.
 */
public final class MapConfigurationStore implements ConfigurationStore {
	private final Map<String, String> values = new ConcurrentHashMap<>();

	public MapConfigurationStore() {
	}

	public MapConfigurationStore(Map<String, String> initial) {
		values.putAll(initial);
	}

	@Override
	public Optional<String> lookup(String key) {
		return Optional.ofNullable(values.get(key));
	}

	public MapConfigurationStore put(String key, String value) {
		values.put(key, value);
		return this;
	}

	public void remove(String key) {
		values.remove(key);
	}
}
