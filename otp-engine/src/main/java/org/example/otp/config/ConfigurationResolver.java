package org.example.otp.config;

import org.example.otp.common.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the raw provisioning string for a {@link ProvisioningSource}. Nothing is cached
 * here so that a caller re-resolving after a configuration change sees the new value.
 */
public final class ConfigurationResolver {
	private static final Logger log = LoggerFactory.getLogger(ConfigurationResolver.class);

	private final EnvConfig config;

	public ConfigurationResolver(ConfigurationStore store) {
		this.config = new EnvConfig(store);
	}

	public String resolve(ProvisioningSource source) {
		String literal = source.literalValue();
		if (literal != null && !literal.isBlank()) {
			log.debug("Using direct provisioning string");
			return literal.trim();
		}
		String key = source.externalKey();
		if (key != null) {
			String value = config.getString(key, ConfigOptions.optional(""));
			if (!value.isEmpty()) {
				log.debug("Resolved provisioning string from {}", key);
				return value;
			}
			throw new ConfigurationException("OTP: missing configuration value for " + key);
		}
		throw new ConfigurationException("OTP: no provisioning string given (" + source.describe() + ")");
	}
}
