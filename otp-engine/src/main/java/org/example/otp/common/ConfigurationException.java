package org.example.otp.common;

/**
 * No usable configuration value: missing key, empty value or a value of the wrong type.
 */
public class ConfigurationException extends OtpException {
	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
