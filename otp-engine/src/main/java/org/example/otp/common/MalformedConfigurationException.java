package org.example.otp.common;

public class MalformedConfigurationException extends ProvisioningException {
	public MalformedConfigurationException(String field, String message) {
		super(field, message);
	}

	public MalformedConfigurationException(String field, String message, Throwable cause) {
		super(field, message, cause);
	}
}
