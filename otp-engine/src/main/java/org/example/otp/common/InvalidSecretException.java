package org.example.otp.common;

public class InvalidSecretException extends ProvisioningException {
	public InvalidSecretException(String message) {
		super("secret", message);
	}
}
