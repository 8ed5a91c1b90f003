package org.example.otp.common;

/**
 * A provisioning string was found but cannot be turned into TOTP parameters.
 * Messages name the offending field and never carry the secret.
 */
public abstract class ProvisioningException extends OtpException {
	private final String field;

	protected ProvisioningException(String field, String message) {
		super(message);
		this.field = field;
	}

	protected ProvisioningException(String field, String message, Throwable cause) {
		super(message, cause);
		this.field = field;
	}

	/** Name of the offending part of the provisioning string ("secret", "digits", "type"...). */
	public String field() {
		return field;
	}
}
