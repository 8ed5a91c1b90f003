package org.example.otp.common;

/**
 * The provisioning string describes an OTP flavour other than TOTP (e.g. counter based HOTP).
 */
public class UnsupportedTypeException extends ProvisioningException {
	private final String type;

	public UnsupportedTypeException(String type) {
		super("type", "unsupported otp type '" + type + "', only totp is accepted");
		this.type = type;
	}

	public String type() {
		return type;
	}
}
