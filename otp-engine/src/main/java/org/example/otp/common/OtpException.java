package org.example.otp.common;

/**
 * Base for every failure that prevents an OTP code from being generated or checked.
 */
public class OtpException extends RuntimeException {
	public OtpException(String message) {
		super(message);
	}

	public OtpException(String message, Throwable cause) {
		super(message, cause);
	}
}
