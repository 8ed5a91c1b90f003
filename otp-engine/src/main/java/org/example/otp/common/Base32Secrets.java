package org.example.otp.common;

import org.apache.commons.codec.binary.Base32;

import java.util.Locale;

/**
 * Strict base32 handling for shared secrets (commons-codec alone silently skips bad characters).
 */
public final class Base32Secrets {
	private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567";

	private Base32Secrets() {
	}

	/**
	 * Decodes a base32 secret. Spaces and '-' separators are dropped, case is ignored and
	 * trailing '=' padding is optional.
	 *
	 * @throws InvalidSecretException on characters outside the alphabet, padding in the
	 *                                middle or a length that no byte sequence encodes to
	 */
	public static byte[] decode(String text) {
		if (text == null)
			throw new InvalidSecretException("secret is missing");
		String s = text.replace(" ", "").replace("-", "").toUpperCase(Locale.ROOT);
		int end = s.length();
		while (end > 0 && s.charAt(end - 1) == '=')
			end--;
		int padding = s.length() - end;
		String body = s.substring(0, end);
		if (body.isEmpty())
			throw new InvalidSecretException("secret is empty");
		for (int i = 0; i < body.length(); i++) {
			if (ALPHABET.indexOf(body.charAt(i)) < 0)
				throw new InvalidSecretException("secret contains a character outside the base32 alphabet at position " + i);
		}
		int rem = body.length() % 8;
		if (rem == 1 || rem == 3 || rem == 6)
			throw new InvalidSecretException("secret has an invalid base32 length");
		if (padding > 0 && (rem == 0 || padding != 8 - rem))
			throw new InvalidSecretException("secret has malformed base32 padding");
		byte[] out = new Base32().decode(body);
		if (out.length == 0)
			throw new InvalidSecretException("secret is empty");
		return out;
	}

	/** Canonical unpadded encoding, the form authenticator apps and QR payloads expect. */
	public static String encode(byte[] data) {
		String s = new Base32().encodeToString(data);
		int end = s.length();
		while (end > 0 && s.charAt(end - 1) == '=')
			end--;
		return s.substring(0, end);
	}
}
