package org.example.otp.engine;

import dev.samstevens.totp.qr.QrData;
import dev.samstevens.totp.secret.DefaultSecretGenerator;
import dev.samstevens.totp.secret.SecretGenerator;
import org.example.otp.common.Base32Secrets;

/**
 * Enrollment side: new secrets and otpauth URIs for authenticator apps.
 */
public final class TotpProvisioning {
	private TotpProvisioning() {
	}

	/** 160-bit key, the size RFC 4226 recommends for HMAC-SHA1. */
	public static final int DEFAULT_SECRET_CHARACTERS = 32;

	public static String newSecret() {
		return newSecret(DEFAULT_SECRET_CHARACTERS);
	}

	/**
	 * Random base32 secret of the given length. Whole 8-character blocks only, so the
	 * secret maps to a whole number of bytes.
	 */
	public static String newSecret(int characters) {
		if (characters <= 0 || characters % 8 != 0)
			throw new IllegalArgumentException("secret length must be a positive multiple of 8, got " + characters);
		SecretGenerator gen = new DefaultSecretGenerator(characters);
		return gen.generate();
	}

	/**
	 * For a spec with a label, the result parses back to an equal {@link TotpSpec}, except
	 * when there is no issuer and the label itself contains ':'. The part before the colon
	 * then reads back as the issuer, as authenticator apps read it.
	 */
	public static String toUri(TotpSpec spec) {
		String account = spec.label() == null ? "" : spec.label();
		QrData data = new QrData.Builder()
				.label(spec.issuer() == null ? account : spec.issuer() + ":" + account)
				.secret(Base32Secrets.encode(spec.secret()))
				.issuer(spec.issuer() == null ? "" : spec.issuer())
				.algorithm(spec.algorithm())
				.digits(spec.digits())
				.period(spec.period())
				.build();
		return data.getUri();
	}
}
