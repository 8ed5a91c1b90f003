package org.example.otp.engine;

import org.example.otp.common.TokenNormalizer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;

/**
 * Accepts a code from the current step or up to {@code window} steps either side of it.
 * Steps are tried nearest first, the earlier one before the later: 0, -1, +1, -2, +2...
 */
public final class TotpValidator {
	private final TotpCodeGenerator generator;

	public TotpValidator(TotpCodeGenerator generator) {
		this.generator = generator;
	}

	public VerificationResult verify(TotpSpec spec, String candidate, int window, Instant instant) {
		if (window < 0)
			throw new IllegalArgumentException("window must not be negative, got " + window);
		String token = TokenNormalizer.normalize(candidate);
		if (!TokenNormalizer.isNumeric(token))
			return VerificationResult.rejected(VerificationResult.MALFORMED);

		// generated codes always have exactly spec.digits() characters
		if (token.length() != spec.digits())
			return VerificationResult.rejected(VerificationResult.NO_MATCH);

		long current = generator.counterAt(spec, instant);
		// long, so that window == Integer.MAX_VALUE cannot wrap the loop
		for (long step = 0; step <= window; step++) {
			if (matches(spec, token, current - step))
				return VerificationResult.match((int) -step);
			if (step > 0 && matches(spec, token, current + step))
				return VerificationResult.match((int) step);
		}
		return VerificationResult.rejected(VerificationResult.NO_MATCH);
	}

	private boolean matches(TotpSpec spec, String token, long counter) {
		byte[] expected = generator.generate(spec, counter).getBytes(StandardCharsets.US_ASCII);
		// timing must not reveal how many leading digits were right
		return MessageDigest.isEqual(expected, token.getBytes(StandardCharsets.US_ASCII));
	}
}
