package org.example.otp.engine;

import dev.samstevens.totp.code.CodeGenerator;
import dev.samstevens.totp.code.DefaultCodeGenerator;
import dev.samstevens.totp.exceptions.CodeGenerationException;

import java.time.Instant;

/**
 * RFC 6238 code derivation. HMAC and dynamic truncation come from the samstevens generator,
 * this class owns the time step arithmetic.
 */
public final class TotpCodeGenerator {

	public long counterAt(TotpSpec spec, Instant instant) {
		return Math.floorDiv(instant.getEpochSecond(), (long) spec.period());
	}

	public String generate(TotpSpec spec, Instant instant) {
		return generate(spec, counterAt(spec, instant));
	}

	public String generate(TotpSpec spec, long counter) {
		CodeGenerator gen = new DefaultCodeGenerator(spec.algorithm(), spec.digits());
		try {
			return gen.generate(spec.base32Key(), counter);
		} catch (CodeGenerationException e) {
			// only reachable when the JCA provider lacks the HMAC algorithm
			throw new IllegalStateException("Cannot compute " + spec.algorithm().getHmacAlgorithm(), e);
		}
	}
}
