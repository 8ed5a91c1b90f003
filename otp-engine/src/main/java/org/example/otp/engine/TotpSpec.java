package org.example.otp.engine;

import dev.samstevens.totp.code.HashingAlgorithm;
import org.example.otp.common.Base32Secrets;

import java.util.Arrays;
import java.util.Objects;

/**
 * Parsed TOTP parameters. Immutable; the secret is copied in and out.
 */
public final class TotpSpec {
	public static final int MIN_DIGITS = 1;
	public static final int MAX_DIGITS = 10;

	private final byte[] secret;
	private final String base32Key;
	private final HashingAlgorithm algorithm;
	private final int digits;
	private final int period;
	private final String label;
	private final String issuer;

	public TotpSpec(byte[] secret, HashingAlgorithm algorithm, int digits, int period, String label, String issuer) {
		if (secret == null || secret.length == 0)
			throw new IllegalArgumentException("secret must not be empty");
		if (digits < MIN_DIGITS || digits > MAX_DIGITS)
			throw new IllegalArgumentException("digits must be in [" + MIN_DIGITS + "," + MAX_DIGITS + "], got " + digits);
		if (period <= 0)
			throw new IllegalArgumentException("period must be positive, got " + period);
		this.secret = secret.clone();
		this.base32Key = Base32Secrets.encode(secret);
		this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
		this.digits = digits;
		this.period = period;
		this.label = label;
		this.issuer = issuer;
	}

	public byte[] secret() {
		return secret.clone();
	}

	// form expected by the samstevens code generator
	String base32Key() {
		return base32Key;
	}

	public HashingAlgorithm algorithm() {
		return algorithm;
	}

	public int digits() {
		return digits;
	}

	/** Time step in seconds. */
	public int period() {
		return period;
	}

	public String label() {
		return label;
	}

	public String issuer() {
		return issuer;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof TotpSpec other))
			return false;
		return digits == other.digits && period == other.period && algorithm == other.algorithm
				&& Arrays.equals(secret, other.secret) && Objects.equals(label, other.label)
				&& Objects.equals(issuer, other.issuer);
	}

	@Override
	public int hashCode() {
		return Objects.hash(Arrays.hashCode(secret), algorithm, digits, period, label, issuer);
	}

	@Override
	public String toString() {
		return "TotpSpec[algorithm=" + algorithm + ", digits=" + digits + ", period=" + period
				+ ", label=" + label + ", issuer=" + issuer + "]";
	}
}
