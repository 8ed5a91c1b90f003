package org.example.otp.engine;

/**
 * Outcome of checking a code. A rejected code is a normal result, not an exception.
 *
 * @param ok     whether the code matched within the window
 * @param delta  signed step offset of the match (0 = current step), null when not ok
 * @param reason why the code was rejected, null when ok
 */
public record VerificationResult(boolean ok, Integer delta, String reason) {
	public static final String MALFORMED = "empty or non-numeric-shaped";
	public static final String NO_MATCH = "no match within window";

	public VerificationResult {
		if (ok && (delta == null || reason != null))
			throw new IllegalArgumentException("a match carries a delta and no reason");
		if (!ok && (delta != null || reason == null))
			throw new IllegalArgumentException("a rejection carries a reason and no delta");
	}

	public static VerificationResult match(int delta) {
		return new VerificationResult(true, delta, null);
	}

	public static VerificationResult rejected(String reason) {
		return new VerificationResult(false, null, reason);
	}
}
