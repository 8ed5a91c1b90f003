package org.example.otp.common;

import java.util.Locale;

/**
 * Cleans up user typed codes before comparison. Never fails: garbage in simply won't match.
 */
public final class TokenNormalizer {
	private static final char FULLWIDTH_ZERO = '０';
	private static final char FULLWIDTH_NINE = '９';

	private TokenNormalizer() {
	}

	public static String normalize(String input) {
		if (input == null)
			return "";
		String s = input.trim();
		StringBuilder sb = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c >= FULLWIDTH_ZERO && c <= FULLWIDTH_NINE) {
				sb.append((char) ('0' + (c - FULLWIDTH_ZERO)));
			} else if (!isBlank(c)) {
				sb.append(c);
			}
		}
		return sb.toString().toUpperCase(Locale.ROOT);
	}

	/** True when the (already normalized) token is non-empty and made only of ASCII digits. */
	public static boolean isNumeric(String token) {
		if (token == null || token.isEmpty())
			return false;
		for (int i = 0; i < token.length(); i++) {
			char c = token.charAt(i);
			if (c < '0' || c > '9')
				return false;
		}
		return true;
	}

	// isWhitespace skips U+00A0 and friends, isSpaceChar catches them
	private static boolean isBlank(char c) {
		return Character.isWhitespace(c) || Character.isSpaceChar(c);
	}
}
