package org.example.otp.engine;

import dev.samstevens.totp.code.HashingAlgorithm;
import org.example.otp.common.Base32Secrets;
import org.example.otp.common.MalformedConfigurationException;
import org.example.otp.common.UnsupportedTypeException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parses {@code otpauth://totp/[issuer:]account?secret=...&algorithm=...&digits=...&period=...}.
 */
public final class ProvisioningUriParser {
	public static final String SCHEME = "otpauth";
	public static final String TYPE = "totp";
	public static final HashingAlgorithm DEFAULT_ALGORITHM = HashingAlgorithm.SHA1;
	public static final int DEFAULT_DIGITS = 6;
	public static final int DEFAULT_PERIOD = 30;

	private ProvisioningUriParser() {
	}

	public static TotpSpec parse(String uri) {
		if (uri == null || uri.isBlank())
			throw new MalformedConfigurationException("uri", "provisioning string is empty");
		String s = uri.trim();

		int schemeEnd = s.indexOf("://");
		if (schemeEnd < 0 || !s.substring(0, schemeEnd).equalsIgnoreCase(SCHEME))
			throw new MalformedConfigurationException("scheme", "provisioning string must start with " + SCHEME + "://");
		String rest = s.substring(schemeEnd + 3);

		int slash = rest.indexOf('/');
		String type = slash < 0 ? rest : rest.substring(0, slash);
		int q = type.indexOf('?');
		if (q >= 0)
			type = type.substring(0, q);
		if (type.isEmpty())
			throw new MalformedConfigurationException("type", "otp type is missing");
		if (!type.equalsIgnoreCase(TYPE))
			throw new UnsupportedTypeException(type);
		if (slash < 0)
			throw new MalformedConfigurationException("label", "label is missing");
		rest = rest.substring(slash + 1);

		int hash = rest.indexOf('#');
		if (hash >= 0)
			rest = rest.substring(0, hash);
		int query = rest.indexOf('?');
		if (query < 0)
			throw new MalformedConfigurationException("secret", "query string with the secret is missing");
		String label = decode("label", rest.substring(0, query));
		if (label.isBlank())
			throw new MalformedConfigurationException("label", "label is empty");
		Map<String, String> params = splitQuery(rest.substring(query + 1));

		String issuer = null;
		int colon = label.indexOf(':');
		if (colon >= 0) {
			issuer = emptyToNull(label.substring(0, colon).trim());
			label = label.substring(colon + 1).trim();
		}
		String issuerParam = emptyToNull(params.get("issuer"));
		if (issuerParam != null)
			issuer = issuerParam;

		String secret = params.get("secret");
		if (secret == null || secret.isBlank())
			throw new MalformedConfigurationException("secret", "secret parameter is missing");

		return new TotpSpec(
				Base32Secrets.decode(secret),
				algorithm(params.get("algorithm")),
				intParam(params, "digits", DEFAULT_DIGITS, TotpSpec.MIN_DIGITS, TotpSpec.MAX_DIGITS),
				intParam(params, "period", DEFAULT_PERIOD, 1, Integer.MAX_VALUE),
				label,
				issuer);
	}

	static HashingAlgorithm algorithm(String token) {
		if (token == null)
			return DEFAULT_ALGORITHM;
		switch (token.replace("-", "").toUpperCase(Locale.ROOT)) {
		case "SHA1":
			return HashingAlgorithm.SHA1;
		case "SHA256":
			return HashingAlgorithm.SHA256;
		case "SHA512":
			return HashingAlgorithm.SHA512;
		default:
			throw new MalformedConfigurationException("algorithm", "unknown algorithm '" + token + "'");
		}
	}

	private static int intParam(Map<String, String> params, String name, int def, int min, int max) {
		String raw = params.get(name);
		if (raw == null)
			return def;
		int v;
		try {
			v = Integer.parseInt(raw.trim());
		} catch (NumberFormatException e) {
			throw new MalformedConfigurationException(name, name + " is not a number: '" + raw + "'", e);
		}
		if (v < min || v > max)
			throw new MalformedConfigurationException(name, name + " out of range [" + min + "," + max + "]: " + v);
		return v;
	}

	// keys are matched case-insensitively, the last occurrence wins
	private static Map<String, String> splitQuery(String q) {
		Map<String, String> m = new HashMap<>();
		if (q.isEmpty())
			return m;
		for (String p : q.split("&")) {
			if (p.isEmpty())
				continue;
			int i = p.indexOf('=');
			String k = decode("query", i > 0 ? p.substring(0, i) : p).toLowerCase(Locale.ROOT);
			String v = i > 0 ? decode(k, p.substring(i + 1)) : "";
			m.put(k, v);
		}
		return m;
	}

	// percent-decoding only: a literal '+' stays a '+'
	private static String decode(String field, String raw) {
		try {
			return URLDecoder.decode(raw.replace("+", "%2B"), StandardCharsets.UTF_8);
		} catch (IllegalArgumentException e) {
			throw new MalformedConfigurationException(field, "bad percent-encoding in " + field, e);
		}
	}

	private static String emptyToNull(String s) {
		return s == null || s.isEmpty() ? null : s;
	}
}
