package org.example.otp.config;

/**
 * Where an otpauth provisioning string comes from: given directly, or the name of a
 * configuration key holding it. Exactly one of the two is set.
 */
public record ProvisioningSource(String literalValue, String externalKey) {

	public ProvisioningSource {
		if ((literalValue == null) == (externalKey == null))
			throw new IllegalArgumentException("exactly one of literalValue or externalKey must be set");
	}

	public static ProvisioningSource ofUri(String uri) {
		return new ProvisioningSource(uri, null);
	}

	public static ProvisioningSource ofKey(String key) {
		return new ProvisioningSource(null, key);
	}

	/** Safe for logs and error messages: the key name, or "direct" for a literal. */
	public String describe() {
		return externalKey != null ? externalKey : "direct";
	}

	@Override
	public String toString() {
		return "ProvisioningSource[" + describe() + "]";
	}
}
