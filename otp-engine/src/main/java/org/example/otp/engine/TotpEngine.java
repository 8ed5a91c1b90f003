package org.example.otp.engine;

import dev.samstevens.totp.time.SystemTimeProvider;
import dev.samstevens.totp.time.TimeProvider;
import org.example.otp.common.ProvisioningException;
import org.example.otp.config.ConfigurationResolver;
import org.example.otp.config.ConfigurationStore;
import org.example.otp.config.EnvironmentConfigurationStore;
import org.example.otp.config.MapConfigurationStore;
import org.example.otp.config.ProvisioningSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Generates and checks TOTP codes for one provisioning source.
 *
 * <p>The provisioning string is resolved and parsed on first use and kept until
 * {@link #refresh()}. Safe to share between threads.
 *
 * <pre>{@code
 * TotpEngine otp = TotpEngine.fromEnv("HEROKU_OTP_URI");
 * String code = otp.getCode();
 * boolean valid = otp.verifyBool(code);
 * }</pre>
 */
public final class TotpEngine {
	private static final Logger log = LoggerFactory.getLogger(TotpEngine.class);

	public static final int DEFAULT_WINDOW = 1;

	private final ProvisioningSource source;
	private final ConfigurationResolver resolver;
	private final TimeProvider timeProvider;
	private final TotpCodeGenerator generator = new TotpCodeGenerator();
	private final TotpValidator validator = new TotpValidator(generator);

	private final Object lock = new Object();
	private volatile TotpSpec cached;

	public TotpEngine(ProvisioningSource source, ConfigurationResolver resolver, TimeProvider timeProvider) {
		this.source = source;
		this.resolver = resolver;
		this.timeProvider = timeProvider;
	}

	public static TotpEngine fromUri(String uri) {
		return new TotpEngine(ProvisioningSource.ofUri(uri), new ConfigurationResolver(new MapConfigurationStore()),
				new SystemTimeProvider());
	}

	/** Reads the otpauth URI from the named environment variable. */
	public static TotpEngine fromEnv(String key) {
		return fromKey(key, new EnvironmentConfigurationStore());
	}

	public static TotpEngine fromKey(String key, ConfigurationStore store) {
		return new TotpEngine(ProvisioningSource.ofKey(key), new ConfigurationResolver(store), new SystemTimeProvider());
	}

	/**
	 * The parsed parameters, loading them if needed.
	 *
	 * @throws org.example.otp.common.ConfigurationException when the source yields nothing
	 * @throws ProvisioningException                         when the provisioning string is unusable
	 */
	public TotpSpec spec() {
		TotpSpec s = cached;
		if (s != null)
			return s;
		synchronized (lock) {
			if (cached == null) {
				log.debug("Loading TOTP configuration from {}", source.describe());
				String uri = resolver.resolve(source);
				try {
					cached = ProvisioningUriParser.parse(uri);
				} catch (ProvisioningException e) {
					log.warn("Unusable provisioning string from {} ({}): {}", source.describe(), e.field(), e.getMessage());
					throw e;
				}
			}
			return cached;
		}
	}

	public String getCode() {
		return getCode(now());
	}

	public String getCode(Instant instant) {
		return generator.generate(spec(), instant);
	}

	public VerificationResult verify(String candidate) {
		return verify(candidate, DEFAULT_WINDOW);
	}

	public VerificationResult verify(String candidate, int window) {
		return verify(candidate, window, now());
	}

	public VerificationResult verify(String candidate, int window, Instant instant) {
		return validator.verify(spec(), candidate, window, instant);
	}

	public boolean verifyBool(String candidate) {
		return verify(candidate).ok();
	}

	public boolean verifyBool(String candidate, int window) {
		return verify(candidate, window).ok();
	}

	public boolean verifyBool(String candidate, int window, Instant instant) {
		return verify(candidate, window, instant).ok();
	}

	/** Drops the cached parameters; the next call resolves and parses again. */
	public void refresh() {
		synchronized (lock) {
			cached = null;
		}
		log.debug("TOTP configuration for {} cleared", source.describe());
	}

	private Instant now() {
		return Instant.ofEpochSecond(timeProvider.getTime());
	}
}
