package org.example.otp.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.example.otp.common.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Typed accessors over a {@link ConfigurationStore}. One method per target type, each with
 * its own required/default/trim handling.
 */
public final class EnvConfig {
	private static final List<String> TRUE_VALUES = List.of("true", "1", "yes", "on");
	private static final List<String> FALSE_VALUES = List.of("false", "0", "no", "off");

	private final ConfigurationStore store;
	private final Gson gson = new Gson();

	public EnvConfig(ConfigurationStore store) {
		this.store = store;
	}

	public boolean has(String key) {
		return store.has(key);
	}

	/** Fails listing every missing key at once. */
	public void require(String... keys) {
		List<String> missing = Arrays.stream(keys).filter(k -> !store.has(k)).collect(Collectors.toList());
		if (!missing.isEmpty())
			throw new ConfigurationException("Missing required configuration: " + String.join(", ", missing));
	}

	public String getString(String key) {
		return getString(key, ConfigOptions.mandatory());
	}

	public String getString(String key, ConfigOptions<String> opts) {
		return get(key, opts, raw -> raw);
	}

	public Integer getInt(String key, ConfigOptions<Integer> opts) {
		return get(key, opts, raw -> {
			try {
				return Integer.parseInt(raw);
			} catch (NumberFormatException e) {
				throw new ConfigurationException("Configuration " + key + " is not a valid integer: \"" + raw + "\"", e);
			}
		});
	}

	public Long getLong(String key, ConfigOptions<Long> opts) {
		return get(key, opts, raw -> {
			try {
				return Long.parseLong(raw);
			} catch (NumberFormatException e) {
				throw new ConfigurationException("Configuration " + key + " is not a valid number: \"" + raw + "\"", e);
			}
		});
	}

	public Boolean getBoolean(String key, ConfigOptions<Boolean> opts) {
		return get(key, opts, raw -> {
			String v = raw.toLowerCase(Locale.ROOT);
			if (TRUE_VALUES.contains(v))
				return true;
			if (FALSE_VALUES.contains(v))
				return false;
			throw new ConfigurationException("Configuration " + key + " is not a valid boolean: \"" + raw + "\"");
		});
	}

	/** Matches constant names case-insensitively. */
	public <E extends Enum<E>> E getEnum(String key, Class<E> type, ConfigOptions<E> opts) {
		return get(key, opts, raw -> {
			for (E e : type.getEnumConstants()) {
				if (e.name().equalsIgnoreCase(raw))
					return e;
			}
			throw new ConfigurationException("Configuration " + key + " must be one of "
					+ Arrays.toString(type.getEnumConstants()) + ", got \"" + raw + "\"");
		});
	}

	public List<String> getList(String key, String separator, ConfigOptions<List<String>> opts) {
		return getList(key, separator, Function.identity(), opts);
	}

	/** Splits on the (literal) separator, trims items and drops empty ones. */
	public <T> List<T> getList(String key, String separator, Function<String, T> mapper, ConfigOptions<List<T>> opts) {
		return get(key, opts, raw -> {
			List<T> out = new ArrayList<>();
			for (String part : raw.split(Pattern.quote(separator))) {
				String item = part.trim();
				if (!item.isEmpty())
					out.add(mapper.apply(item));
			}
			return List.copyOf(out);
		});
	}

	public <T> T getJson(String key, Class<T> type, ConfigOptions<T> opts) {
		return get(key, opts, raw -> {
			try {
				return gson.fromJson(raw, type);
			} catch (JsonParseException e) {
				throw new ConfigurationException("Configuration " + key + " is not valid JSON: " + e.getMessage(), e);
			}
		});
	}

	private <T> T get(String key, ConfigOptions<T> opts, Function<String, T> parser) {
		String raw = store.lookup(key).orElse(null);
		if (raw != null && opts.trim())
			raw = raw.trim();
		if (raw == null || raw.isEmpty()) {
			if (!opts.required())
				return opts.defaultValue();
			throw new ConfigurationException("Missing configuration: " + key);
		}
		return parser.apply(raw);
	}
}
