package org.springaicommunity.github.statusreport;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves environment variables from the process environment and {@code .env} files.
 * The files are loaded once and cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 *
 * <p>
 * Configuration values may reference variables as {@code ${NAME}}; see
 * {@link #expand(String, Function)}.
 */
public final class EnvironmentSupport {

	private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Replace every {@code ${NAME}} placeholder with the value of the variable. Unknown
	 * variables expand to the empty string.
	 * @param value the text containing placeholders
	 * @param lookup variable lookup, usually {@link #get(String)}
	 * @return the expanded text
	 */
	public static String expand(String value, Function<String, @Nullable String> lookup) {
		Matcher matcher = PLACEHOLDER.matcher(value);
		StringBuilder expanded = new StringBuilder();
		while (matcher.find()) {
			String replacement = lookup.apply(matcher.group(1));
			matcher.appendReplacement(expanded, Matcher.quoteReplacement(replacement != null ? replacement : ""));
		}
		matcher.appendTail(expanded);
		return expanded.toString();
	}

}
