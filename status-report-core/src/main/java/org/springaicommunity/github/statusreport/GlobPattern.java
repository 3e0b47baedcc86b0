package org.springaicommunity.github.statusreport;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A case-insensitive shell-style glob compiled to a regular expression.
 *
 * <p>
 * Supported syntax:
 * <ul>
 * <li>{@code *} matches any run of characters, including none and including {@code /}</li>
 * <li>{@code ?} matches exactly one character</li>
 * <li>{@code [abc]}, {@code [a-z]} match one character of the set, {@code [!abc]} one
 * character outside it</li>
 * <li>{@code \} makes the next character literal</li>
 * </ul>
 *
 * <p>
 * The glob is trimmed before compilation. Malformed globs are rejected with a
 * {@link ReportConfigurationException}.
 */
public final class GlobPattern {

	private final String glob;

	private final Pattern pattern;

	private GlobPattern(String glob, Pattern pattern) {
		this.glob = glob;
		this.pattern = pattern;
	}

	/**
	 * Compile a glob that must match a whole value.
	 * @param glob the glob text
	 * @return the compiled pattern
	 * @throws ReportConfigurationException if the glob is malformed
	 */
	public static GlobPattern compile(String glob) {
		String trimmed = glob.trim();
		return new GlobPattern(trimmed, compileRegex(trimmed, toRegex(trimmed)));
	}

	/**
	 * Compile a glob that must match the beginning of a value.
	 * @param glob the glob text
	 * @return the compiled pattern
	 * @throws ReportConfigurationException if the glob is malformed
	 */
	public static GlobPattern compilePrefix(String glob) {
		String trimmed = glob.trim();
		return new GlobPattern(trimmed, compileRegex(trimmed, toRegex(trimmed) + ".*"));
	}

	/**
	 * Test a value against this glob. The value is trimmed first.
	 * @param value the value to test
	 * @return true if the value matches
	 */
	public boolean matches(String value) {
		return pattern.matcher(value.trim()).matches();
	}

	/**
	 * The trimmed glob text this pattern was compiled from.
	 * @return the glob
	 */
	public String glob() {
		return glob;
	}

	@Override
	public String toString() {
		return glob;
	}

	private static Pattern compileRegex(String glob, String regex) {
		try {
			return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
		}
		catch (PatternSyntaxException e) {
			throw new ReportConfigurationException("Invalid glob '" + glob + "': " + e.getDescription(), e);
		}
	}

	static String toRegex(String glob) {
		StringBuilder regex = new StringBuilder(glob.length() + 8);
		int i = 0;
		while (i < glob.length()) {
			char c = glob.charAt(i);
			switch (c) {
				case '*' -> regex.append(".*");
				case '?' -> regex.append('.');
				case '\\' -> {
					if (i + 1 >= glob.length()) {
						throw new ReportConfigurationException(
								"Invalid glob '" + glob + "': trailing escape character");
					}
					i++;
					regex.append(Pattern.quote(String.valueOf(glob.charAt(i))));
				}
				case '[' -> i = appendCharacterClass(glob, i, regex);
				default -> regex.append(Pattern.quote(String.valueOf(c)));
			}
			i++;
		}
		return regex.toString();
	}

	/**
	 * Translate the set starting at {@code start} and return the index of its closing
	 * bracket.
	 */
	private static int appendCharacterClass(String glob, int start, StringBuilder regex) {
		int i = start + 1;
		StringBuilder set = new StringBuilder("[");
		if (i < glob.length() && glob.charAt(i) == '!') {
			set.append('^');
			i++;
		}
		boolean empty = true;
		while (i < glob.length()) {
			char c = glob.charAt(i);
			if (c == ']' && !empty) {
				regex.append(set).append(']');
				return i;
			}
			if (c == '\\') {
				if (i + 1 >= glob.length()) {
					break;
				}
				i++;
				c = glob.charAt(i);
				appendSetLiteral(set, c);
			}
			else if (c == '-' && !empty && i + 1 < glob.length() && glob.charAt(i + 1) != ']') {
				set.append('-');
			}
			else {
				appendSetLiteral(set, c);
			}
			empty = false;
			i++;
		}
		throw new ReportConfigurationException("Invalid glob '" + glob + "': unterminated character set");
	}

	private static void appendSetLiteral(StringBuilder set, char c) {
		if (!Character.isLetterOrDigit(c)) {
			set.append('\\');
		}
		set.append(c);
	}

}
