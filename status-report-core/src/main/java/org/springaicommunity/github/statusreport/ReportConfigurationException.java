package org.springaicommunity.github.statusreport;

/**
 * Thrown when the report configuration is unusable: missing settings, malformed match
 * patterns, conflicting render orders or unreadable configuration files.
 *
 * <p>
 * Configuration problems are always detected before any item is processed, so a run that
 * fails with this exception has written no report.
 */
public class ReportConfigurationException extends RuntimeException {

	public ReportConfigurationException(String message) {
		super(message);
	}

	public ReportConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}

}
