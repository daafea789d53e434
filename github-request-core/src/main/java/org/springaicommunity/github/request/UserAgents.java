package org.springaicommunity.github.request;

import org.jspecify.annotations.Nullable;

/**
 * Builds {@code User-Agent} strings identifying the calling application.
 */
public final class UserAgents {

	private UserAgents() {
	}

	/**
	 * Build a user agent of the form
	 * {@code name[/version][ (url)] Java-http-client/<java version>}.
	 * @param name client name
	 * @param version client version, or {@code null}
	 * @param url project URL, or {@code null}
	 * @return the user agent string
	 */
	public static String make(String name, @Nullable String version, @Nullable String url) {
		StringBuilder userAgent = new StringBuilder(name);
		if (version != null) {
			userAgent.append('/').append(version);
		}
		if (url != null) {
			userAgent.append(" (").append(url).append(')');
		}
		userAgent.append(" Java-http-client/").append(System.getProperty("java.version"));
		return userAgent.toString();
	}

}
