package org.springaicommunity.github.request;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * URL helpers shared by {@link GitHubClient} and {@link Endpoint}.
 */
public final class GitHubUrls {

	public static final String DEFAULT_API_URL = "https://api.github.com";

	public static final String DEFAULT_GRAPHQL_URL = "https://api.github.com/graphql";

	private GitHubUrls() {
	}

	/**
	 * Resolve {@code path} against {@code base}. Absolute {@code http://} and
	 * {@code https://} URLs are returned unchanged; anything else is appended to
	 * {@code base} with exactly one slash between the two.
	 * @param base base URL
	 * @param path relative path or absolute URL
	 * @return the resolved URL
	 */
	public static String join(String base, String path) {
		if (isAbsolute(path)) {
			return path;
		}
		return stripTrailingSlashes(base) + "/" + stripLeadingSlashes(path);
	}

	public static boolean isAbsolute(String url) {
		String lower = url.toLowerCase(Locale.ROOT);
		return lower.startsWith("http://") || lower.startsWith("https://");
	}

	/**
	 * Append URL-encoded query parameters to {@code url}, which may already carry a
	 * query string.
	 */
	public static String withQuery(String url, Map<String, List<String>> query) {
		if (query.isEmpty()) {
			return url;
		}
		StringBuilder result = new StringBuilder(url);
		char separator = url.indexOf('?') >= 0 ? '&' : '?';
		for (Map.Entry<String, List<String>> param : query.entrySet()) {
			for (String value : param.getValue()) {
				result.append(separator)
					.append(URLEncoder.encode(param.getKey(), StandardCharsets.UTF_8))
					.append('=')
					.append(URLEncoder.encode(value, StandardCharsets.UTF_8));
				separator = '&';
			}
		}
		return result.toString();
	}

	private static String stripTrailingSlashes(String value) {
		int end = value.length();
		while (end > 0 && value.charAt(end - 1) == '/') {
			end--;
		}
		return value.substring(0, end);
	}

	private static String stripLeadingSlashes(String value) {
		int start = 0;
		while (start < value.length() && value.charAt(start) == '/') {
			start++;
		}
		return value.substring(start);
	}

}
