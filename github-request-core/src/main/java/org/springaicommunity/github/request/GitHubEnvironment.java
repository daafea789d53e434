package org.springaicommunity.github.request;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Reads GitHub settings from the environment.
 *
 * <p>
 * Lookup order for each variable:
 * <ol>
 * <li>System environment variable</li>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 * A variable set to the empty string counts as unset.
 */
public final class GitHubEnvironment {

	public static final String API_URL_VARIABLE = "GITHUB_API_URL";

	public static final String GRAPHQL_URL_VARIABLE = "GITHUB_GRAPHQL_URL";

	public static final String TOKEN_VARIABLE = "GITHUB_TOKEN";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final @Nullable Dotenv HOME_DOTENV = loadHomeDotenv();

	private GitHubEnvironment() {
	}

	private static @Nullable Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home == null) {
			return null;
		}
		return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
	}

	/**
	 * Get a non-empty environment value.
	 * @param name the variable name
	 * @return the value, or {@code null} if unset or empty
	 */
	public static @Nullable String get(String name) {
		// Dotenv.get consults System.getenv before the file's own entries
		String value = CWD_DOTENV.get(name);
		if ((value == null || value.isEmpty()) && HOME_DOTENV != null) {
			value = HOME_DOTENV.get(name);
		}
		return value == null || value.isEmpty() ? null : value;
	}

	/**
	 * Base URL of the REST API: {@code $GITHUB_API_URL}, or {@code https://api.github.com}.
	 */
	public static String apiUrl() {
		String value = get(API_URL_VARIABLE);
		return value != null ? value : GitHubUrls.DEFAULT_API_URL;
	}

	/**
	 * URL of the GraphQL endpoint: {@code $GITHUB_GRAPHQL_URL}, or
	 * {@code https://api.github.com/graphql}.
	 */
	public static String graphqlUrl() {
		String value = get(GRAPHQL_URL_VARIABLE);
		return value != null ? value : GitHubUrls.DEFAULT_GRAPHQL_URL;
	}

	/**
	 * The token in {@code $GITHUB_TOKEN}, if any.
	 */
	public static @Nullable String token() {
		return get(TOKEN_VARIABLE);
	}

}
