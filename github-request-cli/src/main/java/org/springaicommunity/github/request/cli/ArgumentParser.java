package org.springaicommunity.github.request.cli;

import org.springaicommunity.github.request.GitHubClient;
import org.springaicommunity.github.request.GitHubUrls;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Command-line argument parser for the github-request CLI. Pure Java implementation with
 * no Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private static final Pattern METHOD = Pattern.compile("[A-Za-z]+");

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();
		List<String> positional = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-X", "--method":
					String method = getRequiredValue(args, i, "method");
					if (!METHOD.matcher(method).matches()) {
						throw new IllegalArgumentException("Invalid method '" + method + "'");
					}
					config.method = method.toUpperCase(Locale.ROOT);
					i++;
					break;

				case "-f", "--field":
					String field = getRequiredValue(args, i, "field");
					int equals = field.indexOf('=');
					if (equals <= 0) {
						throw new IllegalArgumentException("Invalid field '" + field + "': expected key=value");
					}
					config.fields.put(field.substring(0, equals), field.substring(equals + 1));
					i++;
					break;

				case "-H", "--header":
					String header = getRequiredValue(args, i, "header");
					int colon = header.indexOf(':');
					if (colon <= 0) {
						throw new IllegalArgumentException("Invalid header '" + header + "': expected 'Name: value'");
					}
					config.headers.put(header.substring(0, colon).trim(), header.substring(colon + 1).trim());
					i++;
					break;

				case "--input":
					config.inputFile = getRequiredValue(args, i, "input");
					i++;
					break;

				case "--paginate":
					config.paginate = true;
					break;

				case "-i", "--include":
					config.include = true;
					break;

				case "--api-url":
					config.apiUrl = getRequiredValue(args, i, "api-url");
					if (!GitHubUrls.isAbsolute(config.apiUrl)) {
						throw new IllegalArgumentException(
								"Invalid API URL '" + config.apiUrl + "': must start with http:// or https://");
					}
					i++;
					break;

				case "--mutation-delay":
					String delayStr = getRequiredValue(args, i, "mutation-delay");
					try {
						config.mutationDelaySeconds = Double.parseDouble(delayStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid mutation delay '" + delayStr + "': must be a number of seconds");
					}
					if (!(config.mutationDelaySeconds >= 0) || config.mutationDelaySeconds.isInfinite()) {
						throw new IllegalArgumentException("Mutation delay must be non-negative: " + delayStr);
					}
					i++;
					break;

				case "--max-retries":
					String retriesStr = getRequiredValue(args, i, "max-retries");
					try {
						config.maxRetries = Integer.parseInt(retriesStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid max retries '" + retriesStr + "': must be a non-negative integer");
					}
					if (config.maxRetries < 0) {
						throw new IllegalArgumentException("Max retries must be non-negative: " + config.maxRetries);
					}
					i++;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					positional.add(arg);
					break;
			}
		}

		if (positional.size() > 1) {
			throw new IllegalArgumentException("Expected a single endpoint, got: " + String.join(" ", positional));
		}
		config.path = positional.isEmpty() ? null : positional.get(0);

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-request [OPTIONS] ENDPOINT\n");
		help.append("\n");
		help.append("Make an authenticated request to the GitHub REST API and print the JSON response.\n");
		help.append("ENDPOINT is a path such as repos/OWNER/REPO/issues, or a full URL.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("    -X, --method METHOD       HTTP method (default: GET, or POST when a body is given)\n");
		help.append("    -f, --field KEY=VALUE     Add a parameter: query string for GET/DELETE, JSON body otherwise\n");
		help.append("    -H, --header 'NAME: VAL'  Add a request header\n");
		help.append("    --input FILE              Send FILE as the request body (\"-\" for standard input)\n");
		help.append("    --paginate                Follow pagination links and print all items as one array\n");
		help.append("    -i, --include             Print the response status and headers\n");
		help.append("    -v, --verbose             Log requests and retries\n");
		help.append("\n");
		help.append("CLIENT OPTIONS:\n");
		help.append("    --api-url URL             API base URL (default: $GITHUB_API_URL or ")
			.append(GitHubUrls.DEFAULT_API_URL)
			.append(")\n");
		help.append("    --mutation-delay SECONDS  Minimum spacing between mutating requests (default: ")
			.append(GitHubClient.DEFAULT_MUTATION_DELAY.toMillis() / 1000.0)
			.append(")\n");
		help.append("    --max-retries N           Retries for failed or rate-limited requests (default: 10)\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN              GitHub access token (optional)\n");
		help.append("    GITHUB_API_URL            API base URL for GitHub Enterprise\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0 success, 1 request failed, 2 invalid usage\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-request repos/spring-projects/spring-ai\n");
		help.append("    github-request --paginate -f state=open -f per_page=100 repos/OWNER/REPO/issues\n");
		help.append("    github-request -X POST -f name=triage -f color=ededed repos/OWNER/REPO/labels\n");
		help.append("    github-request -X DELETE repos/OWNER/REPO/labels/triage\n");
		help.append("    github-request -H 'Accept: application/vnd.github.raw' repos/OWNER/REPO/readme\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (!config.helpRequested && (config.path == null || config.path.isBlank())) {
			errors.add("Endpoint cannot be empty");
		}

		if (config.paginate && !"GET".equals(config.effectiveMethod())) {
			errors.add("--paginate only works with GET requests");
		}

		if (config.paginate && config.include) {
			errors.add("--paginate cannot be combined with --include");
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Configuration errors: " + String.join(", ", errors));
		}
	}

}
