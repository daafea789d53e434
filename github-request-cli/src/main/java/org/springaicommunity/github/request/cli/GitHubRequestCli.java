package org.springaicommunity.github.request.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.request.GitHubClient;
import org.springaicommunity.github.request.GitHubEnvironment;
import org.springaicommunity.github.request.GitHubHttpException;
import org.springaicommunity.github.request.GitHubRequestException;
import org.springaicommunity.github.request.GitHubResponse;
import org.springaicommunity.github.request.GitHubTransport;
import org.springaicommunity.github.request.RequestOptions;
import org.springaicommunity.github.request.RetryConfig;
import org.springaicommunity.github.request.UserAgents;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * GitHub Request CLI Application
 *
 * Plain Java command-line front end to the GitHub REST API in the style of
 * {@code gh api}. No Spring dependencies - uses {@link GitHubClient#builder()} for wiring.
 *
 * Usage: java -jar github-request-cli.jar [OPTIONS] ENDPOINT
 *
 * Environment Variables: GITHUB_TOKEN - GitHub access token, GITHUB_API_URL - API base
 * URL
 *
 * Exit codes: 0 on success, 1 when the request fails, 2 on invalid usage.
 */
public class GitHubRequestCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRequestCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_REQUEST_FAILED = 1;

	static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		int exitCode = run(args, System.in, System.out, System.err, null);
		if (exitCode != 0) {
			System.exit(exitCode);
		}
	}

	/**
	 * Run the CLI.
	 * @param args command-line arguments
	 * @param in standard input, read for {@code --input -}
	 * @param out receives the response
	 * @param err receives error messages
	 * @param transport transport to use, or null for the default HTTP transport
	 * @return exit code
	 */
	static int run(String[] args, InputStream in, PrintStream out, PrintStream err,
			@Nullable GitHubTransport transport) {
		ArgumentParser argumentParser = new ArgumentParser();

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			err.println("Error: " + e.getMessage());
			err.println("Run with --help for usage.");
			return EXIT_USAGE;
		}

		if (config.verbose) {
			enableVerboseLogging();
		}

		RequestOptions options;
		try {
			options = buildOptions(config, in);
		}
		catch (IOException e) {
			err.println("Error: cannot read input " + config.inputFile + ": " + e.getMessage());
			return EXIT_USAGE;
		}

		try (GitHubClient client = buildClient(config, transport)) {
			if (config.paginate) {
				printPaginated(client, config, options, out);
			}
			else {
				printResponse(client, client.send(config.effectiveMethod(), config.path, options), config.include,
						out);
			}
			return EXIT_OK;
		}
		catch (GitHubHttpException e) {
			if (config.include) {
				printHead(e.getResponse(), out);
			}
			err.println(e.getMessage());
			return EXIT_REQUEST_FAILED;
		}
		catch (GitHubRequestException e) {
			logger.debug("Request failed", e);
			err.println("Error: " + e.getMessage());
			return EXIT_REQUEST_FAILED;
		}
	}

	static GitHubClient buildClient(ParsedConfiguration config, @Nullable GitHubTransport transport) {
		RetryConfig.Builder retry = RetryConfig.builder();
		if (config.maxRetries != null) {
			retry.maxRetries(config.maxRetries);
		}
		GitHubClient.Builder builder = GitHubClient.builder()
			.apiUrl(config.apiUrl != null ? config.apiUrl : GitHubEnvironment.apiUrl())
			.token(GitHubEnvironment.token())
			.userAgent(UserAgents.make("github-request-cli",
					GitHubRequestCli.class.getPackage().getImplementationVersion(), null))
			.retryConfig(retry.build())
			.transport(transport);
		if (config.mutationDelaySeconds != null) {
			builder.mutationDelay(Duration.ofNanos(Math.round(config.mutationDelaySeconds * 1e9)));
		}
		return builder.build();
	}

	static RequestOptions buildOptions(ParsedConfiguration config, InputStream in) throws IOException {
		RequestOptions.Builder options = RequestOptions.builder().headers(config.headers);
		if (config.fieldsAsQuery()) {
			options.query(config.fields);
		}
		else if (!config.fields.isEmpty()) {
			options.json(config.fields);
		}
		if (config.inputFile != null) {
			byte[] data = "-".equals(config.inputFile) ? in.readAllBytes()
					: Files.readAllBytes(Path.of(config.inputFile));
			options.data(data);
		}
		return options.build();
	}

	private static void printPaginated(GitHubClient client, ParsedConfiguration config, RequestOptions options,
			PrintStream out) {
		ObjectMapper mapper = client.getObjectMapper();
		ArrayNode items = mapper.createArrayNode();
		client.paginate(config.path, options).forEachRemaining(items::add);
		logger.debug("Collected {} items from {}", items.size(), config.path);
		out.println(pretty(mapper, items));
	}

	private static void printResponse(GitHubClient client, GitHubResponse response, boolean include,
			PrintStream out) {
		if (include) {
			printHead(response, out);
		}
		String text = response.text();
		if (text.isBlank()) {
			return;
		}
		ObjectMapper mapper = client.getObjectMapper();
		try {
			out.println(pretty(mapper, mapper.readTree(text)));
		}
		catch (JsonProcessingException e) {
			logger.debug("Response from {} is not JSON; printing as text", response.uri());
			out.println(text);
		}
	}

	private static void printHead(GitHubResponse response, PrintStream out) {
		out.println("HTTP " + response.statusCode());
		Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		headers.putAll(response.headers().map());
		headers.forEach((name, values) -> values.forEach(value -> out.println(name + ": " + value)));
		out.println();
	}

	private static String pretty(ObjectMapper mapper, JsonNode node) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize JSON tree", e);
		}
	}

	private static void enableVerboseLogging() {
		Logger libraryLogger = LoggerFactory.getLogger("org.springaicommunity.github.request");
		if (libraryLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

}
