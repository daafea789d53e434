package org.springaicommunity.github.request;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Spring configuration exposing a {@link GitHubClient} and its {@link ObjectMapper}.
 *
 * <p>
 * Properties:
 * <ul>
 * <li>{@code GITHUB_TOKEN} - bearer token (optional)</li>
 * <li>{@code GITHUB_API_URL} - base URL (default https://api.github.com)</li>
 * <li>{@code github.request.user-agent}</li>
 * <li>{@code github.request.mutation-delay-ms} (default 1000)</li>
 * <li>{@code github.request.max-retries} (default 10)</li>
 * <li>{@code github.request.total-wait-seconds} (default 300, 0 = unbounded)</li>
 * </ul>
 */
@Configuration
public class GitHubRequestConfig {

	@Value("${GITHUB_TOKEN:}")
	private String githubToken;

	@Value("${GITHUB_API_URL:" + GitHubUrls.DEFAULT_API_URL + "}")
	private String apiUrl;

	@Value("${github.request.user-agent:github-request}")
	private String userAgent;

	@Value("${github.request.mutation-delay-ms:1000}")
	private long mutationDelayMillis;

	@Value("${github.request.max-retries:10}")
	private int maxRetries;

	@Value("${github.request.total-wait-seconds:300}")
	private long totalWaitSeconds;

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean(destroyMethod = "close")
	public GitHubClient gitHubClient(ObjectMapper objectMapper) {
		RetryConfig retryConfig = RetryConfig.builder()
			.maxRetries(maxRetries)
			.totalWait(totalWaitSeconds > 0 ? Duration.ofSeconds(totalWaitSeconds) : null)
			.build();
		return GitHubClient.builder()
			.apiUrl(apiUrl.isBlank() ? GitHubUrls.DEFAULT_API_URL : apiUrl)
			.token(githubToken.isBlank() ? null : githubToken)
			.userAgent(userAgent)
			.mutationDelay(Duration.ofMillis(mutationDelayMillis))
			.retryConfig(retryConfig)
			.objectMapper(objectMapper)
			.build();
	}

}
