package org.springaicommunity.github.request.cli;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Request
	public String path;

	public String method; // null = GET, or POST when a body is given

	public Map<String, String> fields = new LinkedHashMap<>();

	public Map<String, String> headers = new LinkedHashMap<>();

	public String inputFile; // "-" reads standard input

	// Output
	public boolean paginate = false;

	public boolean include = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	// Client settings, null = library default
	public String apiUrl;

	public Double mutationDelaySeconds;

	public Integer maxRetries;

	/**
	 * The HTTP method to use: the explicit one, else POST when fields or an input file
	 * make up a body, else GET.
	 */
	public String effectiveMethod() {
		if (method != null) {
			return method;
		}
		return fields.isEmpty() && inputFile == null ? "GET" : "POST";
	}

	/**
	 * Whether {@code -f} fields are sent as query parameters rather than as a JSON body.
	 */
	public boolean fieldsAsQuery() {
		String effective = effectiveMethod();
		return "GET".equals(effective) || "DELETE".equals(effective) || "HEAD".equals(effective) || inputFile != null;
	}

}
