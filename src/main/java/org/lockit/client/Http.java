package org.lockit.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

public final class Http {
	public static final String TOKEN_HEADER = "X-Session-Token";

	private final HttpClient hc = HttpClient.newHttpClient(); // redirects are not followed
	private final String base;
	private String token;

	public Http(String base) {
		this.base = base;
	}

	public void setToken(String t) {
		this.token = t;
	}

	public String token() {
		return token;
	}

	public String post(String path, String json) throws IOException, InterruptedException {
		return body(exchange("POST", path, json));
	}

	public String get(String path) throws IOException, InterruptedException {
		return body(exchange("GET", path, null));
	}

	/** Raw exchange, whatever the status; a null json sends an empty body. */
	public HttpResponse<String> exchange(String method, String path, String json)
			throws IOException, InterruptedException {
		HttpRequest.BodyPublisher body = json == null ? HttpRequest.BodyPublishers.noBody()
				: HttpRequest.BodyPublishers.ofString(json);
		HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(base + path)).method(method, body);
		if (json != null)
			b.header("Content-Type", "application/json");
		if (token != null)
			b.header(TOKEN_HEADER, token);
		return hc.send(b.build(), HttpResponse.BodyHandlers.ofString());
	}

	private static String body(HttpResponse<String> r) throws IOException {
		if (r.statusCode() >= 200 && r.statusCode() < 300)
			return r.body();
		throw new IOException("HTTP " + r.statusCode() + ": " + r.body());
	}
}
