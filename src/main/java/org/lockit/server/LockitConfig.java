package org.lockit.server;

import org.lockit.common.OtpEngine;
import org.lockit.common.ProvisioningUri;
import org.lockit.common.VerificationWindow;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;

/**
 * Settings of the two-factor server. {@link #load()} reads {@code lockit.properties} from
 * the classpath; a JVM system property with the same key wins over the file.
 */
public record LockitConfig(int port, String issuer, String loginRoute, boolean rest, VerificationWindow window,
		int digits, String qrChartApi, DatabaseConfig db) {

	public static final String RESOURCE = "/lockit.properties";

	public static final String PORT = "lockit.port";
	public static final String ISSUER = "lockit.issuer";
	public static final String LOGIN_ROUTE = "lockit.loginRoute";
	public static final String REST = "lockit.rest";
	public static final String WINDOW = "lockit.window";
	public static final String TIME_STEP = "lockit.timeStep";
	public static final String DIGITS = "lockit.digits";
	public static final String QR_CHART_API = "lockit.qrChartApi";
	public static final String DB_URL = "lockit.db.url";
	public static final String DB_NAME = "lockit.db.name";
	public static final String DB_COLLECTION = "lockit.db.collection";

	private static final List<String> KEYS = List.of(PORT, ISSUER, LOGIN_ROUTE, REST, WINDOW, TIME_STEP, DIGITS,
			QR_CHART_API, DB_URL, DB_NAME, DB_COLLECTION);

	public static final int DEFAULT_PORT = 8080;
	public static final String DEFAULT_LOGIN_ROUTE = "/login";
	public static final String DEFAULT_QR_CHART_API = "https://chart.googleapis.com/chart?chs=200x200&cht=qr&chl=";

	public LockitConfig {
		if (issuer == null || issuer.isBlank())
			throw new IllegalArgumentException(ISSUER + " must not be blank");
		if (loginRoute == null || !loginRoute.startsWith("/"))
			throw new IllegalArgumentException(LOGIN_ROUTE + " must start with '/', got " + loginRoute);
		if (Server.ROUTES.contains(loginRoute))
			throw new IllegalArgumentException(LOGIN_ROUTE + " collides with the server route " + loginRoute);
		if (window == null)
			throw new IllegalArgumentException("window is null");
		if (digits < 1 || digits > OtpEngine.MAX_DIGITS)
			throw new IllegalArgumentException(DIGITS + " must be between 1 and " + OtpEngine.MAX_DIGITS);
	}

	public static LockitConfig defaults() {
		return from(new Properties());
	}

	public static LockitConfig load() {
		Properties p = new Properties();
		try (InputStream in = LockitConfig.class.getResourceAsStream(RESOURCE)) {
			if (in != null) {
				try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
					p.load(r);
				}
			}
		} catch (IOException e) {
			throw new UncheckedIOException("cannot read " + RESOURCE, e);
		}
		for (String key : KEYS) {
			String v = System.getProperty(key);
			if (v != null)
				p.setProperty(key, v);
		}
		return from(p);
	}

	public static LockitConfig from(Properties p) {
		String dbUrl = p.getProperty(DB_URL);
		DatabaseConfig db = (dbUrl == null || dbUrl.isBlank()) ? null
				: new DatabaseConfig(dbUrl.trim(), p.getProperty(DB_NAME), p.getProperty(DB_COLLECTION));
		return new LockitConfig(
				intValue(p, PORT, DEFAULT_PORT),
				p.getProperty(ISSUER, ProvisioningUri.DEFAULT_ISSUER).trim(),
				p.getProperty(LOGIN_ROUTE, DEFAULT_LOGIN_ROUTE).trim(),
				Boolean.parseBoolean(p.getProperty(REST, "false").trim()),
				new VerificationWindow(intValue(p, WINDOW, VerificationWindow.DEFAULT_WINDOW_SIZE),
						intValue(p, TIME_STEP, VerificationWindow.DEFAULT_TIME_STEP)),
				intValue(p, DIGITS, OtpEngine.DEFAULT_DIGITS),
				p.getProperty(QR_CHART_API, DEFAULT_QR_CHART_API).trim(),
				db);
	}

	public LockitConfig withPort(int port) {
		return new LockitConfig(port, issuer, loginRoute, rest, window, digits, qrChartApi, db);
	}

	private static int intValue(Properties p, String key, int def) {
		String v = p.getProperty(key);
		if (v == null || v.isBlank())
			return def;
		try {
			return Integer.parseInt(v.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(key + " is not a number: '" + v + "'", e);
		}
	}
}
