package org.lockit.server;

import org.lockit.common.ApiModels.*;
import org.lockit.common.SecretCodec;
import org.lockit.common.VerifyResult;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import com.sun.net.httpserver.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.*;

/**
 * Two-factor HTTP endpoints. The server never stores secrets: the caller keeps the base32
 * secret from {@code /2fa/setup} and sends it back with each code to verify.
 */
public final class Server {
	private static final Logger log = LoggerFactory.getLogger(Server.class);
	private static final Gson gson = new Gson();

	public static final String SETUP = "/2fa/setup";
	public static final String QRCODE = "/2fa/qrcode";
	public static final String VERIFY = "/2fa/verify";
	public static final String LOGOUT = "/logout";
	public static final String PRIVATE = "/private";
	/** Fixed contexts; the login route is configured and must not collide with these. */
	public static final List<String> ROUTES = List.of(SETUP, QRCODE, VERIFY, LOGOUT, PRIVATE);

	private final TwoFactorService totp;
	private final SessionStore sessions;
	private final SessionTeardown teardown;

	private Server(TwoFactorService totp, SessionStore sessions) {
		this.totp = totp;
		this.sessions = sessions;
		this.teardown = new SessionTeardown(sessions);
	}

	public static void main(String[] args) throws Exception {
		LockitConfig config = LockitConfig.load();
		if (config.db() != null) {
			DatabaseAdapter db = DatabaseResolver.resolve(config.db());
			log.info("User database: {} via {}", db.type(), db.adapterName());
		}
		HttpServer s = start(config);
		log.info("Server listening on port {}", s.getAddress().getPort());
	}

	public static HttpServer start(LockitConfig config) throws IOException {
		return start(config, Clock.systemUTC());
	}

	public static HttpServer start(LockitConfig config, Clock clock) throws IOException {
		Server app = new Server(new TwoFactorService(config, clock), new InMemorySessionStore());
		HttpServer s = HttpServer.create(new InetSocketAddress(config.port()), 0);
		s.createContext(SETUP, j(app::doSetup));
		s.createContext(QRCODE, j(app::doQr));
		s.createContext(VERIFY, j(app::doVerify));
		s.createContext(config.loginRoute(), j(app::doLogin));
		s.createContext(LOGOUT, j(app::doLogout));
		HttpContext priv = s.createContext(PRIVATE, j(app::doPrivate));
		priv.getFilters().add(new RouteGuard(app.sessions, config));
		s.setExecutor(null);
		s.start();
		return s;
	}

	private void doSetup(HttpExchange ex) throws IOException {
		String account = splitQuery(ex.getRequestURI()).get("account");
		if (account == null || account.isBlank()) {
			send(ex, 400, gson.toJson(new ErrorResp("missing account")));
			return;
		}
		byte[] secret = totp.newSecret();
		byte[] png = totp.qrPng(account, secret);
		String dataUri = "data:image/png;base64," + Base64.getEncoder().encodeToString(png);

		SetupResp resp = new SetupResp(totp.issuer(), account, totp.encode(secret), totp.otpauthUri(account, secret),
				totp.qrChartUrl(account, secret), dataUri);
		send(ex, 200, gson.toJson(resp));
	}

	private void doQr(HttpExchange ex) throws IOException {
		Map<String, String> q = splitQuery(ex.getRequestURI());
		String account = q.get("account");
		String secret = q.get("secret");
		if (account == null || secret == null) {
			send(ex, 400, gson.toJson(new ErrorResp("account and secret are required")));
			return;
		}
		byte[] png = totp.qrPng(account, SecretCodec.decode(secret));
		ex.getResponseHeaders().add("Content-Type", "image/png");
		ex.sendResponseHeaders(200, png.length);
		try (OutputStream os = ex.getResponseBody()) {
			os.write(png);
		}
	}

	private void doVerify(HttpExchange ex) throws IOException {
		if (!"POST".equalsIgnoreCase(ex.getRequestMethod())) {
			send(ex, 405, gson.toJson(new ErrorResp("method not allowed")));
			return;
		}
		VerifyReq req = read(ex, VerifyReq.class);
		if (req == null || req.account() == null || req.secretBase32() == null) {
			send(ex, 400, gson.toJson(new ErrorResp("account and secretBase32 are required")));
			return;
		}
		VerifyResult r = totp.verify(req.secretBase32(), req.code());
		if (!r.isExact()) {
			String msg = r.matched() ? "clock drift of " + r.delta() + " steps" : "invalid code";
			log.info("Rejected code for {}: {}", req.account(), msg);
			send(ex, 401, gson.toJson(new VerifyResp(false, r.delta(), null, msg)));
			return;
		}
		String token = sessions.open(req.account());
		log.info("Session opened for {}", req.account());
		send(ex, 200, gson.toJson(new VerifyResp(true, 0, token, "ok")));
	}

	private void doLogin(HttpExchange ex) throws IOException {
		String redirect = splitQuery(ex.getRequestURI()).get("redirect");
		send(ex, 200, gson.toJson(new LoginHint("post a code to " + VERIFY, VERIFY, redirect)));
	}

	private void doPrivate(HttpExchange ex) throws IOException {
		String account = sessions.account(ex.getRequestHeaders().getFirst(RouteGuard.TOKEN_HEADER)).orElse(null);
		send(ex, 200, gson.toJson(new PrivateResp(account)));
	}

	private void doLogout(HttpExchange ex) throws IOException {
		if (!"POST".equalsIgnoreCase(ex.getRequestMethod())) {
			send(ex, 405, gson.toJson(new ErrorResp("method not allowed")));
			return;
		}
		teardown.destroy(ex, () -> log.debug("Session closed"));
		send(ex, 200, "{\"ok\":true}");
	}

	// util
	private static <T> T read(HttpExchange ex, Class<T> cls) throws IOException {
		try (Reader r = new InputStreamReader(ex.getRequestBody(), StandardCharsets.UTF_8)) {
			return gson.fromJson(r, cls);
		}
	}

	private static void send(HttpExchange ex, int code, String body) throws IOException {
		ex.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
		byte[] b = body.getBytes(StandardCharsets.UTF_8);
		ex.sendResponseHeaders(code, b.length);
		try (OutputStream os = ex.getResponseBody()) {
			os.write(b);
		}
	}

	private static HttpHandler j(ThrowingHandler h) {
		return ex -> {
			try {
				h.handle(ex);
			} catch (IllegalArgumentException | JsonParseException e) {
				send(ex, 400, gson.toJson(new ErrorResp(e.getMessage())));
			} catch (Exception e) {
				log.error("Handler failed for {}", ex.getRequestURI(), e);
				send(ex, 500, gson.toJson(new ErrorResp(e.getClass().getSimpleName() + ": " + e.getMessage())));
			}
		};
	}

	@FunctionalInterface private interface ThrowingHandler {
		void handle(HttpExchange ex) throws Exception;
	}

	private static Map<String, String> splitQuery(URI u) {
		Map<String, String> m = new HashMap<>();
		String q = u.getRawQuery();
		if (q == null)
			return m;
		for (String p : q.split("&")) {
			int i = p.indexOf('=');
			String k = URLDecoder.decode(i > 0 ? p.substring(0, i) : p, StandardCharsets.UTF_8);
			String v = i > 0 ? URLDecoder.decode(p.substring(i + 1), StandardCharsets.UTF_8) : "";
			m.put(k, v);
		}
		return m;
	}
}
