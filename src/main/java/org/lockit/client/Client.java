package org.lockit.client;

import com.google.gson.Gson;
import org.lockit.common.ApiModels.*;

import java.net.URLEncoder;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/**
 * Console client for the two-factor server.
 */
public final class Client {
	private static final Scanner in = new Scanner(System.in);
	private static final Gson gson = new Gson();

	public static void main(String[] args) throws Exception {
		String base = System.getProperty("server", "http://localhost:8080");
		Http http = new Http(base);
		System.out.println("Connected to: " + base);

		while (true) {
			System.out.println("\n[1] Setup 2FA [2] Verify code [3] Private page [4] Logout [0] Quit");
			System.out.print("> ");
			String op = in.nextLine().trim();
			try {
				switch (op) {
				case "1" -> setup(http);
				case "2" -> verify(http);
				case "3" -> open(http);
				case "4" -> logout(http);
				case "0" -> {
					return;
				}
				default -> System.out.println("Unknown option");
				}
			} catch (Exception e) {
				System.out.println("Error: " + e.getMessage());
			}
		}
	}

	private static void setup(Http http) throws Exception {
		System.out.print("Account (e-mail): ");
		String account = in.nextLine().trim();
		String resp = http.get("/2fa/setup?account=" + URLEncoder.encode(account, StandardCharsets.UTF_8));
		SetupResp r = gson.fromJson(resp, SetupResp.class);

		String dataUri = r.qrcodeDataUri();
		byte[] png = Base64.getDecoder().decode(dataUri.substring(dataUri.indexOf(',') + 1));
		Path out = Paths.get("qrcode-" + account.replaceAll("[^A-Za-z0-9._-]", "_") + ".png");
		Files.write(out, png);
		System.out.println("Scan the QR code with your authenticator app: " + out.toAbsolutePath());
		System.out.println("Or open: " + r.qrChartUrl());
		System.out.println("Keep this secret, it is needed to verify codes: " + r.secretBase32());
	}

	private static void verify(Http http) throws Exception {
		System.out.print("Account: ");
		String account = in.nextLine().trim();
		System.out.print("Secret (base32): ");
		String secret = in.nextLine().trim();
		System.out.print("Code: ");
		String code = in.nextLine().trim();

		HttpResponse<String> resp = http.exchange("POST", "/2fa/verify", gson.toJson(new VerifyReq(account, secret, code)));
		VerifyResp r = gson.fromJson(resp.body(), VerifyResp.class);
		if (r == null || !r.ok()) {
			System.out.println(r == null ? "HTTP " + resp.statusCode() : r.message());
			return;
		}
		http.setToken(r.sessionToken());
		System.out.println("Authenticated. Session=" + r.sessionToken());
	}

	private static void open(Http http) throws Exception {
		HttpResponse<String> resp = http.exchange("GET", "/private", null);
		if (resp.statusCode() == 200) {
			System.out.println("Private page for " + gson.fromJson(resp.body(), PrivateResp.class).account());
			return;
		}
		String location = resp.headers().firstValue("Location").orElse(null);
		System.out.println("Not logged in (HTTP " + resp.statusCode() + ")" + (location == null ? "" : ", go to " + location));
	}

	private static void logout(Http http) throws Exception {
		if (http.token() == null) {
			System.out.println("Not logged in");
			return;
		}
		http.post("/logout", "{}");
		http.setToken(null);
		System.out.println("Logged out");
	}
}
