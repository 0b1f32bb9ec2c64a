package org.lockit.common;


public final class ApiModels {
	// Requests
	public record VerifyReq(String account, String secretBase32, String code) {
	}

	// Responses
	public record SetupResp(String issuer, String account, String secretBase32, String otpauthUri,
							String qrChartUrl, String qrcodeDataUri) {
	}

	public record VerifyResp(boolean ok, int delta, String sessionToken, String message) {
	}

	public record LoginHint(String message, String verifyRoute, String redirect) {
	}

	public record PrivateResp(String account) {
	}

	public record ErrorResp(String error) {
	}
}
