package org.lockit.server;

import org.lockit.common.OtpEngine;
import org.lockit.common.ProvisioningUri;
import org.lockit.common.SecretCodec;
import org.lockit.common.Secrets;
import org.lockit.common.VerificationWindow;
import org.lockit.common.VerifyResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * TOTP service: new secrets, provisioning URI and QR, code checks against the clock.
 */
public final class TwoFactorService {
	private static final Logger log = LoggerFactory.getLogger(TwoFactorService.class);

	private final String issuer;
	private final String qrChartApi;
	private final VerificationWindow window;
	private final OtpEngine engine;
	private final Clock clock;

	public TwoFactorService(LockitConfig config) {
		this(config, Clock.systemUTC());
	}

	public TwoFactorService(LockitConfig config, Clock clock) {
		this.issuer = config.issuer();
		this.qrChartApi = config.qrChartApi();
		this.window = config.window();
		this.engine = new OtpEngine(config.digits());
		this.clock = clock;
	}

	public String issuer() {
		return issuer;
	}

	public byte[] newSecret() {
		return Secrets.random();
	}

	public String encode(byte[] secret) {
		return SecretCodec.encode(secret);
	}

	public String otpauthUri(String account, byte[] secret) {
		return ProvisioningUri.build(secret, account, issuer);
	}

	public String qrChartUrl(String account, byte[] secret) {
		return QrCodes.chartUrl(qrChartApi, otpauthUri(account, secret));
	}

	public byte[] qrPng(String account, byte[] secret) {
		return QrCodes.png(otpauthUri(account, secret), QrCodes.DEFAULT_SIZE);
	}

	/**
	 * Window search at the current time. A match with a non-zero delta means the device
	 * clock drifted; use {@link #isValid} to reject those.
	 */
	public VerifyResult verify(String secretBase32, String code) {
		byte[] secret = SecretCodec.decode(secretBase32);
		VerifyResult r = engine.verify(code, secret, window, clock.instant());
		log.debug("totp check: matched={} delta={}", r.matched(), r.delta());
		return r;
	}

	public boolean isValid(String secretBase32, String code) {
		return verify(secretBase32, code).isExact();
	}
}
