package org.lockit.common;

import org.apache.commons.codec.EncoderException;
import org.apache.commons.codec.net.PercentCodec;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Percent-encoding of a single URI component, with the same result as JavaScript's
 * {@code encodeURIComponent}: only {@code A-Z a-z 0-9 - _ . ! ~ * ' ( )} pass through.
 */
public final class UriComponent {
	private static final String UNRESERVED = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_.!~*'()";
	private static final PercentCodec CODEC = new PercentCodec(reservedAscii(), false);

	private UriComponent() {
	}

	public static String encode(String value) {
		if (value == null)
			throw new IllegalArgumentException("value is null");
		try {
			return new String(CODEC.encode(value.getBytes(StandardCharsets.UTF_8)), StandardCharsets.US_ASCII);
		} catch (EncoderException e) {
			throw new IllegalStateException("percent encoding failed", e);
		}
	}

	private static byte[] reservedAscii() {
		byte[] out = new byte[128];
		int n = 0;
		for (int c = 0; c < 128; c++) {
			if (UNRESERVED.indexOf(c) < 0)
				out[n++] = (byte) c;
		}
		return Arrays.copyOf(out, n);
	}
}
