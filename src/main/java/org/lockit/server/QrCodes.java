package org.lockit.server;

import org.lockit.common.UriComponent;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Turns a provisioning URI into something scannable: a link to an external chart
 * service, or a PNG rendered locally.
 */
public final class QrCodes {
	public static final int DEFAULT_SIZE = 200;

	private QrCodes() {
	}

	public static String chartUrl(String chartApi, String otpauthUri) {
		return chartApi + UriComponent.encode(otpauthUri);
	}

	public static byte[] png(String otpauthUri, int size) {
		try {
			BitMatrix matrix = new QRCodeWriter().encode(otpauthUri, BarcodeFormat.QR_CODE, size, size);
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			MatrixToImageWriter.writeToStream(matrix, "PNG", out);
			return out.toByteArray();
		} catch (WriterException | IOException e) {
			throw new IllegalStateException("QR rendering failed", e);
		}
	}
}
