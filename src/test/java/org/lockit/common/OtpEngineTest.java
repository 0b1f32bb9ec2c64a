package org.lockit.common;

import dev.samstevens.totp.code.DefaultCodeGenerator;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class OtpEngineTest {

	private static final byte[] SECRET = "12345678901234567890".getBytes(StandardCharsets.US_ASCII);
	private static final long NOW = 1_700_000_000L; // counter 56666666, step ends at NOW + 10

	private final OtpEngine engine = new OtpEngine();

	@Test
	public void testRfc4226Vectors() {
		String[] expected = { "755224", "287082", "359152", "969429", "338314", "254676", "287922", "162583",
				"399871", "520489" };
		for (int c = 0; c < expected.length; c++)
			assertEquals(expected[c], engine.generate(SECRET, c), "counter " + c);
	}

	@Test
	public void testRfc6238Vector() {
		long counter = OtpEngine.counterAt(59, 30);
		assertEquals(1, counter);
		assertEquals("94287082", engine.generate(SECRET, counter, 8));
		assertEquals("287082", engine.generate(SECRET, counter, 6));
		assertEquals("07081804", engine.generate(SECRET, OtpEngine.counterAt(1111111109L, 30), 8));
	}

	@Test
	public void testGenerateAtUsesTimeStep() {
		assertEquals("921300", engine.generateAt(SECRET, NOW, VerificationWindow.DEFAULT));
		assertEquals("94287082", new OtpEngine(8).generateAt(SECRET, 59, VerificationWindow.DEFAULT));
	}

	@Test
	public void testDeterministic() {
		assertEquals(engine.generate(SECRET, 123456789L), engine.generate(SECRET, 123456789L));
	}

	@Test
	public void testAgreesWithReferenceGenerator() throws Exception {
		DefaultCodeGenerator reference = new DefaultCodeGenerator();
		String base32 = SecretCodec.encode(SECRET);
		for (long c = 56666660L; c < 56666680L; c++)
			assertEquals(reference.generate(base32, c), engine.generate(SECRET, c), "counter " + c);
	}

	@Test
	public void testVerifyCurrentCode() {
		VerifyResult r = engine.verify("921300", SECRET, VerificationWindow.DEFAULT, NOW);
		assertTrue(r.matched());
		assertEquals(0, r.delta());
		assertTrue(r.isExact());
	}

	@Test
	public void testVerifyAcceptsDriftInsideWindow() {
		long current = OtpEngine.counterAt(NOW, 30);
		VerificationWindow window = new VerificationWindow(3, 30);
		for (int k = -3; k <= 3; k++) {
			VerifyResult r = engine.verify(engine.generate(SECRET, current + k), SECRET, window, NOW);
			assertTrue(r.matched(), "delta " + k);
			assertEquals(k, r.delta());
			assertEquals(k == 0, r.isExact());
		}
	}

	@Test
	public void testVerifyRejectsDriftOutsideWindow() {
		long current = OtpEngine.counterAt(NOW, 30);
		VerificationWindow window = new VerificationWindow(3, 30);
		assertEquals(VerifyResult.NO_MATCH, engine.verify(engine.generate(SECRET, current + 4), SECRET, window, NOW));
		assertEquals(VerifyResult.NO_MATCH, engine.verify(engine.generate(SECRET, current - 4), SECRET, window, NOW));
	}

	@Test
	public void testZeroWindowIsStrict() {
		long current = OtpEngine.counterAt(NOW, 30);
		VerificationWindow strict = new VerificationWindow(0, 30);
		assertTrue(engine.verify(engine.generate(SECRET, current), SECRET, strict, NOW).isExact());
		assertFalse(engine.verify(engine.generate(SECRET, current - 1), SECRET, strict, NOW).matched());
	}

	@Test
	public void testDefaultWindowReachesSixSteps() {
		long current = OtpEngine.counterAt(NOW, 30);
		assertEquals(-6, engine.verify("682841", SECRET, NOW).delta());
		assertEquals(6, engine.verify(engine.generate(SECRET, current + 6), SECRET, NOW).delta());
		assertFalse(engine.verify("055496", SECRET, NOW).matched()); // seven steps back
	}

	@Test
	public void testWrongCodeDoesNotMatch() {
		assertEquals(VerifyResult.NO_MATCH, engine.verify("000000", SECRET, VerificationWindow.DEFAULT, NOW));
	}

	@Test
	public void testMalformedCodesNeverThrow() {
		for (String code : new String[] { null, "", "92130", "9213000", "92130a", " 921300", "９２１３００" })
			assertFalse(engine.verify(code, SECRET, VerificationWindow.DEFAULT, NOW).matched(), String.valueOf(code));
	}

	@Test
	public void testInstantOverload() {
		VerifyResult r = engine.verify("921300", SECRET, VerificationWindow.DEFAULT, Instant.ofEpochSecond(NOW + 9));
		assertTrue(r.isExact());
	}

	@Test
	public void testWindowNearEpochSkipsNegativeCounters() {
		VerifyResult r = engine.verify("755224", SECRET, VerificationWindow.DEFAULT, 10);
		assertTrue(r.isExact());
		assertEquals(1, engine.verify("287082", SECRET, VerificationWindow.DEFAULT, 10).delta());
	}

	@Test
	public void testWindowAtEndOfCounterRange() {
		VerificationWindow window = new VerificationWindow(2, 1);
		assertEquals(-1, engine.verify(engine.generate(SECRET, Long.MAX_VALUE - 1), SECRET, window, Long.MAX_VALUE).delta());
		assertTrue(engine.verify(engine.generate(SECRET, Long.MAX_VALUE), SECRET, window, Long.MAX_VALUE).isExact());
		assertFalse(engine.verify(engine.generate(SECRET, 0), SECRET, window, Long.MAX_VALUE).matched());
	}

	@Test
	public void testEmptySecretFailsFast() {
		assertThrows(InvalidSecretException.class, () -> engine.generate(new byte[0], 1));
		assertThrows(InvalidSecretException.class, () -> engine.generate(null, 1));
		assertThrows(InvalidSecretException.class, () -> engine.verify("123456", new byte[0], NOW));
	}

	@Test
	public void testDigitsOutOfRange() {
		assertThrows(IllegalArgumentException.class, () -> new OtpEngine(0));
		assertThrows(IllegalArgumentException.class, () -> new OtpEngine(10));
		assertThrows(IllegalArgumentException.class, () -> engine.generate(SECRET, 1, 11));
	}

	@Test
	public void testWindowValidation() {
		assertThrows(IllegalArgumentException.class, () -> new VerificationWindow(-1, 30));
		assertThrows(IllegalArgumentException.class, () -> new VerificationWindow(1, 0));
		assertThrows(IllegalArgumentException.class, () -> new VerificationWindow(Integer.MAX_VALUE, 30));
		assertEquals(VerificationWindow.MAX_WINDOW_SIZE, new VerificationWindow(VerificationWindow.MAX_WINDOW_SIZE, 30).windowSize());
		assertEquals(new VerificationWindow(6, 30), VerificationWindow.DEFAULT);
	}
}
