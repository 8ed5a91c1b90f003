package org.example.otp.engine;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.samstevens.totp.code.HashingAlgorithm;
import org.example.otp.common.InvalidSecretException;
import org.example.otp.common.MalformedConfigurationException;
import org.example.otp.common.UnsupportedTypeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ProvisioningUriParser")
class ProvisioningUriParserTest {

	private static final byte[] HELLO = {'H', 'e', 'l', 'l', 'o', '!', (byte) 0xDE, (byte) 0xAD, (byte) 0xBE, (byte) 0xEF};

	@Nested
	@DisplayName("Valid strings")
	class Valid {

		@Test
		@DisplayName("Should apply defaults for algorithm, digits and period")
		void shouldApplyDefaults() {
			TotpSpec spec = ProvisioningUriParser.parse("otpauth://totp/alice?secret=JBSWY3DPEHPK3PXP");

			assertArrayEquals(HELLO, spec.secret());
			assertEquals(HashingAlgorithm.SHA1, spec.algorithm());
			assertEquals(6, spec.digits());
			assertEquals(30, spec.period());
			assertEquals("alice", spec.label());
			assertNull(spec.issuer());
		}

		@Test
		@DisplayName("Should read every parameter")
		void shouldReadParameters() {
			TotpSpec spec = ProvisioningUriParser.parse(
					"otpauth://totp/ACME%20Co:alice%40example.com?secret=jbswy3dpehpk3pxp&algorithm=SHA256&digits=8&period=60&image=x");

			assertEquals(HashingAlgorithm.SHA256, spec.algorithm());
			assertEquals(8, spec.digits());
			assertEquals(60, spec.period());
			assertEquals("alice@example.com", spec.label());
			assertEquals("ACME Co", spec.issuer());
			assertArrayEquals(HELLO, spec.secret());
		}

		@Test
		@DisplayName("Should let the issuer parameter override the label prefix")
		void shouldPreferIssuerParameter() {
			TotpSpec spec = ProvisioningUriParser.parse("otpauth://totp/Old:bob?issuer=New&secret=JBSWY3DPEHPK3PXP");
			assertEquals("New", spec.issuer());
			assertEquals("bob", spec.label());
		}

		@Test
		@DisplayName("Should be case-insensitive on scheme, type and parameter names")
		void shouldIgnoreCase() {
			TotpSpec spec = ProvisioningUriParser.parse("OTPAUTH://TOTP/bob?SECRET=JBSWY3DPEHPK3PXP&Digits=7");
			assertEquals(7, spec.digits());
		}

		@ParameterizedTest
		@CsvSource({"SHA1,SHA1", "sha-1,SHA1", "SHA-256,SHA256", "sha512,SHA512"})
		@DisplayName("Should accept algorithm spellings")
		void shouldAcceptAlgorithmSpellings(String token, HashingAlgorithm expected) {
			TotpSpec spec = ProvisioningUriParser.parse("otpauth://totp/x?secret=JBSWY3DPEHPK3PXP&algorithm=" + token);
			assertEquals(expected, spec.algorithm());
		}

		@Test
		@DisplayName("Should be pure")
		void shouldBePure() {
			String uri = "otpauth://totp/ACME:alice?secret=JBSWY3DPEHPK3PXP&period=45";
			assertEquals(ProvisioningUriParser.parse(uri), ProvisioningUriParser.parse(uri));
		}
	}

	@Nested
	@DisplayName("Rejected strings")
	class Rejected {

		@Test
		@DisplayName("Should reject counter based OTP")
		void shouldRejectHotp() {
			var ex = assertThrows(UnsupportedTypeException.class,
					() -> ProvisioningUriParser.parse("otpauth://hotp/alice?secret=JBSWY3DPEHPK3PXP&counter=0"));
			assertEquals("hotp", ex.type());
			assertEquals("type", ex.field());
		}

		@Test
		@DisplayName("Should reject a secret outside the base32 alphabet")
		void shouldRejectBadSecret() {
			var ex = assertThrows(InvalidSecretException.class,
					() -> ProvisioningUriParser.parse("otpauth://totp/alice?secret=NOT-BASE32!!"));
			assertFalse(ex.getMessage().contains("NOT-BASE32"));
		}

		@ParameterizedTest
		@CsvSource(delimiter = '|', value = {
				"https://totp/alice?secret=JBSWY3DPEHPK3PXP|scheme",
				"otpauth:///alice?secret=JBSWY3DPEHPK3PXP|type",
				"otpauth://totp?secret=JBSWY3DPEHPK3PXP|label",
				"otpauth://totp/?secret=JBSWY3DPEHPK3PXP|label",
				"otpauth://totp/alice|secret",
				"otpauth://totp/alice?issuer=ACME|secret",
				"otpauth://totp/alice?secret=|secret",
				"otpauth://totp/alice?secret=JBSWY3DPEHPK3PXP&digits=six|digits",
				"otpauth://totp/alice?secret=JBSWY3DPEHPK3PXP&digits=0|digits",
				"otpauth://totp/alice?secret=JBSWY3DPEHPK3PXP&digits=11|digits",
				"otpauth://totp/alice?secret=JBSWY3DPEHPK3PXP&period=0|period",
				"otpauth://totp/alice?secret=JBSWY3DPEHPK3PXP&period=-30|period",
				"otpauth://totp/alice?secret=JBSWY3DPEHPK3PXP&algorithm=MD5|algorithm",
				"otpauth://totp/al%ZZice?secret=JBSWY3DPEHPK3PXP|label"
		})
		@DisplayName("Should name the offending field")
		void shouldNameOffendingField(String uri, String field) {
			var ex = assertThrows(MalformedConfigurationException.class, () -> ProvisioningUriParser.parse(uri));
			assertEquals(field, ex.field());
		}

		@Test
		@DisplayName("Should reject an empty string")
		void shouldRejectEmpty() {
			assertThrows(MalformedConfigurationException.class, () -> ProvisioningUriParser.parse("  "));
			assertThrows(MalformedConfigurationException.class, () -> ProvisioningUriParser.parse(null));
		}
	}
}
