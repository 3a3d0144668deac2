package org.ledgerwire.crypto;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.KeccakDigest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.crypto.signers.StandardDSAEncoding;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;

/**
 * secp256k1 ECDSA signing and verification, plus the digests used to derive block hashes and addresses.
 * <p>
 * Signatures are DER-encoded, computed over the SHA-256 digest of the message, with deterministic nonces (RFC 6979)
 * and normalised to low-S form. Verification only accepts canonical DER with low S.
 */
public abstract class Crypto {

	private static final Logger LOGGER = LogManager.getLogger(Crypto.class);

	public static final int PRIVATE_KEY_LENGTH = 32;
	/** Compressed SEC1 point. */
	public static final int PUBLIC_KEY_LENGTH = 33;
	public static final int ADDRESS_LENGTH = 20;

	private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
	static final ECDomainParameters CURVE = new ECDomainParameters(CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(),
			CURVE_PARAMS.getN(), CURVE_PARAMS.getH());
	public static final BigInteger CURVE_ORDER = CURVE_PARAMS.getN();
	private static final BigInteger HALF_CURVE_ORDER = CURVE_ORDER.shiftRight(1);

	public static byte[] digest(byte[] input) {
		SHA256Digest sha256 = new SHA256Digest();
		sha256.update(input, 0, input.length);

		byte[] output = new byte[sha256.getDigestSize()];
		sha256.doFinal(output, 0);
		return output;
	}

	public static byte[] keccak256(byte[] input) {
		KeccakDigest keccak = new KeccakDigest(256);
		keccak.update(input, 0, input.length);

		byte[] output = new byte[keccak.getDigestSize()];
		keccak.doFinal(output, 0);
		return output;
	}

	/** Returns compressed public key for passed private key. */
	public static byte[] toPublicKey(byte[] privateKey) {
		BigInteger d = toScalar(privateKey);
		ECPoint point = new FixedPointCombMultiplier().multiply(CURVE.getG(), d);
		return point.getEncoded(true);
	}

	/** Returns account address for passed public key, in either compressed or uncompressed form. */
	public static byte[] toAddress(byte[] publicKey) {
		ECPoint point = CURVE.getCurve().decodePoint(publicKey);
		byte[] uncompressed = point.getEncoded(false);

		// Skip 0x04 prefix
		byte[] hash = keccak256(Arrays.copyOfRange(uncompressed, 1, uncompressed.length));
		return Arrays.copyOfRange(hash, hash.length - ADDRESS_LENGTH, hash.length);
	}

	public static byte[] sign(byte[] privateKey, byte[] message) {
		ECDSASigner signer = new ECDSASigner(new HMacDSAKCalculator(new SHA256Digest()));
		signer.init(true, new ECPrivateKeyParameters(toScalar(privateKey), CURVE));

		BigInteger[] rs = signer.generateSignature(digest(message));
		BigInteger s = rs[1];
		if (s.compareTo(HALF_CURVE_ORDER) > 0)
			s = CURVE.getN().subtract(s);

		try {
			return StandardDSAEncoding.INSTANCE.encode(CURVE.getN(), rs[0], s);
		} catch (IOException e) {
			throw new AssertionError("DER encoding of a valid signature shouldn't fail", e);
		}
	}

	/**
	 * Returns whether <tt>signature</tt> was produced over <tt>message</tt> by the owner of <tt>publicKey</tt>.
	 * <p>
	 * Malformed public keys or signatures are reported as <tt>false</tt>.
	 */
	public static boolean verify(byte[] publicKey, byte[] signature, byte[] message) {
		if (publicKey == null || signature == null || message == null)
			return false;

		try {
			ECPoint point = CURVE.getCurve().decodePoint(publicKey);
			ECPublicKeyParameters publicKeyParams = new ECPublicKeyParameters(point, CURVE);

			// Rejects non-canonical DER
			BigInteger[] rs = StandardDSAEncoding.INSTANCE.decode(CURVE.getN(), signature);
			if (rs[1].compareTo(HALF_CURVE_ORDER) > 0)
				return false;

			ECDSASigner verifier = new ECDSASigner();
			verifier.init(false, publicKeyParams);
			return verifier.verifySignature(digest(message), rs[0], rs[1]);
		} catch (IOException | RuntimeException e) {
			LOGGER.trace("Unable to verify signature: {}", e.getMessage());
			return false;
		}
	}

	private static BigInteger toScalar(byte[] privateKey) {
		if (privateKey == null || privateKey.length != PRIVATE_KEY_LENGTH)
			throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_LENGTH + " bytes");

		BigInteger d = new BigInteger(1, privateKey);
		if (d.signum() == 0 || d.compareTo(CURVE.getN()) >= 0)
			throw new IllegalArgumentException("Private key out of range");

		return d;
	}

}
