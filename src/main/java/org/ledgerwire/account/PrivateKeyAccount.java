package org.ledgerwire.account;

import org.bouncycastle.util.BigIntegers;
import org.ledgerwire.crypto.Crypto;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Account holding a secp256k1 private key, used to sign outgoing messages.
 */
public class PrivateKeyAccount extends PublicKeyAccount {

	private static final SecureRandom RANDOM = new SecureRandom();

	private final byte[] privateKey;

	/**
	 * Create PrivateKeyAccount using 32 byte private key.
	 *
	 * @param privateKey 32 byte big-endian scalar
	 */
	public PrivateKeyAccount(byte[] privateKey) {
		super(Crypto.toPublicKey(privateKey));

		this.privateKey = privateKey.clone();
	}

	public static PrivateKeyAccount generate() {
		BigInteger order = Crypto.CURVE_ORDER;
		BigInteger d;
		do {
			d = BigIntegers.createRandomBigInteger(order.bitLength(), RANDOM);
		} while (d.signum() == 0 || d.compareTo(order) >= 0);

		return new PrivateKeyAccount(BigIntegers.asUnsignedByteArray(Crypto.PRIVATE_KEY_LENGTH, d));
	}

	public byte[] getPrivateKey() {
		return this.privateKey.clone();
	}

	public byte[] sign(byte[] message) {
		return Crypto.sign(this.privateKey, message);
	}

}
