package org.ledgerwire.data;

import org.bouncycastle.util.encoders.Hex;

/**
 * Account address: the last 20 bytes of the Keccak-256 digest of the account's uncompressed public key.
 */
public class Address extends FixedLengthBytes {

	public static final int LENGTH = 20;

	public Address(byte[] bytes) {
		super(bytes, LENGTH);
	}

	public static Address fromHex(String hex) {
		String digits = hex.startsWith("0x") ? hex.substring(2) : hex;
		return new Address(Hex.decode(digits));
	}

	@Override
	public String toString() {
		return "0x" + this.toHex();
	}

}
