package org.ledgerwire.data;

/** SHA-256 digest, used as block hash. */
public class HashDigest extends FixedLengthBytes {

	public static final int LENGTH = 32;

	public HashDigest(byte[] bytes) {
		super(bytes, LENGTH);
	}

}
