package org.ledgerwire.data;

public class TxId extends FixedLengthBytes {

	public static final int LENGTH = 32;

	public TxId(byte[] bytes) {
		super(bytes, LENGTH);
	}

}
