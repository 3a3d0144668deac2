package org.ledgerwire.data;

import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

/**
 * Immutable byte value with a protocol-wide fixed length, e.g. block hashes and account addresses.
 * <p>
 * Bytes are copied in and out so instances never share buffers with the frames they were read from.
 */
public abstract class FixedLengthBytes {

	private final byte[] bytes;

	protected FixedLengthBytes(byte[] bytes, int length) {
		if (bytes == null)
			throw new IllegalArgumentException(String.format("%s bytes missing", this.getClass().getSimpleName()));

		if (bytes.length != length)
			throw new IllegalArgumentException(String.format("%s must be %d bytes, not %d",
					this.getClass().getSimpleName(), length, bytes.length));

		this.bytes = bytes.clone();
	}

	public byte[] getBytes() {
		return this.bytes.clone();
	}

	public String toHex() {
		return Hex.toHexString(this.bytes);
	}

	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;

		if (other == null || other.getClass() != this.getClass())
			return false;

		return Arrays.equals(this.bytes, ((FixedLengthBytes) other).bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(this.bytes);
	}

	@Override
	public String toString() {
		return this.toHex();
	}

}
