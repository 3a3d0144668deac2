package org.ledgerwire.utils;

import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;
import org.ledgerwire.network.message.MalformedFrameException;

import java.util.List;

public class Serialization {

	/** Integer (count) frames are 4 bytes, big-endian. */
	public static final int INT_LENGTH = Ints.BYTES;

	private Serialization() {
	}

	/**
	 * Serialize int to a 4-byte, big-endian frame.
	 *
	 * @param value
	 * @return byte[]
	 */
	public static byte[] serializeInt(int value) {
		return Ints.toByteArray(value);
	}

	/**
	 * Deserialize int from 4-byte frame.
	 *
	 * @param frame
	 * @return int
	 * @throws MalformedFrameException if frame isn't exactly 4 bytes
	 */
	public static int deserializeInt(byte[] frame) throws MalformedFrameException {
		if (frame.length != INT_LENGTH)
			throw new MalformedFrameException(String.format("Integer frame must be %d bytes, not %d", INT_LENGTH, frame.length));

		return Ints.fromByteArray(frame);
	}

	/**
	 * Checks frame has expected fixed length.
	 *
	 * @param frame
	 * @param length expected length in bytes
	 * @param description e.g. "block hash", used in exception message
	 * @return the same frame
	 * @throws MalformedFrameException
	 */
	public static byte[] requireLength(byte[] frame, int length, String description) throws MalformedFrameException {
		if (frame.length != length)
			throw new MalformedFrameException(String.format("%s frame must be %d bytes, not %d", description, length, frame.length));

		return frame;
	}

	/**
	 * Returns concatenation of all frames, in order. This is what envelope signatures cover.
	 *
	 * @param frames
	 * @return byte[]
	 */
	public static byte[] concatenate(List<byte[]> frames) {
		return Bytes.concat(frames.toArray(new byte[0][]));
	}

}
