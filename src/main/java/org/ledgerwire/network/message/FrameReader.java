package org.ledgerwire.network.message;

import org.ledgerwire.data.Address;
import org.ledgerwire.data.HashDigest;
import org.ledgerwire.data.TxId;
import org.ledgerwire.state.StateCodec;
import org.ledgerwire.state.StateCodecException;
import org.ledgerwire.utils.Serialization;

import java.util.List;

/**
 * Positional, forward-only reader over the body frames of a received message.
 * <p>
 * Every read fails with {@link TruncatedPayloadException} rather than running past the last frame, and every
 * fixed-size read checks the frame length. Returned byte arrays are copies.
 */
public class FrameReader {

	private final List<byte[]> frames;
	private final StateCodec stateCodec;
	private final int maxListCount;
	private int position;

	/**
	 * @param frames body frames, header already removed
	 * @param stateCodec used to rebuild account-state values
	 * @param maxListCount upper bound for {@link #readListCount(int)}
	 */
	public FrameReader(List<byte[]> frames, StateCodec stateCodec, int maxListCount) {
		this.frames = frames;
		this.stateCodec = stateCodec;
		this.maxListCount = maxListCount;
		this.position = 0;
	}

	public int getPosition() {
		return this.position;
	}

	public int remaining() {
		return this.frames.size() - this.position;
	}

	public boolean hasRemaining() {
		return this.position < this.frames.size();
	}

	public byte[] readFrame() throws TruncatedPayloadException {
		if (!this.hasRemaining())
			throw new TruncatedPayloadException(String.format("Expected frame at position %d but only %d frames present",
					this.position, this.frames.size()));

		return this.frames.get(this.position++).clone();
	}

	public byte[] readFixed(int length, String description) throws TruncatedPayloadException, MalformedFrameException {
		return Serialization.requireLength(this.readFrame(), length, description);
	}

	public HashDigest readHashDigest() throws TruncatedPayloadException, MalformedFrameException {
		return new HashDigest(this.readFixed(HashDigest.LENGTH, "Block hash"));
	}

	public Address readAddress() throws TruncatedPayloadException, MalformedFrameException {
		return new Address(this.readFixed(Address.LENGTH, "Address"));
	}

	public TxId readTxId() throws TruncatedPayloadException, MalformedFrameException {
		return new TxId(this.readFixed(TxId.LENGTH, "Transaction ID"));
	}

	public int readInt() throws TruncatedPayloadException, MalformedFrameException {
		return Serialization.deserializeInt(this.readFrame());
	}

	/**
	 * Reads a count frame and checks enough frames remain for a run of that many items.
	 *
	 * @param minFramesPerItem the fewest frames one item can occupy
	 */
	public int readCount(int minFramesPerItem) throws MessageException {
		int count = this.readInt();
		this.requireRun(count, minFramesPerItem);
		return count;
	}

	/** As {@link #readCount(int)} but also bounded by the configured maximum list length. */
	public int readListCount(int minFramesPerItem) throws MessageException {
		int count = this.readInt();

		if (count > this.maxListCount)
			throw new OversizedMessageException(String.format("Declared count %d exceeds maximum %d", count, this.maxListCount));

		this.requireRun(count, minFramesPerItem);
		return count;
	}

	/**
	 * Checks that <tt>count</tt> items of at least <tt>minFramesPerItem</tt> frames each can still be read.
	 */
	public void requireRun(int count, int minFramesPerItem) throws InvalidPayloadException, TruncatedPayloadException {
		if (count < 0)
			throw new InvalidPayloadException(String.format("Negative count %d at position %d", count, this.position - 1));

		long framesNeeded = (long) count * minFramesPerItem;
		if (framesNeeded > this.remaining())
			throw new TruncatedPayloadException(String.format("Count %d needs at least %d frames but only %d remain",
					count, framesNeeded, this.remaining()));
	}

	public Object readState() throws TruncatedPayloadException, InvalidPayloadException {
		byte[] blob = this.readFrame();

		Object state;
		try {
			state = this.stateCodec.deserialize(blob);
		} catch (StateCodecException e) {
			throw new InvalidPayloadException(String.format("Undecodable state at position %d", this.position - 1), e);
		}

		if (state == null)
			throw new InvalidPayloadException(String.format("Null state at position %d", this.position - 1));

		return state;
	}

}
