package org.ledgerwire.network.message;

import com.google.common.collect.ImmutableList;
import org.ledgerwire.data.HashDigest;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks for hashes of blocks following the first block in <tt>locator</tt> that the peer knows, up to
 * <tt>stop</tt> if given.
 * <p>
 * Body: <tt>[count][locator hash...][stop hash?]</tt>. The stop frame is simply absent when there is no stop.
 */
public class GetBlockHashesMessage extends Message {

	private final List<HashDigest> locator;
	private final HashDigest stop;

	public GetBlockHashesMessage(List<HashDigest> locator, HashDigest stop) {
		this(null, locator, stop);
	}

	public GetBlockHashesMessage(byte[] identity, List<HashDigest> locator, HashDigest stop) {
		super(identity, MessageType.GET_BLOCK_HASHES);

		this.locator = ImmutableList.copyOf(locator);
		this.stop = stop;
	}

	public List<HashDigest> getLocator() {
		return this.locator;
	}

	/** Returns stop hash, or null to continue as far as the peer is willing. */
	public HashDigest getStop() {
		return this.stop;
	}

	@Override
	protected void writeBody(FrameWriter body) {
		body.writeInt(this.locator.size());

		for (HashDigest hash : this.locator)
			body.writeFixed(hash);

		if (this.stop != null)
			body.writeFixed(this.stop);
	}

	public static Message fromFrames(byte[] identity, FrameReader body) throws MessageException {
		int count = body.readListCount(1);

		List<HashDigest> locator = new ArrayList<>(count);
		for (int i = 0; i < count; ++i)
			locator.add(body.readHashDigest());

		HashDigest stop = body.hasRemaining() ? body.readHashDigest() : null;

		return new GetBlockHashesMessage(identity, locator, stop);
	}

}
