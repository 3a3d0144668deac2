package org.ledgerwire.network.message;

import org.ledgerwire.data.HashDigest;

import java.util.Objects;

/**
 * Asks a peer for the recent states it has calculated up to a given block.
 * Answered by {@link RecentStatesMessage}.
 */
public class GetRecentStatesMessage extends Message {

	private final HashDigest blockHash;

	public GetRecentStatesMessage(HashDigest blockHash) {
		this(null, blockHash);
	}

	public GetRecentStatesMessage(byte[] identity, HashDigest blockHash) {
		super(identity, MessageType.GET_RECENT_STATES);

		this.blockHash = Objects.requireNonNull(blockHash);
	}

	public HashDigest getBlockHash() {
		return this.blockHash;
	}

	@Override
	protected void writeBody(FrameWriter body) {
		body.writeFixed(this.blockHash);
	}

	public static Message fromFrames(byte[] identity, FrameReader body) throws MessageException {
		return new GetRecentStatesMessage(identity, body.readHashDigest());
	}

}
