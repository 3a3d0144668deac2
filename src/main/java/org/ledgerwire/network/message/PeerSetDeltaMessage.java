package org.ledgerwire.network.message;

/**
 * Changes to the sender's peer set.
 * <p>
 * The delta itself is serialized by the peer-discovery layer and carried here as a single opaque frame.
 */
public class PeerSetDeltaMessage extends Message {

	private final byte[] delta;

	public PeerSetDeltaMessage(byte[] delta) {
		this(null, delta);
	}

	public PeerSetDeltaMessage(byte[] identity, byte[] delta) {
		super(identity, MessageType.PEER_SET_DELTA);

		this.delta = delta.clone();
	}

	public byte[] getDelta() {
		return this.delta.clone();
	}

	@Override
	protected void writeBody(FrameWriter body) {
		body.writeFrame(this.delta);
	}

	public static Message fromFrames(byte[] identity, FrameReader body) throws MessageException {
		return new PeerSetDeltaMessage(identity, body.readFrame());
	}

}
