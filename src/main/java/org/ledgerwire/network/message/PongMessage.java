package org.ledgerwire.network.message;

public class PongMessage extends Message {

	public PongMessage() {
		super(MessageType.PONG);
	}

	/** Pong addressed back to the sender of a ping received with <tt>identity</tt>. */
	public PongMessage(byte[] identity) {
		super(identity, MessageType.PONG);
	}

	@Override
	protected void writeBody(FrameWriter body) {
		// No body
	}

	public static Message fromFrames(byte[] identity, FrameReader body) {
		return new PongMessage(identity);
	}

}
