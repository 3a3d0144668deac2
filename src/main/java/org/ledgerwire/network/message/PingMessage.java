package org.ledgerwire.network.message;

public class PingMessage extends Message {

	public PingMessage() {
		super(MessageType.PING);
	}

	public PingMessage(byte[] identity) {
		super(identity, MessageType.PING);
	}

	@Override
	protected void writeBody(FrameWriter body) {
		// No body
	}

	public static Message fromFrames(byte[] identity, FrameReader body) {
		return new PingMessage(identity);
	}

}
