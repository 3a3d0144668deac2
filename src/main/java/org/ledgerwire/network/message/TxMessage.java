package org.ledgerwire.network.message;

/**
 * A single serialized transaction, e.g. in reply to {@link GetTxsMessage}.
 */
public class TxMessage extends Message {

	private final byte[] payload;

	public TxMessage(byte[] payload) {
		this(null, payload);
	}

	public TxMessage(byte[] identity, byte[] payload) {
		super(identity, MessageType.TX);

		this.payload = payload.clone();
	}

	public byte[] getPayload() {
		return this.payload.clone();
	}

	@Override
	protected void writeBody(FrameWriter body) {
		body.writeFrame(this.payload);
	}

	public static Message fromFrames(byte[] identity, FrameReader body) throws MessageException {
		return new TxMessage(identity, body.readFrame());
	}

}
