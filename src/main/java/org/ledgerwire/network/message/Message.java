package org.ledgerwire.network.message;

import org.bouncycastle.util.encoders.Hex;
import org.ledgerwire.state.StateCodec;

import java.util.List;

/**
 * Network message serialization and deserialization.
 * <p>
 * Only the body of a message is produced by subclasses, via {@link #writeBody(FrameWriter)}. Header frames
 * (identity, type tag, public key, signature) are added and checked by {@link MessageEnvelope}.
 * <p>
 * Each subclass also provides a static <tt>fromFrames(byte[] identity, FrameReader body)</tt>, referenced from
 * its {@link MessageType} constant.
 * <p>
 * Messages are immutable. The routing identity is fixed when the message is built: received request-direction
 * messages carry the identity of the connection they arrived on, and replies are built with that identity so the
 * transport can route them back.
 */
public abstract class Message {

	private final MessageType type;
	private final byte[] identity;

	protected Message(MessageType type) {
		this(null, type);
	}

	protected Message(byte[] identity, MessageType type) {
		this.type = type;
		this.identity = identity != null ? identity.clone() : null;
	}

	public MessageType getType() {
		return this.type;
	}

	/** Returns routing identity, or null for reply-direction messages. */
	public byte[] getIdentity() {
		return this.identity != null ? this.identity.clone() : null;
	}

	public boolean hasIdentity() {
		return this.identity != null;
	}

	/** Returns this message's body frames, in wire order. */
	public List<byte[]> toBodyFrames(StateCodec stateCodec) throws MessageException {
		FrameWriter body = new FrameWriter(stateCodec);
		this.writeBody(body);
		return body.toFrames();
	}

	protected abstract void writeBody(FrameWriter body) throws MessageException;

	@Override
	public String toString() {
		if (this.identity == null)
			return this.type.name();

		return String.format("%s[%s]", this.type.name(), Hex.toHexString(this.identity));
	}

}
