package org.ledgerwire.network.message;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ledgerwire.account.PrivateKeyAccount;
import org.ledgerwire.crypto.Crypto;
import org.ledgerwire.settings.Settings;
import org.ledgerwire.state.StateCodec;
import org.ledgerwire.utils.Serialization;

import java.util.ArrayList;
import java.util.List;

/**
 * Frames, signs and verifies messages.
 * <p>
 * Wire layout:
 * <pre>
 * request direction: [identity, type (1 byte), public key, signature, body...]
 * reply direction:   [type (1 byte), public key, signature, body...]
 * </pre>
 * The signature covers the concatenated bytes of the body frames only, and is checked before any body frame
 * is decoded.
 * <p>
 * Instances hold no per-message state and may be shared between connection threads.
 */
public class MessageEnvelope {

	private static final Logger LOGGER = LogManager.getLogger(MessageEnvelope.class);

	/** type, public key, signature */
	public static final int REPLY_HEADER_COUNT = 3;
	/** identity, type, public key, signature */
	public static final int REQUEST_HEADER_COUNT = 4;

	private final StateCodec stateCodec;
	private final int maxFramesPerMessage;
	private final int maxFrameSize;
	private final int maxHashesPerMessage;

	/** Envelope using limits from {@link Settings}. */
	public MessageEnvelope(StateCodec stateCodec) {
		this(stateCodec, Settings.getInstance().getMaxFramesPerMessage(), Settings.getInstance().getMaxFrameSize(),
				Settings.getInstance().getMaxHashesPerMessage());
	}

	public MessageEnvelope(StateCodec stateCodec, int maxFramesPerMessage, int maxFrameSize, int maxHashesPerMessage) {
		this.stateCodec = stateCodec;
		this.maxFramesPerMessage = maxFramesPerMessage;
		this.maxFrameSize = maxFrameSize;
		this.maxHashesPerMessage = maxHashesPerMessage;
	}

	/**
	 * Returns complete frame sequence for <tt>message</tt>, signed by <tt>signer</tt>.
	 * <p>
	 * The identity frame is included only if the message carries an identity.
	 */
	public List<byte[]> toFrames(Message message, PrivateKeyAccount signer) throws MessageException {
		List<byte[]> body = message.toBodyFrames(this.stateCodec);
		byte[] signature = signer.sign(Serialization.concatenate(body));

		List<byte[]> frames = new ArrayList<>(body.size() + REQUEST_HEADER_COUNT);

		if (message.hasIdentity())
			frames.add(message.getIdentity());

		frames.add(new byte[] { message.getType().value });
		frames.add(signer.getPublicKey());
		frames.add(signature);
		frames.addAll(body);

		LOGGER.trace("Framed {} message: {} body frames", message.getType(), body.size());

		return frames;
	}

	/**
	 * Verifies and decodes a received frame sequence.
	 *
	 * @param rawFrames frames as received from the transport
	 * @param reply true if frames arrived on the reply direction, i.e. without an identity frame
	 * @return message, carrying <tt>rawFrames[0]</tt> as identity if not <tt>reply</tt>
	 * @throws EmptyMessageException if there are no frames
	 * @throws TruncatedPayloadException if the header, or a declared count, is incomplete
	 * @throws OversizedMessageException if configured limits are exceeded
	 * @throws InvalidSignatureException if the signature doesn't cover the body
	 * @throws MalformedFrameException if the type tag or a fixed-size body frame has the wrong length
	 * @throws UnknownMessageTypeException if the type tag is unknown
	 * @throws InvalidPayloadException if the body is inconsistent
	 */
	public Message parse(List<byte[]> rawFrames, boolean reply) throws MessageException {
		try {
			return this.parseFrames(rawFrames, reply);
		} catch (MessageException e) {
			LOGGER.debug("Rejected {} message: {}", reply ? "reply" : "request", e.getMessage());
			throw e;
		}
	}

	private Message parseFrames(List<byte[]> rawFrames, boolean reply) throws MessageException {
		if (rawFrames == null || rawFrames.isEmpty())
			throw new EmptyMessageException("Can't parse empty frame sequence");

		int headerCount = reply ? REPLY_HEADER_COUNT : REQUEST_HEADER_COUNT;
		if (rawFrames.size() < headerCount)
			throw new TruncatedPayloadException(String.format("Expected at least %d header frames, got %d",
					headerCount, rawFrames.size()));

		this.checkLimits(rawFrames);

		byte[] typeFrame = rawFrames.get(headerCount - 3);
		byte[] publicKey = rawFrames.get(headerCount - 2);
		byte[] signature = rawFrames.get(headerCount - 1);

		List<byte[]> body = new ArrayList<>(rawFrames.subList(headerCount, rawFrames.size()));

		if (!Crypto.verify(publicKey, signature, Serialization.concatenate(body)))
			throw new InvalidSignatureException("Message signature is invalid");

		Serialization.requireLength(typeFrame, 1, "Message type");

		MessageType messageType = MessageType.valueOf(typeFrame[0]);
		if (messageType == null)
			throw new UnknownMessageTypeException(String.format("Unknown message type 0x%02x", typeFrame[0]));

		byte[] identity = reply ? null : rawFrames.get(0);

		FrameReader bodyReader = new FrameReader(body, this.stateCodec, this.maxHashesPerMessage);
		Message message = messageType.fromFrames(identity, bodyReader);

		if (bodyReader.hasRemaining())
			LOGGER.debug("Ignoring {} trailing frames after {} message", bodyReader.remaining(), messageType);

		LOGGER.trace("Parsed {} message: {} body frames", messageType, body.size());

		return message;
	}

	private void checkLimits(List<byte[]> rawFrames) throws OversizedMessageException {
		if (rawFrames.size() > this.maxFramesPerMessage)
			throw new OversizedMessageException(String.format("Frame count %d exceeds maximum %d",
					rawFrames.size(), this.maxFramesPerMessage));

		for (byte[] frame : rawFrames)
			if (frame.length > this.maxFrameSize)
				throw new OversizedMessageException(String.format("Frame size %d exceeds maximum %d",
						frame.length, this.maxFrameSize));
	}

}
