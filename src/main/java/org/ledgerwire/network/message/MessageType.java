package org.ledgerwire.network.message;

import java.util.Arrays;
import java.util.Map;

import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toMap;

public enum MessageType {
	/** Liveness check. */
	PING(0x01, PingMessage::fromFrames),
	PONG(0x02, PongMessage::fromFrames),

	/** Changes to sender's peer set, for peer-list synchronisation. */
	PEER_SET_DELTA(0x03, PeerSetDeltaMessage::fromFrames),

	GET_BLOCK_HASHES(0x04, GetBlockHashesMessage::fromFrames),
	/** Block inventory. */
	BLOCK_HASHES(0x05, BlockHashesMessage::fromFrames),
	/** Transaction inventory. */
	TX_IDS(0x06, TxIdsMessage::fromFrames),

	GET_BLOCKS(0x07, GetBlocksMessage::fromFrames),
	GET_TXS(0x08, GetTxsMessage::fromFrames),
	BLOCKS(0x0a, BlocksMessage::fromFrames),
	TX(0x10, TxMessage::fromFrames),

	/** Request for calculated recent states. */
	GET_RECENT_STATES(0x0b, GetRecentStatesMessage::fromFrames),
	/** Reply to {@link #GET_RECENT_STATES}: state references and compressed block states. */
	RECENT_STATES(0x0c, RecentStatesMessage::fromFrames);

	public final byte value;

	private final MessageDecoder decoder;

	private static final Map<Byte, MessageType> map = Arrays.stream(MessageType.values())
			.collect(toMap(messageType -> messageType.value, identity()));

	MessageType(int value, MessageDecoder decoder) {
		this.value = (byte) value;
		this.decoder = decoder;
	}

	/** Returns type for given tag, or null if tag is unknown. */
	public static MessageType valueOf(byte value) {
		return map.get(value);
	}

	/**
	 * Attempt to read a message from body frames.
	 *
	 * @param identity routing identity, or null for reply-direction messages
	 * @param body body frames, header already verified and removed
	 * @return message
	 * @throws MessageException if body can't be decoded as this type
	 */
	public Message fromFrames(byte[] identity, FrameReader body) throws MessageException {
		return this.decoder.fromFrames(identity, body);
	}
}
