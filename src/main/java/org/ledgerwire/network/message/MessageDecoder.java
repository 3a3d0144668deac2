package org.ledgerwire.network.message;

/**
 * Rebuilds one message variant from its body frames.
 */
@FunctionalInterface
public interface MessageDecoder {

	/**
	 * @param identity routing identity, or null for reply-direction messages
	 * @param body reader positioned at the first body frame
	 */
	Message fromFrames(byte[] identity, FrameReader body) throws MessageException;

}
