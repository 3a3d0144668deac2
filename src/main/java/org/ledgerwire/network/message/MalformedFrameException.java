package org.ledgerwire.network.message;

/** A fixed-size frame (hash, address, integer, type tag) has the wrong length. */
@SuppressWarnings("serial")
public class MalformedFrameException extends MessageException {

	public MalformedFrameException(String message) {
		super(message);
	}

}
