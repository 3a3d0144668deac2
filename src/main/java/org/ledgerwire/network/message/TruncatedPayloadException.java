package org.ledgerwire.network.message;

/** Declared counts, or the envelope header, need more frames than were received. */
@SuppressWarnings("serial")
public class TruncatedPayloadException extends MessageException {

	public TruncatedPayloadException(String message) {
		super(message);
	}

}
