package org.ledgerwire.network.message;

/** Type tag isn't one of {@link MessageType}. */
@SuppressWarnings("serial")
public class UnknownMessageTypeException extends MessageException {

	public UnknownMessageTypeException(String message) {
		super(message);
	}

}
