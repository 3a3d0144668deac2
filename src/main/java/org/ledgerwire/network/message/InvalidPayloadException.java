package org.ledgerwire.network.message;

/** Frames are well-formed but the payload they describe is inconsistent. */
@SuppressWarnings("serial")
public class InvalidPayloadException extends MessageException {

	public InvalidPayloadException(String message) {
		super(message);
	}

	public InvalidPayloadException(String message, Throwable cause) {
		super(message, cause);
	}

}
