package org.ledgerwire.network.message;

/** Signature frame doesn't verify against the public-key frame and the body frames. */
@SuppressWarnings("serial")
public class InvalidSignatureException extends MessageException {

	public InvalidSignatureException(String message) {
		super(message);
	}

}
