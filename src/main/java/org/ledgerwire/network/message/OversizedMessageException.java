package org.ledgerwire.network.message;

/** Frame sequence exceeds configured frame-count or frame-size limits. */
@SuppressWarnings("serial")
public class OversizedMessageException extends MessageException {

	public OversizedMessageException(String message) {
		super(message);
	}

}
