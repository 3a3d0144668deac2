package org.ledgerwire.network.message;

/** Frame sequence had no frames at all. */
@SuppressWarnings("serial")
public class EmptyMessageException extends MessageException {

	public EmptyMessageException(String message) {
		super(message);
	}

}
