package org.ledgerwire.network.message;

/**
 * Root of all failures to build or parse a wire message.
 * <p>
 * Each failure is terminal for the message concerned only. It is up to the transport to decide whether
 * to drop, penalise or disconnect the peer that sent it.
 */
@SuppressWarnings("serial")
public class MessageException extends Exception {

	public MessageException() {
	}

	public MessageException(String message) {
		super(message);
	}

	public MessageException(String message, Throwable cause) {
		super(message, cause);
	}

	public MessageException(Throwable cause) {
		super(cause);
	}

}
