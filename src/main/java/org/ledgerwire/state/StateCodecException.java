package org.ledgerwire.state;

@SuppressWarnings("serial")
public class StateCodecException extends Exception {

	public StateCodecException() {
	}

	public StateCodecException(String message) {
		super(message);
	}

	public StateCodecException(String message, Throwable cause) {
		super(message, cause);
	}

	public StateCodecException(Throwable cause) {
		super(cause);
	}

}
