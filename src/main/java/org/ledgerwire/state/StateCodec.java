package org.ledgerwire.state;

/**
 * Converts account-state values to and from the opaque blobs carried in state frames.
 * <p>
 * Implementations must be safe to share between threads.
 */
public interface StateCodec {

	byte[] serialize(Object state) throws StateCodecException;

	/**
	 * Rebuilds a state value from a blob received from a remote peer.
	 *
	 * @throws StateCodecException if <tt>blob</tt> is not a valid encoding
	 */
	Object deserialize(byte[] blob) throws StateCodecException;

}
