package org.ledgerwire.account;

import org.ledgerwire.crypto.Crypto;
import org.ledgerwire.data.Address;

public class PublicKeyAccount {

	protected final byte[] publicKey;
	protected final Address address;

	/** <p>Constructor for wrapping a peer's public key</p>
	 *
	 * @param publicKey 33 byte compressed secp256k1 public key
	 * @throws IllegalArgumentException if <tt>publicKey</tt> isn't a point on the curve
	 */
	public PublicKeyAccount(byte[] publicKey) {
		if (publicKey == null || publicKey.length != Crypto.PUBLIC_KEY_LENGTH)
			throw new IllegalArgumentException("Public key must be " + Crypto.PUBLIC_KEY_LENGTH + " bytes");

		this.publicKey = publicKey.clone();
		this.address = new Address(Crypto.toAddress(this.publicKey));
	}

	public byte[] getPublicKey() {
		return this.publicKey.clone();
	}

	public Address getAddress() {
		return this.address;
	}

	public boolean verify(byte[] signature, byte[] message) {
		return Crypto.verify(this.publicKey, signature, message);
	}

	public static Address getAddress(byte[] publicKey) {
		return new Address(Crypto.toAddress(publicKey));
	}

	@Override
	public String toString() {
		return this.address.toString();
	}

}
