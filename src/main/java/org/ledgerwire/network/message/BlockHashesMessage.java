package org.ledgerwire.network.message;

import com.google.common.collect.ImmutableList;
import org.ledgerwire.data.Address;
import org.ledgerwire.data.HashDigest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Block inventory: hashes of blocks the sender can supply.
 * <p>
 * Body: <tt>[sender address][count][hash...]</tt>
 */
public class BlockHashesMessage extends Message {

	private final Address sender;
	private final List<HashDigest> hashes;

	public BlockHashesMessage(Address sender, List<HashDigest> hashes) {
		this(null, sender, hashes);
	}

	public BlockHashesMessage(byte[] identity, Address sender, List<HashDigest> hashes) {
		super(identity, MessageType.BLOCK_HASHES);

		this.sender = Objects.requireNonNull(sender);
		this.hashes = ImmutableList.copyOf(hashes);
	}

	public Address getSender() {
		return this.sender;
	}

	public List<HashDigest> getHashes() {
		return this.hashes;
	}

	@Override
	protected void writeBody(FrameWriter body) {
		body.writeFixed(this.sender);
		body.writeInt(this.hashes.size());

		for (HashDigest hash : this.hashes)
			body.writeFixed(hash);
	}

	public static Message fromFrames(byte[] identity, FrameReader body) throws MessageException {
		Address sender = body.readAddress();
		int count = body.readListCount(1);

		List<HashDigest> hashes = new ArrayList<>(count);
		for (int i = 0; i < count; ++i)
			hashes.add(body.readHashDigest());

		return new BlockHashesMessage(identity, sender, hashes);
	}

}
