package org.ledgerwire.network.message;

import com.google.common.collect.ImmutableList;
import org.ledgerwire.data.Address;
import org.ledgerwire.data.TxId;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Transaction inventory: IDs of transactions the sender can supply.
 * <p>
 * Body: <tt>[sender address][count][tx id...]</tt>
 */
public class TxIdsMessage extends Message {

	private final Address sender;
	private final List<TxId> ids;

	public TxIdsMessage(Address sender, List<TxId> ids) {
		this(null, sender, ids);
	}

	public TxIdsMessage(byte[] identity, Address sender, List<TxId> ids) {
		super(identity, MessageType.TX_IDS);

		this.sender = Objects.requireNonNull(sender);
		this.ids = ImmutableList.copyOf(ids);
	}

	public Address getSender() {
		return this.sender;
	}

	public List<TxId> getIds() {
		return this.ids;
	}

	@Override
	protected void writeBody(FrameWriter body) {
		body.writeFixed(this.sender);
		body.writeInt(this.ids.size());

		for (TxId id : this.ids)
			body.writeFixed(id);
	}

	public static Message fromFrames(byte[] identity, FrameReader body) throws MessageException {
		Address sender = body.readAddress();
		int count = body.readListCount(1);

		List<TxId> ids = new ArrayList<>(count);
		for (int i = 0; i < count; ++i)
			ids.add(body.readTxId());

		return new TxIdsMessage(identity, sender, ids);
	}

}
