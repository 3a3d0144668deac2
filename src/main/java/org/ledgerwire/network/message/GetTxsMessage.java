package org.ledgerwire.network.message;

import com.google.common.collect.ImmutableList;
import org.ledgerwire.data.TxId;

import java.util.ArrayList;
import java.util.List;

public class GetTxsMessage extends Message {

    private final List<TxId> txIds;

    public GetTxsMessage(List<TxId> txIds) {
        this(null, txIds);
    }

    public GetTxsMessage(byte[] identity, List<TxId> txIds) {
        super(identity, MessageType.GET_TXS);

        this.txIds = ImmutableList.copyOf(txIds);
    }

    public List<TxId> getTxIds() {
        return this.txIds;
    }

    @Override
    protected void writeBody(FrameWriter body) {
        body.writeInt(this.txIds.size());

        for (TxId txId : this.txIds)
            body.writeFixed(txId);
    }

    public static Message fromFrames(byte[] identity, FrameReader body) throws MessageException {
        int count = body.readListCount(1);

        List<TxId> txIds = new ArrayList<>(count);
        for (int i = 0; i < count; ++i)
            txIds.add(body.readTxId());

        return new GetTxsMessage(identity, txIds);
    }

}
