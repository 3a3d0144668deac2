package org.ledgerwire.network.message;

import com.google.common.collect.ImmutableList;
import org.ledgerwire.data.HashDigest;

import java.util.ArrayList;
import java.util.List;

public class GetBlocksMessage extends Message {

    private final List<HashDigest> blockHashes;

    public GetBlocksMessage(List<HashDigest> blockHashes) {
        this(null, blockHashes);
    }

    public GetBlocksMessage(byte[] identity, List<HashDigest> blockHashes) {
        super(identity, MessageType.GET_BLOCKS);

        this.blockHashes = ImmutableList.copyOf(blockHashes);
    }

    public List<HashDigest> getBlockHashes() {
        return this.blockHashes;
    }

    @Override
    protected void writeBody(FrameWriter body) {
        body.writeInt(this.blockHashes.size());

        for (HashDigest blockHash : this.blockHashes)
            body.writeFixed(blockHash);
    }

    public static Message fromFrames(byte[] identity, FrameReader body) throws MessageException {
        int count = body.readListCount(1);

        List<HashDigest> blockHashes = new ArrayList<>(count);
        for (int i = 0; i < count; ++i)
            blockHashes.add(body.readHashDigest());

        return new GetBlocksMessage(identity, blockHashes);
    }

}
