package org.ledgerwire.network.message;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Serialized blocks, one frame per block, in reply to {@link GetBlocksMessage}.
 * <p>
 * Block serialization belongs to the chain layer; here blocks are opaque.
 */
public class BlocksMessage extends Message {

    private static final Logger LOGGER = LogManager.getLogger(BlocksMessage.class);

    private final List<byte[]> blocks;

    public BlocksMessage(List<byte[]> blocks) {
        this(null, blocks);
    }

    public BlocksMessage(byte[] identity, List<byte[]> blocks) {
        super(identity, MessageType.BLOCKS);

        List<byte[]> copies = new ArrayList<>(blocks.size());
        for (byte[] block : blocks)
            copies.add(block.clone());

        this.blocks = Collections.unmodifiableList(copies);
    }

    /** Returns serialized blocks. Callers must not modify the arrays. */
    public List<byte[]> getBlocks() {
        return this.blocks;
    }

    @Override
    protected void writeBody(FrameWriter body) {
        body.writeInt(this.blocks.size());

        int totalLength = 0;
        for (byte[] block : this.blocks) {
            body.writeFrame(block);
            totalLength += block.length;
        }

        LOGGER.trace(String.format("Total length of %d blocks is %d bytes", this.blocks.size(), totalLength));
    }

    public static Message fromFrames(byte[] identity, FrameReader body) throws MessageException {
        int count = body.readListCount(1);

        List<byte[]> blocks = new ArrayList<>(count);
        for (int i = 0; i < count; ++i)
            blocks.add(body.readFrame());

        return new BlocksMessage(identity, blocks);
    }

}
