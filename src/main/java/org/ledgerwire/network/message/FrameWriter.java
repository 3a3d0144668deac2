package org.ledgerwire.network.message;

import org.ledgerwire.data.FixedLengthBytes;
import org.ledgerwire.state.StateCodec;
import org.ledgerwire.state.StateCodecException;
import org.ledgerwire.utils.Serialization;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates body frames for an outgoing message.
 */
public class FrameWriter {

	private final List<byte[]> frames = new ArrayList<>();
	private final StateCodec stateCodec;

	public FrameWriter(StateCodec stateCodec) {
		this.stateCodec = stateCodec;
	}

	public FrameWriter writeFrame(byte[] frame) {
		this.frames.add(frame.clone());
		return this;
	}

	public FrameWriter writeInt(int value) {
		this.frames.add(Serialization.serializeInt(value));
		return this;
	}

	/** Hashes, addresses and transaction IDs. */
	public FrameWriter writeFixed(FixedLengthBytes value) {
		this.frames.add(value.getBytes());
		return this;
	}

	public FrameWriter writeState(Object state) throws MessageException {
		try {
			this.frames.add(this.stateCodec.serialize(state));
		} catch (StateCodecException e) {
			throw new MessageException("Unable to serialize account state", e);
		}

		return this;
	}

	public int size() {
		return this.frames.size();
	}

	public List<byte[]> toFrames() {
		return Collections.unmodifiableList(new ArrayList<>(this.frames));
	}

}
