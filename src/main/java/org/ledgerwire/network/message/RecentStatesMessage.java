package org.ledgerwire.network.message;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ledgerwire.data.Address;
import org.ledgerwire.data.HashDigest;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reply to {@link GetRecentStatesMessage}: the state references and compressed block states a lagging node needs
 * to rebuild recent world state up to {@link #getBlockHash()}.
 * <p>
 * Body frames:
 * <pre>
 * [block hash]
 * [account count]                   -1 if missing, and nothing else follows
 *   per account:  [address] [k] [block hash 0] ... [block hash k-1]      oldest reference first
 * [block state count]
 *   per block:    [block hash] [p] [address 0] [state 0] ... [address p-1] [state p-1]
 * </pre>
 * Only some referenced blocks carry states. The receiver recovers the rest by replaying along the references.
 * Every block hash with states must be referenced by at least one account.
 */
public class RecentStatesMessage extends Message {

	private static final Logger LOGGER = LogManager.getLogger(RecentStatesMessage.class);

	/** Written in place of the account count when the sender has no states for the requested block. */
	public static final int MISSING = -1;

	private final HashDigest blockHash;
	private final boolean missing;
	private final ImmutableMap<HashDigest, ImmutableMap<Address, Object>> blockStates;
	private final ImmutableMap<Address, ImmutableList<HashDigest>> stateReferences;

	public RecentStatesMessage(HashDigest blockHash, Map<HashDigest, ? extends Map<Address, ?>> blockStates,
			Map<Address, ? extends List<HashDigest>> stateReferences) {
		this(null, blockHash, blockStates, stateReferences);
	}

	/**
	 * @param identity routing identity of the {@link GetRecentStatesMessage} being answered, or null
	 * @param blockHash block the states were calculated up to
	 * @param blockStates per-block account states, keyed by block hash
	 * @param stateReferences per-account block hashes where the account's state changed, oldest first
	 * @throws NullPointerException if either map is null, use {@link #missing(HashDigest)} instead; or if any
	 *             key, reference or state value is null
	 * @throws IllegalArgumentException if a block in <tt>blockStates</tt> isn't in any state reference
	 */
	public RecentStatesMessage(byte[] identity, HashDigest blockHash, Map<HashDigest, ? extends Map<Address, ?>> blockStates,
			Map<Address, ? extends List<HashDigest>> stateReferences) {
		super(identity, MessageType.RECENT_STATES);

		Objects.requireNonNull(blockStates, "blockStates");
		Objects.requireNonNull(stateReferences, "stateReferences");

		this.blockHash = Objects.requireNonNull(blockHash, "blockHash");
		this.missing = false;

		ImmutableMap.Builder<Address, ImmutableList<HashDigest>> referencesBuilder = ImmutableMap.builder();
		for (Map.Entry<Address, ? extends List<HashDigest>> entry : stateReferences.entrySet())
			referencesBuilder.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
		this.stateReferences = referencesBuilder.build();

		Set<HashDigest> referencedBlocks = referencedBlocks(this.stateReferences);

		ImmutableMap.Builder<HashDigest, ImmutableMap<Address, Object>> statesBuilder = ImmutableMap.builder();
		for (Map.Entry<HashDigest, ? extends Map<Address, ?>> entry : blockStates.entrySet()) {
			if (!referencedBlocks.contains(entry.getKey()))
				throw new IllegalArgumentException(String.format("Block %s has states but no account references it", entry.getKey()));

			statesBuilder.put(entry.getKey(), ImmutableMap.<Address, Object>copyOf(entry.getValue()));
		}
		this.blockStates = statesBuilder.build();
	}

	private RecentStatesMessage(byte[] identity, HashDigest blockHash) {
		super(identity, MessageType.RECENT_STATES);

		this.blockHash = Objects.requireNonNull(blockHash, "blockHash");
		this.missing = true;
		this.blockStates = ImmutableMap.of();
		this.stateReferences = ImmutableMap.of();
	}

	/** Reply for when no states are held for <tt>blockHash</tt>. */
	public static RecentStatesMessage missing(HashDigest blockHash) {
		return new RecentStatesMessage(null, blockHash);
	}

	public static RecentStatesMessage missing(byte[] identity, HashDigest blockHash) {
		return new RecentStatesMessage(identity, blockHash);
	}

	public HashDigest getBlockHash() {
		return this.blockHash;
	}

	/** Whether sender holds no states for the requested block. Distinct from holding states for zero accounts. */
	public boolean isMissing() {
		return this.missing;
	}

	/**
	 * Returns account states keyed by block hash, or an empty map if missing.
	 * <p>
	 * State values are held as given, or as returned by the {@link org.ledgerwire.state.StateCodec} for received
	 * messages. {@link org.ledgerwire.state.JsonStateCodec} returns immutable collections; values from other codecs
	 * are shared with the caller.
	 */
	public Map<HashDigest, ImmutableMap<Address, Object>> getBlockStates() {
		return this.blockStates;
	}

	/** Returns block hashes, oldest first, keyed by account, or an empty map if missing. */
	public Map<Address, ImmutableList<HashDigest>> getStateReferences() {
		return this.stateReferences;
	}

	/** Total number of state references over all accounts. */
	public int getStateReferenceCount() {
		int count = 0;
		for (List<HashDigest> references : this.stateReferences.values())
			count += references.size();

		return count;
	}

	@Override
	protected void writeBody(FrameWriter body) throws MessageException {
		body.writeFixed(this.blockHash);

		if (this.missing) {
			body.writeInt(MISSING);
			return;
		}

		body.writeInt(this.stateReferences.size());
		for (Map.Entry<Address, ImmutableList<HashDigest>> entry : this.stateReferences.entrySet()) {
			body.writeFixed(entry.getKey());
			body.writeInt(entry.getValue().size());

			for (HashDigest reference : entry.getValue())
				body.writeFixed(reference);
		}

		body.writeInt(this.blockStates.size());
		for (Map.Entry<HashDigest, ImmutableMap<Address, Object>> entry : this.blockStates.entrySet()) {
			body.writeFixed(entry.getKey());
			body.writeInt(entry.getValue().size());

			for (Map.Entry<Address, Object> state : entry.getValue().entrySet()) {
				body.writeFixed(state.getKey());
				body.writeState(state.getValue());
			}
		}

		LOGGER.trace("Encoded recent states for {}: {} accounts, {} block states", this.blockHash,
				this.stateReferences.size(), this.blockStates.size());
	}

	public static Message fromFrames(byte[] identity, FrameReader body) throws MessageException {
		HashDigest blockHash = body.readHashDigest();

		int accountCount = body.readInt();
		if (accountCount == MISSING)
			return new RecentStatesMessage(identity, blockHash);

		// Each account needs at least [address][k]
		body.requireRun(accountCount, 2);

		Map<Address, List<HashDigest>> stateReferences = new LinkedHashMap<>();
		for (int i = 0; i < accountCount; ++i) {
			Address address = body.readAddress();
			int referenceCount = body.readCount(1);

			ImmutableList.Builder<HashDigest> references = ImmutableList.builderWithExpectedSize(referenceCount);
			for (int j = 0; j < referenceCount; ++j)
				references.add(body.readHashDigest());

			if (stateReferences.put(address, references.build()) != null)
				throw new InvalidPayloadException(String.format("Duplicate state references for account %s", address));
		}

		Set<HashDigest> referencedBlocks = referencedBlocks(stateReferences);

		// Each block needs at least [block hash][p]
		int blockCount = body.readCount(2);

		Map<HashDigest, Map<Address, Object>> blockStates = new LinkedHashMap<>();
		for (int i = 0; i < blockCount; ++i) {
			HashDigest stateBlockHash = body.readHashDigest();
			if (!referencedBlocks.contains(stateBlockHash))
				throw new InvalidPayloadException(String.format("Block %s has states but no account references it", stateBlockHash));

			// Each state is [address][state]
			int stateCount = body.readCount(2);

			Map<Address, Object> states = new LinkedHashMap<>();
			for (int j = 0; j < stateCount; ++j) {
				Address address = body.readAddress();

				if (states.put(address, body.readState()) != null)
					throw new InvalidPayloadException(String.format("Duplicate state for account %s in block %s", address, stateBlockHash));
			}

			if (blockStates.put(stateBlockHash, states) != null)
				throw new InvalidPayloadException(String.format("Duplicate block states for block %s", stateBlockHash));
		}

		return new RecentStatesMessage(identity, blockHash, blockStates, stateReferences);
	}

	private static Set<HashDigest> referencedBlocks(Map<Address, ? extends List<HashDigest>> stateReferences) {
		Set<HashDigest> referencedBlocks = new HashSet<>();
		for (List<HashDigest> references : stateReferences.values())
			referencedBlocks.addAll(references);

		return referencedBlocks;
	}

}
