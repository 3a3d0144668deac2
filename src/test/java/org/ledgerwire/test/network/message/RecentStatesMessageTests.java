package org.ledgerwire.test.network.message;

import com.google.common.primitives.Ints;
import org.junit.Before;
import org.junit.Test;
import org.ledgerwire.account.PrivateKeyAccount;
import org.ledgerwire.data.Address;
import org.ledgerwire.data.HashDigest;
import org.ledgerwire.network.message.FrameReader;
import org.ledgerwire.network.message.InvalidPayloadException;
import org.ledgerwire.network.message.MalformedFrameException;
import org.ledgerwire.network.message.Message;
import org.ledgerwire.network.message.MessageEnvelope;
import org.ledgerwire.network.message.MessageException;
import org.ledgerwire.network.message.MessageType;
import org.ledgerwire.network.message.RecentStatesMessage;
import org.ledgerwire.network.message.TruncatedPayloadException;
import org.ledgerwire.state.JsonStateCodec;
import org.ledgerwire.state.StateCodec;
import org.ledgerwire.test.utils.TestUtils;
import org.ledgerwire.utils.Serialization;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.Assert.*;

public class RecentStatesMessageTests {

	private static final int ACCOUNT_COUNT = 5;
	private static final int MAX_HASHES = 500;

	private StateCodec stateCodec;
	private MessageEnvelope envelope;
	private PrivateKeyAccount signer;

	// Populated by buildScenario()
	private List<Address> accounts;
	private Map<HashDigest, Map<Address, Object>> compressedBlockStates;
	private Map<Address, List<HashDigest>> stateReferences;
	private HashDigest blockHash;

	@Before
	public void beforeTest() {
		this.stateCodec = new JsonStateCodec();
		this.envelope = new MessageEnvelope(this.stateCodec, 1024, 1024 * 1024, MAX_HASHES);
		this.signer = PrivateKeyAccount.generate();

		this.buildScenario();
	}

	/**
	 * Each account's state changes in two blocks. Every second block, in creation order, keeps its states.
	 */
	private void buildScenario() {
		this.accounts = new ArrayList<>();
		List<HashDigest> blockHashes = new ArrayList<>();
		List<Map<Address, Object>> blockStates = new ArrayList<>();

		for (int i = 0; i < ACCOUNT_COUNT; ++i) {
			Address address = TestUtils.randomAddress();
			this.accounts.add(address);

			HashDigest blockHash1 = TestUtils.randomHashDigest();
			HashDigest blockHash2 = TestUtils.randomHashDigest();

			blockHashes.add(blockHash1);
			blockStates.add(Collections.singletonMap(address, String.format("A:%s:%s", blockHash1, address)));
			blockHashes.add(blockHash2);
			blockStates.add(Collections.singletonMap(address, String.format("B:%s:%s", blockHash2, address)));
		}

		this.compressedBlockStates = new LinkedHashMap<>();
		for (int i = 1; i < blockHashes.size(); i += 2)
			this.compressedBlockStates.put(blockHashes.get(i), blockStates.get(i));

		this.stateReferences = new LinkedHashMap<>();
		for (Address address : this.accounts) {
			List<HashDigest> references = new ArrayList<>();
			for (int i = 0; i < blockHashes.size(); ++i)
				if (blockStates.get(i).containsKey(address))
					references.add(blockHashes.get(i));

			this.stateReferences.put(address, references);
		}

		this.blockHash = blockHashes.get(blockHashes.size() - 1);
	}

	private RecentStatesMessage decode(List<byte[]> bodyFrames) throws MessageException {
		return (RecentStatesMessage) RecentStatesMessage.fromFrames(null, new FrameReader(bodyFrames, this.stateCodec, MAX_HASHES));
	}

	@Test
	public void testConstructorRejectsNulls() {
		Map<HashDigest, Map<Address, Object>> emptyBlockStates = Collections.emptyMap();
		Map<Address, List<HashDigest>> emptyStateReferences = Collections.emptyMap();

		assertThrows(NullPointerException.class, () -> new RecentStatesMessage(this.blockHash, null, emptyStateReferences));
		assertThrows(NullPointerException.class, () -> new RecentStatesMessage(this.blockHash, emptyBlockStates, null));
	}

	@Test
	public void testConstructorRejectsUnreferencedBlockStates() {
		Map<HashDigest, Map<Address, Object>> blockStates = new HashMap<>(this.compressedBlockStates);
		blockStates.put(TestUtils.randomHashDigest(), Collections.singletonMap(this.accounts.get(0), "orphan"));

		assertThrows(IllegalArgumentException.class, () -> new RecentStatesMessage(this.blockHash, blockStates, this.stateReferences));
	}

	@Test
	public void testConstructorRejectsNullStateValues() {
		Address address = this.accounts.get(0);
		HashDigest referencedHash = this.stateReferences.get(address).get(0);

		Map<HashDigest, Map<Address, Object>> blockStates = new HashMap<>(this.compressedBlockStates);
		blockStates.put(referencedHash, Collections.singletonMap(address, null));

		assertThrows(NullPointerException.class, () -> new RecentStatesMessage(this.blockHash, blockStates, this.stateReferences));
	}

	@Test
	public void testTypedStates() throws MessageException {
		Address balanceOnly = TestUtils.randomAddress();
		Address rawState = TestUtils.randomAddress();
		Address listState = TestUtils.randomAddress();
		HashDigest stateHash = TestUtils.randomHashDigest();

		Map<Address, List<HashDigest>> references = new LinkedHashMap<>();
		references.put(balanceOnly, List.of(stateHash));
		references.put(rawState, List.of(stateHash));
		references.put(listState, List.of(stateHash));

		byte[] raw = new byte[] { 1, 2, 3 };
		List<Object> tokens = new ArrayList<>(List.of("token", 9L));

		Map<Address, Object> states = new LinkedHashMap<>();
		states.put(balanceOnly, 5L);
		states.put(rawState, raw);
		states.put(listState, tokens);

		RecentStatesMessage reply = new RecentStatesMessage(stateHash, Map.of(stateHash, states), references);
		RecentStatesMessage parsed = this.decode(reply.toBodyFrames(this.stateCodec));

		Map<Address, Object> parsedStates = parsed.getBlockStates().get(stateHash);

		Object balance = parsedStates.get(balanceOnly);
		assertEquals(Long.class, balance.getClass());
		assertEquals(5L, balance);

		Object parsedRaw = parsedStates.get(rawState);
		assertTrue(parsedRaw instanceof byte[]);
		assertArrayEquals(raw, (byte[]) parsedRaw);

		@SuppressWarnings("unchecked")
		List<Object> parsedTokens = (List<Object>) parsedStates.get(listState);
		assertEquals(tokens, parsedTokens);

		// Decoded states can't be altered through the message
		assertThrows(UnsupportedOperationException.class, () -> parsedTokens.add("extra"));
	}

	@Test
	public void testDataFrames() throws MessageException {
		RecentStatesMessage reply = new RecentStatesMessage(this.blockHash, this.compressedBlockStates, this.stateReferences);
		List<byte[]> frames = this.envelope.toFrames(reply, this.signer);

		final int headerSize = MessageEnvelope.REPLY_HEADER_COUNT;
		int stateRefsOffset = headerSize + 1;
		int blockStatesOffset = stateRefsOffset + 1 + (ACCOUNT_COUNT * 4);

		// 1 + 1 + 5 * (1 + 1 + 2) + 1 + 5 * (1 + 1 + 1 + 1)
		assertEquals(43, frames.size() - headerSize);
		assertEquals(blockStatesOffset + 1 + (this.compressedBlockStates.size() * 4), frames.size());

		assertEquals(MessageType.RECENT_STATES.value, frames.get(0)[0]);
		assertEquals(this.blockHash, new HashDigest(frames.get(headerSize)));
		assertEquals(ACCOUNT_COUNT, Ints.fromByteArray(frames.get(headerSize + 1)));

		Set<Address> remainingAccounts = new HashSet<>(this.accounts);
		for (int i = 0; i < ACCOUNT_COUNT; ++i) {
			int offset = stateRefsOffset + 1 + (i * 4);

			assertEquals(Address.LENGTH, frames.get(offset).length);
			Address address = new Address(frames.get(offset));
			assertTrue(remainingAccounts.contains(address));

			assertEquals(Serialization.INT_LENGTH, frames.get(offset + 1).length);
			assertEquals(2, Ints.fromByteArray(frames.get(offset + 1)));

			assertEquals(HashDigest.LENGTH, frames.get(offset + 2).length);
			assertEquals(this.stateReferences.get(address).get(0), new HashDigest(frames.get(offset + 2)));
			assertEquals(HashDigest.LENGTH, frames.get(offset + 3).length);
			assertEquals(this.stateReferences.get(address).get(1), new HashDigest(frames.get(offset + 3)));

			remainingAccounts.remove(address);
		}

		assertTrue(remainingAccounts.isEmpty());
		assertEquals(this.compressedBlockStates.size(), Ints.fromByteArray(frames.get(blockStatesOffset)));

		for (int i = 0; i < this.compressedBlockStates.size(); ++i) {
			int offset = blockStatesOffset + 1 + (i * 4);

			HashDigest hash = new HashDigest(frames.get(offset));
			assertTrue(this.compressedBlockStates.containsKey(hash));
			assertEquals(1, Ints.fromByteArray(frames.get(offset + 1)));

			Address address = new Address(frames.get(offset + 2));
			assertEquals(this.compressedBlockStates.get(hash).keySet().iterator().next(), address);

			String state = new String(frames.get(offset + 3), StandardCharsets.UTF_8);
			assertEquals(String.format("\"B:%s:%s\"", hash, address), state);
		}
	}

	@Test
	public void testRoundTrip() throws MessageException {
		RecentStatesMessage reply = new RecentStatesMessage(this.blockHash, this.compressedBlockStates, this.stateReferences);

		Message message = this.envelope.parse(this.envelope.toFrames(reply, this.signer), true);
		assertTrue(message instanceof RecentStatesMessage);

		RecentStatesMessage parsed = (RecentStatesMessage) message;
		assertEquals(this.blockHash, parsed.getBlockHash());
		assertFalse(parsed.isMissing());
		assertEquals(this.compressedBlockStates, parsed.getBlockStates());
		assertEquals(this.stateReferences, parsed.getStateReferences());
		assertEquals(ACCOUNT_COUNT * 2, parsed.getStateReferenceCount());
		assertNull(parsed.getIdentity());
	}

	@Test
	public void testMissing() throws MessageException {
		RecentStatesMessage missing = RecentStatesMessage.missing(this.blockHash);
		assertTrue(missing.isMissing());
		assertTrue(missing.getBlockStates().isEmpty());
		assertTrue(missing.getStateReferences().isEmpty());

		List<byte[]> bodyFrames = missing.toBodyFrames(this.stateCodec);
		assertEquals(2, bodyFrames.size());
		assertArrayEquals(this.blockHash.getBytes(), bodyFrames.get(0));
		assertArrayEquals(new byte[] { (byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0xff }, bodyFrames.get(1));

		RecentStatesMessage parsed = (RecentStatesMessage) this.envelope.parse(this.envelope.toFrames(missing, this.signer), true);
		assertEquals(this.blockHash, parsed.getBlockHash());
		assertTrue(parsed.isMissing());
	}

	@Test
	public void testMissingIgnoresFollowingFrames() throws MessageException {
		List<byte[]> bodyFrames = new ArrayList<>(RecentStatesMessage.missing(this.blockHash).toBodyFrames(this.stateCodec));
		bodyFrames.add(Serialization.serializeInt(3));
		bodyFrames.add(new byte[] { 1, 2 });

		RecentStatesMessage parsed = this.decode(bodyFrames);
		assertTrue(parsed.isMissing());
		assertEquals(this.blockHash, parsed.getBlockHash());
	}

	@Test
	public void testNoAccountsIsNotMissing() throws MessageException {
		RecentStatesMessage empty = new RecentStatesMessage(this.blockHash, Collections.emptyMap(), Collections.emptyMap());

		List<byte[]> bodyFrames = empty.toBodyFrames(this.stateCodec);
		assertEquals(3, bodyFrames.size());
		assertEquals(0, Ints.fromByteArray(bodyFrames.get(1)));
		assertEquals(0, Ints.fromByteArray(bodyFrames.get(2)));

		RecentStatesMessage parsed = this.decode(bodyFrames);
		assertFalse(parsed.isMissing());
		assertTrue(parsed.getStateReferences().isEmpty());
		assertTrue(parsed.getBlockStates().isEmpty());
	}

	@Test
	public void testVariableLengthReferences() throws MessageException {
		Address noChanges = TestUtils.randomAddress();
		Address oneChange = TestUtils.randomAddress();
		Address threeChanges = TestUtils.randomAddress();

		HashDigest hash1 = TestUtils.randomHashDigest();
		HashDigest hash2 = TestUtils.randomHashDigest();
		HashDigest hash3 = TestUtils.randomHashDigest();

		Map<Address, List<HashDigest>> references = new LinkedHashMap<>();
		references.put(noChanges, Collections.emptyList());
		references.put(oneChange, List.of(hash2));
		references.put(threeChanges, List.of(hash1, hash2, hash3));

		Map<Address, Object> statesAtHash2 = new LinkedHashMap<>();
		statesAtHash2.put(oneChange, 42);
		statesAtHash2.put(threeChanges, Map.of("balance", 100, "name", "three"));

		Map<HashDigest, Map<Address, Object>> blockStates = Map.of(hash2, statesAtHash2);

		RecentStatesMessage reply = new RecentStatesMessage(hash3, blockStates, references);
		List<byte[]> bodyFrames = reply.toBodyFrames(this.stateCodec);

		// hash, count, 3 accounts of (2 + k), state count, 1 block of (2 + 2 * 2)
		assertEquals(1 + 1 + (2 + 0) + (2 + 1) + (2 + 3) + 1 + (2 + 4), bodyFrames.size());

		RecentStatesMessage parsed = this.decode(bodyFrames);
		assertEquals(references, parsed.getStateReferences());
		assertEquals(blockStates, parsed.getBlockStates());
		assertEquals(List.of(hash1, hash2, hash3), parsed.getStateReferences().get(threeChanges));
		assertEquals(4, parsed.getStateReferenceCount());
	}

	@Test
	public void testTruncation() throws MessageException {
		RecentStatesMessage reply = new RecentStatesMessage(this.blockHash, this.compressedBlockStates, this.stateReferences);
		List<byte[]> bodyFrames = reply.toBodyFrames(this.stateCodec);

		for (int length = 0; length < bodyFrames.size(); ++length) {
			List<byte[]> truncated = bodyFrames.subList(0, length);
			try {
				this.decode(truncated);
				fail("Truncated payload of " + length + " frames was accepted");
			} catch (TruncatedPayloadException e) {
				// Expected
			}
		}

		assertFalse(this.decode(bodyFrames).isMissing());
	}

	@Test
	public void testHugeAccountCount() {
		List<byte[]> bodyFrames = List.of(this.blockHash.getBytes(), Serialization.serializeInt(Integer.MAX_VALUE));

		assertThrows(TruncatedPayloadException.class, () -> this.decode(bodyFrames));
	}

	@Test
	public void testMalformedFrames() throws MessageException {
		RecentStatesMessage reply = new RecentStatesMessage(this.blockHash, this.compressedBlockStates, this.stateReferences);
		List<byte[]> bodyFrames = reply.toBodyFrames(this.stateCodec);

		// Block hash
		List<byte[]> shortHash = new ArrayList<>(bodyFrames);
		shortHash.set(0, new byte[HashDigest.LENGTH - 1]);
		assertThrows(MalformedFrameException.class, () -> this.decode(shortHash));

		// First address
		List<byte[]> longAddress = new ArrayList<>(bodyFrames);
		longAddress.set(2, new byte[Address.LENGTH + 1]);
		assertThrows(MalformedFrameException.class, () -> this.decode(longAddress));

		// First reference count
		List<byte[]> shortCount = new ArrayList<>(bodyFrames);
		shortCount.set(3, new byte[] { 0, 2 });
		assertThrows(MalformedFrameException.class, () -> this.decode(shortCount));
	}

	@Test
	public void testNegativeCount() {
		List<byte[]> bodyFrames = List.of(this.blockHash.getBytes(), Serialization.serializeInt(-2));

		assertThrows(InvalidPayloadException.class, () -> this.decode(bodyFrames));
	}

	@Test
	public void testDuplicateAccount() {
		Address address = TestUtils.randomAddress();
		HashDigest reference = TestUtils.randomHashDigest();

		List<byte[]> bodyFrames = List.of(
				this.blockHash.getBytes(),
				Serialization.serializeInt(2),
				address.getBytes(), Serialization.serializeInt(1), reference.getBytes(),
				address.getBytes(), Serialization.serializeInt(1), reference.getBytes(),
				Serialization.serializeInt(0));

		assertThrows(InvalidPayloadException.class, () -> this.decode(bodyFrames));
	}

	@Test
	public void testUnreferencedBlockStates() {
		Address address = TestUtils.randomAddress();

		List<byte[]> bodyFrames = List.of(
				this.blockHash.getBytes(),
				Serialization.serializeInt(1),
				address.getBytes(), Serialization.serializeInt(1), TestUtils.randomHashDigest().getBytes(),
				Serialization.serializeInt(1),
				TestUtils.randomHashDigest().getBytes(), Serialization.serializeInt(1), address.getBytes(), "\"state\"".getBytes(StandardCharsets.UTF_8));

		assertThrows(InvalidPayloadException.class, () -> this.decode(bodyFrames));
	}

	@Test
	public void testUndecodableState() {
		Address address = TestUtils.randomAddress();
		HashDigest reference = TestUtils.randomHashDigest();

		List<byte[]> bodyFrames = List.of(
				this.blockHash.getBytes(),
				Serialization.serializeInt(1),
				address.getBytes(), Serialization.serializeInt(1), reference.getBytes(),
				Serialization.serializeInt(1),
				reference.getBytes(), Serialization.serializeInt(1), address.getBytes(), new byte[] { '{', '"' });

		assertThrows(InvalidPayloadException.class, () -> this.decode(bodyFrames));
	}

	@Test
	public void testReplyCarriesRequestIdentity() throws MessageException {
		byte[] identity = TestUtils.randomBytes(5);

		RecentStatesMessage reply = new RecentStatesMessage(identity, this.blockHash, this.compressedBlockStates, this.stateReferences);
		List<byte[]> frames = this.envelope.toFrames(reply, this.signer);

		assertEquals(43 + MessageEnvelope.REQUEST_HEADER_COUNT, frames.size());
		assertArrayEquals(identity, frames.get(0));

		RecentStatesMessage parsed = (RecentStatesMessage) this.envelope.parse(frames, false);
		assertArrayEquals(identity, parsed.getIdentity());
		assertEquals(this.stateReferences, parsed.getStateReferences());
	}

}
