package com.vigil.session;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.vigil.chain.BridgeGameReader;
import com.vigil.chain.BridgeHttpClient;
import com.vigil.chain.ControllerBridgeWriter;
import com.vigil.chain.GameReader;
import com.vigil.chain.GameWriter;
import com.vigil.chain.JsonRpcClient;
import com.vigil.chain.SessionKeyWriter;
import com.vigil.config.ChainConfig;
import com.vigil.config.RunnerConfig;
import com.vigil.state.ChainValues;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;

import javax.annotation.Nullable;
import javax.inject.Inject;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Session bootstrap through the local bridge. New adventurers come from
 * {@code POST /session/new-game}; the writer implementation is picked once here
 * from {@code chain.signer}.
 */
@Slf4j
public class BridgeSessionBootstrapper implements SessionBootstrapper {

    static final String SESSION_PATH = "/session";
    static final String NEW_GAME_PATH = "/session/new-game";

    private final RunnerConfig config;
    private final SessionStore store;
    private final OkHttpClient httpClient;
    private final Gson gson;
    private final Clock clock;

    @Inject
    public BridgeSessionBootstrapper(RunnerConfig config, SessionStore store, OkHttpClient httpClient,
                                     Gson gson, Clock clock) {
        this.config = config;
        this.store = store;
        this.httpClient = httpClient;
        this.gson = gson;
        this.clock = clock;
    }

    @Override
    public GameSession bootstrap() throws IOException {
        BridgeHttpClient bridge = newBridge();
        Optional<SessionRecord> stored = config.getSession().isReuse() ? store.load() : Optional.empty();

        SessionRecord record;
        long pinned = config.getSession().getAdventurerId();
        if (pinned > 0) {
            record = stored.isPresent()
                    ? stored.get().toBuilder().adventurerId(pinned).updatedAt(clock.instant()).build()
                    : currentAccount(bridge, pinned);
            store.save(record);
        } else if (stored.isPresent() && stored.get().hasAdventurer()) {
            record = stored.get();
        } else {
            record = newGame(bridge, null);
            store.save(record);
        }

        log.info("Session ready: adventurer {} on {} ({} signer)",
                record.getAdventurerId(), record.getAddress(), config.getChain().getSigner());
        return open(bridge, record);
    }

    @Override
    public GameSession rotate(long terminatedAdventurerId) throws IOException {
        BridgeHttpClient bridge = newBridge();
        SessionRecord record = newGame(bridge, terminatedAdventurerId);
        store.save(record);
        log.info("Rotated identity: adventurer {} -> {}", terminatedAdventurerId, record.getAdventurerId());
        return open(bridge, record);
    }

    /**
     * Record for a pinned adventurer played by the account the bridge is signed in with.
     */
    private SessionRecord currentAccount(BridgeHttpClient bridge, long adventurerId) throws IOException {
        JsonObject reply = bridge.get(SESSION_PATH);
        if (!reply.has("address")) {
            throw new IOException("Bridge session reply has no address: " + reply);
        }
        Instant now = clock.instant();
        return SessionRecord.builder()
                .address(reply.get("address").getAsString())
                .adventurerId(adventurerId)
                .playUrl(reply.has("playUrl") ? reply.get("playUrl").getAsString() : null)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private SessionRecord newGame(BridgeHttpClient bridge, @Nullable Long previousAdventurerId) throws IOException {
        JsonObject request = new JsonObject();
        if (previousAdventurerId != null) {
            request.addProperty("previousAdventurerId", previousAdventurerId);
        }
        JsonObject reply = bridge.post(NEW_GAME_PATH, request);

        long adventurerId = ChainValues.toLong(reply, reply.has("adventurerId") ? "adventurerId" : "adventurer_id");
        String address = reply.has("address") ? reply.get("address").getAsString() : "";
        if (adventurerId <= 0 || address.isEmpty()) {
            throw new IOException("New game reply is missing adventurer id or address: " + reply);
        }
        Instant now = clock.instant();
        return SessionRecord.builder()
                .address(address)
                .adventurerId(adventurerId)
                .playUrl(reply.has("playUrl") ? reply.get("playUrl").getAsString() : null)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private GameSession open(BridgeHttpClient bridge, SessionRecord record) {
        ChainConfig chain = config.getChain();
        JsonRpcClient rpc = new JsonRpcClient(httpClient, chain.getRpcUrl(), chain.getRequestTimeoutMs(), gson);
        GameReader reader = new BridgeGameReader(bridge, rpc);
        GameWriter writer = ChainConfig.SIGNER_SESSION_KEY.equals(chain.getSigner())
                ? new SessionKeyWriter(bridge, chain, clock, record.getAddress())
                : new ControllerBridgeWriter(bridge, chain, clock);
        return new GameSession(record.getAdventurerId(), record.getAddress(), reader, writer);
    }

    private BridgeHttpClient newBridge() {
        ChainConfig chain = config.getChain();
        return new BridgeHttpClient(httpClient, chain.getBridgeUrl(), chain.getBridgeToken(),
                chain.getRequestTimeoutMs(), gson);
    }
}
