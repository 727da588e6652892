package com.vigil.chain;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.vigil.config.ChainConfig;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Clock;

/**
 * Submits through a local signer that holds the session key for {@code address}.
 * The multicall is built here: a randomness request first when a salt is given,
 * then the game call. The signer appends the salt hash, signs and sends.
 */
@Slf4j
public class SessionKeyWriter extends AbstractBridgeWriter {

    static final String SIGN_AND_SEND_PATH = "/sign-and-send";
    static final String REFRESH_PATH = "/signer/refresh";

    private final String address;

    public SessionKeyWriter(BridgeHttpClient bridge, ChainConfig config, Clock clock, String address) {
        super(bridge, config, clock);
        this.address = address;
    }

    @Override
    protected SettlementHandle submit(ContractCall call, @Nullable RandomnessSalt salt) throws WriteException {
        JsonArray multicall = new JsonArray();
        if (salt != null) {
            JsonObject vrf = callJson(calls.requestRandom(config.getVrfProviderAddress()));
            vrf.add("saltElements", strings(salt.getElements()));
            multicall.add(vrf);
        }
        multicall.add(callJson(call));

        JsonObject body = new JsonObject();
        body.addProperty("address", address);
        body.add("calls", multicall);

        JsonObject reply;
        try {
            reply = bridge.post(SIGN_AND_SEND_PATH, body);
        } catch (IOException e) {
            throw WriteException.classified(errorText(e), e);
        }
        return handleFrom(call.getEntrypoint(), reply);
    }

    /**
     * Ask the signer to refetch the account nonce.
     */
    @Override
    public void resync() {
        JsonObject body = new JsonObject();
        body.addProperty("address", address);
        try {
            bridge.post(REFRESH_PATH, body);
            log.info("Signer refresh requested for {}", address);
        } catch (IOException e) {
            log.warn("Signer refresh failed: {}", e.getMessage());
        }
    }
}
