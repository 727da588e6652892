package com.vigil.chain;

import com.google.gson.JsonObject;
import com.vigil.config.ChainConfig;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.io.IOException;
import java.time.Clock;
import java.util.Locale;

/**
 * Submits through a browser-hosted delegated signer. The bridge relays
 * {@code {entrypoint, calldata}} to the controller on its page via {@code POST /execute}.
 *
 * <p>When the bridge reports that the controller is gone (not connected, no
 * controller on the page, page closed) it is asked to reconnect and the same call
 * is retried, up to {@code chain.controllerReconnectAttempts} times.
 */
@Slf4j
public class ControllerBridgeWriter extends AbstractBridgeWriter {

    static final String EXECUTE_PATH = "/execute";
    static final String RECONNECT_PATH = "/controller/reconnect";

    private static final String[] RECONNECT_MARKERS = {"not_connected", "no_controller", "page_closed"};

    public ControllerBridgeWriter(BridgeHttpClient bridge, ChainConfig config, Clock clock) {
        super(bridge, config, clock);
    }

    @Override
    protected SettlementHandle submit(ContractCall call, @Nullable RandomnessSalt salt) throws WriteException {
        JsonObject body = new JsonObject();
        body.addProperty("contractAddress", call.getContractAddress());
        body.addProperty("entrypoint", call.getEntrypoint());
        body.add("calldata", strings(call.getCalldata()));
        if (salt != null) {
            body.addProperty("vrfProvider", config.getVrfProviderAddress());
            body.add("saltElements", strings(salt.getElements()));
        }

        int attempts = Math.max(1, config.getControllerReconnectAttempts());
        String lastError = "controller execute failed";
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String error;
            try {
                JsonObject reply = bridge.post(EXECUTE_PATH, body);
                error = errorText(reply);
                if (error == null) {
                    return handleFrom(call.getEntrypoint(), reply);
                }
            } catch (IOException e) {
                error = errorText(e);
            }

            lastError = error;
            if (!needsReconnect(error)) {
                throw WriteException.classified(error);
            }
            log.warn("Controller unavailable for {} (attempt {}/{}): {}", call.getEntrypoint(), attempt, attempts, error);
            reconnect();
        }
        throw new WriteException(WriteErrorKind.SIGNER_UNAVAILABLE,
                "Controller execute failed (" + call.getEntrypoint() + "): " + lastError);
    }

    @Override
    public void resync() {
        reconnect();
    }

    private void reconnect() {
        try {
            bridge.post(RECONNECT_PATH, new JsonObject());
            log.info("Controller reconnect requested");
        } catch (IOException e) {
            log.warn("Controller reconnect request failed: {}", e.getMessage());
        }
    }

    static boolean needsReconnect(String error) {
        String text = error.toLowerCase(Locale.ROOT);
        return WriteErrorClassifier.containsAny(text, RECONNECT_MARKERS);
    }
}
