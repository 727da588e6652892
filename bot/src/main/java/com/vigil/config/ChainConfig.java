package com.vigil.config;

import lombok.Data;

/**
 * Where reads and writes go, and how the signer is reached.
 */
@Data
public class ChainConfig {

    public static final String SIGNER_CONTROLLER = "controller";
    public static final String SIGNER_SESSION_KEY = "session-key";

    /**
     * {@value #SIGNER_CONTROLLER} (browser-mediated delegated signer) or
     * {@value #SIGNER_SESSION_KEY} (local signer holding the session key).
     */
    private String signer = SIGNER_CONTROLLER;

    /**
     * Base URL of the local bridge serving state, catalog and signing endpoints.
     */
    private String bridgeUrl = "http://127.0.0.1:7777";

    /**
     * Bearer token for the bridge. Prefer the VIGIL_BRIDGE_TOKEN environment variable.
     */
    private String bridgeToken = "";

    /**
     * Starknet JSON-RPC endpoint used for transaction receipts.
     */
    private String rpcUrl = "https://api.cartridge.gg/x/starknet/mainnet/rpc/v0_9";

    private String gameContract = "0x6f7c4350d6d5ee926b3ac4fa0c9c351055456e75c92227468d84232fc493a9c";

    private String vrfProviderAddress = "0x051fea4450da9d6aee758bdeba88b2f665bcbf549d2c61421aa724e9ac0ced8f";

    /**
     * Attach a randomness salt to explore and battle writes.
     */
    private boolean attachRandomnessSalt = true;

    private long requestTimeoutMs = 15_000;

    /**
     * Attempts for a world-state read when the failure is transient.
     */
    private int readAttempts = 3;
    private long readRetryBaseDelayMs = 200;

    /**
     * Reconnect attempts when the controller bridge reports a lost connection.
     */
    private int controllerReconnectAttempts = 3;
}
