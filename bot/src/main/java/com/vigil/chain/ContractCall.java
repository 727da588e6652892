package com.vigil.chain;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One Starknet call: target contract, entrypoint and serialized calldata (felts as strings).
 */
@Value
public class ContractCall {

    String contractAddress;

    String entrypoint;

    List<String> calldata;

    public ContractCall(String contractAddress, String entrypoint, List<String> calldata) {
        this.contractAddress = contractAddress;
        this.entrypoint = entrypoint;
        this.calldata = Collections.unmodifiableList(new ArrayList<>(calldata));
    }
}
