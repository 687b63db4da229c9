package com.ionindexer.domain.action;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Block types with a dedicated action extractor, keyed by the classifier's btype code.
 */
public enum ActionType {
    CALL_CONTRACT("call_contract"),
    TON_TRANSFER("ton_transfer"),
    JETTON_TRANSFER("jetton_transfer"),
    NFT_TRANSFER("nft_transfer"),
    NFT_MINT("nft_mint"),
    JETTON_BURN("jetton_burn"),
    JETTON_SWAP("jetton_swap"),
    CHANGE_DNS("change_dns"),
    DELETE_DNS("delete_dns"),
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe"),
    ELECTION_DEPOSIT("election_deposit"),
    ELECTION_RECOVER("election_recover"),
    AUCTION_BID("auction_bid");

    private static final Map<String, ActionType> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ActionType::code, Function.identity()));

    private final String code;

    ActionType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<ActionType> fromCode(String code) {
        return Optional.ofNullable(code).map(BY_CODE::get);
    }
}
