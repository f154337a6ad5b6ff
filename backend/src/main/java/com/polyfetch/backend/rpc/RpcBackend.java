package com.polyfetch.backend.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyfetch.backend.BackendClient;
import com.polyfetch.common.BackendException;
import com.polyfetch.common.DecodeException;
import com.polyfetch.common.FetchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;

/**
 * Fetches the finalized balance of one NEAR account with a single {@code query/view_account} call. No retries.
 */
@Component
@Slf4j
public class RpcBackend implements BackendClient<AccountBalance> {

    public static final String NAME = "rpc";

    private static final String UNKNOWN_ACCOUNT = "UNKNOWN_ACCOUNT";
    /** Older nodes report a missing account only in the message text. */
    private static final String LEGACY_UNKNOWN_ACCOUNT_MESSAGE = "does not exist while viewing";

    private final NearRpcClient rpcClient;
    private final ObjectMapper objectMapper;
    private final RpcProperties properties;

    public RpcBackend(NearRpcClient rpcClient, ObjectMapper objectMapper, RpcProperties properties) {
        this.rpcClient = rpcClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public FetchResult<AccountBalance> fetch() {
        try {
            AccountBalance balance = viewAccount(properties.accountId());
            log.debug("Account: {} // Yocto: {}", balance.accountId(), balance.amount());
            return FetchResult.success(balance);
        } catch (BackendException e) {
            log.warn("RPC fetch for {} failed: {}", properties.accountId(), e.getMessage());
            return FetchResult.failure(NAME, e);
        }
    }

    AccountBalance viewAccount(String accountId) {
        Map<String, Object> params = Map.of(
                "request_type", "view_account",
                "finality", "final",
                "account_id", accountId
        );
        String json = rpcClient.call(properties.url(), "query", params).block();
        if (json == null || json.isBlank()) {
            throw new DecodeException("Empty response to view_account for " + accountId);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DecodeException("view_account response is not JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            if (isUnknownAccount(error)) {
                throw new AccountNotFoundException(accountId);
            }
            throw new RpcException("view_account error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.hasNonNull("error")) {
            String message = result.path("error").asText();
            if (message.contains(LEGACY_UNKNOWN_ACCOUNT_MESSAGE)) {
                throw new AccountNotFoundException(accountId);
            }
            throw new RpcException("view_account error: " + message);
        }
        return new AccountBalance(
                accountId,
                yocto(result, "amount", accountId),
                result.has("locked") ? yocto(result, "locked", accountId) : BigInteger.ZERO,
                result.path("storage_usage").asLong(),
                result.path("block_height").asLong(),
                result.path("block_hash").asText(null));
    }

    private static boolean isUnknownAccount(JsonNode error) {
        if (UNKNOWN_ACCOUNT.equals(error.path("cause").path("name").asText())) {
            return true;
        }
        return error.path("data").asText("").contains(LEGACY_UNKNOWN_ACCOUNT_MESSAGE);
    }

    /** NEAR encodes balances as decimal strings since they exceed 64 bits. */
    private static BigInteger yocto(JsonNode result, String field, String accountId) {
        JsonNode node = result.path(field);
        if (!node.isTextual() && !node.isIntegralNumber()) {
            throw new DecodeException("view_account for " + accountId + " has no " + field);
        }
        try {
            return new BigInteger(node.asText());
        } catch (NumberFormatException e) {
            throw new DecodeException("view_account for " + accountId + " has invalid " + field + ": " + node.asText(), e);
        }
    }
}
