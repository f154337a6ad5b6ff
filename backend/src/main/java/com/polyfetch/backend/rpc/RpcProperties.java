package com.polyfetch.backend.rpc;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * NEAR RPC node and the account whose balance is fetched.
 */
@Validated
@ConfigurationProperties(prefix = "polyfetch.rpc")
public record RpcProperties(
        @DefaultValue("https://rpc.testnet.near.org") @NotBlank String url,
        @DefaultValue("panasthetik.testnet") @NotBlank String accountId
) {
}
