package com.polyfetch.config;

import com.polyfetch.backend.rpc.NearRpcClient;
import com.polyfetch.backend.rpc.WebClientNearRpcClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class RpcClientConfig {

    @Bean
    public NearRpcClient nearRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientNearRpcClient(webClientBuilder);
    }
}
