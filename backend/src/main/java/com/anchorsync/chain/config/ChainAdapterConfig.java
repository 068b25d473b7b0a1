package com.anchorsync.chain.config;

import com.anchorsync.chain.ChainProvider;
import com.anchorsync.chain.RpcEndpointRotator;
import com.anchorsync.chain.anchor.AnchorProofFetcher;
import com.anchorsync.chain.anchor.EvmAnchorProofFetcher;
import com.anchorsync.chain.evm.EvmChainProvider;
import com.anchorsync.chain.evm.EvmJsonRpcExecutor;
import com.anchorsync.chain.evm.EvmRpcClient;
import com.anchorsync.chain.evm.WebClientEvmRpcClient;
import com.anchorsync.chain.listener.BlockConfirmationListenerFactory;
import com.anchorsync.chain.listener.PollingBlockConfirmationListenerFactory;
import com.anchorsync.common.RetryPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * Wires EVM chain access from anchorsync.chain: one rotator over all urls, one global rate limiter.
 * Every bean backs off when the host application provides its own.
 */
@Configuration
@EnableConfigurationProperties(ChainProperties.class)
public class ChainAdapterConfig {

    /** Used when no url is configured so the context still starts; sync init fails fast on first call. */
    private static final List<String> DEFAULT_FALLBACK_URLS = List.of("http://localhost:8545");

    @Bean
    public RpcEndpointRotator evmRpcEndpointRotator(ChainProperties properties) {
        ChainProperties.Retry retry = properties.getRetry();
        RetryPolicy policy = new RetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs(),
                retry.getJitterFactor(), retry.getMaxAttempts());
        List<String> urls = properties.getUrls() == null || properties.getUrls().isEmpty()
                ? DEFAULT_FALLBACK_URLS : properties.getUrls();
        return new RpcEndpointRotator(urls, policy);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(ChainProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }

    @Bean
    @ConditionalOnMissingBean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder) {
        return new WebClientEvmRpcClient(webClientBuilder);
    }

    @Bean
    public EvmJsonRpcExecutor evmJsonRpcExecutor(EvmRpcClient rpcClient, RpcEndpointRotator evmRpcEndpointRotator,
                                                 RateLimiter evmRpcRateLimiter, ObjectMapper objectMapper) {
        return new EvmJsonRpcExecutor(rpcClient, evmRpcEndpointRotator, evmRpcRateLimiter, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChainProvider chainProvider(EvmJsonRpcExecutor evmJsonRpcExecutor) {
        return new EvmChainProvider(evmJsonRpcExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public BlockConfirmationListenerFactory blockConfirmationListenerFactory(ChainProperties properties) {
        return new PollingBlockConfirmationListenerFactory(
                Duration.ofMillis(Math.max(1L, properties.getBlockPollIntervalMs())), properties.getMaxBlocksPerPoll());
    }

    @Bean
    @ConditionalOnMissingBean
    public AnchorProofFetcher anchorProofFetcher(EvmJsonRpcExecutor evmJsonRpcExecutor, ChainProperties properties) {
        return new EvmAnchorProofFetcher(evmJsonRpcExecutor, properties.getAnchorContractAddress(),
                properties.getAnchorEventTopic());
    }
}
