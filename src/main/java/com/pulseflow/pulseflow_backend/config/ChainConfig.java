package com.pulseflow.pulseflow_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Slf4j
@Configuration
@EnableConfigurationProperties(ChainProperties.class)
public class ChainConfig {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties chainProperties) {
        log.info("Connecting to chain {} via {}", chainProperties.chainId(), chainProperties.rpcUrl());
        return Web3j.build(new HttpService(chainProperties.rpcUrl()));
    }
}
