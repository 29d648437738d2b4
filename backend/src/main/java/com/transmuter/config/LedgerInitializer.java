package com.transmuter.config;

import com.transmuter.state.TransmuterStateStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Creates the ledger document on first start from {@link TransmuterProperties}.
 */
@Component
@RequiredArgsConstructor
public class LedgerInitializer implements ApplicationRunner {

    private final TransmuterStateStore stateStore;
    private final TransmuterProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        stateStore.initialize(properties.getStablecoin(), properties.getTrusted());
    }
}
