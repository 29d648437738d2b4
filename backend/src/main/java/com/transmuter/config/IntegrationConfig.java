package com.transmuter.config;

import com.transmuter.domain.TokenBalanceRepository;
import com.transmuter.integration.BalanceBookCollateralManager;
import com.transmuter.integration.BalanceBookTokenGateway;
import com.transmuter.integration.CollateralManager;
import com.transmuter.integration.TokenGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Balance-book token and manager collaborators for standalone runs. A deployment wiring real token and manager
 * clients declares its own {@link TokenGateway} and {@link CollateralManager} beans.
 */
@Configuration
@EnableConfigurationProperties(TransmuterProperties.class)
public class IntegrationConfig {

    @Bean
    @ConditionalOnMissingBean(TokenGateway.class)
    public BalanceBookTokenGateway balanceBookTokenGateway(TokenBalanceRepository repository,
                                                           TransmuterProperties properties) {
        return new BalanceBookTokenGateway(repository, properties.getStablecoin(), properties.getReserve());
    }

    @Bean
    @ConditionalOnBean(BalanceBookTokenGateway.class)
    @ConditionalOnMissingBean(CollateralManager.class)
    public CollateralManager collateralManager(BalanceBookTokenGateway tokenGateway, TransmuterProperties properties) {
        return new BalanceBookCollateralManager(tokenGateway, properties.getReserve());
    }
}
