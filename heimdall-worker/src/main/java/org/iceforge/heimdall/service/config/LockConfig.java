package org.iceforge.heimdall.service.config;

import org.iceforge.heimdall.lock.AdvisoryChannelLockService;
import org.iceforge.heimdall.lock.ChannelLockService;
import org.iceforge.heimdall.lock.LocalChannelLockService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
public class LockConfig {

    @Bean
    @ConditionalOnProperty(prefix = "heimdall.lock", name = "store", havingValue = "advisory", matchIfMissing = true)
    public ChannelLockService advisoryChannelLockService(DataSource dataSource) {
        return new AdvisoryChannelLockService(dataSource);
    }

    /**
     * Single-process deployments only. Two workers with local locks would run one channel twice at once.
     */
    @Bean
    @ConditionalOnProperty(prefix = "heimdall.lock", name = "store", havingValue = "local")
    public ChannelLockService localChannelLockService() {
        return new LocalChannelLockService();
    }
}
