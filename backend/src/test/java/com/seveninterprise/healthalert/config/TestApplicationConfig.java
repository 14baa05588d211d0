package com.seveninterprise.healthalert.config;

import com.seveninterprise.healthalert.services.ChannelSendResult;
import com.seveninterprise.healthalert.services.IChannelSender;
import org.mockito.Mockito;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;

/**
 * Test configuration for application beans.
 * Provides mocked implementations for external dependencies.
 */
@TestConfiguration
public class TestApplicationConfig {

    /**
     * Mock channel gateway: every send is accepted
     */
    @Bean
    @Primary
    @Profile("test")
    public IChannelSender mockChannelSender() {
        IChannelSender mockSender = Mockito.mock(IChannelSender.class);

        Mockito.when(mockSender.send(Mockito.anyString(), Mockito.any(), Mockito.any()))
               .thenReturn(ChannelSendResult.accepted());

        return mockSender;
    }

    /**
     * Controllable clock so sweeps and timers can be driven by the tests
     */
    @Bean
    @Primary
    @Profile("test")
    public MutableClock testClock() {
        return new MutableClock();
    }
}
