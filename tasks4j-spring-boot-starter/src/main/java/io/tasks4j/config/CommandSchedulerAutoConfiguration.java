package io.tasks4j.config;

import io.tasks4j.CommandCallback;
import io.tasks4j.CommandScheduler;
import io.tasks4j.internal.memory.InMemoryCommandScheduler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration entrypoint for the command scheduler.
 */
@AutoConfiguration
@ConditionalOnClass(CommandScheduler.class)
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "tasks4j.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CommandSchedulerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CommandScheduler commandScheduler(SchedulerProperties props) {
        return new InMemoryCommandScheduler(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandSchedulerLifecycle commandSchedulerLifecycle(CommandScheduler scheduler,
                                                               ObjectProvider<CommandCallback> callbackProvider) {
        return new CommandSchedulerLifecycle(scheduler, callbackProvider.getIfAvailable());
    }
}
