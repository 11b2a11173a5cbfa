package io.tasks4j.config;

import io.tasks4j.CommandCallback;
import io.tasks4j.CommandScheduler;
import io.tasks4j.core.MissedOncePolicy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class CommandSchedulerAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CommandSchedulerAutoConfiguration.class))
            .withPropertyValues(
                    "tasks4j.scheduler.tick-interval=100ms",
                    "tasks4j.scheduler.max-concurrency=2",
                    "tasks4j.scheduler.timezone=Europe/Berlin"
            );

    @Test
    void shouldAutoConfigureSchedulerBeans() {
        contextRunner
                .withBean(CommandCallback.class, () -> command -> "ok")
                .run(context -> {
                    assertThat(context).hasSingleBean(CommandScheduler.class);
                    assertThat(context).hasSingleBean(CommandSchedulerLifecycle.class);
                    assertThat(context).hasSingleBean(SchedulerProperties.class);
                    assertThat(context.getBean(CommandScheduler.class).isRunning()).isTrue();
                });
    }

    @Test
    void shouldBindSchedulerProperties() {
        contextRunner
                .withPropertyValues("tasks4j.scheduler.missed-once-policy=fire_immediately")
                .run(context -> {
                    SchedulerProperties props = context.getBean(SchedulerProperties.class);
                    assertThat(props.getTickInterval()).isEqualTo(Duration.ofMillis(100));
                    assertThat(props.getMaxConcurrency()).isEqualTo(2);
                    assertThat(props.getMaxInstances()).isEqualTo(1);
                    assertThat(props.resolveZone()).isEqualTo(ZoneId.of("Europe/Berlin"));
                    assertThat(props.getMissedOncePolicy()).isEqualTo(MissedOncePolicy.FIRE_IMMEDIATELY);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("tasks4j.scheduler.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(CommandScheduler.class);
                    assertThat(context).doesNotHaveBean(CommandSchedulerLifecycle.class);
                });
    }

    @Test
    void shouldStartWithoutCallbackBean() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(CommandScheduler.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldDeliverDueCommandsToCallbackBean() throws Exception {
        CommandCallback callback = mock(CommandCallback.class);
        contextRunner
                .withBean(CommandCallback.class, () -> callback)
                .run(context -> {
                    CommandScheduler scheduler = context.getBean(CommandScheduler.class);
                    assertThat(scheduler.scheduleOnce("greeting", "say good morning", Instant.now().plusMillis(200)))
                            .isTrue();

                    verify(callback, timeout(3000)).execute("say good morning");
                });
    }

    @Test
    void shouldStopSchedulerWhenContextCloses() {
        CommandScheduler[] captured = new CommandScheduler[1];
        contextRunner.run(context -> captured[0] = context.getBean(CommandScheduler.class));

        assertThat(captured[0].isRunning()).isFalse();
    }
}
