package com.identity.engine.lifecycle;

import com.identity.engine.dispatch.AsyncEventDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.ContextClosedEvent;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GracefulShutdownHandlerTest {

    @Mock
    private AsyncEventDispatcher dispatcher;

    @Mock
    private ApplicationContext context;

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void onShutdown_shouldWaitWithConfiguredTimeout() throws Exception {
        when(dispatcher.getShutdownTimeout()).thenReturn(Duration.ofSeconds(30));
        GracefulShutdownHandler handler = new GracefulShutdownHandler(dispatcher);

        handler.onShutdown(new ContextClosedEvent(context));

        verify(dispatcher).shutdown(Duration.ofSeconds(30));
    }

    @Test
    void onShutdown_shouldNotFailOnTimeout() throws Exception {
        when(dispatcher.getShutdownTimeout()).thenReturn(Duration.ofSeconds(1));
        doThrow(new TimeoutException()).when(dispatcher).shutdown(Duration.ofSeconds(1));
        GracefulShutdownHandler handler = new GracefulShutdownHandler(dispatcher);

        assertThatCode(() -> handler.onShutdown(new ContextClosedEvent(context))).doesNotThrowAnyException();
    }

    @Test
    void onShutdown_shouldRestoreInterruptFlag() throws Exception {
        when(dispatcher.getShutdownTimeout()).thenReturn(Duration.ofSeconds(1));
        doThrow(new InterruptedException()).when(dispatcher).shutdown(Duration.ofSeconds(1));
        GracefulShutdownHandler handler = new GracefulShutdownHandler(dispatcher);

        handler.onShutdown(new ContextClosedEvent(context));

        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void isShuttingDown_shouldReflectDispatcher() {
        when(dispatcher.isShuttingDown()).thenReturn(true);

        assertThat(new GracefulShutdownHandler(dispatcher).isShuttingDown()).isTrue();
    }
}
