package com.example.realtime.event;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import com.example.realtime.service.exception.ConnectionException;
import com.example.realtime.service.exception.MalformedPayloadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChangeListener Tests")
class ChangeListenerTest {

    private static final String NOTIFICATIONS = "notification_created";
    private static final String MESSAGES = "message_created";

    @Mock
    private ChangeEventSource source;

    @Mock
    private ScheduledExecutorService scheduler;

    @Mock
    private ScheduledFuture<Object> reconnectFuture;

    @Mock
    private ChangeEventHandler notificationHandler;

    @Mock
    private ChangeEventHandler messageHandler;

    private ExecutorService receiveExecutor;
    private ChangeListener listener;

    @BeforeEach
    void setUp() {
        receiveExecutor = Executors.newSingleThreadExecutor();
        lenient().doReturn(reconnectFuture).when(scheduler).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        lenient().when(source.supportsChannel(anyString())).thenReturn(true);
        listener = new ChangeListener(
                source,
                new ObjectMapper(),
                scheduler,
                receiveExecutor,
                ReconnectPolicy.fixed(Duration.ofSeconds(5)),
                Duration.ofMillis(20),
                Duration.ofMillis(200));
        listener.registerChannel(NOTIFICATIONS, notificationHandler);
        listener.registerChannel(MESSAGES, messageHandler);
    }

    @AfterEach
    void tearDown() {
        listener.forceClose();
        receiveExecutor.shutdownNow();
    }

    @Nested
    @DisplayName("Connect Tests")
    class ConnectTests {

        @Test
        @DisplayName("Should subscribe every registered channel and report connected")
        void shouldSubscribeAllChannels() {
            // Given
            FakeLink link = new FakeLink();
            when(source.open()).thenReturn(link);

            // When
            listener.connect();

            // Then
            assertThat(link.subscribed).containsExactlyInAnyOrder(NOTIFICATIONS, MESSAGES);
            assertThat(listener.isConnected()).isTrue();
            assertThat(listener.state()).isEqualTo(LinkState.CONNECTED);
        }

        @Test
        @DisplayName("Should throw and schedule one reconnect when the link cannot be opened")
        void shouldScheduleReconnectWhenOpenFails() {
            // Given
            when(source.open()).thenThrow(new ConnectionException("connection refused"));

            // When / Then
            assertThatThrownBy(() -> listener.connect()).isInstanceOf(ConnectionException.class);
            assertThat(listener.state()).isEqualTo(LinkState.DISCONNECTED);
            verify(scheduler, times(1)).schedule(any(Runnable.class), eq(5_000L), eq(TimeUnit.MILLISECONDS));
            assertThat(listener.isReconnectPending()).isTrue();
        }

        @Test
        @DisplayName("Should force-close a link whose subscription fails")
        void shouldCloseLinkWhenSubscribeFails() {
            // Given
            FakeLink link = new FakeLink();
            link.subscribeFailure = new ConnectionException("LISTEN failed");
            when(source.open()).thenReturn(link);

            // When / Then
            assertThatThrownBy(() -> listener.connect()).isInstanceOf(ConnectionException.class);
            assertThat(link.forceClosed).isTrue();
            assertThat(listener.isConnected()).isFalse();
        }

        @Test
        @DisplayName("Should refuse a channel name the source cannot subscribe")
        void shouldRejectUnsupportedChannel() {
            // Given
            when(source.supportsChannel("bad;name")).thenReturn(false);

            // When / Then
            assertThatThrownBy(() -> listener.registerChannel("bad;name", notificationHandler))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(listener.registeredChannels()).doesNotContain("bad;name");
        }

        @Test
        @DisplayName("Should replace the handler when a channel is registered twice")
        void shouldReplaceHandlerOnReRegistration() {
            // Given
            ChangeEventHandler replacement = mock(ChangeEventHandler.class);
            listener.registerChannel(NOTIFICATIONS, replacement);
            FakeLink link = new FakeLink();
            when(source.open()).thenReturn(link);
            listener.connect();

            // When
            link.push(NOTIFICATIONS, "{\"profile_id\":\"p1\"}");

            // Then
            verify(replacement, timeout(1_000)).handle(any(ChangeEvent.class));
            verify(notificationHandler, never()).handle(any());
            assertThat(listener.registeredChannels()).containsExactlyInAnyOrder(NOTIFICATIONS, MESSAGES);
        }
    }

    @Nested
    @DisplayName("Dispatch Tests")
    class DispatchTests {

        private FakeLink link;

        @BeforeEach
        void connect() {
            link = new FakeLink();
            when(source.open()).thenReturn(link);
            listener.connect();
        }

        @Test
        @DisplayName("Should hand the parsed payload to the handler of its channel")
        void shouldDispatchParsedPayload() {
            // When
            link.push(MESSAGES, "{\"conversation_id\":\"c1\",\"content\":\"hi\"}");

            // Then
            ArgumentCaptor<ChangeEvent> captor = ArgumentCaptor.forClass(ChangeEvent.class);
            verify(messageHandler, timeout(1_000)).handle(captor.capture());
            assertThat(captor.getValue().getChannel()).isEqualTo(MESSAGES);
            assertThat(captor.getValue().getPayload()).containsEntry("conversation_id", "c1").containsEntry("content", "hi");
            verify(notificationHandler, never()).handle(any());
        }

        @Test
        @DisplayName("Should drop a malformed payload and keep delivering the next one")
        void shouldSurviveMalformedPayload() {
            // When
            link.push(NOTIFICATIONS, "{not json");
            link.push(NOTIFICATIONS, "{\"profile_id\":\"p1\"}");

            // Then
            verify(notificationHandler, timeout(1_000).times(1))
                    .handle(argThat(event -> "p1".equals(event.getPayload().get("profile_id"))));
            assertThat(listener.droppedEvents()).isEqualTo(1);
            assertThat(listener.isConnected()).isTrue();
        }

        @Test
        @DisplayName("Should drop events for a channel without a handler")
        void shouldDropUnknownChannel() {
            // When
            link.push("booking_created", "{\"booking_id\":\"b1\"}");
            link.push(MESSAGES, "{\"conversation_id\":\"c1\"}");

            // Then
            verify(messageHandler, timeout(1_000)).handle(any());
            assertThat(listener.droppedEvents()).isEqualTo(1);
            verify(notificationHandler, never()).handle(any());
        }

        @Test
        @DisplayName("Should keep receiving after a handler throws")
        void shouldSurviveHandlerFailure() {
            // Given
            doThrow(new IllegalStateException("boom")).doNothing().when(notificationHandler).handle(any());

            // When
            link.push(NOTIFICATIONS, "{\"profile_id\":\"p1\"}");
            link.push(NOTIFICATIONS, "{\"profile_id\":\"p2\"}");

            // Then
            verify(notificationHandler, timeout(1_000).times(2)).handle(any());
            assertThat(listener.failedEvents()).isEqualTo(1);
            assertThat(listener.isConnected()).isTrue();
        }

        @Test
        @DisplayName("Should count a rejected payload as dropped rather than failed")
        void shouldCountRejectedPayloadAsDropped() {
            // Given
            doThrow(new MalformedPayloadException(MESSAGES, "Message without conversation_id"))
                    .when(messageHandler).handle(any());

            // When
            link.push(MESSAGES, "{\"content\":\"orphan\"}");
            link.push(NOTIFICATIONS, "{\"profile_id\":\"p1\"}");

            // Then
            verify(notificationHandler, timeout(1_000)).handle(any());
            assertThat(listener.droppedEvents()).isEqualTo(1);
            assertThat(listener.failedEvents()).isZero();
        }
    }

    @Nested
    @DisplayName("Reconnect Tests")
    class ReconnectTests {

        @Test
        @DisplayName("Should schedule exactly one reconnect after the link drops and resubscribe on it")
        void shouldReconnectAfterDrop() {
            // Given
            FakeLink first = new FakeLink();
            FakeLink second = new FakeLink();
            when(source.open()).thenReturn(first, second);
            listener.connect();

            // When
            first.fail(new ConnectionException("server closed the connection"));

            // Then
            ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
            verify(scheduler, timeout(1_000).times(1))
                    .schedule(task.capture(), eq(5_000L), eq(TimeUnit.MILLISECONDS));
            assertThat(listener.state()).isEqualTo(LinkState.DISCONNECTED);
            assertThat(first.forceClosed).isTrue();

            // When the scheduled attempt runs
            task.getValue().run();

            // Then
            assertThat(listener.isConnected()).isTrue();
            assertThat(second.subscribed).containsExactlyInAnyOrder(NOTIFICATIONS, MESSAGES);
            verify(scheduler, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        }

        @Test
        @DisplayName("Should cancel the pending reconnect on disconnect")
        void shouldCancelReconnectOnDisconnect() {
            // Given
            FakeLink link = new FakeLink();
            when(source.open()).thenReturn(link);
            listener.connect();
            link.fail(new ConnectionException("network reset"));
            verify(scheduler, timeout(1_000)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));

            // When
            listener.disconnect();

            // Then
            verify(reconnectFuture).cancel(false);
            assertThat(listener.isReconnectPending()).isFalse();
            assertThat(listener.state()).isEqualTo(LinkState.DISCONNECTED);
        }

        @Test
        @DisplayName("A disconnect racing with a starting reconnect should keep the listener stopped")
        void disconnectDuringReconnectShouldWin() {
            // Given
            when(source.open()).thenThrow(new ConnectionException("connection refused"));
            assertThatThrownBy(() -> listener.connect()).isInstanceOf(ConnectionException.class);
            ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
            verify(scheduler).schedule(task.capture(), anyLong(), any(TimeUnit.class));

            Logger logger = (Logger) LoggerFactory.getLogger(ChangeListener.class);
            AppenderBase<ILoggingEvent> disconnectOnReconnect = new AppenderBase<>() {
                @Override
                protected void append(ILoggingEvent event) {
                    if (event.getFormattedMessage().startsWith("Attempting change listener reconnect")) {
                        listener.disconnect();
                    }
                }
            };
            disconnectOnReconnect.start();
            logger.addAppender(disconnectOnReconnect);

            // When
            try {
                task.getValue().run();
            } finally {
                logger.detachAppender(disconnectOnReconnect);
            }

            // Then
            assertThat(listener.state()).isEqualTo(LinkState.DISCONNECTED);
            verify(source, times(1)).open();
            verify(scheduler, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        }
    }

    @Nested
    @DisplayName("Disconnect Tests")
    class DisconnectTests {

        @Test
        @DisplayName("Should close the link gracefully")
        void shouldCloseGracefully() {
            // Given
            FakeLink link = new FakeLink();
            when(source.open()).thenReturn(link);
            listener.connect();

            // When
            listener.disconnect();

            // Then
            assertThat(link.closed).isTrue();
            assertThat(listener.isConnected()).isFalse();
            verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        }

        @Test
        @DisplayName("Should time out a hanging close and still allow a forced close")
        void shouldFallBackToForceClose() {
            // Given
            FakeLink link = new FakeLink();
            link.closeGate = new CountDownLatch(1);
            when(source.open()).thenReturn(link);
            listener.connect();

            try {
                // When / Then
                assertThatThrownBy(() -> listener.disconnect())
                        .isInstanceOf(ConnectionException.class)
                        .hasMessageContaining("timed out");
                listener.forceClose();
                assertThat(link.forceClosed).isTrue();
            } finally {
                link.closeGate.countDown();
            }
        }
    }

    static final class FakeLink implements SubscriptionLink {

        final List<String> subscribed = new CopyOnWriteArrayList<>();
        final BlockingQueue<ChangeNotification> queue = new LinkedBlockingQueue<>();
        volatile RuntimeException failure;
        volatile RuntimeException subscribeFailure;
        volatile CountDownLatch closeGate;
        volatile boolean closed;
        volatile boolean forceClosed;

        void push(String channel, String payload) {
            queue.add(new ChangeNotification(channel, payload));
        }

        void fail(RuntimeException cause) {
            failure = cause;
        }

        @Override
        public void subscribe(String channel) {
            if (subscribeFailure != null) {
                throw subscribeFailure;
            }
            subscribed.add(channel);
        }

        @Override
        public List<ChangeNotification> poll(Duration timeout) {
            if (failure != null) {
                throw failure;
            }
            try {
                ChangeNotification next = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
                return next == null ? List.of() : List.of(next);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return List.of();
            }
        }

        @Override
        public void close() {
            CountDownLatch gate = closeGate;
            if (gate != null) {
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            closed = true;
        }

        @Override
        public void forceClose() {
            forceClosed = true;
        }
    }
}
