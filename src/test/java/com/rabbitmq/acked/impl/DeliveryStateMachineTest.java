// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.acked.impl;

import static com.rabbitmq.acked.impl.TestUtils.waitAtMost;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.acked.AckedException;
import com.rabbitmq.acked.ConsumerChannel;
import com.rabbitmq.acked.Delivery;
import com.rabbitmq.acked.ErrorReporting;
import com.rabbitmq.acked.Handler;
import com.rabbitmq.acked.RecoveryStrategy;
import com.rabbitmq.acked.Rejection;
import com.rabbitmq.acked.Result;
import com.rabbitmq.acked.metrics.MetricsCollector;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class DeliveryStateMachineTest {

  static final Duration TIMEOUT = TestUtils.DEFAULT_CONDITION_TIMEOUT;

  static ExecutorService executorService;

  @Mock ErrorReporting errorReporting;
  @Mock MetricsCollector metricsCollector;

  AutoCloseable mocks;
  TestChannel channel;
  Map<String, CompletableFuture<Result>> outcomes;
  AtomicInteger handlerCalls;
  DeliveryStateMachine machine;

  @BeforeAll
  static void beforeAll() {
    executorService = Executors.newCachedThreadPool();
  }

  @AfterAll
  static void afterAll() {
    executorService.shutdownNow();
  }

  @BeforeEach
  void init() {
    mocks = MockitoAnnotations.openMocks(this);
    channel = new TestChannel();
    outcomes = new ConcurrentHashMap<>();
    handlerCalls = new AtomicInteger(0);
  }

  @AfterEach
  void tearDown() throws Exception {
    if (machine != null) {
      machine.abort();
    }
    mocks.close();
  }

  @Test
  void successfulHandlerAcksDelivery() {
    machine = machine(d -> Result.completedSuccess());
    subscribe(channel);
    long tag = channel.deliver("hello");
    waitAtMost(() -> channel.acked.contains(tag));
    assertThat(channel.nacked).isEmpty();
    assertThat(machine.pendingCount()).isZero();
    verify(metricsCollector).consume();
    verify(metricsCollector).consumeDisposition(MetricsCollector.ConsumeDisposition.ACCEPTED);
  }

  @Test
  void nackRejectionRequeuesWithoutReportOrRecovery() {
    RecoveryStrategy recoveryStrategy = mock(RecoveryStrategy.class);
    machine =
        machine(d -> Result.completedRejection(Rejection.nack("not now")), recoveryStrategy);
    subscribe(channel);
    long tag = channel.deliver("hello");
    waitAtMost(() -> channel.nacked.contains(tag));
    assertThat(channel.acked).isEmpty();
    verify(errorReporting, never()).report(anyString(), anyString(), any(), any());
    verify(recoveryStrategy, never()).recover(any(), any(), anyString(), any());
    verify(metricsCollector).consumeDisposition(MetricsCollector.ConsumeDisposition.REQUEUED);
  }

  @Test
  void unhandledRejectionIsReportedAndRecoveryDecides() {
    IllegalStateException failure = new IllegalStateException("expected in test");
    machine =
        machine(
            d -> Result.completedRejection(Rejection.unhandled("boom", failure)),
            RecoveryStrategy.drop());
    subscribe(channel);
    long tag = channel.deliver("hello");
    waitAtMost(() -> channel.acked.contains(tag));
    verify(errorReporting).report(eq("test"), eq("boom"), eq(failure), any());
    assertThat(channel.nacked).isEmpty();
  }

  @Test
  void unhandledRejectionWithNackRecoveryRequeues() {
    machine =
        machine(
            d ->
                Result.completedRejection(
                    Rejection.unhandled("boom", new IllegalStateException("expected in test"))),
            RecoveryStrategy.nack());
    subscribe(channel);
    long tag = channel.deliver("hello");
    waitAtMost(() -> channel.nacked.contains(tag));
    verify(errorReporting).report(eq("test"), eq("boom"), isA(IllegalStateException.class), any());
  }

  @Test
  void extractRejectionIsReportedWithExtractException() {
    RecoveryStrategy recoveryStrategy = mock(RecoveryStrategy.class);
    when(recoveryStrategy.recover(any(), any(), anyString(), any()))
        .thenReturn(CompletableFuture.completedFuture(false));
    Handler handler =
        Handler.decoding(
            d -> {
              throw new IllegalArgumentException("not a number");
            },
            (Integer value, Delivery d) -> Result.completedSuccess());
    machine = machine(handler, recoveryStrategy);
    subscribe(channel);
    long tag = channel.deliver("not a number");
    waitAtMost(() -> channel.nacked.contains(tag));
    verify(errorReporting)
        .report(
            eq("test"),
            eq("Could not extract required data"),
            isA(AckedException.ExtractException.class),
            any());
    verify(recoveryStrategy)
        .recover(isA(AckedException.ExtractException.class), eq(channel), eq("queue"), any());
  }

  @Test
  void handlerThrowingIsAnUnhandledException() {
    machine =
        machine(
            d -> {
              throw new IOException("expected in test");
            });
    subscribe(channel);
    long tag = channel.deliver("hello");
    waitAtMost(() -> channel.nacked.contains(tag));
    verify(errorReporting)
        .report(eq("test"), eq("Error while running handler"), isA(IOException.class), any());
  }

  @Test
  void failedHandlerFutureIsAnUnhandledException() {
    machine =
        machine(
            d ->
                CompletableFuture.<Result>supplyAsync(
                    () -> {
                      throw new IllegalStateException("expected in test");
                    }));
    subscribe(channel);
    long tag = channel.deliver("hello");
    waitAtMost(() -> channel.nacked.contains(tag));
    verify(errorReporting)
        .report(
            eq("test"),
            eq("Unhandled exception occurred in async acking future"),
            isA(IllegalStateException.class),
            any());
  }

  @Test
  void failingRecoveryStrategyNacksAndShutsDownConsumer() {
    RecoveryStrategy recoveryStrategy =
        (error, ch, queue, delivery) -> {
          throw new IllegalStateException("expected in test");
        };
    machine =
        machine(
            d ->
                Result.completedRejection(
                    Rejection.unhandled("boom", new RuntimeException("expected in test"))),
            recoveryStrategy);
    subscribe(channel);
    long tag = channel.deliver("hello");
    waitAtMost(() -> channel.nacked.contains(tag));
    assertThat(machine.stopped()).succeedsWithin(TIMEOUT);
    assertThat(machine.state()).isEqualTo(DeliveryStateMachine.State.STOPPED);
    assertThat(channel.cancelled).hasSize(1);
  }

  @Test
  void shutdownWithoutPendingDeliveriesStopsImmediately() {
    machine = machine(d -> Result.completedSuccess());
    subscribe(channel);
    machine.shutdown();
    assertThat(machine.stopped()).succeedsWithin(TIMEOUT);
    assertThat(channel.cancelled).hasSize(1);
    assertThat(channel.hasConsumer()).isFalse();
  }

  @Test
  void shutdownBeforeSubscribeStops() {
    machine = machine(d -> Result.completedSuccess());
    machine.shutdown();
    assertThat(machine.stopped()).succeedsWithin(TIMEOUT);
    assertThat(machine.state()).isEqualTo(DeliveryStateMachine.State.STOPPED);
  }

  @Test
  void shutdownDrainsPendingDeliveries() {
    machine = machine(this::pendingOutcome);
    subscribe(channel);
    long tag1 = channel.deliver("1");
    long tag2 = channel.deliver("2");
    waitAtMost(() -> outcomes.size() == 2);

    machine.shutdown();
    waitAtMost(() -> machine.state() == DeliveryStateMachine.State.STOPPING);
    assertThat(machine.pendingCount()).isEqualTo(2);

    outcomes.get("1").complete(Result.success());
    waitAtMost(() -> channel.acked.contains(tag1));
    assertThat(machine.stopped()).isNotDone();

    outcomes.get("2").complete(Result.success());
    waitAtMost(() -> channel.acked.contains(tag2));
    assertThat(machine.stopped()).succeedsWithin(TIMEOUT);
    assertThat(machine.pendingCount()).isZero();
  }

  @Test
  void deliveryWhileStoppingIsRequeuedWithoutCallingHandler() {
    machine = machine(this::pendingOutcome);
    subscribe(channel);
    channel.deliver("1");
    waitAtMost(() -> outcomes.size() == 1);
    ConsumerChannel.DeliveryCallback callback = channel.consumers.values().iterator().next();

    machine.shutdown();
    waitAtMost(() -> machine.state() == DeliveryStateMachine.State.STOPPING);
    // in flight when the consumer got cancelled
    callback.handle(new Delivery("ctag-1", 42, new byte[0]));
    waitAtMost(() -> channel.nacked.contains(42L));
    assertThat(handlerCalls).hasValue(1);

    outcomes.get("1").complete(Result.success());
    assertThat(machine.stopped()).succeedsWithin(TIMEOUT);
  }

  @Test
  void abortDiscardsPendingDeliveries() {
    machine = machine(this::pendingOutcome);
    subscribe(channel);
    channel.deliver("1");
    waitAtMost(() -> outcomes.size() == 1);

    machine.abort();
    assertThat(machine.stopped()).succeedsWithin(TIMEOUT);
    assertThat(machine.pendingCount()).isZero();

    outcomes.get("1").complete(Result.success());
    // settlement after stop is ignored
    machine.rejectOrAck(true, 1, channel);
    assertThat(channel.acked).isEmpty();
    assertThat(channel.nacked).isEmpty();
  }

  @Test
  void unsubscribeKeepsTrackingInFlightDeliveries() {
    machine = machine(this::pendingOutcome);
    subscribe(channel);
    long tag = channel.deliver("1");
    waitAtMost(() -> outcomes.size() == 1);

    assertThat(machine.unsubscribe()).succeedsWithin(TIMEOUT);
    assertThat(channel.hasConsumer()).isFalse();
    assertThat(machine.state()).isEqualTo(DeliveryStateMachine.State.SUBSCRIBED);

    outcomes.get("1").complete(Result.success());
    waitAtMost(() -> channel.acked.contains(tag));

    subscribe(channel);
    assertThat(channel.hasConsumer()).isTrue();
    // same channel, already consuming: no second consumer
    subscribe(channel);
    assertThat(channel.consumers).hasSize(1);
  }

  @Test
  void subscribeOnNewChannelForgetsPendingDeliveries() {
    machine = machine(this::pendingOutcome);
    subscribe(channel);
    channel.deliver("1");
    waitAtMost(() -> outcomes.size() == 1);
    assertThat(machine.pendingCount()).isEqualTo(1);

    TestChannel newChannel = new TestChannel();
    subscribe(newChannel);
    assertThat(machine.pendingCount()).isZero();
    assertThat(machine.channel()).isSameAs(newChannel);

    // the old channel is gone, its deliveries are redelivered by the broker
    outcomes.get("1").complete(Result.success());
    long tag = newChannel.deliver("2");
    waitAtMost(() -> outcomes.size() == 2);
    outcomes.get("2").complete(Result.success());
    waitAtMost(() -> newChannel.acked.contains(tag));
    assertThat(channel.acked).isEmpty();
  }

  @Test
  void subscriptionFailureStopsWithCause() {
    machine = machine(d -> Result.completedSuccess());
    IOException failure = new IOException("expected in test");
    channel.consumeFailure = failure;
    machine.subscribe(channel);
    assertThat(machine.stopped()).succeedsWithin(TIMEOUT);
    assertThat(machine.failureCause()).isSameAs(failure);
  }

  @Test
  void ackFailureIsSwallowed() {
    machine = machine(d -> Result.completedSuccess());
    subscribe(channel);
    channel.ackFailure = new IOException("expected in test");
    channel.deliver("1");
    waitAtMost(() -> machine.pendingCount() == 0);
    channel.ackFailure = null;
    long tag = channel.deliver("2");
    waitAtMost(() -> channel.acked.contains(tag));
    assertThat(machine.state()).isEqualTo(DeliveryStateMachine.State.SUBSCRIBED);
  }

  private CompletableFuture<Result> pendingOutcome(Delivery delivery) {
    CompletableFuture<Result> outcome = new CompletableFuture<>();
    outcomes.put(delivery.bodyAsString(), outcome);
    return outcome;
  }

  private void subscribe(ConsumerChannel ch) {
    assertThat(machine.subscribe(ch)).succeedsWithin(TIMEOUT);
  }

  private DeliveryStateMachine machine(Handler handler) {
    return machine(handler, RecoveryStrategy.nack());
  }

  private DeliveryStateMachine machine(Handler handler, RecoveryStrategy recoveryStrategy) {
    Handler counting =
        d -> {
          handlerCalls.incrementAndGet();
          return handler.handle(d);
        };
    return new DeliveryStateMachine(
        "test",
        "queue",
        counting,
        recoveryStrategy,
        errorReporting,
        executorService,
        executorService,
        metricsCollector);
  }
}
