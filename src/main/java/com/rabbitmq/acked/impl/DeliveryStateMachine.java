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

import com.rabbitmq.acked.AckedException;
import com.rabbitmq.acked.ConsumerChannel;
import com.rabbitmq.acked.Delivery;
import com.rabbitmq.acked.ErrorReporting;
import com.rabbitmq.acked.Handler;
import com.rabbitmq.acked.RecoveryStrategy;
import com.rabbitmq.acked.Rejection;
import com.rabbitmq.acked.Result;
import com.rabbitmq.acked.metrics.MetricsCollector;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-subscription state machine tracking the deliveries handed to the handler.
 *
 * <p>Every message is processed on the machine's {@link EventLoop}, the state, the current
 * channel and the pending delivery set are only touched there. Handlers run on the handler
 * executor, their outcome comes back to the loop as an ack or a nack.
 */
final class DeliveryStateMachine {

  enum State {
    UNSUBSCRIBED,
    SUBSCRIBED,
    STOPPING,
    STOPPED
  }

  private static final Logger LOGGER = LoggerFactory.getLogger(DeliveryStateMachine.class);

  private final String name;
  private final String queue;
  private final Handler handler;
  private final RecoveryStrategy recoveryStrategy;
  private final ErrorReporting errorReporting;
  private final Executor handlerExecutor;
  private final MetricsCollector metricsCollector;
  private final EventLoop eventLoop;
  private final CompletableFuture<Void> stopped = new CompletableFuture<>();

  // event loop only
  private final Set<Long> pending = new HashSet<>();
  private String consumerTag;

  // written in the event loop only, volatile for observers
  private volatile State state = State.UNSUBSCRIBED;
  private volatile ConsumerChannel channel;
  private volatile int pendingCount = 0;
  private volatile Throwable failureCause;

  DeliveryStateMachine(
      String name,
      String queue,
      Handler handler,
      RecoveryStrategy recoveryStrategy,
      ErrorReporting errorReporting,
      ExecutorService loopExecutor,
      Executor handlerExecutor,
      MetricsCollector metricsCollector) {
    this.name = name;
    this.queue = queue;
    this.handler = handler;
    this.recoveryStrategy = recoveryStrategy;
    this.errorReporting = errorReporting;
    this.handlerExecutor = handlerExecutor;
    this.metricsCollector = metricsCollector;
    this.eventLoop = new EventLoop("delivery-state-machine-" + name, loopExecutor);
  }

  /**
   * Register the consumer on the channel.
   *
   * @param channel the channel to consume from
   * @return a future completing once the subscription has been processed
   */
  CompletableFuture<Void> subscribe(ConsumerChannel channel) {
    CompletableFuture<Void> result = new CompletableFuture<>();
    if (!this.submit(
        () -> {
          try {
            this.doSubscribe(channel);
          } finally {
            result.complete(null);
          }
        })) {
      result.complete(null);
    }
    return result;
  }

  /** Cancel the consumer, in-flight deliveries are still tracked. */
  CompletableFuture<Void> unsubscribe() {
    CompletableFuture<Void> result = new CompletableFuture<>();
    if (!this.submit(() -> this.doUnsubscribe(result))) {
      result.complete(null);
    }
    return result;
  }

  /** Stop consuming and stop once every pending delivery has been settled. */
  void shutdown() {
    this.submit(this::doShutdown);
  }

  /** Stop immediately, pending deliveries are left to the broker. */
  void abort() {
    this.submit(this::doAbort);
  }

  void rejectOrAck(boolean ack, long deliveryTag, ConsumerChannel channel) {
    this.submit(() -> this.doRejectOrAck(ack, deliveryTag, channel));
  }

  CompletableFuture<Void> stopped() {
    return this.stopped;
  }

  State state() {
    return this.state;
  }

  ConsumerChannel channel() {
    return this.channel;
  }

  int pendingCount() {
    return this.pendingCount;
  }

  Throwable failureCause() {
    return this.failureCause;
  }

  private boolean submit(Runnable task) {
    return this.eventLoop.submit(task);
  }

  private void doSubscribe(ConsumerChannel newChannel) {
    switch (this.state) {
      case UNSUBSCRIBED:
      case SUBSCRIBED:
        if (newChannel != this.channel) {
          if (this.channel != null) {
            LOGGER.debug(
                "Subscription '{}' moving to a new channel, forgetting {} pending deliveries",
                this.name,
                this.pending.size());
          }
          this.cancelQuietly();
          this.pending.clear();
          this.pendingCount = 0;
          this.channel = newChannel;
        } else if (this.consumerTag != null) {
          LOGGER.debug("Subscription '{}' already consuming on this channel", this.name);
          return;
        }
        try {
          this.consumerTag =
              newChannel.consume(this.queue, delivery -> this.onDelivery(newChannel, delivery));
          this.state = State.SUBSCRIBED;
          LOGGER.debug(
              "Subscription '{}' consuming from '{}' with consumer tag {}",
              this.name,
              this.queue,
              this.consumerTag);
        } catch (Exception e) {
          LOGGER.warn("Error while subscribing '{}' to queue '{}'", this.name, this.queue, e);
          this.stop(e);
        }
        break;
      case STOPPING:
        if (newChannel != this.channel) {
          LOGGER.debug("Subscription '{}' got a new channel while stopping, stopping", this.name);
          this.pending.clear();
          this.pendingCount = 0;
          this.channel = newChannel;
          this.stop(null);
        }
        break;
      default:
        LOGGER.debug("Subscription '{}' is stopped, ignoring subscribe", this.name);
    }
  }

  private void doUnsubscribe(CompletableFuture<Void> result) {
    if (this.state == State.SUBSCRIBED) {
      this.cancelQuietly();
    }
    result.complete(null);
  }

  private void doShutdown() {
    switch (this.state) {
      case UNSUBSCRIBED:
        this.stop(null);
        break;
      case SUBSCRIBED:
        this.cancelQuietly();
        if (this.pending.isEmpty()) {
          this.stop(null);
        } else {
          LOGGER.debug(
              "Subscription '{}' draining {} pending deliveries", this.name, this.pending.size());
          this.state = State.STOPPING;
        }
        break;
      default:
        break;
    }
  }

  private void doAbort() {
    if (this.state != State.STOPPED) {
      this.cancelQuietly();
      if (!this.pending.isEmpty()) {
        LOGGER.debug(
            "Subscription '{}' aborted with {} pending deliveries", this.name, this.pending.size());
      }
      this.pending.clear();
      this.pendingCount = 0;
      this.stop(null);
    }
  }

  private void onDelivery(ConsumerChannel deliveryChannel, Delivery delivery) {
    if (!this.submit(() -> this.handleDelivery(deliveryChannel, delivery))) {
      LOGGER.debug(
          "Subscription '{}' is stopped, ignoring delivery {}", this.name, delivery.deliveryTag());
    }
  }

  private void handleDelivery(ConsumerChannel deliveryChannel, Delivery delivery) {
    if (deliveryChannel != this.channel) {
      LOGGER.debug(
          "Ignoring delivery {} from a previous channel of subscription '{}'",
          delivery.deliveryTag(),
          this.name);
      return;
    }
    switch (this.state) {
      case SUBSCRIBED:
        this.pending.add(delivery.deliveryTag());
        this.pendingCount = this.pending.size();
        this.metricsCollector.consume();
        this.dispatch(deliveryChannel, delivery);
        break;
      case STOPPING:
        // not handed to the handler, the broker delivers it again
        this.settleQuietly(deliveryChannel, delivery.deliveryTag(), false);
        break;
      default:
        LOGGER.debug(
            "Subscription '{}' in state {}, ignoring delivery {}",
            this.name,
            this.state,
            delivery.deliveryTag());
    }
  }

  private void dispatch(ConsumerChannel deliveryChannel, Delivery delivery) {
    long deliveryTag = delivery.deliveryTag();
    CompletableFuture<Boolean> decision;
    try {
      decision =
          CompletableFuture.supplyAsync(() -> this.runHandler(delivery), this.handlerExecutor)
              .thenCompose(Function.identity())
              .handle(DeliveryStateMachine::interpretHandlerOutcome)
              .thenCompose(result -> this.decide(result, deliveryChannel, delivery));
    } catch (Exception e) {
      this.dispatchFailed(deliveryChannel, delivery, e);
      return;
    }
    decision.whenComplete(
        (ack, throwable) -> {
          if (throwable == null && ack != null) {
            this.rejectOrAck(ack, deliveryTag, deliveryChannel);
          } else {
            Throwable cause =
                throwable == null
                    ? new AckedException("Recovery strategy completed without a decision")
                    : Utils.unwrap(throwable);
            this.dispatchFailed(deliveryChannel, delivery, cause);
          }
        });
  }

  private CompletableFuture<Result> runHandler(Delivery delivery) {
    try {
      CompletionStage<Result> result = this.handler.handle(delivery);
      if (result == null) {
        return CompletableFuture.completedFuture(
            Result.rejected(
                Rejection.unhandled(
                    "Error while running handler",
                    new AckedException("Handler returned no result"))));
      } else {
        return result.toCompletableFuture();
      }
    } catch (Exception e) {
      return CompletableFuture.completedFuture(
          Result.rejected(Rejection.unhandled("Error while running handler", e)));
    }
  }

  private static Result interpretHandlerOutcome(Result result, Throwable throwable) {
    if (throwable != null) {
      return Result.rejected(
          Rejection.unhandled(
              "Unhandled exception occurred in async acking future", Utils.unwrap(throwable)));
    } else if (result == null) {
      return Result.rejected(
          Rejection.unhandled(
              "Unhandled exception occurred in async acking future",
              new AckedException("Handler completed without a result")));
    } else {
      return result;
    }
  }

  private CompletionStage<Boolean> decide(
      Result result, ConsumerChannel deliveryChannel, Delivery delivery) {
    if (result.isSuccess()) {
      return CompletableFuture.completedFuture(true);
    }
    Rejection rejection = result.rejection();
    if (rejection instanceof Rejection.Nack) {
      LOGGER.debug(
          "Delivery {} of subscription '{}' rejected: {}",
          delivery.deliveryTag(),
          this.name,
          rejection.message());
      return CompletableFuture.completedFuture(false);
    }
    Throwable cause;
    if (rejection instanceof Rejection.Extract) {
      cause =
          new AckedException.ExtractException(
              rejection.message(), ((Rejection.Extract) rejection).cause());
      this.report("Could not extract required data", cause, delivery);
    } else {
      cause = ((Rejection.UnhandledException) rejection).cause();
      this.report(rejection.message(), cause, delivery);
    }
    try {
      CompletionStage<Boolean> recovery =
          this.recoveryStrategy.recover(cause, deliveryChannel, this.queue, delivery);
      if (recovery == null) {
        return Utils.failedFuture(new AckedException("Recovery strategy returned no decision"));
      }
      return recovery;
    } catch (Exception e) {
      return Utils.failedFuture(e);
    }
  }

  private void dispatchFailed(
      ConsumerChannel deliveryChannel, Delivery delivery, Throwable cause) {
    LOGGER.error(
        "Error while processing delivery {} of subscription '{}', shutting down consumer",
        delivery.deliveryTag(),
        this.name,
        cause);
    this.report("Error while processing delivery, shutting down consumer", cause, delivery);
    this.rejectOrAck(false, delivery.deliveryTag(), deliveryChannel);
    this.shutdown();
  }

  private void report(String message, Throwable cause, Delivery delivery) {
    try {
      this.errorReporting.report(this.name, message, cause, delivery);
    } catch (Exception e) {
      LOGGER.warn("Error while reporting error for subscription '{}'", this.name, e);
    }
  }

  private void doRejectOrAck(boolean ack, long deliveryTag, ConsumerChannel deliveryChannel) {
    if (this.state == State.STOPPED) {
      return;
    }
    if (deliveryChannel != this.channel) {
      LOGGER.debug(
          "Ignoring settlement of delivery {} from a previous channel of subscription '{}'",
          deliveryTag,
          this.name);
      return;
    }
    if (!this.pending.remove(deliveryTag)) {
      LOGGER.debug(
          "Delivery {} is not pending for subscription '{}', ignoring settlement",
          deliveryTag,
          this.name);
      return;
    }
    this.pendingCount = this.pending.size();
    this.settleQuietly(deliveryChannel, deliveryTag, ack);
    if (this.state == State.STOPPING && this.pending.isEmpty()) {
      this.stop(null);
    }
  }

  private void settleQuietly(ConsumerChannel deliveryChannel, long deliveryTag, boolean ack) {
    try {
      if (ack) {
        deliveryChannel.ack(deliveryTag);
        this.metricsCollector.consumeDisposition(MetricsCollector.ConsumeDisposition.ACCEPTED);
      } else {
        deliveryChannel.nack(deliveryTag, true);
        this.metricsCollector.consumeDisposition(MetricsCollector.ConsumeDisposition.REQUEUED);
      }
    } catch (Exception e) {
      LOGGER.warn(
          "Error while {} delivery {} of subscription '{}'",
          ack ? "acking" : "nacking",
          deliveryTag,
          this.name,
          e);
    }
  }

  private void cancelQuietly() {
    String tag = this.consumerTag;
    this.consumerTag = null;
    if (tag != null && this.channel != null) {
      try {
        this.channel.cancel(tag);
      } catch (Exception e) {
        LOGGER.warn("Error while cancelling consumer {} of subscription '{}'", tag, this.name, e);
      }
    }
  }

  private void stop(Throwable cause) {
    this.failureCause = cause;
    this.state = State.STOPPED;
    this.eventLoop.close();
    LOGGER.debug("Subscription '{}' stopped", this.name);
    this.stopped.complete(null);
  }
}
