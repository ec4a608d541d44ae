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

import static com.rabbitmq.acked.Resource.State.CLOSED;
import static com.rabbitmq.acked.Resource.State.OPEN;
import static com.rabbitmq.acked.Resource.State.OPENING;
import static com.rabbitmq.acked.Resource.State.RECOVERING;

import com.rabbitmq.acked.AckedException;
import com.rabbitmq.acked.Binding;
import com.rabbitmq.acked.ConsumerChannel;
import com.rabbitmq.acked.Subscription;
import com.rabbitmq.acked.metrics.MetricsCollector;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AckedSubscription extends ResourceBase implements Subscription {

  private static final Logger LOGGER = LoggerFactory.getLogger(AckedSubscription.class);

  private final AckedEnvironment environment;
  private final String name;
  private final Binding binding;
  private final Duration defaultCloseTimeout;
  private final MetricsCollector metricsCollector;
  private final DeliveryStateMachine stateMachine;
  private final CompletableFuture<Void> initialized = new CompletableFuture<>();
  private final CompletableFuture<Duration> closing = new CompletableFuture<>();
  private final CompletableFuture<Void> aborting = new CompletableFuture<>();
  private final CompletableFuture<Void> closed = new CompletableFuture<>();
  private volatile ConsumerChannel channel;
  private volatile Throwable initializationFailure;

  AckedSubscription(AckedSubscriptionBuilder builder) {
    super(builder.listeners());
    this.environment = builder.environment();
    this.name = builder.name() == null ? Utils.NAME_SUPPLIER.get() : builder.name();
    this.binding = builder.binding();
    this.defaultCloseTimeout = builder.closeTimeout();
    this.metricsCollector = this.environment.metricsCollector();
    this.stateMachine =
        new DeliveryStateMachine(
            this.name,
            this.binding.queueName(),
            builder.handler(),
            builder.recoveryStrategy(),
            builder.errorReporting(),
            this.environment.executorService(),
            this.environment.handlerExecutorService(),
            this.metricsCollector);
    this.metricsCollector.openConsumer();
  }

  void start() {
    this.stateMachine
        .stopped()
        .whenCompleteAsync((ignored, ex) -> this.onStopped(), this.environment.executorService());
    try {
      this.environment.executorService().execute(this::initialize);
    } catch (RejectedExecutionException e) {
      this.initializationFailed(e);
    }
  }

  private void initialize() {
    try {
      ConsumerChannel newChannel = this.environment.channelFactory().create();
      this.channel = newChannel;
      if (this.stateMachine.stopped().isDone()) {
        closeQuietly(newChannel);
        this.initialized.completeExceptionally(
            new AckedException.AckedResourceClosedException(
                "Subscription closed before initialization"));
        return;
      }
      LOGGER.debug("Declaring {} for subscription '{}'", this.binding, this.name);
      this.binding.declare(newChannel);
      this.initialized.complete(null);
      this.stateMachine.subscribe(newChannel);
      this.compareAndSetState(OPENING, OPEN);
    } catch (Exception e) {
      this.initializationFailed(e);
    }
  }

  private void initializationFailed(Exception e) {
    LOGGER.warn("Error while initializing subscription '{}'", this.name, e);
    this.initializationFailure = e;
    this.initialized.completeExceptionally(e);
    this.stateMachine.abort();
  }

  private void onStopped() {
    ConsumerChannel machineChannel = this.stateMachine.channel();
    closeQuietly(machineChannel);
    ConsumerChannel lastChannel = this.channel;
    if (lastChannel != machineChannel) {
      closeQuietly(lastChannel);
    }
    Throwable cause =
        this.initializationFailure == null
            ? this.stateMachine.failureCause()
            : this.initializationFailure;
    this.environment.removeSubscription(this);
    this.metricsCollector.closeConsumer();
    this.state(CLOSED, cause);
    LOGGER.debug("Subscription '{}' closed", this.name);
    this.closed.complete(null);
  }

  private static void closeQuietly(ConsumerChannel channel) {
    if (channel != null) {
      try {
        channel.close();
      } catch (Exception e) {
        LOGGER.warn("Error while closing channel", e);
      }
    }
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public String queue() {
    return this.binding.queueName();
  }

  @Override
  public CompletableFuture<Void> initialized() {
    return this.initialized;
  }

  @Override
  public CompletableFuture<Duration> closing() {
    return this.closing;
  }

  @Override
  public CompletableFuture<Void> aborting() {
    return this.aborting;
  }

  @Override
  public CompletableFuture<Void> closed() {
    return this.closed;
  }

  @Override
  public void close() {
    this.close(this.defaultCloseTimeout);
  }

  @Override
  public void close(Duration timeout) {
    if (this.closing.complete(timeout)) {
      LOGGER.debug("Closing subscription '{}' with a timeout of {}", this.name, timeout);
      if (!this.closed.isDone()) {
        this.startClosing(timeout);
      }
      this.stateMachine.shutdown();
      ScheduledFuture<?> deadline;
      try {
        deadline =
            this.environment
                .scheduledExecutorService()
                .schedule(this::forceClose, timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException e) {
        LOGGER.warn("Could not schedule close deadline of subscription '{}'", this.name, e);
        this.abort();
        return;
      }
      this.closed.whenComplete((ignored, ex) -> deadline.cancel(false));
    }
  }

  private void forceClose() {
    if (!this.closed.isDone()) {
      LOGGER.warn(
          "Subscription '{}' did not close within {}, aborting with {} pending deliveries",
          this.name,
          this.closing.getNow(this.defaultCloseTimeout),
          this.stateMachine.pendingCount());
      this.abort();
    }
  }

  @Override
  public void abort() {
    if (this.aborting.complete(null)) {
      LOGGER.debug("Aborting subscription '{}'", this.name);
      if (!this.closed.isDone()) {
        this.startClosing(Duration.ZERO);
      }
      this.stateMachine.abort();
    }
  }

  @Override
  public void pause() {
    this.checkOpen();
    this.stateMachine.unsubscribe();
  }

  @Override
  public void unpause() {
    this.checkOpen();
    this.stateMachine.subscribe(this.stateMachine.channel());
  }

  @Override
  public int pendingDeliveryCount() {
    return this.stateMachine.pendingCount();
  }

  @Override
  public void resubscribe(ConsumerChannel newChannel) {
    this.checkOpen();
    ConsumerChannel previous = this.channel;
    this.channel = newChannel;
    this.state(RECOVERING);
    this.stateMachine
        .subscribe(newChannel)
        .whenComplete(
            (ignored, ex) -> {
              if (previous != newChannel) {
                closeQuietly(previous);
              }
              this.compareAndSetState(RECOVERING, OPEN);
            });
  }

  DeliveryStateMachine.State deliveryState() {
    return this.stateMachine.state();
  }

  @Override
  public String toString() {
    return "AckedSubscription{" + "name='" + name + '\'' + ", queue='" + queue() + '\'' + '}';
  }
}
