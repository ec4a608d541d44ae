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
import com.rabbitmq.acked.ChannelFactory;
import com.rabbitmq.acked.Environment;
import com.rabbitmq.acked.SubscriptionBuilder;
import com.rabbitmq.acked.metrics.MetricsCollector;
import com.rabbitmq.acked.metrics.NoOpMetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class AckedEnvironment implements Environment {

  private static final Logger LOGGER = LoggerFactory.getLogger(AckedEnvironment.class);
  private static final AtomicLong ID_SEQUENCE = new AtomicLong(0);
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

  private final long id;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final boolean internalExecutor;
  private final boolean internalHandlerExecutor;
  private final boolean internalScheduledExecutor;
  private final ExecutorService executorService;
  private final ExecutorService handlerExecutorService;
  private final ScheduledExecutorService scheduledExecutorService;
  private final MetricsCollector metricsCollector;
  private final ChannelFactory channelFactory;
  private final Set<AckedSubscription> subscriptions = ConcurrentHashMap.newKeySet();

  AckedEnvironment(
      ExecutorService executorService,
      ExecutorService handlerExecutorService,
      ScheduledExecutorService scheduledExecutorService,
      MetricsCollector metricsCollector,
      ChannelFactory channelFactory) {
    this.id = ID_SEQUENCE.getAndIncrement();
    String threadPrefix = String.format("rabbitmq-acked-environment-%d-", this.id);
    if (executorService == null) {
      this.executorService = Executors.newCachedThreadPool(Utils.threadFactory(threadPrefix));
      this.internalExecutor = true;
    } else {
      this.executorService = executorService;
      this.internalExecutor = false;
    }
    if (handlerExecutorService == null) {
      this.handlerExecutorService = Utils.executorService(threadPrefix + "handler-");
      this.internalHandlerExecutor = true;
    } else {
      this.handlerExecutorService = handlerExecutorService;
      this.internalHandlerExecutor = false;
    }
    if (scheduledExecutorService == null) {
      this.scheduledExecutorService =
          Executors.newScheduledThreadPool(1, Utils.threadFactory(threadPrefix + "scheduler-"));
      this.internalScheduledExecutor = true;
    } else {
      this.scheduledExecutorService = scheduledExecutorService;
      this.internalScheduledExecutor = false;
    }
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    this.channelFactory = channelFactory;
  }

  @Override
  public SubscriptionBuilder subscriptionBuilder() {
    this.checkNotClosed();
    return new AckedSubscriptionBuilder(this);
  }

  AckedSubscription subscription(AckedSubscriptionBuilder builder) {
    this.checkNotClosed();
    AckedSubscription subscription = new AckedSubscription(builder);
    this.subscriptions.add(subscription);
    subscription.start();
    return subscription;
  }

  void removeSubscription(AckedSubscription subscription) {
    this.subscriptions.remove(subscription);
  }

  @Override
  public void close() {
    if (this.closed.compareAndSet(false, true)) {
      LOGGER.debug("Closing environment {}", this.id);
      List<CompletableFuture<Void>> closedSubscriptions = new ArrayList<>();
      for (AckedSubscription subscription : this.subscriptions) {
        subscription.abort();
        closedSubscriptions.add(subscription.closed());
      }
      try {
        CompletableFuture.allOf(closedSubscriptions.toArray(new CompletableFuture<?>[0]))
            .get(CLOSE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (ExecutionException | TimeoutException e) {
        LOGGER.warn("Error while waiting for subscriptions of environment {} to close", this.id, e);
      }
      if (this.internalExecutor) {
        this.executorService.shutdownNow();
      }
      if (this.internalHandlerExecutor) {
        this.handlerExecutorService.shutdownNow();
      }
      if (this.internalScheduledExecutor) {
        this.scheduledExecutorService.shutdownNow();
      }
      LOGGER.debug("Environment {} has been closed", this.id);
    }
  }

  private void checkNotClosed() {
    if (this.closed.get()) {
      throw new AckedException.AckedResourceClosedException("Environment is closed");
    }
  }

  ExecutorService executorService() {
    return this.executorService;
  }

  ExecutorService handlerExecutorService() {
    return this.handlerExecutorService;
  }

  ScheduledExecutorService scheduledExecutorService() {
    return this.scheduledExecutorService;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  ChannelFactory channelFactory() {
    return this.channelFactory;
  }

  int subscriptionCount() {
    return this.subscriptions.size();
  }

  @Override
  public String toString() {
    return "AckedEnvironment{" + "id=" + id + '}';
  }
}
