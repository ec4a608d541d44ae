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

import com.rabbitmq.acked.ChannelFactory;
import com.rabbitmq.acked.Environment;
import com.rabbitmq.acked.EnvironmentBuilder;
import com.rabbitmq.acked.metrics.MetricsCollector;
import com.rabbitmq.acked.metrics.NoOpMetricsCollector;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/** Builder to create an {@link Environment} instance. */
public class AckedEnvironmentBuilder implements EnvironmentBuilder {

  private ExecutorService executorService;
  private ExecutorService handlerExecutorService;
  private ScheduledExecutorService scheduledExecutorService;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private ChannelFactory channelFactory;

  public AckedEnvironmentBuilder() {}

  /**
   * Set executor service used for internal tasks (subscription event loops, binding
   * declaration).
   *
   * <p>Each subscription keeps a thread of this executor busy while it is open, so the executor
   * must be able to grow. The library uses a cached thread pool by default.
   *
   * <p>It is the developer's responsibility to shut down the executor when it is no longer needed.
   *
   * @param executorService the executor service
   * @return this builder instance
   */
  public AckedEnvironmentBuilder executorService(ExecutorService executorService) {
    this.executorService = executorService;
    return this;
  }

  /**
   * Set executor service handlers run on.
   *
   * <p>It is the developer's responsibility to shut down the executor when it is no longer needed.
   *
   * @param handlerExecutorService the executor service
   * @return this builder instance
   */
  public AckedEnvironmentBuilder handlerExecutorService(ExecutorService handlerExecutorService) {
    this.handlerExecutorService = handlerExecutorService;
    return this;
  }

  /**
   * Set scheduled executor service used for close deadlines.
   *
   * @param scheduledExecutorService the scheduled executor service
   * @return this builder instance
   */
  public AckedEnvironmentBuilder scheduledExecutorService(
      ScheduledExecutorService scheduledExecutorService) {
    this.scheduledExecutorService = scheduledExecutorService;
    return this;
  }

  /**
   * Set up a {@link MetricsCollector}.
   *
   * @param metricsCollector the metrics collector
   * @return this builder instance
   * @see com.rabbitmq.acked.metrics.MicrometerMetricsCollector
   */
  public AckedEnvironmentBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector = metricsCollector;
    return this;
  }

  @Override
  public AckedEnvironmentBuilder channelFactory(ChannelFactory channelFactory) {
    this.channelFactory = channelFactory;
    return this;
  }

  @Override
  public Environment build() {
    if (this.channelFactory == null) {
      throw new IllegalArgumentException("A channel factory must be set");
    }
    return new AckedEnvironment(
        this.executorService,
        this.handlerExecutorService,
        this.scheduledExecutorService,
        this.metricsCollector,
        this.channelFactory);
  }
}
