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

import com.rabbitmq.acked.Binding;
import com.rabbitmq.acked.ErrorReporting;
import com.rabbitmq.acked.Handler;
import com.rabbitmq.acked.RecoveryStrategy;
import com.rabbitmq.acked.Resource;
import com.rabbitmq.acked.Subscription;
import com.rabbitmq.acked.SubscriptionBuilder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

class AckedSubscriptionBuilder implements SubscriptionBuilder {

  static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofMinutes(5);

  private final AckedEnvironment environment;
  private Binding binding;
  private Handler handler;
  private RecoveryStrategy recoveryStrategy = RecoveryStrategy.nack();
  private ErrorReporting errorReporting = ErrorReporting.logging();
  private String name;
  private Duration closeTimeout = DEFAULT_CLOSE_TIMEOUT;
  private final List<Resource.StateListener> listeners = new ArrayList<>();

  AckedSubscriptionBuilder(AckedEnvironment environment) {
    this.environment = environment;
  }

  @Override
  public SubscriptionBuilder queue(String queue) {
    this.binding = Binding.passive(queue);
    return this;
  }

  @Override
  public SubscriptionBuilder binding(Binding binding) {
    this.binding = binding;
    return this;
  }

  @Override
  public SubscriptionBuilder handler(Handler handler) {
    this.handler = handler;
    return this;
  }

  @Override
  public SubscriptionBuilder recoveryStrategy(RecoveryStrategy recoveryStrategy) {
    this.recoveryStrategy = recoveryStrategy;
    return this;
  }

  @Override
  public SubscriptionBuilder errorReporting(ErrorReporting errorReporting) {
    this.errorReporting = errorReporting;
    return this;
  }

  @Override
  public SubscriptionBuilder name(String name) {
    this.name = name;
    return this;
  }

  @Override
  public SubscriptionBuilder closeTimeout(Duration closeTimeout) {
    this.closeTimeout = closeTimeout;
    return this;
  }

  @Override
  public SubscriptionBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  AckedEnvironment environment() {
    return this.environment;
  }

  Binding binding() {
    return this.binding;
  }

  Handler handler() {
    return this.handler;
  }

  RecoveryStrategy recoveryStrategy() {
    return this.recoveryStrategy;
  }

  ErrorReporting errorReporting() {
    return this.errorReporting;
  }

  String name() {
    return this.name;
  }

  Duration closeTimeout() {
    return this.closeTimeout;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }

  @Override
  public Subscription build() {
    if (this.binding == null) {
      throw new IllegalArgumentException("A queue or a binding must be specified");
    }
    if (this.handler == null) {
      throw new IllegalArgumentException("Handler cannot be null");
    }
    if (this.recoveryStrategy == null) {
      throw new IllegalArgumentException("Recovery strategy cannot be null");
    }
    if (this.errorReporting == null) {
      throw new IllegalArgumentException("Error reporting cannot be null");
    }
    if (this.closeTimeout == null || this.closeTimeout.isNegative()) {
      throw new IllegalArgumentException("Close timeout must be positive");
    }
    return this.environment.subscription(this);
  }
}
