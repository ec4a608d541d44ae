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
package com.rabbitmq.acked;

import java.time.Duration;

/** API to configure and create a {@link Subscription}. */
public interface SubscriptionBuilder {

  /**
   * Consume from an existing queue.
   *
   * <p>Shortcut for {@link #binding(Binding)} with {@link Binding#passive(String)}.
   *
   * @param queue queue
   * @return this builder instance
   */
  SubscriptionBuilder queue(String queue);

  /**
   * The binding to declare and consume from.
   *
   * @param binding binding
   * @return this builder instance
   */
  SubscriptionBuilder binding(Binding binding);

  /**
   * The callback for deliveries.
   *
   * @param handler callback
   * @return this builder instance
   */
  SubscriptionBuilder handler(Handler handler);

  /**
   * The policy applied when the handler fails.
   *
   * <p>The default is {@link RecoveryStrategy#nack()}.
   *
   * @param recoveryStrategy recovery strategy
   * @return this builder instance
   */
  SubscriptionBuilder recoveryStrategy(RecoveryStrategy recoveryStrategy);

  /**
   * Where to report handler failures.
   *
   * <p>The default is {@link ErrorReporting#logging()}.
   *
   * @param errorReporting error reporting
   * @return this builder instance
   */
  SubscriptionBuilder errorReporting(ErrorReporting errorReporting);

  /**
   * The name of the subscription, used in error reports.
   *
   * <p>A name is generated by default.
   *
   * @param name name
   * @return this builder instance
   */
  SubscriptionBuilder name(String name);

  /**
   * The grace period of {@link Subscription#close()}.
   *
   * <p>The default is 5 minutes.
   *
   * @param closeTimeout grace period
   * @return this builder instance
   */
  SubscriptionBuilder closeTimeout(Duration closeTimeout);

  /**
   * Add {@link Resource.StateListener}s to the subscription.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  SubscriptionBuilder listeners(Resource.StateListener... listeners);

  /**
   * Build and start the subscription.
   *
   * <p>The binding declaration and the consumer registration happen asynchronously, see {@link
   * Subscription#initialized()}.
   *
   * @return the subscription
   */
  Subscription build();
}
