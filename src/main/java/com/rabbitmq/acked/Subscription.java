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
import java.util.concurrent.CompletableFuture;

/**
 * A {@link Binding} consumed by a {@link Handler}.
 *
 * <p>Instances are configured and created with a {@link SubscriptionBuilder}. A subscription
 * exposes its lifecycle milestones as futures, each completed at most once:
 *
 * <ul>
 *   <li>{@link #initialized()}: the binding has been declared, before any delivery
 *   <li>{@link #closing()}: a graceful close has been requested
 *   <li>{@link #aborting()}: an abort has been requested
 *   <li>{@link #closed()}: the consumer is stopped
 * </ul>
 *
 * <pre>{@code
 * Subscription subscription = environment.subscriptionBuilder()
 *     .binding(Binding.queue("orders", true, false, false))
 *     .handler(delivery -> {
 *       process(delivery.body());
 *       return Result.completedSuccess();
 *     })
 *     .build();
 * subscription.initialized().join();
 * // stop receiving, wait up to 30 seconds for in-flight deliveries
 * subscription.close(Duration.ofSeconds(30));
 * subscription.closed().join();
 * }</pre>
 *
 * @see Environment#subscriptionBuilder()
 */
public interface Subscription extends AutoCloseable, Resource {

  /**
   * Name of the subscription, used in error reports.
   *
   * @return name
   */
  String name();

  /**
   * Queue the subscription consumes from.
   *
   * @return queue name
   */
  String queue();

  /**
   * Completes once the binding has been declared.
   *
   * <p>Completes exceptionally if the declaration fails.
   *
   * @return initialization future
   */
  CompletableFuture<Void> initialized();

  /**
   * Completes with the grace period of the first {@link #close(Duration)} call.
   *
   * @return closing future
   */
  CompletableFuture<Duration> closing();

  /**
   * Completes once {@link #abort()} has been called.
   *
   * @return aborting future
   */
  CompletableFuture<Void> aborting();

  /**
   * Completes once the consumer is stopped.
   *
   * @return closed future
   */
  CompletableFuture<Void> closed();

  /**
   * Stop receiving deliveries and stop once in-flight deliveries are settled.
   *
   * <p>If in-flight deliveries are not settled when the grace period expires, the channel is
   * closed and the broker redelivers them. Only the first call has an effect.
   *
   * @param timeout the grace period
   */
  void close(Duration timeout);

  /**
   * Close with the default grace period.
   *
   * @see SubscriptionBuilder#closeTimeout(Duration)
   */
  @Override
  void close();

  /** Stop immediately, without waiting for in-flight deliveries. */
  void abort();

  /** Cancel the broker consumer, in-flight deliveries are still settled. */
  void pause();

  /** Consume again after {@link #pause()}. */
  void unpause();

  /**
   * Number of deliveries dispatched to the handler and not settled yet.
   *
   * @return pending delivery count
   */
  int pendingDeliveryCount();

  /**
   * Consume from a new channel, e.g. after the previous one failed.
   *
   * <p>Deliveries pending on the previous channel are forgotten, the broker redelivers them.
   *
   * @param channel the new channel
   */
  void resubscribe(ConsumerChannel channel);
}
