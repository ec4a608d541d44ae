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
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Policy that turns a processing failure into an acknowledgement decision.
 *
 * <p>The strategy is called for {@link Rejection.UnhandledException} and {@link
 * Rejection.Extract} rejections, after the failure has been reported. A strategy that throws or
 * returns a failed stage shuts the consumer down.
 *
 * @see SubscriptionBuilder#recoveryStrategy(RecoveryStrategy)
 */
@FunctionalInterface
public interface RecoveryStrategy {

  /**
   * Decide what to do with a delivery that failed.
   *
   * @param error the processing error
   * @param channel the channel the delivery has been received on
   * @param queue the queue the delivery comes from
   * @param delivery the delivery
   * @return true to ack the delivery, false to nack and requeue it
   */
  CompletionStage<Boolean> recover(
      Throwable error, ConsumerChannel channel, String queue, Delivery delivery);

  /**
   * Nack and requeue the delivery (default strategy).
   *
   * @return the strategy
   */
  static RecoveryStrategy nack() {
    return (error, channel, queue, delivery) -> CompletableFuture.completedFuture(false);
  }

  /**
   * Ack the delivery, i.e. give up on it.
   *
   * @return the strategy
   */
  static RecoveryStrategy drop() {
    return (error, channel, queue, delivery) -> CompletableFuture.completedFuture(true);
  }

  /**
   * Nack and requeue the delivery after a delay.
   *
   * <p>This avoids redelivering a failing message in a tight loop. The delivery stays pending
   * during the delay, so it counts against the channel prefetch.
   *
   * @param delay the delay before the nack
   * @param scheduler the scheduler for the delay
   * @return the strategy
   */
  static RecoveryStrategy nackAfter(Duration delay, ScheduledExecutorService scheduler) {
    return (error, channel, queue, delivery) -> {
      CompletableFuture<Boolean> result = new CompletableFuture<>();
      scheduler.schedule(() -> result.complete(false), delay.toMillis(), TimeUnit.MILLISECONDS);
      return result;
    };
  }
}
