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

/**
 * Lifecycle of a consumer subscription.
 *
 * <p>A subscription opens once its binding is declared and its consumer registered, may move to
 * new channels, then closes, gracefully or not. Listeners can react to these steps, e.g. stop
 * feeding a stream when the subscription starts closing.
 *
 * @see Subscription
 */
public interface Resource {

  /**
   * Listener of subscription state changes.
   *
   * <p>Listeners are called synchronously on the thread making the change, exceptions they throw
   * are logged and ignored.
   *
   * @see SubscriptionBuilder#listeners(StateListener...)
   */
  @FunctionalInterface
  interface StateListener {

    /**
     * Handle state change.
     *
     * @param context state change context
     */
    void handle(Context context);
  }

  /** A state change. */
  interface Context {

    Resource resource();

    /**
     * Why the subscription closed, if it did not close on request.
     *
     * @return failure cause, null when the subscription closed normally or is not closing
     */
    Throwable failureCause();

    State previousState();

    State currentState();

    /**
     * Time given to pending deliveries to settle, set when moving to {@link State#CLOSING}.
     *
     * <p>{@link Duration#ZERO} when the subscription is aborted, pending deliveries are then
     * dropped without acknowledgement.
     *
     * @return grace period, null for other states
     */
    Duration gracePeriod();
  }

  enum State {
    /** The binding is being declared and the consumer registered. */
    OPENING,
    /** Deliveries flow to the handler. */
    OPEN,
    /** The consumer is moving to a new channel, pending deliveries still settle. */
    RECOVERING,
    /** No new deliveries, pending ones settle within the grace period. */
    CLOSING,
    /** The consumer is cancelled and its channel closed. */
    CLOSED
  }
}
