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
package com.rabbitmq.acked.metrics;

/** Interface to collect execution data of subscriptions. */
public interface MetricsCollector {

  /** Called when a new {@link com.rabbitmq.acked.Subscription} is opened. */
  void openConsumer();

  /** Called when a {@link com.rabbitmq.acked.Subscription} is closed. */
  void closeConsumer();

  /** Called when a {@link com.rabbitmq.acked.Delivery} is dispatched to a handler. */
  void consume();

  /**
   * Called when a {@link com.rabbitmq.acked.Delivery} is settled on the channel.
   *
   * @param disposition disposition (outcome)
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** The delivery has been acknowledged. */
    ACCEPTED,
    /** The delivery has been negatively acknowledged and requeued. */
    REQUEUED
  }
}
