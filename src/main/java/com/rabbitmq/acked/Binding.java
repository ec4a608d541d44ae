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

import java.io.IOException;
import java.util.List;

/**
 * Declaration of the queue a {@link Subscription} consumes from, with its exchange bindings.
 *
 * <p>The subscription applies the binding on its channel before consuming, {@link
 * Subscription#initialized()} completes once the declaration succeeded.
 */
public interface Binding {

  /**
   * The queue to consume from.
   *
   * @return queue name
   */
  String queueName();

  /**
   * Declare the queue and its bindings.
   *
   * @param channel the channel to use
   * @throws IOException if the declaration fails
   */
  void declare(ConsumerChannel channel) throws IOException;

  /**
   * A binding that declares nothing, the queue must exist.
   *
   * @param queue the queue
   * @return the binding
   */
  static Binding passive(String queue) {
    return new Bindings.PassiveBinding(queue);
  }

  /**
   * A binding that declares a queue.
   *
   * @param queue the queue
   * @param durable whether the queue survives a broker restart
   * @param exclusive whether the queue is used by only one connection
   * @param autoDelete whether the queue is deleted when it has no consumers anymore
   * @return the binding
   */
  static Binding queue(String queue, boolean durable, boolean exclusive, boolean autoDelete) {
    return new Bindings.QueueBinding(queue, durable, exclusive, autoDelete);
  }

  /**
   * A binding that declares a durable queue bound to a durable topic exchange.
   *
   * @param queue the queue
   * @param exchange the topic exchange
   * @param routingKeys the binding keys, one binding per key
   * @return the binding
   */
  static Binding topic(String queue, String exchange, String... routingKeys) {
    return new Bindings.TopicBinding(queue, exchange, List.of(routingKeys));
  }
}
