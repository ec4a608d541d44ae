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
import java.util.Collections;
import java.util.List;

final class Bindings {

  private Bindings() {}

  private static String checkQueue(String queue) {
    if (queue == null || queue.isBlank()) {
      throw new IllegalArgumentException("A queue must be specified");
    }
    return queue;
  }

  static final class PassiveBinding implements Binding {

    private final String queue;

    PassiveBinding(String queue) {
      this.queue = checkQueue(queue);
    }

    @Override
    public String queueName() {
      return this.queue;
    }

    @Override
    public void declare(ConsumerChannel channel) {}

    @Override
    public String toString() {
      return "PassiveBinding{" + "queue='" + queue + '\'' + '}';
    }
  }

  static final class QueueBinding implements Binding {

    private final String queue;
    private final boolean durable;
    private final boolean exclusive;
    private final boolean autoDelete;

    QueueBinding(String queue, boolean durable, boolean exclusive, boolean autoDelete) {
      this.queue = checkQueue(queue);
      this.durable = durable;
      this.exclusive = exclusive;
      this.autoDelete = autoDelete;
    }

    @Override
    public String queueName() {
      return this.queue;
    }

    @Override
    public void declare(ConsumerChannel channel) throws IOException {
      channel.declareQueue(
          this.queue, this.durable, this.exclusive, this.autoDelete, Collections.emptyMap());
    }

    @Override
    public String toString() {
      return "QueueBinding{" + "queue='" + queue + '\'' + ", durable=" + durable + '}';
    }
  }

  static final class TopicBinding implements Binding {

    private static final String TOPIC = "topic";

    private final String queue;
    private final String exchange;
    private final List<String> routingKeys;

    TopicBinding(String queue, String exchange, List<String> routingKeys) {
      this.queue = checkQueue(queue);
      if (exchange == null || exchange.isBlank()) {
        throw new IllegalArgumentException("An exchange must be specified");
      }
      if (routingKeys.isEmpty()) {
        throw new IllegalArgumentException("At least one routing key must be specified");
      }
      this.exchange = exchange;
      this.routingKeys = routingKeys;
    }

    @Override
    public String queueName() {
      return this.queue;
    }

    @Override
    public void declare(ConsumerChannel channel) throws IOException {
      channel.declareQueue(this.queue, true, false, false, Collections.emptyMap());
      channel.declareExchange(this.exchange, TOPIC, true);
      for (String routingKey : this.routingKeys) {
        channel.bindQueue(this.queue, this.exchange, routingKey);
      }
    }

    @Override
    public String toString() {
      return "TopicBinding{"
          + "queue='"
          + queue
          + '\''
          + ", exchange='"
          + exchange
          + '\''
          + ", routingKeys="
          + routingKeys
          + '}';
    }
  }
}
