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
import java.util.Map;

/**
 * The broker channel capability a {@link Subscription} consumes from.
 *
 * <p>A channel instance is owned by exactly one subscription at a time. Delivery tags are scoped
 * to the channel they have been received on.
 *
 * @see com.rabbitmq.acked.amqp091.AmqpClientChannel
 */
public interface ConsumerChannel extends AutoCloseable {

  /**
   * Start consuming from a queue with manual acknowledgment.
   *
   * @param queue the queue to consume from
   * @param callback the callback for inbound deliveries
   * @return the consumer tag
   * @throws IOException if the broker refuses the registration
   */
  String consume(String queue, DeliveryCallback callback) throws IOException;

  /**
   * Cancel a consumer registration.
   *
   * @param consumerTag the tag returned by {@link #consume(String, DeliveryCallback)}
   * @throws IOException if the operation fails
   */
  void cancel(String consumerTag) throws IOException;

  /**
   * Acknowledge a single delivery.
   *
   * @param deliveryTag delivery tag
   * @throws IOException if the operation fails
   */
  void ack(long deliveryTag) throws IOException;

  /**
   * Negatively acknowledge a single delivery.
   *
   * @param deliveryTag delivery tag
   * @param requeue whether the broker should requeue the message
   * @throws IOException if the operation fails
   */
  void nack(long deliveryTag, boolean requeue) throws IOException;

  void declareQueue(
      String queue,
      boolean durable,
      boolean exclusive,
      boolean autoDelete,
      Map<String, Object> arguments)
      throws IOException;

  void declareExchange(String exchange, String type, boolean durable) throws IOException;

  void bindQueue(String queue, String exchange, String routingKey) throws IOException;

  boolean isOpen();

  /**
   * Close the channel.
   *
   * <p>The broker requeues the deliveries that have not been acknowledged on this channel.
   *
   * @throws IOException if the operation fails
   */
  @Override
  void close() throws IOException;

  /** Callback for inbound deliveries. */
  @FunctionalInterface
  interface DeliveryCallback {

    void handle(Delivery delivery);
  }
}
