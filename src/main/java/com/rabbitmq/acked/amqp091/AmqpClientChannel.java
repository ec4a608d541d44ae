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
package com.rabbitmq.acked.amqp091;

import com.rabbitmq.acked.ChannelFactory;
import com.rabbitmq.acked.ConsumerChannel;
import com.rabbitmq.acked.Delivery;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link ConsumerChannel} backed by a channel of the RabbitMQ AMQP 0-9-1 Java client.
 *
 * <p>Consumers use manual acknowledgement, the prefetch of the channel bounds the number of
 * unsettled deliveries.
 */
public final class AmqpClientChannel implements ConsumerChannel {

  private final Channel channel;

  public AmqpClientChannel(Channel channel) {
    this.channel = channel;
  }

  /**
   * Factory creating a new channel on the connection for each subscription.
   *
   * @param connection the connection
   * @param prefetch the maximum number of unacknowledged deliveries per channel
   * @return the channel factory
   */
  public static ChannelFactory factory(Connection connection, int prefetch) {
    return () -> {
      Channel channel = connection.createChannel();
      if (channel == null) {
        throw new IOException("No channel available on connection");
      }
      channel.basicQos(prefetch);
      return new AmqpClientChannel(channel);
    };
  }

  @Override
  public String consume(String queue, DeliveryCallback callback) throws IOException {
    return this.channel.basicConsume(
        queue,
        false,
        new DefaultConsumer(this.channel) {
          @Override
          public void handleDelivery(
              String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
            callback.handle(delivery(consumerTag, envelope, properties, body));
          }
        });
  }

  static Delivery delivery(
      String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
    Map<String, String> props = new LinkedHashMap<>();
    Map<String, Object> headers = new LinkedHashMap<>();
    if (properties != null) {
      put(props, "content-type", properties.getContentType());
      put(props, "content-encoding", properties.getContentEncoding());
      put(props, "delivery-mode", properties.getDeliveryMode());
      put(props, "priority", properties.getPriority());
      put(props, "correlation-id", properties.getCorrelationId());
      put(props, "reply-to", properties.getReplyTo());
      put(props, "expiration", properties.getExpiration());
      put(props, "message-id", properties.getMessageId());
      if (properties.getTimestamp() != null) {
        put(props, "timestamp", properties.getTimestamp().getTime());
      }
      put(props, "type", properties.getType());
      put(props, "user-id", properties.getUserId());
      put(props, "app-id", properties.getAppId());
      if (properties.getHeaders() != null) {
        properties
            .getHeaders()
            .forEach((k, v) -> headers.put(k, v instanceof LongString ? v.toString() : v));
      }
    }
    return new Delivery(
        consumerTag,
        envelope.getDeliveryTag(),
        envelope.isRedeliver(),
        envelope.getExchange(),
        envelope.getRoutingKey(),
        props,
        headers,
        body);
  }

  private static void put(Map<String, String> properties, String key, Object value) {
    if (value != null) {
      properties.put(key, value.toString());
    }
  }

  @Override
  public void cancel(String consumerTag) throws IOException {
    this.channel.basicCancel(consumerTag);
  }

  @Override
  public void ack(long deliveryTag) throws IOException {
    this.channel.basicAck(deliveryTag, false);
  }

  @Override
  public void nack(long deliveryTag, boolean requeue) throws IOException {
    this.channel.basicNack(deliveryTag, false, requeue);
  }

  @Override
  public void declareQueue(
      String queue,
      boolean durable,
      boolean exclusive,
      boolean autoDelete,
      Map<String, Object> arguments)
      throws IOException {
    this.channel.queueDeclare(queue, durable, exclusive, autoDelete, arguments);
  }

  @Override
  public void declareExchange(String exchange, String type, boolean durable) throws IOException {
    this.channel.exchangeDeclare(exchange, type, durable);
  }

  @Override
  public void bindQueue(String queue, String exchange, String routingKey) throws IOException {
    this.channel.queueBind(queue, exchange, routingKey);
  }

  @Override
  public boolean isOpen() {
    return this.channel.isOpen();
  }

  @Override
  public void close() throws IOException {
    if (this.channel.isOpen()) {
      try {
        this.channel.close();
      } catch (TimeoutException e) {
        throw new IOException("Timeout while closing channel", e);
      }
    }
  }

  @Override
  public String toString() {
    return "AmqpClientChannel{" + "channel=" + channel.getChannelNumber() + '}';
  }
}
