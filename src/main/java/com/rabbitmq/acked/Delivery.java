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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message delivered by the broker to a consumer.
 *
 * <p>The delivery tag is scoped to the {@link ConsumerChannel} the message has been delivered on
 * and is what acknowledgements refer to.
 */
public final class Delivery {

  private final String consumerTag;
  private final long deliveryTag;
  private final boolean redelivered;
  private final String exchange;
  private final String routingKey;
  private final Map<String, String> properties;
  private final Map<String, Object> headers;
  private final byte[] body;

  public Delivery(String consumerTag, long deliveryTag, byte[] body) {
    this(consumerTag, deliveryTag, false, "", "", null, null, body);
  }

  public Delivery(
      String consumerTag,
      long deliveryTag,
      boolean redelivered,
      String exchange,
      String routingKey,
      Map<String, String> properties,
      Map<String, Object> headers,
      byte[] body) {
    this.consumerTag = consumerTag;
    this.deliveryTag = deliveryTag;
    this.redelivered = redelivered;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.properties = copy(properties);
    this.headers = copy(headers);
    this.body = body == null ? new byte[0] : body;
  }

  private static <V> Map<String, V> copy(Map<String, V> map) {
    if (map == null || map.isEmpty()) {
      return Collections.emptyMap();
    } else {
      return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
  }

  public String consumerTag() {
    return this.consumerTag;
  }

  public long deliveryTag() {
    return this.deliveryTag;
  }

  public boolean redelivered() {
    return this.redelivered;
  }

  public String exchange() {
    return this.exchange;
  }

  public String routingKey() {
    return this.routingKey;
  }

  /**
   * Standard message properties (content type, correlation ID, etc), only those that are set.
   *
   * @return properties
   */
  public Map<String, String> properties() {
    return this.properties;
  }

  public Map<String, Object> headers() {
    return this.headers;
  }

  @SuppressFBWarnings("EI_EXPOSE_REP")
  public byte[] body() {
    return this.body;
  }

  /**
   * The body as a UTF-8 string.
   *
   * @return body as string
   */
  public String bodyAsString() {
    return new String(this.body, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "Delivery{"
        + "consumerTag='"
        + consumerTag
        + '\''
        + ", deliveryTag="
        + deliveryTag
        + ", redelivered="
        + redelivered
        + ", exchange='"
        + exchange
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + ", bodySize="
        + body.length
        + '}';
  }
}
