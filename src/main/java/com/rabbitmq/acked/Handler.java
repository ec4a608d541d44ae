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

import java.util.concurrent.CompletionStage;

/**
 * Contract to process a delivery.
 *
 * <p>The handler runs on a worker pool, the returned stage can complete on any thread. An
 * exception thrown by the handler or a failed stage is treated as an {@link
 * Rejection.UnhandledException}.
 *
 * @see SubscriptionBuilder#handler(Handler)
 * @see com.rabbitmq.acked.stream.DeliverySource
 */
@FunctionalInterface
public interface Handler {

  /**
   * Process a delivery.
   *
   * @param delivery the delivery
   * @return the outcome of the processing
   * @throws Exception if anything goes wrong
   */
  CompletionStage<Result> handle(Delivery delivery) throws Exception;

  /**
   * Create a handler that decodes the delivery before processing it.
   *
   * <p>A decoding failure results in an {@link Rejection.Extract}.
   *
   * @param decoder the decoder
   * @param handler the handler for decoded values
   * @param <T> type of decoded values
   * @return the handler
   */
  static <T> Handler decoding(Decoder<T> decoder, TypedHandler<T> handler) {
    return delivery -> {
      T value;
      try {
        value = decoder.decode(delivery);
      } catch (Exception e) {
        return Result.completedRejection(
            Rejection.extract("Could not decode delivery " + delivery.deliveryTag(), e));
      }
      return handler.handle(value, delivery);
    };
  }

  /**
   * Decodes a delivery into a value.
   *
   * @param <T> type of the value
   */
  @FunctionalInterface
  interface Decoder<T> {

    T decode(Delivery delivery) throws Exception;
  }

  /**
   * Processes a decoded value.
   *
   * @param <T> type of the value
   */
  @FunctionalInterface
  interface TypedHandler<T> {

    CompletionStage<Result> handle(T value, Delivery delivery) throws Exception;
  }
}
