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
package com.rabbitmq.acked.stream;

import com.rabbitmq.acked.AckedException;
import com.rabbitmq.acked.Delivery;
import com.rabbitmq.acked.Handler;
import com.rabbitmq.acked.Rejection;
import com.rabbitmq.acked.Result;
import com.rabbitmq.acked.Subscription;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Sinks;

/**
 * {@link Handler} turning deliveries into an {@link AckedFlux}.
 *
 * <p>The result of each delivery follows its acknowledgement handle: a completed handle acks the
 * delivery, a failed handle goes through error reporting and the recovery strategy of the
 * subscription. A delivery the stream discards without processing it is requeued.
 *
 * <p>The stream supports a single subscriber.
 */
public final class DeliverySource implements Handler {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeliverySource.class);

  private final Sinks.Many<AckedElement<Delivery>> sink =
      Sinks.many().unicast().onBackpressureBuffer();
  private final AckedFlux<Delivery> flux = AckedFlux.from(this.sink.asFlux());

  public DeliverySource() {}

  public AckedFlux<Delivery> flux() {
    return this.flux;
  }

  @Override
  public CompletionStage<Result> handle(Delivery delivery) {
    AckHandle handle = AckHandle.create();
    CompletableFuture<Result> result = new CompletableFuture<>();
    handle.whenSettled(cause -> result.complete(toResult(cause)));
    Sinks.EmitResult emitResult;
    synchronized (this.sink) {
      emitResult = this.sink.tryEmitNext(new AckedElement<>(handle, delivery));
    }
    if (emitResult.isFailure()) {
      LOGGER.debug(
          "Could not emit delivery {} in stream: {}", delivery.deliveryTag(), emitResult);
      handle.fail(
          new AckedException.ElementDiscardedException(
              "Stream does not accept deliveries (" + emitResult + ")"));
    }
    return result;
  }

  private static Result toResult(Throwable cause) {
    if (cause == null) {
      return Result.success();
    } else if (cause instanceof AckedException.ElementDiscardedException) {
      return Result.rejected(Rejection.nack(cause.getMessage()));
    } else {
      return Result.rejected(Rejection.unhandled("Acknowledgement failed", cause));
    }
  }

  /** Complete the stream, later deliveries are requeued. */
  public void complete() {
    synchronized (this.sink) {
      this.sink.tryEmitComplete();
    }
  }

  /**
   * Complete the stream once the subscription is closed.
   *
   * @param subscription the subscription feeding this source
   * @return this source
   */
  public DeliverySource completeWhenClosed(Subscription subscription) {
    subscription.closed().whenComplete((ignored, ex) -> this.complete());
    return this;
  }
}
