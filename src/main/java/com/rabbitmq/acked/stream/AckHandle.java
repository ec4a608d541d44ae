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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Single-assignment acknowledgement of a stream element.
 *
 * <p>A handle is settled at most once, either completed (the element has been processed, the
 * delivery is acknowledged) or failed. Later settlement attempts are ignored.
 *
 * <p>Handles can be split (one element becomes several) or combined (several elements become
 * one), settlement then flows between the related handles.
 */
public final class AckHandle {

  private final CompletableFuture<Void> settlement = new CompletableFuture<>();

  AckHandle() {}

  public static AckHandle create() {
    return new AckHandle();
  }

  /**
   * Complete the handle.
   *
   * @return true if this call settled the handle
   */
  public boolean complete() {
    return this.settlement.complete(null);
  }

  /**
   * Fail the handle.
   *
   * @param cause the failure
   * @return true if this call settled the handle
   */
  public boolean fail(Throwable cause) {
    return this.settlement.completeExceptionally(cause);
  }

  public boolean isSettled() {
    return this.settlement.isDone();
  }

  /**
   * Register a callback for the settlement of the handle.
   *
   * <p>The callback receives null on completion, the failure cause otherwise. It is called
   * immediately if the handle is already settled.
   *
   * @param callback the callback
   */
  public void whenSettled(Consumer<Throwable> callback) {
    this.settlement.whenComplete((ignored, cause) -> callback.accept(unwrap(cause)));
  }

  /**
   * A view of the settlement that cannot settle the handle.
   *
   * @return future completing with the handle
   */
  public CompletableFuture<Void> toCompletableFuture() {
    return this.settlement.copy();
  }

  /**
   * Split into child handles.
   *
   * <p>This handle completes when all the children complete and fails as soon as one of them
   * fails.
   *
   * @param count the number of children, must be positive
   * @return the children
   */
  public List<AckHandle> split(int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("Split count must be positive: " + count);
    }
    AtomicInteger remaining = new AtomicInteger(count);
    List<AckHandle> children = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      AckHandle child = new AckHandle();
      child.whenSettled(
          cause -> {
            if (cause != null) {
              this.fail(cause);
            } else if (remaining.decrementAndGet() == 0) {
              this.complete();
            }
          });
      children.add(child);
    }
    return Collections.unmodifiableList(children);
  }

  /**
   * Create a handle which settles all the members the same way when it is settled.
   *
   * @param members the handles to settle
   * @return the representative handle
   */
  public static AckHandle combine(List<AckHandle> members) {
    List<AckHandle> copy = List.copyOf(members);
    AckHandle representative = new AckHandle();
    representative.whenSettled(cause -> copy.forEach(m -> m.settle(cause)));
    return representative;
  }

  /**
   * Settle this handle the same way as another one, once the other one is settled.
   *
   * @param other the handle to follow
   */
  public void completeWith(AckHandle other) {
    other.whenSettled(this::settle);
  }

  private void settle(Throwable cause) {
    if (cause == null) {
      this.complete();
    } else {
      this.fail(cause);
    }
  }

  private static Throwable unwrap(Throwable cause) {
    if (cause instanceof CompletionException && cause.getCause() != null) {
      return cause.getCause();
    } else {
      return cause;
    }
  }

  @Override
  public String toString() {
    String status;
    if (!this.settlement.isDone()) {
      status = "pending";
    } else if (this.settlement.isCompletedExceptionally()) {
      status = "failed";
    } else {
      status = "completed";
    }
    return "AckHandle{" + status + '}';
  }
}
