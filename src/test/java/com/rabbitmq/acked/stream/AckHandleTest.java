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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

public class AckHandleTest {

  @Test
  void handleIsSettledOnlyOnce() {
    AckHandle handle = AckHandle.create();
    AtomicInteger callbacks = new AtomicInteger(0);
    AtomicReference<Throwable> cause = new AtomicReference<>(new Exception());
    handle.whenSettled(
        t -> {
          callbacks.incrementAndGet();
          cause.set(t);
        });
    assertThat(handle.isSettled()).isFalse();
    assertThat(handle.complete()).isTrue();
    assertThat(handle.fail(new IllegalStateException())).isFalse();
    assertThat(handle.complete()).isFalse();
    assertThat(callbacks).hasValue(1);
    assertThat(cause.get()).isNull();
    assertThat(handle.toCompletableFuture()).isCompleted();
  }

  @Test
  void callbackRegisteredAfterSettlementIsCalled() {
    AckHandle handle = AckHandle.create();
    IllegalStateException failure = new IllegalStateException();
    handle.fail(failure);
    AtomicReference<Throwable> cause = new AtomicReference<>();
    handle.whenSettled(cause::set);
    assertThat(cause).hasValue(failure);
  }

  @Test
  void completableFutureViewCannotSettleTheHandle() {
    AckHandle handle = AckHandle.create();
    handle.toCompletableFuture().complete(null);
    assertThat(handle.isSettled()).isFalse();
  }

  @Test
  void splitCompletesWhenAllChildrenComplete() {
    AckHandle parent = AckHandle.create();
    List<AckHandle> children = parent.split(3);
    assertThat(children).hasSize(3);
    children.get(0).complete();
    children.get(2).complete();
    assertThat(parent.isSettled()).isFalse();
    children.get(1).complete();
    assertThat(parent.toCompletableFuture()).isCompleted();
  }

  @Test
  void splitFailsAsSoonAsOneChildFails() {
    AckHandle parent = AckHandle.create();
    List<AckHandle> children = parent.split(3);
    IllegalStateException failure = new IllegalStateException();
    children.get(1).fail(failure);
    AtomicReference<Throwable> cause = new AtomicReference<>();
    parent.whenSettled(cause::set);
    assertThat(cause).hasValue(failure);
    children.get(0).complete();
    children.get(2).complete();
    assertThat(cause).hasValue(failure);
  }

  @Test
  void splitNeedsAPositiveCount() {
    assertThatThrownBy(() -> AckHandle.create().split(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void combinedHandleSettlesAllMembers() {
    List<AckHandle> members = List.of(AckHandle.create(), AckHandle.create());
    AckHandle representative = AckHandle.combine(members);
    representative.complete();
    assertThat(members).allMatch(h -> h.toCompletableFuture().isDone());
    assertThat(members).noneMatch(h -> h.toCompletableFuture().isCompletedExceptionally());

    members = List.of(AckHandle.create(), AckHandle.create());
    representative = AckHandle.combine(members);
    IllegalStateException failure = new IllegalStateException();
    representative.fail(failure);
    for (AckHandle member : members) {
      AtomicReference<Throwable> cause = new AtomicReference<>();
      member.whenSettled(cause::set);
      assertThat(cause).hasValue(failure);
    }
  }

  @Test
  void completeWithFollowsTheOtherHandle() {
    AckHandle previous = AckHandle.create();
    AckHandle next = AckHandle.create();
    previous.completeWith(next);
    assertThat(previous.isSettled()).isFalse();
    next.complete();
    assertThat(previous.toCompletableFuture()).isCompleted();
  }
}
