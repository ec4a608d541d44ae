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
package com.rabbitmq.acked.impl;

import static com.rabbitmq.acked.impl.Assertions.assertThat;
import static com.rabbitmq.acked.impl.TestUtils.sync;
import static com.rabbitmq.acked.impl.TestUtils.waitAtMost;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class EventLoopTest {

  static ExecutorService executorService;
  EventLoop loop;

  @BeforeAll
  static void beforeAll() {
    executorService = Executors.newCachedThreadPool();
  }

  @BeforeEach
  void beforeEach() {
    loop = new EventLoop("test", executorService);
  }

  @AfterEach
  void afterEach() {
    loop.close();
  }

  @AfterAll
  static void afterAll() {
    executorService.shutdownNow();
  }

  @Test
  void tasksRunInSubmissionOrder() {
    List<Integer> processed = new CopyOnWriteArrayList<>();
    IntStream.range(0, 100).forEach(i -> loop.submit(() -> processed.add(i)));
    waitAtMost(() -> processed.size() == 100);
    assertThat(processed)
        .containsExactlyElementsOf(IntStream.range(0, 100).boxed().collect(Collectors.toList()));
  }

  @Test
  void tasksRunOnASingleThread() {
    Set<Thread> threads = ConcurrentHashMap.newKeySet();
    TestUtils.Sync sync = sync();
    IntStream.range(0, 10).forEach(i -> loop.submit(() -> threads.add(Thread.currentThread())));
    loop.submit(sync::down);
    assertThat(sync).completes();
    assertThat(threads).hasSize(1).doesNotContain(Thread.currentThread());
  }

  @Test
  void failingTaskDoesNotStopTheLoop() {
    TestUtils.Sync sync = sync();
    loop.submit(
        () -> {
          throw new IllegalStateException("expected in test");
        });
    loop.submit(sync::down);
    assertThat(sync).completes();
  }

  @Test
  void closeRunsEnqueuedTasksAndRefusesNewOnes() {
    AtomicInteger count = new AtomicInteger(0);
    TestUtils.Sync blocker = sync();
    TestUtils.Sync started = sync();
    loop.submit(
        () -> {
          started.down();
          blocker.await(TestUtils.DEFAULT_CONDITION_TIMEOUT);
        });
    assertThat(started).completes();
    IntStream.range(0, 10).forEach(i -> loop.submit(count::incrementAndGet));
    loop.close();
    TestUtils.Sync rejected = sync();
    assertThat(loop.submit(rejected::down)).isFalse();
    blocker.down();
    waitAtMost(() -> count.get() == 10);
    assertThat(rejected).hasNotCompleted();
  }

  @Test
  void acceptedTasksRunWhenCloseRacesWithSubmission() throws Exception {
    for (int i = 0; i < 50; i++) {
      EventLoop racingLoop = new EventLoop("racing-" + i, executorService);
      AtomicInteger accepted = new AtomicInteger(0);
      AtomicInteger ran = new AtomicInteger(0);
      CountDownLatch start = new CountDownLatch(1);
      CountDownLatch submitted = new CountDownLatch(1);
      executorService.execute(
          () -> {
            try {
              start.await();
              for (int j = 0; j < 1000; j++) {
                if (racingLoop.submit(ran::incrementAndGet)) {
                  accepted.incrementAndGet();
                }
              }
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            } finally {
              submitted.countDown();
            }
          });
      start.countDown();
      racingLoop.close();
      assertThat(submitted.await(10, TimeUnit.SECONDS)).isTrue();
      waitAtMost(() -> ran.get() == accepted.get());
    }
  }
}
