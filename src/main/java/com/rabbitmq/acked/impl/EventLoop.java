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

import com.rabbitmq.acked.AckedException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded mailbox: tasks run one at a time, in submission order, on the loop thread.
 *
 * <p>Submission never blocks. After {@link #close()} the loop runs the tasks already enqueued,
 * then exits, new submissions are refused.
 */
final class EventLoop implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(EventLoop.class);

  private final String name;
  private final BlockingQueue<Runnable> taskQueue = new LinkedBlockingQueue<>();
  // guards closed, so that an accepted task is always in the queue before the loop can exit
  private final Object lock = new Object();
  private boolean closed = false;

  EventLoop(String name, ExecutorService executorService) {
    this.name = name;
    CountDownLatch loopStartedLatch = new CountDownLatch(1);
    executorService.execute(
        () -> {
          loopStartedLatch.countDown();
          while (!Thread.currentThread().isInterrupted()) {
            try {
              Runnable task = this.taskQueue.poll(100, TimeUnit.MILLISECONDS);
              if (task != null) {
                task.run();
              } else if (this.drained()) {
                LOGGER.debug("Event loop '{}' drained, exiting", this.name);
                return;
              }
            } catch (InterruptedException e) {
              LOGGER.debug("Event loop '{}' has been interrupted.", this.name);
              return;
            } catch (Exception e) {
              LOGGER.warn("Error during processing of task in event loop '{}'", this.name, e);
            }
          }
        });
    try {
      if (!loopStartedLatch.await(10, TimeUnit.SECONDS)) {
        throw new IllegalStateException("Event loop '" + name + "' could not start");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AckedException("Error while creating event loop " + name, e);
    }
  }

  /**
   * Enqueue a task.
   *
   * @param task the task
   * @return true if the task will run, false if the loop is closed
   */
  boolean submit(Runnable task) {
    synchronized (this.lock) {
      if (this.closed) {
        LOGGER.debug("Event loop '{}' is closed, refusing task", this.name);
        return false;
      } else {
        return this.taskQueue.offer(task);
      }
    }
  }

  private boolean drained() {
    synchronized (this.lock) {
      return this.closed && this.taskQueue.isEmpty();
    }
  }

  @Override
  public void close() {
    synchronized (this.lock) {
      this.closed = true;
    }
  }
}
