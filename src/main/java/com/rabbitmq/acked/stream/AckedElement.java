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

import java.util.Objects;

/**
 * A stream element carrying its acknowledgement handle.
 *
 * @param <T> type of the data
 */
public final class AckedElement<T> {

  private final AckHandle handle;
  private final T data;

  public AckedElement(AckHandle handle, T data) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.data = data;
  }

  public static <T> AckedElement<T> of(T data) {
    return new AckedElement<>(AckHandle.create(), data);
  }

  public AckHandle handle() {
    return this.handle;
  }

  public T data() {
    return this.data;
  }

  /**
   * Same handle, new data.
   *
   * @param newData the data
   * @param <U> type of the new data
   * @return the new element
   */
  public <U> AckedElement<U> withData(U newData) {
    return new AckedElement<>(this.handle, newData);
  }

  public boolean ack() {
    return this.handle.complete();
  }

  public boolean nack(Throwable cause) {
    return this.handle.fail(cause);
  }

  @Override
  public String toString() {
    return "AckedElement{" + "handle=" + handle + ", data=" + data + '}';
  }
}
