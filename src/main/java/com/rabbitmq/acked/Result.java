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

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/** Outcome of a {@link Handler}: success or {@link Rejection}. */
public final class Result {

  private static final Result SUCCESS = new Result(null);

  private final Rejection rejection;

  private Result(Rejection rejection) {
    this.rejection = rejection;
  }

  public static Result success() {
    return SUCCESS;
  }

  public static Result rejected(Rejection rejection) {
    return new Result(Objects.requireNonNull(rejection, "rejection"));
  }

  /**
   * Shortcut for handlers that settle synchronously.
   *
   * @return an already completed successful result
   */
  public static CompletionStage<Result> completedSuccess() {
    return CompletableFuture.completedFuture(SUCCESS);
  }

  public static CompletionStage<Result> completedRejection(Rejection rejection) {
    return CompletableFuture.completedFuture(rejected(rejection));
  }

  public boolean isSuccess() {
    return this.rejection == null;
  }

  /**
   * The rejection, null for a successful result.
   *
   * @return the rejection or null
   */
  public Rejection rejection() {
    return this.rejection;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Result{success}" : "Result{" + rejection + '}';
  }
}
