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

/**
 * Why a {@link Handler} did not process a delivery successfully.
 *
 * <p>Rejections are outcomes, not errors: they are always turned into an ack or nack decision.
 *
 * @see Result#rejected(Rejection)
 */
public abstract class Rejection {

  private final String message;

  private Rejection(String message) {
    this.message = message;
  }

  /**
   * Intentional rejection, the delivery is nacked, not reported and no recovery is attempted.
   *
   * @param reason reason
   * @return the rejection
   */
  public static Rejection nack(String reason) {
    return new Nack(reason);
  }

  /**
   * Unexpected failure, reported then handed to the {@link RecoveryStrategy}.
   *
   * @param message message
   * @param cause cause
   * @return the rejection
   */
  public static Rejection unhandled(String message, Throwable cause) {
    return new UnhandledException(message, cause);
  }

  /**
   * The payload could not be decoded, reported then handed to the {@link RecoveryStrategy}.
   *
   * @param message message
   * @param cause cause, can be null
   * @return the rejection
   */
  public static Rejection extract(String message, Throwable cause) {
    return new Extract(message, cause);
  }

  public String message() {
    return this.message;
  }

  public static final class Nack extends Rejection {

    private Nack(String reason) {
      super(reason);
    }

    @Override
    public String toString() {
      return "Nack{" + "reason='" + message() + '\'' + '}';
    }
  }

  public static final class UnhandledException extends Rejection {

    private final Throwable cause;

    private UnhandledException(String message, Throwable cause) {
      super(message);
      this.cause = cause;
    }

    public Throwable cause() {
      return this.cause;
    }

    @Override
    public String toString() {
      return "UnhandledException{" + "message='" + message() + '\'' + ", cause=" + cause + '}';
    }
  }

  public static final class Extract extends Rejection {

    private final Throwable cause;

    private Extract(String message, Throwable cause) {
      super(message);
      this.cause = cause;
    }

    public Throwable cause() {
      return this.cause;
    }

    @Override
    public String toString() {
      return "Extract{" + "message='" + message() + '\'' + ", cause=" + cause + '}';
    }
  }
}
