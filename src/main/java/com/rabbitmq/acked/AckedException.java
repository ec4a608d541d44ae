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

/** Base exception of the library. */
public class AckedException extends RuntimeException {

  public AckedException(Throwable cause) {
    super(cause);
  }

  public AckedException(String format, Object... args) {
    super(String.format(format, args));
  }

  public AckedException(String message, Throwable cause) {
    super(message, cause);
  }

  public static class AckedResourceInvalidStateException extends AckedException {

    public AckedResourceInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public AckedResourceInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class AckedResourceClosedException extends AckedResourceInvalidStateException {

    public AckedResourceClosedException(String message) {
      super(message);
    }

    public AckedResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * The payload of a delivery could not be decoded into the shape a handler expects.
   *
   * <p>This is the error a {@link RecoveryStrategy} receives for a {@link Rejection.Extract}.
   */
  public static class ExtractException extends AckedException {

    public ExtractException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A stream dropped an element before its acknowledgement handle was settled. */
  public static class ElementDiscardedException extends AckedException {

    public ElementDiscardedException(String message) {
      super(message);
    }
  }

  /** A bounded buffer of a stream was full. */
  public static class BufferOverflowException extends AckedException {

    public BufferOverflowException(String message) {
      super(message);
    }
  }
}
