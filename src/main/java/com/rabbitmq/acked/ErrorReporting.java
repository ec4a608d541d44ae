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

import java.util.List;

/**
 * Receives processing failures of subscriptions.
 *
 * <p>Reporting is fire-and-forget: exceptions thrown by implementations are logged and ignored.
 *
 * @see SubscriptionBuilder#errorReporting(ErrorReporting)
 */
@FunctionalInterface
public interface ErrorReporting {

  /**
   * Report a failure.
   *
   * @param consumerName the name of the subscription
   * @param message a description of the failure
   * @param cause the cause
   * @param delivery the delivery that failed
   */
  void report(String consumerName, String message, Throwable cause, Delivery delivery);

  /**
   * Error reporting that logs with SLF4J (default).
   *
   * @return logging error reporting
   */
  static ErrorReporting logging() {
    return LoggingErrorReporting.INSTANCE;
  }

  /**
   * Report to several error reportings, in order.
   *
   * @param reportings the error reportings
   * @return composite error reporting
   */
  static ErrorReporting compose(ErrorReporting... reportings) {
    List<ErrorReporting> delegates = List.of(reportings);
    return (consumerName, message, cause, delivery) ->
        delegates.forEach(r -> r.report(consumerName, message, cause, delivery));
  }
}
