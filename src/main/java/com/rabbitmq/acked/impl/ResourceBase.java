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

import static com.rabbitmq.acked.Resource.State.CLOSED;
import static com.rabbitmq.acked.Resource.State.CLOSING;
import static com.rabbitmq.acked.Resource.State.OPEN;
import static com.rabbitmq.acked.Resource.State.RECOVERING;

import com.rabbitmq.acked.AckedException;
import com.rabbitmq.acked.Resource;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class ResourceBase implements Resource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBase.class);

  private final AtomicReference<State> state = new AtomicReference<>();
  private final List<StateListener> listeners;

  ResourceBase(List<StateListener> listeners) {
    this.listeners = List.copyOf(listeners);
    this.state(State.OPENING);
  }

  protected void checkOpen() {
    State state = this.state.get();
    if (state == CLOSED) {
      throw new AckedException.AckedResourceClosedException("Subscription is closed");
    } else if (state != OPEN && state != RECOVERING) {
      throw new AckedException.AckedResourceInvalidStateException(
          "Subscription is not open, current state is %s", state.name());
    }
  }

  protected State state() {
    return this.state.get();
  }

  protected void state(State state) {
    this.transition(state, null, null);
  }

  protected void state(State state, Throwable failureCause) {
    this.transition(state, failureCause, null);
  }

  /**
   * Move to {@link State#CLOSING}.
   *
   * @param gracePeriod time given to pending deliveries, {@link Duration#ZERO} to abort
   */
  protected void startClosing(Duration gracePeriod) {
    this.transition(CLOSING, null, gracePeriod);
  }

  /**
   * Move to a new state only from an expected one.
   *
   * @param expected the expected current state
   * @param state the new state
   * @return true if the transition happened
   */
  protected boolean compareAndSetState(State expected, State state) {
    if (this.state.compareAndSet(expected, state)) {
      this.dispatch(new StateChange(this, null, expected, state, null));
      return true;
    } else {
      return false;
    }
  }

  private void transition(State state, Throwable failureCause, Duration gracePeriod) {
    State previousState = this.state.getAndSet(state);
    if (state != previousState) {
      this.dispatch(new StateChange(this, failureCause, previousState, state, gracePeriod));
    }
  }

  private void dispatch(Context context) {
    for (StateListener listener : this.listeners) {
      try {
        listener.handle(context);
      } catch (Exception e) {
        LOGGER.warn(
            "Error in subscription state listener ({} -> {})",
            context.previousState(),
            context.currentState(),
            e);
      }
    }
  }

  private static final class StateChange implements Context {

    private final Resource resource;
    private final Throwable failureCause;
    private final State previousState;
    private final State currentState;
    private final Duration gracePeriod;

    private StateChange(
        Resource resource,
        Throwable failureCause,
        State previousState,
        State currentState,
        Duration gracePeriod) {
      this.resource = resource;
      this.failureCause = failureCause;
      this.previousState = previousState;
      this.currentState = currentState;
      this.gracePeriod = gracePeriod;
    }

    @Override
    public Resource resource() {
      return this.resource;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public State previousState() {
      return this.previousState;
    }

    @Override
    public State currentState() {
      return this.currentState;
    }

    @Override
    public Duration gracePeriod() {
      return this.gracePeriod;
    }
  }
}
