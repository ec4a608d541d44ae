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

import com.rabbitmq.acked.AckedException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SynchronousSink;
import reactor.util.context.Context;

/**
 * Stream of {@link AckedElement}s.
 *
 * <p>Every operator keeps track of the acknowledgement handles: an element dropped by an
 * operator has its handle completed, an element whose transformation fails has its handle
 * failed and the failure is propagated as the error signal of the stream. Elements the stream
 * discards without processing them (cancellation, truncation, overflow) have their handle failed
 * with an {@link AckedException.ElementDiscardedException}.
 *
 * <p>Instances are immutable, each operator returns a new stream.
 *
 * @param <T> type of the data
 */
public final class AckedFlux<T> {

  private static final Logger LOGGER = LoggerFactory.getLogger(AckedFlux.class);

  private final Flux<AckedElement<T>> flux;

  private AckedFlux(Flux<AckedElement<T>> flux) {
    this.flux = flux;
  }

  public static <T> AckedFlux<T> from(Publisher<AckedElement<T>> publisher) {
    return new AckedFlux<>(Flux.from(publisher));
  }

  /**
   * Apply a reusable segment of operators.
   *
   * @param segment the segment
   * @param <U> output data type
   * @return the transformed stream
   */
  public <U> AckedFlux<U> transform(Function<? super AckedFlux<T>, AckedFlux<U>> segment) {
    return segment.apply(this);
  }

  public <U> AckedFlux<U> map(Function<? super T, ? extends U> mapper) {
    return new AckedFlux<>(this.flux.map(e -> e.<U>withData(applyOrFail(e, mapper))));
  }

  /**
   * Keep the elements matching the predicate, the others are acknowledged.
   *
   * @param predicate the predicate
   * @return the filtered stream
   */
  public AckedFlux<T> filter(Predicate<? super T> predicate) {
    return new AckedFlux<>(
        this.flux.filter(
            e -> {
              boolean keep = applyOrFail(e, predicate::test);
              if (!keep) {
                e.handle().complete();
              }
              return keep;
            }));
  }

  /**
   * Filter and map in one step, elements mapped to an empty optional are acknowledged.
   *
   * @param collector the mapping function
   * @param <U> output data type
   * @return the collected stream
   */
  public <U> AckedFlux<U> collect(Function<? super T, Optional<U>> collector) {
    return new AckedFlux<>(
        this.flux.handle(
            (AckedElement<T> e, SynchronousSink<AckedElement<U>> sink) -> {
              Optional<U> result;
              try {
                result = collector.apply(e.data());
              } catch (RuntimeException ex) {
                e.handle().fail(ex);
                sink.error(ex);
                return;
              }
              if (result.isPresent()) {
                sink.next(e.withData(result.get()));
              } else {
                e.handle().complete();
              }
            }));
  }

  /**
   * One element to zero or more elements.
   *
   * <p>An element mapped to nothing is acknowledged. Otherwise the original handle completes
   * once all the produced elements are acknowledged and fails as soon as one of them fails.
   *
   * @param mapper the mapping function
   * @param <U> output data type
   * @return the new stream
   */
  public <U> AckedFlux<U> mapConcat(Function<? super T, ? extends Iterable<? extends U>> mapper) {
    return new AckedFlux<>(
        this.flux.<AckedElement<U>>concatMapIterable(
            e -> {
              List<U> items = new ArrayList<>();
              applyOrFail(e, mapper).forEach(items::add);
              if (items.isEmpty()) {
                e.handle().complete();
                return List.<AckedElement<U>>of();
              }
              List<AckHandle> handles = e.handle().split(items.size());
              List<AckedElement<U>> elements = new ArrayList<>(items.size());
              for (int i = 0; i < items.size(); i++) {
                elements.add(new AckedElement<>(handles.get(i), items.get(i)));
              }
              return elements;
            }));
  }

  /**
   * Asynchronous transformation, output order is the input order.
   *
   * @param parallelism maximum number of transformations in flight
   * @param mapper the asynchronous mapping function
   * @param <U> output data type
   * @return the new stream
   */
  public <U> AckedFlux<U> mapAsync(
      int parallelism, Function<? super T, ? extends CompletionStage<U>> mapper) {
    return new AckedFlux<>(
        this.flux.flatMapSequential(e -> mapElementAsync(e, mapper), parallelism));
  }

  /**
   * Asynchronous transformation, elements are emitted as soon as they are transformed.
   *
   * @param parallelism maximum number of transformations in flight
   * @param mapper the asynchronous mapping function
   * @param <U> output data type
   * @return the new stream
   */
  public <U> AckedFlux<U> mapAsyncUnordered(
      int parallelism, Function<? super T, ? extends CompletionStage<U>> mapper) {
    return new AckedFlux<>(this.flux.flatMap(e -> mapElementAsync(e, mapper), parallelism));
  }

  private static <T, U> Mono<AckedElement<U>> mapElementAsync(
      AckedElement<T> element, Function<? super T, ? extends CompletionStage<U>> mapper) {
    AtomicBoolean emitted = new AtomicBoolean(false);
    return Mono.defer(() -> Mono.fromCompletionStage(mapper.apply(element.data())))
        .map(u -> element.<U>withData(u))
        .single()
        .doOnNext(ignored -> emitted.set(true))
        .doOnError(ex -> element.handle().fail(ex))
        .doOnCancel(
            () -> {
              if (!emitted.get()) {
                element.handle().fail(discarded("Asynchronous transformation cancelled"));
              }
            });
  }

  /**
   * Group elements in lists of the given size, the last list can be smaller.
   *
   * <p>Settling the handle of a list settles the handles of all its elements.
   *
   * @param size the size of the groups
   * @return the grouped stream
   */
  public AckedFlux<List<T>> grouped(int size) {
    return new AckedFlux<>(this.flux.buffer(size).map(AckedFlux::combine));
  }

  /**
   * Group elements in lists of at most the given size, emitting a list when it is full or when
   * the duration elapses, whichever comes first.
   *
   * @param size the maximum size of the groups
   * @param duration the maximum time to wait before emitting a group
   * @return the grouped stream
   */
  public AckedFlux<List<T>> groupedWithin(int size, Duration duration) {
    return new AckedFlux<>(this.flux.bufferTimeout(size, duration).map(AckedFlux::combine));
  }

  private static <T> AckedElement<List<T>> combine(List<AckedElement<T>> elements) {
    List<AckHandle> handles = new ArrayList<>(elements.size());
    List<T> data = new ArrayList<>(elements.size());
    for (AckedElement<T> element : elements) {
      handles.add(element.handle());
      data.add(element.data());
    }
    return new AckedElement<>(AckHandle.combine(handles), data);
  }

  /**
   * Merge elements while downstream is not ready.
   *
   * <p>When elements are merged, the handle of the previous aggregate follows the handle of the
   * new element, which becomes the handle of the aggregate.
   *
   * @param seed creates an aggregate from an element
   * @param aggregate merges an element into the current aggregate
   * @param <S> aggregate type
   * @return the conflated stream
   */
  public <S> AckedFlux<S> conflate(
      Function<? super T, ? extends S> seed,
      BiFunction<? super S, ? super T, ? extends S> aggregate) {
    return new AckedFlux<>(
        Flux.<AckedElement<S>>create(
            sink -> {
              Conflator<T, S> conflator = new Conflator<>(seed, aggregate, sink);
              sink.onRequest(ignored -> conflator.drain());
              sink.onDispose(conflator::discardPending);
              this.flux.subscribe(conflator);
            }));
  }

  /**
   * Bounded buffer applying backpressure when full.
   *
   * @param size size of the buffer
   * @return the buffered stream
   */
  public AckedFlux<T> buffer(int size) {
    return this.buffer(size, false);
  }

  /**
   * Bounded buffer.
   *
   * <p>With <code>failOnOverflow</code> set, an element arriving when the buffer is full fails
   * with an {@link AckedException.BufferOverflowException}, so do the buffered elements, and the
   * stream errors with the same exception right away. Otherwise the buffer applies backpressure.
   *
   * @param size size of the buffer
   * @param failOnOverflow whether to fail instead of applying backpressure
   * @return the buffered stream
   */
  public AckedFlux<T> buffer(int size, boolean failOnOverflow) {
    if (size <= 0) {
      throw new IllegalArgumentException("Buffer size must be positive: " + size);
    }
    if (failOnOverflow) {
      return new AckedFlux<>(
          Flux.<AckedElement<T>>create(
              sink -> {
                OverflowFailingBuffer<T> buffer = new OverflowFailingBuffer<>(size, sink);
                sink.onRequest(ignored -> buffer.drain());
                sink.onDispose(buffer::discardBuffered);
                this.flux.subscribe(buffer);
              }));
    } else {
      return new AckedFlux<>(this.flux.limitRate(size));
    }
  }

  /**
   * Split the stream in sub-streams, one per key.
   *
   * <p>This is an exit of the acked stream, discarded elements have their handles failed.
   *
   * @param keyMapper extracts the key of an element
   * @param <K> key type
   * @return the groups
   */
  public <K> Flux<GroupedAckedFlux<K, T>> groupBy(Function<? super T, ? extends K> keyMapper) {
    return failDiscarded(this.flux)
        .<K>groupBy(e -> applyOrFail(e, keyMapper))
        .map(group -> new GroupedAckedFlux<K, T>(group.key(), new AckedFlux<>(group)));
  }

  /**
   * Take the first elements, later elements are not requested from the source.
   *
   * @param count the number of elements to take
   * @return the truncated stream
   */
  public AckedFlux<T> take(long count) {
    return new AckedFlux<>(this.flux.take(count, true));
  }

  /**
   * Take elements as long as they match the predicate, the first element not matching is
   * discarded.
   *
   * @param predicate the predicate
   * @return the truncated stream
   */
  public AckedFlux<T> takeWhile(Predicate<? super T> predicate) {
    return new AckedFlux<>(
        this.flux.takeWhile(
            e -> {
              boolean keep = applyOrFail(e, predicate::test);
              if (!keep) {
                e.handle().fail(discarded("Element does not match take-while predicate"));
              }
              return keep;
            }));
  }

  /**
   * Take elements for the given duration.
   *
   * @param duration the duration
   * @return the truncated stream
   */
  public AckedFlux<T> takeWithin(Duration duration) {
    return new AckedFlux<>(this.flux.take(duration));
  }

  public AckedFlux<T> log(String name) {
    return this.log(name, Function.identity());
  }

  /**
   * Log elements and terminal signals at debug level.
   *
   * @param name name in the log messages
   * @param extract extracts what to log from an element
   * @return the same stream, logged
   */
  public AckedFlux<T> log(String name, Function<? super T, ?> extract) {
    return new AckedFlux<>(
        this.flux
            .doOnNext(
                e -> {
                  Object value = applyOrFail(e, extract);
                  LOGGER.debug("[{}] Element: {}", name, value);
                })
            .doOnError(ex -> LOGGER.debug("[{}] Upstream failed", name, ex))
            .doOnComplete(() -> LOGGER.debug("[{}] Upstream finished", name)));
  }

  /**
   * Exit the acked stream, acknowledging each element when it is emitted.
   *
   * @return the data
   */
  public Flux<T> acked() {
    return failDiscarded(this.flux)
        .map(
            e -> {
              e.handle().complete();
              return e.data();
            });
  }

  /**
   * Exit the acked stream without acknowledging the elements.
   *
   * <p>Unsafe: the caller is responsible for settling every handle exactly once. A subscription
   * stops receiving deliveries once its unsettled deliveries reach the channel prefetch.
   *
   * @return the elements
   */
  public Flux<AckedElement<T>> unacked() {
    return failDiscarded(this.flux);
  }

  private static <T> Flux<AckedElement<T>> failDiscarded(Flux<AckedElement<T>> flux) {
    @SuppressWarnings("unchecked")
    Class<AckedElement<?>> type = (Class<AckedElement<?>>) (Class<?>) AckedElement.class;
    return flux.doOnDiscard(
        type, e -> e.handle().fail(discarded("Element discarded by the stream")));
  }

  private static AckedException.ElementDiscardedException discarded(String message) {
    return new AckedException.ElementDiscardedException(message);
  }

  private static <T, R> R applyOrFail(
      AckedElement<T> element, Function<? super T, ? extends R> function) {
    try {
      return function.apply(element.data());
    } catch (RuntimeException e) {
      element.handle().fail(e);
      throw e;
    }
  }

  private static final class Conflator<T, S> extends BaseSubscriber<AckedElement<T>> {

    private final Function<? super T, ? extends S> seed;
    private final BiFunction<? super S, ? super T, ? extends S> aggregate;
    private final FluxSink<AckedElement<S>> sink;
    private AckedElement<S> pending;
    private boolean done;

    private Conflator(
        Function<? super T, ? extends S> seed,
        BiFunction<? super S, ? super T, ? extends S> aggregate,
        FluxSink<AckedElement<S>> sink) {
      this.seed = seed;
      this.aggregate = aggregate;
      this.sink = sink;
    }

    @Override
    public Context currentContext() {
      return Context.of(this.sink.contextView());
    }

    @Override
    protected void hookOnSubscribe(Subscription subscription) {
      subscription.request(Long.MAX_VALUE);
    }

    @Override
    protected void hookOnNext(AckedElement<T> element) {
      synchronized (this) {
        if (this.pending == null) {
          this.pending = element.withData(applyOrFail(element, this.seed));
        } else {
          S merged;
          try {
            merged = this.aggregate.apply(this.pending.data(), element.data());
          } catch (RuntimeException e) {
            element.handle().fail(e);
            throw e;
          }
          this.pending.handle().completeWith(element.handle());
          this.pending = new AckedElement<>(element.handle(), merged);
        }
      }
      this.drain();
    }

    @Override
    protected void hookOnComplete() {
      synchronized (this) {
        this.done = true;
      }
      this.drain();
    }

    @Override
    protected void hookOnError(Throwable throwable) {
      AckedElement<S> toFail;
      synchronized (this) {
        this.done = true;
        toFail = this.pending;
        this.pending = null;
      }
      if (toFail != null) {
        toFail.handle().fail(throwable);
      }
      this.sink.error(throwable);
    }

    synchronized void drain() {
      if (this.pending != null && this.sink.requestedFromDownstream() > 0) {
        AckedElement<S> element = this.pending;
        this.pending = null;
        this.sink.next(element);
      }
      if (this.done && this.pending == null) {
        this.sink.complete();
      }
    }

    void discardPending() {
      this.cancel();
      AckedElement<S> toDiscard;
      synchronized (this) {
        toDiscard = this.pending;
        this.pending = null;
      }
      if (toDiscard != null) {
        toDiscard.handle().fail(discarded("Conflated element discarded by the stream"));
      }
    }
  }

  private static final class OverflowFailingBuffer<T> extends BaseSubscriber<AckedElement<T>> {

    private final int size;
    private final FluxSink<AckedElement<T>> sink;
    private final Deque<AckedElement<T>> buffer = new ArrayDeque<>();
    private boolean done;
    private boolean overflowed;

    private OverflowFailingBuffer(int size, FluxSink<AckedElement<T>> sink) {
      this.size = size;
      this.sink = sink;
    }

    @Override
    public Context currentContext() {
      return Context.of(this.sink.contextView());
    }

    @Override
    protected void hookOnSubscribe(Subscription subscription) {
      subscription.request(Long.MAX_VALUE);
    }

    @Override
    protected void hookOnNext(AckedElement<T> element) {
      List<AckedElement<T>> toFail;
      boolean overflow;
      synchronized (this) {
        if (this.overflowed) {
          toFail = List.of(element);
          overflow = false;
        } else if (this.buffer.size() >= this.size) {
          this.overflowed = true;
          toFail = new ArrayList<>(this.buffer);
          toFail.add(element);
          this.buffer.clear();
          overflow = true;
        } else {
          this.buffer.add(element);
          toFail = null;
          overflow = false;
        }
      }
      if (toFail == null) {
        this.drain();
      } else {
        AckedException.BufferOverflowException exception =
            new AckedException.BufferOverflowException(
                "Buffer of size " + this.size + " overflowed");
        toFail.forEach(e -> e.handle().fail(exception));
        if (overflow) {
          this.cancel();
          this.sink.error(exception);
        }
      }
    }

    @Override
    protected void hookOnComplete() {
      synchronized (this) {
        this.done = true;
      }
      this.drain();
    }

    @Override
    protected void hookOnError(Throwable throwable) {
      List<AckedElement<T>> toFail;
      synchronized (this) {
        this.done = true;
        toFail = new ArrayList<>(this.buffer);
        this.buffer.clear();
      }
      toFail.forEach(e -> e.handle().fail(throwable));
      this.sink.error(throwable);
    }

    synchronized void drain() {
      while (!this.buffer.isEmpty() && this.sink.requestedFromDownstream() > 0) {
        this.sink.next(this.buffer.poll());
      }
      if (this.done && this.buffer.isEmpty() && !this.overflowed) {
        this.sink.complete();
      }
    }

    void discardBuffered() {
      this.cancel();
      List<AckedElement<T>> toDiscard;
      synchronized (this) {
        toDiscard = new ArrayList<>(this.buffer);
        this.buffer.clear();
      }
      toDiscard.forEach(
          e -> e.handle().fail(discarded("Buffered element discarded by the stream")));
    }
  }
}
