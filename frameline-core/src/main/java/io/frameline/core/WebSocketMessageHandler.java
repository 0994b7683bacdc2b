/*
 * Copyright 2015-2021 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.frameline.core;

import com.fasterxml.jackson.databind.JsonNode;
import io.frameline.MessageHandler;
import io.frameline.compression.GzipCodec;
import io.frameline.formatter.FormatterTracingCallbacks;
import io.frameline.formatter.JsonMessageFormatter;
import io.frameline.formatter.MessageFormatter;
import io.frameline.formatter.TextMessageFormatter;
import io.frameline.transport.ChannelState;
import io.frameline.transport.CloseStatus;
import io.frameline.transport.FrameChannel;
import io.frameline.transport.FrameKind;
import io.frameline.transport.ReceiveResult;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.CompositeByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.util.ReferenceCountUtil;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.util.annotation.Nullable;

/**
 * A {@link MessageHandler} over a {@link FrameChannel}, typically a WebSocket.
 *
 * <p>Incoming frames are accumulated until a frame marked end-of-message arrives and the bytes are
 * handed to the {@link MessageFormatter}. Outgoing messages are serialized and sent as one frame
 * per segment of the encoded buffer, the last one marked end-of-message.
 *
 * <p>When constructed with {@code compress} enabled, every message is gzip compressed as a whole
 * and always travels in binary frames, in both directions. Both peers must agree on this setting.
 *
 * <p>The channel is not closed by this handler, except to answer a close frame from the peer.
 *
 * @param <T> the logical message type
 */
public final class WebSocketMessageHandler<T> implements MessageHandler<T> {

  /** Default size of the buffer each frame is received into. */
  public static final int DEFAULT_SEGMENT_SIZE_HINT = 4096;

  static final String CLOSE_REASON = "Closed as requested.";

  private static final Logger logger = LoggerFactory.getLogger(WebSocketMessageHandler.class);

  private final FrameChannel channel;
  private final FrameChannel connection;
  private final MessageFormatter<T> formatter;
  private final boolean compress;
  private final int segmentSizeHint;
  private final Clock clock;
  private final ByteBufAllocator allocator;

  private final FrameKind formatterFrameKind;
  @Nullable private final FormatterTracingCallbacks<T> tracer;

  private volatile Instant lastSend;
  private volatile Instant lastReceive;

  @SuppressWarnings("unchecked")
  private WebSocketMessageHandler(Builder<T> builder) {
    this.channel = builder.channel;
    this.connection = LoggingFrameChannel.wrapIfEnabled(builder.channel);
    this.formatter = builder.formatter;
    this.compress = builder.compress;
    this.segmentSizeHint = builder.segmentSizeHint;
    this.clock = builder.clock;
    this.allocator = builder.channel.alloc();

    this.formatterFrameKind =
        formatter instanceof TextMessageFormatter ? FrameKind.TEXT : FrameKind.BINARY;
    this.tracer =
        formatter instanceof FormatterTracingCallbacks
            ? (FormatterTracingCallbacks<T>) formatter
            : null;

    Instant now = clock.instant();
    this.lastSend = now;
    this.lastReceive = now;
  }

  /**
   * Creates a handler that exchanges JSON text messages.
   *
   * @param channel the connected channel, not closed by the handler
   * @param compress whether messages are gzip compressed
   * @return a new handler with default settings
   */
  public static WebSocketMessageHandler<JsonNode> create(FrameChannel channel, boolean compress) {
    return builder(channel).compress(compress).build();
  }

  /**
   * Starts building a handler over {@code channel}, with the JSON formatter until {@link
   * Builder#formatter(MessageFormatter)} replaces it.
   *
   * @param channel the connected channel, not closed by the handler
   * @return a new {@link Builder}
   */
  public static Builder<JsonNode> builder(FrameChannel channel) {
    return new Builder<>(channel, JsonMessageFormatter.create());
  }

  @Override
  public Mono<T> read() {
    return Mono.using(
        allocator::compositeBuffer,
        accumulation ->
            receiveMessage(accumulation)
                .flatMap(last -> last.isClose() ? closeAsRequested() : decode(accumulation)),
        ReferenceCountUtil::safeRelease);
  }

  @Override
  public Mono<Void> write(T message) {
    Objects.requireNonNull(message, "message must not be null");
    return Mono.create(sink -> transmit(sink, message));
  }

  @Override
  public boolean canRead() {
    return true;
  }

  @Override
  public boolean canWrite() {
    return true;
  }

  public FrameChannel channel() {
    return channel;
  }

  public MessageFormatter<T> formatter() {
    return formatter;
  }

  public boolean compress() {
    return compress;
  }

  public int segmentSizeHint() {
    return segmentSizeHint;
  }

  /** Time the last frame was sent, or the construction time if none was. */
  public Instant lastSend() {
    return lastSend;
  }

  /** Time the last frame was received, or the construction time if none was. */
  public Instant lastReceive() {
    return lastReceive;
  }

  /** Receives frames into {@code accumulation} until the message ends or a close frame arrives. */
  private Mono<ReceiveResult> receiveMessage(CompositeByteBuf accumulation) {
    return Mono.defer(() -> receiveSegment(accumulation))
        .repeat()
        .takeUntil(result -> result.isClose() || result.isEndOfMessage())
        .last();
  }

  private Mono<ReceiveResult> receiveSegment(CompositeByteBuf accumulation) {
    return Mono.using(
        () -> allocator.buffer(segmentSizeHint, segmentSizeHint),
        segment ->
            connection
                .receive(segment)
                .doOnNext(
                    result -> {
                      lastReceive = clock.instant();
                      if (!result.isClose() && segment.isReadable()) {
                        accumulation.addComponent(true, segment.retain());
                      }
                    }),
        ReferenceCountUtil::safeRelease);
  }

  private Mono<T> closeAsRequested() {
    ChannelState state = connection.state();
    if (!state.canClose()) {
      logger.debug("close frame received in state {}, not answering it", state);
      return Mono.empty();
    }

    logger.debug("close frame received in state {}, completing the close handshake", state);
    return connection.close(CloseStatus.NORMAL_CLOSURE, CLOSE_REASON).then(Mono.empty());
  }

  private Mono<T> decode(CompositeByteBuf accumulation) {
    if (!accumulation.isReadable()) {
      logger.debug("received an empty message");
      return Mono.empty();
    }

    return Mono.fromCallable(
        () -> {
          if (!compress) {
            return formatter.deserialize(accumulation);
          }

          CompositeByteBuf decompressed = GzipCodec.decompress(allocator, accumulation);
          try {
            if (!decompressed.isReadable()) {
              logger.debug("received an empty compressed message");
              return null;
            }
            return formatter.deserialize(decompressed);
          } finally {
            decompressed.release();
          }
        });
  }

  private void transmit(MonoSink<Void> sink, T message) {
    Disposable.Swap transmission = Disposables.swap();
    sink.onCancel(transmission);

    FrameKind kind = formatterFrameKind;
    // unbounded so that the segments the formatter produced are never consolidated
    CompositeByteBuf encoded = allocator.compositeBuffer(Integer.MAX_VALUE);
    ByteBuf payload = encoded;
    try {
      formatter.serialize(encoded, message);

      if (transmission.isDisposed()) {
        logger.debug("write cancelled after serialization, no frame sent");
        encoded.release();
        return;
      }

      if (tracer != null) {
        tracer.onSerializationComplete(message, encoded);
      }

      if (compress) {
        payload = GzipCodec.compress(allocator, encoded);
        encoded.release();
        kind = FrameKind.BINARY;
      }
    } catch (Throwable t) {
      ReferenceCountUtil.safeRelease(encoded);
      if (payload != encoded) {
        ReferenceCountUtil.safeRelease(payload);
      }
      sink.error(t);
      return;
    }

    ByteBuf toSend = payload;
    transmission.update(
        sendSegments(toSend, kind)
            .doFinally(signalType -> ReferenceCountUtil.safeRelease(toSend))
            .subscribe(null, sink::error, sink::success));
  }

  /**
   * Sends one frame per segment of {@code payload}; the frame whose end reaches the total length
   * is marked end-of-message. An empty payload is sent as a single empty final frame.
   */
  private Mono<Void> sendSegments(ByteBuf payload, FrameKind kind) {
    List<Segment> segments = segmentsOf(payload);
    return Flux.fromIterable(segments)
        .concatMap(
            segment ->
                connection
                    .send(segment.bytes, kind, segment.endOfMessage)
                    .doOnSuccess(v -> lastSend = clock.instant()))
        .then();
  }

  static List<Segment> segmentsOf(ByteBuf payload) {
    int total = payload.readableBytes();
    if (total == 0) {
      return Collections.singletonList(new Segment(Unpooled.EMPTY_BUFFER, true));
    }
    if (!(payload instanceof CompositeByteBuf)) {
      return Collections.singletonList(new Segment(payload, true));
    }

    List<ByteBuf> parts =
        ((CompositeByteBuf) payload).decompose(payload.readerIndex(), total);
    List<Segment> segments = new ArrayList<>(parts.size());
    int offset = 0;
    for (ByteBuf part : parts) {
      int length = part.readableBytes();
      if (length == 0) {
        continue;
      }
      segments.add(new Segment(part, offset + length == total));
      offset += length;
    }
    return segments;
  }

  static final class Segment {
    final ByteBuf bytes;
    final boolean endOfMessage;

    Segment(ByteBuf bytes, boolean endOfMessage) {
      this.bytes = bytes;
      this.endOfMessage = endOfMessage;
    }
  }

  /**
   * Configures a {@link WebSocketMessageHandler}.
   *
   * @param <T> the logical message type of the formatter
   */
  public static final class Builder<T> {

    private final FrameChannel channel;
    private final MessageFormatter<T> formatter;
    private boolean compress;
    private int segmentSizeHint = DEFAULT_SEGMENT_SIZE_HINT;
    private Clock clock = Clock.systemUTC();

    private Builder(FrameChannel channel, MessageFormatter<T> formatter) {
      this.channel = Objects.requireNonNull(channel, "channel must not be null");
      this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
    }

    /**
     * Replaces the formatter, and with it the message type.
     *
     * @param formatter the formatter
     * @return a builder for the formatter's message type
     */
    public <R> Builder<R> formatter(MessageFormatter<R> formatter) {
      Builder<R> builder = new Builder<>(channel, formatter);
      builder.compress = compress;
      builder.segmentSizeHint = segmentSizeHint;
      builder.clock = clock;
      return builder;
    }

    /** Enables gzip compression of every message in both directions. Defaults to false. */
    public Builder<T> compress(boolean compress) {
      this.compress = compress;
      return this;
    }

    /**
     * Sets the size of the buffer each receive uses. Larger messages are received with more than
     * one receive.
     *
     * @param segmentSizeHint a positive number of bytes, 4096 by default
     * @return this builder
     */
    public Builder<T> segmentSizeHint(int segmentSizeHint) {
      if (segmentSizeHint <= 0) {
        throw new IllegalArgumentException(
            "segmentSizeHint must be positive, provided: " + segmentSizeHint);
      }
      this.segmentSizeHint = segmentSizeHint;
      return this;
    }

    /** Sets the clock the send and receive timestamps are taken from. */
    public Builder<T> clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock must not be null");
      return this;
    }

    public WebSocketMessageHandler<T> build() {
      return new WebSocketMessageHandler<>(this);
    }
  }
}
