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

package io.frameline.transport.local;

import io.frameline.transport.ChannelState;
import io.frameline.transport.FrameChannel;
import io.frameline.transport.FrameKind;
import io.frameline.transport.ReceiveResult;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.Unpooled;
import io.netty.util.ReferenceCountUtil;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

/**
 * A {@link FrameChannel} connected to a peer inside the same JVM. Channels are created in
 * connected pairs with {@link #pair(String)}; every frame one end sends is received by the other.
 *
 * <p>Sent bytes are copied, so the sender keeps ownership of its payload. When a maximum frame size
 * is configured, every sent frame is split into pieces no larger than it and the receiver sees
 * them as separate frames, only the last of which carries the end-of-message flag.
 */
public final class LocalFrameChannel implements FrameChannel {

  private static final Logger logger = LoggerFactory.getLogger(LocalFrameChannel.class);

  private final String name;
  private final ByteBufAllocator allocator;
  private final int maxFrameSize;
  private final Object lock;

  private final ArrayDeque<Frame> inbound = new ArrayDeque<>();
  private final ArrayDeque<PendingReceive> waiting = new ArrayDeque<>();

  private LocalFrameChannel peer;

  private volatile ChannelState state = ChannelState.OPEN;

  private LocalFrameChannel(
      String name, ByteBufAllocator allocator, int maxFrameSize, Object lock) {
    this.name = name;
    this.allocator = allocator;
    this.maxFrameSize = maxFrameSize;
    this.lock = lock;
  }

  /**
   * Creates two connected channels using the default allocator.
   *
   * @param name the name of the pair, used in logs
   * @return the connected pair
   */
  public static Pair pair(String name) {
    return pair(name, ByteBufAllocator.DEFAULT);
  }

  /**
   * Creates two connected channels.
   *
   * @param name the name of the pair, used in logs
   * @param allocator the allocator both channels copy frames with
   * @return the connected pair
   */
  public static Pair pair(String name, ByteBufAllocator allocator) {
    return pair(name, allocator, Integer.MAX_VALUE);
  }

  /**
   * Creates two connected channels that split every sent frame into pieces of at most {@code
   * maxFrameSize} bytes.
   *
   * @param name the name of the pair, used in logs
   * @param allocator the allocator both channels copy frames with
   * @param maxFrameSize the largest frame either end delivers
   * @return the connected pair
   */
  public static Pair pair(String name, ByteBufAllocator allocator, int maxFrameSize) {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(allocator, "allocator must not be null");
    if (maxFrameSize <= 0) {
      throw new IllegalArgumentException(
          "maxFrameSize must be positive, provided: " + maxFrameSize);
    }

    Object lock = new Object();
    LocalFrameChannel client =
        new LocalFrameChannel(name + "-client", allocator, maxFrameSize, lock);
    LocalFrameChannel server =
        new LocalFrameChannel(name + "-server", allocator, maxFrameSize, lock);
    client.peer = server;
    server.peer = client;
    return new Pair(client, server);
  }

  public String name() {
    return name;
  }

  @Override
  public Mono<ReceiveResult> receive(ByteBuf buffer) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    return Mono.create(
        sink -> {
          ReceiveResult result;
          synchronized (lock) {
            if (inbound.isEmpty()) {
              if (!canReceive(state)) {
                sink.error(new ClosedChannelException());
                return;
              }
              PendingReceive pending = new PendingReceive(sink, buffer);
              waiting.offer(pending);
              sink.onCancel(() -> cancelReceive(pending));
              return;
            }
            result = deliver(buffer);
          }
          sink.success(result);
        });
  }

  @Override
  public Mono<Void> send(ByteBuf payload, FrameKind kind, boolean endOfMessage) {
    Objects.requireNonNull(payload, "payload must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    if (kind == FrameKind.CLOSE) {
      return Mono.error(new IllegalArgumentException("use close to send a close frame"));
    }
    return Mono.defer(
        () -> {
          if (!canSend(state)) {
            return Mono.error(new ClosedChannelException());
          }
          int index = payload.readerIndex();
          int remaining = payload.readableBytes();
          do {
            int length = Math.min(remaining, maxFrameSize);
            ByteBuf copy;
            if (length == 0) {
              copy = Unpooled.EMPTY_BUFFER;
            } else {
              copy = allocator.buffer(length, length);
              copy.writeBytes(payload, index, length);
            }
            index += length;
            remaining -= length;
            peer.offer(new Frame(kind, copy, endOfMessage && remaining == 0, 0));
          } while (remaining > 0);
          return Mono.empty();
        });
  }

  @Override
  public Mono<Void> close(int statusCode, String reason) {
    return Mono.defer(
        () -> {
          ChannelState previous;
          synchronized (lock) {
            previous = state;
            switch (previous) {
              case OPEN:
                state = ChannelState.CLOSE_SENT;
                break;
              case CLOSE_RECEIVED:
                state = ChannelState.CLOSED;
                break;
              case CLOSE_SENT:
                return Mono.empty();
              default:
                return Mono.error(new ClosedChannelException());
            }
          }
          logger.debug("{} closing with {}: {} in state {}", name, statusCode, reason, previous);
          ByteBuf description =
              reason == null
                  ? Unpooled.EMPTY_BUFFER
                  : Unpooled.copiedBuffer(reason, StandardCharsets.UTF_8);
          peer.offer(new Frame(FrameKind.CLOSE, description, true, statusCode));
          return Mono.empty();
        });
  }

  @Override
  public ChannelState state() {
    return state;
  }

  @Override
  public ByteBufAllocator alloc() {
    return allocator;
  }

  @Override
  public String toString() {
    return "LocalFrameChannel{name='" + name + "', state=" + state + '}';
  }

  private void offer(Frame frame) {
    PendingReceive pending;
    ReceiveResult result;
    synchronized (lock) {
      if (state == ChannelState.CLOSED || state == ChannelState.ABORTED) {
        logger.debug("{} dropping {} frame, channel is {}", name, frame.kind, state);
        frame.release();
        return;
      }
      inbound.offer(frame);
      pending = waiting.poll();
      if (pending == null) {
        return;
      }
      result = deliver(pending.buffer);
    }
    pending.sink.success(result);
  }

  // callers hold the lock
  private ReceiveResult deliver(ByteBuf buffer) {
    Frame frame = inbound.peek();
    if (frame.kind == FrameKind.CLOSE) {
      inbound.poll();
      String description = frame.bytes.toString(StandardCharsets.UTF_8);
      frame.release();
      state = state == ChannelState.CLOSE_SENT ? ChannelState.CLOSED : ChannelState.CLOSE_RECEIVED;
      return ReceiveResult.close(frame.closeStatus, description);
    }

    int count = Math.min(buffer.writableBytes(), frame.bytes.readableBytes());
    buffer.writeBytes(frame.bytes, count);
    boolean consumed = !frame.bytes.isReadable();
    if (consumed) {
      inbound.poll();
      frame.release();
    }
    return ReceiveResult.data(frame.kind, count, consumed && frame.endOfMessage);
  }

  private void cancelReceive(PendingReceive pending) {
    synchronized (lock) {
      waiting.remove(pending);
    }
  }

  private static boolean canReceive(ChannelState state) {
    return state == ChannelState.OPEN || state == ChannelState.CLOSE_SENT;
  }

  private static boolean canSend(ChannelState state) {
    return state == ChannelState.OPEN || state == ChannelState.CLOSE_RECEIVED;
  }

  /** Two connected {@link LocalFrameChannel}s. */
  public static final class Pair {
    private final LocalFrameChannel client;
    private final LocalFrameChannel server;

    Pair(LocalFrameChannel client, LocalFrameChannel server) {
      this.client = client;
      this.server = server;
    }

    public LocalFrameChannel client() {
      return client;
    }

    public LocalFrameChannel server() {
      return server;
    }
  }

  static final class Frame {
    final FrameKind kind;
    final ByteBuf bytes;
    final boolean endOfMessage;
    final int closeStatus;

    Frame(FrameKind kind, ByteBuf bytes, boolean endOfMessage, int closeStatus) {
      this.kind = kind;
      this.bytes = bytes;
      this.endOfMessage = endOfMessage;
      this.closeStatus = closeStatus;
    }

    void release() {
      ReferenceCountUtil.safeRelease(bytes);
    }
  }

  static final class PendingReceive {
    final MonoSink<ReceiveResult> sink;
    final ByteBuf buffer;

    PendingReceive(MonoSink<ReceiveResult> sink, ByteBuf buffer) {
      this.sink = sink;
      this.buffer = buffer;
    }
  }
}
