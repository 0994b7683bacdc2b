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

package io.frameline.transport.netty;

import io.frameline.transport.ChannelState;
import io.frameline.transport.CloseStatus;
import io.frameline.transport.FrameChannel;
import io.frameline.transport.FrameKind;
import io.frameline.transport.ReceiveResult;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.ContinuationWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.util.ReferenceCountUtil;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayDeque;
import java.util.Objects;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.publisher.Sinks;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * A {@link FrameChannel} over a reactor-netty WebSocket connection.
 *
 * <p>Inbound frames are pulled one at a time, so a slow reader applies backpressure to the socket.
 * Ping and pong frames are skipped. The peer's close frame is acknowledged by reactor-netty itself,
 * so it is reported as a {@link FrameKind#CLOSE} result once the inbound side completes and the
 * channel is {@link ChannelState#CLOSED} from then on.
 *
 * <p>Outbound messages start with a text or binary frame and continue with continuation frames
 * until the end of the message.
 */
public final class WebsocketFrameChannel implements FrameChannel {

  private static final Logger logger = LoggerFactory.getLogger(WebsocketFrameChannel.class);

  private final WebsocketInbound inbound;
  private final WebsocketOutbound outbound;
  private final InboundFrames frames = new InboundFrames();
  private final Sinks.Empty<Void> onClose = Sinks.empty();

  private final ArrayDeque<HeldFrame> held = new ArrayDeque<>();
  private final ArrayDeque<PendingReceive> waiting = new ArrayDeque<>();

  private FrameKind inboundMessageKind;
  private ReceiveResult closeResult;
  private Throwable error;
  private boolean closeDelivered;
  private boolean requested;

  private boolean continuing;

  private volatile ChannelState state = ChannelState.OPEN;

  private WebsocketFrameChannel(WebsocketInbound inbound, WebsocketOutbound outbound) {
    this.inbound = inbound;
    this.outbound = outbound;
  }

  /**
   * Creates a new instance and starts listening for inbound frames.
   *
   * @param inbound the inbound side of an upgraded WebSocket connection
   * @param outbound the outbound side of the same connection
   * @return a new instance
   * @throws NullPointerException if {@code inbound} or {@code outbound} is {@code null}
   */
  public static WebsocketFrameChannel create(WebsocketInbound inbound, WebsocketOutbound outbound) {
    Objects.requireNonNull(inbound, "inbound must not be null");
    Objects.requireNonNull(outbound, "outbound must not be null");

    WebsocketFrameChannel channel = new WebsocketFrameChannel(inbound, outbound);
    inbound.receiveFrames().subscribe(channel.frames);
    return channel;
  }

  /**
   * Completes once the inbound side of the connection has terminated, either with the close
   * handshake or because the connection was lost.
   *
   * @return the close notifier
   */
  public Mono<Void> onClose() {
    return onClose.asMono();
  }

  @Override
  public Mono<ReceiveResult> receive(ByteBuf buffer) {
    Objects.requireNonNull(buffer, "buffer must not be null");
    return Mono.create(
        sink -> {
          ReceiveResult result;
          Throwable failure = null;
          boolean request = false;
          synchronized (this) {
            result = deliver(buffer);
            if (result == null) {
              if (error != null) {
                failure = error;
              } else if (closeDelivered) {
                failure = new ClosedChannelException();
              } else {
                PendingReceive pending = new PendingReceive(sink, buffer);
                waiting.offer(pending);
                sink.onCancel(() -> cancelReceive(pending));
                request = !requested;
                requested = true;
              }
            }
          }

          if (result != null) {
            sink.success(result);
          } else if (failure != null) {
            sink.error(failure);
          } else if (request) {
            frames.request(1);
          }
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
          ChannelState current = state;
          if (current != ChannelState.OPEN && current != ChannelState.CLOSE_RECEIVED) {
            return Mono.error(new ClosedChannelException());
          }
          return outbound.sendObject(nextFrame(payload, kind, endOfMessage)).then();
        });
  }

  @Override
  public Mono<Void> close(int statusCode, String reason) {
    return Mono.defer(
        () -> {
          synchronized (this) {
            switch (state) {
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
          logger.debug("sending close {}: {}", statusCode, reason);
          return outbound.sendClose(statusCode, reason);
        });
  }

  @Override
  public ChannelState state() {
    return state;
  }

  @Override
  public ByteBufAllocator alloc() {
    return outbound.alloc();
  }

  private synchronized WebSocketFrame nextFrame(
      ByteBuf payload, FrameKind kind, boolean endOfMessage) {
    ByteBuf content = payload.retainedDuplicate();
    WebSocketFrame frame;
    if (continuing) {
      frame = new ContinuationWebSocketFrame(endOfMessage, 0, content);
    } else if (kind == FrameKind.TEXT) {
      frame = new TextWebSocketFrame(endOfMessage, 0, content);
    } else {
      frame = new BinaryWebSocketFrame(endOfMessage, 0, content);
    }
    continuing = !endOfMessage;
    return frame;
  }

  // callers hold the monitor
  private ReceiveResult deliver(ByteBuf buffer) {
    HeldFrame frame = held.peek();
    if (frame == null) {
      if (closeResult != null && !closeDelivered) {
        closeDelivered = true;
        return closeResult;
      }
      return null;
    }

    int count = Math.min(buffer.writableBytes(), frame.content.readableBytes());
    buffer.writeBytes(frame.content, count);
    boolean consumed = !frame.content.isReadable();
    if (consumed) {
      held.poll();
      frame.content.release();
    }
    return ReceiveResult.data(frame.kind, count, consumed && frame.finalFragment);
  }

  private synchronized void cancelReceive(PendingReceive pending) {
    waiting.remove(pending);
  }

  private void onInboundFrame(WebSocketFrame frame) {
    if (frame instanceof PingWebSocketFrame || frame instanceof PongWebSocketFrame) {
      logger.trace("skipping {}", frame);
      frames.request(1);
      return;
    }

    PendingReceive pending;
    ReceiveResult result;
    synchronized (this) {
      requested = false;
      FrameKind kind;
      if (frame instanceof ContinuationWebSocketFrame) {
        kind = inboundMessageKind == null ? FrameKind.BINARY : inboundMessageKind;
      } else {
        kind = frame instanceof TextWebSocketFrame ? FrameKind.TEXT : FrameKind.BINARY;
        inboundMessageKind = kind;
      }
      held.offer(new HeldFrame(kind, frame.content().retain(), frame.isFinalFragment()));

      pending = waiting.poll();
      if (pending == null) {
        return;
      }
      result = deliver(pending.buffer);
    }
    pending.sink.success(result);
  }

  private void onInboundTerminate(ReceiveResult result) {
    logger.debug("inbound terminated with {}", result);
    PendingReceive pending;
    synchronized (this) {
      closeResult = result;
      // 1006 never travels on the wire, it means the connection was lost
      state =
          result.closeStatus() == CloseStatus.ABNORMAL_CLOSURE
              ? ChannelState.ABORTED
              : ChannelState.CLOSED;
      pending = held.isEmpty() ? waiting.poll() : null;
      if (pending != null) {
        closeDelivered = true;
      }
    }
    if (pending != null) {
      pending.sink.success(result);
    }
    onClose.tryEmitEmpty();
  }

  private void onInboundError(Throwable t) {
    logger.debug("inbound failed", t);
    PendingReceive pending;
    synchronized (this) {
      error = t;
      state = ChannelState.ABORTED;
      pending = waiting.poll();
      held.forEach(frame -> ReferenceCountUtil.safeRelease(frame.content));
      held.clear();
    }
    if (pending != null) {
      pending.sink.error(t);
    }
    onClose.tryEmitError(t);
  }

  final class InboundFrames extends BaseSubscriber<WebSocketFrame> {

    @Override
    protected void hookOnSubscribe(Subscription subscription) {
      // frames are requested by receive
    }

    @Override
    protected void hookOnNext(WebSocketFrame frame) {
      onInboundFrame(frame);
    }

    @Override
    protected void hookOnComplete() {
      inbound
          .receiveCloseStatus()
          .map(status -> ReceiveResult.close(status.code(), status.reasonText()))
          .defaultIfEmpty(ReceiveResult.close(CloseStatus.ABNORMAL_CLOSURE, "connection closed"))
          .subscribe(
              WebsocketFrameChannel.this::onInboundTerminate,
              WebsocketFrameChannel.this::onInboundError);
    }

    @Override
    protected void hookOnError(Throwable throwable) {
      onInboundError(throwable);
    }
  }

  static final class HeldFrame {
    final FrameKind kind;
    final ByteBuf content;
    final boolean finalFragment;

    HeldFrame(FrameKind kind, ByteBuf content, boolean finalFragment) {
      this.kind = kind;
      this.content = content;
      this.finalFragment = finalFragment;
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
