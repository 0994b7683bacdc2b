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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.frameline.transport.ChannelState;
import io.frameline.transport.CloseStatus;
import io.frameline.transport.FrameKind;
import io.frameline.transport.ReceiveResult;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.ContinuationWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;
import reactor.test.StepVerifier;

class WebsocketFrameChannelTest {

  private final WebsocketInbound inbound = mock(WebsocketInbound.class);
  private final WebsocketOutbound outbound = mock(WebsocketOutbound.class);
  private final Sinks.Many<WebSocketFrame> frames = Sinks.many().unicast().onBackpressureBuffer();
  private final Sinks.One<WebSocketCloseStatus> closeStatus = Sinks.one();
  private final List<WebSocketFrame> sent = new ArrayList<>();

  private final ByteBuf target = Unpooled.buffer(64, 64);

  private WebsocketFrameChannel channel;

  @BeforeEach
  void setUp() {
    when(inbound.receiveFrames()).thenReturn(frames.asFlux());
    when(inbound.receiveCloseStatus()).thenReturn(closeStatus.asMono());
    when(outbound.sendObject(any(Object.class)))
        .thenAnswer(
            invocation -> {
              sent.add(invocation.getArgument(0));
              return outbound;
            });
    when(outbound.then()).thenReturn(Mono.empty());
    when(outbound.sendClose(anyInt(), anyString())).thenReturn(Mono.empty());

    channel = WebsocketFrameChannel.create(inbound, outbound);
  }

  @AfterEach
  void releaseSent() {
    sent.forEach(WebSocketFrame::release);
  }

  @DisplayName("messages start with a data frame and continue with continuation frames")
  @Test
  void sendUsesContinuationFrames() {
    channel.send(utf8("a"), FrameKind.TEXT, false).block();
    channel.send(utf8("b"), FrameKind.TEXT, false).block();
    channel.send(utf8("c"), FrameKind.TEXT, true).block();
    channel.send(utf8("d"), FrameKind.BINARY, true).block();

    assertThat(sent)
        .hasSize(4)
        .extracting(frame -> (Object) frame.getClass())
        .containsExactly(
            TextWebSocketFrame.class,
            ContinuationWebSocketFrame.class,
            ContinuationWebSocketFrame.class,
            BinaryWebSocketFrame.class);
    assertThat(sent)
        .extracting(WebSocketFrame::isFinalFragment)
        .containsExactly(false, false, true, true);
    assertThat(sent.get(1).content().toString(StandardCharsets.UTF_8)).isEqualTo("b");
  }

  @DisplayName("sending does not consume the caller's payload")
  @Test
  void sendRetainsPayload() {
    ByteBuf payload = utf8("payload");

    channel.send(payload, FrameKind.BINARY, true).block();

    assertThat(payload.refCnt()).isEqualTo(2);
    assertThat(payload.readableBytes()).isEqualTo(7);
  }

  @DisplayName("continuation frames keep the kind of the first frame and pings are skipped")
  @Test
  void receiveFragmentedMessage() {
    frames.tryEmitNext(new TextWebSocketFrame(false, 0, utf8("ab")));
    frames.tryEmitNext(new PingWebSocketFrame(utf8("ping")));
    frames.tryEmitNext(new ContinuationWebSocketFrame(true, 0, utf8("cd")));

    ReceiveResult first = channel.receive(target).block();
    ReceiveResult second = channel.receive(target).block();

    assertThat(first.kind()).isEqualTo(FrameKind.TEXT);
    assertThat(first.isEndOfMessage()).isFalse();
    assertThat(second.kind()).isEqualTo(FrameKind.TEXT);
    assertThat(second.isEndOfMessage()).isTrue();
    assertThat(target.toString(StandardCharsets.UTF_8)).isEqualTo("abcd");
  }

  @DisplayName("a frame larger than the receive buffer is delivered in pieces")
  @Test
  void receiveInPieces() {
    frames.tryEmitNext(new BinaryWebSocketFrame(true, 0, utf8("abcdef")));
    ByteBuf small = Unpooled.buffer(4, 4);

    ReceiveResult first = channel.receive(small).block();
    small.clear();
    ReceiveResult second = channel.receive(small).block();

    assertThat(first.count()).isEqualTo(4);
    assertThat(first.isEndOfMessage()).isFalse();
    assertThat(second.count()).isEqualTo(2);
    assertThat(second.isEndOfMessage()).isTrue();
  }

  @DisplayName("inbound completion is reported once as the peer's close frame")
  @Test
  void completionReportsClose() {
    closeStatus.tryEmitValue(new WebSocketCloseStatus(1001, "going away"));
    frames.tryEmitComplete();

    channel
        .receive(target)
        .as(StepVerifier::create)
        .assertNext(
            result -> {
              assertThat(result.isClose()).isTrue();
              assertThat(result.closeStatus()).isEqualTo(1001);
              assertThat(result.closeDescription()).isEqualTo("going away");
            })
        .verifyComplete();
    assertThat(channel.state()).isEqualTo(ChannelState.CLOSED);
    channel.onClose().as(StepVerifier::create).verifyComplete();

    channel.receive(target).as(StepVerifier::create).verifyError(ClosedChannelException.class);
    channel
        .send(utf8("late"), FrameKind.TEXT, true)
        .as(StepVerifier::create)
        .verifyError(ClosedChannelException.class);
  }

  @DisplayName("losing the connection without a close frame aborts the channel")
  @Test
  void abnormalClosure() {
    closeStatus.tryEmitEmpty();
    frames.tryEmitComplete();

    ReceiveResult result = channel.receive(target).block();

    assertThat(result.closeStatus()).isEqualTo(CloseStatus.ABNORMAL_CLOSURE);
    assertThat(channel.state()).isEqualTo(ChannelState.ABORTED);
  }

  @DisplayName("inbound errors fail pending and later receives")
  @Test
  void inboundError() {
    IllegalStateException failure = new IllegalStateException("boom");

    StepVerifier.create(channel.receive(target))
        .then(() -> frames.tryEmitError(failure))
        .verifyErrorSatisfies(e -> assertThat(e).isSameAs(failure));

    assertThat(channel.state()).isEqualTo(ChannelState.ABORTED);
    channel
        .receive(target)
        .as(StepVerifier::create)
        .verifyErrorSatisfies(e -> assertThat(e).isSameAs(failure));
  }

  @DisplayName("close sends one close frame and moves to CLOSE_SENT")
  @Test
  void close() {
    channel.close(CloseStatus.NORMAL_CLOSURE, "done").block();
    channel.close(CloseStatus.NORMAL_CLOSURE, "done").block();

    assertThat(channel.state()).isEqualTo(ChannelState.CLOSE_SENT);
    verify(outbound, times(1)).sendClose(1000, "done");
  }

  private static ByteBuf utf8(String text) {
    return Unpooled.copiedBuffer(text, StandardCharsets.UTF_8);
  }
}
