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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.frameline.transport.ChannelState;
import io.frameline.transport.CloseStatus;
import io.frameline.transport.FrameChannel;
import io.frameline.transport.FrameKind;
import io.frameline.transport.ReceiveResult;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.Unpooled;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class LoggingFrameChannelTest {

  private final FrameChannel delegate = mock(FrameChannel.class);

  private final LoggingFrameChannel channel = new LoggingFrameChannel(delegate);

  @Test
  void delegatesEveryOperation() {
    ByteBuf payload = Unpooled.wrappedBuffer(new byte[100]);
    ByteBuf buffer = Unpooled.buffer(16);
    when(delegate.send(any(), any(), anyBoolean())).thenReturn(Mono.empty());
    when(delegate.close(anyInt(), anyString())).thenReturn(Mono.empty());
    when(delegate.receive(any()))
        .thenReturn(
            Mono.fromSupplier(
                () -> {
                  buffer.writeBytes(new byte[] {1, 2, 3});
                  return ReceiveResult.data(FrameKind.BINARY, 3, true);
                }));
    when(delegate.state()).thenReturn(ChannelState.CLOSE_SENT);
    when(delegate.alloc()).thenReturn(ByteBufAllocator.DEFAULT);

    channel.send(payload, FrameKind.TEXT, true).as(StepVerifier::create).verifyComplete();
    channel.close(CloseStatus.NORMAL_CLOSURE, "done").as(StepVerifier::create).verifyComplete();
    channel
        .receive(buffer)
        .as(StepVerifier::create)
        .expectNextMatches(result -> result.count() == 3)
        .verifyComplete();

    verify(delegate).send(payload, FrameKind.TEXT, true);
    verify(delegate).close(CloseStatus.NORMAL_CLOSURE, "done");
    verify(delegate).receive(buffer);
    Assertions.assertThat(channel.state()).isEqualTo(ChannelState.CLOSE_SENT);
    Assertions.assertThat(channel.alloc()).isSameAs(ByteBufAllocator.DEFAULT);
    Assertions.assertThat(payload.readerIndex()).isZero();
  }
}
