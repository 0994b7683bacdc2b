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

package io.frameline.transport;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import java.nio.channels.ClosedChannelException;
import reactor.core.publisher.Mono;

/**
 * A connected, full-duplex, frame-oriented channel such as a WebSocket.
 *
 * <p><strong>Concurrency</strong>
 *
 * <p>Implementations permit one in-flight {@link #receive(ByteBuf)} and one in-flight {@link
 * #send(ByteBuf, FrameKind, boolean)} at the same time, but not two concurrent receives or two
 * concurrent sends. Callers serialize their reads and their writes.
 *
 * <p><strong>Errors</strong>
 *
 * <p>Any operation attempted once the channel is {@link ChannelState#CLOSED} or {@link
 * ChannelState#ABORTED} <em>MUST</em> emit a {@link ClosedChannelException}.
 */
public interface FrameChannel {

  /**
   * Receives the next frame, or the next piece of a frame, into the writable space of the given
   * buffer. At most {@code buffer.writableBytes()} bytes are written, advancing the buffer's writer
   * index. A frame larger than that is delivered across several receives and only the last piece
   * carries the end-of-message flag of the frame.
   *
   * @param buffer the buffer the frame content is written to, never released by the channel
   * @return the kind, byte count and end-of-message flag of what was received
   */
  Mono<ReceiveResult> receive(ByteBuf buffer);

  /**
   * Sends one frame. The channel does not take ownership of {@code payload}; the caller keeps it
   * alive until the returned {@link Mono} terminates.
   *
   * @param payload the readable bytes of the frame
   * @param kind {@link FrameKind#TEXT} or {@link FrameKind#BINARY}
   * @param endOfMessage whether this frame completes the logical message
   * @return completes once the frame has been handed to the wire
   */
  Mono<Void> send(ByteBuf payload, FrameKind kind, boolean endOfMessage);

  /**
   * Starts or completes the close handshake.
   *
   * @param statusCode the close status, see {@link CloseStatus}
   * @param reason the human readable close reason
   * @return completes when the handshake has been performed
   */
  Mono<Void> close(int statusCode, String reason);

  /**
   * Returns the current state of the connection. Never blocks.
   *
   * @return the {@link ChannelState}
   */
  ChannelState state();

  /**
   * Returns the allocator used for scratch buffers exchanged with this channel.
   *
   * @return the {@link ByteBufAllocator}
   */
  default ByteBufAllocator alloc() {
    return ByteBufAllocator.DEFAULT;
  }
}
