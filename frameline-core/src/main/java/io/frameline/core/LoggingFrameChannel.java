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

import io.frameline.transport.ChannelState;
import io.frameline.transport.FrameChannel;
import io.frameline.transport.FrameKind;
import io.frameline.transport.ReceiveResult;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

class LoggingFrameChannel implements FrameChannel {

  private static final Logger LOGGER = LoggerFactory.getLogger("io.frameline.FrameLogger");

  private static final int MAX_DUMPED_BYTES = 64;

  final FrameChannel source;

  LoggingFrameChannel(FrameChannel source) {
    this.source = source;
  }

  @Override
  public Mono<ReceiveResult> receive(ByteBuf buffer) {
    int start = buffer.writerIndex();
    return source
        .receive(buffer)
        .doOnNext(
            result ->
                LOGGER.debug(
                    "receiving -> " + result + " " + dump(buffer, start, result.count())));
  }

  @Override
  public Mono<Void> send(ByteBuf payload, FrameKind kind, boolean endOfMessage) {
    LOGGER.debug(
        "sending -> "
            + kind
            + " frame, endOfMessage="
            + endOfMessage
            + " "
            + dump(payload, payload.readerIndex(), payload.readableBytes()));

    return source.send(payload, kind, endOfMessage);
  }

  @Override
  public Mono<Void> close(int statusCode, String reason) {
    LOGGER.debug("sending -> CLOSE " + statusCode + ": " + reason);

    return source.close(statusCode, reason);
  }

  @Override
  public ChannelState state() {
    return source.state();
  }

  @Override
  public ByteBufAllocator alloc() {
    return source.alloc();
  }

  private static String dump(ByteBuf buffer, int index, int length) {
    int dumped = Math.min(length, MAX_DUMPED_BYTES);
    return length
        + " bytes ["
        + ByteBufUtil.hexDump(buffer, index, dumped)
        + (dumped < length ? "...]" : "]");
  }

  static FrameChannel wrapIfEnabled(FrameChannel source) {
    if (LOGGER.isDebugEnabled()) {
      return new LoggingFrameChannel(source);
    }

    return source;
  }
}
