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

import java.util.Objects;
import reactor.util.annotation.Nullable;

/** Outcome of a single {@link FrameChannel#receive(io.netty.buffer.ByteBuf)}. */
public final class ReceiveResult {

  private final FrameKind kind;
  private final int count;
  private final boolean endOfMessage;
  private final int closeStatus;
  @Nullable private final String closeDescription;

  private ReceiveResult(
      FrameKind kind,
      int count,
      boolean endOfMessage,
      int closeStatus,
      @Nullable String closeDescription) {
    this.kind = Objects.requireNonNull(kind, "kind must not be null");
    if (count < 0) {
      throw new IllegalArgumentException("count must be non-negative, provided: " + count);
    }
    this.count = count;
    this.endOfMessage = endOfMessage;
    this.closeStatus = closeStatus;
    this.closeDescription = closeDescription;
  }

  /**
   * Creates the result of receiving (part of) a data frame.
   *
   * @param kind {@link FrameKind#TEXT} or {@link FrameKind#BINARY}
   * @param count the number of bytes written to the receive buffer
   * @param endOfMessage whether the logical message is complete
   * @return a new {@link ReceiveResult}
   */
  public static ReceiveResult data(FrameKind kind, int count, boolean endOfMessage) {
    if (kind == FrameKind.CLOSE) {
      throw new IllegalArgumentException("use ReceiveResult.close for close frames");
    }
    return new ReceiveResult(kind, count, endOfMessage, 0, null);
  }

  /**
   * Creates the result of receiving a close frame.
   *
   * @param closeStatus the status the peer closed with
   * @param closeDescription the reason the peer closed with, if any
   * @return a new {@link ReceiveResult}
   */
  public static ReceiveResult close(int closeStatus, @Nullable String closeDescription) {
    return new ReceiveResult(FrameKind.CLOSE, 0, true, closeStatus, closeDescription);
  }

  public FrameKind kind() {
    return kind;
  }

  public int count() {
    return count;
  }

  public boolean isEndOfMessage() {
    return endOfMessage;
  }

  public boolean isClose() {
    return kind == FrameKind.CLOSE;
  }

  /** Close status of a {@link FrameKind#CLOSE} result, {@code 0} otherwise. */
  public int closeStatus() {
    return closeStatus;
  }

  @Nullable
  public String closeDescription() {
    return closeDescription;
  }

  @Override
  public String toString() {
    if (isClose()) {
      return "ReceiveResult{kind=CLOSE, closeStatus="
          + closeStatus
          + ", closeDescription='"
          + closeDescription
          + "'}";
    }
    return "ReceiveResult{kind="
        + kind
        + ", count="
        + count
        + ", endOfMessage="
        + endOfMessage
        + '}';
  }
}
