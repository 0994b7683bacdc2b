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

/** Lifecycle of a {@link FrameChannel}. */
public enum ChannelState {
  CONNECTING,
  OPEN,
  CLOSE_SENT,
  CLOSE_RECEIVED,
  CLOSED,
  ABORTED;

  /**
   * Whether a close handshake may still be started or completed from this state.
   *
   * @return {@code true} for {@link #OPEN}, {@link #CLOSE_RECEIVED} and {@link #CLOSE_SENT}
   */
  public boolean canClose() {
    switch (this) {
      case OPEN:
      case CLOSE_RECEIVED:
      case CLOSE_SENT:
        return true;
      default:
        return false;
    }
  }
}
