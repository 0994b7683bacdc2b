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

package io.frameline;

import reactor.core.publisher.Mono;

/**
 * Reads and writes whole logical messages over a frame-oriented transport.
 *
 * <p>At most one {@link #read()} and one {@link #write(Object)} may be in flight at any time;
 * callers serialize reads with reads and writes with writes.
 *
 * @param <T> the logical message type
 */
public interface MessageHandler<T> {

  /**
   * Receives the next logical message.
   *
   * @return the message, or an empty {@link Mono} once the peer has closed the connection or sent
   *     an empty message
   */
  Mono<T> read();

  /**
   * Sends one logical message.
   *
   * @param message the message, must not be {@code null}
   * @return completes once every frame of the message has been sent
   */
  Mono<Void> write(T message);

  /**
   * Flushes buffered writes. Frames are dispatched as they are written, so by default there is
   * nothing to flush.
   *
   * @return an empty {@link Mono}
   */
  default Mono<Void> flush() {
    return Mono.empty();
  }

  boolean canRead();

  boolean canWrite();
}
