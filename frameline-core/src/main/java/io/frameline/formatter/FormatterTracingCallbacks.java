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

package io.frameline.formatter;

import io.netty.buffer.ByteBuf;

/**
 * Implemented by formatters that need the encoded form of a message to trace it.
 *
 * @param <T> the logical message type
 */
public interface FormatterTracingCallbacks<T> {

  /**
   * Invoked once a message has been serialized and before any of it is sent. Implementations must
   * not modify {@code encoded} or its indexes.
   *
   * @param message the message that was serialized
   * @param encoded the serialized bytes
   */
  void onSerializationComplete(T message, ByteBuf encoded);
}
