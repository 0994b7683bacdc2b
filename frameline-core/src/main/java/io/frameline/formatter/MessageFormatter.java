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
 * Converts logical messages to and from their encoded bytes.
 *
 * <p>Optional capabilities are expressed by also implementing {@link TextMessageFormatter} or
 * {@link FormatterTracingCallbacks}.
 *
 * @param <T> the logical message type
 */
public interface MessageFormatter<T> {

  /**
   * Writes the encoded form of {@code message} to {@code target}.
   *
   * @param target the buffer to write to
   * @param message the message to encode
   * @throws io.frameline.exceptions.MessageFormatException if the message cannot be encoded
   */
  void serialize(ByteBuf target, T message);

  /**
   * Reads one message from the readable bytes of {@code source}.
   *
   * @param source the encoded message
   * @return the decoded message
   * @throws io.frameline.exceptions.MessageFormatException if the bytes are malformed
   */
  T deserialize(ByteBuf source);
}
