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

package io.frameline.exceptions;

import io.frameline.transport.CloseStatus;
import reactor.util.annotation.Nullable;

/**
 * The bytes of a received message are not a valid gzip stream. The message is lost but the
 * channel stays usable.
 */
public final class CompressedMessageFormatException extends FramelineException {

  private static final long serialVersionUID = 1146702419833165738L;

  /**
   * Constructs a new exception with the specified message.
   *
   * @param message the message
   */
  public CompressedMessageFormatException(String message) {
    this(message, null);
  }

  /**
   * Constructs a new exception with the specified message and cause.
   *
   * @param message the message
   * @param cause the cause of this exception
   */
  public CompressedMessageFormatException(String message, @Nullable Throwable cause) {
    super(CloseStatus.INVALID_PAYLOAD_DATA, message, cause);
  }
}
