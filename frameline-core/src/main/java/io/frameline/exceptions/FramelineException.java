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

import reactor.util.annotation.Nullable;

/**
 * The root of the frameline exception hierarchy. Carries the close status a peer would use when
 * the error ends the connection.
 *
 * @see io.frameline.transport.CloseStatus
 */
public class FramelineException extends RuntimeException {

  private static final long serialVersionUID = 3817461057622936241L;

  private final int closeStatus;

  /**
   * Constructor with a close status and a message.
   *
   * @param closeStatus the close status describing the error
   * @param message error explanation
   */
  public FramelineException(int closeStatus, String message) {
    this(closeStatus, message, null);
  }

  /**
   * Alternative to {@link #FramelineException(int, String)} with a root cause.
   *
   * @param closeStatus the close status describing the error
   * @param message error explanation
   * @param cause a root cause for the error
   */
  public FramelineException(int closeStatus, String message, @Nullable Throwable cause) {
    super(message, cause);
    if (closeStatus < 1000 || closeStatus > 4999) {
      throw new IllegalArgumentException(
          "Allowed closeStatus value should be in range [1000-4999]", this);
    }
    this.closeStatus = closeStatus;
  }

  /**
   * Return the close status represented by this exception.
   *
   * @return the close status
   */
  public int closeStatus() {
    return closeStatus;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " (" + closeStatus + "): " + getMessage();
  }
}
