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

/**
 * Close status codes.
 *
 * @see <a href="https://tools.ietf.org/html/rfc6455#section-7.4.1">RFC 6455 Section 7.4.1</a>
 */
public final class CloseStatus {

  public static final int NORMAL_CLOSURE = 1000;

  public static final int ENDPOINT_UNAVAILABLE = 1001;

  public static final int PROTOCOL_ERROR = 1002;

  public static final int INVALID_MESSAGE_TYPE = 1003;

  /** Reserved, never sent on the wire: the connection closed without a close frame. */
  public static final int EMPTY = 1005;

  /** Reserved, never sent on the wire: the connection was dropped. */
  public static final int ABNORMAL_CLOSURE = 1006;

  public static final int INVALID_PAYLOAD_DATA = 1007;

  public static final int POLICY_VIOLATION = 1008;

  public static final int MESSAGE_TOO_BIG = 1009;

  public static final int INTERNAL_SERVER_ERROR = 1011;

  private CloseStatus() {}
}
