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

import java.nio.charset.Charset;

/**
 * A {@link MessageFormatter} whose output is always valid text, so that it may travel in text
 * frames.
 *
 * @param <T> the logical message type
 */
public interface TextMessageFormatter<T> extends MessageFormatter<T> {

  /**
   * Returns the character encoding of the serialized text.
   *
   * @return the {@link Charset}
   */
  Charset encoding();
}
