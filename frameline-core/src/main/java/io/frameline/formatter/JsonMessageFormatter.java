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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Encodes messages as UTF-8 JSON text with Jackson. This is the default formatter of {@link
 * io.frameline.core.WebSocketMessageHandler}.
 *
 * @param <T> the logical message type
 */
public final class JsonMessageFormatter<T> extends AbstractJacksonMessageFormatter<T>
    implements TextMessageFormatter<T> {

  private JsonMessageFormatter(ObjectMapper mapper, Class<T> messageType) {
    super(mapper, messageType);
  }

  /**
   * Creates a {@link JsonMessageFormatter} for untyped JSON trees with default configurations.
   *
   * @return a new instance handling {@link JsonNode} messages
   */
  public static JsonMessageFormatter<JsonNode> create() {
    return create(JsonNode.class);
  }

  /**
   * Creates a {@link JsonMessageFormatter} bound to the given type with default configurations.
   * Use {@link #create(ObjectMapper, Class)} for custom mapper configurations.
   *
   * @param messageType the type messages are decoded to
   * @return a new instance
   */
  public static <T> JsonMessageFormatter<T> create(Class<T> messageType) {
    return create(configureDefaults(new ObjectMapper()), messageType);
  }

  /**
   * Creates a {@link JsonMessageFormatter} with a custom mapper.
   *
   * @param mapper the mapper, must produce JSON
   * @param messageType the type messages are decoded to
   * @return a new instance
   */
  public static <T> JsonMessageFormatter<T> create(ObjectMapper mapper, Class<T> messageType) {
    return new JsonMessageFormatter<>(mapper, messageType);
  }

  @Override
  public Charset encoding() {
    return StandardCharsets.UTF_8;
  }
}
