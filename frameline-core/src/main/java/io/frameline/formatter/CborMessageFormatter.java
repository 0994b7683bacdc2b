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
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import java.io.IOException;
import java.io.InputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes messages as CBOR with Jackson. CBOR is binary, so messages travel in binary frames; at
 * {@code TRACE} level every sent message is logged as JSON.
 *
 * @param <T> the logical message type
 */
public final class CborMessageFormatter<T> extends AbstractJacksonMessageFormatter<T>
    implements FormatterTracingCallbacks<T> {

  private static final Logger logger = LoggerFactory.getLogger(CborMessageFormatter.class);

  private final ObjectMapper jsonMapper = new ObjectMapper();

  private CborMessageFormatter(ObjectMapper mapper, Class<T> messageType) {
    super(mapper, messageType);
  }

  /**
   * Creates a {@link CborMessageFormatter} for untyped trees with default configurations.
   *
   * @return a new instance handling {@link JsonNode} messages
   */
  public static CborMessageFormatter<JsonNode> create() {
    return create(JsonNode.class);
  }

  /**
   * Creates a {@link CborMessageFormatter} bound to the given type with default configurations.
   *
   * @param messageType the type messages are decoded to
   * @return a new instance
   */
  public static <T> CborMessageFormatter<T> create(Class<T> messageType) {
    return create(configureDefaults(new ObjectMapper(new CBORFactory())), messageType);
  }

  /**
   * Creates a {@link CborMessageFormatter} with a custom mapper.
   *
   * @param mapper the mapper, must be backed by a {@link CBORFactory}
   * @param messageType the type messages are decoded to
   * @return a new instance
   */
  public static <T> CborMessageFormatter<T> create(ObjectMapper mapper, Class<T> messageType) {
    return new CborMessageFormatter<>(mapper, messageType);
  }

  @Override
  public void onSerializationComplete(T message, ByteBuf encoded) {
    if (!logger.isTraceEnabled()) {
      return;
    }
    String type = message.getClass().getSimpleName();
    try (InputStream in = new ByteBufInputStream(encoded.duplicate())) {
      JsonNode tree = mapper.readTree(in);
      logger.trace("serialized {} -> {}", type, jsonMapper.writeValueAsString(tree));
    } catch (IOException e) {
      logger.trace(
          "serialized {} of {} bytes, not renderable as JSON", type, encoded.readableBytes(), e);
    }
  }
}
