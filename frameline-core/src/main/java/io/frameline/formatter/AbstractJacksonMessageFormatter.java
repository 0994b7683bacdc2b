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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.frameline.exceptions.MessageFormatException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.buffer.ByteBufOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

abstract class AbstractJacksonMessageFormatter<T> implements MessageFormatter<T> {

  final ObjectMapper mapper;

  final Class<T> messageType;

  AbstractJacksonMessageFormatter(ObjectMapper mapper, Class<T> messageType) {
    this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    this.messageType = Objects.requireNonNull(messageType, "messageType must not be null");
  }

  static ObjectMapper configureDefaults(ObjectMapper mapper) {
    mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    return mapper;
  }

  @Override
  public void serialize(ByteBuf target, T message) {
    try (OutputStream out = new ByteBufOutputStream(target)) {
      mapper.writeValue(out, message);
    } catch (IOException e) {
      throw new MessageFormatException(
          "failed to encode " + message.getClass().getName() + " message", e);
    }
  }

  @Override
  public T deserialize(ByteBuf source) {
    try (InputStream in = new ByteBufInputStream(source.duplicate())) {
      T message = mapper.readValue(in, messageType);
      if (message == null) {
        throw new MessageFormatException("message decoded to null");
      }
      return message;
    } catch (IOException e) {
      throw new MessageFormatException(
          "failed to decode " + source.readableBytes() + " bytes as " + messageType.getName(), e);
    }
  }

  public Class<T> messageType() {
    return messageType;
  }
}
