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

package io.frameline.compression;

import io.frameline.exceptions.CompressedMessageFormatException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufInputStream;
import io.netty.buffer.ByteBufOutputStream;
import io.netty.buffer.CompositeByteBuf;
import io.netty.util.ReferenceCountUtil;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * One-shot gzip transform of whole messages. Both directions consume the complete source buffer as
 * a single stream; there is no incremental state kept between messages.
 *
 * <p>Source buffers are read without touching their reader index. Returned buffers are owned by the
 * caller.
 */
public final class GzipCodec {

  private static final int COPY_CHUNK_SIZE = 8192;

  private GzipCodec() {}

  /**
   * Compresses the readable bytes of {@code source} with {@link Deflater#BEST_SPEED}.
   *
   * @param allocator allocator for the compressed buffer
   * @param source the bytes to compress
   * @return a new buffer holding a complete gzip stream
   */
  public static CompositeByteBuf compress(ByteBufAllocator allocator, ByteBuf source) {
    CompositeByteBuf target = allocator.compositeBuffer();
    try (OutputStream gzip = new FastGzipOutputStream(new ByteBufOutputStream(target))) {
      source.getBytes(source.readerIndex(), gzip, source.readableBytes());
    } catch (IOException e) {
      ReferenceCountUtil.safeRelease(target);
      // only the in-memory sink is written to
      throw new UncheckedIOException(e);
    } catch (Throwable t) {
      ReferenceCountUtil.safeRelease(target);
      throw t;
    }
    return target;
  }

  /**
   * Decompresses the readable bytes of {@code source}, which must form a complete gzip stream.
   *
   * @param allocator allocator for the decompressed buffer
   * @param source the gzip stream
   * @return a new buffer holding the decompressed bytes
   * @throws CompressedMessageFormatException if {@code source} is not a valid gzip stream
   */
  public static CompositeByteBuf decompress(ByteBufAllocator allocator, ByteBuf source) {
    CompositeByteBuf target = allocator.compositeBuffer();
    try (StrictGzipInputStream gzip =
        new StrictGzipInputStream(new ByteBufInputStream(source.duplicate()))) {
      while (target.writeBytes(gzip, COPY_CHUNK_SIZE) != -1) {
        // drain
      }
      int trailing = gzip.trailingBytes();
      if (trailing > 0) {
        throw new CompressedMessageFormatException(
            "message of "
                + source.readableBytes()
                + " bytes has "
                + trailing
                + " bytes after the gzip stream");
      }
    } catch (IOException e) {
      ReferenceCountUtil.safeRelease(target);
      throw new CompressedMessageFormatException(
          "message of " + source.readableBytes() + " bytes is not a valid gzip stream", e);
    } catch (Throwable t) {
      ReferenceCountUtil.safeRelease(target);
      throw t;
    }
    return target;
  }

  static final class StrictGzipInputStream extends GZIPInputStream {

    private static final int TRAILER_SIZE = 8;

    StrictGzipInputStream(InputStream in) throws IOException {
      super(in);
    }

    /** Bytes left behind the last gzip member. Valid once the stream has been drained. */
    int trailingBytes() throws IOException {
      return Math.max(0, inf.getRemaining() - TRAILER_SIZE) + in.available();
    }
  }

  static final class FastGzipOutputStream extends GZIPOutputStream {

    FastGzipOutputStream(OutputStream out) throws IOException {
      super(out);
      def.setLevel(Deflater.BEST_SPEED);
    }
  }
}
