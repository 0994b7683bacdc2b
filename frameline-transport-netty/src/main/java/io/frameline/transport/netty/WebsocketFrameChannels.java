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

package io.frameline.transport.netty;

import java.util.Objects;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;

/** Connects {@link WebsocketFrameChannel}s with a reactor-netty {@link HttpClient}. */
public final class WebsocketFrameChannels {

  private static final String DEFAULT_PATH = "/";

  private WebsocketFrameChannels() {}

  /**
   * Connects to the root path of the server the client is configured for.
   *
   * @param client the {@link HttpClient} to use
   * @return emits the channel once the WebSocket upgrade succeeded
   */
  public static Mono<WebsocketFrameChannel> connect(HttpClient client) {
    return connect(client, DEFAULT_PATH);
  }

  /**
   * Upgrades a request to {@code path} to a WebSocket and wraps the connection. The connection
   * stays open until the close handshake completes or the connection is lost.
   *
   * @param client the {@link HttpClient} to use
   * @param path the path to request
   * @return emits the channel once the WebSocket upgrade succeeded
   * @throws NullPointerException if {@code client} or {@code path} is {@code null}
   */
  public static Mono<WebsocketFrameChannel> connect(HttpClient client, String path) {
    Objects.requireNonNull(client, "HttpClient must not be null");
    Objects.requireNonNull(path, "path must not be null");
    String uri = path.startsWith("/") ? path : "/" + path;

    return Mono.create(
        sink -> {
          Disposable connection =
              client
                  .websocket(WebsocketClientSpec.builder().build())
                  .uri(uri)
                  .handle(
                      (in, out) -> {
                        WebsocketFrameChannel channel = WebsocketFrameChannel.create(in, out);
                        sink.success(channel);
                        return channel.onClose();
                      })
                  .subscribe(null, sink::error);
          sink.onCancel(connection);
        });
  }
}
