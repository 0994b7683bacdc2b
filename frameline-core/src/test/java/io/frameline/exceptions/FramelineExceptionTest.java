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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import io.frameline.transport.CloseStatus;
import org.junit.jupiter.api.Test;

class FramelineExceptionTest {

  @Test
  void carriesCloseStatus() {
    FramelineException exception =
        new FramelineException(CloseStatus.MESSAGE_TOO_BIG, "too big");

    assertThat(exception.closeStatus()).isEqualTo(1009);
    assertThat(exception).hasMessage("too big").hasNoCause();
    assertThat(exception.toString()).isEqualTo("FramelineException (1009): too big");
  }

  @Test
  void formatExceptionsUseInvalidPayloadData() {
    IllegalStateException cause = new IllegalStateException();

    assertThat(new MessageFormatException("bad", cause))
        .hasCause(cause)
        .satisfies(e -> assertThat(e.closeStatus()).isEqualTo(CloseStatus.INVALID_PAYLOAD_DATA));
    assertThat(new CompressedMessageFormatException("bad").closeStatus())
        .isEqualTo(CloseStatus.INVALID_PAYLOAD_DATA);
  }

  @Test
  void rejectsStatusOutOfRange() {
    assertThatIllegalArgumentException().isThrownBy(() -> new FramelineException(999, "x"));
    assertThatIllegalArgumentException().isThrownBy(() -> new FramelineException(5000, "x"));
  }
}
