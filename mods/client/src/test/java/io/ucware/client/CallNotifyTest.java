/*
 * Copyright (C) 2024 by the ucware-cli authors
 *
 * This file is part of ucware-cli
 *
 * Licensed under the MIT License (the "License");
 * you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *    https://opensource.org/licenses/MIT
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.ucware.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CallNotifyTest {

  @TempDir
  Path dir;

  private ClientConfig config(final String token) {
    var env = token == null
        ? Map.of("UCWARE_URL", "https://ucware.example.com", "UCWARE_TOKEN_FILE", dir.resolve("t").toString())
        : Map.of("UCWARE_URL", "https://ucware.example.com", "UCWARE_TOKEN_FILE", dir.resolve("t").toString(),
            "UCWARE_TOKEN", token);
    return ClientConfig.from(env);
  }

  @Test
  public void testGivenTokenSeedsStore() throws Exception {
    var tokens = CallNotify.openTokens(config("given"));

    assertEquals("given", tokens.get());
    assertEquals("given", Files.readString(dir.resolve("t")));
  }

  @Test
  public void testStoredTokenIsUsed() throws Exception {
    Files.writeString(dir.resolve("t"), "stored\n");

    assertEquals("stored", CallNotify.openTokens(config(null)).get());
  }

  @Test
  public void testNoTokenAnywhere() {
    var e = assertThrows(IllegalStateException.class, () -> CallNotify.openTokens(config(null)));
    assertEquals("no token specified and no store available", e.getMessage());
  }
}
