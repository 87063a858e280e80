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
package io.ucware.sipsocket.utils;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * The product token this client puts in User-Agent headers, {@code <name>/<version>}.
 */
public final class UserAgent {
  private static final Logger LOG = LogManager.getLogger(UserAgent.class);
  private static final String RESOURCE = "/io/ucware/sipsocket/version.properties";
  private static final String VALUE = load();

  private UserAgent() {
  }

  public static String value() {
    return VALUE;
  }

  private static String load() {
    var properties = new Properties();
    try (InputStream in = UserAgent.class.getResourceAsStream(RESOURCE)) {
      if (in != null) {
        properties.load(in);
      }
    } catch (IOException e) {
      LOG.warn("unable to read {}", RESOURCE, e);
    }
    return properties.getProperty("name", "ucware-cli") + "/" + properties.getProperty("version", "0.0.0");
  }
}
