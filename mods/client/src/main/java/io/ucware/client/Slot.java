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

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A device slot of a UCware user. Properties the client has no field for are kept in
 * {@link #getExtra()}.
 */
public class Slot {
  static final String WEBRTC = "webrtc";

  @JsonProperty("id")
  private long id;

  @JsonProperty("name")
  private String name;

  @JsonProperty("userId")
  private long userId;

  @JsonProperty("deviceType")
  private String deviceType;

  @JsonProperty("deviceId")
  private long deviceId;

  @JsonProperty("sipHost")
  private String sipHost;

  @JsonProperty("sipPort")
  private int sipPort;

  @JsonProperty("sipUser")
  private String sipUser;

  @JsonProperty("sipPassword")
  private String sipPassword;

  private final Map<String, Object> extra = new LinkedHashMap<>();

  public long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public long getUserId() {
    return userId;
  }

  public String getDeviceType() {
    return deviceType;
  }

  public long getDeviceId() {
    return deviceId;
  }

  public String getSipHost() {
    return sipHost;
  }

  public int getSipPort() {
    return sipPort;
  }

  public String getSipUser() {
    return sipUser;
  }

  public String getSipPassword() {
    return sipPassword;
  }

  @JsonAnyGetter
  public Map<String, Object> getExtra() {
    return extra;
  }

  @JsonAnySetter
  public void putExtra(final String key, final Object value) {
    extra.put(key, value);
  }

  @JsonIgnore
  public boolean isWebRtc() {
    return WEBRTC.equals(deviceType);
  }

  @Override
  public String toString() {
    return "Slot{id=" + id + ", name=" + name + ", deviceType=" + deviceType + ", sipHost=" + sipHost
        + ", sipPort=" + sipPort + ", sipUser=" + sipUser + "}";
  }
}
