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
package io.ucware.sipsocket;

import io.ucware.sipsocket.utils.ResponseHelper;

import javax.sip.header.CallIdHeader;
import javax.sip.header.ViaHeader;
import javax.sip.message.Message;
import javax.sip.message.Request;
import javax.sip.message.Response;
import java.util.Objects;

/**
 * Identity of a transaction: method, Call-ID and the branch of the topmost Via.
 *
 * <p>A request and every response belonging to it yield equal keys. For responses the method is
 * taken from the CSeq header.
 */
public final class TransactionKey {
  private final String method;
  private final String callId;
  private final String branch;

  public TransactionKey(final String method, final String callId, final String branch) {
    this.method = Objects.requireNonNull(method, "method");
    this.callId = callId;
    this.branch = branch;
  }

  public static TransactionKey fromRequest(final Request request) {
    return new TransactionKey(request.getMethod(), callIdOf(request), branchOf(request));
  }

  public static TransactionKey fromResponse(final Response response) {
    return new TransactionKey(ResponseHelper.methodOf(response), callIdOf(response), branchOf(response));
  }

  public String getMethod() {
    return method;
  }

  /**
   * @return The Call-ID, or null if the message had none
   */
  public String getCallId() {
    return callId;
  }

  /**
   * @return The Via branch, or null if the message had no Via or the Via no branch
   */
  public String getBranch() {
    return branch;
  }

  private static String callIdOf(final Message message) {
    var header = (CallIdHeader) message.getHeader(CallIdHeader.NAME);
    return header == null ? null : header.getCallId();
  }

  private static String branchOf(final Message message) {
    // getHeader returns the topmost value of a list header
    var header = (ViaHeader) message.getHeader(ViaHeader.NAME);
    return header == null ? null : header.getBranch();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransactionKey)) {
      return false;
    }
    var other = (TransactionKey) o;
    return method.equals(other.method)
        && Objects.equals(callId, other.callId)
        && Objects.equals(branch, other.branch);
  }

  @Override
  public int hashCode() {
    return Objects.hash(method, callId, branch);
  }

  @Override
  public String toString() {
    return "TransactionKey{method=" + method + ", callId=" + callId + ", branch=" + branch + "}";
  }
}
