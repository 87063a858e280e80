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

import javax.sip.header.CSeqHeader;
import javax.sip.message.Response;

/**
 * Classification helpers for SIP responses.
 */
public class ResponseHelper {

  /**
   * Checks if a response is provisional (1xx), i.e. does not complete its transaction.
   *
   * @param response The response
   * @return True if provisional
   */
  public static boolean isProvisional(final Response response) {
    return response.getStatusCode() < 200;
  }

  /**
   * Checks if a response is in the success class (2xx).
   *
   * @param response The response
   * @return True if successful
   */
  public static boolean isSuccess(final Response response) {
    int statusCode = response.getStatusCode();
    return statusCode >= 200 && statusCode < 300;
  }

  /**
   * Gets the method a response answers, as named in its CSeq header.
   *
   * @param response The response
   * @return The method, or an empty string if the CSeq header is missing
   */
  public static String methodOf(final Response response) {
    CSeqHeader cseqHeader = (CSeqHeader) response.getHeader(CSeqHeader.NAME);
    if (cseqHeader == null || cseqHeader.getMethod() == null) {
      return "";
    }
    return cseqHeader.getMethod();
  }
}
