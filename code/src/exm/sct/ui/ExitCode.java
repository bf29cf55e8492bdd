/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.sct.ui;

import exm.sct.common.exceptions.InvalidSyntaxException;
import exm.sct.common.exceptions.UserException;

/**
 * Process exit codes of the sct command
 */
public enum ExitCode {
  SUCCESS(0),
  /** Reserved for JVM errors */
  ERROR_JAVA(1),
  /** Input could not be read or output could not be written */
  ERROR_IO(2),
  /** Source could not be read into the IR */
  ERROR_SYNTAX(3),
  /** Bad transformation, target, option or backend construct */
  ERROR_USER(4),
  /** Bad command line argument */
  ERROR_COMMAND(5),
  /** Bug in SCT */
  ERROR_INTERNAL(90);

  private final int code;

  private ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Exit code to report a user error with
   */
  public static ExitCode forUserError(UserException e) {
    if (e instanceof InvalidSyntaxException) {
      return ERROR_SYNTAX;
    }
    return ERROR_USER;
  }
}
