/*
 * Copyright 2026 The Closure Compiler Authors.
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

package com.google.astpos;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.Serializable;

/** Options for {@link PositionSynthesizer}. */
public class PositionOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  static final String DEFAULT_FILE_NAME = "synthetic.go";

  private String fileName = DEFAULT_FILE_NAME;

  /** Whether every synthesized tree is checked by {@link PositionValidator}. */
  private boolean validatePositions = true;

  public String getFileName() {
    return fileName;
  }

  /** Sets the name reported by the resulting {@link SyntheticFile}. */
  public void setFileName(String fileName) {
    checkArgument(!fileName.isEmpty(), "Empty file name");
    this.fileName = fileName;
  }

  public boolean shouldValidatePositions() {
    return validatePositions;
  }

  public void setValidatePositions(boolean validatePositions) {
    this.validatePositions = validatePositions;
  }
}
