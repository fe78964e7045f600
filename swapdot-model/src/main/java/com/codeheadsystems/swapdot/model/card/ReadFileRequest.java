package com.codeheadsystems.swapdot.model.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Requests a ReadData command.
 * <p>
 * Used by: {@code POST /card/read-file}
 *
 * @param fileNo file number, defaults to 1 (the token key file)
 * @param length bytes to read, defaults to 0 (the whole file)
 */
public record ReadFileRequest(
    @JsonProperty("fileNo") Integer fileNo,
    @JsonProperty("length") Integer length) {

  public int fileNoOrDefault() {
    return fileNo == null ? 1 : fileNo;
  }

  public int lengthOrDefault() {
    return length == null ? 0 : length;
  }
}
