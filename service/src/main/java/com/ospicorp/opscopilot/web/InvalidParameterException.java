package com.ospicorp.opscopilot.web;

public class InvalidParameterException extends RuntimeException {
  public static final int NOT_CSV = 2001;
  public static final int NO_EXPECTED_COLUMNS = 2002;
  public static final int UNREADABLE_CSV = 2003;
  public static final int BLANK_QUESTION = 2004;
  public static final int UNKNOWN_WINDOW = 2005;
  public static final int UNKNOWN_FORMAT = 2006;

  private static final String ERROR_DOCS_BASE = "https://docs.ops-copilot.dev/errors/";

  private final int errorCode;
  private final String moreInfo;

  public InvalidParameterException(String message, int errorCode, String moreInfo) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = moreInfo;
  }

  public static InvalidParameterException of(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
