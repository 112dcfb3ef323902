package com.trino.client.common;

/** Authentication schemes selectable through the {@code authType} parameter. */
public enum AuthType {
  NONE,
  BASIC,
  JWT,
  CERTIFICATE,
  OAUTH2,
  KERBEROS
}
