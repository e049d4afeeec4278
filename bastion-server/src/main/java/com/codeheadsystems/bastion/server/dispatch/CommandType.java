package com.codeheadsystems.bastion.server.dispatch;

/**
 * Explicit tag identifying each routable operation. Dispatch is keyed on this tag rather than
 * on the command's runtime class.
 */
public enum CommandType {
  REGISTER,
  LOGIN,
  REFRESH,
  INTROSPECT,
  USER_INFO,
  LIST_PRINCIPALS,
  SET_ACTIVE,
  GRANT_ROLE,
  REVOKE_ROLE
}
